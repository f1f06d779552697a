/**
 * Attribute assembly.
 *
 * <h2>Classes</h2>
 * <ul>
 *   <li>{@link com.ryuqq.graphics.core.attribute.AttributeTemplates} - Immutable per-kind default attributes</li>
 *   <li>{@link com.ryuqq.graphics.core.attribute.AttributeAssembler} - Template, override and computed field merge</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Templates are built once and never handed out for mutation</li>
 *   <li><strong>Flag Merge:</strong> Bitmask attributes are merged by OR, never overwritten</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Graphics Team
 */
package com.ryuqq.graphics.core.attribute;
