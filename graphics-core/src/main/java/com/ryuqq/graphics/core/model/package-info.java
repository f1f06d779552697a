/**
 * Core value objects of the entity construction layer.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.graphics.core.model.Point3} - Immutable 3D vector</li>
 *   <li>{@link com.ryuqq.graphics.core.model.AttributeSet} - Immutable ordered attribute map</li>
 *   <li>{@link com.ryuqq.graphics.core.model.Flags} - Typed integer bitmask</li>
 *   <li>{@link com.ryuqq.graphics.core.model.EntityHandle} - Hexadecimal DXF handle</li>
 * </ul>
 *
 * <h2>Enumerations</h2>
 * <ul>
 *   <li>{@link com.ryuqq.graphics.core.model.FormatVersion} - Ordered DXF format versions</li>
 *   <li>{@link com.ryuqq.graphics.core.model.EntityKind} - Creatable entity types and their minimum versions</li>
 * </ul>
 *
 * <p>Flag constants live in {@code PolylineFlags}, {@code LwPolylineFlags}, {@code SplineFlags}
 * and {@code DimensionTypeFlags}.</p>
 *
 * @since 1.0.0
 * @author Graphics Team
 */
package com.ryuqq.graphics.core.model;
