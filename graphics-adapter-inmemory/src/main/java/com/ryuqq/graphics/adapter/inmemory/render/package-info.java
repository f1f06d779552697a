/**
 * Reference renderers.
 *
 * <ul>
 *   <li>{@link com.ryuqq.graphics.adapter.inmemory.render.RecordingDimensionRenderer} - records render calls</li>
 *   <li>{@link com.ryuqq.graphics.adapter.inmemory.render.SimpleArrowRenderer} - line/solid arrows and arrow block references</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Graphics Team
 */
package com.ryuqq.graphics.adapter.inmemory.render;
