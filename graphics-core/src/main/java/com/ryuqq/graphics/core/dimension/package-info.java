/**
 * Dimension geometry resolution.
 *
 * <p>{@link com.ryuqq.graphics.core.dimension.DimensionGeometryResolver} turns measurement points
 * into {@link com.ryuqq.graphics.core.dimension.DimensionRequest}s. Rendering is delegated to a
 * {@link com.ryuqq.graphics.core.spi.DimensionRenderer}.</p>
 *
 * @since 1.0.0
 * @author Graphics Team
 */
package com.ryuqq.graphics.core.dimension;
