package com.ryuqq.graphics.core.spi;

import com.ryuqq.graphics.core.dimension.DimensionRequest;
import com.ryuqq.graphics.core.model.EntityHandle;

/**
 * Dimension rendering SPI.
 *
 * <p>Turns a created DIMENSION entity into its graphical representation (dimension lines,
 * extension lines, arrows, text) according to the request's style and overrides.</p>
 *
 * <p>The factory never calls this implicitly for single dimensions: rendering happens when
 * the caller invokes {@code DimensionStyleOverride.render()}.</p>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public interface DimensionRenderer {

    /**
     * Renders a dimension.
     *
     * @param dimension handle of the DIMENSION entity
     * @param request resolved dimension request (style, overrides, attributes)
     */
    void render(EntityHandle dimension, DimensionRequest request);
}
