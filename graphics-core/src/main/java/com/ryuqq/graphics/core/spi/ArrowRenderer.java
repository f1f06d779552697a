package com.ryuqq.graphics.core.spi;

import com.ryuqq.graphics.core.model.AttributeSet;
import com.ryuqq.graphics.core.model.Point3;

/**
 * Arrow symbol SPI.
 *
 * <p>Draws named arrow symbols (e.g. {@code CLOSED_FILLED}, {@code ARCHTICK}) either as
 * plain entities or as a reference to the arrow block.</p>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public interface ArrowRenderer {

    /**
     * Draws an arrow as individual entities.
     *
     * @param target layout that receives the entities
     * @param name arrow name
     * @param insert arrow tip
     * @param size arrow size
     * @param rotation rotation in degrees
     * @param attributes graphical attributes (layer, color, ...)
     * @return connection point of the dimension line
     */
    Point3 renderArrow(EntityCreator target, String name, Point3 insert, double size, double rotation,
                       AttributeSet attributes);

    /**
     * Inserts an arrow as block reference.
     *
     * @param target layout that receives the reference
     * @param name arrow name
     * @param insert arrow tip
     * @param size arrow size
     * @param rotation rotation in degrees
     * @param attributes graphical attributes of the INSERT
     * @return connection point of the dimension line
     */
    Point3 insertArrow(EntityCreator target, String name, Point3 insert, double size, double rotation,
                       AttributeSet attributes);
}
