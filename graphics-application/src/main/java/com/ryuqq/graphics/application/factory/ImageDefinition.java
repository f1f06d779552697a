package com.ryuqq.graphics.application.factory;

import com.ryuqq.graphics.core.model.EntityHandle;
import com.ryuqq.graphics.core.model.Point3;

/**
 * IMAGEDEF 객체 참조.
 *
 * @param handle IMAGEDEF 핸들
 * @param pixelWidth 가로 픽셀 수 (양수)
 * @param pixelHeight 세로 픽셀 수 (양수)
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public record ImageDefinition(EntityHandle handle, double pixelWidth, double pixelHeight) {

    public ImageDefinition {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        if (!(pixelWidth > 0) || !(pixelHeight > 0)) {
            throw new IllegalArgumentException(
                "image size must be positive (width: " + pixelWidth + ", height: " + pixelHeight + ")"
            );
        }
    }

    /**
     * IMAGE 엔티티의 image_size 값.
     *
     * @return (pixelWidth, pixelHeight, 0)
     */
    public Point3 imageSize() {
        return Point3.of(pixelWidth, pixelHeight);
    }
}
