package com.ryuqq.graphics.core.model;

/**
 * LWPOLYLINE 엔티티의 {@code flags} 비트 상수.
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public final class LwPolylineFlags {

    public static final int CLOSED = 1;
    public static final int PLINEGEN = 128;

    private LwPolylineFlags() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
