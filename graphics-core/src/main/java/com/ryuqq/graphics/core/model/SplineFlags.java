package com.ryuqq.graphics.core.model;

/**
 * SPLINE 엔티티의 {@code flags} 비트 상수.
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public final class SplineFlags {

    public static final int CLOSED = 1;
    public static final int PERIODIC = 2;
    public static final int RATIONAL = 4;
    public static final int PLANAR = 8;
    public static final int LINEAR = 16;

    private SplineFlags() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
