package com.ryuqq.graphics.core.model;

/**
 * DIMENSION 엔티티의 {@code dimtype} 비트 상수.
 *
 * <p>하위 3비트(0~6)는 치수 종류를, 상위 비트는 블록 참조 방식과
 * 사용자 지정 텍스트 위치 여부를 나타냅니다.</p>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public final class DimensionTypeFlags {

    public static final int LINEAR = 0;
    public static final int ALIGNED = 1;
    public static final int ANGULAR = 2;
    public static final int DIAMETER = 3;
    public static final int RADIUS = 4;
    public static final int ANGULAR_3P = 5;
    public static final int ORDINATE = 6;
    public static final int BLOCK_EXCLUSIVE = 32;
    public static final int ORDINATE_TYPE = 64;
    public static final int USER_LOCATION_OVERRIDE = 128;

    private DimensionTypeFlags() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
