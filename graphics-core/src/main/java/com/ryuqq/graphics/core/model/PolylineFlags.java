package com.ryuqq.graphics.core.model;

/**
 * POLYLINE 엔티티의 {@code flags} 비트 상수.
 *
 * <p>POLYLINE 하나의 엔티티 타입이 2D/3D 폴리라인, 폴리곤 메시, 폴리페이스 메시를
 * 모두 표현하며, 어떤 모드인지는 이 비트로 구분됩니다.</p>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public final class PolylineFlags {

    public static final int CLOSED = 1;
    public static final int MESH_CLOSED_M_DIRECTION = CLOSED;
    public static final int CURVE_FIT_VERTICES_ADDED = 2;
    public static final int SPLINE_FIT_VERTICES_ADDED = 4;
    public static final int POLYLINE_3D = 8;
    public static final int POLYMESH_3D = 16;
    public static final int MESH_CLOSED_N_DIRECTION = 32;
    public static final int POLYFACE = 64;
    public static final int GENERATE_LINETYPE_PATTERN = 128;

    private PolylineFlags() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
