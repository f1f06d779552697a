package com.ryuqq.graphics.core.version;

import com.ryuqq.graphics.core.exception.DxfValueException;
import com.ryuqq.graphics.core.exception.DxfVersionException;
import com.ryuqq.graphics.core.model.EntityKind;
import com.ryuqq.graphics.core.model.FormatVersion;

/**
 * 포맷 버전 사전조건 검증.
 *
 * <p>엔티티 종류별 최소 버전은 {@link EntityKind#getMinVersion()} 한 곳에서 조회하며,
 * 검증은 속성 계산 이전에 수행되어 실패 시 어떤 부수효과도 남기지 않습니다.</p>
 *
 * <p><strong>최소 버전:</strong></p>
 * <ul>
 *   <li>R12: POINT, LINE, CIRCLE, ARC, SOLID, TRACE, 3DFACE, TEXT, INSERT, ATTRIB, POLYLINE, SHAPE, DIMENSION</li>
 *   <li>R2000: ELLIPSE, LWPOLYLINE, MTEXT, RAY, XLINE, SPLINE, BODY 계열, HATCH, MESH, IMAGE, UNDERLAY</li>
 *   <li>R2007: SURFACE 계열</li>
 * </ul>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public final class VersionGate {

    /**
     * ELLIPSE 축 비율의 최대값.
     */
    public static final double MAX_ELLIPSE_RATIO = 1.0;

    // Utility class - prevent instantiation
    private VersionGate() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 엔티티 종류가 활성 버전에서 허용되는지 검증.
     *
     * @param kind 엔티티 종류
     * @param active 활성 포맷 버전
     * @throws IllegalArgumentException kind 또는 active가 null인 경우
     * @throws DxfVersionException 활성 버전이 최소 요구 버전보다 낮은 경우
     */
    public static void require(EntityKind kind, FormatVersion active) {
        if (kind == null || active == null) {
            throw new IllegalArgumentException("Arguments cannot be null (kind: " + kind + ", active: " + active + ")");
        }
        if (!active.isAtLeast(kind.getMinVersion())) {
            throw new DxfVersionException(kind, kind.getMinVersion(), active);
        }
    }

    /**
     * 예외 없이 허용 여부만 확인.
     *
     * @param kind 엔티티 종류
     * @param active 활성 포맷 버전
     * @return 허용되면 true
     */
    public static boolean isSupported(EntityKind kind, FormatVersion active) {
        if (kind == null || active == null) {
            return false;
        }
        return active.isAtLeast(kind.getMinVersion());
    }

    /**
     * ELLIPSE의 축 비율 검증 (ratio ≤ 1, NaN 불가).
     *
     * @param ratio 보조축/주축 비율
     * @throws DxfValueException ratio가 1보다 크거나 NaN인 경우 (field: "ratio")
     */
    public static void requireEllipseRatio(double ratio) {
        if (!(ratio <= MAX_ELLIPSE_RATIO)) {
            throw new DxfValueException("ratio", "ellipse axis ratio must not exceed 1.0, got " + ratio);
        }
    }
}
