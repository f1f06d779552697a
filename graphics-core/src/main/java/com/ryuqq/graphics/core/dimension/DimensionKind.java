package com.ryuqq.graphics.core.dimension;

import com.ryuqq.graphics.core.model.DimensionTypeFlags;
import com.ryuqq.graphics.core.model.Flags;

/**
 * 치수 종류 (DIMENSION 엔티티의 dimtype 하위 비트).
 *
 * <p>LINEAR와 ALIGNED만 이 계층에서 기하를 계산하며,
 * 나머지 종류는 타입 플래그와 재정의만 조립하고 기하는 렌더러에 위임합니다.</p>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public enum DimensionKind {

    LINEAR(DimensionTypeFlags.LINEAR),
    ALIGNED(DimensionTypeFlags.ALIGNED),
    ANGULAR(DimensionTypeFlags.ANGULAR),
    DIAMETER(DimensionTypeFlags.DIAMETER),
    RADIUS(DimensionTypeFlags.RADIUS),
    ANGULAR_3P(DimensionTypeFlags.ANGULAR_3P),
    ORDINATE(DimensionTypeFlags.ORDINATE);

    private final int dxfCode;

    DimensionKind(int dxfCode) {
        this.dxfCode = dxfCode;
    }

    public int getDxfCode() {
        return dxfCode;
    }

    /**
     * 익명 치수 블록을 독점 참조하는 dimtype 값.
     *
     * @return dxfCode | BLOCK_EXCLUSIVE
     */
    public Flags dimtype() {
        return Flags.of(dxfCode | DimensionTypeFlags.BLOCK_EXCLUSIVE);
    }

    /**
     * 이 계층에서 기하(defpoint, angle)를 계산하는 종류인지 확인.
     *
     * @return LINEAR 또는 ALIGNED이면 true
     */
    public boolean hasDerivedGeometry() {
        return this == LINEAR || this == ALIGNED;
    }
}
