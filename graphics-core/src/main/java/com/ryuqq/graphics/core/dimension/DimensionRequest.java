package com.ryuqq.graphics.core.dimension;

import com.ryuqq.graphics.core.model.AttributeSet;
import com.ryuqq.graphics.core.model.Point3;

/**
 * 조립된 치수 요청.
 *
 * <p>DIMENSION 엔티티 속성과 스타일 재정의를 함께 담아
 * {@link com.ryuqq.graphics.core.spi.DimensionRenderer}에 전달됩니다.</p>
 *
 * @param kind 치수 종류
 * @param attributes DIMENSION 엔티티 속성 (dimtype, dimstyle, defpoint 등)
 * @param styleName 치수 스타일 이름
 * @param styleOverride 스타일 재정의 (dimtix, dimse1 등)
 * @param location 사용자 지정 텍스트 위치 (없으면 null)
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public record DimensionRequest(
    DimensionKind kind,
    AttributeSet attributes,
    String styleName,
    AttributeSet styleOverride,
    Point3 location
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind, attributes, styleName이 null인 경우
     */
    public DimensionRequest {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (attributes == null) {
            throw new IllegalArgumentException("attributes cannot be null");
        }
        if (styleName == null || styleName.isBlank()) {
            throw new IllegalArgumentException("styleName cannot be null or blank");
        }
        styleOverride = AttributeSet.orEmpty(styleOverride);
    }

    public boolean hasLocation() {
        return location != null;
    }

    /**
     * 스타일 재정의 하나를 추가한 새 요청.
     *
     * @param key 재정의 이름 (예: "dimse1")
     * @param value 값
     * @return 새 DimensionRequest
     */
    public DimensionRequest withOverride(String key, Object value) {
        return new DimensionRequest(kind, attributes, styleName, styleOverride.with(key, value), location);
    }
}
