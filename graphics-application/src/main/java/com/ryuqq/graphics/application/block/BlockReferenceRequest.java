package com.ryuqq.graphics.application.block;

import com.ryuqq.graphics.core.model.AttributeSet;
import com.ryuqq.graphics.core.model.Point3;

import java.util.List;

/**
 * 블록 참조(INSERT) 생성 요청.
 *
 * @param blockName 참조할 블록 이름
 * @param insert 삽입점 (WCS)
 * @param attributes INSERT 엔티티 추가 속성
 * @param attribs 함께 생성된 ATTRIB 속성 (생성 순서)
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public record BlockReferenceRequest(
    String blockName,
    Point3 insert,
    AttributeSet attributes,
    List<AttributeSet> attribs
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException blockName 또는 insert가 null인 경우
     */
    public BlockReferenceRequest {
        if (blockName == null || blockName.isBlank()) {
            throw new IllegalArgumentException("blockName cannot be null or blank");
        }
        if (insert == null) {
            throw new IllegalArgumentException("insert cannot be null");
        }
        attributes = AttributeSet.orEmpty(attributes);
        attribs = attribs == null ? List.of() : List.copyOf(attribs);
    }
}
