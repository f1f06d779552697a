package com.ryuqq.graphics.adapter.inmemory.entity;

import com.ryuqq.graphics.core.model.AttributeSet;
import com.ryuqq.graphics.core.model.EntityHandle;
import com.ryuqq.graphics.core.model.EntityKind;

/**
 * 메모리에 저장된 엔티티.
 *
 * @param handle 할당된 핸들
 * @param kind 엔티티 종류
 * @param attributes 저장된 속성 (수정 없이 보관)
 * @param owner 소유 레이아웃 이름 (모델 공간 또는 블록 이름)
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public record StoredEntity(EntityHandle handle, EntityKind kind, AttributeSet attributes, String owner) {

    public StoredEntity {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (attributes == null) {
            throw new IllegalArgumentException("attributes cannot be null");
        }
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner cannot be null or blank");
        }
    }
}
