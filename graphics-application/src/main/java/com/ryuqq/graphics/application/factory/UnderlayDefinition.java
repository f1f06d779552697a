package com.ryuqq.graphics.application.factory;

import com.ryuqq.graphics.core.model.EntityHandle;
import com.ryuqq.graphics.core.model.EntityKind;

/**
 * UNDERLAYDEFINITION 객체 참조.
 *
 * @param handle 정의 객체 핸들
 * @param format 언더레이 포맷 (생성할 엔티티 종류를 결정)
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public record UnderlayDefinition(EntityHandle handle, Format format) {

    public UnderlayDefinition {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        if (format == null) {
            throw new IllegalArgumentException("format cannot be null");
        }
    }

    public EntityKind entityKind() {
        return format.getEntityKind();
    }

    /**
     * 언더레이 파일 포맷.
     */
    public enum Format {
        PDF(EntityKind.PDFUNDERLAY),
        DWF(EntityKind.DWFUNDERLAY),
        DGN(EntityKind.DGNUNDERLAY);

        private final EntityKind entityKind;

        Format(EntityKind entityKind) {
            this.entityKind = entityKind;
        }

        public EntityKind getEntityKind() {
            return entityKind;
        }
    }
}
