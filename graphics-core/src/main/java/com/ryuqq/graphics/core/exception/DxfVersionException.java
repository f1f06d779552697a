package com.ryuqq.graphics.core.exception;

import com.ryuqq.graphics.core.model.EntityKind;
import com.ryuqq.graphics.core.model.FormatVersion;

/**
 * 활성 포맷 버전이 엔티티의 최소 요구 버전보다 낮을 때 발생.
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public class DxfVersionException extends GraphicsFactoryException {

    private final EntityKind kind;
    private final FormatVersion required;
    private final FormatVersion actual;

    public DxfVersionException(EntityKind kind, FormatVersion required, FormatVersion actual) {
        super(String.format(
            "%s requires DXF version %s (%s) or later, but the active version is %s (%s)",
            kind.getDxfType(), required, required.getDxfCode(), actual, actual.getDxfCode()
        ));
        this.kind = kind;
        this.required = required;
        this.actual = actual;
    }

    public EntityKind getKind() {
        return kind;
    }

    public FormatVersion getRequired() {
        return required;
    }

    public FormatVersion getActual() {
        return actual;
    }
}
