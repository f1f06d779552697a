package com.ryuqq.graphics.core.exception;

/**
 * 입력 값이 기하학적 또는 도메인 제약을 위반할 때 발생.
 *
 * <p>예: ELLIPSE ratio &gt; 1, 점 개수 부족, 알 수 없는 파라미터화 방식.</p>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public class DxfValueException extends GraphicsFactoryException {

    private final String field;

    /**
     * 필드 정보를 포함하는 예외 생성.
     *
     * @param field 위반한 입력 필드 이름
     * @param message 오류 메시지
     */
    public DxfValueException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    /**
     * 위반한 입력 필드 이름.
     *
     * @return 필드 이름
     */
    public String getField() {
        return field;
    }
}
