package com.ryuqq.graphics.core.exception;

/**
 * 그래픽 팩토리 계층의 기반 예외.
 *
 * <p>모든 도메인 오류는 엔티티 생성 협력자가 호출되기 전에 발생하며,
 * 이 예외가 발생한 경우 어떤 엔티티도 생성되지 않습니다.</p>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public class GraphicsFactoryException extends RuntimeException {

    public GraphicsFactoryException(String message) {
        super(message);
    }

    public GraphicsFactoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
