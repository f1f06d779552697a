package com.ryuqq.graphics.core.spline;

import com.ryuqq.graphics.core.exception.DxfValueException;

/**
 * 맞춤점(fit point)에 대한 파라미터 벡터 계산 방식.
 *
 * <ul>
 *   <li>{@link #UNIFORM} - tᵢ = i / n, 균등 간격</li>
 *   <li>{@link #DISTANCE} - 현(chord) 길이 비례</li>
 *   <li>{@link #CENTRIPETAL} - 현 길이의 power 제곱 비례 (power = 0.5가 고전적 구심 방식)</li>
 * </ul>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public enum ParametrizationMethod {

    UNIFORM("uniform"),
    DISTANCE("distance"),
    CENTRIPETAL("centripetal");

    private final String methodName;

    ParametrizationMethod(String methodName) {
        this.methodName = methodName;
    }

    public String getMethodName() {
        return methodName;
    }

    /**
     * 이름으로 조회 (대소문자 무시).
     *
     * @param name "uniform", "distance", "centripetal"
     * @return ParametrizationMethod
     * @throws DxfValueException 알 수 없는 이름인 경우 (field: "method")
     */
    public static ParametrizationMethod of(String name) {
        if (name != null) {
            for (ParametrizationMethod method : values()) {
                if (method.methodName.equalsIgnoreCase(name.trim())) {
                    return method;
                }
            }
        }
        throw new DxfValueException("method", "unknown method: " + name);
    }
}
