package com.ryuqq.graphics.application.factory;

import com.ryuqq.graphics.core.model.FormatVersion;
import com.ryuqq.graphics.core.spline.ParametrizationMethod;

/**
 * 그래픽 팩토리 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>dxfVersion: 활성 포맷 버전 (기본 R2013)</li>
 *   <li>defaultDimStyle: 치수 스타일 기본값 (기본 "EZDXF")</li>
 *   <li>defaultDegree: 스플라인 차수 기본값 (기본 3)</li>
 *   <li>defaultMethod: 파라미터화 방식 기본값 (기본 DISTANCE)</li>
 *   <li>defaultPower: CENTRIPETAL 지수 기본값 (기본 0.5)</li>
 * </ul>
 *
 * @author Graphics Team
 * @since 1.0.0
 * @param dxfVersion 활성 포맷 버전
 * @param defaultDimStyle 치수 스타일 기본값
 * @param defaultDegree 스플라인 차수 기본값 (1 이상)
 * @param defaultMethod 파라미터화 방식 기본값
 * @param defaultPower CENTRIPETAL 지수 기본값 (양수)
 */
public record FactoryConfig(
    FormatVersion dxfVersion,
    String defaultDimStyle,
    int defaultDegree,
    ParametrizationMethod defaultMethod,
    double defaultPower
) {

    public static final String DEFAULT_DIM_STYLE = "EZDXF";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: R2013, "EZDXF", degree=3, DISTANCE, power=0.5</p>
     */
    public FactoryConfig() {
        this(FormatVersion.R2013, DEFAULT_DIM_STYLE, 3, ParametrizationMethod.DISTANCE, 0.5);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public FactoryConfig {
        if (dxfVersion == null) {
            throw new IllegalArgumentException("dxfVersion cannot be null");
        }
        if (defaultDimStyle == null || defaultDimStyle.isBlank()) {
            throw new IllegalArgumentException("defaultDimStyle cannot be null or blank");
        }
        if (defaultDegree < 1) {
            throw new IllegalArgumentException(
                "defaultDegree must be at least 1 (current: " + defaultDegree + ")"
            );
        }
        if (defaultMethod == null) {
            throw new IllegalArgumentException("defaultMethod cannot be null");
        }
        if (!(defaultPower > 0.0)) {
            throw new IllegalArgumentException(
                "defaultPower must be positive (current: " + defaultPower + ")"
            );
        }
    }

    /**
     * 활성 버전만 변경한 새 인스턴스 생성.
     *
     * @param dxfVersion 새 포맷 버전
     * @return 새 FactoryConfig 인스턴스
     */
    public FactoryConfig withDxfVersion(FormatVersion dxfVersion) {
        return new FactoryConfig(dxfVersion, defaultDimStyle, defaultDegree, defaultMethod, defaultPower);
    }

    public FactoryConfig withDefaultDimStyle(String defaultDimStyle) {
        return new FactoryConfig(dxfVersion, defaultDimStyle, defaultDegree, defaultMethod, defaultPower);
    }

    public FactoryConfig withDefaultDegree(int defaultDegree) {
        return new FactoryConfig(dxfVersion, defaultDimStyle, defaultDegree, defaultMethod, defaultPower);
    }

    public FactoryConfig withDefaultMethod(ParametrizationMethod defaultMethod) {
        return new FactoryConfig(dxfVersion, defaultDimStyle, defaultDegree, defaultMethod, defaultPower);
    }

    public FactoryConfig withDefaultPower(double defaultPower) {
        return new FactoryConfig(dxfVersion, defaultDimStyle, defaultDegree, defaultMethod, defaultPower);
    }
}
