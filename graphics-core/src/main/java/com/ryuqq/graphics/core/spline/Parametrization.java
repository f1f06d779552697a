package com.ryuqq.graphics.core.spline;

import com.ryuqq.graphics.core.exception.DxfValueException;
import com.ryuqq.graphics.core.model.Point3;

import java.util.List;

/**
 * 맞춤점 시퀀스의 파라미터 벡터 계산.
 *
 * <p>열린 곡선은 P₀…Pₙ에 대해 n+1개의 값을, 닫힌 곡선은 마지막 점에서 첫 점으로
 * 돌아오는 구간을 포함하여 n+2개의 값(마지막 값 = 1)을 반환합니다.</p>
 *
 * <pre>
 * uniform:     tᵢ = i / n
 * distance:    tᵢ = Σ|Pⱼ − Pⱼ₋₁| / total
 * centripetal: tᵢ = Σ|Pⱼ − Pⱼ₋₁|^power / total
 * </pre>
 *
 * <p>DISTANCE와 CENTRIPETAL에서 연속한 두 점이 같으면 파라미터가 엄격하게 증가하지 않으므로
 * {@link DxfValueException}이 발생합니다.</p>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public final class Parametrization {

    static final double COINCIDENCE_TOLERANCE = 1e-12;

    // Utility class - prevent instantiation
    private Parametrization() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 열린 곡선의 파라미터 벡터.
     *
     * @param fitPoints 맞춤점 (2개 이상)
     * @param method 계산 방식
     * @param power CENTRIPETAL 지수 (&gt; 0)
     * @return 0에서 1까지 엄격하게 증가하는 파라미터 벡터
     * @throws DxfValueException 점이 2개 미만이거나 연속한 점이 일치하는 경우
     */
    public static ParameterVector parameters(List<Point3> fitPoints, ParametrizationMethod method, double power) {
        checkArguments(fitPoints, method, power);
        return compute(fitPoints, method, power, false);
    }

    /**
     * 닫힌 곡선의 파라미터 벡터 (마지막 점 → 첫 점 구간 포함).
     *
     * @param fitPoints 맞춤점 (첫 점을 끝에 반복하지 않음, 2개 이상)
     * @param method 계산 방식
     * @param power CENTRIPETAL 지수 (&gt; 0)
     * @return fitPoints.size() + 1개의 값, 마지막 값은 1
     * @throws DxfValueException 점이 2개 미만이거나 연속한 점이 일치하는 경우
     */
    public static ParameterVector closedParameters(List<Point3> fitPoints, ParametrizationMethod method,
                                                   double power) {
        checkArguments(fitPoints, method, power);
        return compute(fitPoints, method, power, true);
    }

    private static ParameterVector compute(List<Point3> points, ParametrizationMethod method, double power,
                                           boolean closed) {
        int segments = closed ? points.size() : points.size() - 1;
        double[] lengths = new double[segments];
        for (int i = 0; i < segments; i++) {
            lengths[i] = segmentLength(points.get(i), points.get((i + 1) % points.size()), method, power, i);
        }
        double total = 0.0;
        for (double length : lengths) {
            total += length;
        }
        double[] t = new double[segments + 1];
        double sum = 0.0;
        for (int i = 1; i < segments; i++) {
            sum += lengths[i - 1];
            t[i] = sum / total;
        }
        t[segments] = 1.0;
        for (int i = 1; i < t.length; i++) {
            if (!(t[i] > t[i - 1])) {
                throw new DxfValueException(
                    "fitPoints", "fit point " + i + " is too close to its predecessor relative to the total length"
                        + " for method " + method
                );
            }
        }
        return ParameterVector.of(t);
    }

    private static double segmentLength(Point3 from, Point3 to, ParametrizationMethod method, double power,
                                        int index) {
        if (method == ParametrizationMethod.UNIFORM) {
            return 1.0;
        }
        double distance = from.distance(to);
        if (distance <= COINCIDENCE_TOLERANCE) {
            throw new DxfValueException(
                "fitPoints", "coincident consecutive fit points at index " + index + " for method " + method
            );
        }
        return method == ParametrizationMethod.CENTRIPETAL ? Math.pow(distance, power) : distance;
    }

    private static void checkArguments(List<Point3> fitPoints, ParametrizationMethod method, double power) {
        if (fitPoints == null) {
            throw new IllegalArgumentException("fitPoints cannot be null");
        }
        if (method == null) {
            throw new IllegalArgumentException("method cannot be null");
        }
        if (fitPoints.size() < 2) {
            throw new DxfValueException("fitPoints", "insufficient fit points: " + fitPoints.size());
        }
        if (method == ParametrizationMethod.CENTRIPETAL && !(power > 0.0)) {
            throw new DxfValueException("power", "power must be positive, got " + power);
        }
    }
}
