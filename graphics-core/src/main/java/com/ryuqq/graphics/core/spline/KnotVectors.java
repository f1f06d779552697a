package com.ryuqq.graphics.core.spline;

/**
 * B-spline 매듭 벡터 생성.
 *
 * <p>모든 매듭 벡터의 길이는 {@code controlPointCount + degree + 1}입니다.</p>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public final class KnotVectors {

    // Utility class - prevent instantiation
    private KnotVectors() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 파라미터 평균으로 만든 clamped 매듭 벡터 (전역 보간용).
     *
     * <p>양 끝 값이 각각 degree+1번 반복되고, 내부 매듭은 연속한 degree개 파라미터의 평균입니다.</p>
     *
     * @param t 맞춤점 파라미터 (길이 = 제어점 개수)
     * @param degree 차수
     * @return 길이 t.size() + degree + 1인 매듭 벡터
     */
    public static double[] clampedAveraged(ParameterVector t, int degree) {
        int count = t.size();
        double[] knots = new double[count + degree + 1];
        double last = t.last();
        for (int i = 0; i <= degree; i++) {
            knots[i] = 0.0;
            knots[knots.length - 1 - i] = last;
        }
        for (int j = 1; j < count - degree; j++) {
            double sum = 0.0;
            for (int i = j; i < j + degree; i++) {
                sum += t.get(i);
            }
            knots[j + degree] = sum / degree;
        }
        return knots;
    }

    /**
     * 열린 균등(open uniform) 매듭 벡터.
     *
     * <pre>
     * [0]*order + [1 .. count-order] + [count-order+1]*order
     * </pre>
     *
     * @param count 제어점 개수 (≥ order)
     * @param order 차수 + 1
     * @return 길이 count + order인 매듭 벡터
     */
    public static double[] openUniform(int count, int order) {
        double[] knots = new double[count + order];
        double end = count - order + 1;
        for (int i = 0; i < order; i++) {
            knots[i] = 0.0;
            knots[knots.length - 1 - i] = end;
        }
        for (int i = 1; i <= count - order; i++) {
            knots[order - 1 + i] = i;
        }
        return knots;
    }

    /**
     * 주기적 균등(periodic uniform) 매듭 벡터: 0, 1, 2, ... 정수.
     *
     * @param count 제어점 개수 (순환 확장 포함)
     * @param order 차수 + 1
     * @return 길이 count + order인 매듭 벡터
     */
    public static double[] periodicUniform(int count, int order) {
        double[] knots = new double[count + order];
        for (int i = 0; i < knots.length; i++) {
            knots[i] = i;
        }
        return knots;
    }

    /**
     * 닫힌 보간 곡선의 주기적 매듭 벡터.
     *
     * <p>기본 매듭 κ₀…κₙ₋₁을 주기 1로 양쪽에 degree개씩 확장합니다 (κᵢ₊ₙ = κᵢ + 1).
     * 홀수 차수는 κᵢ = tᵢ, 짝수 차수는 κᵢ = (tᵢ₋₁ + tᵢ) / 2로 두어
     * 보간 행렬이 특이해지지 않도록 합니다.</p>
     *
     * @param t 닫힌 파라미터 벡터 (n+1개, 마지막 값 1)
     * @param degree 차수
     * @return 길이 n + 2·degree + 1인 매듭 벡터
     */
    public static double[] periodicInterpolation(ParameterVector t, int degree) {
        int n = t.size() - 1;
        double[] base = new double[n];
        for (int i = 0; i < n; i++) {
            if (degree % 2 == 1) {
                base[i] = t.get(i);
            } else {
                double previous = i == 0 ? t.get(n - 1) - 1.0 : t.get(i - 1);
                base[i] = (previous + t.get(i)) / 2.0;
            }
        }
        double[] knots = new double[n + 2 * degree + 1];
        for (int j = 0; j < knots.length; j++) {
            int index = j - degree;
            int period = Math.floorDiv(index, n);
            knots[j] = base[Math.floorMod(index, n)] + period;
        }
        return knots;
    }

    /**
     * 최소제곱 근사용 clamped 매듭 벡터.
     *
     * <p>맞춤점 파라미터를 구간별로 보간하여 모든 매듭 구간에 적어도 하나의
     * 파라미터가 포함되도록 합니다.</p>
     *
     * @param t 맞춤점 파라미터 (m+1개)
     * @param count 제어점 개수 (degree &lt; count ≤ m+1)
     * @param degree 차수
     * @return 길이 count + degree + 1인 매듭 벡터
     */
    public static double[] approximation(ParameterVector t, int count, int degree) {
        int fitCount = t.size();
        int n = count - 1;
        double[] knots = new double[count + degree + 1];
        double last = t.last();
        for (int i = 0; i <= degree; i++) {
            knots[i] = 0.0;
            knots[knots.length - 1 - i] = last;
        }
        double d = (double) fitCount / (n - degree + 1);
        for (int j = 1; j <= n - degree; j++) {
            int i = (int) (j * d);
            double alpha = j * d - i;
            knots[degree + j] = (1.0 - alpha) * t.get(i - 1) + alpha * t.get(i);
        }
        return knots;
    }
}
