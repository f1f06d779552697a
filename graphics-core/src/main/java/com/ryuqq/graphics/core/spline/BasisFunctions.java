package com.ryuqq.graphics.core.spline;

/**
 * B-spline 기저 함수 (Cox–de Boor).
 *
 * @author Graphics Team
 * @since 1.0.0
 */
final class BasisFunctions {

    private BasisFunctions() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * u가 속한 매듭 구간 인덱스.
     *
     * @param lastIndex 마지막 제어점 인덱스
     * @param degree 차수
     * @param u 파라미터
     * @param knots 매듭 벡터
     * @return knots[span] ≤ u &lt; knots[span+1]인 span (도메인 끝은 마지막 구간)
     */
    static int findSpan(int lastIndex, int degree, double u, double[] knots) {
        if (u >= knots[lastIndex + 1]) {
            return lastIndex;
        }
        if (u <= knots[degree]) {
            int span = degree;
            while (span < lastIndex && knots[span + 1] <= u) {
                span++;
            }
            return span;
        }
        int low = degree;
        int high = lastIndex + 1;
        int mid = (low + high) / 2;
        while (u < knots[mid] || u >= knots[mid + 1]) {
            if (u < knots[mid]) {
                high = mid;
            } else {
                low = mid;
            }
            mid = (low + high) / 2;
        }
        return mid;
    }

    /**
     * span 구간에서 0이 아닌 degree+1개의 기저 함수 값.
     *
     * @return N[span-degree .. span]
     */
    static double[] evaluate(int span, double u, int degree, double[] knots) {
        double[] basis = new double[degree + 1];
        double[] left = new double[degree + 1];
        double[] right = new double[degree + 1];
        basis[0] = 1.0;
        for (int j = 1; j <= degree; j++) {
            left[j] = u - knots[span + 1 - j];
            right[j] = knots[span + j] - u;
            double saved = 0.0;
            for (int r = 0; r < j; r++) {
                double temp = basis[r] / (right[r + 1] + left[j - r]);
                basis[r] = saved + right[r + 1] * temp;
                saved = left[j - r] * temp;
            }
            basis[j] = saved;
        }
        return basis;
    }
}
