package com.ryuqq.graphics.core.spline;

import com.ryuqq.graphics.core.exception.DxfValueException;

/**
 * 부분 피벗 가우스 소거법으로 A·X = B를 푼다 (B는 x, y, z 3열).
 *
 * @author Graphics Team
 * @since 1.0.0
 */
final class LinearSystem {

    private static final double SINGULAR_TOLERANCE = 1e-12;

    private LinearSystem() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * @param matrix n×n 계수 행렬 (변경됨)
     * @param rhs n×3 우변 (변경됨)
     * @return n×3 해
     * @throws DxfValueException 행렬이 특이한 경우
     */
    static double[][] solve(double[][] matrix, double[][] rhs) {
        int n = matrix.length;
        int columns = rhs.length == 0 ? 0 : rhs[0].length;
        for (int col = 0; col < n; col++) {
            int pivot = col;
            for (int row = col + 1; row < n; row++) {
                if (Math.abs(matrix[row][col]) > Math.abs(matrix[pivot][col])) {
                    pivot = row;
                }
            }
            if (Math.abs(matrix[pivot][col]) < SINGULAR_TOLERANCE) {
                throw new DxfValueException("fitPoints", "degenerate fit points, singular interpolation system");
            }
            swap(matrix, col, pivot);
            swap(rhs, col, pivot);
            for (int row = col + 1; row < n; row++) {
                double factor = matrix[row][col] / matrix[col][col];
                if (factor == 0.0) {
                    continue;
                }
                for (int k = col; k < n; k++) {
                    matrix[row][k] -= factor * matrix[col][k];
                }
                for (int k = 0; k < columns; k++) {
                    rhs[row][k] -= factor * rhs[col][k];
                }
            }
        }
        double[][] solution = new double[n][columns];
        for (int row = n - 1; row >= 0; row--) {
            for (int k = 0; k < columns; k++) {
                double sum = rhs[row][k];
                for (int j = row + 1; j < n; j++) {
                    sum -= matrix[row][j] * solution[j][k];
                }
                solution[row][k] = sum / matrix[row][row];
            }
        }
        return solution;
    }

    private static void swap(double[][] rows, int a, int b) {
        if (a != b) {
            double[] temp = rows[a];
            rows[a] = rows[b];
            rows[b] = temp;
        }
    }
}
