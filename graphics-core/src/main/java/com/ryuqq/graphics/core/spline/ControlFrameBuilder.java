package com.ryuqq.graphics.core.spline;

import com.ryuqq.graphics.core.exception.DxfValueException;
import com.ryuqq.graphics.core.model.Point3;

import java.util.ArrayList;
import java.util.List;

/**
 * 맞춤점 또는 제어점으로부터 {@link BSplineControlFrame} 생성.
 *
 * <p><strong>맞춤점 기반:</strong></p>
 * <ul>
 *   <li>{@link #buildOpen} - 전역 보간, clamped 평균 매듭. 곡선은 모든 맞춤점을 지납니다.</li>
 *   <li>{@link #buildClosed} - 닫힌 다각형에 대한 주기적 보간. 제어점은 첫 degree개의 점을 끝에 반복합니다.</li>
 *   <li>{@link #buildOpenRational}, {@link #buildClosedRational} - 가중치 부착</li>
 *   <li>{@link #approximate} - 지정 개수의 제어점으로 최소제곱 근사 (양 끝점만 보간)</li>
 * </ul>
 *
 * <p><strong>제어점 기반:</strong> {@link #openUniform}, {@link #periodicUniform}.</p>
 *
 * <p>근사 결과는 특정 CAD 애플리케이션의 자체 맞춤점 알고리즘과 같은 형상을 보장하지 않습니다.</p>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public final class ControlFrameBuilder {

    // Utility class - prevent instantiation
    private ControlFrameBuilder() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 열린(clamped) 보간 프레임.
     *
     * @param fitPoints 맞춤점 (2개 이상, degree+1개 이상)
     * @param degree 차수
     * @param method 파라미터화 방식
     * @param power CENTRIPETAL 지수
     * @return 맞춤점 개수만큼의 제어점을 가진 프레임
     * @throws DxfValueException 맞춤점이 부족하거나 연속한 점이 일치하는 경우
     */
    public static BSplineControlFrame buildOpen(List<Point3> fitPoints, int degree, ParametrizationMethod method,
                                                double power) {
        List<Point3> points = checkedFitPoints(fitPoints, degree);
        ParameterVector t = Parametrization.parameters(points, method, power);
        double[] knots = KnotVectors.clampedAveraged(t, degree);
        int count = points.size();

        double[][] matrix = new double[count][count];
        for (int k = 0; k < count; k++) {
            int span = BasisFunctions.findSpan(count - 1, degree, t.get(k), knots);
            double[] basis = BasisFunctions.evaluate(span, t.get(k), degree, knots);
            for (int j = 0; j <= degree; j++) {
                matrix[k][span - degree + j] = basis[j];
            }
        }
        double[][] solution = LinearSystem.solve(matrix, coordinates(points));
        return BSplineControlFrame.of(degree, toPoints(solution), knots, null, false);
    }

    /**
     * 닫힌(주기적) 보간 프레임.
     *
     * <p>마지막 맞춤점이 첫 점과 같으면 중복으로 보고 제거합니다.
     * 곡선은 이음매에서 C^(degree-1) 연속이며 특정 시작/끝점을 고정하지 않습니다.</p>
     *
     * @param fitPoints 맞춤점 (degree+1개 이상)
     * @param degree 차수
     * @param method 파라미터화 방식
     * @param power CENTRIPETAL 지수
     * @return 맞춤점 개수 + degree개의 제어점을 가진 닫힌 프레임
     * @throws DxfValueException 맞춤점이 부족하거나 연속한 점이 일치하는 경우
     */
    public static BSplineControlFrame buildClosed(List<Point3> fitPoints, int degree, ParametrizationMethod method,
                                                  double power) {
        List<Point3> points = checkedFitPoints(fitPoints, degree);
        if (points.size() > 2 && points.get(0).isClose(points.get(points.size() - 1), Parametrization.COINCIDENCE_TOLERANCE)) {
            points.remove(points.size() - 1);
        }
        int n = points.size();
        if (n < degree + 1) {
            throw insufficient(n, degree);
        }
        ParameterVector t = Parametrization.closedParameters(points, method, power);
        double[] knots = KnotVectors.periodicInterpolation(t, degree);

        double[][] matrix = new double[n][n];
        for (int k = 0; k < n; k++) {
            int span = BasisFunctions.findSpan(n + degree - 1, degree, t.get(k), knots);
            double[] basis = BasisFunctions.evaluate(span, t.get(k), degree, knots);
            for (int j = 0; j <= degree; j++) {
                matrix[k][(span - degree + j) % n] += basis[j];
            }
        }
        List<Point3> controlPoints = toPoints(LinearSystem.solve(matrix, coordinates(points)));
        return BSplineControlFrame.of(degree, wrap(controlPoints, degree), knots, null, true);
    }

    /**
     * 열린 유리(rational) 보간 프레임.
     *
     * @param weights 제어점별 가중치 (맞춤점 개수와 같음)
     * @return 가중치가 부착된 프레임
     */
    public static BSplineControlFrame buildOpenRational(List<Point3> fitPoints, double[] weights, int degree,
                                                        ParametrizationMethod method, double power) {
        return buildOpen(fitPoints, degree, method, power).withWeights(weights);
    }

    /**
     * 닫힌 유리(rational) 보간 프레임.
     *
     * <p>가중치는 기본 제어점 개수(맞춤점 개수)만큼 주면 첫 degree개가 순환 확장되고,
     * 확장된 제어점 개수만큼 주면 그대로 사용됩니다.</p>
     *
     * @param weights 가중치
     * @return 가중치가 부착된 닫힌 프레임
     */
    public static BSplineControlFrame buildClosedRational(List<Point3> fitPoints, double[] weights, int degree,
                                                          ParametrizationMethod method, double power) {
        BSplineControlFrame frame = buildClosed(fitPoints, degree, method, power);
        return frame.withWeights(wrapWeights(weights, frame.getControlPointCount() - degree, degree));
    }

    /**
     * 최소제곱 근사 프레임.
     *
     * <p>첫 점과 마지막 점은 보간하고, 나머지 맞춤점과의 제곱 거리 합을 최소화합니다.</p>
     *
     * @param fitPoints 맞춤점
     * @param count 제어점 개수 (degree &lt; count &lt; fitPoints.size())
     * @param degree 차수
     * @param method 파라미터화 방식
     * @param power CENTRIPETAL 지수
     * @return count개의 제어점을 가진 열린 프레임
     * @throws DxfValueException count가 범위를 벗어난 경우 (field: "count")
     */
    public static BSplineControlFrame approximate(List<Point3> fitPoints, int count, int degree,
                                                  ParametrizationMethod method, double power) {
        List<Point3> points = checkedFitPoints(fitPoints, degree);
        if (count <= degree || count >= points.size()) {
            throw new DxfValueException(
                "count", "control point count must satisfy degree < count < fit point count (degree: "
                    + degree + ", count: " + count + ", fit points: " + points.size() + ")"
            );
        }
        ParameterVector t = Parametrization.parameters(points, method, power);
        double[] knots = KnotVectors.approximation(t, count, degree);
        int m = points.size() - 1;
        int n = count - 1;
        Point3 first = points.get(0);
        Point3 last = points.get(m);

        List<Point3> controlPoints = new ArrayList<>(count);
        controlPoints.add(first);
        if (n > 1) {
            double[][] rows = new double[m - 1][];
            Point3[] residuals = new Point3[m - 1];
            for (int k = 1; k < m; k++) {
                double[] row = basisRow(n, degree, t.get(k), knots);
                rows[k - 1] = row;
                residuals[k - 1] = points.get(k)
                    .subtract(first.multiply(row[0]))
                    .subtract(last.multiply(row[n]));
            }
            double[][] normal = new double[n - 1][n - 1];
            double[][] rhs = new double[n - 1][3];
            for (int i = 1; i < n; i++) {
                for (int j = 1; j < n; j++) {
                    double sum = 0.0;
                    for (double[] row : rows) {
                        sum += row[i] * row[j];
                    }
                    normal[i - 1][j - 1] = sum;
                }
                for (int k = 0; k < rows.length; k++) {
                    rhs[i - 1][0] += rows[k][i] * residuals[k].x();
                    rhs[i - 1][1] += rows[k][i] * residuals[k].y();
                    rhs[i - 1][2] += rows[k][i] * residuals[k].z();
                }
            }
            controlPoints.addAll(toPoints(LinearSystem.solve(normal, rhs)));
        }
        controlPoints.add(last);
        return BSplineControlFrame.of(degree, controlPoints, knots, null, false);
    }

    /**
     * 제어점으로 만든 열린 균등(clamped) 프레임.
     *
     * @param controlPoints 제어점 (degree+1개 이상)
     * @param degree 차수
     * @return 첫 점과 마지막 점을 지나는 프레임
     */
    public static BSplineControlFrame openUniform(List<Point3> controlPoints, int degree) {
        List<Point3> points = checkedControlPoints(controlPoints, degree);
        return BSplineControlFrame.of(
            degree, points, KnotVectors.openUniform(points.size(), degree + 1), null, false
        );
    }

    /**
     * 제어점으로 만든 주기적 균등 프레임.
     *
     * <p>제어점 끝에 첫 degree개의 점을 반복해 붙이고 정수 매듭을 사용합니다.</p>
     *
     * @param controlPoints 제어점 (degree+1개 이상, 반복 없이)
     * @param degree 차수
     * @return controlPoints.size() + degree개의 제어점을 가진 닫힌 프레임
     */
    public static BSplineControlFrame periodicUniform(List<Point3> controlPoints, int degree) {
        List<Point3> points = wrap(checkedControlPoints(controlPoints, degree), degree);
        return BSplineControlFrame.of(
            degree, points, KnotVectors.periodicUniform(points.size(), degree + 1), null, true
        );
    }

    /**
     * 닫힌 프레임용 가중치 확장.
     *
     * @param weights 가중치
     * @param baseCount 순환 확장 전 제어점 개수
     * @param degree 차수
     * @return baseCount개이면 첫 degree개를 반복해 붙인 배열, 아니면 원본 복사본
     */
    public static double[] wrapWeights(double[] weights, int baseCount, int degree) {
        if (weights == null) {
            throw new IllegalArgumentException("weights cannot be null");
        }
        if (weights.length != baseCount) {
            return weights.clone();
        }
        double[] wrapped = new double[baseCount + degree];
        for (int i = 0; i < wrapped.length; i++) {
            wrapped[i] = weights[i % baseCount];
        }
        return wrapped;
    }

    private static double[] basisRow(int lastIndex, int degree, double u, double[] knots) {
        double[] row = new double[lastIndex + 1];
        int span = BasisFunctions.findSpan(lastIndex, degree, u, knots);
        double[] basis = BasisFunctions.evaluate(span, u, degree, knots);
        for (int j = 0; j <= degree; j++) {
            row[span - degree + j] = basis[j];
        }
        return row;
    }

    private static List<Point3> checkedFitPoints(List<Point3> fitPoints, int degree) {
        if (fitPoints == null) {
            throw new IllegalArgumentException("fitPoints cannot be null");
        }
        checkDegree(degree);
        List<Point3> points = copy(fitPoints, "fitPoints");
        if (points.size() < 2 || points.size() < degree + 1) {
            throw insufficient(points.size(), degree);
        }
        return points;
    }

    private static List<Point3> checkedControlPoints(List<Point3> controlPoints, int degree) {
        if (controlPoints == null) {
            throw new IllegalArgumentException("controlPoints cannot be null");
        }
        checkDegree(degree);
        List<Point3> points = copy(controlPoints, "controlPoints");
        if (points.size() < degree + 1) {
            throw new DxfValueException(
                "controlPoints", "at least " + (degree + 1) + " control points required, got " + points.size()
            );
        }
        return points;
    }

    private static void checkDegree(int degree) {
        if (degree < 1) {
            throw new DxfValueException("degree", "degree must be at least 1, got " + degree);
        }
    }

    private static List<Point3> copy(List<Point3> source, String name) {
        List<Point3> points = new ArrayList<>(source.size());
        for (Point3 point : source) {
            if (point == null) {
                throw new IllegalArgumentException(name + " cannot contain null");
            }
            points.add(point);
        }
        return points;
    }

    private static DxfValueException insufficient(int count, int degree) {
        return new DxfValueException(
            "fitPoints", "insufficient fit points: " + count + " (degree " + degree + " requires "
                + Math.max(2, degree + 1) + ")"
        );
    }

    private static List<Point3> wrap(List<Point3> points, int degree) {
        List<Point3> wrapped = new ArrayList<>(points.size() + degree);
        wrapped.addAll(points);
        for (int i = 0; i < degree; i++) {
            wrapped.add(points.get(i % points.size()));
        }
        return wrapped;
    }

    private static double[][] coordinates(List<Point3> points) {
        double[][] rhs = new double[points.size()][3];
        for (int i = 0; i < points.size(); i++) {
            Point3 point = points.get(i);
            rhs[i][0] = point.x();
            rhs[i][1] = point.y();
            rhs[i][2] = point.z();
        }
        return rhs;
    }

    private static List<Point3> toPoints(double[][] solution) {
        List<Point3> points = new ArrayList<>(solution.length);
        for (double[] row : solution) {
            points.add(Point3.of(row[0], row[1], row[2]));
        }
        return points;
    }
}
