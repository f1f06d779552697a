package com.ryuqq.graphics.core.spline;

import com.ryuqq.graphics.core.exception.DxfValueException;
import com.ryuqq.graphics.core.model.Flags;
import com.ryuqq.graphics.core.model.Point3;
import com.ryuqq.graphics.core.model.SplineFlags;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * B-spline 제어 프레임 (차수, 제어점, 매듭, 선택적 가중치).
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>degree ≥ 1</li>
 *   <li>knots.size() == controlPoints.size() + degree + 1</li>
 *   <li>knots는 감소하지 않음</li>
 *   <li>가중치가 있으면 weights.size() == controlPoints.size()이고 모두 양수</li>
 * </ul>
 *
 * <p>비유리(non-rational) 프레임의 weights는 빈 목록입니다.
 * 닫힌 프레임의 제어점에는 순환을 위해 반복된 첫 degree개의 점이 이미 포함되어 있습니다.</p>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public final class BSplineControlFrame {

    private static final double DOMAIN_TOLERANCE = 1e-9;

    private final int degree;
    private final List<Point3> controlPoints;
    private final double[] knots;
    private final double[] weights;
    private final boolean closed;

    private BSplineControlFrame(int degree, List<Point3> controlPoints, double[] knots, double[] weights,
                                boolean closed) {
        this.degree = degree;
        this.controlPoints = controlPoints;
        this.knots = knots;
        this.weights = weights;
        this.closed = closed;
    }

    /**
     * 제어 프레임 생성.
     *
     * @param degree 차수 (≥ 1)
     * @param controlPoints 제어점
     * @param knots 매듭 벡터
     * @param weights 가중치 (비유리 프레임은 null 또는 빈 배열)
     * @param closed 닫힌(주기적) 프레임 여부
     * @return BSplineControlFrame 인스턴스
     * @throws IllegalArgumentException controlPoints 또는 knots가 null인 경우
     * @throws DxfValueException 불변식을 위반한 경우
     */
    public static BSplineControlFrame of(int degree, List<Point3> controlPoints, double[] knots, double[] weights,
                                         boolean closed) {
        if (controlPoints == null || knots == null) {
            throw new IllegalArgumentException("controlPoints and knots cannot be null");
        }
        if (degree < 1) {
            throw new DxfValueException("degree", "degree must be at least 1, got " + degree);
        }
        List<Point3> points = new ArrayList<>(controlPoints.size());
        for (Point3 point : controlPoints) {
            if (point == null) {
                throw new IllegalArgumentException("controlPoints cannot contain null");
            }
            points.add(point);
        }
        if (points.size() < degree + 1) {
            throw new DxfValueException(
                "controlPoints", "at least " + (degree + 1) + " control points required, got " + points.size()
            );
        }
        checkKnots(knots, points.size(), degree);
        double[] checkedWeights = weights == null ? new double[0] : weights.clone();
        if (checkedWeights.length > 0) {
            checkWeights(checkedWeights, points.size());
        }
        return new BSplineControlFrame(
            degree, Collections.unmodifiableList(points), knots.clone(), checkedWeights, closed
        );
    }

    /**
     * 매듭 벡터만 교체한 새 프레임.
     *
     * @param newKnots 매듭 벡터
     * @return 새 BSplineControlFrame
     * @throws DxfValueException 매듭 벡터가 불변식을 위반한 경우
     */
    public BSplineControlFrame withKnots(double[] newKnots) {
        return of(degree, controlPoints, newKnots, weights, closed);
    }

    /**
     * 가중치를 붙인 유리(rational) 프레임.
     *
     * @param newWeights 제어점별 가중치 (모두 양수)
     * @return 새 BSplineControlFrame
     * @throws DxfValueException 가중치 개수가 다르거나 양수가 아닌 값이 있는 경우
     */
    public BSplineControlFrame withWeights(double[] newWeights) {
        if (newWeights == null || newWeights.length == 0) {
            throw new DxfValueException("weights", "weights cannot be empty");
        }
        return of(degree, controlPoints, knots, newWeights, closed);
    }

    public int getDegree() {
        return degree;
    }

    public int getOrder() {
        return degree + 1;
    }

    public List<Point3> getControlPoints() {
        return controlPoints;
    }

    public int getControlPointCount() {
        return controlPoints.size();
    }

    public List<Double> getKnots() {
        return toList(knots);
    }

    public double[] knotArray() {
        return knots.clone();
    }

    /**
     * 가중치 (비유리 프레임이면 빈 목록).
     *
     * @return 불변 가중치 목록
     */
    public List<Double> getWeights() {
        return toList(weights);
    }

    public boolean isRational() {
        return weights.length > 0;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * SPLINE 엔티티 flags.
     *
     * @return 닫힌 프레임이면 CLOSED|PERIODIC, 유리 프레임이면 RATIONAL 비트 포함
     */
    public Flags getFlags() {
        int value = 0;
        if (closed) {
            value |= SplineFlags.CLOSED | SplineFlags.PERIODIC;
        }
        if (isRational()) {
            value |= SplineFlags.RATIONAL;
        }
        return Flags.of(value);
    }

    public double domainStart() {
        return knots[degree];
    }

    public double domainEnd() {
        return knots[controlPoints.size()];
    }

    /**
     * 곡선 위의 점 계산.
     *
     * @param t 파라미터 ({@link #domainStart()} ~ {@link #domainEnd()})
     * @return 곡선 위의 점
     * @throws IllegalArgumentException t가 도메인을 벗어난 경우
     */
    public Point3 point(double t) {
        double start = domainStart();
        double end = domainEnd();
        if (t < start - DOMAIN_TOLERANCE || t > end + DOMAIN_TOLERANCE) {
            throw new IllegalArgumentException("t out of domain [" + start + ", " + end + "]: " + t);
        }
        double u = Math.max(start, Math.min(end, t));
        int lastIndex = controlPoints.size() - 1;
        int span = BasisFunctions.findSpan(lastIndex, degree, u, knots);
        double[] basis = BasisFunctions.evaluate(span, u, degree, knots);
        double x = 0.0;
        double y = 0.0;
        double z = 0.0;
        double w = 0.0;
        for (int j = 0; j <= degree; j++) {
            int index = span - degree + j;
            double factor = basis[j] * (isRational() ? weights[index] : 1.0);
            Point3 cp = controlPoints.get(index);
            x += factor * cp.x();
            y += factor * cp.y();
            z += factor * cp.z();
            w += factor;
        }
        return Point3.of(x / w, y / w, z / w);
    }

    private static void checkKnots(double[] knots, int count, int degree) {
        if (knots.length != count + degree + 1) {
            throw new DxfValueException(
                "knots", "expected " + (count + degree + 1) + " knot values, got " + knots.length
            );
        }
        for (int i = 0; i < knots.length; i++) {
            if (!Double.isFinite(knots[i]) || (i > 0 && knots[i] < knots[i - 1])) {
                throw new DxfValueException("knots", "knot values must be finite and non-decreasing");
            }
        }
    }

    private static void checkWeights(double[] weights, int count) {
        if (weights.length != count) {
            throw new DxfValueException(
                "weights", "expected " + count + " weights, got " + weights.length
            );
        }
        for (double weight : weights) {
            if (!(weight > 0.0) || !Double.isFinite(weight)) {
                throw new DxfValueException("weights", "weights must be positive, got " + weight);
            }
        }
    }

    private static List<Double> toList(double[] values) {
        List<Double> list = new ArrayList<>(values.length);
        for (double value : values) {
            list.add(value);
        }
        return Collections.unmodifiableList(list);
    }

    @Override
    public String toString() {
        return "BSplineControlFrame{degree=" + degree + ", controlPoints=" + controlPoints.size()
            + ", closed=" + closed + ", rational=" + isRational() + "}";
    }
}
