package com.ryuqq.graphics.core.model;

/**
 * 3차원 벡터 (점 또는 방향).
 *
 * <p>Point3는 WCS 좌표와 방향 벡터를 모두 표현하며,
 * 좌표계 변환(UCS/OCS)은 이 계층의 책임이 아닙니다.</p>
 *
 * <p><strong>불변성:</strong> 모든 연산은 새 인스턴스를 반환합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Point3 direction = Point3.of(10, 0).subtract(Point3.ORIGIN);
 * double angle = direction.angleDeg();                    // 0.0
 * Point3 base = direction.orthogonal().normalize(5);      // (0, 5, 0)
 * </pre>
 *
 * @param x x 좌표
 * @param y y 좌표
 * @param z z 좌표
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public record Point3(double x, double y, double z) {

    /**
     * 원점 (0, 0, 0).
     */
    public static final Point3 ORIGIN = new Point3(0, 0, 0);

    private static final double ABS_TOL = 1e-12;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 좌표가 NaN 또는 무한대인 경우
     */
    public Point3 {
        if (!Double.isFinite(x) || !Double.isFinite(y) || !Double.isFinite(z)) {
            throw new IllegalArgumentException(
                "Point3 coordinates must be finite (x: " + x + ", y: " + y + ", z: " + z + ")"
            );
        }
        // -0.0 → 0.0 (record equals는 Double.compare 기반)
        x += 0.0;
        y += 0.0;
        z += 0.0;
    }

    /**
     * 3D 점 생성.
     *
     * @param x x 좌표
     * @param y y 좌표
     * @param z z 좌표
     * @return Point3 인스턴스
     */
    public static Point3 of(double x, double y, double z) {
        return new Point3(x, y, z);
    }

    /**
     * 2D 점 생성 (z = 0).
     *
     * @param x x 좌표
     * @param y y 좌표
     * @return Point3 인스턴스
     */
    public static Point3 of(double x, double y) {
        return new Point3(x, y, 0);
    }

    /**
     * 2개 또는 3개 좌표 배열로부터 생성.
     *
     * @param coordinates (x, y) 또는 (x, y, z)
     * @return Point3 인스턴스
     * @throws IllegalArgumentException 좌표 개수가 2 또는 3이 아닌 경우
     */
    public static Point3 of(double... coordinates) {
        if (coordinates == null || coordinates.length < 2 || coordinates.length > 3) {
            throw new IllegalArgumentException("Point3 requires 2 or 3 coordinates");
        }
        return new Point3(coordinates[0], coordinates[1], coordinates.length == 3 ? coordinates[2] : 0);
    }

    public Point3 add(Point3 other) {
        return new Point3(x + other.x, y + other.y, z + other.z);
    }

    public Point3 subtract(Point3 other) {
        return new Point3(x - other.x, y - other.y, z - other.z);
    }

    public Point3 multiply(double factor) {
        return new Point3(x * factor, y * factor, z * factor);
    }

    public double dot(Point3 other) {
        return x * other.x + y * other.y + z * other.z;
    }

    public Point3 cross(Point3 other) {
        return new Point3(
            y * other.z - z * other.y,
            z * other.x - x * other.z,
            x * other.y - y * other.x
        );
    }

    /**
     * 벡터 길이.
     *
     * @return 유클리드 길이
     */
    public double magnitude() {
        return Math.sqrt(x * x + y * y + z * z);
    }

    /**
     * 두 점 사이의 거리.
     *
     * @param other 다른 점
     * @return 유클리드 거리
     */
    public double distance(Point3 other) {
        return subtract(other).magnitude();
    }

    /**
     * 길이가 0인지 확인.
     *
     * @return 모든 성분이 허용 오차 이내로 0이면 true
     */
    public boolean isNull() {
        return isClose(ORIGIN, ABS_TOL);
    }

    /**
     * 지정 길이로 정규화.
     *
     * @param length 결과 벡터의 길이 (음수이면 반대 방향)
     * @return 방향이 같고 길이가 |length|인 벡터
     * @throws IllegalStateException 길이가 0인 벡터인 경우
     */
    public Point3 normalize(double length) {
        double magnitude = magnitude();
        if (magnitude <= ABS_TOL) {
            throw new IllegalStateException("Cannot normalize a null vector");
        }
        return multiply(length / magnitude);
    }

    /**
     * 단위 벡터로 정규화.
     *
     * @return 길이 1인 벡터
     * @throws IllegalStateException 길이가 0인 벡터인 경우
     */
    public Point3 normalize() {
        return normalize(1.0);
    }

    /**
     * xy 평면에서 x축 기준 각도 (도 단위, 반시계 방향).
     *
     * @return atan2(y, x)를 도 단위로 변환한 값 (-180 ~ 180)
     */
    public double angleDeg() {
        return Math.toDegrees(Math.atan2(y, x));
    }

    /**
     * xy 평면에서 반시계 방향으로 90도 회전한 직교 벡터.
     *
     * @return (-y, x, z)
     */
    public Point3 orthogonal() {
        return orthogonal(true);
    }

    /**
     * xy 평면에서 90도 회전한 직교 벡터.
     *
     * @param counterClockwise true이면 반시계, false이면 시계 방향
     * @return 직교 벡터
     */
    public Point3 orthogonal(boolean counterClockwise) {
        return counterClockwise ? new Point3(-y, x, z) : new Point3(y, -x, z);
    }

    /**
     * 허용 오차 이내로 같은 점인지 확인.
     *
     * @param other 비교 대상
     * @param tolerance 성분별 절대 허용 오차
     * @return 모든 성분의 차이가 tolerance 이하이면 true
     */
    public boolean isClose(Point3 other, double tolerance) {
        return Math.abs(x - other.x) <= tolerance
            && Math.abs(y - other.y) <= tolerance
            && Math.abs(z - other.z) <= tolerance;
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ", " + z + ")";
    }
}
