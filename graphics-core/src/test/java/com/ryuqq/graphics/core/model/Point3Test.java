package com.ryuqq.graphics.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Point3 테스트.
 *
 * @author Graphics Team
 * @since 1.0.0
 */
class Point3Test {

    private static final double EPS = 1e-12;

    @Test
    void of_TwoCoordinates_ZIsZero() {
        // When
        Point3 point = Point3.of(1, 2);

        // Then
        assertEquals(1.0, point.x());
        assertEquals(2.0, point.y());
        assertEquals(0.0, point.z());
    }

    @Test
    void of_CoordinateArray_AcceptsTwoOrThree() {
        assertEquals(Point3.of(1, 2, 0), Point3.of(new double[]{1, 2}));
        assertEquals(Point3.of(1, 2, 3), Point3.of(new double[]{1, 2, 3}));
        assertThrows(IllegalArgumentException.class, () -> Point3.of(new double[]{1}));
        assertThrows(IllegalArgumentException.class, () -> Point3.of(new double[]{1, 2, 3, 4}));
    }

    @Test
    void constructor_NonFiniteCoordinate_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Point3.of(Double.NaN, 0));
        assertThrows(IllegalArgumentException.class, () -> Point3.of(0, Double.POSITIVE_INFINITY));
    }

    @Test
    void equals_NegativeZero_EqualsPositiveZero() {
        assertEquals(Point3.of(0, 0, 0), Point3.of(-0.0, -0.0, -0.0));
        assertEquals(Point3.ORIGIN.hashCode(), Point3.of(-0.0, 0.0).hashCode());
    }

    @Test
    void arithmetic_ReturnsNewVectors() {
        // Given
        Point3 a = Point3.of(1, 2, 3);
        Point3 b = Point3.of(4, 5, 6);

        // Then
        assertEquals(Point3.of(5, 7, 9), a.add(b));
        assertEquals(Point3.of(3, 3, 3), b.subtract(a));
        assertEquals(Point3.of(2, 4, 6), a.multiply(2));
        assertEquals(32.0, a.dot(b), EPS);
        assertEquals(Point3.of(-3, 6, -3), a.cross(b));
    }

    @Test
    void magnitudeAndDistance() {
        assertEquals(5.0, Point3.of(3, 4).magnitude(), EPS);
        assertEquals(5.0, Point3.of(1, 1).distance(Point3.of(4, 5)), EPS);
    }

    @Test
    void normalize_ScalesToRequestedLength() {
        // When
        Point3 normalized = Point3.of(0, 3).normalize(5);

        // Then
        assertTrue(normalized.isClose(Point3.of(0, 5), EPS));
        assertTrue(Point3.of(10, 0).normalize().isClose(Point3.of(1, 0), EPS));
    }

    @Test
    void normalize_NullVector_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> Point3.ORIGIN.normalize(1)
        );
        assertTrue(exception.getMessage().contains("null vector"));
    }

    @Test
    void orthogonal_RotatesByNinetyDegrees() {
        assertEquals(Point3.of(0, 1), Point3.of(1, 0).orthogonal());
        assertEquals(Point3.of(0, -1), Point3.of(1, 0).orthogonal(false));
    }

    @Test
    void angleDeg_MeasuredCounterClockwiseFromXAxis() {
        assertEquals(0.0, Point3.of(10, 0).angleDeg(), EPS);
        assertEquals(90.0, Point3.of(0, 2).angleDeg(), EPS);
        assertEquals(45.0, Point3.of(1, 1).angleDeg(), EPS);
        assertEquals(180.0, Point3.of(-1, 0).angleDeg(), EPS);
    }

    @Test
    void isNull_TrueOnlyForZeroLengthVectors() {
        assertTrue(Point3.ORIGIN.isNull());
        assertTrue(Point3.of(1e-14, 0).isNull());
        assertFalse(Point3.of(1e-6, 0).isNull());
    }
}
