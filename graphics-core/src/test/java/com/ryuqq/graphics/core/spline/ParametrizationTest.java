package com.ryuqq.graphics.core.spline;

import com.ryuqq.graphics.core.exception.DxfValueException;
import com.ryuqq.graphics.core.model.Point3;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Parametrization 테스트.
 *
 * @author Graphics Team
 * @since 1.0.0
 */
class ParametrizationTest {

    private static final List<Point3> LINE = List.of(
        Point3.of(0, 0), Point3.of(1, 0), Point3.of(4, 0), Point3.of(13, 0)
    );

    @Test
    void uniform_EqualSteps() {
        ParameterVector t = Parametrization.parameters(LINE, ParametrizationMethod.UNIFORM, 0);

        assertThat(t.asList()).containsExactly(0.0, 1.0 / 3.0, 2.0 / 3.0, 1.0);
    }

    @Test
    void distance_ProportionalToChordLength() {
        ParameterVector t = Parametrization.parameters(LINE, ParametrizationMethod.DISTANCE, 0);

        assertThat(t.get(1)).isCloseTo(1.0 / 13.0, within(1e-12));
        assertThat(t.get(2)).isCloseTo(4.0 / 13.0, within(1e-12));
        assertThat(t.last()).isEqualTo(1.0);
    }

    @Test
    void centripetal_UsesPoweredChordLength() {
        // chords 1, 3, 9 → sqrt: 1, √3, 3
        ParameterVector t = Parametrization.parameters(LINE, ParametrizationMethod.CENTRIPETAL, 0.5);
        double total = 1.0 + Math.sqrt(3.0) + 3.0;

        assertThat(t.get(1)).isCloseTo(1.0 / total, within(1e-12));
        assertThat(t.get(2)).isCloseTo((1.0 + Math.sqrt(3.0)) / total, within(1e-12));
        assertThat(t.last()).isEqualTo(1.0);
    }

    @Test
    void closedParameters_IncludeClosingSegment() {
        // Given: unit square
        List<Point3> square = List.of(Point3.of(0, 0), Point3.of(1, 0), Point3.of(1, 1), Point3.of(0, 1));

        // When
        ParameterVector t = Parametrization.closedParameters(square, ParametrizationMethod.DISTANCE, 0);

        // Then
        assertThat(t.size()).isEqualTo(5);
        assertThat(t.asList()).containsExactly(0.0, 0.25, 0.5, 0.75, 1.0);
    }

    @Test
    void coincidentPoints_RejectedForDistance() {
        List<Point3> points = List.of(Point3.of(0, 0), Point3.of(0, 0), Point3.of(1, 1));

        assertThatThrownBy(() -> Parametrization.parameters(points, ParametrizationMethod.DISTANCE, 0))
            .isInstanceOf(DxfValueException.class)
            .hasMessageContaining("coincident");
    }

    @Test
    void negligibleChord_CollapsingParameters_RejectedAsValueError() {
        // Given: distinct points whose last chord vanishes against the total length
        List<Point3> points = List.of(Point3.of(0, 0), Point3.of(1e6, 0), Point3.of(1e6, 1e-11));

        // When & Then
        assertThatThrownBy(() -> Parametrization.parameters(points, ParametrizationMethod.DISTANCE, 0))
            .isInstanceOfSatisfying(DxfValueException.class, e -> assertThat(e.getField()).isEqualTo("fitPoints"));
    }

    @Test
    void coincidentPoints_AcceptedForUniform() {
        List<Point3> points = List.of(Point3.of(0, 0), Point3.of(0, 0), Point3.of(1, 1));

        assertThat(Parametrization.parameters(points, ParametrizationMethod.UNIFORM, 0).size()).isEqualTo(3);
    }

    @Test
    void singlePoint_Rejected() {
        assertThatThrownBy(() -> Parametrization.parameters(List.of(Point3.ORIGIN), ParametrizationMethod.UNIFORM, 0))
            .isInstanceOf(DxfValueException.class)
            .hasMessageContaining("insufficient fit points");
    }

    @Test
    void centripetal_NonPositivePower_Rejected() {
        assertThatThrownBy(() -> Parametrization.parameters(LINE, ParametrizationMethod.CENTRIPETAL, 0))
            .isInstanceOfSatisfying(DxfValueException.class, e -> assertThat(e.getField()).isEqualTo("power"));
    }

    @Test
    void method_LookupByName() {
        assertThat(ParametrizationMethod.of("Centripetal")).isEqualTo(ParametrizationMethod.CENTRIPETAL);
        assertThatThrownBy(() -> ParametrizationMethod.of("chord"))
            .isInstanceOfSatisfying(DxfValueException.class, e -> assertThat(e.getField()).isEqualTo("method"));
    }

    @Test
    void parameterVector_MustStartAtZeroAndIncrease() {
        assertThatThrownBy(() -> ParameterVector.of(0.1, 0.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ParameterVector.of(0.0, 0.5, 0.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(ParameterVector::of).isInstanceOf(IllegalArgumentException.class);
    }
}
