package com.ryuqq.graphics.core.spline;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 맞춤점에 대응하는 파라미터 값 시퀀스.
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>첫 값은 0</li>
 *   <li>값은 엄격하게 증가</li>
 * </ul>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public final class ParameterVector {

    private final double[] values;

    private ParameterVector(double[] values) {
        this.values = values;
    }

    /**
     * 파라미터 값으로부터 생성.
     *
     * @param values 파라미터 값 (복사됨)
     * @return ParameterVector 인스턴스
     * @throws IllegalArgumentException 비어있거나, 0에서 시작하지 않거나, 엄격하게 증가하지 않는 경우
     */
    public static ParameterVector of(double... values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("ParameterVector cannot be empty");
        }
        if (values[0] != 0.0) {
            throw new IllegalArgumentException("ParameterVector must start at 0, got " + values[0]);
        }
        for (int i = 1; i < values.length; i++) {
            if (!(values[i] > values[i - 1])) {
                throw new IllegalArgumentException(
                    "ParameterVector must be strictly increasing (index " + i + ": "
                        + values[i - 1] + " → " + values[i] + ")"
                );
            }
        }
        return new ParameterVector(values.clone());
    }

    public double get(int index) {
        return values[index];
    }

    public int size() {
        return values.length;
    }

    public double last() {
        return values[values.length - 1];
    }

    /**
     * 배열 복사본.
     *
     * @return 파라미터 값 배열
     */
    public double[] toArray() {
        return values.clone();
    }

    public List<Double> asList() {
        List<Double> list = new ArrayList<>(values.length);
        for (double value : values) {
            list.add(value);
        }
        return Collections.unmodifiableList(list);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParameterVector that = (ParameterVector) o;
        return Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "ParameterVector" + Arrays.toString(values);
    }
}
