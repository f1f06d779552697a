package com.ryuqq.graphics.core.geometry;

import com.ryuqq.graphics.core.exception.DxfValueException;
import com.ryuqq.graphics.core.model.AttributeSet;
import com.ryuqq.graphics.core.model.Point3;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * SOLID, TRACE, 3DFACE 정점 정규화.
 *
 * <p>3개 또는 4개의 점을 정확히 4개의 정점으로 확장합니다.
 * 3개인 경우 네 번째 정점은 <strong>마지막</strong> 입력 점을 반복합니다.</p>
 *
 * <pre>
 * [A, B, C]    → [A, B, C, C]
 * [A, B, C, D] → [A, B, C, D]
 * </pre>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public final class QuadrilateralNormalizer {

    /**
     * 정점 속성 이름 접두사 (vtx0 ~ vtx3).
     */
    public static final String VERTEX_PREFIX = "vtx";

    // Utility class - prevent instantiation
    private QuadrilateralNormalizer() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 점 목록을 4개의 정점으로 정규화.
     *
     * @param points 3개 또는 4개의 점
     * @return 불변 4-정점 목록
     * @throws IllegalArgumentException points가 null이거나 null 요소를 포함하는 경우
     * @throws DxfValueException 점 개수가 3 또는 4가 아닌 경우
     */
    public static List<Point3> normalize(List<Point3> points) {
        if (points == null) {
            throw new IllegalArgumentException("points cannot be null");
        }
        if (points.size() != 3 && points.size() != 4) {
            throw new DxfValueException("points", "expected 3 or 4 points, got " + points.size());
        }
        List<Point3> vertices = new ArrayList<>(4);
        for (Point3 point : points) {
            if (point == null) {
                throw new IllegalArgumentException("points cannot contain null");
            }
            vertices.add(point);
        }
        if (vertices.size() == 3) {
            vertices.add(vertices.get(2));
        }
        return Collections.unmodifiableList(vertices);
    }

    /**
     * 정규화 후 정점 속성(vtx0 ~ vtx3)으로 변환.
     *
     * @param points 3개 또는 4개의 점
     * @return vtx0 ~ vtx3 속성
     */
    public static AttributeSet toAttributes(List<Point3> points) {
        List<Point3> vertices = normalize(points);
        AttributeSet.Builder builder = AttributeSet.builder();
        for (int i = 0; i < vertices.size(); i++) {
            builder.put(VERTEX_PREFIX + i, vertices.get(i));
        }
        return builder.build();
    }
}
