package com.ryuqq.graphics.core.dimension;

import com.ryuqq.graphics.core.attribute.AttributeAssembler;
import com.ryuqq.graphics.core.exception.DxfValueException;
import com.ryuqq.graphics.core.model.AttributeSet;
import com.ryuqq.graphics.core.model.DimensionTypeFlags;
import com.ryuqq.graphics.core.model.EntityKind;
import com.ryuqq.graphics.core.model.Flags;
import com.ryuqq.graphics.core.model.Point3;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 치수 요청 조립기.
 *
 * <p>측정점과 오프셋으로부터 DIMENSION 엔티티 속성(defpoint, angle 등)과
 * 스타일 재정의를 계산하여 {@link DimensionRequest}를 반환합니다. 기하 렌더링은 하지 않습니다.</p>
 *
 * <p><strong>LINEAR:</strong></p>
 * <pre>
 * dimtype   = LINEAR | BLOCK_EXCLUSIVE
 * defpoint  = base (치수선 위의 임의 점)
 * defpoint2 = p1, defpoint3 = p2
 * angle     = 치수선 각도 (0 = 수평, 90 = 수직)
 * </pre>
 *
 * <p><strong>ALIGNED:</strong> {@code direction = p2 - p1}로부터 각도와 기준점을 계산한 뒤
 * LINEAR로 위임합니다. 별도의 코드 경로는 없습니다.</p>
 *
 * <p><strong>text_rotation:</strong> 지정하면 절대 각도로서 치수선 방향에서 유도되는
 * 텍스트 방향을 항상 대체합니다 (0 = 수평).</p>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public final class DimensionGeometryResolver {

    /**
     * 측정값을 텍스트로 표시하는 기본 텍스트.
     */
    public static final String MEASUREMENT_TEXT = "<>";

    private final String defaultStyle;

    /**
     * 기본 스타일 이름으로 생성.
     *
     * @param defaultStyle style 인자가 null일 때 사용할 치수 스타일
     * @throws IllegalArgumentException defaultStyle이 null이거나 비어있는 경우
     */
    public DimensionGeometryResolver(String defaultStyle) {
        if (defaultStyle == null || defaultStyle.isBlank()) {
            throw new IllegalArgumentException("defaultStyle cannot be null or blank");
        }
        this.defaultStyle = defaultStyle;
    }

    public String getDefaultStyle() {
        return defaultStyle;
    }

    /**
     * 수평, 수직, 회전 선형 치수.
     *
     * @param base 치수선 위치 (치수선 또는 그 연장선 위의 임의 점)
     * @param p1 측정점 1 (보조선 1 시작점)
     * @param p2 측정점 2 (보조선 2 시작점)
     * @param location 사용자 지정 텍스트 중심 (null 가능)
     * @param text 치수 텍스트 (null이면 측정값 "&lt;&gt;")
     * @param angle x축에서 치수선까지의 각도 (도)
     * @param textRotation 절대 텍스트 회전 (null이면 설정하지 않음)
     * @param style 치수 스타일 (null이면 기본 스타일)
     * @param override 스타일 재정의 (null 가능)
     * @param attribs DIMENSION 엔티티 추가 속성 (null 가능)
     * @return 조립된 요청
     */
    public DimensionRequest resolveLinear(Point3 base, Point3 p1, Point3 p2, Point3 location, String text,
                                          double angle, Double textRotation, String style,
                                          AttributeSet override, AttributeSet attribs) {
        requirePoint(base, "base");
        requirePoint(p1, "p1");
        requirePoint(p2, "p2");
        String styleName = styleOrDefault(style);

        AttributeSet.Builder computed = AttributeSet.builder()
            .put("dimtype", location == null
                ? DimensionKind.LINEAR.dimtype()
                : DimensionKind.LINEAR.dimtype().or(DimensionTypeFlags.USER_LOCATION_OVERRIDE))
            .put("dimstyle", styleName)
            .put("defpoint", base)
            .put("text", text == null ? MEASUREMENT_TEXT : text)
            .put("defpoint2", p1)
            .put("defpoint3", p2)
            .put("angle", angle);
        if (textRotation != null) {
            computed.put("text_rotation", textRotation.doubleValue());
        }
        if (location != null) {
            computed.put("text_midpoint", location);
        }
        AttributeSet attributes = AttributeAssembler.assemble(EntityKind.DIMENSION, attribs, computed.build());
        return new DimensionRequest(DimensionKind.LINEAR, attributes, styleName, override, location);
    }

    /**
     * 측정점 p1, p2에 평행한 선형 치수.
     *
     * <pre>
     * direction = p2 - p1
     * angle     = direction.angleDeg()
     * base      = direction.orthogonal().normalize(distance)
     * </pre>
     *
     * <p>distance의 부호가 치수선이 놓이는 쪽을 결정합니다 (음수이면 반대쪽).</p>
     *
     * @param p1 측정점 1
     * @param p2 측정점 2
     * @param distance 측정점으로부터 치수선까지의 거리
     * @param text 치수 텍스트 (null이면 측정값)
     * @param style 치수 스타일 (null이면 기본 스타일)
     * @param override 스타일 재정의 (null 가능)
     * @param attribs DIMENSION 엔티티 추가 속성 (null 가능)
     * @return LINEAR 요청
     * @throws DxfValueException p1과 p2가 일치하는 경우
     */
    public DimensionRequest resolveAligned(Point3 p1, Point3 p2, double distance, String text, String style,
                                           AttributeSet override, AttributeSet attribs) {
        requirePoint(p1, "p1");
        requirePoint(p2, "p2");
        Point3 direction = p2.subtract(p1);
        if (direction.isNull()) {
            throw new DxfValueException("p2", "measurement points p1 and p2 are coincident");
        }
        double angle = direction.angleDeg();
        Point3 base = direction.orthogonal().normalize(distance);
        return resolveLinear(base, p1, p2, null, text, angle, null, style, override, attribs);
    }

    /**
     * 연속 선형 치수 (연속한 측정점 쌍마다 하나).
     *
     * <p>모든 요청의 재정의에 {@code dimtix=1}, {@code dimtvp=0}이 설정됩니다.
     * avoidDoubleRendering이면 두 번째 요청부터 보조선 1을 억제({@code dimse1=1})하고,
     * 화살표 1이 원점 연결 형태이면 화살표 1도 억제({@code dimblk1=NONE})합니다.
     * {@code dimtsz > 0}(틱 사용)도 같은 경우로 보며, 화살표 1의 이름은 {@code dimsah}가 설정된 경우에만
     * {@code dimblk1}, 그 밖에는 {@code dimblk}에서 읽습니다.</p>
     *
     * @param base 치수선 위치
     * @param points 측정점 (2개 이상)
     * @param angle 치수선 각도 (도)
     * @param avoidDoubleRendering 이웃 치수와 겹치는 보조선/화살표 억제 여부
     * @param style 치수 스타일 (null이면 기본 스타일)
     * @param override 스타일 재정의 (null 가능)
     * @param attribs DIMENSION 엔티티 추가 속성 (null 가능)
     * @return points.size() - 1개의 요청 (순서 유지)
     * @throws DxfValueException 측정점이 2개 미만인 경우
     */
    public List<DimensionRequest> resolveMultiPointLinear(Point3 base, List<Point3> points, double angle,
                                                          boolean avoidDoubleRendering, String style,
                                                          AttributeSet override, AttributeSet attribs) {
        requirePoint(base, "base");
        if (points == null) {
            throw new IllegalArgumentException("points cannot be null");
        }
        if (points.size() < 2) {
            throw new DxfValueException("points", "at least 2 measurement points required, got " + points.size());
        }
        AttributeSet continued = AttributeSet.orEmpty(override).toBuilder()
            .put("dimtix", 1)
            .put("dimtvp", 0)
            .build();
        boolean tickArrow = usesTickSize(continued) || ArrowNames.isOriginZero(firstArrow(continued));

        List<DimensionRequest> requests = new ArrayList<>(points.size() - 1);
        for (int i = 1; i < points.size(); i++) {
            AttributeSet requestOverride = continued;
            if (avoidDoubleRendering && i > 1) {
                requestOverride = requestOverride.with("dimse1", 1);
                if (tickArrow) {
                    requestOverride = requestOverride.with("dimblk1", ArrowNames.NONE);
                }
            }
            requests.add(resolveLinear(
                base, points.get(i - 1), points.get(i), null, null, angle, null, style, requestOverride, attribs
            ));
        }
        return Collections.unmodifiableList(requests);
    }

    /**
     * 기하를 계산하지 않는 치수 종류 (ANGULAR, ANGULAR_3P, DIAMETER, RADIUS, ORDINATE).
     *
     * @param kind 치수 종류
     * @param style 치수 스타일 (null이면 기본 스타일)
     * @param override 스타일 재정의 (null 가능)
     * @param attribs DIMENSION 엔티티 속성 (null 가능)
     * @return 타입 플래그와 재정의만 담은 요청
     * @throws IllegalArgumentException kind가 null이거나 LINEAR/ALIGNED인 경우
     */
    public DimensionRequest resolve(DimensionKind kind, String style, AttributeSet override, AttributeSet attribs) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (kind.hasDerivedGeometry()) {
            throw new IllegalArgumentException(kind + " requires measurement points, use resolveLinear/resolveAligned");
        }
        String styleName = styleOrDefault(style);
        AttributeSet computed = AttributeSet.builder()
            .put("dimtype", kind.dimtype())
            .put("dimstyle", styleName)
            .build();
        AttributeSet attributes = AttributeAssembler.assemble(EntityKind.DIMENSION, attribs, computed);
        return new DimensionRequest(kind, attributes, styleName, override, null);
    }

    private String styleOrDefault(String style) {
        return style == null || style.isBlank() ? defaultStyle : style;
    }

    // dimtsz > 0: 화살표 블록 대신 틱
    private static boolean usesTickSize(AttributeSet override) {
        return override.get("dimtsz") instanceof Number size && size.doubleValue() > 0.0;
    }

    // dimsah가 설정된 경우에만 dimblk1 사용
    private static String firstArrow(AttributeSet override) {
        Object arrow = isSet(override.get("dimsah")) ? override.get("dimblk1") : override.get("dimblk");
        return arrow instanceof String name ? name : null;
    }

    private static boolean isSet(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        return value instanceof Number number && number.intValue() != 0;
    }

    private static void requirePoint(Point3 point, String name) {
        if (point == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }
}
