package com.ryuqq.graphics.core.attribute;

import com.ryuqq.graphics.core.model.AttributeSet;
import com.ryuqq.graphics.core.model.EntityKind;
import com.ryuqq.graphics.core.model.Flags;
import com.ryuqq.graphics.core.model.Point3;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 엔티티 종류별 기본 속성 템플릿.
 *
 * <p>템플릿은 클래스 로딩 시 한 번 생성되는 불변 {@link AttributeSet}이며,
 * 호출자는 {@link #of(EntityKind)}로 받은 값을 기반으로 새 집합을 만듭니다.
 * 템플릿 자체가 변경되는 경로는 없습니다.</p>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public final class AttributeTemplates {

    /**
     * 모든 엔티티의 기본 레이어.
     */
    public static final String DEFAULT_LAYER = "0";

    private static final Map<EntityKind, AttributeSet> TEMPLATES = createTemplates();

    // Utility class - prevent instantiation
    private AttributeTemplates() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 엔티티 종류의 기본 속성.
     *
     * @param kind 엔티티 종류
     * @return 불변 템플릿
     * @throws IllegalArgumentException kind가 null인 경우
     */
    public static AttributeSet of(EntityKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        return TEMPLATES.get(kind);
    }

    private static Map<EntityKind, AttributeSet> createTemplates() {
        Map<EntityKind, AttributeSet> templates = new EnumMap<>(EntityKind.class);
        for (EntityKind kind : EntityKind.values()) {
            AttributeSet.Builder builder = AttributeSet.builder().put("layer", DEFAULT_LAYER);
            switch (kind) {
                case TEXT, ATTRIB, ATTDEF -> builder
                    .put("insert", Point3.ORIGIN)
                    .put("height", 2.5)
                    .put("rotation", 0.0);
                case MTEXT -> builder
                    .put("insert", Point3.ORIGIN)
                    .put("char_height", 2.5);
                case ELLIPSE -> builder
                    .put("major_axis", Point3.of(1, 0, 0))
                    .put("ratio", 1.0)
                    .put("start_param", 0.0)
                    .put("end_param", 2 * Math.PI);
                case INSERT -> builder
                    .put("xscale", 1.0)
                    .put("yscale", 1.0)
                    .put("zscale", 1.0)
                    .put("rotation", 0.0);
                case SHAPE -> builder
                    .put("insert", Point3.ORIGIN)
                    .put("size", 1.0);
                case POLYLINE, LWPOLYLINE, SPLINE -> builder.put("flags", Flags.none());
                case HATCH -> builder
                    .put("color", 7)
                    .put("pattern_name", "SOLID")
                    .put("solid_fill", 1);
                case IMAGE -> builder.put("flags", Flags.of(3));
                case PDFUNDERLAY, DWFUNDERLAY, DGNUNDERLAY -> builder
                    .put("insert", Point3.ORIGIN)
                    .put("rotation", 0.0)
                    .put("scale_x", 1.0)
                    .put("scale_y", 1.0)
                    .put("scale_z", 1.0);
                default -> {
                    // layer only
                }
            }
            templates.put(kind, builder.build());
        }
        return Collections.unmodifiableMap(templates);
    }
}
