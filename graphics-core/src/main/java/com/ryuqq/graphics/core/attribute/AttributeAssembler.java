package com.ryuqq.graphics.core.attribute;

import com.ryuqq.graphics.core.model.AttributeSet;
import com.ryuqq.graphics.core.model.EntityKind;
import com.ryuqq.graphics.core.model.Flags;

/**
 * 기본값, 호출자 재정의, 계산된 속성을 하나의 {@link AttributeSet}으로 병합.
 *
 * <p><strong>우선순위 (낮음 → 높음):</strong></p>
 * <pre>
 * template (종류별 기본값) → overrides (호출자) → computed (항상 계산되는 필드)
 * </pre>
 *
 * <p><strong>Flags 병합:</strong> 한쪽 값이 {@link Flags}이면 덮어쓰지 않고 비트 OR로 병합합니다.
 * 따라서 호출자가 설정한 비트와 팩토리가 설정한 비트(예: POLYLINE 3D/mesh/polyface)가 모두 유지됩니다.</p>
 *
 * <p>입력은 모두 불변이며 항상 새 인스턴스를 반환합니다.</p>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public final class AttributeAssembler {

    // Utility class - prevent instantiation
    private AttributeAssembler() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 엔티티 종류의 템플릿 위에 재정의와 계산 필드를 병합.
     *
     * @param kind 엔티티 종류
     * @param overrides 호출자 재정의 (null 가능)
     * @param computed 계산된 필드 (null 가능)
     * @return 병합된 속성
     * @throws IllegalArgumentException kind가 null인 경우
     */
    public static AttributeSet assemble(EntityKind kind, AttributeSet overrides, AttributeSet computed) {
        AttributeSet.Builder builder = AttributeTemplates.of(kind).toBuilder();
        merge(builder, overrides);
        merge(builder, computed);
        return builder.build();
    }

    /**
     * 기본값 위에 재정의를 병합.
     *
     * @param defaults 기본값 (null 가능)
     * @param overrides 재정의 (null 가능)
     * @return 병합된 속성
     */
    public static AttributeSet assemble(AttributeSet defaults, AttributeSet overrides) {
        AttributeSet.Builder builder = AttributeSet.orEmpty(defaults).toBuilder();
        merge(builder, overrides);
        return builder.build();
    }

    private static void merge(AttributeSet.Builder target, AttributeSet source) {
        if (source == null) {
            return;
        }
        source.asMap().forEach((key, value) -> target.put(key, mergeValue(target.get(key), value)));
    }

    private static Object mergeValue(Object existing, Object incoming) {
        if (existing instanceof Flags flags && incoming instanceof Number number) {
            return flags.or(number.intValue());
        }
        if (incoming instanceof Flags flags) {
            if (existing instanceof Flags other) {
                return flags.or(other);
            }
            if (existing instanceof Number number) {
                return flags.or(number.intValue());
            }
        }
        return incoming;
    }
}
