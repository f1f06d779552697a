package com.ryuqq.graphics.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 엔티티 속성 집합 (속성 이름 → 값).
 *
 * <p>AttributeSet은 DXF 엔티티 하나를 생성하는 데 필요한 속성을 담으며,
 * 엔티티 생성 협력자({@link com.ryuqq.graphics.core.spi.EntityCreator})에 그대로 전달됩니다.</p>
 *
 * <p><strong>허용되는 값 타입:</strong></p>
 * <ul>
 *   <li>{@link Number}, {@link String}, {@link Boolean}</li>
 *   <li>{@link Point3}, {@link Flags}</li>
 *   <li>{@link List} (위 타입 또는 중첩 AttributeSet의 목록, 불변 복사본으로 저장)</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> {@link #with(String, Object)}, {@link #without(String)}은
 * 새 인스턴스를 반환합니다. 키 순서는 삽입 순서를 따릅니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * AttributeSet attribs = AttributeSet.builder()
 *     .put("layer", "WALLS")
 *     .put("color", 1)
 *     .build();
 * AttributeSet moved = attribs.with("start", Point3.of(1, 2));
 * </pre>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public final class AttributeSet {

    private static final AttributeSet EMPTY = new AttributeSet(Collections.emptyMap());

    private final Map<String, Object> values;

    private AttributeSet(Map<String, Object> values) {
        this.values = values;
    }

    /**
     * 빈 AttributeSet.
     *
     * @return 속성이 없는 인스턴스
     */
    public static AttributeSet empty() {
        return EMPTY;
    }

    /**
     * Map으로부터 AttributeSet 생성.
     *
     * @param values 속성 이름 → 값 (null이면 빈 집합)
     * @return AttributeSet 인스턴스
     * @throws IllegalArgumentException 키가 비어있거나 값 타입이 허용되지 않는 경우
     */
    public static AttributeSet of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        Builder builder = builder();
        values.forEach(builder::put);
        return builder.build();
    }

    /**
     * null을 빈 집합으로 치환.
     *
     * @param attributes AttributeSet (null 가능)
     * @return attributes 또는 빈 집합
     */
    public static AttributeSet orEmpty(AttributeSet attributes) {
        return attributes == null ? EMPTY : attributes;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 이 집합의 내용을 복사한 새 Builder.
     *
     * @return Builder
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.values.putAll(values);
        return builder;
    }

    /**
     * 속성 하나를 추가(또는 교체)한 새 집합.
     *
     * @param key 속성 이름
     * @param value 속성 값
     * @return 새 AttributeSet
     */
    public AttributeSet with(String key, Object value) {
        return toBuilder().put(key, value).build();
    }

    /**
     * 속성 하나를 제거한 새 집합.
     *
     * @param key 속성 이름
     * @return 새 AttributeSet (키가 없으면 this)
     */
    public AttributeSet without(String key) {
        if (!values.containsKey(key)) {
            return this;
        }
        Builder builder = toBuilder();
        builder.values.remove(key);
        return builder.build();
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    /**
     * 속성 값 조회.
     *
     * @param key 속성 이름
     * @return 값 또는 null (없는 경우)
     */
    public Object get(String key) {
        return values.get(key);
    }

    public String getString(String key) {
        return typed(key, String.class);
    }

    public Point3 getPoint(String key) {
        return typed(key, Point3.class);
    }

    public Flags getFlags(String key) {
        Object value = values.get(key);
        if (value instanceof Number number) {
            return Flags.of(number.intValue());
        }
        return typed(key, Flags.class);
    }

    /**
     * 숫자 속성 조회.
     *
     * @param key 속성 이름
     * @return double 값 또는 null (없는 경우)
     * @throws IllegalStateException 값이 숫자가 아닌 경우
     */
    public Double getDouble(String key) {
        Number number = typed(key, Number.class);
        return number == null ? null : number.doubleValue();
    }

    public Integer getInt(String key) {
        Number number = typed(key, Number.class);
        return number == null ? null : number.intValue();
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Boolean value = typed(key, Boolean.class);
        return value == null ? defaultValue : value;
    }

    /**
     * 목록 속성 조회.
     *
     * @param key 속성 이름
     * @param elementType 요소 타입
     * @param <T> 요소 타입
     * @return 불변 목록 또는 null (없는 경우)
     * @throws IllegalStateException 값이 목록이 아니거나 요소 타입이 다른 경우
     */
    @SuppressWarnings("unchecked")
    public <T> List<T> getList(String key, Class<T> elementType) {
        List<?> list = typed(key, List.class);
        if (list == null) {
            return null;
        }
        for (Object element : list) {
            if (!elementType.isInstance(element)) {
                throw new IllegalStateException(
                    "Attribute '" + key + "' contains " + element.getClass().getSimpleName()
                        + ", expected " + elementType.getSimpleName()
                );
            }
        }
        return (List<T>) list;
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * 읽기 전용 Map 뷰.
     *
     * @return 수정 불가능한 Map
     */
    public Map<String, Object> asMap() {
        return values;
    }

    private <T> T typed(String key, Class<T> type) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (!type.isInstance(value)) {
            throw new IllegalStateException(
                "Attribute '" + key + "' is " + value.getClass().getSimpleName()
                    + ", expected " + type.getSimpleName()
            );
        }
        return type.cast(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AttributeSet that = (AttributeSet) o;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "AttributeSet" + values;
    }

    /**
     * AttributeSet Builder.
     *
     * <p>Builder 자체는 가변이며 스레드 간 공유하지 않습니다.</p>
     */
    public static final class Builder {

        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * 속성 추가 (같은 키가 있으면 교체).
         *
         * @param key 속성 이름
         * @param value 속성 값
         * @return this
         * @throws IllegalArgumentException 키가 비어있거나 값이 null 또는 허용되지 않는 타입인 경우
         */
        public Builder put(String key, Object value) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("Attribute key cannot be null or blank");
            }
            values.put(key, checked(key, value));
            return this;
        }

        public Builder putAll(AttributeSet attributes) {
            if (attributes != null) {
                values.putAll(attributes.values);
            }
            return this;
        }

        public Builder remove(String key) {
            values.remove(key);
            return this;
        }

        public boolean contains(String key) {
            return values.containsKey(key);
        }

        public Object get(String key) {
            return values.get(key);
        }

        public AttributeSet build() {
            if (values.isEmpty()) {
                return EMPTY;
            }
            return new AttributeSet(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }

        private static Object checked(String key, Object value) {
            if (value == null) {
                throw new IllegalArgumentException("Attribute '" + key + "' cannot be null");
            }
            if (value instanceof Number || value instanceof String || value instanceof Boolean
                || value instanceof Point3 || value instanceof Flags || value instanceof AttributeSet) {
                return value;
            }
            if (value instanceof List<?> list) {
                List<Object> copy = new ArrayList<>(list.size());
                for (Object element : list) {
                    copy.add(checked(key, element));
                }
                return Collections.unmodifiableList(copy);
            }
            throw new IllegalArgumentException(
                "Attribute '" + key + "' has unsupported type: " + value.getClass().getName()
            );
        }
    }
}
