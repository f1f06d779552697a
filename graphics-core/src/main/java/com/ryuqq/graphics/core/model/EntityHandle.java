package com.ryuqq.graphics.core.model;

import java.util.regex.Pattern;

/**
 * 문서 데이터베이스가 할당한 엔티티 핸들.
 *
 * <p>DXF 핸들은 16진수 문자열이며, 문서 내에서 유일합니다.
 * 핸들 할당은 {@link com.ryuqq.graphics.core.spi.EntityCreator}의 책임입니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~16자</li>
 *   <li>패턴: 16진수 대문자 (예: 2F, 1A0)</li>
 * </ul>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public final class EntityHandle {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[0-9A-F]+$");

    private final String value;

    private EntityHandle(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("EntityHandle cannot be null or blank");
        }
        if (value.length() > 16) {
            throw new IllegalArgumentException("EntityHandle length cannot exceed 16 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("EntityHandle must be an uppercase hexadecimal string");
        }
        this.value = value;
    }

    /**
     * EntityHandle 생성.
     *
     * @param value 16진수 핸들 문자열
     * @return EntityHandle 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static EntityHandle of(String value) {
        return new EntityHandle(value);
    }

    /**
     * 정수 값으로부터 EntityHandle 생성.
     *
     * @param value 핸들 번호 (양수)
     * @return EntityHandle 인스턴스
     * @throws IllegalArgumentException value가 양수가 아닌 경우
     */
    public static EntityHandle of(long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("EntityHandle value must be positive (current: " + value + ")");
        }
        return new EntityHandle(Long.toHexString(value).toUpperCase());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EntityHandle that = (EntityHandle) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "EntityHandle{" + value + '}';
    }
}
