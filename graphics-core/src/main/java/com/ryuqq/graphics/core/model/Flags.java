package com.ryuqq.graphics.core.model;

/**
 * 비트마스크 플래그 값.
 *
 * <p>DXF 엔티티의 {@code flags} 계열 속성(POLYLINE 모드, SPLINE 종류, DIMENSION 타입 등)을
 * 표현합니다. 일반 정수와 달리 병합 시 덮어쓰지 않고 {@link #or(Flags)}로 합쳐지므로,
 * 호출자가 미리 설정한 비트가 유지됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Flags callerFlags = Flags.of(PolylineFlags.CLOSED);
 * Flags merged = callerFlags.or(Flags.of(PolylineFlags.POLYLINE_3D));  // 1 | 8 = 9
 * merged.has(PolylineFlags.CLOSED);                                    // true
 * </pre>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public final class Flags {

    private static final Flags NONE = new Flags(0);

    private final int value;

    private Flags(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("Flags value cannot be negative (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * Flags 생성.
     *
     * @param value 비트마스크 값 (0 이상)
     * @return Flags 인스턴스
     * @throws IllegalArgumentException 음수인 경우
     */
    public static Flags of(int value) {
        return value == 0 ? NONE : new Flags(value);
    }

    /**
     * 비트가 하나도 설정되지 않은 Flags.
     *
     * @return 값이 0인 Flags
     */
    public static Flags none() {
        return NONE;
    }

    /**
     * 비트 OR 병합.
     *
     * @param other 병합할 플래그
     * @return 두 플래그의 비트 OR 결과
     */
    public Flags or(Flags other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        return of(value | other.value);
    }

    /**
     * 비트 OR 병합.
     *
     * @param bits 병합할 비트
     * @return 비트 OR 결과
     */
    public Flags or(int bits) {
        return of(value | bits);
    }

    /**
     * 지정 비트가 모두 설정되어 있는지 확인.
     *
     * @param bits 확인할 비트
     * @return 모든 비트가 설정되어 있으면 true
     */
    public boolean has(int bits) {
        return (value & bits) == bits;
    }

    public int getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Flags flags = (Flags) o;
        return value == flags.value;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(value);
    }

    @Override
    public String toString() {
        return "Flags{" + value + '}';
    }
}
