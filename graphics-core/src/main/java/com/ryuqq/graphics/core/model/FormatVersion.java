package com.ryuqq.graphics.core.model;

/**
 * DXF 파일 포맷 버전.
 *
 * <p>선언 순서가 곧 버전 순서이며, {@link #isAtLeast(FormatVersion)}로 비교합니다.</p>
 *
 * <pre>
 * R12 (AC1009) &lt; R2000 (AC1015) &lt; R2004 (AC1018) &lt; R2007 (AC1021)
 *     &lt; R2010 (AC1024) &lt; R2013 (AC1027) &lt; R2018 (AC1032)
 * </pre>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public enum FormatVersion {

    R12("AC1009"),
    R2000("AC1015"),
    R2004("AC1018"),
    R2007("AC1021"),
    R2010("AC1024"),
    R2013("AC1027"),
    R2018("AC1032");

    private final String dxfCode;

    FormatVersion(String dxfCode) {
        this.dxfCode = dxfCode;
    }

    /**
     * DXF 헤더의 $ACADVER 값 (예: AC1015).
     *
     * @return DXF 버전 코드
     */
    public String getDxfCode() {
        return dxfCode;
    }

    /**
     * 이 버전이 지정 버전 이상인지 확인.
     *
     * @param other 비교 대상 버전
     * @return this &gt;= other이면 true
     */
    public boolean isAtLeast(FormatVersion other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        return compareTo(other) >= 0;
    }

    /**
     * 이름(R2000) 또는 DXF 코드(AC1015)로 버전 조회.
     *
     * @param value 버전 이름 또는 DXF 코드 (대소문자 무시)
     * @return FormatVersion
     * @throws IllegalArgumentException 알 수 없는 버전인 경우
     */
    public static FormatVersion of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("FormatVersion cannot be null or blank");
        }
        String normalized = value.trim().toUpperCase();
        for (FormatVersion version : values()) {
            if (version.name().equals(normalized) || version.dxfCode.equals(normalized)) {
                return version;
            }
        }
        throw new IllegalArgumentException("Unknown DXF version: " + value);
    }
}
