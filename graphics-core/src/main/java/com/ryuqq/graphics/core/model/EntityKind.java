package com.ryuqq.graphics.core.model;

/**
 * 생성 가능한 DXF 엔티티 종류와 최소 요구 포맷 버전.
 *
 * <p>엔티티별 버전 요구사항은 이 enum 한 곳에만 정의되며,
 * {@link com.ryuqq.graphics.core.version.VersionGate}가 이 값을 조회합니다.</p>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public enum EntityKind {

    POINT("POINT", FormatVersion.R12),
    LINE("LINE", FormatVersion.R12),
    CIRCLE("CIRCLE", FormatVersion.R12),
    ARC("ARC", FormatVersion.R12),
    SOLID("SOLID", FormatVersion.R12),
    TRACE("TRACE", FormatVersion.R12),
    FACE3D("3DFACE", FormatVersion.R12),
    TEXT("TEXT", FormatVersion.R12),
    INSERT("INSERT", FormatVersion.R12),
    ATTRIB("ATTRIB", FormatVersion.R12),
    ATTDEF("ATTDEF", FormatVersion.R12),
    POLYLINE("POLYLINE", FormatVersion.R12),
    SHAPE("SHAPE", FormatVersion.R12),
    DIMENSION("DIMENSION", FormatVersion.R12),

    ELLIPSE("ELLIPSE", FormatVersion.R2000),
    LWPOLYLINE("LWPOLYLINE", FormatVersion.R2000),
    MTEXT("MTEXT", FormatVersion.R2000),
    RAY("RAY", FormatVersion.R2000),
    XLINE("XLINE", FormatVersion.R2000),
    SPLINE("SPLINE", FormatVersion.R2000),
    BODY("BODY", FormatVersion.R2000),
    REGION("REGION", FormatVersion.R2000),
    SOLID3D("3DSOLID", FormatVersion.R2000),
    HATCH("HATCH", FormatVersion.R2000),
    MESH("MESH", FormatVersion.R2000),
    IMAGE("IMAGE", FormatVersion.R2000),
    PDFUNDERLAY("PDFUNDERLAY", FormatVersion.R2000),
    DWFUNDERLAY("DWFUNDERLAY", FormatVersion.R2000),
    DGNUNDERLAY("DGNUNDERLAY", FormatVersion.R2000),

    SURFACE("SURFACE", FormatVersion.R2007),
    EXTRUDEDSURFACE("EXTRUDEDSURFACE", FormatVersion.R2007),
    LOFTEDSURFACE("LOFTEDSURFACE", FormatVersion.R2007),
    REVOLVEDSURFACE("REVOLVEDSURFACE", FormatVersion.R2007),
    SWEPTSURFACE("SWEPTSURFACE", FormatVersion.R2007);

    private final String dxfType;
    private final FormatVersion minVersion;

    EntityKind(String dxfType, FormatVersion minVersion) {
        this.dxfType = dxfType;
        this.minVersion = minVersion;
    }

    /**
     * DXF 타입 문자열 (예: 3DFACE, LWPOLYLINE).
     *
     * @return DXF 타입 이름
     */
    public String getDxfType() {
        return dxfType;
    }

    /**
     * 이 엔티티를 쓰기 위해 필요한 최소 포맷 버전.
     *
     * @return 최소 버전
     */
    public FormatVersion getMinVersion() {
        return minVersion;
    }

    /**
     * ACIS 데이터를 담는 엔티티(BODY 계열, SURFACE 계열)인지 확인.
     *
     * @return ACIS 엔티티이면 true
     */
    public boolean isAcis() {
        return switch (this) {
            case BODY, REGION, SOLID3D, SURFACE, EXTRUDEDSURFACE,
                 LOFTEDSURFACE, REVOLVEDSURFACE, SWEPTSURFACE -> true;
            default -> false;
        };
    }

    /**
     * DXF 타입 문자열로 조회.
     *
     * @param dxfType DXF 타입 (예: "3DFACE")
     * @return EntityKind
     * @throws IllegalArgumentException 알 수 없는 타입인 경우
     */
    public static EntityKind fromDxfType(String dxfType) {
        if (dxfType == null || dxfType.isBlank()) {
            throw new IllegalArgumentException("dxfType cannot be null or blank");
        }
        for (EntityKind kind : values()) {
            if (kind.dxfType.equalsIgnoreCase(dxfType.trim())) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown DXF entity type: " + dxfType);
    }
}
