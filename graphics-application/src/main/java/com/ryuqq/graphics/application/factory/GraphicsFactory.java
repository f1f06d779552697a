package com.ryuqq.graphics.application.factory;

import com.ryuqq.graphics.core.exception.DxfValueException;
import com.ryuqq.graphics.core.exception.DxfVersionException;
import com.ryuqq.graphics.core.model.AttributeSet;
import com.ryuqq.graphics.core.model.EntityHandle;
import com.ryuqq.graphics.core.model.Point3;

import java.util.List;
import java.util.Map;

/**
 * 그래픽 엔티티 팩토리.
 *
 * <p>기하학적 의도(맞춤점, 측정점, 사각형 정점 등)로부터 엔티티 속성을 계산하고,
 * 포맷 버전 사전조건을 검사한 뒤 엔티티 생성 협력자에 전달합니다.</p>
 *
 * <p><strong>공통 규칙:</strong></p>
 * <ul>
 *   <li>모든 {@code attribs} 인자는 null 가능하며 엔티티 기본 속성을 재정의합니다</li>
 *   <li>계산된 필드(정점, 제어점, defpoint 등)는 {@code attribs}보다 우선합니다</li>
 *   <li>{@code flags} 속성은 덮어쓰지 않고 비트 OR로 병합됩니다</li>
 *   <li>검증 실패 시 어떤 엔티티도 생성되지 않습니다</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * GraphicsFactory factory = new DefaultGraphicsFactory(config, modelspace, blocks, dimRenderer, arrows);
 * factory.addLine(Point3.of(0, 0), Point3.of(10, 0), null);
 * factory.addSplineControlFrame(fitPoints, 3, "centripetal", 0.5, null);
 * factory.addAlignedDim(Point3.of(0, 0), Point3.of(10, 0), 5, null, null, null, null).render();
 * </pre>
 *
 * @author Graphics Team
 * @since 1.0.0
 * @see DxfVersionException
 * @see DxfValueException
 */
public interface GraphicsFactory {

    EntityHandle addPoint(Point3 location, AttributeSet attribs);

    EntityHandle addLine(Point3 start, Point3 end, AttributeSet attribs);

    EntityHandle addCircle(Point3 center, double radius, AttributeSet attribs);

    /**
     * ELLIPSE 추가 (R2000+).
     *
     * @param center 중심
     * @param majorAxis 주축 벡터 (중심 기준)
     * @param ratio 보조축/주축 비율 (ratio ≤ 1)
     * @param startParam 시작 파라미터 (라디안)
     * @param endParam 끝 파라미터 (라디안)
     * @param attribs 추가 속성
     * @return 생성된 엔티티 핸들
     * @throws DxfValueException ratio가 1보다 큰 경우 (field: "ratio")
     */
    EntityHandle addEllipse(Point3 center, Point3 majorAxis, double ratio, double startParam, double endParam,
                            AttributeSet attribs);

    /**
     * ARC 추가.
     *
     * <p>시계 방향 호는 시작/끝 각도를 바꿔 반시계 방향으로 저장합니다.</p>
     *
     * @param counterClockwise false이면 시계 방향
     */
    EntityHandle addArc(Point3 center, double radius, double startAngle, double endAngle, boolean counterClockwise,
                        AttributeSet attribs);

    /**
     * SOLID 추가 (3개 또는 4개의 정점).
     *
     * @throws DxfValueException 점 개수가 3 또는 4가 아닌 경우
     */
    EntityHandle addSolid(List<Point3> points, AttributeSet attribs);

    EntityHandle addTrace(List<Point3> points, AttributeSet attribs);

    EntityHandle add3dFace(List<Point3> points, AttributeSet attribs);

    EntityHandle addText(String text, AttributeSet attribs);

    EntityHandle addBlockRef(String name, Point3 insert, AttributeSet attribs);

    /**
     * 블록의 ATTDEF마다 ATTRIB을 자동 생성한 블록 참조 추가.
     *
     * <p>블록 참조와 ATTRIB은 새 익명 블록에 담기고, 반환되는 핸들은
     * 그 익명 블록을 참조하는 INSERT입니다.</p>
     *
     * @param name 블록 이름
     * @param insert 삽입점
     * @param values tag → 값 (없는 tag는 빈 문자열)
     * @param attribs INSERT 추가 속성
     * @return 익명 블록 INSERT 핸들
     */
    EntityHandle addAutoBlockRef(String name, Point3 insert, Map<String, String> values, AttributeSet attribs);

    EntityHandle addAttrib(String tag, String text, Point3 insert, AttributeSet attribs);

    /**
     * 2D POLYLINE 추가. {@code attribs}의 {@code closed}(boolean)는 CLOSED 비트로 변환됩니다.
     */
    EntityHandle addPolyline2d(List<Point3> points, AttributeSet attribs);

    EntityHandle addPolyline3d(List<Point3> points, AttributeSet attribs);

    /**
     * m × n 정점 격자의 POLYMESH 추가.
     *
     * <p>각 방향 크기는 최소 2로 보정되며 정점은 원점으로 초기화됩니다.
     * {@code m_close}, {@code n_close}(boolean)는 방향별 닫힘 비트로 변환됩니다.</p>
     */
    EntityHandle addPolymesh(int mSize, int nSize, AttributeSet attribs);

    EntityHandle addPolyface(AttributeSet attribs);

    EntityHandle addShape(String name, Point3 insert, double size, AttributeSet attribs);

    /**
     * LWPOLYLINE 추가 (R2000+).
     *
     * @param points 사용자 포맷의 점 (x, y, [start_width, [end_width, [bulge]]])
     * @param format x, y, s, e, b의 순서 (null이면 "xyseb")
     * @param attribs 추가 속성 ({@code closed} 포함 가능)
     */
    EntityHandle addLwPolyline(List<double[]> points, String format, AttributeSet attribs);

    EntityHandle addMText(String text, AttributeSet attribs);

    EntityHandle addRay(Point3 start, Point3 unitVector, AttributeSet attribs);

    EntityHandle addXLine(Point3 start, Point3 unitVector, AttributeSet attribs);

    /**
     * 맞춤점만 가진 SPLINE 추가. 제어점은 CAD 애플리케이션이 계산합니다.
     *
     * @param fitPoints 맞춤점 (null이면 빈 스플라인)
     */
    EntityHandle addSpline(List<Point3> fitPoints, int degree, AttributeSet attribs);

    /**
     * 맞춤점을 지나는 열린 B-spline 제어 프레임 추가.
     *
     * @param method "uniform", "distance", "centripetal"
     * @param power centripetal 지수
     * @throws DxfValueException 알 수 없는 method이거나 맞춤점이 부족한 경우
     */
    EntityHandle addSplineControlFrame(List<Point3> fitPoints, int degree, String method, double power,
                                       AttributeSet attribs);

    /**
     * 설정의 기본 차수, 방식, 지수를 사용하는 {@link #addSplineControlFrame}.
     */
    EntityHandle addSplineControlFrame(List<Point3> fitPoints, AttributeSet attribs);

    /**
     * 맞춤점을 지나는 닫힌(주기적) B-spline 제어 프레임 추가.
     */
    EntityHandle addClosedSplineControlFrame(List<Point3> fitPoints, int degree, String method, double power,
                                             AttributeSet attribs);

    /**
     * count개의 제어점으로 맞춤점을 근사하는 B-spline 추가.
     *
     * @throws DxfValueException degree &lt; count &lt; 맞춤점 개수를 만족하지 않는 경우
     */
    EntityHandle addSplineApprox(List<Point3> fitPoints, int count, int degree, String method, double power,
                                 AttributeSet attribs);

    /**
     * 제어점으로 정의한 열린 균등 SPLINE.
     *
     * @param knots 매듭 값 (null이면 open uniform)
     */
    EntityHandle addOpenSpline(List<Point3> controlPoints, int degree, List<Double> knots, AttributeSet attribs);

    EntityHandle addClosedSpline(List<Point3> controlPoints, int degree, List<Double> knots, AttributeSet attribs);

    EntityHandle addRationalSpline(List<Point3> controlPoints, List<Double> weights, int degree, List<Double> knots,
                                   AttributeSet attribs);

    EntityHandle addClosedRationalSpline(List<Point3> controlPoints, List<Double> weights, int degree,
                                         List<Double> knots, AttributeSet attribs);

    EntityHandle addBody(List<String> acisData, AttributeSet attribs);

    EntityHandle addRegion(List<String> acisData, AttributeSet attribs);

    EntityHandle add3dSolid(List<String> acisData, AttributeSet attribs);

    /**
     * SURFACE 추가 (R2007+). ACIS 데이터는 해석 없이 그대로 저장됩니다.
     */
    EntityHandle addSurface(List<String> acisData, AttributeSet attribs);

    EntityHandle addExtrudedSurface(List<String> acisData, AttributeSet attribs);

    EntityHandle addLoftedSurface(List<String> acisData, AttributeSet attribs);

    EntityHandle addRevolvedSurface(List<String> acisData, AttributeSet attribs);

    EntityHandle addSweptSurface(List<String> acisData, AttributeSet attribs);

    /**
     * 단색 채움 HATCH 추가.
     *
     * @param color ACI 색상 (기본 7)
     */
    EntityHandle addHatch(int color, AttributeSet attribs);

    EntityHandle addMesh(AttributeSet attribs);

    /**
     * IMAGE 추가.
     *
     * <p>u_pixel, v_pixel은 픽셀당 도면 단위 크기와 회전으로부터 계산됩니다 (xy 평면만 지원).</p>
     *
     * @param sizeX 도면 단위 가로 크기
     * @param sizeY 도면 단위 세로 크기
     * @param rotation z축 회전 (도)
     */
    EntityHandle addImage(ImageDefinition definition, Point3 insert, double sizeX, double sizeY, double rotation,
                          AttributeSet attribs);

    /**
     * PDF/DWF/DGN UNDERLAY 추가. 엔티티 종류는 정의의 포맷으로 결정됩니다.
     *
     * @param scale x, y, z 축 배율
     */
    EntityHandle addUnderlay(UnderlayDefinition definition, Point3 insert, Point3 scale, double rotation,
                             AttributeSet attribs);

    /**
     * 균등 배율 UNDERLAY 추가.
     */
    default EntityHandle addUnderlay(UnderlayDefinition definition, Point3 insert, double scale, double rotation,
                                     AttributeSet attribs) {
        return addUnderlay(definition, insert, Point3.of(scale, scale, scale), rotation, attribs);
    }

    /**
     * 수평, 수직, 회전 선형 치수 추가.
     *
     * <p>기하는 반환된 객체의 {@link DimensionStyleOverride#render()}를 호출할 때 생성됩니다.
     * textRotation은 지정하면 치수선 방향과 무관한 절대 각도로 적용됩니다.</p>
     *
     * @param base 치수선 위치
     * @param p1 측정점 1
     * @param p2 측정점 2
     * @param location 사용자 지정 텍스트 위치 (null 가능)
     * @param text 치수 텍스트 (null이면 측정값)
     * @param angle 치수선 각도 (도)
     * @param textRotation 절대 텍스트 회전 (null 가능)
     * @param dimstyle 치수 스타일 (null이면 설정 기본값)
     * @param override 스타일 재정의
     * @param attribs DIMENSION 추가 속성
     * @return 렌더링 전 치수
     */
    DimensionStyleOverride addLinearDim(Point3 base, Point3 p1, Point3 p2, Point3 location, String text,
                                        double angle, Double textRotation, String dimstyle,
                                        AttributeSet override, AttributeSet attribs);

    /**
     * 연속 선형 치수 추가. 이 연산은 치수를 즉시 렌더링합니다.
     *
     * @return 생성된 DIMENSION 핸들 (점 쌍 순서)
     */
    List<EntityHandle> addMultiPointLinearDim(Point3 base, List<Point3> points, double angle,
                                              boolean avoidDoubleRendering, String dimstyle,
                                              AttributeSet override, AttributeSet attribs);

    /**
     * p1, p2에 평행한 치수 추가. distance의 부호가 치수선의 방향(쪽)을 결정합니다.
     */
    DimensionStyleOverride addAlignedDim(Point3 p1, Point3 p2, double distance, String text, String dimstyle,
                                         AttributeSet override, AttributeSet attribs);

    DimensionStyleOverride addAngularDim(AttributeSet override, AttributeSet attribs);

    DimensionStyleOverride addDiameterDim(AttributeSet override, AttributeSet attribs);

    DimensionStyleOverride addRadiusDim(AttributeSet override, AttributeSet attribs);

    DimensionStyleOverride addAngular3pDim(AttributeSet override, AttributeSet attribs);

    DimensionStyleOverride addOrdinateDim(AttributeSet override, AttributeSet attribs);

    /**
     * 화살표를 개별 엔티티로 추가.
     *
     * @return 치수선 연결점
     */
    Point3 addArrow(String name, Point3 insert, double size, double rotation, AttributeSet attribs);

    /**
     * 화살표를 블록 참조로 추가.
     *
     * @return 치수선 연결점
     */
    Point3 addArrowBlockRef(String name, Point3 insert, double size, double rotation, AttributeSet attribs);
}
