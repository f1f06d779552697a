package com.ryuqq.graphics.application.factory;

import com.ryuqq.graphics.application.block.AutoBlockComposer;
import com.ryuqq.graphics.application.block.BlockReferenceRequest;
import com.ryuqq.graphics.core.attribute.AttributeAssembler;
import com.ryuqq.graphics.core.dimension.DimensionGeometryResolver;
import com.ryuqq.graphics.core.dimension.DimensionKind;
import com.ryuqq.graphics.core.dimension.DimensionRequest;
import com.ryuqq.graphics.core.geometry.QuadrilateralNormalizer;
import com.ryuqq.graphics.core.model.AttributeSet;
import com.ryuqq.graphics.core.model.EntityHandle;
import com.ryuqq.graphics.core.model.EntityKind;
import com.ryuqq.graphics.core.model.Flags;
import com.ryuqq.graphics.core.model.LwPolylineFlags;
import com.ryuqq.graphics.core.model.Point3;
import com.ryuqq.graphics.core.model.PolylineFlags;
import com.ryuqq.graphics.core.spi.ArrowRenderer;
import com.ryuqq.graphics.core.spi.BlockTable;
import com.ryuqq.graphics.core.spi.DimensionRenderer;
import com.ryuqq.graphics.core.spi.EntityCreator;
import com.ryuqq.graphics.core.spline.BSplineControlFrame;
import com.ryuqq.graphics.core.spline.ControlFrameBuilder;
import com.ryuqq.graphics.core.spline.ParametrizationMethod;
import com.ryuqq.graphics.core.version.VersionGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * {@link GraphicsFactory} 기본 구현.
 *
 * <p>모든 연산은 같은 순서로 진행됩니다.</p>
 * <ol>
 *   <li>{@link VersionGate}: 활성 버전 검사 (속성 계산 이전)</li>
 *   <li>계산 엔진: {@link QuadrilateralNormalizer}, {@link ControlFrameBuilder},
 *       {@link DimensionGeometryResolver}, {@link AutoBlockComposer}</li>
 *   <li>{@link AttributeAssembler}: 템플릿 + 호출자 속성 + 계산 필드 병합</li>
 *   <li>{@link EntityCreator}: 논리 엔티티당 한 번 호출, 재시도 없음</li>
 * </ol>
 *
 * <p><strong>Thread Safety:</strong> 인스턴스 상태는 생성 후 변경되지 않으며,
 * 동시 호출 시의 일관성은 {@link EntityCreator} 구현에 따릅니다.</p>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public class DefaultGraphicsFactory implements GraphicsFactory {

    private static final Logger log = LoggerFactory.getLogger(DefaultGraphicsFactory.class);

    private static final int MIN_MESH_SIZE = 2;
    private static final double PIXEL_VECTOR_SCALE = 1e6;

    private final FactoryConfig config;
    private final EntityCreator layout;
    private final DimensionRenderer dimensionRenderer;
    private final ArrowRenderer arrowRenderer;
    private final DimensionGeometryResolver dimensionResolver;
    private final AutoBlockComposer autoBlockComposer;

    /**
     * 생성자.
     *
     * @param config 팩토리 설정
     * @param layout 엔티티를 받을 레이아웃
     * @param blocks 블록 테이블
     * @param dimensionRenderer 치수 렌더러
     * @param arrowRenderer 화살표 렌더러
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public DefaultGraphicsFactory(FactoryConfig config, EntityCreator layout, BlockTable blocks,
                                  DimensionRenderer dimensionRenderer, ArrowRenderer arrowRenderer) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (layout == null) {
            throw new IllegalArgumentException("layout cannot be null");
        }
        if (blocks == null) {
            throw new IllegalArgumentException("blocks cannot be null");
        }
        if (dimensionRenderer == null) {
            throw new IllegalArgumentException("dimensionRenderer cannot be null");
        }
        if (arrowRenderer == null) {
            throw new IllegalArgumentException("arrowRenderer cannot be null");
        }
        this.config = config;
        this.layout = layout;
        this.dimensionRenderer = dimensionRenderer;
        this.arrowRenderer = arrowRenderer;
        this.dimensionResolver = new DimensionGeometryResolver(config.defaultDimStyle());
        this.autoBlockComposer = new AutoBlockComposer(blocks);
    }

    public FactoryConfig getConfig() {
        return config;
    }

    // ========== 기본 도형 ==========

    @Override
    public EntityHandle addPoint(Point3 location, AttributeSet attribs) {
        gate(EntityKind.POINT);
        requireNonNull(location, "location");
        return issue(EntityKind.POINT, attribs, AttributeSet.builder().put("location", location).build());
    }

    @Override
    public EntityHandle addLine(Point3 start, Point3 end, AttributeSet attribs) {
        gate(EntityKind.LINE);
        requireNonNull(start, "start");
        requireNonNull(end, "end");
        return issue(EntityKind.LINE, attribs, AttributeSet.builder()
            .put("start", start)
            .put("end", end)
            .build());
    }

    @Override
    public EntityHandle addCircle(Point3 center, double radius, AttributeSet attribs) {
        gate(EntityKind.CIRCLE);
        requireNonNull(center, "center");
        return issue(EntityKind.CIRCLE, attribs, AttributeSet.builder()
            .put("center", center)
            .put("radius", radius)
            .build());
    }

    @Override
    public EntityHandle addEllipse(Point3 center, Point3 majorAxis, double ratio, double startParam,
                                   double endParam, AttributeSet attribs) {
        gate(EntityKind.ELLIPSE);
        VersionGate.requireEllipseRatio(ratio);
        requireNonNull(center, "center");
        requireNonNull(majorAxis, "majorAxis");
        return issue(EntityKind.ELLIPSE, attribs, AttributeSet.builder()
            .put("center", center)
            .put("major_axis", majorAxis)
            .put("ratio", ratio)
            .put("start_param", startParam)
            .put("end_param", endParam)
            .build());
    }

    @Override
    public EntityHandle addArc(Point3 center, double radius, double startAngle, double endAngle,
                               boolean counterClockwise, AttributeSet attribs) {
        gate(EntityKind.ARC);
        requireNonNull(center, "center");
        // 시계 방향은 각도를 바꿔 반시계 방향으로 저장
        return issue(EntityKind.ARC, attribs, AttributeSet.builder()
            .put("center", center)
            .put("radius", radius)
            .put("start_angle", counterClockwise ? startAngle : endAngle)
            .put("end_angle", counterClockwise ? endAngle : startAngle)
            .build());
    }

    @Override
    public EntityHandle addSolid(List<Point3> points, AttributeSet attribs) {
        return addQuadrilateral(EntityKind.SOLID, points, attribs);
    }

    @Override
    public EntityHandle addTrace(List<Point3> points, AttributeSet attribs) {
        return addQuadrilateral(EntityKind.TRACE, points, attribs);
    }

    @Override
    public EntityHandle add3dFace(List<Point3> points, AttributeSet attribs) {
        return addQuadrilateral(EntityKind.FACE3D, points, attribs);
    }

    private EntityHandle addQuadrilateral(EntityKind kind, List<Point3> points, AttributeSet attribs) {
        gate(kind);
        return issue(kind, attribs, QuadrilateralNormalizer.toAttributes(points));
    }

    @Override
    public EntityHandle addText(String text, AttributeSet attribs) {
        gate(EntityKind.TEXT);
        requireNonNull(text, "text");
        return issue(EntityKind.TEXT, attribs, AttributeSet.builder().put("text", text).build());
    }

    // ========== 블록 ==========

    @Override
    public EntityHandle addBlockRef(String name, Point3 insert, AttributeSet attribs) {
        gate(EntityKind.INSERT);
        requireNonNull(name, "name");
        requireNonNull(insert, "insert");
        return issue(EntityKind.INSERT, attribs, AttributeSet.builder()
            .put("name", name)
            .put("insert", insert)
            .build());
    }

    @Override
    public EntityHandle addAutoBlockRef(String name, Point3 insert, Map<String, String> values,
                                        AttributeSet attribs) {
        gate(EntityKind.INSERT);
        gate(EntityKind.ATTRIB);
        BlockReferenceRequest request = autoBlockComposer.compose(name, insert, values, attribs);
        return addBlockRef(request.blockName(), request.insert(), request.attributes());
    }

    @Override
    public EntityHandle addAttrib(String tag, String text, Point3 insert, AttributeSet attribs) {
        gate(EntityKind.ATTRIB);
        requireNonNull(tag, "tag");
        requireNonNull(text, "text");
        return issue(EntityKind.ATTRIB, attribs, AttributeSet.builder()
            .put("tag", tag)
            .put("text", text)
            .put("insert", insert == null ? Point3.ORIGIN : insert)
            .build());
    }

    // ========== POLYLINE ==========

    @Override
    public EntityHandle addPolyline2d(List<Point3> points, AttributeSet attribs) {
        return addPolyline(points, attribs, 0);
    }

    @Override
    public EntityHandle addPolyline3d(List<Point3> points, AttributeSet attribs) {
        return addPolyline(points, attribs, PolylineFlags.POLYLINE_3D);
    }

    private EntityHandle addPolyline(List<Point3> points, AttributeSet attribs, int typeFlags) {
        gate(EntityKind.POLYLINE);
        requireNonNull(points, "points");
        AttributeSet caller = AttributeSet.orEmpty(attribs);
        int flags = typeFlags | (flag(caller, "closed") ? PolylineFlags.CLOSED : 0);
        return issue(EntityKind.POLYLINE, caller.without("closed"), AttributeSet.builder()
            .put("flags", Flags.of(flags))
            .put("vertices", points)
            .build());
    }

    @Override
    public EntityHandle addPolymesh(int mSize, int nSize, AttributeSet attribs) {
        gate(EntityKind.POLYLINE);
        int m = Math.max(mSize, MIN_MESH_SIZE);
        int n = Math.max(nSize, MIN_MESH_SIZE);
        if (m != mSize || n != nSize) {
            log.warn("Polymesh size {}x{} raised to {}x{}", mSize, nSize, m, n);
        }
        AttributeSet caller = AttributeSet.orEmpty(attribs);
        int flags = PolylineFlags.POLYMESH_3D | meshCloseFlags(caller);
        return issue(EntityKind.POLYLINE, caller.without("m_close").without("n_close"), AttributeSet.builder()
            .put("flags", Flags.of(flags))
            .put("m_count", m)
            .put("n_count", n)
            .put("vertices", Collections.nCopies(m * n, Point3.ORIGIN))
            .build());
    }

    @Override
    public EntityHandle addPolyface(AttributeSet attribs) {
        gate(EntityKind.POLYLINE);
        AttributeSet caller = AttributeSet.orEmpty(attribs);
        int flags = PolylineFlags.POLYFACE | meshCloseFlags(caller);
        return issue(EntityKind.POLYLINE, caller.without("m_close").without("n_close"), AttributeSet.builder()
            .put("flags", Flags.of(flags))
            .build());
    }

    private static int meshCloseFlags(AttributeSet caller) {
        return (flag(caller, "m_close") ? PolylineFlags.MESH_CLOSED_M_DIRECTION : 0)
            | (flag(caller, "n_close") ? PolylineFlags.MESH_CLOSED_N_DIRECTION : 0);
    }

    @Override
    public EntityHandle addShape(String name, Point3 insert, double size, AttributeSet attribs) {
        gate(EntityKind.SHAPE);
        requireNonNull(name, "name");
        return issue(EntityKind.SHAPE, attribs, AttributeSet.builder()
            .put("name", name)
            .put("insert", insert == null ? Point3.ORIGIN : insert)
            .put("size", size)
            .build());
    }

    // ========== R2000 엔티티 ==========

    @Override
    public EntityHandle addLwPolyline(List<double[]> points, String format, AttributeSet attribs) {
        gate(EntityKind.LWPOLYLINE);
        List<List<Double>> normalized = LwPolylinePoints.normalize(points, format);
        AttributeSet caller = AttributeSet.orEmpty(attribs);
        int flags = flag(caller, "closed") ? LwPolylineFlags.CLOSED : 0;
        return issue(EntityKind.LWPOLYLINE, caller.without("closed"), AttributeSet.builder()
            .put("flags", Flags.of(flags))
            .put("count", normalized.size())
            .put("points", normalized)
            .build());
    }

    @Override
    public EntityHandle addMText(String text, AttributeSet attribs) {
        gate(EntityKind.MTEXT);
        requireNonNull(text, "text");
        return issue(EntityKind.MTEXT, attribs, AttributeSet.builder().put("text", text).build());
    }

    @Override
    public EntityHandle addRay(Point3 start, Point3 unitVector, AttributeSet attribs) {
        return addConstructionLine(EntityKind.RAY, start, unitVector, attribs);
    }

    @Override
    public EntityHandle addXLine(Point3 start, Point3 unitVector, AttributeSet attribs) {
        return addConstructionLine(EntityKind.XLINE, start, unitVector, attribs);
    }

    private EntityHandle addConstructionLine(EntityKind kind, Point3 start, Point3 unitVector,
                                             AttributeSet attribs) {
        gate(kind);
        requireNonNull(start, "start");
        requireNonNull(unitVector, "unitVector");
        return issue(kind, attribs, AttributeSet.builder()
            .put("start", start)
            .put("unit_vector", unitVector)
            .build());
    }

    // ========== SPLINE ==========

    @Override
    public EntityHandle addSpline(List<Point3> fitPoints, int degree, AttributeSet attribs) {
        gate(EntityKind.SPLINE);
        AttributeSet.Builder computed = AttributeSet.builder().put("degree", degree);
        if (fitPoints != null) {
            computed.put("fit_points", fitPoints);
        }
        return issue(EntityKind.SPLINE, attribs, computed.build());
    }

    @Override
    public EntityHandle addSplineControlFrame(List<Point3> fitPoints, int degree, String method, double power,
                                              AttributeSet attribs) {
        gate(EntityKind.SPLINE);
        BSplineControlFrame frame = ControlFrameBuilder.buildOpen(
            fitPoints, degree, ParametrizationMethod.of(method), power
        );
        return issueSpline(frame, attribs);
    }

    @Override
    public EntityHandle addSplineControlFrame(List<Point3> fitPoints, AttributeSet attribs) {
        gate(EntityKind.SPLINE);
        BSplineControlFrame frame = ControlFrameBuilder.buildOpen(
            fitPoints, config.defaultDegree(), config.defaultMethod(), config.defaultPower()
        );
        return issueSpline(frame, attribs);
    }

    @Override
    public EntityHandle addClosedSplineControlFrame(List<Point3> fitPoints, int degree, String method,
                                                    double power, AttributeSet attribs) {
        gate(EntityKind.SPLINE);
        BSplineControlFrame frame = ControlFrameBuilder.buildClosed(
            fitPoints, degree, ParametrizationMethod.of(method), power
        );
        return issueSpline(frame, attribs);
    }

    @Override
    public EntityHandle addSplineApprox(List<Point3> fitPoints, int count, int degree, String method, double power,
                                        AttributeSet attribs) {
        gate(EntityKind.SPLINE);
        BSplineControlFrame frame = ControlFrameBuilder.approximate(
            fitPoints, count, degree, ParametrizationMethod.of(method), power
        );
        return issueSpline(frame, attribs);
    }

    @Override
    public EntityHandle addOpenSpline(List<Point3> controlPoints, int degree, List<Double> knots,
                                      AttributeSet attribs) {
        gate(EntityKind.SPLINE);
        BSplineControlFrame frame = ControlFrameBuilder.openUniform(controlPoints, degree);
        return issueSpline(withKnots(frame, knots), attribs);
    }

    @Override
    public EntityHandle addClosedSpline(List<Point3> controlPoints, int degree, List<Double> knots,
                                        AttributeSet attribs) {
        gate(EntityKind.SPLINE);
        BSplineControlFrame frame = ControlFrameBuilder.periodicUniform(controlPoints, degree);
        return issueSpline(withKnots(frame, knots), attribs);
    }

    @Override
    public EntityHandle addRationalSpline(List<Point3> controlPoints, List<Double> weights, int degree,
                                          List<Double> knots, AttributeSet attribs) {
        gate(EntityKind.SPLINE);
        requireNonNull(weights, "weights");
        BSplineControlFrame frame = ControlFrameBuilder.openUniform(controlPoints, degree)
            .withWeights(toArray(weights));
        return issueSpline(withKnots(frame, knots), attribs);
    }

    @Override
    public EntityHandle addClosedRationalSpline(List<Point3> controlPoints, List<Double> weights, int degree,
                                                List<Double> knots, AttributeSet attribs) {
        gate(EntityKind.SPLINE);
        requireNonNull(weights, "weights");
        BSplineControlFrame frame = ControlFrameBuilder.periodicUniform(controlPoints, degree);
        frame = frame.withWeights(ControlFrameBuilder.wrapWeights(toArray(weights), controlPoints.size(), degree));
        return issueSpline(withKnots(frame, knots), attribs);
    }

    private EntityHandle issueSpline(BSplineControlFrame frame, AttributeSet attribs) {
        AttributeSet.Builder computed = AttributeSet.builder()
            .put("degree", frame.getDegree())
            .put("flags", frame.getFlags())
            .put("control_points", frame.getControlPoints())
            .put("knots", frame.getKnots());
        if (frame.isRational()) {
            computed.put("weights", frame.getWeights());
        }
        return issue(EntityKind.SPLINE, attribs, computed.build());
    }

    private static BSplineControlFrame withKnots(BSplineControlFrame frame, List<Double> knots) {
        return knots == null ? frame : frame.withKnots(toArray(knots));
    }

    // ========== ACIS ==========

    @Override
    public EntityHandle addBody(List<String> acisData, AttributeSet attribs) {
        return addAcis(EntityKind.BODY, acisData, attribs);
    }

    @Override
    public EntityHandle addRegion(List<String> acisData, AttributeSet attribs) {
        return addAcis(EntityKind.REGION, acisData, attribs);
    }

    @Override
    public EntityHandle add3dSolid(List<String> acisData, AttributeSet attribs) {
        return addAcis(EntityKind.SOLID3D, acisData, attribs);
    }

    @Override
    public EntityHandle addSurface(List<String> acisData, AttributeSet attribs) {
        return addAcis(EntityKind.SURFACE, acisData, attribs);
    }

    @Override
    public EntityHandle addExtrudedSurface(List<String> acisData, AttributeSet attribs) {
        return addAcis(EntityKind.EXTRUDEDSURFACE, acisData, attribs);
    }

    @Override
    public EntityHandle addLoftedSurface(List<String> acisData, AttributeSet attribs) {
        return addAcis(EntityKind.LOFTEDSURFACE, acisData, attribs);
    }

    @Override
    public EntityHandle addRevolvedSurface(List<String> acisData, AttributeSet attribs) {
        return addAcis(EntityKind.REVOLVEDSURFACE, acisData, attribs);
    }

    @Override
    public EntityHandle addSweptSurface(List<String> acisData, AttributeSet attribs) {
        return addAcis(EntityKind.SWEPTSURFACE, acisData, attribs);
    }

    private EntityHandle addAcis(EntityKind kind, List<String> acisData, AttributeSet attribs) {
        gate(kind);
        AttributeSet.Builder computed = AttributeSet.builder();
        if (acisData != null) {
            computed.put("acis_data", acisData);
        }
        return issue(kind, attribs, computed.build());
    }

    // ========== HATCH, MESH, IMAGE, UNDERLAY ==========

    @Override
    public EntityHandle addHatch(int color, AttributeSet attribs) {
        gate(EntityKind.HATCH);
        return issue(EntityKind.HATCH, attribs, AttributeSet.builder()
            .put("solid_fill", 1)
            .put("color", color)
            .put("pattern_name", "SOLID")
            .build());
    }

    @Override
    public EntityHandle addMesh(AttributeSet attribs) {
        gate(EntityKind.MESH);
        return issue(EntityKind.MESH, attribs, AttributeSet.empty());
    }

    @Override
    public EntityHandle addImage(ImageDefinition definition, Point3 insert, double sizeX, double sizeY,
                                 double rotation, AttributeSet attribs) {
        gate(EntityKind.IMAGE);
        requireNonNull(definition, "definition");
        requireNonNull(insert, "insert");
        double xAngle = Math.toRadians(rotation);
        double yAngle = xAngle + Math.PI / 2.0;
        return issue(EntityKind.IMAGE, attribs, AttributeSet.builder()
            .put("insert", insert)
            .put("u_pixel", pixelVector(sizeX / definition.pixelWidth(), xAngle))
            .put("v_pixel", pixelVector(sizeY / definition.pixelHeight(), yAngle))
            .put("image_def_handle", definition.handle().getValue())
            .put("image_size", definition.imageSize())
            .build());
    }

    private static Point3 pixelVector(double unitsPerPixel, double angle) {
        // xy 평면 이미지만 지원
        return Point3.of(
            Math.round(Math.cos(angle) * unitsPerPixel * PIXEL_VECTOR_SCALE) / PIXEL_VECTOR_SCALE,
            Math.round(Math.sin(angle) * unitsPerPixel * PIXEL_VECTOR_SCALE) / PIXEL_VECTOR_SCALE,
            0
        );
    }

    @Override
    public EntityHandle addUnderlay(UnderlayDefinition definition, Point3 insert, Point3 scale, double rotation,
                                    AttributeSet attribs) {
        requireNonNull(definition, "definition");
        EntityKind kind = definition.entityKind();
        gate(kind);
        requireNonNull(scale, "scale");
        return issue(kind, attribs, AttributeSet.builder()
            .put("insert", insert == null ? Point3.ORIGIN : insert)
            .put("underlay_def_handle", definition.handle().getValue())
            .put("rotation", rotation)
            .put("scale_x", scale.x())
            .put("scale_y", scale.y())
            .put("scale_z", scale.z())
            .build());
    }

    // ========== DIMENSION ==========

    @Override
    public DimensionStyleOverride addLinearDim(Point3 base, Point3 p1, Point3 p2, Point3 location, String text,
                                               double angle, Double textRotation, String dimstyle,
                                               AttributeSet override, AttributeSet attribs) {
        gate(EntityKind.DIMENSION);
        return issueDimension(dimensionResolver.resolveLinear(
            base, p1, p2, location, text, angle, textRotation, dimstyle, override, attribs
        ));
    }

    @Override
    public List<EntityHandle> addMultiPointLinearDim(Point3 base, List<Point3> points, double angle,
                                                     boolean avoidDoubleRendering, String dimstyle,
                                                     AttributeSet override, AttributeSet attribs) {
        gate(EntityKind.DIMENSION);
        List<DimensionRequest> requests = dimensionResolver.resolveMultiPointLinear(
            base, points, angle, avoidDoubleRendering, dimstyle, override, attribs
        );
        List<EntityHandle> handles = new ArrayList<>(requests.size());
        for (DimensionRequest request : requests) {
            DimensionStyleOverride dimension = issueDimension(request);
            dimension.render();
            handles.add(dimension.getHandle());
        }
        return Collections.unmodifiableList(handles);
    }

    @Override
    public DimensionStyleOverride addAlignedDim(Point3 p1, Point3 p2, double distance, String text,
                                                String dimstyle, AttributeSet override, AttributeSet attribs) {
        gate(EntityKind.DIMENSION);
        return issueDimension(dimensionResolver.resolveAligned(p1, p2, distance, text, dimstyle, override, attribs));
    }

    @Override
    public DimensionStyleOverride addAngularDim(AttributeSet override, AttributeSet attribs) {
        return addDimension(DimensionKind.ANGULAR, override, attribs);
    }

    @Override
    public DimensionStyleOverride addDiameterDim(AttributeSet override, AttributeSet attribs) {
        return addDimension(DimensionKind.DIAMETER, override, attribs);
    }

    @Override
    public DimensionStyleOverride addRadiusDim(AttributeSet override, AttributeSet attribs) {
        return addDimension(DimensionKind.RADIUS, override, attribs);
    }

    @Override
    public DimensionStyleOverride addAngular3pDim(AttributeSet override, AttributeSet attribs) {
        return addDimension(DimensionKind.ANGULAR_3P, override, attribs);
    }

    @Override
    public DimensionStyleOverride addOrdinateDim(AttributeSet override, AttributeSet attribs) {
        return addDimension(DimensionKind.ORDINATE, override, attribs);
    }

    private DimensionStyleOverride addDimension(DimensionKind kind, AttributeSet override, AttributeSet attribs) {
        gate(EntityKind.DIMENSION);
        return issueDimension(dimensionResolver.resolve(kind, null, override, attribs));
    }

    private DimensionStyleOverride issueDimension(DimensionRequest request) {
        EntityHandle handle = create(EntityKind.DIMENSION, request.attributes());
        return new DimensionStyleOverride(handle, request, dimensionRenderer);
    }

    // ========== ARROW ==========

    @Override
    public Point3 addArrow(String name, Point3 insert, double size, double rotation, AttributeSet attribs) {
        requireNonNull(name, "name");
        requireNonNull(insert, "insert");
        return arrowRenderer.renderArrow(layout, name, insert, size, rotation, AttributeSet.orEmpty(attribs));
    }

    @Override
    public Point3 addArrowBlockRef(String name, Point3 insert, double size, double rotation,
                                   AttributeSet attribs) {
        requireNonNull(name, "name");
        requireNonNull(insert, "insert");
        return arrowRenderer.insertArrow(layout, name, insert, size, rotation, AttributeSet.orEmpty(attribs));
    }

    // ========== 공통 ==========

    private void gate(EntityKind kind) {
        VersionGate.require(kind, config.dxfVersion());
    }

    private EntityHandle issue(EntityKind kind, AttributeSet attribs, AttributeSet computed) {
        return create(kind, AttributeAssembler.assemble(kind, attribs, computed));
    }

    private EntityHandle create(EntityKind kind, AttributeSet attributes) {
        EntityHandle handle = layout.create(kind, attributes);
        log.debug("Created {} {}", kind.getDxfType(), handle.getValue());
        return handle;
    }

    private static boolean flag(AttributeSet attributes, String key) {
        Object value = attributes.get(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        return value instanceof Number number && number.intValue() != 0;
    }

    private static double[] toArray(List<Double> values) {
        double[] array = new double[values.size()];
        for (int i = 0; i < array.length; i++) {
            Double value = values.get(i);
            if (value == null) {
                throw new IllegalArgumentException("values cannot contain null");
            }
            array[i] = value;
        }
        return array;
    }

    private static void requireNonNull(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }
}
