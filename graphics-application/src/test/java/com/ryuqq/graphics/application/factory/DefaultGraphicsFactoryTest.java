package com.ryuqq.graphics.application.factory;

import com.ryuqq.graphics.core.dimension.DimensionKind;
import com.ryuqq.graphics.core.dimension.DimensionRequest;
import com.ryuqq.graphics.core.exception.DxfValueException;
import com.ryuqq.graphics.core.exception.DxfVersionException;
import com.ryuqq.graphics.core.model.AttributeSet;
import com.ryuqq.graphics.core.model.EntityHandle;
import com.ryuqq.graphics.core.model.EntityKind;
import com.ryuqq.graphics.core.model.Flags;
import com.ryuqq.graphics.core.model.FormatVersion;
import com.ryuqq.graphics.core.model.Point3;
import com.ryuqq.graphics.core.model.PolylineFlags;
import com.ryuqq.graphics.core.model.SplineFlags;
import com.ryuqq.graphics.core.spi.ArrowRenderer;
import com.ryuqq.graphics.core.spi.BlockTable;
import com.ryuqq.graphics.core.spi.DimensionRenderer;
import com.ryuqq.graphics.core.spi.EntityCreator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * DefaultGraphicsFactory 유닛 테스트.
 *
 * <p>레이아웃({@link EntityCreator})에 전달되는 속성 집합을 검증합니다:</p>
 * <ul>
 *   <li>버전 검사가 속성 계산과 엔티티 생성보다 먼저 수행됨</li>
 *   <li>템플릿 + 호출자 속성 + 계산 필드 병합</li>
 *   <li>스플라인, 치수, 블록 등 계산 엔진 결과 전달</li>
 * </ul>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DefaultGraphicsFactoryTest {

    @Mock
    private EntityCreator layout;

    @Mock
    private BlockTable blocks;

    @Mock
    private DimensionRenderer dimensionRenderer;

    @Mock
    private ArrowRenderer arrowRenderer;

    private final AtomicLong handleSequence = new AtomicLong(0x100);

    private DefaultGraphicsFactory factory;

    @BeforeEach
    void setUp() {
        lenient().when(layout.create(any(), any()))
            .thenAnswer(invocation -> EntityHandle.of(handleSequence.getAndIncrement()));
        factory = factory(FormatVersion.R2013);
    }

    // ============================================================
    // 1. 버전 검사
    // ============================================================

    @Test
    void R12에서_LWPOLYLINE_생성시_버전_예외_엔티티_미생성() {
        // given
        DefaultGraphicsFactory r12 = factory(FormatVersion.R12);

        // when & then
        assertThatThrownBy(() -> r12.addLwPolyline(List.of(new double[]{0, 0}, new double[]{1, 1}), null, null))
            .isInstanceOfSatisfying(DxfVersionException.class, e -> {
                assertThat(e.getKind()).isEqualTo(EntityKind.LWPOLYLINE);
                assertThat(e.getRequired()).isEqualTo(FormatVersion.R2000);
            });
        verifyNoInteractions(layout);
    }

    @Test
    void SURFACE는_R2007부터_허용() {
        // given
        DefaultGraphicsFactory r2000 = factory(FormatVersion.R2000);
        DefaultGraphicsFactory r2007 = factory(FormatVersion.R2007);

        // when & then
        assertThatThrownBy(() -> r2000.addSurface(null, null)).isInstanceOf(DxfVersionException.class);
        assertThatThrownBy(() -> r2000.addSweptSurface(null, null)).isInstanceOf(DxfVersionException.class);
        assertThat(r2000.addBody(List.of("line 1"), null)).isNotNull();
        assertThat(r2007.addSurface(null, null)).isNotNull();
    }

    @Test
    void 버전_검사가_값_검사보다_먼저_수행됨() {
        // given
        DefaultGraphicsFactory r12 = factory(FormatVersion.R12);

        // when & then
        assertThatThrownBy(() -> r12.addEllipse(Point3.ORIGIN, Point3.of(1, 0), 2.0, 0, Math.PI, null))
            .isInstanceOf(DxfVersionException.class);
        assertThatThrownBy(() -> r12.addSplineControlFrame(List.of(Point3.ORIGIN), null))
            .isInstanceOf(DxfVersionException.class);
        verifyNoInteractions(layout);
    }

    @Test
    void R12에서도_기본_엔티티_생성() {
        DefaultGraphicsFactory r12 = factory(FormatVersion.R12);

        r12.addLine(Point3.ORIGIN, Point3.of(1, 1), null);
        r12.addText("R12", null);
        r12.addPolyline2d(List.of(Point3.ORIGIN, Point3.of(1, 1)), null);

        verify(layout, times(3)).create(any(), any());
    }

    // ============================================================
    // 2. 기본 도형과 속성 병합
    // ============================================================

    @Test
    void LINE_템플릿_호출자속성_계산필드_병합() {
        // given
        AttributeSet attribs = AttributeSet.builder()
            .put("layer", "WALLS")
            .put("start", Point3.of(99, 99))
            .build();

        // when
        EntityHandle handle = factory.addLine(Point3.of(0, 0), Point3.of(10, 0), attribs);

        // then
        AttributeSet created = created(EntityKind.LINE);
        assertThat(handle).isNotNull();
        assertThat(created.getString("layer")).isEqualTo("WALLS");
        assertThat(created.getPoint("start")).isEqualTo(Point3.ORIGIN);
        assertThat(created.getPoint("end")).isEqualTo(Point3.of(10, 0));
    }

    @Test
    void ELLIPSE_비율_범위_밖이면_값_예외() {
        assertThatThrownBy(() -> factory.addEllipse(Point3.ORIGIN, Point3.of(2, 0), 1.5, 0, Math.PI, null))
            .isInstanceOfSatisfying(DxfValueException.class, e -> assertThat(e.getField()).isEqualTo("ratio"));
        verifyNoInteractions(layout);
    }

    @Test
    void ELLIPSE_속성() {
        factory.addEllipse(Point3.of(1, 1), Point3.of(3, 0), 0.5, 0.0, Math.PI, null);

        AttributeSet created = created(EntityKind.ELLIPSE);
        assertThat(created.getPoint("center")).isEqualTo(Point3.of(1, 1));
        assertThat(created.getPoint("major_axis")).isEqualTo(Point3.of(3, 0));
        assertThat(created.getDouble("ratio")).isEqualTo(0.5);
        assertThat(created.getDouble("end_param")).isEqualTo(Math.PI);
    }

    @Test
    void ARC_시계방향은_시작끝_각도_교환() {
        factory.addArc(Point3.ORIGIN, 2.0, 30.0, 120.0, false, null);

        AttributeSet created = created(EntityKind.ARC);
        assertThat(created.getDouble("start_angle")).isEqualTo(120.0);
        assertThat(created.getDouble("end_angle")).isEqualTo(30.0);
    }

    @Test
    void SOLID_세_점이면_마지막_점_복제() {
        factory.addSolid(List.of(Point3.of(0, 0), Point3.of(1, 0), Point3.of(0, 1)), null);

        AttributeSet created = created(EntityKind.SOLID);
        assertThat(created.getPoint("vtx3")).isEqualTo(Point3.of(0, 1));
    }

    @Test
    void FACE3D_점_개수_오류() {
        assertThatThrownBy(() -> factory.add3dFace(List.of(Point3.ORIGIN, Point3.of(1, 0)), null))
            .isInstanceOf(DxfValueException.class);
        verifyNoInteractions(layout);
    }

    // ============================================================
    // 3. POLYLINE 계열
    // ============================================================

    @Test
    void POLYLINE_3D_닫힘_플래그() {
        // when
        factory.addPolyline3d(
            List.of(Point3.ORIGIN, Point3.of(1, 0, 1), Point3.of(1, 1, 2)),
            AttributeSet.builder().put("closed", true).build()
        );

        // then
        AttributeSet created = created(EntityKind.POLYLINE);
        assertThat(created.getFlags("flags").getValue())
            .isEqualTo(PolylineFlags.POLYLINE_3D | PolylineFlags.CLOSED);
        assertThat(created.contains("closed")).isFalse();
        assertThat(created.getList("vertices", Point3.class)).hasSize(3);
    }

    @Test
    void POLYMESH_최소_크기_2로_보정() {
        // when
        factory.addPolymesh(1, 3, AttributeSet.builder().put("n_close", true).build());

        // then
        AttributeSet created = created(EntityKind.POLYLINE);
        assertThat(created.getInt("m_count")).isEqualTo(2);
        assertThat(created.getInt("n_count")).isEqualTo(3);
        assertThat(created.getList("vertices", Point3.class)).hasSize(6).containsOnly(Point3.ORIGIN);
        assertThat(created.getFlags("flags").getValue())
            .isEqualTo(PolylineFlags.POLYMESH_3D | PolylineFlags.MESH_CLOSED_N_DIRECTION);
    }

    @Test
    void POLYFACE_플래그() {
        factory.addPolyface(AttributeSet.builder().put("m_close", 1).build());

        AttributeSet created = created(EntityKind.POLYLINE);
        assertThat(created.getFlags("flags").getValue())
            .isEqualTo(PolylineFlags.POLYFACE | PolylineFlags.MESH_CLOSED_M_DIRECTION);
        assertThat(created.contains("m_close")).isFalse();
    }

    @Test
    void LWPOLYLINE_포맷_정규화와_닫힘() {
        // when
        factory.addLwPolyline(
            List.of(new double[]{0, 0}, new double[]{10, 0}, new double[]{10, 10}),
            "xy",
            AttributeSet.builder().put("closed", true).build()
        );

        // then
        AttributeSet created = created(EntityKind.LWPOLYLINE);
        assertThat(created.getInt("count")).isEqualTo(3);
        assertThat(created.getList("points", List.class).get(1)).isEqualTo(List.of(10.0, 0.0, 0.0, 0.0, 0.0));
        assertThat(created.getFlags("flags").getValue()).isEqualTo(1);
    }

    // ============================================================
    // 4. SPLINE
    // ============================================================

    @Test
    void 맞춤점_네_개로_3차_스플라인_제어점_생성() {
        // when
        factory.addSplineControlFrame(
            List.of(Point3.of(0, 0), Point3.of(1, 2), Point3.of(2, 0), Point3.of(3, 2)), null
        );

        // then
        AttributeSet created = created(EntityKind.SPLINE);
        assertThat(created.getInt("degree")).isEqualTo(3);
        assertThat(created.getList("control_points", Point3.class)).hasSize(4);
        assertThat(created.getList("knots", Double.class))
            .containsExactly(0.0, 0.0, 0.0, 0.0, 1.0, 1.0, 1.0, 1.0);
        assertThat(created.contains("weights")).isFalse();
        assertThat(created.getFlags("flags")).isEqualTo(Flags.none());
    }

    @Test
    void 알_수_없는_매개변수화_방법() {
        assertThatThrownBy(() -> factory.addSplineControlFrame(
            List.of(Point3.of(0, 0), Point3.of(1, 2), Point3.of(2, 0), Point3.of(3, 2)), 3, "chord", 0.5, null))
            .isInstanceOfSatisfying(DxfValueException.class, e -> assertThat(e.getField()).isEqualTo("method"));
    }

    @Test
    void 닫힌_유리_스플라인_가중치_순환() {
        // when
        factory.addClosedRationalSpline(
            List.of(Point3.of(0, 0), Point3.of(2, 0), Point3.of(2, 2), Point3.of(0, 2)),
            List.of(1.0, 2.0, 1.0, 2.0), 3, null, null
        );

        // then
        AttributeSet created = created(EntityKind.SPLINE);
        assertThat(created.getList("weights", Double.class)).containsExactly(1.0, 2.0, 1.0, 2.0, 1.0, 2.0, 1.0);
        assertThat(created.getList("control_points", Point3.class)).hasSize(7);
        assertThat(created.getFlags("flags").getValue())
            .isEqualTo(SplineFlags.CLOSED | SplineFlags.PERIODIC | SplineFlags.RATIONAL);
    }

    @Test
    void 사용자_매듭_벡터_사용() {
        // when
        factory.addOpenSpline(
            List.of(Point3.of(0, 0), Point3.of(1, 1), Point3.of(2, 0)), 2, List.of(0.0, 0.0, 0.0, 5.0, 5.0, 5.0), null
        );

        // then
        assertThat(created(EntityKind.SPLINE).getList("knots", Double.class))
            .containsExactly(0.0, 0.0, 0.0, 5.0, 5.0, 5.0);
    }

    @Test
    void 매듭_개수_오류() {
        assertThatThrownBy(() -> factory.addOpenSpline(
            List.of(Point3.of(0, 0), Point3.of(1, 1), Point3.of(2, 0)), 2, List.of(0.0, 1.0), null))
            .isInstanceOfSatisfying(DxfValueException.class, e -> assertThat(e.getField()).isEqualTo("knots"));
    }

    @Test
    void 근사_스플라인_제어점_개수() {
        // given
        List<Point3> fitPoints = List.of(
            Point3.of(0, 0), Point3.of(1, 1), Point3.of(2, 1.5), Point3.of(3, 1), Point3.of(4, 0),
            Point3.of(5, -1), Point3.of(6, -1.5), Point3.of(7, -1)
        );

        // when
        factory.addSplineApprox(fitPoints, 5, 3, "distance", 0.5, null);

        // then
        List<Point3> cps = created(EntityKind.SPLINE).getList("control_points", Point3.class);
        assertThat(cps).hasSize(5);
        assertThat(cps.get(0)).isEqualTo(fitPoints.get(0));
        assertThat(cps.get(4)).isEqualTo(fitPoints.get(7));
    }

    @Test
    void 맞춤점_그대로_저장() {
        factory.addSpline(List.of(Point3.ORIGIN, Point3.of(1, 1)), 3, null);

        AttributeSet created = created(EntityKind.SPLINE);
        assertThat(created.getList("fit_points", Point3.class)).hasSize(2);
        assertThat(created.getInt("degree")).isEqualTo(3);
    }

    // ============================================================
    // 5. IMAGE, UNDERLAY, HATCH, ACIS
    // ============================================================

    @Test
    void IMAGE_픽셀_벡터() {
        // given
        ImageDefinition definition = new ImageDefinition(EntityHandle.of("A0"), 640, 320);

        // when
        factory.addImage(definition, Point3.of(5, 5), 6.4, 3.2, 0.0, null);

        // then
        AttributeSet created = created(EntityKind.IMAGE);
        assertThat(created.getPoint("u_pixel")).isEqualTo(Point3.of(0.01, 0, 0));
        assertThat(created.getPoint("v_pixel")).isEqualTo(Point3.of(0, 0.01, 0));
        assertThat(created.getString("image_def_handle")).isEqualTo("A0");
        assertThat(created.getPoint("image_size")).isEqualTo(Point3.of(640, 320));
        assertThat(created.getFlags("flags").getValue()).isEqualTo(3);
    }

    @Test
    void UNDERLAY_종류와_균일_축척() {
        // given
        UnderlayDefinition definition = new UnderlayDefinition(EntityHandle.of("B1"), UnderlayDefinition.Format.DWF);

        // when
        factory.addUnderlay(definition, Point3.ORIGIN, 2.0, 45.0, null);

        // then
        AttributeSet created = created(EntityKind.DWFUNDERLAY);
        assertThat(created.getDouble("scale_x")).isEqualTo(2.0);
        assertThat(created.getDouble("scale_z")).isEqualTo(2.0);
        assertThat(created.getDouble("rotation")).isEqualTo(45.0);
        assertThat(created.getString("underlay_def_handle")).isEqualTo("B1");
    }

    @Test
    void HATCH_단색_채우기() {
        factory.addHatch(3, null);

        AttributeSet created = created(EntityKind.HATCH);
        assertThat(created.getInt("solid_fill")).isEqualTo(1);
        assertThat(created.getInt("color")).isEqualTo(3);
        assertThat(created.getString("pattern_name")).isEqualTo("SOLID");
    }

    @Test
    void ACIS_데이터_전달() {
        factory.add3dSolid(List.of("400 0 1 0", "body $-1"), null);

        assertThat(created(EntityKind.SOLID3D).getList("acis_data", String.class))
            .containsExactly("400 0 1 0", "body $-1");
    }

    // ============================================================
    // 6. DIMENSION
    // ============================================================

    @Test
    void 선형_치수는_render_호출시에만_렌더링() {
        // when
        DimensionStyleOverride dimension = factory.addLinearDim(
            Point3.of(0, 5), Point3.of(0, 0), Point3.of(10, 0), null, null, 0.0, null, null, null, null
        );

        // then
        verifyNoInteractions(dimensionRenderer);
        AttributeSet created = created(EntityKind.DIMENSION);
        assertThat(created.getString("dimstyle")).isEqualTo("EZDXF");

        dimension.withOverride("dimtxt", 5.0).render();

        ArgumentCaptor<DimensionRequest> captor = ArgumentCaptor.forClass(DimensionRequest.class);
        verify(dimensionRenderer).render(eq(dimension.getHandle()), captor.capture());
        assertThat(captor.getValue().styleOverride().getDouble("dimtxt")).isEqualTo(5.0);
    }

    @Test
    void 연속_치수는_즉시_렌더링() {
        // when
        List<EntityHandle> handles = factory.addMultiPointLinearDim(
            Point3.of(0, 5), List.of(Point3.of(0, 0), Point3.of(3, 0), Point3.of(7, 0)), 0.0, true, null, null, null
        );

        // then
        assertThat(handles).hasSize(2).doesNotHaveDuplicates();
        verify(layout, times(2)).create(eq(EntityKind.DIMENSION), any());
        verify(dimensionRenderer, times(2)).render(any(), any());
    }

    @Test
    void 정렬_치수() {
        factory.addAlignedDim(Point3.of(0, 0), Point3.of(10, 0), 5.0, null, "STANDARD", null, null);

        AttributeSet created = created(EntityKind.DIMENSION);
        assertThat(created.getPoint("defpoint")).isEqualTo(Point3.of(0, 5));
        assertThat(created.getDouble("angle")).isEqualTo(0.0);
        assertThat(created.getString("dimstyle")).isEqualTo("STANDARD");
    }

    @Test
    void 반지름_치수는_설정의_기본_스타일_사용() {
        // given
        DefaultGraphicsFactory custom = new DefaultGraphicsFactory(
            new FactoryConfig().withDefaultDimStyle("ISO-25"), layout, blocks, dimensionRenderer, arrowRenderer
        );

        // when
        DimensionStyleOverride dimension = custom.addRadiusDim(null, null);

        // then
        assertThat(dimension.getRequest().kind()).isEqualTo(DimensionKind.RADIUS);
        assertThat(dimension.getRequest().styleName()).isEqualTo("ISO-25");
        assertThat(created(EntityKind.DIMENSION).getFlags("dimtype").getValue()).isEqualTo(4 | 32);
    }

    // ============================================================
    // 7. 화살표
    // ============================================================

    @Test
    void 화살표는_렌더러에_위임() {
        // given
        Point3 connection = Point3.of(-1, 0);
        when(arrowRenderer.renderArrow(layout, "", Point3.ORIGIN, 1.0, 0.0, AttributeSet.empty()))
            .thenReturn(connection);

        // when
        Point3 result = factory.addArrow("", Point3.ORIGIN, 1.0, 0.0, null);

        // then
        assertThat(result).isEqualTo(connection);
        verifyNoInteractions(layout);
    }

    @Test
    void 생성자_null_인자_거부() {
        assertThatThrownBy(() -> new DefaultGraphicsFactory(null, layout, blocks, dimensionRenderer, arrowRenderer))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config cannot be null");
        assertThatThrownBy(() -> new DefaultGraphicsFactory(new FactoryConfig(), layout, blocks, null, arrowRenderer))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private DefaultGraphicsFactory factory(FormatVersion version) {
        return new DefaultGraphicsFactory(
            new FactoryConfig().withDxfVersion(version), layout, blocks, dimensionRenderer, arrowRenderer
        );
    }

    private AttributeSet created(EntityKind kind) {
        ArgumentCaptor<AttributeSet> captor = ArgumentCaptor.forClass(AttributeSet.class);
        verify(layout, atLeastOnce()).create(eq(kind), captor.capture());
        return captor.getValue();
    }
}
