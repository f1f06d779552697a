package com.ryuqq.graphics.adapter.inmemory;

import com.ryuqq.graphics.adapter.inmemory.block.InMemoryBlockTable;
import com.ryuqq.graphics.adapter.inmemory.entity.InMemoryEntityDatabase;
import com.ryuqq.graphics.adapter.inmemory.entity.InMemoryLayout;
import com.ryuqq.graphics.adapter.inmemory.entity.StoredEntity;
import com.ryuqq.graphics.adapter.inmemory.render.RecordingDimensionRenderer;
import com.ryuqq.graphics.adapter.inmemory.render.SimpleArrowRenderer;
import com.ryuqq.graphics.application.factory.DefaultGraphicsFactory;
import com.ryuqq.graphics.application.factory.DimensionStyleOverride;
import com.ryuqq.graphics.application.factory.FactoryConfig;
import com.ryuqq.graphics.application.factory.GraphicsFactory;
import com.ryuqq.graphics.core.exception.DxfValueException;
import com.ryuqq.graphics.core.exception.DxfVersionException;
import com.ryuqq.graphics.core.model.AttributeSet;
import com.ryuqq.graphics.core.model.EntityHandle;
import com.ryuqq.graphics.core.model.EntityKind;
import com.ryuqq.graphics.core.model.FormatVersion;
import com.ryuqq.graphics.core.model.Point3;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * In-Memory 어댑터 위에서 DefaultGraphicsFactory 통합 테스트.
 *
 * @author Graphics Team
 * @since 1.0.0
 */
class GraphicsFactoryIntegrationTest {

    private InMemoryEntityDatabase database;
    private InMemoryBlockTable blocks;
    private RecordingDimensionRenderer dimensionRenderer;
    private InMemoryLayout modelSpace;
    private GraphicsFactory factory;

    @BeforeEach
    void setUp() {
        database = new InMemoryEntityDatabase();
        blocks = new InMemoryBlockTable(database);
        dimensionRenderer = new RecordingDimensionRenderer();
        modelSpace = database.modelSpace();
        factory = factory(FormatVersion.R2013);
    }

    private GraphicsFactory factory(FormatVersion version) {
        return new DefaultGraphicsFactory(
            new FactoryConfig().withDxfVersion(version), modelSpace, blocks, dimensionRenderer,
            new SimpleArrowRenderer()
        );
    }

    @Test
    void 자동_블록_참조_생성() {
        // given
        InMemoryLayout flag = blocks.defineBlock("FLAG", Point3.of(10, 10));
        flag.create(EntityKind.LINE, AttributeSet.builder()
            .put("start", Point3.of(10, 10)).put("end", Point3.of(10, 14)).build());
        flag.create(EntityKind.ATTDEF, AttributeSet.builder()
            .put("tag", "NAME").put("prompt", "Name?").put("insert", Point3.of(11, 13)).put("height", 0.5).build());
        flag.create(EntityKind.ATTDEF, AttributeSet.builder()
            .put("tag", "XPOS").put("insert", Point3.of(11, 12)).build());

        // when
        EntityHandle handle = factory.addAutoBlockRef(
            "FLAG", Point3.of(100, 50), Map.of("NAME", "Flag 1"), AttributeSet.builder().put("layer", "FLAGS").build()
        );

        // then
        StoredEntity insert = database.get(handle);
        assertThat(insert.owner()).isEqualTo(InMemoryEntityDatabase.MODEL_SPACE);
        String anonymous = insert.attributes().getString("name");
        assertThat(anonymous).startsWith("*U");
        assertThat(insert.attributes().getPoint("insert")).isEqualTo(Point3.of(100, 50));
        assertThat(insert.attributes().getString("layer")).isEqualTo("FLAGS");

        InMemoryLayout anonymousBlock = blocks.layout(anonymous);
        StoredEntity blockRef = anonymousBlock.entities(EntityKind.INSERT).get(0);
        assertThat(blockRef.attributes().getString("name")).isEqualTo("FLAG");
        assertThat(blockRef.attributes().getInt("attribs_follow")).isEqualTo(1);

        List<StoredEntity> attribs = anonymousBlock.entities(EntityKind.ATTRIB);
        assertThat(attribs).hasSize(2);
        AttributeSet name = attribs.get(0).attributes();
        assertThat(name.getString("text")).isEqualTo("Flag 1");
        assertThat(name.getPoint("insert")).isEqualTo(Point3.of(1, 3));
        assertThat(name.getString("owner")).isEqualTo(blockRef.handle().getValue());
        assertThat(name.contains("prompt")).isFalse();
        assertThat(name.contains("handle")).isFalse();
        assertThat(attribs.get(1).attributes().getString("text")).isEmpty();
    }

    @Test
    void 정의되지_않은_블록은_익명_블록_미생성() {
        assertThatThrownBy(() -> factory.addAutoBlockRef("MISSING", Point3.ORIGIN, Map.of(), null))
            .isInstanceOf(DxfValueException.class);
        assertThat(blocks.size()).isZero();
        assertThat(database.size()).isZero();
    }

    @Test
    void 버전_위반시_데이터베이스_변화_없음() {
        GraphicsFactory r12 = factory(FormatVersion.R12);

        assertThatThrownBy(() -> r12.addMText("hello", null)).isInstanceOf(DxfVersionException.class);
        assertThat(database.size()).isZero();
    }

    @Test
    void 닫힌_스플라인_맞춤점_보간() {
        // given
        List<Point3> fitPoints = List.of(Point3.of(0, 0), Point3.of(2, 0), Point3.of(2, 2), Point3.of(0, 2));

        // when
        EntityHandle handle = factory.addClosedSplineControlFrame(fitPoints, 3, "uniform", 0.5, null);

        // then
        AttributeSet spline = database.get(handle).attributes();
        List<Point3> controlPoints = spline.getList("control_points", Point3.class);
        List<Double> knots = spline.getList("knots", Double.class);
        assertThat(controlPoints).hasSize(7);
        assertThat(knots).hasSize(11);
        assertThat(spline.getFlags("flags").getValue()).isEqualTo(3);
        for (int i = 0; i < 3; i++) {
            assertThat(controlPoints.get(4 + i).distance(controlPoints.get(i))).isCloseTo(0.0, within(1e-9));
        }
    }

    @Test
    void 치수_렌더링_기록() {
        // when
        DimensionStyleOverride dimension = factory.addLinearDim(
            Point3.of(0, 3), Point3.ORIGIN, Point3.of(4, 0), Point3.of(2, 5), null, 0.0, null, null, null, null
        );
        dimension.render();
        List<EntityHandle> chain = factory.addMultiPointLinearDim(
            Point3.of(0, 6), List.of(Point3.ORIGIN, Point3.of(4, 0), Point3.of(9, 0)), 0.0, true, null, null, null
        );

        // then
        assertThat(modelSpace.entities(EntityKind.DIMENSION)).hasSize(3);
        assertThat(database.get(dimension.getHandle()).attributes().getFlags("dimtype").getValue())
            .isEqualTo(32 | 128);
        assertThat(dimensionRenderer.rendered()).hasSize(3);
        RecordingDimensionRenderer.RenderedDimension second = dimensionRenderer.rendered().get(2);
        assertThat(second.handle()).isEqualTo(chain.get(1));
        assertThat(second.request().styleOverride().getInt("dimse1")).isEqualTo(1);
        assertThat(dimensionRenderer.rendered().get(1).request().styleOverride().contains("dimse1")).isFalse();
    }

    @Test
    void 화살표는_모델_공간에_생성() {
        // when
        Point3 connection = factory.addArrow("", Point3.of(5, 0), 1.0, 180.0, null);
        factory.addArrowBlockRef("ARCHTICK", Point3.ORIGIN, 1.0, 0.0, null);

        // then
        assertThat(connection.x()).isCloseTo(6.0, within(1e-9));
        assertThat(modelSpace.entities(EntityKind.SOLID)).hasSize(1);
        assertThat(modelSpace.entities(EntityKind.INSERT).get(0).attributes().getString("name"))
            .isEqualTo("_ARCHTICK");
    }
}
