package com.ryuqq.graphics.adapter.inmemory.render;

import com.ryuqq.graphics.core.attribute.AttributeAssembler;
import com.ryuqq.graphics.core.dimension.ArrowNames;
import com.ryuqq.graphics.core.geometry.QuadrilateralNormalizer;
import com.ryuqq.graphics.core.model.AttributeSet;
import com.ryuqq.graphics.core.model.EntityKind;
import com.ryuqq.graphics.core.model.Point3;
import com.ryuqq.graphics.core.spi.ArrowRenderer;
import com.ryuqq.graphics.core.spi.EntityCreator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * 최소한의 화살표 라이브러리.
 *
 * <p>틱 형태 화살표({@link ArrowNames#isTick(String)})는 사선 LINE 하나로, 작은 점(DOTSMALL,
 * DOTBLANK)은 CIRCLE로, 그 밖의 화살표는 채워진 삼각형 SOLID로 그립니다. 블록 참조 방식은 {@code _<NAME>} 블록을 INSERT합니다
 * (기본 화살표는 {@value #CLOSED_FILLED_BLOCK}).</p>
 *
 * <p><strong>연결점:</strong> 틱과 작은 점은 삽입점, 나머지는 회전 방향 반대쪽으로
 * size만큼 떨어진 점입니다.</p>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public class SimpleArrowRenderer implements ArrowRenderer {

    private static final Logger log = LoggerFactory.getLogger(SimpleArrowRenderer.class);

    static final String CLOSED_FILLED_BLOCK = "_CLOSEDFILLED";
    private static final double HALF_WIDTH_FACTOR = 1.0 / 6.0;
    private static final double DOT_RADIUS_FACTOR = 0.25;

    @Override
    public Point3 renderArrow(EntityCreator target, String name, Point3 insert, double size, double rotation,
                              AttributeSet attributes) {
        requireArguments(target, name, insert);
        if (ArrowNames.isTick(name)) {
            if (!ArrowNames.NONE.equalsIgnoreCase(name.trim())) {
                Point3 half = direction(rotation + 45.0).multiply(size / 2.0);
                target.create(EntityKind.LINE, AttributeAssembler.assemble(EntityKind.LINE, attributes,
                    AttributeSet.builder()
                        .put("start", insert.subtract(half))
                        .put("end", insert.add(half))
                        .build()));
            }
        } else if (ArrowNames.isOriginZero(name)) {
            target.create(EntityKind.CIRCLE, AttributeAssembler.assemble(EntityKind.CIRCLE, attributes,
                AttributeSet.builder()
                    .put("center", insert)
                    .put("radius", size * DOT_RADIUS_FACTOR)
                    .build()));
        } else {
            Point3 back = direction(rotation).multiply(-size);
            Point3 side = direction(rotation).orthogonal().multiply(size * HALF_WIDTH_FACTOR);
            List<Point3> triangle = List.of(insert, insert.add(back).add(side), insert.add(back).subtract(side));
            target.create(EntityKind.SOLID, AttributeAssembler.assemble(EntityKind.SOLID, attributes,
                QuadrilateralNormalizer.toAttributes(triangle)));
        }
        log.debug("Rendered arrow '{}' at {}", name, insert);
        return connectionPoint(name, insert, size, rotation);
    }

    @Override
    public Point3 insertArrow(EntityCreator target, String name, Point3 insert, double size, double rotation,
                              AttributeSet attributes) {
        requireArguments(target, name, insert);
        target.create(EntityKind.INSERT, AttributeAssembler.assemble(EntityKind.INSERT, attributes,
            AttributeSet.builder()
                .put("name", blockName(name))
                .put("insert", insert)
                .put("xscale", size)
                .put("yscale", size)
                .put("zscale", size)
                .put("rotation", rotation)
                .build()));
        log.debug("Inserted arrow block '{}' at {}", blockName(name), insert);
        return connectionPoint(name, insert, size, rotation);
    }

    /**
     * 화살표 블록 이름.
     *
     * @param name 화살표 이름
     * @return {@code _} 접두사가 붙은 대문자 이름
     */
    static String blockName(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        return normalized.isEmpty() ? CLOSED_FILLED_BLOCK : "_" + normalized;
    }

    private static Point3 connectionPoint(String name, Point3 insert, double size, double rotation) {
        if (ArrowNames.isOriginZero(name)) {
            return insert;
        }
        return insert.add(direction(rotation).multiply(-size));
    }

    private static Point3 direction(double angleDeg) {
        double radians = Math.toRadians(angleDeg);
        return Point3.of(Math.cos(radians), Math.sin(radians));
    }

    private static void requireArguments(EntityCreator target, String name, Point3 insert) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (insert == null) {
            throw new IllegalArgumentException("insert cannot be null");
        }
    }
}
