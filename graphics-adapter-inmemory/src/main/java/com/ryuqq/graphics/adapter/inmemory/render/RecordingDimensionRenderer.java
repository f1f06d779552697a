package com.ryuqq.graphics.adapter.inmemory.render;

import com.ryuqq.graphics.core.dimension.DimensionRequest;
import com.ryuqq.graphics.core.model.EntityHandle;
import com.ryuqq.graphics.core.spi.DimensionRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 렌더링 요청을 기록만 하는 {@link DimensionRenderer}.
 *
 * <p>치수 형상은 만들지 않으며, 어떤 치수가 어떤 스타일 재정의로 렌더링되었는지
 * 검증하는 용도입니다.</p>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public class RecordingDimensionRenderer implements DimensionRenderer {

    private static final Logger log = LoggerFactory.getLogger(RecordingDimensionRenderer.class);

    private final List<RenderedDimension> rendered = new CopyOnWriteArrayList<>();

    @Override
    public void render(EntityHandle dimension, DimensionRequest request) {
        if (dimension == null) {
            throw new IllegalArgumentException("dimension cannot be null");
        }
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        rendered.add(new RenderedDimension(dimension, request));
        log.debug("Rendered {} dimension {} with style {}",
            request.kind(), dimension.getValue(), request.styleName());
    }

    /**
     * 렌더링 순서대로 기록 목록.
     *
     * @return 불변 목록
     */
    public List<RenderedDimension> rendered() {
        return Collections.unmodifiableList(new ArrayList<>(rendered));
    }

    public void clear() {
        rendered.clear();
    }

    /**
     * 렌더링 기록 한 건.
     *
     * @param handle DIMENSION 엔티티 핸들
     * @param request 렌더링 시점의 요청
     */
    public record RenderedDimension(EntityHandle handle, DimensionRequest request) {
    }
}
