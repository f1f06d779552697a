package com.ryuqq.graphics.application.factory;

import com.ryuqq.graphics.core.dimension.DimensionRequest;
import com.ryuqq.graphics.core.model.EntityHandle;
import com.ryuqq.graphics.core.spi.DimensionRenderer;

/**
 * 생성된 DIMENSION 엔티티와 그 스타일 재정의.
 *
 * <p>치수 생성은 두 단계로 나뉩니다. 팩토리가 엔티티를 만들고 이 객체를 반환하면,
 * 호출자는 재정의를 추가로 조정한 뒤 {@link #render()}를 명시적으로 호출해야
 * 치수 기하가 생성됩니다.</p>
 *
 * <pre>
 * DimensionStyleOverride dim = factory.addAlignedDim(p1, p2, 5, null, null, null, null);
 * dim.withOverride("dimtxt", 0.5).render();
 * </pre>
 *
 * <p><strong>불변성:</strong> {@link #withOverride}는 새 인스턴스를 반환합니다.</p>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public final class DimensionStyleOverride {

    private final EntityHandle handle;
    private final DimensionRequest request;
    private final DimensionRenderer renderer;

    DimensionStyleOverride(EntityHandle handle, DimensionRequest request, DimensionRenderer renderer) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (renderer == null) {
            throw new IllegalArgumentException("renderer cannot be null");
        }
        this.handle = handle;
        this.request = request;
        this.renderer = renderer;
    }

    /**
     * DIMENSION 엔티티 핸들.
     *
     * @return 핸들
     */
    public EntityHandle getHandle() {
        return handle;
    }

    public DimensionRequest getRequest() {
        return request;
    }

    /**
     * 스타일 재정의 하나를 추가한 새 인스턴스.
     *
     * @param key 재정의 이름 (예: "dimtxt")
     * @param value 값
     * @return 새 DimensionStyleOverride
     */
    public DimensionStyleOverride withOverride(String key, Object value) {
        return new DimensionStyleOverride(handle, request.withOverride(key, value), renderer);
    }

    /**
     * 치수 기하 렌더링 (렌더러에 위임).
     */
    public void render() {
        renderer.render(handle, request);
    }

    @Override
    public String toString() {
        return "DimensionStyleOverride{handle=" + handle.getValue() + ", kind=" + request.kind()
            + ", style=" + request.styleName() + "}";
    }
}
