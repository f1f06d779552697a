package com.ryuqq.graphics.application.factory;

import com.ryuqq.graphics.core.dimension.DimensionKind;
import com.ryuqq.graphics.core.dimension.DimensionRequest;
import com.ryuqq.graphics.core.model.AttributeSet;
import com.ryuqq.graphics.core.model.EntityHandle;
import com.ryuqq.graphics.core.spi.DimensionRenderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * DimensionStyleOverride 유닛 테스트.
 *
 * @author Graphics Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DimensionStyleOverrideTest {

    private static final EntityHandle HANDLE = EntityHandle.of("1F");

    @Mock
    private DimensionRenderer renderer;

    private static DimensionRequest request() {
        return new DimensionRequest(
            DimensionKind.LINEAR, AttributeSet.builder().put("dimstyle", "EZDXF").build(), "EZDXF", null, null
        );
    }

    @Test
    void render는_렌더러에_위임() {
        // given
        DimensionRequest request = request();
        DimensionStyleOverride dimension = new DimensionStyleOverride(HANDLE, request, renderer);

        // when
        dimension.render();

        // then
        verify(renderer).render(HANDLE, request);
    }

    @Test
    void withOverride는_새_인스턴스_반환_원본_불변() {
        // given
        DimensionStyleOverride original = new DimensionStyleOverride(HANDLE, request(), renderer);

        // when
        DimensionStyleOverride changed = original.withOverride("dimse1", 1);

        // then
        assertThat(changed).isNotSameAs(original);
        assertThat(changed.getHandle()).isEqualTo(HANDLE);
        assertThat(changed.getRequest().styleOverride().getInt("dimse1")).isEqualTo(1);
        assertThat(original.getRequest().styleOverride().contains("dimse1")).isFalse();
        verifyNoInteractions(renderer);
    }

    @Test
    void null_인자_거부() {
        assertThatThrownBy(() -> new DimensionStyleOverride(null, request(), renderer))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DimensionStyleOverride(HANDLE, null, renderer))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DimensionStyleOverride(HANDLE, request(), null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
