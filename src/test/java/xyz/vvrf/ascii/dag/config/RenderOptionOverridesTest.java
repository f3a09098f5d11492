package xyz.vvrf.ascii.dag.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xyz.vvrf.ascii.dag.core.CharSet;
import xyz.vvrf.ascii.dag.core.NodeStyle;
import xyz.vvrf.ascii.dag.core.RenderOptions;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RenderOptionOverrides")
class RenderOptionOverridesTest {

    private final RenderOptions base = RenderOptions.builder()
            .nodeStyle(NodeStyle.ROUND)
            .charset(CharSet.ASCII)
            .nodeSpacing(6)
            .build();

    @Test
    @DisplayName("空覆盖不改变基础配置")
    void noneKeepsBase() {
        assertThat(RenderOptionOverrides.none().isEmpty()).isTrue();
        assertThat(RenderOptionOverrides.none().applyTo(base)).isEqualTo(base);
    }

    @Test
    @DisplayName("只覆盖非 null 的字段")
    void overridesOnlyGivenFields() {
        RenderOptionOverrides overrides = RenderOptionOverrides.builder()
                .charset(CharSet.UNICODE)
                .showArrows(false)
                .build();

        RenderOptions merged = overrides.applyTo(base);

        assertThat(overrides.isEmpty()).isFalse();
        assertThat(merged.getCharset()).isEqualTo(CharSet.UNICODE);
        assertThat(merged.isShowArrows()).isFalse();
        assertThat(merged.getNodeStyle()).isEqualTo(NodeStyle.ROUND);
        assertThat(merged.getNodeSpacing()).isEqualTo(6);
        assertThat(merged.getLayerSpacing()).isEqualTo(RenderOptions.DEFAULT_LAYER_SPACING);
        assertThat(base.isShowArrows()).isTrue();
    }

    @Test
    @DisplayName("合并两组覆盖时后者优先")
    void laterOverridesWin() {
        RenderOptionOverrides host = RenderOptionOverrides.builder()
                .nodeSpacing(2)
                .layerSpacing(3)
                .build();
        RenderOptionOverrides caller = RenderOptionOverrides.builder()
                .nodeSpacing(8)
                .nodeStyle(NodeStyle.CUSTOM)
                .customDelimiters(RenderOptions.Delimiters.of("<<", ">>"))
                .build();

        RenderOptions merged = host.overriddenBy(caller).applyTo(RenderOptions.defaults());

        assertThat(merged.getNodeSpacing()).isEqualTo(8);
        assertThat(merged.getLayerSpacing()).isEqualTo(3);
        assertThat(merged.getNodeStyle()).isEqualTo(NodeStyle.CUSTOM);
        assertThat(merged.getCustomDelimiters().getLeft()).isEqualTo("<<");
        assertThat(merged.validate()).isSameAs(merged);
    }
}
