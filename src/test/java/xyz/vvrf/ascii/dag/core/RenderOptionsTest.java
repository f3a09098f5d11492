package xyz.vvrf.ascii.dag.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RenderOptions")
class RenderOptionsTest {

    @Test
    @DisplayName("默认值")
    void defaults() {
        RenderOptions options = RenderOptions.defaults();

        assertThat(options.getNodeStyle()).isEqualTo(NodeStyle.SQUARE);
        assertThat(options.getCharset()).isEqualTo(CharSet.UNICODE);
        assertThat(options.getNodeSpacing()).isEqualTo(4);
        assertThat(options.getLayerSpacing()).isEqualTo(2);
        assertThat(options.isShowArrows()).isTrue();
        assertThat(options.getMaxCrossingSweeps()).isEqualTo(24);
        assertThat(options.validate()).isSameAs(options);
    }

    @Test
    @DisplayName("间距必须为正数")
    void spacingMustBePositive() {
        assertThatThrownBy(() -> RenderOptions.builder().nodeSpacing(0).build().validate())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("nodeSpacing");
        assertThatThrownBy(() -> RenderOptions.builder().layerSpacing(-1).build().validate())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("layerSpacing");
    }

    @Test
    @DisplayName("扫描轮数必须在 [0, 1000] 内")
    void sweepsAreBounded() {
        assertThat(RenderOptions.builder().maxCrossingSweeps(0).build().validate()).isNotNull();
        assertThat(RenderOptions.builder().maxCrossingSweeps(1000).build().validate()).isNotNull();
        assertThatThrownBy(() -> RenderOptions.builder().maxCrossingSweeps(1001).build().validate())
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> RenderOptions.builder().maxCrossingSweeps(-1).build().validate())
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("CUSTOM 样式需要定界符")
    void customStyleNeedsDelimiters() {
        assertThatThrownBy(() -> RenderOptions.builder().nodeStyle(NodeStyle.CUSTOM).build().validate())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("customDelimiters");

        RenderOptions ok = RenderOptions.builder()
                .nodeStyle(NodeStyle.CUSTOM)
                .customDelimiters(RenderOptions.Delimiters.of("", ">"))
                .build();
        assertThat(ok.validate()).isSameAs(ok);
    }

    @Test
    @DisplayName("ascii 字符集下的定界符必须是可打印 ASCII")
    void asciiDelimitersMustBePrintable() {
        RenderOptions options = RenderOptions.builder()
                .nodeStyle(NodeStyle.CUSTOM)
                .customDelimiters(RenderOptions.Delimiters.of("«", "»"))
                .charset(CharSet.ASCII)
                .build();

        assertThatThrownBy(options::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("7-bit");
        assertThat(options.toBuilder().charset(CharSet.UNICODE).build().validate()).isNotNull();
    }

    @Test
    @DisplayName("定界符不允许控制字符")
    void delimitersRejectControlCharacters() {
        RenderOptions options = RenderOptions.builder()
                .nodeStyle(NodeStyle.CUSTOM)
                .customDelimiters(RenderOptions.Delimiters.of("\t", "|"))
                .build();

        assertThatThrownBy(options::validate).isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("样式和字符集按名称解析，不区分大小写")
    void parsesNames() {
        assertThat(NodeStyle.fromName("Round")).isEqualTo(NodeStyle.ROUND);
        assertThat(NodeStyle.fromName(" minimal ")).isEqualTo(NodeStyle.MINIMAL);
        assertThat(CharSet.fromName("ASCII")).isEqualTo(CharSet.ASCII);
        assertThat(CharSet.UNICODE.toString()).isEqualTo("unicode");

        assertThatThrownBy(() -> NodeStyle.fromName("hexagon"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("minimal, square, round, diamond, custom");
        assertThatThrownBy(() -> CharSet.fromName(null))
                .isInstanceOf(ConfigurationException.class);
    }
}
