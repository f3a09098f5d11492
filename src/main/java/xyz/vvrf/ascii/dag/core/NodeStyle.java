package xyz.vvrf.ascii.dag.core;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 节点的绘制样式，决定标签两侧的定界符。
 * 具体字符由 {@link xyz.vvrf.ascii.dag.render.GlyphResolver} 查表得到。
 *
 * @author ruifeng.wen
 */
public enum NodeStyle {
    /** 无定界符，只绘制标签: A */
    MINIMAL,
    /** 方括号: [A] */
    SQUARE,
    /** 圆括号: (A) */
    ROUND,
    /** 尖括号: &lt;A&gt; */
    DIAMOND,
    /** 调用方提供的定界符对，见 {@link RenderOptions#getCustomDelimiters()} */
    CUSTOM;

    /**
     * 按名称 (不区分大小写) 解析样式。
     *
     * @throws ConfigurationException 如果名称未知
     */
    public static NodeStyle fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toUpperCase(Locale.ROOT);
            for (NodeStyle style : values()) {
                if (style.name().equals(normalized)) {
                    return style;
                }
            }
        }
        throw new ConfigurationException(String.format("Unknown node style '%s'. Expected one of: %s", name,
                Arrays.stream(values()).map(s -> s.name().toLowerCase(Locale.ROOT)).collect(Collectors.joining(", "))));
    }
}
