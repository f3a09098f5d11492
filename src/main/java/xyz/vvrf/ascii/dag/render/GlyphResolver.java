package xyz.vvrf.ascii.dag.render;

import xyz.vvrf.ascii.dag.core.CharSet;
import xyz.vvrf.ascii.dag.core.ConfigurationException;
import xyz.vvrf.ascii.dag.core.NodeStyle;
import xyz.vvrf.ascii.dag.core.RenderOptions;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 样式与字符集解析器：纯查表，无状态。
 * (节点样式 × 字符集) 的每一种组合都能得到完整的 {@link GlyphSet}；
 * 新增一种样式只需要在 {@link #DELIMITERS} 中加一行。
 *
 * @author ruifeng.wen
 */
public final class GlyphResolver {

    private static final Map<NodeStyle, String[]> DELIMITERS;
    private static final Map<CharSet, Map<Glyph, Character>> LINE_GLYPHS;

    static {
        Map<NodeStyle, String[]> delimiters = new EnumMap<>(NodeStyle.class);
        delimiters.put(NodeStyle.MINIMAL, new String[]{"", ""});
        delimiters.put(NodeStyle.SQUARE, new String[]{"[", "]"});
        delimiters.put(NodeStyle.ROUND, new String[]{"(", ")"});
        delimiters.put(NodeStyle.DIAMOND, new String[]{"<", ">"});
        DELIMITERS = Collections.unmodifiableMap(delimiters);

        Map<Glyph, Character> ascii = new EnumMap<>(Glyph.class);
        ascii.put(Glyph.VERTICAL, '|');
        ascii.put(Glyph.HORIZONTAL, '-');
        ascii.put(Glyph.CORNER_DOWN_RIGHT, '+');
        ascii.put(Glyph.CORNER_DOWN_LEFT, '+');
        ascii.put(Glyph.CORNER_UP_RIGHT, '+');
        ascii.put(Glyph.CORNER_UP_LEFT, '+');
        ascii.put(Glyph.TEE_RIGHT, '+');
        ascii.put(Glyph.TEE_LEFT, '+');
        ascii.put(Glyph.TEE_DOWN, '+');
        ascii.put(Glyph.TEE_UP, '+');
        ascii.put(Glyph.CROSSING, '+');
        ascii.put(Glyph.ARROW_UP, '^');
        ascii.put(Glyph.ARROW_DOWN, 'v');
        ascii.put(Glyph.ARROW_LEFT, '<');
        ascii.put(Glyph.ARROW_RIGHT, '>');
        ascii.put(Glyph.SELF_LOOP, '@');

        Map<Glyph, Character> unicode = new EnumMap<>(Glyph.class);
        unicode.put(Glyph.VERTICAL, '│');
        unicode.put(Glyph.HORIZONTAL, '─');
        unicode.put(Glyph.CORNER_DOWN_RIGHT, '┌');
        unicode.put(Glyph.CORNER_DOWN_LEFT, '┐');
        unicode.put(Glyph.CORNER_UP_RIGHT, '└');
        unicode.put(Glyph.CORNER_UP_LEFT, '┘');
        unicode.put(Glyph.TEE_RIGHT, '├');
        unicode.put(Glyph.TEE_LEFT, '┤');
        unicode.put(Glyph.TEE_DOWN, '┬');
        unicode.put(Glyph.TEE_UP, '┴');
        unicode.put(Glyph.CROSSING, '┼');
        unicode.put(Glyph.ARROW_UP, '↑');
        unicode.put(Glyph.ARROW_DOWN, '↓');
        unicode.put(Glyph.ARROW_LEFT, '←');
        unicode.put(Glyph.ARROW_RIGHT, '→');
        unicode.put(Glyph.SELF_LOOP, '↺');

        Map<CharSet, Map<Glyph, Character>> lines = new EnumMap<>(CharSet.class);
        lines.put(CharSet.ASCII, Collections.unmodifiableMap(ascii));
        lines.put(CharSet.UNICODE, Collections.unmodifiableMap(unicode));
        LINE_GLYPHS = Collections.unmodifiableMap(lines);
    }

    private GlyphResolver() {}

    /**
     * 按渲染配置解析字形表。
     */
    public static GlyphSet resolve(RenderOptions options) {
        return resolve(options.getNodeStyle(), options.getCharset(), options.getCustomDelimiters());
    }

    /**
     * 解析字形表。
     *
     * @param style            节点样式
     * @param charset          字符集
     * @param customDelimiters 样式为 CUSTOM 时使用的定界符，其他样式忽略
     * @throws ConfigurationException 参数为 null 或 CUSTOM 样式缺少定界符时
     */
    public static GlyphSet resolve(NodeStyle style, CharSet charset, RenderOptions.Delimiters customDelimiters) {
        if (style == null || charset == null) {
            throw new ConfigurationException("Node style and charset must not be null");
        }
        String left;
        String right;
        if (style == NodeStyle.CUSTOM) {
            if (customDelimiters == null) {
                throw new ConfigurationException("nodeStyle CUSTOM requires customDelimiters");
            }
            left = customDelimiters.getLeft();
            right = customDelimiters.getRight();
        } else {
            String[] pair = DELIMITERS.get(style);
            left = pair[0];
            right = pair[1];
        }
        return new GlyphSet(charset, left, right, LINE_GLYPHS.get(charset));
    }
}
