package xyz.vvrf.ascii.dag.render;

import xyz.vvrf.ascii.dag.core.CharSet;
import xyz.vvrf.ascii.dag.core.LayoutInvariantException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * 一次渲染使用的完整字形表：节点左右定界符加上每个 {@link Glyph} 对应的字符。
 * 由 {@link GlyphResolver} 创建，不可变。
 *
 * @author ruifeng.wen
 */
public final class GlyphSet {

    private final CharSet charset;
    private final String leftDelimiter;
    private final String rightDelimiter;
    private final Map<Glyph, Character> glyphs;

    GlyphSet(CharSet charset, String leftDelimiter, String rightDelimiter, Map<Glyph, Character> glyphs) {
        this.charset = Objects.requireNonNull(charset, "字符集不能为空");
        this.leftDelimiter = Objects.requireNonNull(leftDelimiter, "左定界符不能为空");
        this.rightDelimiter = Objects.requireNonNull(rightDelimiter, "右定界符不能为空");
        EnumMap<Glyph, Character> copy = new EnumMap<>(Glyph.class);
        copy.putAll(glyphs);
        for (Glyph glyph : Glyph.values()) {
            if (!copy.containsKey(glyph)) {
                throw new LayoutInvariantException(String.format("Glyph table for charset %s is missing %s", charset, glyph));
            }
        }
        this.glyphs = Collections.unmodifiableMap(copy);
    }

    public CharSet getCharset() {
        return charset;
    }

    public String getLeftDelimiter() {
        return leftDelimiter;
    }

    public String getRightDelimiter() {
        return rightDelimiter;
    }

    public int getDelimiterWidth() {
        return leftDelimiter.length() + rightDelimiter.length();
    }

    public char get(Glyph glyph) {
        return glyphs.get(glyph);
    }

    public Map<Glyph, Character> asMap() {
        return glyphs;
    }

    /**
     * 节点字形：定界符包裹的标签。
     */
    public String nodeGlyph(String label) {
        return leftDelimiter + label + rightDelimiter;
    }

    /**
     * 根据单元格的连通方向选择线条字形。
     *
     * @param connections {@link Canvas#UP} 等方向位的组合
     */
    public char lineGlyph(int connections) {
        boolean up = (connections & Canvas.UP) != 0;
        boolean down = (connections & Canvas.DOWN) != 0;
        boolean left = (connections & Canvas.LEFT) != 0;
        boolean right = (connections & Canvas.RIGHT) != 0;
        boolean vertical = up || down;
        boolean horizontal = left || right;

        if (up && down && left && right) {
            return get(Glyph.CROSSING);
        }
        if (up && down) {
            return left ? get(Glyph.TEE_LEFT) : right ? get(Glyph.TEE_RIGHT) : get(Glyph.VERTICAL);
        }
        if (left && right) {
            return up ? get(Glyph.TEE_UP) : down ? get(Glyph.TEE_DOWN) : get(Glyph.HORIZONTAL);
        }
        if (vertical && horizontal) {
            if (down) {
                return right ? get(Glyph.CORNER_DOWN_RIGHT) : get(Glyph.CORNER_DOWN_LEFT);
            }
            return right ? get(Glyph.CORNER_UP_RIGHT) : get(Glyph.CORNER_UP_LEFT);
        }
        return horizontal ? get(Glyph.HORIZONTAL) : get(Glyph.VERTICAL);
    }

    @Override
    public String toString() {
        return "GlyphSet{" + charset + ", " + leftDelimiter + "label" + rightDelimiter + '}';
    }
}
