package xyz.vvrf.ascii.dag.render;

import xyz.vvrf.ascii.dag.core.LayoutInvariantException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 可变字符网格，按 (行, 列) 寻址。
 * <p>
 * 画布分三层保存内容：节点字形、标记 (箭头、自环) 和连线的连通方向。
 * 输出时逐格合成，优先级为 节点 &gt; 标记 &gt; 连线 &gt; 空白。
 * 连线只记录每格向上下左右哪些方向连通，最终字形在输出时由 {@link GlyphSet#lineGlyph(int)} 决定；
 * 如果同一格被互不相关的两段路径占用，则输出交叉字形。
 *
 * @author ruifeng.wen
 */
public final class Canvas {

    public static final int UP = 1;
    public static final int DOWN = 1 << 1;
    public static final int LEFT = 1 << 2;
    public static final int RIGHT = 1 << 3;

    private static final char EMPTY = '\0';

    private final int width;
    private final int height;
    private final char[][] nodeCells;
    private final char[][] markers;
    private final int[][] connections;
    private final boolean[][] crossings;
    private final Map<Integer, List<PathOwner>> owners = new HashMap<>();

    public Canvas(int width, int height) {
        if (width < 0 || height < 0) {
            throw new LayoutInvariantException(String.format("Canvas size must not be negative: %dx%d", width, height));
        }
        this.width = width;
        this.height = height;
        this.nodeCells = new char[height][width];
        this.markers = new char[height][width];
        this.connections = new int[height][width];
        this.crossings = new boolean[height][width];
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /**
     * 写入节点字形。节点字形不允许互相覆盖。
     *
     * @throws LayoutInvariantException 越界或与已有节点字形重叠时
     */
    public void putNode(int row, int column, String text) {
        for (int i = 0; i < text.length(); i++) {
            int col = column + i;
            checkBounds(row, col);
            if (nodeCells[row][col] != EMPTY) {
                throw new LayoutInvariantException(String.format("Node glyph '%s' overlaps another node at (%d, %d)", text, row, col));
            }
            nodeCells[row][col] = text.charAt(i);
        }
    }

    /**
     * 写入标记字符 (箭头或自环)，后写入的覆盖先写入的。
     */
    public void putMarker(int row, int column, char marker) {
        checkBounds(row, column);
        markers[row][column] = marker;
    }

    /**
     * 为某一格增加连通方向。
     *
     * @param row       行
     * @param column    列
     * @param direction {@link #UP}/{@link #DOWN}/{@link #LEFT}/{@link #RIGHT} 的组合
     * @param owner     绘制这一格的路径
     */
    public void connect(int row, int column, int direction, PathOwner owner) {
        checkBounds(row, column);
        connections[row][column] |= direction;
        List<PathOwner> cellOwners = owners.computeIfAbsent(row * width + column, k -> new ArrayList<>(2));
        for (PathOwner existing : cellOwners) {
            if (existing == owner) {
                return;
            }
            if (!existing.isRelatedTo(owner)) {
                crossings[row][column] = true;
            }
        }
        cellOwners.add(owner);
    }

    public boolean isNodeCell(int row, int column) {
        return inBounds(row, column) && nodeCells[row][column] != EMPTY;
    }

    public boolean isCrossing(int row, int column) {
        return inBounds(row, column) && crossings[row][column];
    }

    public int getConnections(int row, int column) {
        return inBounds(row, column) ? connections[row][column] : 0;
    }

    /**
     * 按优先级合成某一格最终输出的字符。
     */
    public char charAt(int row, int column, GlyphSet glyphs) {
        checkBounds(row, column);
        if (nodeCells[row][column] != EMPTY) {
            return nodeCells[row][column];
        }
        if (markers[row][column] != EMPTY) {
            return markers[row][column];
        }
        if (crossings[row][column]) {
            return glyphs.get(Glyph.CROSSING);
        }
        if (connections[row][column] != 0) {
            return glyphs.lineGlyph(connections[row][column]);
        }
        return ' ';
    }

    /**
     * 输出文本：每行去掉行尾空白，去掉首尾空行，以 '\n' 连接。
     */
    public String toText(GlyphSet glyphs) {
        List<String> rows = new ArrayList<>(height);
        for (int row = 0; row < height; row++) {
            StringBuilder sb = new StringBuilder(width);
            for (int col = 0; col < width; col++) {
                sb.append(charAt(row, col, glyphs));
            }
            rows.add(rtrim(sb));
        }
        int first = 0;
        while (first < rows.size() && rows.get(first).isEmpty()) {
            first++;
        }
        int last = rows.size() - 1;
        while (last >= first && rows.get(last).isEmpty()) {
            last--;
        }
        if (first > last) {
            return "";
        }
        return String.join("\n", rows.subList(first, last + 1));
    }

    private static String rtrim(StringBuilder sb) {
        int end = sb.length();
        while (end > 0 && sb.charAt(end - 1) == ' ') {
            end--;
        }
        return sb.substring(0, end);
    }

    private boolean inBounds(int row, int column) {
        return row >= 0 && row < height && column >= 0 && column < width;
    }

    private void checkBounds(int row, int column) {
        if (!inBounds(row, column)) {
            throw new LayoutInvariantException(String.format("Cell (%d, %d) is outside the %dx%d canvas", row, column, width, height));
        }
    }

    /**
     * 占用连线单元格的一方。两段相关的路径 (例如共享同一端点) 在同一格汇合时画成分叉或汇合字形，
     * 不相关的路径在同一格相遇时画成交叉字形。
     */
    public interface PathOwner {
        boolean isRelatedTo(PathOwner other);
    }
}
