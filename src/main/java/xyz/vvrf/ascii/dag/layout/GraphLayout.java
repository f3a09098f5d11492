package xyz.vvrf.ascii.dag.layout;

import lombok.Value;
import xyz.vvrf.ascii.dag.core.LayoutInvariantException;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 布局的最终结果：每个顶点的整数坐标与宽度、每层所在的行以及画布尺寸。
 * 由 {@link CoordinateAssigner} 生成，之后只读。
 *
 * @author ruifeng.wen
 */
public final class GraphLayout {

    private final LayeredGraph layeredGraph;
    private final CrossingReducer.Ordering ordering;
    private final Map<LayoutVertex, Integer> xs;
    private final Map<LayoutVertex, Integer> widths;
    private final int[] layerRows;
    private final int width;
    private final int height;

    GraphLayout(LayeredGraph layeredGraph,
                CrossingReducer.Ordering ordering,
                Map<LayoutVertex, Integer> xs,
                Map<LayoutVertex, Integer> widths,
                int[] layerRows,
                int width,
                int height) {
        this.layeredGraph = layeredGraph;
        this.ordering = ordering;
        this.xs = Collections.unmodifiableMap(xs);
        this.widths = Collections.unmodifiableMap(widths);
        this.layerRows = layerRows.clone();
        this.width = width;
        this.height = height;
    }

    public LayeredGraph getLayeredGraph() {
        return layeredGraph;
    }

    public LayerAssignment getAssignment() {
        return layeredGraph.getAssignment();
    }

    /**
     * 冻结后的层内顺序。
     */
    public List<List<LayoutVertex>> getLayers() {
        return ordering.getLayers();
    }

    public int getCrossings() {
        return ordering.getCrossings();
    }

    public int getX(LayoutVertex vertex) {
        Integer x = xs.get(vertex);
        if (x == null) {
            throw new LayoutInvariantException("Vertex without coordinates: " + vertex);
        }
        return x;
    }

    public int getWidth(LayoutVertex vertex) {
        Integer w = widths.get(vertex);
        if (w == null) {
            throw new LayoutInvariantException("Vertex without width: " + vertex);
        }
        return w;
    }

    /**
     * 顶点所在的行。
     */
    public int getRow(LayoutVertex vertex) {
        return layerRows[vertex.getLayer()];
    }

    public int getLayerRow(int layer) {
        return layerRows[layer];
    }

    /**
     * 普通边在顶点上的连接列：字形中心。
     */
    public int getAttachColumn(LayoutVertex vertex) {
        return attachColumn(getX(vertex), getWidth(vertex));
    }

    /**
     * 回边在顶点上的连接列：中心右侧一格 (不超出字形)，与普通边错开。
     */
    public int getBackEdgeAttachColumn(LayoutVertex vertex) {
        return backEdgeAttachColumn(getX(vertex), getWidth(vertex));
    }

    static int attachColumn(int x, int width) {
        return x + width / 2;
    }

    static int backEdgeAttachColumn(int x, int width) {
        return Math.min(attachColumn(x, width) + 1, x + width - 1);
    }

    public int getCanvasWidth() {
        return width;
    }

    public int getCanvasHeight() {
        return height;
    }

    /**
     * 查询真实节点的最终位置。
     */
    public NodePosition getPosition(String nodeId) {
        LayoutVertex vertex = layeredGraph.getVertex(nodeId);
        int order = getLayers().get(vertex.getLayer()).indexOf(vertex);
        return new NodePosition(nodeId, vertex.getLayer(), order, getX(vertex), getRow(vertex), getWidth(vertex));
    }

    /**
     * 节点的最终位置 (层号, 层内顺序, 起始列, 行, 宽度)。
     */
    @Value
    public static class NodePosition {
        String nodeId;
        int layer;
        int order;
        int x;
        int y;
        int width;

        public int getCenter() {
            return x + width / 2;
        }
    }
}
