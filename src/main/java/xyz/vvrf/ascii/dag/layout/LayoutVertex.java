package xyz.vvrf.ascii.dag.layout;

import xyz.vvrf.ascii.dag.core.GraphNode;

import java.util.Comparator;
import java.util.Objects;

/**
 * 分层图中的顶点：要么是真实节点，要么是跨越多层的边在中间层上的虚拟顶点。
 * 虚拟顶点宽度为 1，不绘制节点字形，只在所在层的行上画一段竖线。
 *
 * @author ruifeng.wen
 */
public final class LayoutVertex {

    /**
     * 标识符顺序：真实节点按 ID 排在前，虚拟顶点按 (边序号, 层号) 排在后。
     */
    public static final Comparator<LayoutVertex> IDENTIFIER_ORDER = Comparator
            .comparing(LayoutVertex::isVirtual)
            .thenComparing(v -> v.node == null ? "" : v.node.getId())
            .thenComparingInt(LayoutVertex::getEdgeIndex)
            .thenComparingInt(LayoutVertex::getLayer);

    private final GraphNode node;
    private final int edgeIndex;
    private final int layer;

    private LayoutVertex(GraphNode node, int edgeIndex, int layer) {
        this.node = node;
        this.edgeIndex = edgeIndex;
        this.layer = layer;
    }

    public static LayoutVertex real(GraphNode node, int layer) {
        return new LayoutVertex(Objects.requireNonNull(node, "节点不能为空"), -1, layer);
    }

    public static LayoutVertex virtual(int edgeIndex, int layer) {
        return new LayoutVertex(null, edgeIndex, layer);
    }

    public boolean isVirtual() {
        return node == null;
    }

    /**
     * 真实节点返回对应节点，虚拟顶点返回 null。
     */
    public GraphNode getNode() {
        return node;
    }

    /**
     * 虚拟顶点所属边的插入序号，真实节点为 -1。
     */
    public int getEdgeIndex() {
        return edgeIndex;
    }

    public int getLayer() {
        return layer;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LayoutVertex that = (LayoutVertex) o;
        return edgeIndex == that.edgeIndex &&
                layer == that.layer &&
                Objects.equals(node == null ? null : node.getId(), that.node == null ? null : that.node.getId());
    }

    @Override
    public int hashCode() {
        return Objects.hash(node == null ? null : node.getId(), edgeIndex, layer);
    }

    @Override
    public String toString() {
        return isVirtual() ? "~e" + edgeIndex + "@" + layer : node.getId() + "@" + layer;
    }
}
