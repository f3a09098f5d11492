package xyz.vvrf.ascii.dag.core;

import java.util.Objects;

/**
 * 图中的节点（不可变数据类）。
 * 标识符用于相等性判断和确定性排序，标签用于绘制。
 *
 * @author ruifeng.wen
 */
public final class GraphNode implements Comparable<GraphNode> {

    private final String id;
    private final String label;

    /**
     * 创建一个节点。
     *
     * @param id    节点标识符 (不能为空或空白)
     * @param label 显示标签；为 null 或空串时使用标识符
     */
    public GraphNode(String id, String label) {
        Objects.requireNonNull(id, "节点标识符不能为空");
        if (id.trim().isEmpty()) {
            throw new GraphInputException("Node identifier must not be blank.");
        }
        this.id = id;
        this.label = (label == null || label.isEmpty()) ? id : label;
        if (this.label.indexOf('\n') >= 0 || this.label.indexOf('\r') >= 0) {
            throw new GraphInputException(String.format("Label of node '%s' must be a single line.", id));
        }
    }

    public GraphNode(String id) {
        this(id, null);
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public int compareTo(GraphNode other) {
        return id.compareTo(other.id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GraphNode that = (GraphNode) o;
        return id.equals(that.id) && label.equals(that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, label);
    }

    @Override
    public String toString() {
        return id.equals(label) ? id : id + "(" + label + ")";
    }
}
