package xyz.vvrf.ascii.dag.core;

import java.util.Objects;

/**
 * 图中的一条边（不可变数据类）。
 * 同一对节点之间允许存在多条边，{@code index} 是边在图中的插入序号，用于区分它们。
 * 边被识别为回边 (back edge) 后并不会修改此对象，回边标记由布局结果单独保存。
 *
 * @author ruifeng.wen
 */
public final class GraphEdge {

    private final int index;
    private final String source;
    private final String target;
    private final boolean directed;

    /**
     * 创建一条边的定义。
     *
     * @param index    边的插入序号 (非负)
     * @param source   源节点标识符 (不能为空)
     * @param target   目标节点标识符 (不能为空)
     * @param directed 是否为有向边
     */
    public GraphEdge(int index, String source, String target, boolean directed) {
        if (index < 0) {
            throw new IllegalArgumentException("Edge index must not be negative: " + index);
        }
        this.index = index;
        this.source = Objects.requireNonNull(source, "源节点标识符不能为空");
        this.target = Objects.requireNonNull(target, "目标节点标识符不能为空");
        this.directed = directed;
    }

    public int getIndex() {
        return index;
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    public boolean isDirected() {
        return directed;
    }

    /**
     * 自环：源和目标为同一节点。自环不参与分层和环检测。
     */
    public boolean isSelfLoop() {
        return source.equals(target);
    }

    /**
     * 返回与给定端点相对的另一个端点。
     */
    public String opposite(String endpoint) {
        if (source.equals(endpoint)) {
            return target;
        }
        if (target.equals(endpoint)) {
            return source;
        }
        throw new IllegalArgumentException(String.format("Node '%s' is not an endpoint of edge %s.", endpoint, this));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GraphEdge that = (GraphEdge) o;
        return index == that.index &&
                directed == that.directed &&
                source.equals(that.source) &&
                target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, source, target, directed);
    }

    @Override
    public String toString() {
        return "#" + index + " " + source + (directed ? " -> " : " -- ") + target;
    }
}
