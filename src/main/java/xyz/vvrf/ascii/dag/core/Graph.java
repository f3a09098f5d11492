package xyz.vvrf.ascii.dag.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 待渲染图的不可变快照。
 * 由 {@link xyz.vvrf.ascii.dag.builder.GraphBuilder} 或输入适配器构建，构建后只读。
 * 节点保持插入顺序，边保持插入顺序且 {@link GraphEdge#getIndex()} 与其位置一致。
 *
 * @author ruifeng.wen
 */
public final class Graph {

    private static final Graph EMPTY = new Graph(Collections.emptyList(), Collections.emptyList());

    private final Map<String, GraphNode> nodesById;
    private final List<GraphNode> nodes;
    private final List<GraphEdge> edges;

    /**
     * 创建图快照。调用方负责保证数据合法 (唯一 ID、边端点存在)；
     * 一般情况下请通过 GraphBuilder 构建，它会先做校验。
     *
     * @param nodes 节点列表
     * @param edges 边列表，第 i 条边的 index 必须为 i
     * @throws GraphInputException 如果节点 ID 重复或边引用了不存在的节点
     */
    public Graph(List<GraphNode> nodes, List<GraphEdge> edges) {
        Map<String, GraphNode> byId = new LinkedHashMap<>();
        for (GraphNode node : nodes) {
            if (byId.put(node.getId(), node) != null) {
                throw new GraphInputException(String.format("Duplicate node identifier '%s'.", node.getId()));
            }
        }
        List<GraphEdge> copiedEdges = new ArrayList<>(edges);
        for (int i = 0; i < copiedEdges.size(); i++) {
            GraphEdge edge = copiedEdges.get(i);
            if (edge.getIndex() != i) {
                throw new GraphInputException(String.format("Edge %s is stored at position %d but carries index %d.", edge, i, edge.getIndex()));
            }
            if (!byId.containsKey(edge.getSource())) {
                throw new GraphInputException(String.format("Edge %s references non-existent source node '%s'.", edge, edge.getSource()));
            }
            if (!byId.containsKey(edge.getTarget())) {
                throw new GraphInputException(String.format("Edge %s references non-existent target node '%s'.", edge, edge.getTarget()));
            }
        }
        this.nodesById = Collections.unmodifiableMap(byId);
        this.nodes = Collections.unmodifiableList(new ArrayList<>(byId.values()));
        this.edges = Collections.unmodifiableList(copiedEdges);
    }

    public static Graph empty() {
        return EMPTY;
    }

    /**
     * 按插入顺序返回所有节点。
     */
    public List<GraphNode> getNodes() {
        return nodes;
    }

    public Optional<GraphNode> getNode(String id) {
        return Optional.ofNullable(nodesById.get(id));
    }

    public boolean containsNode(String id) {
        return nodesById.containsKey(id);
    }

    /**
     * 按插入顺序返回所有边。
     */
    public List<GraphEdge> getEdges() {
        return edges;
    }

    public int getNodeCount() {
        return nodesById.size();
    }

    public int getEdgeCount() {
        return edges.size();
    }

    public boolean isEmpty() {
        return nodesById.isEmpty();
    }

    /**
     * 所有边都是有向边时返回 true (无边的图视为有向)。
     */
    public boolean isDirected() {
        for (GraphEdge edge : edges) {
            if (!edge.isDirected()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "Graph{nodes=" + nodesById.size() + ", edges=" + edges.size() + ", directed=" + isDirected() + '}';
    }
}
