package xyz.vvrf.ascii.dag.builder;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.ascii.dag.core.Graph;
import xyz.vvrf.ascii.dag.core.GraphEdge;
import xyz.vvrf.ascii.dag.core.GraphInputException;
import xyz.vvrf.ascii.dag.core.GraphNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 用于以编程方式构建不可变的 {@link Graph} 快照。
 * 节点和边按调用顺序保存；同一对节点之间的重复边会被保留，各自独立绘制。
 * <p>
 * 默认情况下边的端点必须已经通过 {@link #addNode} 声明，否则抛出 {@link GraphInputException}。
 * 输入适配器 (如 DOT 读取器) 可以开启 {@link #autoCreateNodes(boolean)}，在首次引用时自动创建节点。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class GraphBuilder {

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final List<GraphEdge> edges = new ArrayList<>();
    private boolean defaultDirected = true;
    private boolean autoCreateNodes = false;

    public static GraphBuilder directed() {
        return new GraphBuilder().defaultDirected(true);
    }

    public static GraphBuilder undirected() {
        return new GraphBuilder().defaultDirected(false);
    }

    /**
     * 设置 {@link #addEdge(String, String)} 创建的边是否为有向边。
     */
    public GraphBuilder defaultDirected(boolean directed) {
        this.defaultDirected = directed;
        return this;
    }

    /**
     * 开启后，边引用未声明的节点时自动以其标识符创建节点。
     */
    public GraphBuilder autoCreateNodes(boolean enabled) {
        this.autoCreateNodes = enabled;
        return this;
    }

    public GraphBuilder addNode(String id) {
        return addNode(id, null);
    }

    /**
     * 声明一个节点。
     *
     * @param id    节点标识符 (唯一，不能为空)
     * @param label 显示标签，null 或空串表示使用标识符
     * @throws GraphInputException 如果标识符已存在或为空白
     */
    public GraphBuilder addNode(String id, String label) {
        Objects.requireNonNull(id, "节点标识符不能为空");
        if (nodes.containsKey(id)) {
            throw new GraphInputException(String.format("Node '%s' is already defined.", id));
        }
        nodes.put(id, new GraphNode(id, label));
        log.trace("Graph builder: added node '{}'", id);
        return this;
    }

    /**
     * 声明节点，若已存在则只更新其标签 (label 为 null 时保持原样)。
     * 供允许重复声明节点的输入格式使用。
     */
    public GraphBuilder mergeNode(String id, String label) {
        Objects.requireNonNull(id, "节点标识符不能为空");
        GraphNode existing = nodes.get(id);
        if (existing == null) {
            return addNode(id, label);
        }
        if (label != null) {
            nodes.put(id, new GraphNode(id, label));
        }
        return this;
    }

    public GraphBuilder addEdge(String source, String target) {
        return addEdge(source, target, defaultDirected);
    }

    /**
     * 添加一条边。
     *
     * @throws GraphInputException 如果端点未声明且未开启自动创建
     */
    public GraphBuilder addEdge(String source, String target, boolean directed) {
        Objects.requireNonNull(source, "源节点标识符不能为空");
        Objects.requireNonNull(target, "目标节点标识符不能为空");
        ensureNode(source, "source");
        ensureNode(target, "target");
        GraphEdge edge = new GraphEdge(edges.size(), source, target, directed);
        edges.add(edge);
        log.trace("Graph builder: added edge {}", edge);
        return this;
    }

    /**
     * 依次连接给定节点: path("A", "B", "C") 等价于 A-&gt;B, B-&gt;C。
     */
    public GraphBuilder path(String... nodeIds) {
        for (int i = 0; i + 1 < nodeIds.length; i++) {
            addEdge(nodeIds[i], nodeIds[i + 1]);
        }
        return this;
    }

    private void ensureNode(String id, String role) {
        if (nodes.containsKey(id)) {
            return;
        }
        if (!autoCreateNodes) {
            throw new GraphInputException(String.format("Edge references non-existent %s node '%s'.", role, id));
        }
        addNode(id);
    }

    public Graph build() {
        Graph graph = new Graph(new ArrayList<>(nodes.values()), edges);
        log.debug("Graph built: {} nodes, {} edges", graph.getNodeCount(), graph.getEdgeCount());
        return graph;
    }
}
