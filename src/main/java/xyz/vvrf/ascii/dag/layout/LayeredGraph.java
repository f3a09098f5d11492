package xyz.vvrf.ascii.dag.layout;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.ascii.dag.core.Graph;
import xyz.vvrf.ascii.dag.core.GraphEdge;
import xyz.vvrf.ascii.dag.core.GraphNode;
import xyz.vvrf.ascii.dag.core.LayoutInvariantException;

import java.util.*;

/**
 * 规范化的分层图 (proper layered graph)：每条非自环边都被拆成只连接相邻两层的线段，
 * 跨越多层的边在每个中间层上插入一个虚拟顶点。
 * 回边按反向 (上层到下层) 布局，但保留回边标记供绘制使用。
 * <p>
 * 每层的初始顺序：真实节点按 DFS 发现顺序，其后是虚拟顶点按边序号排列。
 *
 * @author ruifeng.wen
 */
@Slf4j
public final class LayeredGraph {

    private final Graph graph;
    private final LayerAssignment assignment;
    private final List<List<LayoutVertex>> initialLayers;
    private final Map<String, LayoutVertex> realVertices;
    private final List<EdgeChain> chains;
    private final List<GraphEdge> selfLoops;
    private final List<List<Segment>> segmentsBelow;
    private final Map<LayoutVertex, List<LayoutVertex>> upperNeighbors;
    private final Map<LayoutVertex, List<LayoutVertex>> lowerNeighbors;

    private LayeredGraph(Graph graph,
                         LayerAssignment assignment,
                         List<List<LayoutVertex>> initialLayers,
                         Map<String, LayoutVertex> realVertices,
                         List<EdgeChain> chains,
                         List<GraphEdge> selfLoops) {
        this.graph = graph;
        this.assignment = assignment;
        this.realVertices = Collections.unmodifiableMap(realVertices);
        this.chains = Collections.unmodifiableList(chains);
        this.selfLoops = Collections.unmodifiableList(selfLoops);

        List<List<LayoutVertex>> frozen = new ArrayList<>();
        for (List<LayoutVertex> layer : initialLayers) {
            frozen.add(Collections.unmodifiableList(new ArrayList<>(layer)));
        }
        this.initialLayers = Collections.unmodifiableList(frozen);

        List<List<Segment>> below = new ArrayList<>();
        for (int i = 0; i < initialLayers.size(); i++) {
            below.add(new ArrayList<>());
        }
        Map<LayoutVertex, List<LayoutVertex>> uppers = new HashMap<>();
        Map<LayoutVertex, List<LayoutVertex>> lowers = new HashMap<>();
        for (List<LayoutVertex> layer : initialLayers) {
            for (LayoutVertex vertex : layer) {
                uppers.put(vertex, new ArrayList<>());
                lowers.put(vertex, new ArrayList<>());
            }
        }
        for (EdgeChain chain : chains) {
            for (Segment segment : chain.getSegments()) {
                below.get(segment.getUpper().getLayer()).add(segment);
                lowers.get(segment.getUpper()).add(segment.getLower());
                uppers.get(segment.getLower()).add(segment.getUpper());
            }
        }
        this.segmentsBelow = below;
        this.upperNeighbors = uppers;
        this.lowerNeighbors = lowers;
    }

    /**
     * 根据分层结果构建规范化分层图。
     *
     * @param graph      原始图
     * @param assignment 该图的分层结果
     * @return 分层图
     */
    public static LayeredGraph build(Graph graph, LayerAssignment assignment) {
        List<List<LayoutVertex>> layers = new ArrayList<>();
        for (int i = 0; i < assignment.getLayerCount(); i++) {
            layers.add(new ArrayList<>());
        }

        Map<String, LayoutVertex> realVertices = new HashMap<>();
        for (String nodeId : assignment.getDiscoveryOrder()) {
            GraphNode node = graph.getNode(nodeId)
                    .orElseThrow(() -> new LayoutInvariantException("Discovered node missing from graph: " + nodeId));
            LayoutVertex vertex = LayoutVertex.real(node, assignment.getLayer(nodeId));
            realVertices.put(nodeId, vertex);
            layers.get(vertex.getLayer()).add(vertex);
        }

        List<EdgeChain> chains = new ArrayList<>();
        List<GraphEdge> selfLoops = new ArrayList<>();
        int virtualCount = 0;
        for (GraphEdge edge : graph.getEdges()) {
            if (edge.isSelfLoop()) {
                selfLoops.add(edge);
                continue;
            }
            LayoutVertex upper = realVertices.get(assignment.upperEndpoint(edge));
            LayoutVertex lower = realVertices.get(assignment.lowerEndpoint(edge));
            if (upper.getLayer() >= lower.getLayer()) {
                throw new LayoutInvariantException(String.format("Edge %s does not span downward: layers %d -> %d",
                        edge, upper.getLayer(), lower.getLayer()));
            }
            List<LayoutVertex> path = new ArrayList<>();
            path.add(upper);
            for (int layer = upper.getLayer() + 1; layer < lower.getLayer(); layer++) {
                LayoutVertex dummy = LayoutVertex.virtual(edge.getIndex(), layer);
                layers.get(layer).add(dummy);
                path.add(dummy);
                virtualCount++;
            }
            path.add(lower);
            chains.add(new EdgeChain(edge, assignment.isBackEdge(edge), path));
        }

        log.debug("Layered graph built: {} layer(s), {} chain(s), {} virtual vertex(es), {} self-loop(s)",
                layers.size(), chains.size(), virtualCount, selfLoops.size());
        return new LayeredGraph(graph, assignment, layers, realVertices, chains, selfLoops);
    }

    public Graph getGraph() {
        return graph;
    }

    public LayerAssignment getAssignment() {
        return assignment;
    }

    public int getLayerCount() {
        return initialLayers.size();
    }

    /**
     * 交叉最小化之前的初始层内顺序。
     */
    public List<List<LayoutVertex>> getInitialLayers() {
        return initialLayers;
    }

    public LayoutVertex getVertex(String nodeId) {
        LayoutVertex vertex = realVertices.get(nodeId);
        if (vertex == null) {
            throw new LayoutInvariantException("Unknown node in layered graph: " + nodeId);
        }
        return vertex;
    }

    /**
     * 所有非自环边对应的链，按边序号排列。
     */
    public List<EdgeChain> getChains() {
        return chains;
    }

    public List<GraphEdge> getSelfLoops() {
        return selfLoops;
    }

    /**
     * 连接第 layer 层与第 layer+1 层的线段。
     */
    public List<Segment> getSegmentsBelow(int layer) {
        return Collections.unmodifiableList(segmentsBelow.get(layer));
    }

    /**
     * 上一层中的相邻顶点 (多重边会重复出现)。
     */
    public List<LayoutVertex> getUpperNeighbors(LayoutVertex vertex) {
        return Collections.unmodifiableList(upperNeighbors.getOrDefault(vertex, Collections.emptyList()));
    }

    public List<LayoutVertex> getLowerNeighbors(LayoutVertex vertex) {
        return Collections.unmodifiableList(lowerNeighbors.getOrDefault(vertex, Collections.emptyList()));
    }

    /**
     * 一条原始边在分层图中的完整路径：从上层端点经过若干虚拟顶点到下层端点。
     */
    public static final class EdgeChain {
        private final GraphEdge edge;
        private final boolean backEdge;
        private final List<LayoutVertex> vertices;
        private final List<Segment> segments;

        EdgeChain(GraphEdge edge, boolean backEdge, List<LayoutVertex> vertices) {
            this.edge = edge;
            this.backEdge = backEdge;
            this.vertices = Collections.unmodifiableList(new ArrayList<>(vertices));
            List<Segment> list = new ArrayList<>();
            for (int i = 0; i + 1 < vertices.size(); i++) {
                list.add(new Segment(this, vertices.get(i), vertices.get(i + 1)));
            }
            this.segments = Collections.unmodifiableList(list);
        }

        public GraphEdge getEdge() {
            return edge;
        }

        public boolean isBackEdge() {
            return backEdge;
        }

        public LayoutVertex getUpper() {
            return vertices.get(0);
        }

        public LayoutVertex getLower() {
            return vertices.get(vertices.size() - 1);
        }

        public List<LayoutVertex> getVertices() {
            return vertices;
        }

        public List<Segment> getSegments() {
            return segments;
        }

        /**
         * 有向边且源节点位于下层 (即回边) 时为 true。
         */
        public boolean pointsUpward() {
            return edge.isDirected() && edge.getSource().equals(getLower().getNode().getId());
        }

        public boolean pointsDownward() {
            return edge.isDirected() && edge.getSource().equals(getUpper().getNode().getId());
        }

        @Override
        public String toString() {
            return "EdgeChain{" + edge + (backEdge ? " (back)" : "") + ", " + vertices + '}';
        }
    }

    /**
     * 相邻两层之间的一段连线。
     */
    public static final class Segment {
        private final EdgeChain chain;
        private final LayoutVertex upper;
        private final LayoutVertex lower;

        Segment(EdgeChain chain, LayoutVertex upper, LayoutVertex lower) {
            this.chain = chain;
            this.upper = upper;
            this.lower = lower;
        }

        public EdgeChain getChain() {
            return chain;
        }

        public LayoutVertex getUpper() {
            return upper;
        }

        public LayoutVertex getLower() {
            return lower;
        }

        @Override
        public String toString() {
            return upper + " -> " + lower;
        }
    }
}
