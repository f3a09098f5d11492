package xyz.vvrf.ascii.dag.layout;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.ascii.dag.core.Graph;
import xyz.vvrf.ascii.dag.core.GraphEdge;
import xyz.vvrf.ascii.dag.core.GraphNode;
import xyz.vvrf.ascii.dag.core.LayoutInvariantException;
import xyz.vvrf.ascii.dag.util.GraphUtils;

import java.util.*;

/**
 * 层分配器。
 * <p>
 * 对每个弱连通分量做三色 DFS：指向 GRAY (仍在遍历栈上) 节点的有向边被识别为回边，
 * 不参与分层约束。无向边可以从任一端点遍历，永远不是回边，
 * 其方向被定为从完成时间较晚的端点指向较早的端点，因此所有非回边都沿完成时间递减方向，
 * 剩下的约束图必然无环。随后用最长路径法分层，各分量按顺序纵向堆叠。
 * <p>
 * 结果只依赖于图本身，重复调用得到相同的回边集合。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class LayerAssigner {

    private enum Color { WHITE, GRAY, BLACK }

    /**
     * 为图中每个节点分配层号。
     *
     * @param graph 输入图
     * @return 分层结果
     * @throws LayoutInvariantException 如果出现节点未分配或非回边仍成环 (内部错误)
     */
    public LayerAssignment assign(Graph graph) {
        Map<String, List<GraphEdge>> traversable = new HashMap<>();
        Map<String, Integer> incomingDirected = new HashMap<>();
        for (GraphNode node : graph.getNodes()) {
            traversable.put(node.getId(), new ArrayList<>());
            incomingDirected.put(node.getId(), 0);
        }
        for (GraphEdge edge : graph.getEdges()) {
            if (edge.isSelfLoop()) {
                continue;
            }
            traversable.get(edge.getSource()).add(edge);
            if (edge.isDirected()) {
                incomingDirected.merge(edge.getTarget(), 1, Integer::sum);
            } else {
                traversable.get(edge.getTarget()).add(edge);
            }
        }

        List<List<String>> components = GraphUtils.weakComponents(graph);
        Map<String, Integer> globalLayers = new LinkedHashMap<>();
        Set<Integer> backEdges = new TreeSet<>();
        List<String> discoveryOrder = new ArrayList<>();
        int layerOffset = 0;

        for (List<String> component : components) {
            ComponentTraversal traversal = new ComponentTraversal(traversable, graph.getEdgeCount());
            for (String nodeId : component) {
                if (incomingDirected.get(nodeId) == 0) {
                    traversal.visitFrom(nodeId);
                }
            }
            // 没有源点的环
            for (String nodeId : component) {
                traversal.visitFrom(nodeId);
            }

            List<String> order = traversal.discovered;
            Map<String, List<String>> adjacency = traversal.orientedAdjacency(order);
            GraphUtils.detectCycles(order, adjacency, "component of " + component.get(0));
            List<String> topological = GraphUtils.topologicalSort(order, adjacency, "component of " + component.get(0));
            Map<String, Integer> localLayers = GraphUtils.longestPathLayers(topological, adjacency);

            int localCount = 0;
            for (String nodeId : order) {
                int layer = localLayers.get(nodeId);
                globalLayers.put(nodeId, layerOffset + layer);
                localCount = Math.max(localCount, layer + 1);
            }
            log.trace("Component {} -> {} layer(s) starting at layer {}, back edges {}",
                    component, localCount, layerOffset, traversal.backEdges);
            layerOffset += localCount;
            backEdges.addAll(traversal.backEdges);
            discoveryOrder.addAll(order);
        }

        if (globalLayers.size() != graph.getNodeCount()) {
            Set<String> missing = new TreeSet<>();
            for (GraphNode node : graph.getNodes()) {
                if (!globalLayers.containsKey(node.getId())) {
                    missing.add(node.getId());
                }
            }
            throw new LayoutInvariantException("Nodes left without a layer after layering: " + missing);
        }

        log.debug("Layer assignment finished: {} node(s), {} layer(s), {} component(s), {} back edge(s)",
                globalLayers.size(), layerOffset, components.size(), backEdges.size());
        return new LayerAssignment(globalLayers, backEdges, discoveryOrder, components, layerOffset);
    }

    /**
     * 单个分量内的迭代式三色 DFS，避免长链导致栈溢出。
     */
    private static final class ComponentTraversal {

        private final Map<String, List<GraphEdge>> traversable;
        private final Map<String, Color> colors = new HashMap<>();
        private final Map<String, Integer> finishTimes = new HashMap<>();
        private final boolean[] classified;
        private final List<GraphEdge> treeOrForward = new ArrayList<>();
        private final Set<Integer> backEdges = new TreeSet<>();
        private final List<String> discovered = new ArrayList<>();
        private int clock = 0;

        ComponentTraversal(Map<String, List<GraphEdge>> traversable, int edgeCount) {
            this.traversable = traversable;
            this.classified = new boolean[edgeCount];
        }

        void visitFrom(String root) {
            if (colors.containsKey(root)) {
                return;
            }
            Deque<Frame> stack = new ArrayDeque<>();
            discover(root, stack);
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                List<GraphEdge> edges = traversable.get(frame.nodeId);
                if (frame.next >= edges.size()) {
                    stack.pop();
                    colors.put(frame.nodeId, Color.BLACK);
                    finishTimes.put(frame.nodeId, clock++);
                    continue;
                }
                GraphEdge edge = edges.get(frame.next++);
                if (classified[edge.getIndex()]) {
                    continue;
                }
                classified[edge.getIndex()] = true;
                String neighbor = edge.opposite(frame.nodeId);
                Color color = colors.getOrDefault(neighbor, Color.WHITE);
                if (edge.isDirected() && color == Color.GRAY) {
                    backEdges.add(edge.getIndex());
                    continue;
                }
                treeOrForward.add(edge);
                if (color == Color.WHITE) {
                    discover(neighbor, stack);
                }
            }
        }

        private void discover(String nodeId, Deque<Frame> stack) {
            colors.put(nodeId, Color.GRAY);
            discovered.add(nodeId);
            stack.push(new Frame(nodeId));
        }

        /**
         * 非回边按完成时间从晚到早定向后的邻接表。
         */
        Map<String, List<String>> orientedAdjacency(List<String> nodes) {
            Map<String, List<String>> adjacency = new LinkedHashMap<>();
            for (String nodeId : nodes) {
                adjacency.put(nodeId, new ArrayList<>());
            }
            for (GraphEdge edge : treeOrForward) {
                String from = edge.getSource();
                String to = edge.getTarget();
                if (!edge.isDirected() && finishTimes.get(from) < finishTimes.get(to)) {
                    from = edge.getTarget();
                    to = edge.getSource();
                }
                adjacency.get(from).add(to);
            }
            return adjacency;
        }
    }

    private static final class Frame {
        private final String nodeId;
        private int next;

        Frame(String nodeId) {
            this.nodeId = nodeId;
        }
    }
}
