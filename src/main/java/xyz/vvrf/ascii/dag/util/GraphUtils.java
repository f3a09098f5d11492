package xyz.vvrf.ascii.dag.util;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.ascii.dag.core.Graph;
import xyz.vvrf.ascii.dag.core.GraphEdge;
import xyz.vvrf.ascii.dag.core.GraphNode;
import xyz.vvrf.ascii.dag.core.LayoutInvariantException;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 图结构的通用工具：弱连通分量、循环检测、拓扑排序与最长路径分层。
 * 邻接表统一使用 {@code 源节点 -> [目标节点列表]} 的形式。
 *
 * @author ruifeng.wen
 */
@Slf4j
public final class GraphUtils {

    private GraphUtils() {}

    /**
     * 计算弱连通分量 (按无向连通性，自环忽略)。
     * 每个分量内的节点按标识符排序，分量之间按各自最小标识符排序。
     *
     * @param graph 输入图
     * @return 分量列表
     */
    public static List<List<String>> weakComponents(Graph graph) {
        Map<String, List<String>> undirected = new HashMap<>();
        for (GraphNode node : graph.getNodes()) {
            undirected.put(node.getId(), new ArrayList<>());
        }
        for (GraphEdge edge : graph.getEdges()) {
            if (edge.isSelfLoop()) {
                continue;
            }
            undirected.get(edge.getSource()).add(edge.getTarget());
            undirected.get(edge.getTarget()).add(edge.getSource());
        }

        List<String> sortedIds = graph.getNodes().stream()
                .map(GraphNode::getId)
                .sorted()
                .collect(Collectors.toList());

        Set<String> seen = new HashSet<>();
        List<List<String>> components = new ArrayList<>();
        for (String start : sortedIds) {
            if (!seen.add(start)) {
                continue;
            }
            List<String> component = new ArrayList<>();
            Deque<String> stack = new ArrayDeque<>();
            stack.push(start);
            while (!stack.isEmpty()) {
                String current = stack.pop();
                component.add(current);
                for (String neighbor : undirected.get(current)) {
                    if (seen.add(neighbor)) {
                        stack.push(neighbor);
                    }
                }
            }
            Collections.sort(component);
            components.add(Collections.unmodifiableList(component));
        }
        log.debug("Found {} weakly connected component(s) among {} nodes", components.size(), sortedIds.size());
        return components;
    }

    /**
     * 使用深度优先搜索 (DFS) 检测给定有向图中是否存在循环。
     * 遍历用显式栈实现，长链不会导致栈溢出。
     *
     * @param allNodeIds 图中所有节点
     * @param adjacency  邻接表
     * @param graphName  用于错误信息的名称
     * @throws LayoutInvariantException 如果检测到循环
     */
    public static void detectCycles(Collection<String> allNodeIds,
                                    Map<String, List<String>> adjacency,
                                    String graphName) {
        Set<String> visited = new HashSet<>(); // 完全访问过的节点
        Set<String> visiting = new HashSet<>(); // 当前路径上的节点
        List<String> path = new ArrayList<>();
        Deque<Iterator<String>> stack = new ArrayDeque<>();

        for (String root : allNodeIds) {
            if (visited.contains(root)) {
                continue;
            }
            enter(root, visiting, path, stack, adjacency);
            while (!stack.isEmpty()) {
                Iterator<String> neighbors = stack.peek();
                if (!neighbors.hasNext()) {
                    stack.pop();
                    String finished = path.remove(path.size() - 1); // 回溯
                    visiting.remove(finished);
                    visited.add(finished);
                    continue;
                }
                String neighbor = neighbors.next();
                if (visiting.contains(neighbor)) {
                    int cycleStartIndex = path.indexOf(neighbor);
                    String cyclePath = String.join(" -> ", path.subList(cycleStartIndex, path.size())) + " -> " + neighbor;
                    throw new LayoutInvariantException(String.format("Graph '%s': cycle left after back-edge removal: %s", graphName, cyclePath));
                }
                if (!visited.contains(neighbor)) {
                    enter(neighbor, visiting, path, stack, adjacency);
                }
            }
        }
    }

    private static void enter(String nodeId,
                              Set<String> visiting,
                              List<String> path,
                              Deque<Iterator<String>> stack,
                              Map<String, List<String>> adjacency) {
        visiting.add(nodeId);
        path.add(nodeId);
        stack.push(adjacency.getOrDefault(nodeId, Collections.<String>emptyList()).iterator());
    }

    /**
     * 使用 Kahn 算法计算拓扑排序。
     * 入度为 0 的节点按 allNodeIds 的迭代顺序入队，保证结果确定。
     *
     * @param allNodeIds 图中所有节点 (迭代顺序决定平局时的先后)
     * @param adjacency  邻接表
     * @param graphName  用于错误信息的名称
     * @return 按拓扑顺序排列的节点列表
     * @throws LayoutInvariantException 如果图包含循环
     */
    public static List<String> topologicalSort(Collection<String> allNodeIds,
                                               Map<String, List<String>> adjacency,
                                               String graphName) {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (String nodeId : allNodeIds) {
            inDegree.put(nodeId, 0);
        }
        for (List<String> neighbors : adjacency.values()) {
            for (String neighbor : neighbors) {
                inDegree.merge(neighbor, 1, Integer::sum);
            }
        }

        Queue<String> queue = new ArrayDeque<>();
        for (Map.Entry<String, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                queue.offer(entry.getKey());
            }
        }

        List<String> sortedOrder = new ArrayList<>();
        while (!queue.isEmpty()) {
            String u = queue.poll();
            sortedOrder.add(u);
            for (String v : adjacency.getOrDefault(u, Collections.emptyList())) {
                int remaining = inDegree.merge(v, -1, Integer::sum);
                if (remaining == 0) {
                    queue.offer(v);
                }
            }
        }

        if (sortedOrder.size() != inDegree.size()) {
            Set<String> remainingNodes = new TreeSet<>(inDegree.keySet());
            remainingNodes.removeAll(sortedOrder);
            throw new LayoutInvariantException(String.format("Graph '%s': topological sort failed, unsorted nodes: %s", graphName, remainingNodes));
        }
        return Collections.unmodifiableList(sortedOrder);
    }

    /**
     * 最长路径分层：源点为 0 层，其余节点为所有前驱层号最大值加一。
     *
     * @param topologicalOrder 拓扑序
     * @param adjacency        邻接表
     * @return 节点 -&gt; 层号
     */
    public static Map<String, Integer> longestPathLayers(List<String> topologicalOrder,
                                                         Map<String, List<String>> adjacency) {
        Map<String, Integer> layers = new LinkedHashMap<>();
        for (String nodeId : topologicalOrder) {
            layers.putIfAbsent(nodeId, 0);
        }
        for (String u : topologicalOrder) {
            int next = layers.get(u) + 1;
            for (String v : adjacency.getOrDefault(u, Collections.emptyList())) {
                if (layers.get(v) < next) {
                    layers.put(v, next);
                }
            }
        }
        return layers;
    }
}
