package xyz.vvrf.ascii.dag.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xyz.vvrf.ascii.dag.builder.GraphBuilder;
import xyz.vvrf.ascii.dag.core.Graph;
import xyz.vvrf.ascii.dag.core.LayoutInvariantException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class GraphUtilsTest {

    private static Map<String, List<String>> adjacency(String... pairs) {
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        for (String pair : pairs) {
            String from = pair.substring(0, 1);
            String to = pair.substring(1, 2);
            adjacency.computeIfAbsent(from, k -> new ArrayList<>()).add(to);
            adjacency.computeIfAbsent(to, k -> new ArrayList<>());
        }
        return adjacency;
    }

    @Test
    @DisplayName("弱连通分量按最小标识符排序，分量内节点有序")
    void weakComponentsAreSorted() {
        Graph graph = GraphBuilder.directed()
                .addNode("z").addNode("b").addNode("y").addNode("a")
                .addEdge("z", "a")
                .addEdge("y", "b")
                .addEdge("b", "b")
                .build();

        List<List<String>> components = GraphUtils.weakComponents(graph);

        assertThat(components).containsExactly(Arrays.asList("a", "z"), Arrays.asList("b", "y"));
    }

    @Test
    @DisplayName("检测到环时报告环路径")
    void detectCyclesReportsPath() {
        Map<String, List<String>> adj = adjacency("AB", "BC", "CA");

        assertThatThrownBy(() -> GraphUtils.detectCycles(adj.keySet(), adj, "test"))
                .isInstanceOf(LayoutInvariantException.class)
                .hasMessageContaining("A -> B -> C -> A");
    }

    @Test
    @DisplayName("无环图通过检测")
    void detectCyclesAcceptsDag() {
        Map<String, List<String>> adj = adjacency("AB", "AC", "BC");

        GraphUtils.detectCycles(adj.keySet(), adj, "test");
    }

    @Test
    @DisplayName("拓扑排序按输入顺序处理入度为 0 的节点")
    void topologicalSortIsStable() {
        Map<String, List<String>> adj = adjacency("AC", "BC", "CD");

        List<String> order = GraphUtils.topologicalSort(Arrays.asList("B", "A", "C", "D"), adj, "test");

        assertThat(order).containsExactly("B", "A", "C", "D");
    }

    @Test
    @DisplayName("有环时拓扑排序失败并列出剩余节点")
    void topologicalSortFailsOnCycle() {
        Map<String, List<String>> adj = adjacency("AB", "BC", "CB");

        assertThatThrownBy(() -> GraphUtils.topologicalSort(adj.keySet(), adj, "test"))
                .isInstanceOf(LayoutInvariantException.class)
                .hasMessageContaining("[B, C]");
    }

    @Test
    @DisplayName("最长路径分层取所有前驱的最大层号加一")
    void longestPathLayers() {
        Map<String, List<String>> adj = adjacency("AB", "BC", "AC", "DC");
        List<String> topo = GraphUtils.topologicalSort(adj.keySet(), adj, "test");

        Map<String, Integer> layers = GraphUtils.longestPathLayers(topo, adj);

        assertThat(layers).containsOnly(entry("A", 0), entry("B", 1), entry("C", 2), entry("D", 0));
    }

    @Test
    @DisplayName("孤立节点位于第 0 层")
    void isolatedNodeIsLayerZero() {
        Map<String, Integer> layers = GraphUtils.longestPathLayers(Collections.singletonList("X"), Collections.emptyMap());

        assertThat(layers).containsOnly(entry("X", 0));
    }
}
