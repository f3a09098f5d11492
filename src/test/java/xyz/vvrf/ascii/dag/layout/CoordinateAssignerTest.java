package xyz.vvrf.ascii.dag.layout;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xyz.vvrf.ascii.dag.builder.GraphBuilder;
import xyz.vvrf.ascii.dag.core.ConfigurationException;
import xyz.vvrf.ascii.dag.core.Graph;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CoordinateAssigner")
class CoordinateAssignerTest {

    private static GraphLayout layout(Graph graph, int nodeSpacing, int layerSpacing, int delimiterWidth) {
        LayeredGraph layered = LayeredGraph.build(graph, new LayerAssigner().assign(graph));
        CrossingReducer.Ordering ordering = new CrossingReducer(24).reduce(layered);
        return new CoordinateAssigner(nodeSpacing, layerSpacing, delimiterWidth).assign(layered, ordering);
    }

    @Test
    @DisplayName("各层以最宽的一层为基准居中")
    void centersLayers() {
        Graph graph = GraphBuilder.directed()
                .addNode("A").addNode("B").addNode("C").addNode("D")
                .addEdge("A", "B")
                .addEdge("A", "C")
                .addEdge("B", "D")
                .build();

        GraphLayout layout = layout(graph, 4, 2, 2);

        assertThat(layout.getPosition("A").getX()).isEqualTo(3);
        assertThat(layout.getPosition("A").getCenter()).isEqualTo(4);
        assertThat(layout.getPosition("B").getX()).isZero();
        assertThat(layout.getPosition("C").getX()).isEqualTo(7);
        assertThat(layout.getPosition("D").getX()).isEqualTo(3);
        assertThat(layout.getPosition("A").getY()).isZero();
        assertThat(layout.getPosition("B").getY()).isEqualTo(3);
        assertThat(layout.getPosition("D").getY()).isEqualTo(6);
        assertThat(layout.getCanvasWidth()).isEqualTo(10);
        assertThat(layout.getCanvasHeight()).isEqualTo(7);
    }

    @Test
    @DisplayName("同层字形之间至少间隔 nodeSpacing 列")
    void respectsNodeSpacing() {
        Graph graph = GraphBuilder.directed()
                .addNode("root").addNode("a").addNode("bb").addNode("ccc").addNode("dddd")
                .addEdge("root", "a")
                .addEdge("root", "bb")
                .addEdge("root", "ccc")
                .addEdge("root", "dddd")
                .build();

        GraphLayout layout = layout(graph, 2, 1, 2);

        List<LayoutVertex> layer = layout.getLayers().get(1);
        for (int i = 0; i + 1 < layer.size(); i++) {
            int end = layout.getX(layer.get(i)) + layout.getWidth(layer.get(i));
            assertThat(layout.getX(layer.get(i + 1)) - end).isEqualTo(2);
        }
        assertThat(layout.getPosition("root").getY()).isZero();
        assertThat(layout.getPosition("a").getY()).isEqualTo(2);
    }

    @Test
    @DisplayName("虚拟顶点宽度为 1，空标签节点按标识符计算宽度")
    void widths() {
        Graph graph = GraphBuilder.directed()
                .addNode("A", "").addNode("B").addNode("C")
                .path("A", "B", "C")
                .addEdge("A", "C")
                .build();

        GraphLayout layout = layout(graph, 4, 2, 0);

        assertThat(layout.getPosition("A").getWidth()).isEqualTo(1);
        assertThat(layout.getWidth(LayoutVertex.virtual(2, 1))).isEqualTo(1);
    }

    @Test
    @DisplayName("自环使画布向右多占一列")
    void selfLoopWidensCanvas() {
        Graph graph = GraphBuilder.directed()
                .addNode("A")
                .addEdge("A", "A")
                .build();

        GraphLayout layout = layout(graph, 4, 2, 2);

        assertThat(layout.getCanvasWidth()).isEqualTo(4);
        assertThat(layout.getCanvasHeight()).isEqualTo(1);
    }

    @Test
    @DisplayName("回边连接列在中心右侧一格，不超出字形")
    void backEdgeAttachColumn() {
        Graph graph = GraphBuilder.directed()
                .addNode("A").addNode("B")
                .addEdge("A", "B")
                .addEdge("B", "A")
                .build();

        GraphLayout square = layout(graph, 4, 2, 2);
        LayoutVertex a = square.getLayeredGraph().getVertex("A");
        assertThat(square.getAttachColumn(a)).isEqualTo(1);
        assertThat(square.getBackEdgeAttachColumn(a)).isEqualTo(2);

        GraphLayout minimal = layout(graph, 4, 2, 0);
        LayoutVertex b = minimal.getLayeredGraph().getVertex("B");
        assertThat(minimal.getBackEdgeAttachColumn(b)).isEqualTo(minimal.getAttachColumn(b));
    }

    @Test
    @DisplayName("间距必须为正数")
    void rejectsInvalidSpacing() {
        assertThatThrownBy(() -> new CoordinateAssigner(0, 2, 2)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new CoordinateAssigner(4, 0, 2)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new CoordinateAssigner(4, 2, -1)).isInstanceOf(ConfigurationException.class);
    }
}
