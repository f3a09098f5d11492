package xyz.vvrf.ascii.dag.io;

import guru.nidi.graphviz.parse.ParserException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.vvrf.ascii.dag.core.Graph;
import xyz.vvrf.ascii.dag.core.GraphEdge;
import xyz.vvrf.ascii.dag.core.GraphInputException;
import xyz.vvrf.ascii.dag.core.GraphNode;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DotGraphReader")
class DotGraphReaderTest {

    private final DotGraphReader reader = new DotGraphReader();

    private static String edges(Graph graph) {
        return graph.getEdges().stream()
                .map(e -> e.getSource() + (e.isDirected() ? "->" : "--") + e.getTarget())
                .collect(Collectors.joining(" "));
    }

    @Nested
    @DisplayName("语法")
    class Syntax {

        @Test
        @DisplayName("有向图、边链与节点声明")
        void digraph() {
            Graph graph = reader.read("digraph G {\n"
                    + "  rankdir=LR;\n"
                    + "  node [shape=box];\n"
                    + "  a [label=\"Start\"];\n"
                    + "  a -> b -> c [color=red];\n"
                    + "  b -> d\n"
                    + "}\n");

            assertThat(graph.getNodes()).extracting(GraphNode::getId).containsExactly("a", "b", "c", "d");
            assertThat(graph.getNode("a")).get().extracting(GraphNode::getLabel).isEqualTo("Start");
            assertThat(edges(graph)).isEqualTo("a->b b->c b->d");
        }

        @Test
        @DisplayName("无向图")
        void undirectedGraph() {
            Graph graph = reader.read("graph { x -- y; y -- z }");

            assertThat(edges(graph)).isEqualTo("x--y y--z");
            assertThat(graph.isDirected()).isFalse();
        }

        @Test
        @DisplayName("注释、引号字符串、HTML 标签与端口")
        void commentsQuotesAndPorts() {
            Graph graph = reader.read("digraph {\n"
                    + "  // line comment\n"
                    + "  /* block\n     comment */\n"
                    + "  \"node one\" [label=\"first node\"];\n"
                    + "  \"node one\":p1:n -> two:s;\n"
                    + "  three [label=<<b>bold</b>>];\n"
                    + "}");

            assertThat(graph.getNode("node one")).get().extracting(GraphNode::getLabel).isEqualTo("first node");
            assertThat(graph.getNode("three")).get().extracting(GraphNode::getLabel).isEqualTo("<b>bold</b>");
            assertThat(edges(graph)).isEqualTo("node one->two");
        }

        @Test
        @DisplayName("子图作为端点时连接到其中所有节点")
        void subgraphEndpoints() {
            Graph graph = reader.read("digraph { a -> { b c }; subgraph cluster_x { d; e } -> f }");

            assertThat(edges(graph)).isEqualTo("a->b a->c d->f e->f");
            assertThat(graph.getNodes()).extracting(GraphNode::getId).containsExactlyInAnyOrder("a", "b", "c", "d", "e", "f");
        }

        @Test
        @DisplayName("作为目标的子图中的边也被读取")
        void edgesInsideTargetSubgraph() {
            Graph graph = reader.read("digraph { a -> { b -> c } }");

            assertThat(edges(graph)).contains("b->c").contains("a->b").contains("a->c");
            assertThat(graph.getEdgeCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("strict 图去掉重复边")
        void strictGraph() {
            Graph directed = reader.read("strict digraph { a -> b; a -> b; b -> a }");
            Graph undirected = reader.read("strict graph { a -- b; b -- a }");

            assertThat(edges(directed)).isEqualTo("a->b b->a");
            assertThat(undirected.getEdges()).extracting(GraphEdge::getIndex).containsExactly(0);
        }

        @Test
        @DisplayName("非 strict 图保留重复边和自环")
        void keepsParallelEdges() {
            Graph graph = reader.read("digraph { a -> b; a -> b; a -> a }");

            assertThat(graph.getEdgeCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("标签中的换行转义替换为空格")
        void labelEscapes() {
            Graph graph = reader.read("digraph { a [label=\"line1\\nline2\"]; a -> b }");

            assertThat(graph.getNode("a")).get().extracting(GraphNode::getLabel).isEqualTo("line1 line2");
            assertThat(graph.getNode("b")).get().extracting(GraphNode::getLabel).isEqualTo("b");
        }

        @Test
        @DisplayName("只作为目标出现的节点也使用其 label")
        void labelOfTargetOnlyNode() {
            Graph graph = reader.read("digraph { a -> b; b [label=\"Bee\"] }");

            assertThat(graph.getNode("b")).get().extracting(GraphNode::getLabel).isEqualTo("Bee");
        }

        @Test
        @DisplayName("\\N 与换行转义的规范化")
        void normalizeLabel() {
            assertThat(DotGraphReader.normalizeLabel("\\N!", "b")).isEqualTo("b!");
            assertThat(DotGraphReader.normalizeLabel("left\\lright\\r", "x")).isEqualTo("left right");
            assertThat(DotGraphReader.normalizeLabel(null, "x")).isNull();
        }
    }

    @Nested
    @DisplayName("错误")
    class Errors {

        @Test
        @DisplayName("缺少右括号时报告语法错误")
        void missingBrace() {
            assertThatThrownBy(() -> reader.read("digraph {\n a -> b\n"))
                    .isInstanceOf(GraphInputException.class)
                    .hasMessageStartingWith("DOT syntax error at line");
        }

        @Test
        @DisplayName("有向图中不允许 --，无向图中不允许 ->")
        void wrongEdgeOperator() {
            assertThatThrownBy(() -> reader.read("digraph { a -- b }"))
                    .isInstanceOf(GraphInputException.class)
                    .hasMessageStartingWith("DOT syntax error at line 1")
                    .hasMessageContaining("-- used in digraph");
            assertThatThrownBy(() -> reader.read("graph { a -> b }"))
                    .isInstanceOf(GraphInputException.class)
                    .hasMessageContaining("-> used in graph");
        }

        @Test
        @DisplayName("不是 graph 或 digraph")
        void notAGraph() {
            assertThatThrownBy(() -> reader.read("tree { a }"))
                    .isInstanceOf(GraphInputException.class)
                    .hasMessageContaining("'graph' or 'digraph' expected");
        }

        @Test
        @DisplayName("错误保留解析器异常作为原因")
        void keepsParserCause() {
            assertThatThrownBy(() -> reader.read("digraph { a -> }"))
                    .isInstanceOf(GraphInputException.class)
                    .hasCauseInstanceOf(ParserException.class);
        }
    }

    @Test
    @DisplayName("从文件和 Reader 读取")
    void readsFileAndReader(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("graph.dot");
        Files.write(file, "digraph { \"α\" -> \"β\" }".getBytes(StandardCharsets.UTF_8));

        assertThat(edges(reader.read(file))).isEqualTo("α->β");
        assertThat(edges(reader.read(new StringReader("digraph { a -> b }")))).isEqualTo("a->b");
    }
}
