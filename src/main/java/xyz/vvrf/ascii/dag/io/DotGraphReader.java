package xyz.vvrf.ascii.dag.io;

import guru.nidi.graphviz.attribute.Label;
import guru.nidi.graphviz.model.Link;
import guru.nidi.graphviz.model.LinkTarget;
import guru.nidi.graphviz.model.MutableGraph;
import guru.nidi.graphviz.model.MutableNode;
import guru.nidi.graphviz.model.PortNode;
import guru.nidi.graphviz.parse.Parser;
import guru.nidi.graphviz.parse.ParserException;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.ascii.dag.builder.GraphBuilder;
import xyz.vvrf.ascii.dag.core.Graph;
import xyz.vvrf.ascii.dag.core.GraphInputException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * 用 graphviz-java 的 {@link Parser} 读取 Graphviz DOT 文本，并通过 {@link GraphBuilder} 构建 {@link Graph}。
 * <p>
 * 节点只使用 label 属性，其余属性、属性语句和端口都被忽略。
 * 子图作为边的端点时，边连接到子图中的全部节点。strict 图中重复的边只保留第一条。
 * <p>
 * 任何语法错误都抛出带行号的 {@link GraphInputException}。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class DotGraphReader {

    private static final String LABEL_ATTRIBUTE = "label";

    public Graph read(Path path) throws IOException {
        return read(new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
    }

    public Graph read(Reader reader) throws IOException {
        StringBuilder sb = new StringBuilder();
        char[] buffer = new char[4096];
        int n;
        while ((n = reader.read(buffer)) != -1) {
            sb.append(buffer, 0, n);
        }
        return read(sb.toString());
    }

    /**
     * 解析 DOT 文本。
     *
     * @param text DOT 源文本
     * @return 构建好的图
     * @throws GraphInputException 语法错误时
     */
    public Graph read(String text) {
        Objects.requireNonNull(text, "DOT 文本不能为空");
        MutableGraph parsed = parse(text);

        GraphBuilder builder = parsed.isDirected() ? GraphBuilder.directed() : GraphBuilder.undirected();
        builder.autoCreateNodes(true);

        Map<String, String> labels = new HashMap<>();
        collectLabels(parsed, labels, Collections.newSetFromMap(new IdentityHashMap<>()));

        new Mapping(builder, labels, parsed.isStrict(), parsed.isDirected()).addGraph(parsed);

        Graph graph = builder.build();
        log.debug("DOT input parsed: {}", graph);
        return graph;
    }

    private MutableGraph parse(String text) {
        try {
            return new Parser().notValidating().read(text);
        } catch (ParserException e) {
            throw new GraphInputException(String.format("DOT syntax error at line %d: %s",
                    e.getPosition().getLine(), e.getMessage()), e);
        } catch (IOException e) {
            throw new GraphInputException("DOT input could not be read: " + e.getMessage(), e);
        }
    }

    /**
     * 一次读取的映射状态：按出现顺序把节点与边写入 builder。
     */
    private static final class Mapping {
        private final GraphBuilder builder;
        private final Map<String, String> labels;
        private final Set<String> seenEdges;
        private final boolean directed;
        private final Set<MutableGraph> expanded = Collections.newSetFromMap(new IdentityHashMap<>());

        Mapping(GraphBuilder builder, Map<String, String> labels, boolean strict, boolean directed) {
            this.builder = builder;
            this.labels = labels;
            this.seenEdges = strict ? new HashSet<>() : null;
            this.directed = directed;
        }

        /**
         * 子图自身的出边 ({@code { a b } -> c}) 挂在子图上；只作为目标出现的子图 ({@code a -> { b -> c }})
         * 不在父图的子图列表里，连接前先展开。
         */
        void addGraph(MutableGraph graph) {
            if (!expanded.add(graph)) {
                return;
            }
            for (MutableNode node : graph.rootNodes()) {
                String source = nameOf(node);
                declare(builder, source, labels);
                addLinks(Collections.singletonList(source), node.links());
            }
            for (MutableGraph subgraph : graph.graphs()) {
                addGraph(subgraph);
                addLinks(nodesOf(subgraph), subgraph.links());
            }
        }

        private void addLinks(List<String> sources, List<Link> links) {
            for (Link link : links) {
                LinkTarget to = link.to();
                if (to instanceof MutableGraph) {
                    addGraph((MutableGraph) to);
                }
                for (String target : targetsOf(to)) {
                    for (String source : sources) {
                        addEdge(source, target);
                    }
                }
            }
        }

        private void addEdge(String source, String target) {
            if (seenEdges != null && !seenEdges.add(edgeKey(source, target, directed))) {
                log.trace("Strict graph: duplicate edge {} -> {} dropped", source, target);
                return;
            }
            declare(builder, source, labels);
            declare(builder, target, labels);
            builder.addEdge(source, target);
        }
    }

    private static String edgeKey(String source, String target, boolean directed) {
        if (!directed && source.compareTo(target) > 0) {
            return target + '\u0000' + source;
        }
        return source + '\u0000' + target;
    }

    private static void declare(GraphBuilder builder, String id, Map<String, String> labels) {
        builder.mergeNode(id, labels.get(id));
    }

    private static List<String> targetsOf(LinkTarget target) {
        if (target instanceof MutableNode) {
            return Collections.singletonList(nameOf((MutableNode) target));
        }
        if (target instanceof PortNode) {
            LinkTarget node = ((PortNode) target).node();
            return targetsOf(node);
        }
        if (target instanceof MutableGraph) {
            return nodesOf((MutableGraph) target);
        }
        log.warn("DOT 边的端点类型无法识别，已忽略: {}", target);
        return Collections.emptyList();
    }

    /**
     * 子图中的全部节点 (含嵌套子图和只作为子图内边的目标出现的节点)，按出现顺序去重。
     */
    private static List<String> nodesOf(MutableGraph graph) {
        Set<String> names = new LinkedHashSet<>();
        for (MutableNode node : graph.rootNodes()) {
            names.add(nameOf(node));
            for (Link link : node.links()) {
                names.addAll(targetsOf(link.to()));
            }
        }
        for (MutableGraph subgraph : graph.graphs()) {
            names.addAll(nodesOf(subgraph));
            for (Link link : subgraph.links()) {
                names.addAll(targetsOf(link.to()));
            }
        }
        return new ArrayList<>(names);
    }

    /**
     * 收集所有可达节点的 label，包括只作为边的目标出现的子图中的节点。
     */
    private static void collectLabels(MutableGraph graph, Map<String, String> labels, Set<Object> visited) {
        if (!visited.add(graph)) {
            return;
        }
        for (MutableNode node : graph.rootNodes()) {
            collectLabel(node, labels, visited);
        }
        for (MutableGraph subgraph : graph.graphs()) {
            collectLabels(subgraph, labels, visited);
            for (Link link : subgraph.links()) {
                collectTargetLabels(link.to(), labels, visited);
            }
        }
    }

    private static void collectLabel(MutableNode node, Map<String, String> labels, Set<Object> visited) {
        if (!visited.add(node)) {
            return;
        }
        String id = nameOf(node);
        String label = normalizeLabel(labelOf(node), id);
        if (label != null) {
            labels.put(id, label);
        }
        for (Link link : node.links()) {
            collectTargetLabels(link.to(), labels, visited);
        }
    }

    private static void collectTargetLabels(LinkTarget target, Map<String, String> labels, Set<Object> visited) {
        if (target instanceof MutableNode) {
            collectLabel((MutableNode) target, labels, visited);
        } else if (target instanceof PortNode) {
            LinkTarget node = ((PortNode) target).node();
            collectTargetLabels(node, labels, visited);
        } else if (target instanceof MutableGraph) {
            collectLabels((MutableGraph) target, labels, visited);
        }
    }

    private static String labelOf(MutableNode node) {
        Object value = node.get(LABEL_ATTRIBUTE);
        if (value == null) {
            return null;
        }
        return value instanceof Label ? ((Label) value).value() : value.toString();
    }

    private static String nameOf(MutableNode node) {
        return node.name().value();
    }

    /**
     * DOT 标签中的换行转义 (\n, \l, \r) 被替换为空格，{@code \N} 表示节点名。
     */
    static String normalizeLabel(String label, String nodeId) {
        if (label == null) {
            return null;
        }
        return label.replace("\\N", nodeId)
                .replace("\\n", " ")
                .replace("\\l", " ")
                .replace("\\r", " ")
                .replace('\n', ' ')
                .replace('\r', ' ')
                .trim();
    }
}
