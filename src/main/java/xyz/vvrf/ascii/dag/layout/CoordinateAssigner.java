package xyz.vvrf.ascii.dag.layout;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.ascii.dag.core.ConfigurationException;
import xyz.vvrf.ascii.dag.core.GraphEdge;
import xyz.vvrf.ascii.dag.core.LayoutInvariantException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 把 (层号, 层内顺序) 转换为整数画布坐标。
 * <p>
 * 节点宽度 = 标签长度 + 左右定界符长度，虚拟顶点宽度为 1。
 * 每层从左到右紧凑排列，相邻字形之间留 nodeSpacing 列，
 * 再整体右移 (最宽层宽度 - 本层宽度) / 2，使各层以最宽的一层为基准居中。
 * 相邻两层之间通常留 layerSpacing 行；拐弯走线在这些行里放不下时，层间距增大到所需的行数，
 * 保证互不相关的水平走线不会首尾重叠。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class CoordinateAssigner {

    private final int nodeSpacing;
    private final int layerSpacing;
    private final int delimiterWidth;

    /**
     * @param nodeSpacing    同层相邻字形间的列数 (正数)
     * @param layerSpacing   相邻层之间的空行数 (正数)
     * @param delimiterWidth 左右定界符的总长度
     */
    public CoordinateAssigner(int nodeSpacing, int layerSpacing, int delimiterWidth) {
        if (nodeSpacing <= 0 || layerSpacing <= 0) {
            throw new ConfigurationException(String.format("Spacing must be positive: nodeSpacing=%d, layerSpacing=%d", nodeSpacing, layerSpacing));
        }
        if (delimiterWidth < 0) {
            throw new ConfigurationException("delimiterWidth must not be negative, got " + delimiterWidth);
        }
        this.nodeSpacing = nodeSpacing;
        this.layerSpacing = layerSpacing;
        this.delimiterWidth = delimiterWidth;
    }

    /**
     * 计算坐标。
     *
     * @param graph    分层图
     * @param ordering 交叉最小化后的层内顺序
     * @return 最终布局
     * @throws LayoutInvariantException 同层字形出现重叠时 (内部错误)
     */
    public GraphLayout assign(LayeredGraph graph, CrossingReducer.Ordering ordering) {
        List<List<LayoutVertex>> layers = ordering.getLayers();
        Map<LayoutVertex, Integer> widths = new HashMap<>();
        Map<LayoutVertex, Integer> xs = new HashMap<>();
        int[] layerWidths = new int[layers.size()];
        int maxLayerWidth = 0;

        for (int layer = 0; layer < layers.size(); layer++) {
            int cursor = 0;
            for (LayoutVertex vertex : layers.get(layer)) {
                int w = widthOf(vertex);
                widths.put(vertex, w);
                xs.put(vertex, cursor);
                cursor += w + nodeSpacing;
            }
            layerWidths[layer] = layers.get(layer).isEmpty() ? 0 : cursor - nodeSpacing;
            maxLayerWidth = Math.max(maxLayerWidth, layerWidths[layer]);
        }

        Set<String> looped = new HashSet<>();
        for (GraphEdge loop : graph.getSelfLoops()) {
            looped.add(loop.getSource());
        }

        int canvasWidth = 0;
        for (int layer = 0; layer < layers.size(); layer++) {
            int shift = (maxLayerWidth - layerWidths[layer]) / 2;
            int previousEnd = Integer.MIN_VALUE;
            for (LayoutVertex vertex : layers.get(layer)) {
                int x = xs.get(vertex) + shift;
                xs.put(vertex, x);
                if (x <= previousEnd) {
                    throw new LayoutInvariantException(String.format("Glyphs overlap in layer %d at vertex %s (x=%d, previous end=%d)",
                            layer, vertex, x, previousEnd));
                }
                int end = x + widths.get(vertex) - 1;
                previousEnd = end;
                int extent = end + 1;
                if (!vertex.isVirtual() && looped.contains(vertex.getNode().getId())) {
                    extent++;
                }
                canvasWidth = Math.max(canvasWidth, extent);
            }
        }

        int[] demand = bendRowDemand(graph, layers.size(), xs, widths);
        int[] layerRows = new int[layers.size()];
        for (int layer = 1; layer < layers.size(); layer++) {
            int gap = Math.max(layerSpacing, demand[layer - 1]);
            if (gap > layerSpacing) {
                log.trace("Gap below layer {} widened from {} to {} row(s) for bends", layer - 1, layerSpacing, gap);
            }
            layerRows[layer] = layerRows[layer - 1] + gap + 1;
        }
        int canvasHeight = layers.isEmpty() ? 0 : layerRows[layers.size() - 1] + 1;

        log.debug("Coordinates assigned: canvas {}x{}, widest layer {} column(s)", canvasWidth, canvasHeight, maxLayerWidth);
        return new GraphLayout(graph, ordering, xs, widths, layerRows, canvasWidth, canvasHeight);
    }

    /**
     * 每个层间需要的水平走线行数。
     * 同一上端点、同一连接列出发的拐弯线段合为一组，占据 [最小列, 最大列] 区间；
     * 同一行内的区间之间至少留一格间隙。按起点排序后首次适配得到的行数即所需行数。
     */
    static int[] bendRowDemand(LayeredGraph graph,
                               int layerCount,
                               Map<LayoutVertex, Integer> xs,
                               Map<LayoutVertex, Integer> widths) {
        List<Map<String, int[]>> bundles = new ArrayList<>();
        for (int layer = 0; layer < layerCount; layer++) {
            bundles.add(new LinkedHashMap<>());
        }
        for (LayeredGraph.EdgeChain chain : graph.getChains()) {
            List<LayoutVertex> vertices = chain.getVertices();
            for (int i = 0; i + 1 < vertices.size(); i++) {
                LayoutVertex upper = vertices.get(i);
                LayoutVertex lower = vertices.get(i + 1);
                int from = column(upper, chain.isBackEdge(), xs, widths);
                int to = column(lower, chain.isBackEdge(), xs, widths);
                if (from == to) {
                    continue;
                }
                int[] span = bundles.get(upper.getLayer())
                        .computeIfAbsent(upper + ":" + from, k -> new int[]{Integer.MAX_VALUE, Integer.MIN_VALUE});
                span[0] = Math.min(span[0], Math.min(from, to));
                span[1] = Math.max(span[1], Math.max(from, to));
            }
        }

        int[] demand = new int[layerCount];
        for (int layer = 0; layer < layerCount; layer++) {
            List<int[]> spans = new ArrayList<>(bundles.get(layer).values());
            spans.sort(Comparator.comparingInt((int[] span) -> span[0]).thenComparingInt(span -> span[1]));
            List<Integer> rowEnds = new ArrayList<>();
            for (int[] span : spans) {
                int chosen = -1;
                for (int r = 0; r < rowEnds.size() && chosen < 0; r++) {
                    if (rowEnds.get(r) + 1 < span[0]) {
                        chosen = r;
                    }
                }
                if (chosen < 0) {
                    rowEnds.add(span[1]);
                } else {
                    rowEnds.set(chosen, span[1]);
                }
            }
            demand[layer] = rowEnds.size();
        }
        return demand;
    }

    private static int column(LayoutVertex vertex, boolean backEdge, Map<LayoutVertex, Integer> xs, Map<LayoutVertex, Integer> widths) {
        int x = xs.get(vertex);
        int w = widths.get(vertex);
        return backEdge ? GraphLayout.backEdgeAttachColumn(x, w) : GraphLayout.attachColumn(x, w);
    }

    private int widthOf(LayoutVertex vertex) {
        if (vertex.isVirtual()) {
            return 1;
        }
        return vertex.getNode().getLabel().length() + delimiterWidth;
    }
}
