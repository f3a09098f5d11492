package xyz.vvrf.ascii.dag.layout;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.ascii.dag.core.ConfigurationException;

import java.util.*;

/**
 * 基于重心法 (barycenter) 的交叉最小化。
 * <p>
 * 每一轮包含一次自上而下的扫描 (按上一层邻居的平均位置排序) 和一次自下而上的扫描
 * (按下一层邻居的平均位置排序)。没有邻居的顶点以当前位置作为重心。
 * 重心相同时先按原位置、再按标识符排序，结果完全确定。
 * 一整轮中没有任何层的顺序变化即视为收敛，提前停止。
 * 返回扫描过程中交叉数最少的顺序 (只有严格减少时才替换)。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class CrossingReducer {

    private final int maxSweeps;

    /**
     * @param maxSweeps 最大扫描轮数，0 表示保持初始顺序
     */
    public CrossingReducer(int maxSweeps) {
        if (maxSweeps < 0) {
            throw new ConfigurationException("maxSweeps must not be negative, got " + maxSweeps);
        }
        this.maxSweeps = maxSweeps;
    }

    /**
     * 计算层内顺序。
     *
     * @param graph 分层图
     * @return 排序结果
     */
    public Ordering reduce(LayeredGraph graph) {
        List<List<LayoutVertex>> current = copy(graph.getInitialLayers());
        int initialCrossings = countCrossings(graph, current);
        List<List<LayoutVertex>> best = copy(current);
        int bestCrossings = initialCrossings;
        int passes = 0;
        boolean converged = false;

        while (passes < maxSweeps && bestCrossings > 0) {
            passes++;
            boolean changed = false;
            Map<LayoutVertex, Integer> positions = positionsOf(current);

            for (int layer = 1; layer < current.size(); layer++) {
                changed |= reorderLayer(graph, current, layer, positions, true);
            }
            for (int layer = current.size() - 2; layer >= 0; layer--) {
                changed |= reorderLayer(graph, current, layer, positions, false);
            }

            int crossings = countCrossings(graph, current);
            log.trace("Crossing reduction pass {}: {} crossing(s), changed={}", passes, crossings, changed);
            if (crossings < bestCrossings) {
                bestCrossings = crossings;
                best = copy(current);
            }
            if (!changed) {
                converged = true;
                break;
            }
        }

        log.debug("Crossing reduction: {} -> {} crossing(s) after {} pass(es){}",
                initialCrossings, bestCrossings, passes, converged ? " (converged)" : "");
        return new Ordering(freeze(best), initialCrossings, bestCrossings, passes);
    }

    private boolean reorderLayer(LayeredGraph graph,
                                 List<List<LayoutVertex>> layers,
                                 int layer,
                                 Map<LayoutVertex, Integer> positions,
                                 boolean useUpper) {
        List<LayoutVertex> vertices = layers.get(layer);
        if (vertices.size() < 2) {
            return false;
        }
        Map<LayoutVertex, Double> barycenters = new HashMap<>();
        for (LayoutVertex vertex : vertices) {
            List<LayoutVertex> neighbors = useUpper ? graph.getUpperNeighbors(vertex) : graph.getLowerNeighbors(vertex);
            if (neighbors.isEmpty()) {
                barycenters.put(vertex, (double) positions.get(vertex));
                continue;
            }
            double sum = 0;
            for (LayoutVertex neighbor : neighbors) {
                sum += positions.get(neighbor);
            }
            barycenters.put(vertex, sum / neighbors.size());
        }

        List<LayoutVertex> sorted = new ArrayList<>(vertices);
        sorted.sort(Comparator.<LayoutVertex>comparingDouble(barycenters::get)
                .thenComparingInt(positions::get)
                .thenComparing(LayoutVertex.IDENTIFIER_ORDER));

        if (sorted.equals(vertices)) {
            return false;
        }
        layers.set(layer, sorted);
        for (int i = 0; i < sorted.size(); i++) {
            positions.put(sorted.get(i), i);
        }
        return true;
    }

    /**
     * 统计相邻两层之间两两相交的线段数。共享端点的线段不算交叉。
     *
     * @param graph  分层图
     * @param layers 每层的顶点顺序
     * @return 交叉总数
     */
    public static int countCrossings(LayeredGraph graph, List<List<LayoutVertex>> layers) {
        Map<LayoutVertex, Integer> positions = positionsOf(layers);
        int total = 0;
        for (int layer = 0; layer + 1 < layers.size(); layer++) {
            List<LayeredGraph.Segment> segments = graph.getSegmentsBelow(layer);
            int size = segments.size();
            int[] uppers = new int[size];
            int[] lowers = new int[size];
            for (int i = 0; i < size; i++) {
                uppers[i] = positions.get(segments.get(i).getUpper());
                lowers[i] = positions.get(segments.get(i).getLower());
            }
            for (int i = 0; i < size; i++) {
                for (int j = i + 1; j < size; j++) {
                    if ((uppers[i] < uppers[j] && lowers[i] > lowers[j])
                            || (uppers[i] > uppers[j] && lowers[i] < lowers[j])) {
                        total++;
                    }
                }
            }
        }
        return total;
    }

    private static Map<LayoutVertex, Integer> positionsOf(List<List<LayoutVertex>> layers) {
        Map<LayoutVertex, Integer> positions = new HashMap<>();
        for (List<LayoutVertex> layer : layers) {
            for (int i = 0; i < layer.size(); i++) {
                positions.put(layer.get(i), i);
            }
        }
        return positions;
    }

    private static List<List<LayoutVertex>> copy(List<List<LayoutVertex>> layers) {
        List<List<LayoutVertex>> result = new ArrayList<>(layers.size());
        for (List<LayoutVertex> layer : layers) {
            result.add(new ArrayList<>(layer));
        }
        return result;
    }

    private static List<List<LayoutVertex>> freeze(List<List<LayoutVertex>> layers) {
        List<List<LayoutVertex>> result = new ArrayList<>(layers.size());
        for (List<LayoutVertex> layer : layers) {
            result.add(Collections.unmodifiableList(new ArrayList<>(layer)));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * 交叉最小化结果：冻结后的层内顺序及统计信息。
     */
    @Value
    public static class Ordering {
        List<List<LayoutVertex>> layers;
        int initialCrossings;
        int crossings;
        int passes;
    }
}
