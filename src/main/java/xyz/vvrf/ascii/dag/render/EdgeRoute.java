package xyz.vvrf.ascii.dag.render;

import xyz.vvrf.ascii.dag.layout.GraphLayout;
import xyz.vvrf.ascii.dag.layout.LayeredGraph;
import xyz.vvrf.ascii.dag.layout.LayoutVertex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 一条画在画布上的连线路径。
 * 经过完全相同单元格的多条边 (例如同一对节点之间的重复边) 共用一个路径，只绘制一次。
 * <p>
 * 路径由相邻两层之间的若干线段组成。每段在上端点的连接列向下，
 * 若上下连接列不同，则在层间某一行 (bendRow) 水平拐向下端点的连接列。
 *
 * @author ruifeng.wen
 */
public final class EdgeRoute {

    static final int STRAIGHT = -1;

    private final List<LayeredGraph.EdgeChain> chains = new ArrayList<>();
    private final List<LayoutVertex> vertices;
    private final int[] columns;
    private final int[] bendRows;
    private final List<SegmentOwner> owners;

    private EdgeRoute(List<LayoutVertex> vertices, int[] columns) {
        this.vertices = vertices;
        this.columns = columns;
        this.bendRows = new int[vertices.size() - 1];
        Arrays.fill(bendRows, STRAIGHT);
        List<SegmentOwner> list = new ArrayList<>();
        for (int i = 0; i + 1 < vertices.size(); i++) {
            list.add(new SegmentOwner(vertices.get(i), vertices.get(i + 1)));
        }
        this.owners = Collections.unmodifiableList(list);
    }

    /**
     * 为一条边链计算路径的顶点与连接列。回边连接在节点中心右侧一列。
     */
    static EdgeRoute of(LayeredGraph.EdgeChain chain, GraphLayout layout) {
        List<LayoutVertex> vertices = chain.getVertices();
        int[] columns = new int[vertices.size()];
        for (int i = 0; i < vertices.size(); i++) {
            LayoutVertex vertex = vertices.get(i);
            columns[i] = chain.isBackEdge() ? layout.getBackEdgeAttachColumn(vertex) : layout.getAttachColumn(vertex);
        }
        EdgeRoute route = new EdgeRoute(vertices, columns);
        route.chains.add(chain);
        return route;
    }

    /**
     * 路径的唯一标识：经过的顶点及各自的连接列。标识相同的路径画出的单元格完全相同。
     */
    String routeKey() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < vertices.size(); i++) {
            sb.append(vertices.get(i)).append(':').append(columns[i]).append('|');
        }
        return sb.toString();
    }

    void merge(EdgeRoute other) {
        chains.addAll(other.chains);
    }

    public List<LayeredGraph.EdgeChain> getChains() {
        return Collections.unmodifiableList(chains);
    }

    public List<LayoutVertex> getVertices() {
        return Collections.unmodifiableList(vertices);
    }

    public int getSegmentCount() {
        return bendRows.length;
    }

    public LayoutVertex getUpper(int segment) {
        return vertices.get(segment);
    }

    public LayoutVertex getLower(int segment) {
        return vertices.get(segment + 1);
    }

    public int getUpperColumn(int segment) {
        return columns[segment];
    }

    public int getLowerColumn(int segment) {
        return columns[segment + 1];
    }

    public boolean bends(int segment) {
        return columns[segment] != columns[segment + 1];
    }

    /**
     * 线段水平拐弯所在的行，直线段返回 {@link #STRAIGHT}。
     */
    public int getBendRow(int segment) {
        return bendRows[segment];
    }

    void setBendRow(int segment, int row) {
        bendRows[segment] = row;
    }

    SegmentOwner getOwner(int segment) {
        return owners.get(segment);
    }

    /**
     * 路径中有一条有向边从上层指向下层时为 true。
     */
    public boolean hasDownwardFlow() {
        for (LayeredGraph.EdgeChain chain : chains) {
            if (chain.pointsDownward()) {
                return true;
            }
        }
        return false;
    }

    /**
     * 路径中有一条有向边从下层指回上层 (回边) 时为 true。
     */
    public boolean hasUpwardFlow() {
        for (LayeredGraph.EdgeChain chain : chains) {
            if (chain.pointsUpward()) {
                return true;
            }
        }
        return false;
    }

    public boolean isBackEdgeRoute() {
        for (LayeredGraph.EdgeChain chain : chains) {
            if (chain.isBackEdge()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "EdgeRoute{" + vertices + ", columns=" + Arrays.toString(columns) + ", bends=" + Arrays.toString(bendRows) + '}';
    }

    /**
     * 线段作为单元格的占用方。共享任一端点的线段视为相关 (分叉、汇合或经过同一虚拟顶点)。
     */
    static final class SegmentOwner implements Canvas.PathOwner {
        private final LayoutVertex upper;
        private final LayoutVertex lower;

        SegmentOwner(LayoutVertex upper, LayoutVertex lower) {
            this.upper = upper;
            this.lower = lower;
        }

        @Override
        public boolean isRelatedTo(Canvas.PathOwner other) {
            if (!(other instanceof SegmentOwner)) {
                return false;
            }
            SegmentOwner that = (SegmentOwner) other;
            return upper.equals(that.upper) || lower.equals(that.lower)
                    || upper.equals(that.lower) || lower.equals(that.upper);
        }
    }
}
