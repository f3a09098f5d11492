package xyz.vvrf.ascii.dag.layout;

import xyz.vvrf.ascii.dag.core.GraphEdge;
import xyz.vvrf.ascii.dag.core.LayoutInvariantException;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 分层结果（不可变）：每个节点的全局层号、回边集合以及 DFS 发现顺序。
 * 回边以边的插入序号标记，原始 {@link GraphEdge} 不会被修改。
 *
 * @author ruifeng.wen
 */
public final class LayerAssignment {

    private final Map<String, Integer> layers;
    private final Set<Integer> backEdgeIndices;
    private final List<String> discoveryOrder;
    private final List<List<String>> components;
    private final int layerCount;

    LayerAssignment(Map<String, Integer> layers,
                    Set<Integer> backEdgeIndices,
                    List<String> discoveryOrder,
                    List<List<String>> components,
                    int layerCount) {
        this.layers = Collections.unmodifiableMap(layers);
        this.backEdgeIndices = Collections.unmodifiableSet(backEdgeIndices);
        this.discoveryOrder = Collections.unmodifiableList(discoveryOrder);
        this.components = Collections.unmodifiableList(components);
        this.layerCount = layerCount;
    }

    /**
     * @throws LayoutInvariantException 节点没有分配层号时 (内部错误)
     */
    public int getLayer(String nodeId) {
        Integer layer = layers.get(nodeId);
        if (layer == null) {
            throw new LayoutInvariantException(String.format("Node '%s' has no layer assigned.", nodeId));
        }
        return layer;
    }

    public Map<String, Integer> getLayers() {
        return layers;
    }

    public boolean isBackEdge(GraphEdge edge) {
        return backEdgeIndices.contains(edge.getIndex());
    }

    /**
     * 回边的插入序号集合。
     */
    public Set<Integer> getBackEdgeIndices() {
        return backEdgeIndices;
    }

    public int getBackEdgeCount() {
        return backEdgeIndices.size();
    }

    /**
     * 所有节点按 DFS 首次发现的顺序排列 (分量按最小标识符排序，分量内根节点按标识符排序)。
     */
    public List<String> getDiscoveryOrder() {
        return discoveryOrder;
    }

    /**
     * 弱连通分量，按在画布上自上而下的堆叠顺序排列。
     */
    public List<List<String>> getComponents() {
        return components;
    }

    public int getLayerCount() {
        return layerCount;
    }

    /**
     * 返回边在分层中位于上层的端点。自环返回其唯一端点。
     */
    public String upperEndpoint(GraphEdge edge) {
        return getLayer(edge.getSource()) <= getLayer(edge.getTarget()) ? edge.getSource() : edge.getTarget();
    }

    public String lowerEndpoint(GraphEdge edge) {
        return edge.opposite(upperEndpoint(edge));
    }

    @Override
    public String toString() {
        return "LayerAssignment{layers=" + layerCount + ", nodes=" + layers.size() + ", backEdges=" + backEdgeIndices + '}';
    }
}
