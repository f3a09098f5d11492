package xyz.vvrf.ascii.dag.execution;

import lombok.Builder;
import lombok.Value;

/**
 * 一次成功渲染的统计信息，供监控监听器使用。
 *
 * @author ruifeng.wen
 */
@Value
@Builder
public class RenderSummary {
    int nodeCount;
    int edgeCount;
    int layerCount;
    int backEdgeCount;
    int crossings;
    int width;
    int height;

    public static RenderSummary empty() {
        return RenderSummary.builder().build();
    }
}
