package xyz.vvrf.ascii.dag.execution;

import xyz.vvrf.ascii.dag.core.Graph;
import xyz.vvrf.ascii.dag.core.RenderOptions;

import java.util.UUID;

/**
 * 图渲染器接口：把图转换为字符画文本。
 * 实现必须是无状态的，每次调用独立完成分层、交叉最小化、坐标计算和绘制。
 *
 * @author ruifeng.wen
 */
public interface GraphRenderer {

    /**
     * 渲染图。
     *
     * @param graph     输入图 (不能为空)
     * @param options   渲染配置 (不能为空)，在任何布局工作开始前校验
     * @param requestId 可选的请求 ID，用于日志和监控。如果为 null 或空，将自动生成。
     * @return 各行右侧去空白、无首尾空行、以 '\n' 连接的文本；空图返回空串
     * @throws xyz.vvrf.ascii.dag.core.ConfigurationException   配置非法时
     * @throws xyz.vvrf.ascii.dag.core.LayoutInvariantException 内部布局错误时
     */
    String render(Graph graph, RenderOptions options, String requestId);

    /**
     * 渲染图，自动生成请求 ID。
     */
    default String render(Graph graph, RenderOptions options) {
        String defaultRequestId = "render-" + UUID.randomUUID().toString().substring(0, 8);
        return render(graph, options, defaultRequestId);
    }

    /**
     * 使用默认配置渲染图。
     */
    default String render(Graph graph) {
        return render(graph, RenderOptions.defaults());
    }
}
