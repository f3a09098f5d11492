package xyz.vvrf.ascii.dag.monitor;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.ascii.dag.core.Graph;
import xyz.vvrf.ascii.dag.core.RenderOptions;
import xyz.vvrf.ascii.dag.execution.RenderSummary;

import java.time.Duration;

/**
 * 把渲染事件写入日志的监听器。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class LoggingRenderMonitorListener implements RenderMonitorListener {

    @Override
    public void onRenderStart(String requestId, Graph graph, RenderOptions options) {
        log.info("[MONITOR] 请求:[{}] 渲染开始。 节点:[{}] 边:[{}] 样式:[{}] 字符集:[{}]",
                requestId, graph.getNodeCount(), graph.getEdgeCount(), options.getNodeStyle(), options.getCharset());
    }

    @Override
    public void onRenderSuccess(String requestId, RenderSummary summary, Duration duration) {
        log.info("[MONITOR] 请求:[{}] 渲染成功。 耗时:[{}ms], 层数:[{}], 回边:[{}], 交叉:[{}], 尺寸:[{}x{}]",
                requestId, duration.toMillis(), summary.getLayerCount(), summary.getBackEdgeCount(),
                summary.getCrossings(), summary.getWidth(), summary.getHeight());
    }

    @Override
    public void onRenderFailure(String requestId, Graph graph, Duration duration, Throwable error) {
        log.error("[MONITOR] 请求:[{}] 渲染失败。 耗时:[{}ms], 错误:[{}], 类型:[{}]",
                requestId, duration.toMillis(), error.getMessage(), error.getClass().getSimpleName(), error);
    }
}
