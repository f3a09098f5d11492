package xyz.vvrf.ascii.dag.monitor;

import xyz.vvrf.ascii.dag.core.Graph;
import xyz.vvrf.ascii.dag.core.RenderOptions;
import xyz.vvrf.ascii.dag.execution.RenderSummary;

import java.time.Duration;

/**
 * 用于监控渲染调用的监听器接口。
 * 监听器抛出的异常会被渲染器记录并忽略，不影响渲染结果。
 *
 * @author ruifeng.wen
 */
public interface RenderMonitorListener {

    /**
     * 渲染开始时调用 (配置校验之前)。
     *
     * @param requestId 请求 ID
     * @param graph     输入图
     * @param options   渲染配置
     */
    void onRenderStart(String requestId, Graph graph, RenderOptions options);

    /**
     * 渲染成功完成时调用。
     *
     * @param requestId 请求 ID
     * @param summary   渲染统计
     * @param duration  总耗时
     */
    void onRenderSuccess(String requestId, RenderSummary summary, Duration duration);

    /**
     * 渲染失败时调用。
     *
     * @param requestId 请求 ID
     * @param graph     输入图
     * @param duration  失败前的耗时
     * @param error     导致失败的异常
     */
    void onRenderFailure(String requestId, Graph graph, Duration duration, Throwable error);
}
