package xyz.vvrf.ascii.dag.execution;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.ascii.dag.core.Graph;
import xyz.vvrf.ascii.dag.core.RenderOptions;
import xyz.vvrf.ascii.dag.layout.CoordinateAssigner;
import xyz.vvrf.ascii.dag.layout.CrossingReducer;
import xyz.vvrf.ascii.dag.layout.GraphLayout;
import xyz.vvrf.ascii.dag.layout.LayerAssigner;
import xyz.vvrf.ascii.dag.layout.LayerAssignment;
import xyz.vvrf.ascii.dag.layout.LayeredGraph;
import xyz.vvrf.ascii.dag.monitor.RenderMonitorListener;
import xyz.vvrf.ascii.dag.render.Canvas;
import xyz.vvrf.ascii.dag.render.CanvasRenderer;
import xyz.vvrf.ascii.dag.render.GlyphResolver;
import xyz.vvrf.ascii.dag.render.GlyphSet;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * {@link GraphRenderer} 的标准实现，按顺序执行：
 * 配置校验 -&gt; 层分配 -&gt; 交叉最小化 -&gt; 坐标计算 -&gt; 画布绘制。
 * <p>
 * 单线程同步执行，不持有可变状态，多个线程可以共享同一个实例。
 * 失败时记录日志并原样抛出，不重试，也不输出部分结果。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class StandardGraphRenderer implements GraphRenderer {

    private final List<RenderMonitorListener> monitorListeners;

    public StandardGraphRenderer() {
        this(Collections.emptyList());
    }

    /**
     * @param monitorListeners 监控监听器列表，可以为 null
     */
    public StandardGraphRenderer(List<RenderMonitorListener> monitorListeners) {
        this.monitorListeners = (monitorListeners != null) ? Collections.unmodifiableList(new ArrayList<>(monitorListeners)) : Collections.emptyList();
        log.debug("StandardGraphRenderer 已创建，监听器数量: {}", this.monitorListeners.size());
    }

    @Override
    public String render(Graph graph, RenderOptions options, String requestId) {
        Objects.requireNonNull(graph, "图不能为空");
        Objects.requireNonNull(options, "渲染配置不能为空");
        final String actualRequestId = (requestId == null || requestId.trim().isEmpty())
                ? "render-" + UUID.randomUUID().toString().substring(0, 8)
                : requestId;

        Instant start = Instant.now();
        safeNotifyListeners(l -> l.onRenderStart(actualRequestId, graph, options));
        try {
            options.validate();
            if (graph.isEmpty()) {
                log.debug("[RequestId: {}] 空图，返回空文本", actualRequestId);
                Duration duration = Duration.between(start, Instant.now());
                safeNotifyListeners(l -> l.onRenderSuccess(actualRequestId, RenderSummary.empty(), duration));
                return "";
            }

            GlyphSet glyphs = GlyphResolver.resolve(options);
            GraphLayout layout = layout(graph, options, glyphs);
            Canvas canvas = new CanvasRenderer(glyphs, options.isShowArrows()).render(layout);
            String text = canvas.toText(glyphs);

            RenderSummary summary = RenderSummary.builder()
                    .nodeCount(graph.getNodeCount())
                    .edgeCount(graph.getEdgeCount())
                    .layerCount(layout.getAssignment().getLayerCount())
                    .backEdgeCount(layout.getAssignment().getBackEdgeCount())
                    .crossings(layout.getCrossings())
                    .width(canvas.getWidth())
                    .height(canvas.getHeight())
                    .build();
            Duration duration = Duration.between(start, Instant.now());
            log.debug("[RequestId: {}] 渲染完成: {} (耗时 {}ms)", actualRequestId, summary, duration.toMillis());
            safeNotifyListeners(l -> l.onRenderSuccess(actualRequestId, summary, duration));
            return text;
        } catch (RuntimeException e) {
            Duration duration = Duration.between(start, Instant.now());
            log.error("[RequestId: {}] 渲染 {} 失败: {}", actualRequestId, graph, e.getMessage(), e);
            safeNotifyListeners(l -> l.onRenderFailure(actualRequestId, graph, duration, e));
            throw e;
        }
    }

    /**
     * 只计算布局而不绘制，供调用方检查节点位置。
     *
     * @param graph   输入图
     * @param options 渲染配置 (会先校验)
     * @return 最终布局
     */
    public GraphLayout layout(Graph graph, RenderOptions options) {
        options.validate();
        return layout(graph, options, GlyphResolver.resolve(options));
    }

    private GraphLayout layout(Graph graph, RenderOptions options, GlyphSet glyphs) {
        LayerAssignment assignment = new LayerAssigner().assign(graph);
        LayeredGraph layered = LayeredGraph.build(graph, assignment);
        CrossingReducer.Ordering ordering = new CrossingReducer(options.getMaxCrossingSweeps()).reduce(layered);
        return new CoordinateAssigner(options.getNodeSpacing(), options.getLayerSpacing(), glyphs.getDelimiterWidth())
                .assign(layered, ordering);
    }

    private void safeNotifyListeners(Consumer<RenderMonitorListener> notification) {
        if (monitorListeners.isEmpty()) {
            return;
        }
        for (RenderMonitorListener listener : monitorListeners) {
            try {
                notification.accept(listener);
            } catch (Exception e) {
                log.error("渲染监控监听器 {} 在通知期间抛出异常: {}", listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }
}
