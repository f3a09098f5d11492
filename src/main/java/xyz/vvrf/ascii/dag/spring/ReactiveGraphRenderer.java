package xyz.vvrf.ascii.dag.spring;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import xyz.vvrf.ascii.dag.config.RenderOptionOverrides;
import xyz.vvrf.ascii.dag.core.Graph;
import xyz.vvrf.ascii.dag.core.RenderOptions;
import xyz.vvrf.ascii.dag.execution.GraphRenderer;

import java.util.Objects;

/**
 * 同步渲染器的响应式包装。
 * 包装一个核心 {@link GraphRenderer}，把每次渲染放到指定的 Reactor {@link Scheduler} 上执行，
 * 避免在事件循环线程上做布局计算。
 * <p>
 * 默认渲染配置来自宿主 (通常是 {@link xyz.vvrf.ascii.dag.spring.boot.AsciiDagProperties})，
 * 调用方可以用 {@link RenderOptionOverrides} 只覆盖部分字段。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class ReactiveGraphRenderer {

    private final GraphRenderer graphRenderer;
    private final Scheduler scheduler;
    private final RenderOptions defaultOptions;

    /**
     * @param graphRenderer  核心渲染器
     * @param scheduler      执行渲染的调度器
     * @param defaultOptions 宿主提供的默认配置
     */
    public ReactiveGraphRenderer(GraphRenderer graphRenderer, Scheduler scheduler, RenderOptions defaultOptions) {
        this.graphRenderer = Objects.requireNonNull(graphRenderer, "GraphRenderer 不能为空");
        this.scheduler = Objects.requireNonNull(scheduler, "Scheduler 不能为空");
        this.defaultOptions = Objects.requireNonNull(defaultOptions, "默认渲染配置不能为空");
        log.info("ReactiveGraphRenderer wrapper initialized, wrapping renderer: {}", graphRenderer.getClass().getSimpleName());
    }

    /**
     * 使用宿主默认配置渲染。
     */
    public Mono<String> render(Graph graph) {
        return render(graph, defaultOptions);
    }

    /**
     * 在宿主默认配置上应用覆盖后渲染。
     */
    public Mono<String> render(Graph graph, RenderOptionOverrides overrides) {
        return render(graph, overrides.applyTo(defaultOptions));
    }

    /**
     * 在调度器上执行一次渲染。订阅时才开始计算，错误以 onError 传递。
     *
     * @param graph   输入图
     * @param options 完整的渲染配置
     * @return 渲染结果
     */
    public Mono<String> render(Graph graph, RenderOptions options) {
        Objects.requireNonNull(graph, "图不能为空");
        Objects.requireNonNull(options, "渲染配置不能为空");
        return Mono.fromCallable(() -> graphRenderer.render(graph, options))
                .subscribeOn(scheduler)
                .doOnError(e -> log.debug("Reactive render of {} failed: {}", graph, e.getMessage()));
    }

    /**
     * 逐个渲染图流中的每个图，结果顺序与输入一致。
     */
    public Flux<String> renderAll(Flux<Graph> graphs, RenderOptions options) {
        Objects.requireNonNull(options, "渲染配置不能为空");
        return graphs.concatMap(graph -> render(graph, options));
    }

    public Flux<String> renderAll(Flux<Graph> graphs) {
        return renderAll(graphs, defaultOptions);
    }

    public RenderOptions getDefaultOptions() {
        return defaultOptions;
    }

    /**
     * 提供对底层核心渲染器的访问。
     */
    public GraphRenderer getGraphRenderer() {
        return graphRenderer;
    }
}
