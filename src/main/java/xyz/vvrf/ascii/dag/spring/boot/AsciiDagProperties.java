package xyz.vvrf.ascii.dag.spring.boot;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.ascii.dag.core.CharSet;
import xyz.vvrf.ascii.dag.core.NodeStyle;
import xyz.vvrf.ascii.dag.core.RenderOptions;

import javax.validation.Valid;
import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;

/**
 * ascii-dag 的配置属性类。
 * 绑定 'ascii-dag' 前缀下的属性。
 *
 * @author ruifeng.wen
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "ascii-dag")
@Validated
public class AsciiDagProperties {

    @Valid
    private final Render render = new Render();
    @Valid
    private final Layout layout = new Layout();
    @Valid
    private final SchedulerProps scheduler = new SchedulerProps();
    @Valid
    private final Monitor monitor = new Monitor();

    @Getter
    @Setter
    public static class Render {
        /**
         * 节点样式。
         */
        @NotNull
        private NodeStyle nodeStyle = NodeStyle.SQUARE;

        /**
         * node-style 为 CUSTOM 时的左定界符。
         */
        private String customLeft;

        /**
         * node-style 为 CUSTOM 时的右定界符。
         */
        private String customRight;

        @NotNull
        private CharSet charset = CharSet.UNICODE;

        @Min(1)
        private int nodeSpacing = RenderOptions.DEFAULT_NODE_SPACING;

        @Min(1)
        private int layerSpacing = RenderOptions.DEFAULT_LAYER_SPACING;

        private boolean showArrows = true;
    }

    @Getter
    @Setter
    public static class Layout {
        /**
         * 交叉最小化的最大扫描轮数，0 表示不做交叉最小化。
         */
        @Min(0)
        @Max(RenderOptions.MAX_CROSSING_SWEEPS_LIMIT)
        private int maxCrossingSweeps = RenderOptions.DEFAULT_MAX_CROSSING_SWEEPS;
    }

    @Getter
    @Setter
    public static class SchedulerProps {
        /**
         * 调度器类型。
         */
        private SchedulerType type = SchedulerType.BOUNDED_ELASTIC;

        /**
         * 调度器名称前缀。
         */
        private String namePrefix = "ascii-dag-render";

        @Min(1)
        private int threadCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE;

        @Min(1)
        private int queuedTaskCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE;

        @Min(0)
        private int ttlSeconds = 60;

        @Min(1)
        private int parallelism = Runtime.getRuntime().availableProcessors();
    }

    public enum SchedulerType {
        BOUNDED_ELASTIC, PARALLEL, SINGLE, IMMEDIATE
    }

    @Getter
    @Setter
    public static class Monitor {
        /**
         * 是否注册日志监听器。
         */
        private boolean loggingEnabled = false;

        /**
         * 存在 MeterRegistry 时是否注册 Micrometer 监听器。
         */
        private boolean metricsEnabled = true;
    }

    /**
     * 把属性转换为渲染配置。结果在渲染时校验。
     */
    public RenderOptions toRenderOptions() {
        RenderOptions.RenderOptionsBuilder builder = RenderOptions.builder()
                .nodeStyle(render.nodeStyle)
                .charset(render.charset)
                .nodeSpacing(render.nodeSpacing)
                .layerSpacing(render.layerSpacing)
                .showArrows(render.showArrows)
                .maxCrossingSweeps(layout.maxCrossingSweeps);
        if (render.customLeft != null || render.customRight != null) {
            builder.customDelimiters(RenderOptions.Delimiters.of(
                    render.customLeft == null ? "" : render.customLeft,
                    render.customRight == null ? "" : render.customRight));
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return "AsciiDagProperties{" +
                "render={nodeStyle=" + render.nodeStyle +
                ", charset=" + render.charset +
                ", nodeSpacing=" + render.nodeSpacing +
                ", layerSpacing=" + render.layerSpacing +
                ", showArrows=" + render.showArrows +
                "}, layout={maxCrossingSweeps=" + layout.maxCrossingSweeps +
                "}, scheduler={type=" + scheduler.type +
                ", namePrefix='" + scheduler.namePrefix + '\'' +
                "}, monitor={loggingEnabled=" + monitor.loggingEnabled +
                ", metricsEnabled=" + monitor.metricsEnabled +
                "}}";
    }
}
