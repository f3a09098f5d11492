package xyz.vvrf.ascii.dag.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.ascii.dag.core.Graph;
import xyz.vvrf.ascii.dag.core.RenderOptions;
import xyz.vvrf.ascii.dag.execution.RenderSummary;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * 把渲染事件记录为 Micrometer 指标。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class MicrometerRenderMonitorListener implements RenderMonitorListener {

    // 指标名称
    public static final String METRIC_RENDER_TIME = "ascii.dag.render.time";
    public static final String METRIC_RENDER_TOTAL = "ascii.dag.render.total";
    public static final String METRIC_RENDER_CROSSINGS = "ascii.dag.render.crossings";
    public static final String METRIC_RENDER_BACK_EDGES = "ascii.dag.render.back.edges";

    // 标签键
    public static final String TAG_STATUS = "status";
    public static final String TAG_ERROR = "error";

    // 状态标签值
    public static final String STATUS_SUCCESS = "SUCCESS";
    public static final String STATUS_FAILURE = "FAILURE";

    private static final String NO_ERROR = "none";

    private final MeterRegistry meterRegistry;

    public MicrometerRenderMonitorListener(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "MeterRegistry 不能为空");
    }

    @Override
    public void onRenderStart(String requestId, Graph graph, RenderOptions options) {
        // 计时器和计数器在结束时记录
    }

    @Override
    public void onRenderSuccess(String requestId, RenderSummary summary, Duration duration) {
        Tags tags = Tags.of(
                Tag.of(TAG_STATUS, STATUS_SUCCESS),
                Tag.of(TAG_ERROR, NO_ERROR)
        );
        recordTimer(tags, duration);
        incrementCounter(tags);
        recordSummary(METRIC_RENDER_CROSSINGS, "每次渲染剩余的边交叉数", summary.getCrossings());
        recordSummary(METRIC_RENDER_BACK_EDGES, "每次渲染识别出的回边数", summary.getBackEdgeCount());
    }

    @Override
    public void onRenderFailure(String requestId, Graph graph, Duration duration, Throwable error) {
        String errorTagValue = error != null ? error.getClass().getSimpleName() : "Unknown";
        Tags tags = Tags.of(
                Tag.of(TAG_STATUS, STATUS_FAILURE),
                Tag.of(TAG_ERROR, errorTagValue)
        );
        recordTimer(tags, duration);
        incrementCounter(tags);
    }

    private void recordTimer(Tags tags, Duration duration) {
        try {
            Timer timer = Timer.builder(METRIC_RENDER_TIME)
                    .tags(tags)
                    .description("图渲染耗时")
                    .register(meterRegistry);
            timer.record(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.error("记录计时器指标失败: {}", e.getMessage(), e);
        }
    }

    private void incrementCounter(Tags tags) {
        try {
            Counter counter = Counter.builder(METRIC_RENDER_TOTAL)
                    .tags(tags)
                    .description("按状态统计的渲染总数")
                    .register(meterRegistry);
            counter.increment();
        } catch (Exception e) {
            log.error("增加计数器指标失败: {}", e.getMessage(), e);
        }
    }

    private void recordSummary(String name, String description, int value) {
        try {
            DistributionSummary.builder(name)
                    .description(description)
                    .register(meterRegistry)
                    .record(value);
        } catch (Exception e) {
            log.error("记录分布指标 {} 失败: {}", name, e.getMessage(), e);
        }
    }
}
