package xyz.vvrf.ascii.dag.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.ascii.dag.execution.GraphRenderer;
import xyz.vvrf.ascii.dag.execution.StandardGraphRenderer;
import xyz.vvrf.ascii.dag.monitor.LoggingRenderMonitorListener;
import xyz.vvrf.ascii.dag.monitor.MicrometerRenderMonitorListener;
import xyz.vvrf.ascii.dag.monitor.RenderMonitorListener;
import xyz.vvrf.ascii.dag.spring.ReactiveGraphRenderer;

import java.util.List;
import java.util.stream.Collectors;

/**
 * ascii-dag 的 Spring Boot 自动配置类。
 * 职责:
 * 1. 启用并绑定 {@link AsciiDagProperties}。
 * 2. 提供核心的 {@link GraphRenderer} Bean，并注入上下文中所有的 {@link RenderMonitorListener}。
 * 3. 提供渲染用的 {@link Scheduler} Bean ("asciiDagRenderScheduler")，类型由属性配置。
 * 4. 提供 {@link ReactiveGraphRenderer} Bean，默认渲染配置来自属性。
 * 5. 按属性注册日志监听器，存在 MeterRegistry 时注册 Micrometer 监听器。
 *
 * @author ruifeng.wen
 */
@Configuration
@EnableConfigurationProperties(AsciiDagProperties.class)
@AutoConfigureAfter(name = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@Slf4j
public class AsciiDagAutoConfiguration {

    public static final String RENDER_SCHEDULER_BEAN_NAME = "asciiDagRenderScheduler";

    public AsciiDagAutoConfiguration() {
        log.info("ascii-dag 自动配置 (AsciiDagAutoConfiguration) 已加载。");
    }

    /**
     * 提供核心渲染器，收集上下文中所有的监控监听器。
     */
    @Bean
    @ConditionalOnMissingBean(GraphRenderer.class)
    public GraphRenderer asciiDagGraphRenderer(ObjectProvider<RenderMonitorListener> listenersProvider) {
        List<RenderMonitorListener> listeners = listenersProvider.orderedStream().collect(Collectors.toList());
        log.info("正在创建 GraphRenderer Bean，监听器: {}",
                listeners.stream().map(l -> l.getClass().getSimpleName()).collect(Collectors.toList()));
        return new StandardGraphRenderer(listeners);
    }

    /**
     * 提供渲染调度器。如果已存在同名 Bean，则不创建。
     */
    @Bean(name = RENDER_SCHEDULER_BEAN_NAME, destroyMethod = "dispose")
    @ConditionalOnMissingBean(name = RENDER_SCHEDULER_BEAN_NAME)
    public Scheduler asciiDagRenderScheduler(AsciiDagProperties properties) {
        AsciiDagProperties.SchedulerProps schedulerProps = properties.getScheduler();
        String namePrefix = schedulerProps.getNamePrefix();

        switch (schedulerProps.getType()) {
            case PARALLEL:
                log.info("正在创建 '{}' (Parallel): prefix={}, parallelism={}", RENDER_SCHEDULER_BEAN_NAME, namePrefix, schedulerProps.getParallelism());
                return Schedulers.newParallel(namePrefix, schedulerProps.getParallelism(), true);
            case SINGLE:
                log.info("正在创建 '{}' (Single): prefix={}", RENDER_SCHEDULER_BEAN_NAME, namePrefix);
                return Schedulers.newSingle(namePrefix, true);
            case IMMEDIATE:
                log.info("'{}' 使用 Immediate 调度器，渲染在订阅线程上执行", RENDER_SCHEDULER_BEAN_NAME);
                return Schedulers.immediate();
            case BOUNDED_ELASTIC:
            default:
                log.info("正在创建 '{}' (BoundedElastic): prefix={}, cap={}, queue={}, ttl={}s",
                        RENDER_SCHEDULER_BEAN_NAME, namePrefix, schedulerProps.getThreadCap(),
                        schedulerProps.getQueuedTaskCap(), schedulerProps.getTtlSeconds());
                return Schedulers.newBoundedElastic(schedulerProps.getThreadCap(), schedulerProps.getQueuedTaskCap(),
                        namePrefix, schedulerProps.getTtlSeconds(), true);
        }
    }

    @Bean
    @ConditionalOnMissingBean(ReactiveGraphRenderer.class)
    public ReactiveGraphRenderer reactiveGraphRenderer(GraphRenderer graphRenderer,
                                                       @Qualifier(RENDER_SCHEDULER_BEAN_NAME) Scheduler scheduler,
                                                       AsciiDagProperties properties) {
        log.info("正在创建 ReactiveGraphRenderer Bean，配置: {}", properties);
        return new ReactiveGraphRenderer(graphRenderer, scheduler, properties.toRenderOptions());
    }

    @Bean
    @ConditionalOnMissingBean(LoggingRenderMonitorListener.class)
    @ConditionalOnProperty(prefix = "ascii-dag.monitor", name = "logging-enabled", havingValue = "true")
    public LoggingRenderMonitorListener loggingRenderMonitorListener() {
        return new LoggingRenderMonitorListener();
    }

    /**
     * Micrometer 指标监听器，仅在 classpath 和上下文中都存在 MeterRegistry 时生效。
     */
    @Configuration
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean(MicrometerRenderMonitorListener.class)
        @ConditionalOnProperty(prefix = "ascii-dag.monitor", name = "metrics-enabled", havingValue = "true", matchIfMissing = true)
        public MicrometerRenderMonitorListener micrometerRenderMonitorListener(MeterRegistry meterRegistry) {
            log.info("检测到 MeterRegistry ({})，注册 MicrometerRenderMonitorListener", meterRegistry.getClass().getSimpleName());
            return new MicrometerRenderMonitorListener(meterRegistry);
        }
    }
}
