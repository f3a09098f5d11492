package xyz.vvrf.ascii.dag.spring;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import xyz.vvrf.ascii.dag.builder.GraphBuilder;
import xyz.vvrf.ascii.dag.config.RenderOptionOverrides;
import xyz.vvrf.ascii.dag.core.CharSet;
import xyz.vvrf.ascii.dag.core.ConfigurationException;
import xyz.vvrf.ascii.dag.core.Graph;
import xyz.vvrf.ascii.dag.core.NodeStyle;
import xyz.vvrf.ascii.dag.core.RenderOptions;
import xyz.vvrf.ascii.dag.execution.StandardGraphRenderer;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ReactiveGraphRenderer")
class ReactiveGraphRendererTest {

    private Scheduler scheduler;
    private ReactiveGraphRenderer reactive;

    private final Graph edge = GraphBuilder.directed().addNode("A").addNode("B").addEdge("A", "B").build();

    @BeforeEach
    void setUp() {
        scheduler = Schedulers.newSingle("ascii-dag-test");
        RenderOptions hostDefaults = RenderOptions.builder().charset(CharSet.ASCII).build();
        reactive = new ReactiveGraphRenderer(new StandardGraphRenderer(), scheduler, hostDefaults);
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    @Test
    @DisplayName("使用宿主默认配置，在指定调度器上执行")
    void rendersOnScheduler() {
        AtomicReference<String> thread = new AtomicReference<>();

        StepVerifier.create(reactive.render(edge).doOnNext(text -> thread.set(Thread.currentThread().getName())))
                .expectNext("[A]\n |\n v\n[B]")
                .verifyComplete();
        assertThat(thread.get()).startsWith("ascii-dag-test");
    }

    @Test
    @DisplayName("调用方覆盖只影响给出的字段")
    void appliesOverrides() {
        RenderOptionOverrides overrides = RenderOptionOverrides.builder()
                .nodeStyle(NodeStyle.ROUND)
                .showArrows(false)
                .build();

        StepVerifier.create(reactive.render(edge, overrides))
                .expectNext("(A)\n |\n |\n(B)")
                .verifyComplete();
    }

    @Test
    @DisplayName("配置错误以 onError 传递")
    void propagatesErrors() {
        RenderOptions invalid = RenderOptions.builder().nodeStyle(NodeStyle.CUSTOM).build();

        StepVerifier.create(reactive.render(edge, invalid))
                .expectError(ConfigurationException.class)
                .verify();
    }

    @Test
    @DisplayName("订阅之前不执行渲染")
    void lazy() {
        Mono<String> pending = reactive.render(edge, RenderOptions.builder().nodeSpacing(-1).build());

        assertThat(pending).isNotNull();
        StepVerifier.create(pending).expectError(ConfigurationException.class).verify();
    }

    @Test
    @DisplayName("批量渲染保持输入顺序")
    void renderAllKeepsOrder() {
        Graph single = GraphBuilder.directed().addNode("X").build();

        StepVerifier.create(reactive.renderAll(Flux.just(edge, single, Graph.empty())))
                .expectNext("[A]\n |\n v\n[B]")
                .expectNext("[X]")
                .expectNext("")
                .verifyComplete();
    }
}
