package io.github.hide212131.langchain4j.context.runtime.instrument;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.hide212131.langchain4j.context.infra.observability.LifecycleTracer;
import io.github.hide212131.langchain4j.context.runtime.com.ContextObjectModel;
import io.github.hide212131.langchain4j.context.runtime.component.EngineComponent;
import io.github.hide212131.langchain4j.context.runtime.component.TickState;
import io.github.hide212131.langchain4j.context.runtime.compiler.FiberCompiler;
import io.github.hide212131.langchain4j.context.runtime.element.Element;
import io.github.hide212131.langchain4j.context.runtime.element.Elements;
import io.github.hide212131.langchain4j.context.runtime.primitives.Primitives;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TracingComponentMiddlewareTest {

    private InMemorySpanExporter exporter;
    private SdkTracerProvider provider;
    private FiberCompiler compiler;

    @BeforeEach
    void setUp() {
        exporter = InMemorySpanExporter.create();
        provider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(exporter))
                .build();
        LifecycleTracer tracer = new LifecycleTracer(provider.get("context-compiler-test"), true);
        compiler = new FiberCompiler(new ContextObjectModel(), TracingComponentMiddleware.registryFor(tracer));
    }

    @AfterEach
    void tearDown() {
        provider.close();
    }

    @Test
    @DisplayName("ライフサイクル呼び出しごとにスパンが記録される")
    void spansPerLifecycleCall() {
        // Given: a compiled component
        compiler.compile(Elements.instance(new Summarizer(false), null), TickState.initial());

        // When: the tree is unmounted
        compiler.unmount();

        // Then: mount, render and unmount are traced in order
        List<SpanData> spans = exporter.getFinishedSpanItems();
        assertThat(spans).extracting(SpanData::getName)
                .containsExactly("component.onMount", "component.render", "component.onUnmount");
        SpanData render = spans.get(1);
        assertThat(render.getAttributes().get(AttributeKey.stringKey("component.name"))).isEqualTo("Summarizer");
        assertThat(render.getAttributes().get(AttributeKey.stringKey("component.method"))).isEqualTo("render");
        assertThat(render.getStatus().getStatusCode()).isEqualTo(StatusCode.OK);
    }

    @Test
    @DisplayName("描画の失敗はエラースパンとして記録され、例外はそのまま送出される")
    void failedRenderIsRecorded() {
        assertThatThrownBy(() -> compiler.compile(Elements.instance(new Summarizer(true), null),
                TickState.initial()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("render failed");

        SpanData render = exporter.getFinishedSpanItems().stream()
                .filter(span -> span.getName().equals("component.render"))
                .findFirst()
                .orElseThrow();
        assertThat(render.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
    }

    private static final class Summarizer extends EngineComponent {

        private final boolean failing;

        Summarizer(boolean failing) {
            this.failing = failing;
        }

        @Override
        public Element render(ContextObjectModel com, TickState state) {
            if (failing) {
                throw new IllegalStateException("render failed");
            }
            return Primitives.section("summary", "short");
        }
    }
}
