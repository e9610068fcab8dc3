package io.github.hide212131.langchain4j.context.infra.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Wraps component lifecycle calls and compile passes in OpenTelemetry spans.
 */
public final class LifecycleTracer {

    private final Tracer tracer;
    private final boolean enabled;

    public LifecycleTracer(Tracer tracer, boolean enabled) {
        this.tracer = tracer;
        this.enabled = enabled;
    }

    public static LifecycleTracer from(ObservabilityConfig config) {
        return new LifecycleTracer(config.tracer(), config.isEnabled());
    }

    /**
     * Executes an operation inside a span. Failures mark the span as errored and are rethrown.
     */
    public <T> T trace(String operationName, Map<String, Object> attributes, Supplier<T> operation) {
        if (!enabled) {
            return operation.get();
        }

        Span span = tracer.spanBuilder(operationName)
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();
        applyAttributes(span, attributes);

        try (Scope scope = span.makeCurrent()) {
            T result = operation.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public void trace(String operationName, Map<String, Object> attributes, Runnable operation) {
        trace(operationName, attributes, () -> {
            operation.run();
            return null;
        });
    }

    public boolean isEnabled() {
        return enabled;
    }

    private static void applyAttributes(Span span, Map<String, Object> attributes) {
        if (attributes == null) {
            return;
        }
        attributes.forEach((key, value) -> {
            if (value instanceof String str) {
                span.setAttribute(key, str);
            } else if (value instanceof Long l) {
                span.setAttribute(key, l);
            } else if (value instanceof Integer i) {
                span.setAttribute(key, i.longValue());
            } else if (value instanceof Boolean b) {
                span.setAttribute(key, b);
            } else if (value != null) {
                span.setAttribute(key, value.toString());
            }
        });
    }
}
