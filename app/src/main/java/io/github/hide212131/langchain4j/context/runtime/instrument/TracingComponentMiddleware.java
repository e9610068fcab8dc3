package io.github.hide212131.langchain4j.context.runtime.instrument;

import io.github.hide212131.langchain4j.context.infra.observability.LifecycleTracer;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/** コンポーネントのライフサイクル呼び出しごとにスパンを作成する。 */
public final class TracingComponentMiddleware implements ComponentHookMiddleware {

    private final LifecycleTracer tracer;

    public TracingComponentMiddleware(LifecycleTracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer");
    }

    @Override
    public Object around(ComponentInvocation invocation, Proceed next) {
        Map<String, Object> attributes = Map.of(
                "component.name", invocation.componentName(),
                "component.method", invocation.method().methodName(),
                "component.fiber_id", invocation.fiberId());
        return tracer.trace("component." + invocation.method().methodName(), attributes,
                (Supplier<Object>) next::proceed);
    }

    /** すべてのコンポーネントをトレースするレジストリを作る。 */
    public static ComponentHookRegistry registryFor(LifecycleTracer tracer) {
        return new ComponentHookRegistry()
                .registerAll(ComponentSelector.global(), new TracingComponentMiddleware(tracer));
    }
}
