package io.github.hide212131.langchain4j.context.runtime.compiler;

import io.github.hide212131.langchain4j.context.runtime.fiber.Fiber;
import io.github.hide212131.langchain4j.context.runtime.instrument.ComponentHookMiddleware;
import io.github.hide212131.langchain4j.context.runtime.instrument.ComponentHookRegistry;
import io.github.hide212131.langchain4j.context.runtime.instrument.ComponentInvocation;
import io.github.hide212131.langchain4j.context.runtime.instrument.LifecycleMethod;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Calls component lifecycle methods through the middleware resolved for each instance.
 * The table is keyed by fiber id, filled when the instance is created and dropped on unmount.
 */
final class LifecycleInvoker {

    private final ComponentHookRegistry registry;
    private final Map<Integer, Map<LifecycleMethod, List<ComponentHookMiddleware>>> wrapped = new HashMap<>();

    LifecycleInvoker(ComponentHookRegistry registry) {
        this.registry = registry;
    }

    void wrap(Fiber fiber) {
        if (registry.isEmpty() || fiber.instance() == null) {
            return;
        }
        Map<LifecycleMethod, List<ComponentHookMiddleware>> table = new EnumMap<>(LifecycleMethod.class);
        for (LifecycleMethod method : LifecycleMethod.values()) {
            List<ComponentHookMiddleware> chain = registry.resolve(method, fiber.instance());
            if (!chain.isEmpty()) {
                table.put(method, chain);
            }
        }
        if (!table.isEmpty()) {
            wrapped.put(fiber.id(), table);
        }
    }

    Object invoke(Fiber fiber, LifecycleMethod method, Supplier<Object> call, Object... arguments) {
        List<ComponentHookMiddleware> chain = wrapped.getOrDefault(fiber.id(), Map.of()).get(method);
        if (chain == null) {
            return call.get();
        }
        ComponentInvocation invocation =
                new ComponentInvocation(method, fiber.id(), fiber.instance(), Arrays.asList(arguments));
        return proceed(chain, 0, invocation, call);
    }

    void run(Fiber fiber, LifecycleMethod method, Runnable call, Object... arguments) {
        invoke(fiber, method, () -> {
            call.run();
            return null;
        }, arguments);
    }

    void forget(int fiberId) {
        wrapped.remove(fiberId);
    }

    boolean isWrapped(int fiberId) {
        return wrapped.containsKey(fiberId);
    }

    private Object proceed(List<ComponentHookMiddleware> chain, int index, ComponentInvocation invocation,
            Supplier<Object> call) {
        if (index >= chain.size()) {
            return call.get();
        }
        return chain.get(index).around(invocation, () -> proceed(chain, index + 1, invocation, call));
    }
}
