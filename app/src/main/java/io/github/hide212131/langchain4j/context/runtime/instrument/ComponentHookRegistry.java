package io.github.hide212131.langchain4j.context.runtime.instrument;

import io.github.hide212131.langchain4j.context.runtime.component.Component;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Holds middleware registrations. The compiler resolves the chain for each instance once, when the
 * instance is created; registrations added later apply to instances created later.
 */
public final class ComponentHookRegistry {

    private final List<Registration> registrations = new ArrayList<>();

    public ComponentHookRegistry register(ComponentSelector selector, LifecycleMethod method,
            ComponentHookMiddleware middleware) {
        registrations.add(new Registration(selector, Objects.requireNonNull(method, "method"), middleware));
        return this;
    }

    /** Applies the middleware to every lifecycle method of the selected components. */
    public ComponentHookRegistry registerAll(ComponentSelector selector, ComponentHookMiddleware middleware) {
        registrations.add(new Registration(selector, null, middleware));
        return this;
    }

    /** Outermost middleware first. */
    public List<ComponentHookMiddleware> resolve(LifecycleMethod method, Component component) {
        return registrations.stream()
                .filter(registration -> registration.method() == null || registration.method() == method)
                .filter(registration -> registration.selector().matches(component))
                .sorted(Comparator.comparingInt(registration -> registration.selector().priority()))
                .map(Registration::middleware)
                .toList();
    }

    public boolean isEmpty() {
        return registrations.isEmpty();
    }

    private record Registration(ComponentSelector selector, LifecycleMethod method,
            ComponentHookMiddleware middleware) {
        Registration {
            Objects.requireNonNull(selector, "selector");
            Objects.requireNonNull(middleware, "middleware");
        }
    }
}
