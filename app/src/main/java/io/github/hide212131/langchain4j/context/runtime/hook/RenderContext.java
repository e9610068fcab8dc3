package io.github.hide212131.langchain4j.context.runtime.hook;

import io.github.hide212131.langchain4j.context.runtime.com.ContextObjectModel;
import io.github.hide212131.langchain4j.context.runtime.component.TickState;
import java.util.Objects;

/**
 * The function fiber currently rendering on this thread. Hooks resolve their slot through it.
 */
public record RenderContext(int fiberId, String componentName, HookList hooks, ContextObjectModel com,
        TickState tickState, UpdateScheduler scheduler) {

    private static final ThreadLocal<RenderContext> CURRENT = new ThreadLocal<>();

    public RenderContext {
        Objects.requireNonNull(componentName, "componentName");
        Objects.requireNonNull(hooks, "hooks");
        Objects.requireNonNull(com, "com");
        Objects.requireNonNull(tickState, "tickState");
        Objects.requireNonNull(scheduler, "scheduler");
    }

    /** Installs {@code context} and returns the one it replaces, to be passed to {@link #restore}. */
    public static RenderContext enter(RenderContext context) {
        RenderContext previous = CURRENT.get();
        CURRENT.set(Objects.requireNonNull(context, "context"));
        return previous;
    }

    public static void restore(RenderContext previous) {
        if (previous == null) {
            CURRENT.remove();
        } else {
            CURRENT.set(previous);
        }
    }

    static RenderContext current() {
        RenderContext context = CURRENT.get();
        if (context == null) {
            throw new HookOrderViolationException("Hooks can only be called inside the render of a function component");
        }
        return context;
    }
}
