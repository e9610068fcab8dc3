package io.github.hide212131.langchain4j.context.runtime.hook;

import io.github.hide212131.langchain4j.context.runtime.com.ContextObjectModel;
import io.github.hide212131.langchain4j.context.runtime.component.AfterCompileContext;
import io.github.hide212131.langchain4j.context.runtime.component.ExecutionMessage;
import io.github.hide212131.langchain4j.context.runtime.component.TickState;
import io.github.hide212131.langchain4j.context.runtime.structure.CompiledStructure;

/**
 * Callback shapes accepted by the lifecycle hooks.
 */
public final class Callbacks {

    private Callbacks() {
    }

    @FunctionalInterface
    public interface ComCallback {
        void call(ContextObjectModel com);
    }

    @FunctionalInterface
    public interface TickCallback {
        void call(ContextObjectModel com, TickState state);
    }

    @FunctionalInterface
    public interface AfterCompileCallback {
        void call(ContextObjectModel com, CompiledStructure compiled, TickState state, AfterCompileContext context);
    }

    @FunctionalInterface
    public interface MessageCallback {
        void call(ContextObjectModel com, ExecutionMessage message, TickState state);
    }

    /** Runs after commit; the returned runnable, if any, cleans up before the next run or on unmount. */
    @FunctionalInterface
    public interface EffectCallback {
        Runnable run();
    }
}
