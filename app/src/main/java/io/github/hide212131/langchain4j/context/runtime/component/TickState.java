package io.github.hide212131.langchain4j.context.runtime.component;

import io.github.hide212131.langchain4j.context.runtime.structure.CompiledStructure;
import io.github.hide212131.langchain4j.context.runtime.structure.CompiledTimelineEntry;
import java.util.List;
import java.util.function.Consumer;

/**
 * Per-tick context handed to lifecycle methods and render.
 *
 * @param tick           1-based tick number
 * @param previous       structure compiled on the previous tick, {@code null} on the first one
 * @param current        timeline entries produced by the model so far in this tick
 * @param queuedMessages messages delivered to the execution since the previous tick
 * @param error          set only while error handlers run
 * @param stopHandler    receives the reason when a component asks to stop the execution
 */
public record TickState(int tick, CompiledStructure previous, List<CompiledTimelineEntry> current,
        List<ExecutionMessage> queuedMessages, EngineError error, Consumer<String> stopHandler) {

    public TickState {
        if (tick < 1) {
            throw new IllegalArgumentException("tick must be >= 1: " + tick);
        }
        current = current == null ? List.of() : List.copyOf(current);
        queuedMessages = queuedMessages == null ? List.of() : List.copyOf(queuedMessages);
        stopHandler = stopHandler == null ? reason -> { } : stopHandler;
    }

    public static TickState initial() {
        return of(1);
    }

    public static TickState of(int tick) {
        return new TickState(tick, null, List.of(), List.of(), null, null);
    }

    public void stop(String reason) {
        stopHandler.accept(reason);
    }

    public TickState withError(EngineError newError) {
        return new TickState(tick, previous, current, queuedMessages, newError, stopHandler);
    }

    public TickState withQueuedMessages(List<ExecutionMessage> messages) {
        return new TickState(tick, previous, current, messages, error, stopHandler);
    }

    public TickState next(CompiledStructure compiled) {
        return new TickState(tick + 1, compiled, List.of(), List.of(), null, stopHandler);
    }
}
