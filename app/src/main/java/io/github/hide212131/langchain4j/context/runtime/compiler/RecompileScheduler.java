package io.github.hide212131.langchain4j.context.runtime.compiler;

import io.github.hide212131.langchain4j.context.infra.logging.CompilerLogger;
import io.github.hide212131.langchain4j.context.runtime.com.ContextObjectModel;
import io.github.hide212131.langchain4j.context.runtime.hook.UpdateScheduler;

/**
 * Tracks the current phase and turns hook state updates into recompile requests. Updates made while
 * rendering or during tick start are already visible to the pass in progress and schedule nothing.
 */
final class RecompileScheduler implements UpdateScheduler {

    private final ContextObjectModel com;
    private final CompilerLogger logger;
    private CompilerPhase phase = CompilerPhase.IDLE;

    RecompileScheduler(ContextObjectModel com, CompilerLogger logger) {
        this.com = com;
        this.logger = logger;
    }

    CompilerPhase enter(CompilerPhase next) {
        CompilerPhase previous = phase;
        phase = next;
        return previous;
    }

    void restore(CompilerPhase previous) {
        phase = previous;
    }

    CompilerPhase phase() {
        return phase;
    }

    @Override
    public void scheduleUpdate(String componentName) {
        if (phase == CompilerPhase.RENDER || phase == CompilerPhase.TICK_START) {
            logger.debug("state update in {} during {} needs no recompile", componentName, phase);
            return;
        }
        com.requestRecompile("state update in " + componentName);
    }
}
