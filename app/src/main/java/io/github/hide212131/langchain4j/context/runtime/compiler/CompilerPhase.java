package io.github.hide212131.langchain4j.context.runtime.compiler;

/** What the compiler is doing right now. Decides whether a state update asks for a recompile. */
public enum CompilerPhase {
    IDLE,
    TICK_START,
    RENDER,
    COMMIT,
    AFTER_COMPILE,
    TICK_END,
    UNMOUNT
}
