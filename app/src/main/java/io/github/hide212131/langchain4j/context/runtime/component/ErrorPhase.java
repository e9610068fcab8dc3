package io.github.hide212131.langchain4j.context.runtime.component;

/** Where an engine error happened. */
public enum ErrorPhase {
    TICK_START,
    RENDER,
    MODEL_EXECUTION,
    TOOL_EXECUTION,
    TICK_END,
    COMPLETE,
    UNKNOWN
}
