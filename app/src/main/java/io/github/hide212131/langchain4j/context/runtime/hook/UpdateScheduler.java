package io.github.hide212131.langchain4j.context.runtime.hook;

/** Receives state changes made through hooks. */
@FunctionalInterface
public interface UpdateScheduler {

    void scheduleUpdate(String componentName);
}
