package io.github.hide212131.langchain4j.context.runtime.instrument;

/** Component methods that middleware can wrap. */
public enum LifecycleMethod {
    ON_MOUNT("onMount"),
    ON_UNMOUNT("onUnmount"),
    ON_START("onStart"),
    ON_TICK_START("onTickStart"),
    RENDER("render"),
    ON_AFTER_COMPILE("onAfterCompile"),
    ON_TICK_END("onTickEnd"),
    ON_MESSAGE("onMessage"),
    ON_COMPLETE("onComplete"),
    ON_ERROR("onError");

    private final String methodName;

    LifecycleMethod(String methodName) {
        this.methodName = methodName;
    }

    public String methodName() {
        return methodName;
    }
}
