package io.github.hide212131.langchain4j.context.runtime.com;

/** COM state の変更通知。 */
@FunctionalInterface
public interface StateListener {

    void onChange(String key, Object newValue, Object oldValue);
}
