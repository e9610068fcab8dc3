package io.github.hide212131.langchain4j.context.runtime.signal;

/** 購読の解除ハンドル。 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    Subscription NONE = () -> { };

    @Override
    void close();
}
