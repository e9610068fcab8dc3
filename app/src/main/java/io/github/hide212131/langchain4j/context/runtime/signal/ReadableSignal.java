package io.github.hide212131.langchain4j.context.runtime.signal;

import java.util.function.Consumer;

/** 読み取り専用のリアクティブ値。 */
public interface ReadableSignal<T> {

    T get();

    Subscription subscribe(Consumer<? super T> listener);
}
