package io.github.hide212131.langchain4j.context.runtime.signal;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Mutable reactive value. Listeners are notified synchronously, and only when the value actually changes.
 * A disposed signal still holds its last value but no longer notifies anyone. Not thread-safe: signals
 * belong to the single thread that drives a compilation.
 */
public class Signal<T> implements ReadableSignal<T> {

    private final List<Consumer<? super T>> listeners = new ArrayList<>();
    private T value;
    private boolean disposed;

    public Signal(T initialValue) {
        this.value = initialValue;
    }

    @Override
    public T get() {
        return value;
    }

    public void set(T newValue) {
        if (Objects.equals(value, newValue)) {
            return;
        }
        value = newValue;
        if (disposed) {
            return;
        }
        for (Consumer<? super T> listener : List.copyOf(listeners)) {
            listener.accept(newValue);
        }
    }

    public void update(UnaryOperator<T> updater) {
        set(updater.apply(value));
    }

    @Override
    public Subscription subscribe(Consumer<? super T> listener) {
        Objects.requireNonNull(listener, "listener");
        if (disposed) {
            return Subscription.NONE;
        }
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void dispose() {
        disposed = true;
        listeners.clear();
    }

    public boolean isDisposed() {
        return disposed;
    }

    @Override
    public String toString() {
        return "Signal[" + value + "]";
    }
}
