package io.github.hide212131.langchain4j.context.runtime.hook;

import io.github.hide212131.langchain4j.context.runtime.signal.Signal;
import java.util.function.BiFunction;

/** useReducer が返すハンドル。 */
public final class Reducer<S, A> {

    private final Signal<S> state;
    private volatile BiFunction<S, A, S> reducer;

    Reducer(Signal<S> state, BiFunction<S, A, S> reducer) {
        this.state = state;
        this.reducer = reducer;
    }

    public S state() {
        return state.get();
    }

    public void dispatch(A action) {
        state.set(reducer.apply(state.get(), action));
    }

    void replaceReducer(BiFunction<S, A, S> newReducer) {
        this.reducer = newReducer;
    }

    Signal<S> signal() {
        return state;
    }
}
