package io.github.hide212131.langchain4j.context.runtime.signal;

import io.github.hide212131.langchain4j.context.runtime.element.Props;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-instance table of signals bound to props and of signals the instance owns.
 *
 * <p>Bound signals receive the prop value on mount and every later reconcile that carries the key. A
 * reconcile without the key leaves the signal untouched. Everything registered here is disposed on unmount.
 */
public final class PropBindings {

    private static final Logger LOGGER = LoggerFactory.getLogger(PropBindings.class);

    private final Map<String, Binding<?>> bindings = new LinkedHashMap<>();
    private final List<Signal<?>> owned = new ArrayList<>();

    public <T> Signal<T> bind(String propKey, Class<T> type, T defaultValue) {
        if (bindings.containsKey(propKey)) {
            throw new IllegalStateException("prop '" + propKey + "' is already bound");
        }
        Binding<T> binding = new Binding<>(type, new Signal<>(defaultValue));
        bindings.put(propKey, binding);
        return binding.signal();
    }

    public <T> Signal<T> own(Signal<T> signal) {
        owned.add(signal);
        return signal;
    }

    public void applyInitial(Props props) {
        bindings.forEach((key, binding) -> binding.accept(key, props.get(key)));
    }

    public void applyUpdate(Props props) {
        bindings.forEach((key, binding) -> {
            if (props.has(key)) {
                binding.accept(key, props.get(key));
            }
        });
    }

    public Set<String> boundKeys() {
        return Collections.unmodifiableSet(bindings.keySet());
    }

    public boolean isEmpty() {
        return bindings.isEmpty() && owned.isEmpty();
    }

    public void dispose() {
        bindings.values().forEach(binding -> binding.signal().dispose());
        owned.forEach(Signal::dispose);
    }

    private record Binding<T>(Class<T> type, Signal<T> signal) {

        void accept(String key, Object value) {
            if (value == null) {
                return;
            }
            if (!type.isInstance(value)) {
                LOGGER.warn("prop '{}' holds {} and cannot feed a {} signal", key,
                        value.getClass().getSimpleName(), type.getSimpleName());
                return;
            }
            signal.set(type.cast(value));
        }
    }
}
