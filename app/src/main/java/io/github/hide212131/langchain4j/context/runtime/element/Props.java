package io.github.hide212131.langchain4j.context.runtime.element;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, insertion-ordered property map attached to an {@link Element}.
 *
 * <p>Null values are dropped on construction, so {@link #has(String)} and a non-null {@link #get(String)}
 * always agree. Three keys carry meaning for the compiler: {@code children}, {@code key} and {@code ref}.
 */
public final class Props {

    public static final String CHILDREN = "children";
    public static final String KEY = "key";
    public static final String REF = "ref";

    private static final Props EMPTY = new Props(Map.of());

    private final Map<String, Object> values;

    private Props(Map<String, Object> values) {
        this.values = values;
    }

    public static Props empty() {
        return EMPTY;
    }

    /** キーと値を交互に並べて生成する。 */
    public static Props of(Object... keyValues) {
        Objects.requireNonNull(keyValues, "keyValues");
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must contain key/value pairs");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            if (!(keyValues[i] instanceof String key)) {
                throw new IllegalArgumentException("prop key must be a string: " + keyValues[i]);
            }
            if (keyValues[i + 1] != null) {
                map.put(key, keyValues[i + 1]);
            }
        }
        return wrap(map);
    }

    public static Props from(Map<String, ?> source) {
        if (source == null || source.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> map = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                map.put(key, value);
            }
        });
        return wrap(map);
    }

    private static Props wrap(Map<String, Object> map) {
        return map.isEmpty() ? EMPTY : new Props(Collections.unmodifiableMap(map));
    }

    public Object get(String key) {
        return values.get(key);
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public String getString(String key) {
        Object value = values.get(key);
        return value == null ? null : value.toString();
    }

    public String getString(String key, String defaultValue) {
        String value = getString(key);
        return value == null ? defaultValue : value;
    }

    public <T> Optional<T> find(String key, Class<T> type) {
        Object value = values.get(key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    public int getInt(String key, int defaultValue) {
        Object value = values.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String str && !str.isBlank()) {
            try {
                return Integer.parseInt(str.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = values.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String str) {
            return Boolean.parseBoolean(str.trim());
        }
        return defaultValue;
    }

    public List<String> getStringList(String key) {
        Object value = values.get(key);
        if (value instanceof Collection<?> collection) {
            List<String> result = new ArrayList<>();
            for (Object item : collection) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
            return List.copyOf(result);
        }
        if (value instanceof String str) {
            return List.of(str);
        }
        return List.of();
    }

    /**
     * Returns the flattened raw children: nested lists are expanded, {@code null} and booleans
     * (conditional rendering leftovers) are skipped.
     */
    public List<Object> children() {
        Object raw = values.get(CHILDREN);
        if (raw == null) {
            return List.of();
        }
        List<Object> flat = new ArrayList<>();
        flatten(raw, flat);
        return Collections.unmodifiableList(flat);
    }

    public boolean hasChildren() {
        return !children().isEmpty();
    }

    public String key() {
        return getString(KEY);
    }

    public String ref() {
        return getString(REF);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    /** 自身に {@code overrides} を浅くマージした新しい Props を返す。 */
    public Props merge(Props overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return overrides;
        }
        Map<String, Object> merged = new LinkedHashMap<>(values);
        merged.putAll(overrides.values);
        return wrap(merged);
    }

    public Props with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        if (value == null) {
            copy.remove(key);
        } else {
            copy.put(key, value);
        }
        return wrap(copy);
    }

    public Props without(String key) {
        if (!values.containsKey(key)) {
            return this;
        }
        return with(key, null);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    private static void flatten(Object value, List<Object> sink) {
        if (value == null || value instanceof Boolean) {
            return;
        }
        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                flatten(item, sink);
            }
            return;
        }
        if (value instanceof Object[] array) {
            for (Object item : array) {
                flatten(item, sink);
            }
            return;
        }
        sink.add(value);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof Props props && values.equals(props.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Props" + values;
    }
}
