package io.github.hide212131.langchain4j.context.runtime.hook;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Positional hook storage of one function fiber.
 *
 * <p>The first render appends a record per hook call. Every later render must call the same kinds in the
 * same order and the same number of times; any deviation raises {@link HookOrderViolationException}.
 */
public final class HookList {

    private final List<HookRecord> records = new ArrayList<>();
    private String componentName = "anonymous";
    private int cursor;
    private boolean rendering;
    private boolean initialized;
    private boolean mounted;

    public void beginRender(String name) {
        this.componentName = name;
        this.cursor = 0;
        this.rendering = true;
    }

    <R extends HookRecord> R next(HookKind kind, Class<R> type, Supplier<R> factory) {
        if (!rendering) {
            throw new HookOrderViolationException(
                    "Hooks can only be called while %s is rendering".formatted(componentName));
        }
        if (!initialized) {
            R created = factory.get();
            records.add(created);
            cursor++;
            return created;
        }
        if (cursor >= records.size()) {
            throw new HookOrderViolationException(
                    "Rendered more hooks than during the previous render in %s".formatted(componentName));
        }
        HookRecord existing = records.get(cursor);
        if (existing.kind() != kind) {
            throw new HookOrderViolationException(
                    "Hook order changed in %s: position %d was %s and is now %s"
                            .formatted(componentName, cursor, existing.kind(), kind));
        }
        cursor++;
        return type.cast(existing);
    }

    public void finishRender() {
        rendering = false;
        if (initialized && cursor < records.size()) {
            throw new HookOrderViolationException(
                    "Rendered fewer hooks than during the previous render in %s".formatted(componentName));
        }
        initialized = true;
    }

    /** Ends a render that threw. A failed first render leaves no records behind. */
    public void abortRender() {
        rendering = false;
        if (!initialized) {
            records.forEach(HookRecord::dispose);
            records.clear();
        }
    }

    public boolean hasPendingEffects() {
        return records.stream()
                .anyMatch(record -> record instanceof HookRecord.EffectRecord effect && effect.isPending());
    }

    /** コミット時に依存が変化した effect を宣言順に実行する。 */
    public void runPendingEffects() {
        for (HookRecord record : List.copyOf(records)) {
            if (record instanceof HookRecord.EffectRecord effect && effect.isPending()) {
                effect.run();
            }
        }
    }

    public <C> List<C> callbacks(HookKind kind, Class<C> type) {
        List<C> callbacks = new ArrayList<>();
        for (HookRecord record : records) {
            if (record.kind() == kind && record instanceof HookRecord.LifecycleRecord lifecycle
                    && type.isInstance(lifecycle.callback())) {
                callbacks.add(type.cast(lifecycle.callback()));
            }
        }
        return callbacks;
    }

    /** Returns {@code true} exactly once, after the first successful render. */
    public boolean markMounted() {
        if (mounted || !initialized) {
            return false;
        }
        mounted = true;
        return true;
    }

    public void dispose() {
        for (HookRecord record : records) {
            record.dispose();
        }
    }

    public int size() {
        return records.size();
    }

    public String componentName() {
        return componentName;
    }
}
