package io.github.hide212131.langchain4j.context.runtime.hook;

import io.github.hide212131.langchain4j.context.runtime.com.ContextObjectModel;
import io.github.hide212131.langchain4j.context.runtime.component.TickState;
import io.github.hide212131.langchain4j.context.runtime.signal.ReadableSignal;
import io.github.hide212131.langchain4j.context.runtime.signal.Signal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * Hook API for function components. Every {@code use*} call occupies the next positional slot of the
 * rendering fiber, so calls must not be conditional.
 *
 * <p>State changes made through these hooks ask the compiler for another pass, except while the
 * component itself is rendering or while tick-start callbacks run.
 */
public final class Hooks {

    private Hooks() {
    }

    public static <T> Signal<T> useState(T initialValue) {
        RenderContext context = RenderContext.current();
        HookRecord.ValueRecord record = context.hooks().next(HookKind.STATE, HookRecord.ValueRecord.class, () -> {
            Signal<T> signal = new Signal<>(initialValue);
            HookRecord.ValueRecord created = new HookRecord.ValueRecord(HookKind.STATE, signal);
            created.own(signal.subscribe(value -> schedule(context)));
            return created;
        });
        return cast(record.value());
    }

    public static <S, A> Reducer<S, A> useReducer(BiFunction<S, A, S> reducer, S initialState) {
        Objects.requireNonNull(reducer, "reducer");
        RenderContext context = RenderContext.current();
        HookRecord.ValueRecord record = context.hooks().next(HookKind.REDUCER, HookRecord.ValueRecord.class, () -> {
            Signal<S> signal = new Signal<>(initialState);
            HookRecord.ValueRecord created =
                    new HookRecord.ValueRecord(HookKind.REDUCER, new Reducer<>(signal, reducer));
            created.own(signal.subscribe(value -> schedule(context)));
            return created;
        });
        Reducer<S, A> handle = cast(record.value());
        handle.replaceReducer(reducer);
        return handle;
    }

    /**
     * Signal mirrored to {@code com.getState(key)} in both directions. The COM value wins over
     * {@code initialValue} when it already exists.
     */
    public static <T> Signal<T> useComState(String key, T initialValue) {
        Objects.requireNonNull(key, "key");
        RenderContext context = RenderContext.current();
        ContextObjectModel com = context.com();
        HookRecord.ValueRecord record = context.hooks().next(HookKind.COM_STATE, HookRecord.ValueRecord.class, () -> {
            if (!com.hasState(key)) {
                com.setState(key, initialValue);
            }
            T current = cast(com.getState(key));
            Signal<T> signal = new Signal<>(current);
            HookRecord.ValueRecord created = new HookRecord.ValueRecord(HookKind.COM_STATE, signal);
            created.own(signal.subscribe(value -> {
                com.setState(key, value);
                schedule(context);
            }));
            created.own(com.onStateChange((changedKey, newValue, oldValue) -> {
                if (key.equals(changedKey)) {
                    signal.set(cast(newValue));
                }
            }));
            return created;
        });
        return cast(record.value());
    }

    /** Read-only view of a COM state key. */
    public static <T> ReadableSignal<T> useWatch(String key, T defaultValue) {
        Objects.requireNonNull(key, "key");
        RenderContext context = RenderContext.current();
        ContextObjectModel com = context.com();
        HookRecord.ValueRecord record = context.hooks().next(HookKind.WATCH, HookRecord.ValueRecord.class, () -> {
            T current = com.hasState(key) ? cast(com.getState(key)) : defaultValue;
            Signal<T> signal = new Signal<>(current);
            HookRecord.ValueRecord created = new HookRecord.ValueRecord(HookKind.WATCH, signal);
            created.own(com.onStateChange((changedKey, newValue, oldValue) -> {
                if (key.equals(changedKey)) {
                    signal.set(cast(newValue));
                }
            }));
            return created;
        });
        return cast(record.value());
    }

    /** Runs {@code effect} after every commit. */
    public static void useEffect(Callbacks.EffectCallback effect) {
        registerEffect(effect, null);
    }

    /** Runs {@code effect} after the first commit and whenever {@code deps} change. */
    public static void useEffect(Callbacks.EffectCallback effect, List<?> deps) {
        registerEffect(effect, Objects.requireNonNull(deps, "deps"));
    }

    public static <T> T useMemo(Supplier<T> factory, List<?> deps) {
        Objects.requireNonNull(factory, "factory");
        RenderContext context = RenderContext.current();
        List<Object> snapshot = HookRecord.snapshotDeps(deps);
        boolean[] created = {false};
        HookRecord.MemoRecord record = context.hooks().next(HookKind.MEMO, HookRecord.MemoRecord.class, () -> {
            created[0] = true;
            return new HookRecord.MemoRecord(factory.get(), snapshot);
        });
        if (!created[0] && record.isStale(snapshot)) {
            record.recompute(factory.get(), snapshot);
        }
        return cast(record.value());
    }

    public static <T> RefObject<T> useRef(T initialValue) {
        RenderContext context = RenderContext.current();
        HookRecord.ValueRecord record = context.hooks().next(HookKind.REF, HookRecord.ValueRecord.class,
                () -> new HookRecord.ValueRecord(HookKind.REF, new RefObject<>(initialValue)));
        return cast(record.value());
    }

    public static void useOnMount(Callbacks.ComCallback callback) {
        registerLifecycle(HookKind.MOUNT, callback);
    }

    public static void useOnUnmount(Callbacks.ComCallback callback) {
        registerLifecycle(HookKind.UNMOUNT, callback);
    }

    public static void useTickStart(Callbacks.TickCallback callback) {
        registerLifecycle(HookKind.TICK_START, callback);
    }

    public static void useTickEnd(Callbacks.TickCallback callback) {
        registerLifecycle(HookKind.TICK_END, callback);
    }

    public static void useAfterCompile(Callbacks.AfterCompileCallback callback) {
        registerLifecycle(HookKind.AFTER_COMPILE, callback);
    }

    public static void useOnMessage(Callbacks.MessageCallback callback) {
        registerLifecycle(HookKind.MESSAGE, callback);
    }

    /** COM に登録された ref を取得する。フックスロットは消費しない。 */
    public static <T> Optional<T> useComRef(String name, Class<T> type) {
        return RenderContext.current().com().getRef(name, type);
    }

    public static ContextObjectModel useCom() {
        return RenderContext.current().com();
    }

    public static TickState useTickState() {
        return RenderContext.current().tickState();
    }

    private static void registerEffect(Callbacks.EffectCallback effect, List<?> deps) {
        Objects.requireNonNull(effect, "effect");
        RenderContext context = RenderContext.current();
        List<Object> snapshot = HookRecord.snapshotDeps(deps);
        boolean[] created = {false};
        HookRecord.EffectRecord record = context.hooks().next(HookKind.EFFECT, HookRecord.EffectRecord.class, () -> {
            created[0] = true;
            return new HookRecord.EffectRecord(effect, snapshot);
        });
        if (!created[0]) {
            record.update(effect, snapshot);
        }
    }

    private static void registerLifecycle(HookKind kind, Object callback) {
        Objects.requireNonNull(callback, "callback");
        RenderContext context = RenderContext.current();
        boolean[] created = {false};
        HookRecord.LifecycleRecord record = context.hooks().next(kind, HookRecord.LifecycleRecord.class, () -> {
            created[0] = true;
            return new HookRecord.LifecycleRecord(kind, callback);
        });
        if (!created[0]) {
            record.replace(callback);
        }
    }

    private static void schedule(RenderContext context) {
        context.scheduler().scheduleUpdate(context.componentName());
    }

    @SuppressWarnings("unchecked")
    private static <T> T cast(Object value) {
        return (T) value;
    }
}
