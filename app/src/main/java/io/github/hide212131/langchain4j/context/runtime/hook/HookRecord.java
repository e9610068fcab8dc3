package io.github.hide212131.langchain4j.context.runtime.hook;

import io.github.hide212131.langchain4j.context.runtime.signal.ReadableSignal;
import io.github.hide212131.langchain4j.context.runtime.signal.Signal;
import io.github.hide212131.langchain4j.context.runtime.signal.Subscription;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One positional slot in a function component's hook list.
 */
public abstract sealed class HookRecord
        permits HookRecord.ValueRecord, HookRecord.EffectRecord, HookRecord.MemoRecord, HookRecord.LifecycleRecord {

    private final HookKind kind;

    HookRecord(HookKind kind) {
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public HookKind kind() {
        return kind;
    }

    /** Releases whatever the slot owns. Called once on unmount. */
    void dispose() {
    }

    /** Holds a value that persists across renders: a signal, a reducer handle or a ref. */
    public static final class ValueRecord extends HookRecord {
        private final Object value;
        private final List<Subscription> subscriptions = new ArrayList<>();

        ValueRecord(HookKind kind, Object value) {
            super(kind);
            this.value = value;
        }

        public Object value() {
            return value;
        }

        void own(Subscription subscription) {
            subscriptions.add(subscription);
        }

        @Override
        void dispose() {
            subscriptions.forEach(Subscription::close);
            subscriptions.clear();
            if (value instanceof Signal<?> signal) {
                signal.dispose();
            }
        }
    }

    /** useEffect の状態。deps が null のときは毎回実行する。 */
    public static final class EffectRecord extends HookRecord {
        private Callbacks.EffectCallback create;
        private List<Object> deps;
        private Runnable cleanup;
        private boolean pending = true;

        EffectRecord(Callbacks.EffectCallback create, List<Object> deps) {
            super(HookKind.EFFECT);
            this.create = create;
            this.deps = deps;
        }

        void update(Callbacks.EffectCallback newCreate, List<Object> newDeps) {
            if (newDeps == null || deps == null || !newDeps.equals(deps)) {
                pending = true;
            }
            create = newCreate;
            deps = newDeps;
        }

        public boolean isPending() {
            return pending;
        }

        void run() {
            if (cleanup != null) {
                cleanup.run();
                cleanup = null;
            }
            pending = false;
            cleanup = create.run();
        }

        @Override
        void dispose() {
            if (cleanup != null) {
                Runnable pendingCleanup = cleanup;
                cleanup = null;
                pendingCleanup.run();
            }
        }
    }

    /** useMemo の値と依存配列。 */
    public static final class MemoRecord extends HookRecord {
        private Object value;
        private List<Object> deps;

        MemoRecord(Object value, List<Object> deps) {
            super(HookKind.MEMO);
            this.value = value;
            this.deps = deps;
        }

        boolean isStale(List<Object> newDeps) {
            return newDeps == null || deps == null || !newDeps.equals(deps);
        }

        void recompute(Object newValue, List<Object> newDeps) {
            value = newValue;
            deps = newDeps;
        }

        public Object value() {
            return value;
        }
    }

    /** Lifecycle callback registration. The latest callback from the most recent render wins. */
    public static final class LifecycleRecord extends HookRecord {
        private Object callback;

        LifecycleRecord(HookKind kind, Object callback) {
            super(kind);
            this.callback = Objects.requireNonNull(callback, "callback");
        }

        void replace(Object newCallback) {
            callback = Objects.requireNonNull(newCallback, "callback");
        }

        public Object callback() {
            return callback;
        }
    }

    /** Dependency values are compared by content; signals compare by their current value. */
    static List<Object> snapshotDeps(List<?> deps) {
        if (deps == null) {
            return null;
        }
        List<Object> snapshot = new ArrayList<>(deps.size());
        for (Object dep : deps) {
            snapshot.add(dep instanceof ReadableSignal<?> signal ? signal.get() : dep);
        }
        return snapshot;
    }
}
