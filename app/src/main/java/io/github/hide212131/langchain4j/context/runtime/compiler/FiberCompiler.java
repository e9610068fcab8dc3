package io.github.hide212131.langchain4j.context.runtime.compiler;

import io.github.hide212131.langchain4j.context.infra.logging.CompilerLogger;
import io.github.hide212131.langchain4j.context.runtime.com.ContextObjectModel;
import io.github.hide212131.langchain4j.context.runtime.com.ExecutableTool;
import io.github.hide212131.langchain4j.context.runtime.component.AfterCompileContext;
import io.github.hide212131.langchain4j.context.runtime.component.Component;
import io.github.hide212131.langchain4j.context.runtime.component.EngineError;
import io.github.hide212131.langchain4j.context.runtime.component.ErrorBoundary;
import io.github.hide212131.langchain4j.context.runtime.component.ErrorPhase;
import io.github.hide212131.langchain4j.context.runtime.component.ExecutionMessage;
import io.github.hide212131.langchain4j.context.runtime.component.RecoveryAction;
import io.github.hide212131.langchain4j.context.runtime.component.TickState;
import io.github.hide212131.langchain4j.context.runtime.content.ContentBlockRegistry;
import io.github.hide212131.langchain4j.context.runtime.element.Element;
import io.github.hide212131.langchain4j.context.runtime.fiber.Fiber;
import io.github.hide212131.langchain4j.context.runtime.fiber.FiberArena;
import io.github.hide212131.langchain4j.context.runtime.hook.Callbacks;
import io.github.hide212131.langchain4j.context.runtime.hook.HookKind;
import io.github.hide212131.langchain4j.context.runtime.hook.HookList;
import io.github.hide212131.langchain4j.context.runtime.instrument.ComponentHookRegistry;
import io.github.hide212131.langchain4j.context.runtime.instrument.LifecycleMethod;
import io.github.hide212131.langchain4j.context.runtime.render.MarkdownRenderer;
import io.github.hide212131.langchain4j.context.runtime.structure.CompiledStructure;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Compiles an element tree into a {@link CompiledStructure} and keeps the fiber tree alive between ticks.
 *
 * <p>One compiler instance owns one fiber tree and one {@link ContextObjectModel}. Calls must be serialized
 * by the driving engine: a tick is {@link #notifyTickStart}, {@link #compileUntilStable},
 * {@link #notifyTickEnd}; {@link #notifyStart} precedes the first tick and {@link #notifyComplete} and
 * {@link #unmount} follow the last one.
 */
public final class FiberCompiler {

    private static final CompilerLogger LOGGER = new CompilerLogger(FiberCompiler.class);

    private final ContextObjectModel com;
    private final FiberArena arena = new FiberArena();
    private final RecompileScheduler scheduler;
    private final LifecycleInvoker invoker;
    private final Reconciler reconciler;
    private final StructureCollector collector;
    private final CompileStabilizer stabilizer;
    private int rootId = FiberArena.NO_FIBER;

    public FiberCompiler(ContextObjectModel com) {
        this(com, new ComponentHookRegistry());
    }

    public FiberCompiler(ContextObjectModel com, ComponentHookRegistry hookRegistry) {
        this(com, hookRegistry, ContentBlockRegistry.defaults());
    }

    public FiberCompiler(ContextObjectModel com, ComponentHookRegistry hookRegistry,
            ContentBlockRegistry contentRegistry) {
        this.com = Objects.requireNonNull(com, "com");
        this.scheduler = new RecompileScheduler(com, LOGGER);
        this.invoker = new LifecycleInvoker(hookRegistry == null ? new ComponentHookRegistry() : hookRegistry);
        this.reconciler = new Reconciler(arena, com, invoker, scheduler, LOGGER);
        this.collector = new StructureCollector(arena, com,
                contentRegistry == null ? ContentBlockRegistry.defaults() : contentRegistry,
                new MarkdownRenderer(), LOGGER);
        this.stabilizer = new CompileStabilizer(this, com, LOGGER);
    }

    /** Reconciles {@code root} against the current tree, runs effects and collects one structure. */
    public CompiledStructure compile(Element root, TickState state) {
        TickState tick = state == null ? TickState.initial() : state;
        CompilerPhase previous = scheduler.enter(CompilerPhase.RENDER);
        try {
            rootId = reconciler.reconcile(rootId, root, tick);
            scheduler.enter(CompilerPhase.COMMIT);
            reconciler.commit();
        } finally {
            scheduler.restore(previous);
            if (rootId != FiberArena.NO_FIBER && !arena.isLive(rootId)) {
                rootId = FiberArena.NO_FIBER;
            }
        }
        return collector.collect(rootId);
    }

    public StabilizationResult compileUntilStable(Element root, TickState state, StabilizationOptions options) {
        return stabilizer.run(root, state == null ? TickState.initial() : state,
                options == null ? StabilizationOptions.defaults() : options);
    }

    /** Once per execution, after the first compile and before the first tick. */
    public void notifyStart() {
        for (Fiber fiber : fibers()) {
            Component instance = fiber.instance();
            if (instance != null) {
                invoker.run(fiber, LifecycleMethod.ON_START, () -> instance.onStart(com), com);
            }
        }
    }

    /**
     * Runs tick start callbacks, then registers every tool of the live tree again. Failures are logged and
     * do not stop the other components.
     */
    public void notifyTickStart(TickState state) {
        CompilerPhase previous = scheduler.enter(CompilerPhase.TICK_START);
        try {
            for (Fiber fiber : fibers()) {
                Component instance = fiber.instance();
                if (instance != null) {
                    try {
                        invoker.run(fiber, LifecycleMethod.ON_TICK_START, () -> instance.onTickStart(com, state),
                                com, state);
                    } catch (RuntimeException e) {
                        LOGGER.error("onTickStart failed in {}: {}", instance.name(), e.getMessage(), e);
                    }
                }
                HookList hooks = fiber.hooks();
                if (hooks != null) {
                    for (Callbacks.TickCallback callback : hooks.callbacks(HookKind.TICK_START,
                            Callbacks.TickCallback.class)) {
                        try {
                            callback.call(com, state);
                        } catch (RuntimeException e) {
                            LOGGER.error("tick start hook failed in {}: {}", hooks.componentName(), e.getMessage(), e);
                        }
                    }
                }
            }
            registerTools();
        } finally {
            scheduler.restore(previous);
        }
    }

    /**
     * Runs tick end callbacks. A failing component that is an {@link ErrorBoundary} receives the error;
     * any other failure is rethrown.
     */
    public void notifyTickEnd(TickState state) {
        CompilerPhase previous = scheduler.enter(CompilerPhase.TICK_END);
        try {
            for (Fiber fiber : fibers()) {
                Component instance = fiber.instance();
                if (instance != null) {
                    try {
                        invoker.run(fiber, LifecycleMethod.ON_TICK_END, () -> instance.onTickEnd(com, state),
                                com, state);
                    } catch (RuntimeException e) {
                        if (!(instance instanceof ErrorBoundary boundary)) {
                            throw e;
                        }
                        EngineError error = new EngineError(e, ErrorPhase.TICK_END, true,
                                Map.of("component", instance.name()));
                        TickState failed = state.withError(error);
                        Object action = invoker.invoke(fiber, LifecycleMethod.ON_ERROR,
                                () -> boundary.onError(com, failed), com, failed);
                        LOGGER.warn("onTickEnd failed in {} and was handled: {}", instance.name(), action);
                    }
                }
                HookList hooks = fiber.hooks();
                if (hooks != null) {
                    for (Callbacks.TickCallback callback : hooks.callbacks(HookKind.TICK_END,
                            Callbacks.TickCallback.class)) {
                        callback.call(com, state);
                    }
                }
            }
        } finally {
            scheduler.restore(previous);
        }
    }

    /**
     * Offers {@code state.error()} to every error boundary in the tree. Returns the first action that
     * continues the execution.
     */
    public Optional<RecoveryAction> notifyError(TickState state) {
        RecoveryAction recovery = null;
        for (Fiber fiber : fibers()) {
            if (!(fiber.instance() instanceof ErrorBoundary boundary)) {
                continue;
            }
            try {
                Object result = invoker.invoke(fiber, LifecycleMethod.ON_ERROR, () -> boundary.onError(com, state),
                        com, state);
                if (recovery == null && result instanceof RecoveryAction action && action.shouldContinue()) {
                    recovery = action;
                }
            } catch (RuntimeException e) {
                LOGGER.error("onError failed in {}: {}", boundary.name(), e.getMessage(), e);
            }
        }
        return Optional.ofNullable(recovery);
    }

    public void notifyComplete(CompiledStructure finalStructure) {
        for (Fiber fiber : fibers()) {
            Component instance = fiber.instance();
            if (instance != null) {
                invoker.run(fiber, LifecycleMethod.ON_COMPLETE, () -> instance.onComplete(com, finalStructure),
                        com, finalStructure);
            }
        }
    }

    /** Delivers a message to class components and to function components that use {@code useOnMessage}. */
    public void notifyMessage(ExecutionMessage message, TickState state) {
        for (Fiber fiber : fibers()) {
            Component instance = fiber.instance();
            if (instance != null) {
                try {
                    invoker.run(fiber, LifecycleMethod.ON_MESSAGE, () -> instance.onMessage(com, message, state),
                            com, message, state);
                } catch (RuntimeException e) {
                    LOGGER.error("onMessage failed in {}: {}", instance.name(), e.getMessage(), e);
                }
            }
            HookList hooks = fiber.hooks();
            if (hooks != null) {
                for (Callbacks.MessageCallback callback : hooks.callbacks(HookKind.MESSAGE,
                        Callbacks.MessageCallback.class)) {
                    try {
                        callback.call(com, message, state);
                    } catch (RuntimeException e) {
                        LOGGER.error("message hook failed in {}: {}", hooks.componentName(), e.getMessage(), e);
                    }
                }
            }
        }
    }

    /** Unmounts the whole tree. The next compile mounts from scratch. */
    public void unmount() {
        if (rootId == FiberArena.NO_FIBER) {
            return;
        }
        CompilerPhase previous = scheduler.enter(CompilerPhase.UNMOUNT);
        try {
            if (arena.isLive(rootId)) {
                reconciler.unmount(rootId);
            }
        } finally {
            rootId = FiberArena.NO_FIBER;
            scheduler.restore(previous);
        }
    }

    public Optional<Fiber> rootFiber() {
        return rootId == FiberArena.NO_FIBER ? Optional.empty() : Optional.of(arena.get(rootId));
    }

    /** Depth-first search from the root. */
    public Optional<Fiber> findFiberByKey(String key) {
        for (Fiber fiber : fibers()) {
            if (Objects.equals(fiber.key(), key)) {
                return Optional.of(fiber);
            }
        }
        return Optional.empty();
    }

    public ContextObjectModel com() {
        return com;
    }

    public CompilerPhase phase() {
        return scheduler.phase();
    }

    FiberArena arena() {
        return arena;
    }

    /**
     * Runs after-compile callbacks. Failures are logged. With {@code trackMutations}, returns a warning for
     * every component that changed timeline, sections or tools without asking for a recompile.
     */
    List<String> notifyAfterCompile(CompiledStructure compiled, TickState state, AfterCompileContext context,
            boolean trackMutations) {
        List<String> warnings = new ArrayList<>();
        CompilerPhase previous = scheduler.enter(CompilerPhase.AFTER_COMPILE);
        try {
            for (Fiber fiber : fibers()) {
                Component instance = fiber.instance();
                HookList hooks = fiber.hooks();
                List<Callbacks.AfterCompileCallback> callbacks = hooks == null
                        ? List.of()
                        : hooks.callbacks(HookKind.AFTER_COMPILE, Callbacks.AfterCompileCallback.class);
                if (instance == null && callbacks.isEmpty()) {
                    continue;
                }
                String name = instance != null ? instance.name() : fiber.type().displayName();
                MutationSnapshot before = trackMutations ? MutationSnapshot.of(com) : null;
                int reasonsBefore = com.getRecompileReasons().size();
                boolean requestedBefore = com.wasRecompileRequested();
                if (instance != null) {
                    try {
                        invoker.run(fiber, LifecycleMethod.ON_AFTER_COMPILE,
                                () -> instance.onAfterCompile(com, compiled, state, context),
                                com, compiled, state, context);
                    } catch (RuntimeException e) {
                        LOGGER.error("onAfterCompile failed in {}: {}", name, e.getMessage(), e);
                    }
                }
                for (Callbacks.AfterCompileCallback callback : callbacks) {
                    try {
                        callback.call(com, compiled, state, context);
                    } catch (RuntimeException e) {
                        LOGGER.error("after compile hook failed in {}: {}", name, e.getMessage(), e);
                    }
                }
                if (before == null) {
                    continue;
                }
                boolean requested = com.getRecompileReasons().size() > reasonsBefore
                        || (!requestedBefore && com.wasRecompileRequested());
                List<String> changes = before.changesTo(MutationSnapshot.of(com));
                if (!changes.isEmpty() && !requested) {
                    String warning = "%s modified the context without requesting a recompile: %s"
                            .formatted(name, String.join(", ", changes));
                    LOGGER.warn("{}", warning);
                    warnings.add(warning);
                }
            }
        } finally {
            scheduler.restore(previous);
        }
        return warnings;
    }

    private void registerTools() {
        for (Fiber fiber : fibers()) {
            ExecutableTool staticTool = Reconciler.staticTool(fiber);
            if (staticTool != null && staticTool.name() != null && !staticTool.name().isBlank()) {
                com.addTool(staticTool);
            }
            if (fiber.instance() != null) {
                ExecutableTool instanceTool = fiber.instance().tool();
                if (instanceTool != null) {
                    com.addTool(instanceTool);
                }
            }
        }
    }

    /** Pre-order list of the live tree. */
    private List<Fiber> fibers() {
        List<Fiber> result = new ArrayList<>();
        if (rootId != FiberArena.NO_FIBER && arena.isLive(rootId)) {
            collectFibers(arena.get(rootId), result);
        }
        return result;
    }

    private void collectFibers(Fiber fiber, List<Fiber> out) {
        out.add(fiber);
        for (Fiber child : arena.children(fiber)) {
            collectFibers(child, out);
        }
    }

    private record MutationSnapshot(int timelineSize, Set<String> sectionIds, int toolCount) {

        static MutationSnapshot of(ContextObjectModel com) {
            return new MutationSnapshot(com.getTimeline().size(), Set.copyOf(com.getSections().keySet()),
                    com.getTools().size());
        }

        List<String> changesTo(MutationSnapshot after) {
            List<String> changes = new ArrayList<>();
            if (timelineSize != after.timelineSize) {
                changes.add("timeline " + timelineSize + " -> " + after.timelineSize);
            }
            if (!sectionIds.equals(after.sectionIds)) {
                changes.add("sections " + sectionIds + " -> " + after.sectionIds);
            }
            if (toolCount != after.toolCount) {
                changes.add("tools " + toolCount + " -> " + after.toolCount);
            }
            return changes;
        }
    }
}
