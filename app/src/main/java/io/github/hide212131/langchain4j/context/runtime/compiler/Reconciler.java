package io.github.hide212131.langchain4j.context.runtime.compiler;

import io.github.hide212131.langchain4j.context.infra.logging.CompilerLogger;
import io.github.hide212131.langchain4j.context.runtime.com.ContextObjectModel;
import io.github.hide212131.langchain4j.context.runtime.com.ExecutableTool;
import io.github.hide212131.langchain4j.context.runtime.component.Component;
import io.github.hide212131.langchain4j.context.runtime.component.FunctionComponent;
import io.github.hide212131.langchain4j.context.runtime.component.TerminalComponent;
import io.github.hide212131.langchain4j.context.runtime.component.TickState;
import io.github.hide212131.langchain4j.context.runtime.element.Element;
import io.github.hide212131.langchain4j.context.runtime.element.ElementType;
import io.github.hide212131.langchain4j.context.runtime.element.Props;
import io.github.hide212131.langchain4j.context.runtime.fiber.Fiber;
import io.github.hide212131.langchain4j.context.runtime.fiber.FiberArena;
import io.github.hide212131.langchain4j.context.runtime.hook.Callbacks;
import io.github.hide212131.langchain4j.context.runtime.hook.HookKind;
import io.github.hide212131.langchain4j.context.runtime.hook.HookList;
import io.github.hide212131.langchain4j.context.runtime.hook.RenderContext;
import io.github.hide212131.langchain4j.context.runtime.instrument.LifecycleMethod;
import io.github.hide212131.langchain4j.context.runtime.signal.PropBindings;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Matches elements against existing fibers and mounts, updates or unmounts them.
 *
 * <p>Child matching: an element with a key takes the old child with the same key; otherwise it takes the
 * unkeyed old child at the same position. A matched fiber is reused only when its type equals the element
 * type; otherwise a new fiber is mounted. Old children left unmatched are unmounted once every sibling has
 * rendered, so a failing render leaves the previous children in place.
 */
final class Reconciler {

    private final FiberArena arena;
    private final ContextObjectModel com;
    private final LifecycleInvoker invoker;
    private final RecompileScheduler scheduler;
    private final CompilerLogger logger;
    private final List<Integer> renderedFunctionFibers = new ArrayList<>();

    Reconciler(FiberArena arena, ContextObjectModel com, LifecycleInvoker invoker, RecompileScheduler scheduler,
            CompilerLogger logger) {
        this.arena = arena;
        this.com = com;
        this.invoker = invoker;
        this.scheduler = scheduler;
        this.logger = logger;
    }

    /**
     * Returns the id of the fiber now representing {@code element}, or {@link FiberArena#NO_FIBER}.
     *
     * <p>If rendering fails, fibers allocated by this call are torn down again and the previous fiber and its
     * children stay as they were.
     */
    int reconcile(int oldId, Element element, TickState state) {
        if (element == null) {
            if (oldId != FiberArena.NO_FIBER) {
                unmount(oldId);
            }
            return FiberArena.NO_FIBER;
        }
        if (oldId != FiberArena.NO_FIBER && arena.get(oldId).type().equals(element.type())) {
            Fiber fiber = arena.get(oldId);
            update(fiber, element);
            link(fiber, renderChildren(fiber, fiber.children(), state));
            return fiber.id();
        }
        Fiber fiber = arena.allocate(element.type(), element.props(), element.key());
        try {
            mount(fiber, element);
            link(fiber, renderChildren(fiber, List.of(), state));
        } catch (RuntimeException e) {
            discard(fiber.id(), e);
            throw e;
        }
        if (oldId != FiberArena.NO_FIBER) {
            unmount(oldId);
        }
        return fiber.id();
    }

    private void link(Fiber fiber, List<Integer> children) {
        for (int childId : children) {
            arena.get(childId).setParent(fiber.id());
        }
        fiber.setChildren(children);
    }

    private void discard(int fiberId, RuntimeException failure) {
        if (!arena.isLive(fiberId)) {
            return;
        }
        try {
            unmount(fiberId);
        } catch (RuntimeException e) {
            failure.addSuppressed(e);
        }
    }

    /** Runs effects and mount callbacks of the function fibers rendered since the last commit. */
    void commit() {
        List<Integer> rendered = List.copyOf(renderedFunctionFibers);
        renderedFunctionFibers.clear();
        for (int fiberId : rendered) {
            if (!arena.isLive(fiberId)) {
                continue;
            }
            HookList hooks = arena.get(fiberId).hooks();
            if (hooks.markMounted()) {
                for (Callbacks.ComCallback callback : hooks.callbacks(HookKind.MOUNT, Callbacks.ComCallback.class)) {
                    callback.call(com);
                }
            }
            hooks.runPendingEffects();
        }
    }

    /**
     * Tears down a fiber: tools, signals and ref first, then the unmount callbacks, then the children.
     * Cancellation failures raised by unmount callbacks are suppressed.
     */
    void unmount(int fiberId) {
        Fiber fiber = arena.get(fiberId);
        Component instance = fiber.instance();
        unregisterTools(fiber);
        if (instance != null) {
            PropBindings bindings = instance.propBindings();
            if (bindings != null) {
                bindings.dispose();
            }
            if (fiber.ref() != null) {
                if (com.getRefs().get(fiber.ref()) == instance) {
                    com.removeRef(fiber.ref());
                }
                fiber.setRef(null);
            }
            suppressCancellation(fiber, () -> invoker.run(fiber, LifecycleMethod.ON_UNMOUNT,
                    () -> instance.onUnmount(com), com));
        }
        HookList hooks = fiber.hooks();
        if (hooks != null) {
            List<Callbacks.ComCallback> callbacks = hooks.callbacks(HookKind.UNMOUNT, Callbacks.ComCallback.class);
            hooks.dispose();
            for (Callbacks.ComCallback callback : callbacks) {
                suppressCancellation(fiber, () -> callback.call(com));
            }
        }
        for (int childId : fiber.children()) {
            if (arena.isLive(childId)) {
                unmount(childId);
            }
        }
        invoker.forget(fiberId);
        arena.release(fiberId);
        logger.debug("unmounted {}", fiber);
    }

    private void mount(Fiber fiber, Element element) {
        ElementType type = fiber.type();
        Component instance = null;
        if (type instanceof ElementType.ClassType classType) {
            instance = classType.componentType().create(element.props());
        } else if (type instanceof ElementType.PrebuiltInstance prebuilt) {
            instance = prebuilt.instance();
        } else if (type instanceof ElementType.FunctionType) {
            fiber.setHooks(new HookList());
        }
        if (instance == null) {
            return;
        }
        Component mounted = instance;
        fiber.setInstance(mounted);
        invoker.wrap(fiber);
        registerStaticTool(fiber);
        mounted.updateProps(mounted.props().merge(element.props()));
        PropBindings bindings = mounted.propBindings();
        if (bindings != null) {
            bindings.applyInitial(element.props());
        }
        publishRef(fiber);
        logger.debug("mounted {} as {}", mounted.name(), fiber);
        invoker.run(fiber, LifecycleMethod.ON_MOUNT, () -> mounted.onMount(com), com);
    }

    private void update(Fiber fiber, Element element) {
        Props props = element.props();
        Component instance = fiber.instance();
        if (instance != null) {
            PropBindings bindings = instance.propBindings();
            if (bindings != null) {
                bindings.applyUpdate(props);
            }
            if (!props.isEmpty()) {
                instance.updateProps(instance.props().merge(props));
            }
        }
        fiber.setProps(props);
        fiber.setKey(element.key());
        publishRef(fiber);
    }

    private List<Integer> renderChildren(Fiber fiber, List<Integer> previousChildren, TickState state) {
        Component instance = fiber.instance();
        if (instance != null) {
            Object output = invoker.invoke(fiber, LifecycleMethod.RENDER, () -> instance.render(com, state),
                    com, state);
            return reconcileRendered(previousChildren, output instanceof Element rendered ? rendered : null, state);
        }
        if (fiber.type() instanceof ElementType.FunctionType function) {
            Element rendered = renderFunction(fiber, function.component(), state);
            if (rendered != null && (function.component() instanceof TerminalComponent
                    || rendered.type().equals(fiber.type()))) {
                return reconcileChildren(previousChildren, rendered.elementChildren(), state);
            }
            return reconcileRendered(previousChildren, rendered, state);
        }
        return reconcileChildren(previousChildren, Element.normalize(fiber.props().children()), state);
    }

    private Element renderFunction(Fiber fiber, FunctionComponent component, TickState state) {
        HookList hooks = fiber.hooks();
        String name = fiber.type().displayName();
        hooks.beginRender(name);
        RenderContext previous = RenderContext.enter(
                new RenderContext(fiber.id(), name, hooks, com, state, scheduler));
        Element rendered;
        try {
            rendered = component.render(fiber.props(), com, state);
            hooks.finishRender();
        } catch (RuntimeException e) {
            hooks.abortRender();
            throw e;
        } finally {
            RenderContext.restore(previous);
        }
        renderedFunctionFibers.add(fiber.id());
        return rendered;
    }

    private List<Integer> reconcileRendered(List<Integer> previousChildren, Element rendered, TickState state) {
        if (rendered == null) {
            return reconcileChildren(previousChildren, List.of(), state);
        }
        if (rendered.isFragment()) {
            return reconcileChildren(previousChildren, rendered.elementChildren(), state);
        }
        return reconcileChildren(previousChildren, List.of(rendered), state);
    }

    private List<Integer> reconcileChildren(List<Integer> previousChildren, List<Element> elements,
            TickState state) {
        Map<String, Integer> keyed = new HashMap<>();
        for (int oldId : previousChildren) {
            String key = arena.get(oldId).key();
            if (key != null) {
                keyed.putIfAbsent(key, oldId);
            }
        }
        Set<Integer> consumed = new HashSet<>();
        List<Integer> result = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            Element element = elements.get(i);
            int match = FiberArena.NO_FIBER;
            Integer byKey = element.key() == null ? null : keyed.get(element.key());
            if (byKey != null && !consumed.contains(byKey)) {
                match = byKey;
            } else if (i < previousChildren.size()) {
                int candidate = previousChildren.get(i);
                if (!consumed.contains(candidate) && arena.get(candidate).key() == null) {
                    match = candidate;
                }
            }
            if (match != FiberArena.NO_FIBER && !arena.get(match).type().equals(element.type())) {
                match = FiberArena.NO_FIBER;
            }
            if (match != FiberArena.NO_FIBER) {
                consumed.add(match);
            }
            int childId;
            try {
                childId = reconcile(match, element, state);
            } catch (RuntimeException e) {
                for (int created : result) {
                    if (!previousChildren.contains(created)) {
                        discard(created, e);
                    }
                }
                throw e;
            }
            if (childId != FiberArena.NO_FIBER) {
                result.add(childId);
            }
        }
        for (int oldId : previousChildren) {
            if (!consumed.contains(oldId) && arena.isLive(oldId)) {
                unmount(oldId);
            }
        }
        return result;
    }

    private void publishRef(Fiber fiber) {
        Component instance = fiber.instance();
        if (instance == null) {
            return;
        }
        String ref = fiber.props().ref();
        String current = fiber.ref();
        if (current != null && !current.equals(ref)) {
            com.removeRef(current);
            fiber.setRef(null);
        }
        if (ref != null) {
            com.setRef(ref, instance);
            fiber.setRef(ref);
        }
    }

    private void registerStaticTool(Fiber fiber) {
        ExecutableTool tool = staticTool(fiber);
        if (tool == null) {
            return;
        }
        if (tool.name() == null || tool.name().isBlank()) {
            logger.warn("static tool of {} has no name and is not registered", fiber.type().displayName());
            return;
        }
        com.addTool(tool);
    }

    private void unregisterTools(Fiber fiber) {
        removeOwnedTool(staticTool(fiber));
        if (fiber.instance() != null) {
            removeOwnedTool(fiber.instance().tool());
        }
    }

    // a replacement fiber may already have registered a tool under the same name
    private void removeOwnedTool(ExecutableTool tool) {
        if (tool == null || tool.name() == null) {
            return;
        }
        if (com.getTool(tool.name()).filter(tool::equals).isPresent()) {
            com.removeTool(tool.name());
        }
    }

    static ExecutableTool staticTool(Fiber fiber) {
        if (fiber.type() instanceof ElementType.ClassType classType) {
            return classType.componentType().staticTool();
        }
        return null;
    }

    private void suppressCancellation(Fiber fiber, Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            if (!Cancellations.isCancellation(e)) {
                throw e;
            }
            logger.debug("cancellation during unmount of {} ignored: {}", fiber, e.getMessage());
        }
    }
}
