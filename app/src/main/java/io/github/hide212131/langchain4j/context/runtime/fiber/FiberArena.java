package io.github.hide212131.langchain4j.context.runtime.fiber;

import io.github.hide212131.langchain4j.context.runtime.element.ElementType;
import io.github.hide212131.langchain4j.context.runtime.element.Props;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns every live fiber and hands out integer ids. Ids are never reused, so a handle to a released fiber
 * fails with {@link StaleFiberException} instead of resolving to an unrelated node.
 */
public final class FiberArena {

    public static final int NO_FIBER = -1;

    private final Map<Integer, Fiber> live = new HashMap<>();
    private int nextId;

    public Fiber allocate(ElementType type, Props props, String key) {
        Fiber fiber = new Fiber(nextId++, type, props, key);
        live.put(fiber.id(), fiber);
        return fiber;
    }

    public Fiber get(int id) {
        Fiber fiber = live.get(id);
        if (fiber == null) {
            throw new StaleFiberException(id);
        }
        return fiber;
    }

    public boolean isLive(int id) {
        return live.containsKey(id);
    }

    public void release(int id) {
        if (live.remove(id) == null) {
            throw new StaleFiberException(id);
        }
    }

    public List<Fiber> children(Fiber fiber) {
        List<Fiber> result = new ArrayList<>(fiber.children().size());
        for (int childId : fiber.children()) {
            result.add(get(childId));
        }
        return result;
    }

    public int size() {
        return live.size();
    }
}
