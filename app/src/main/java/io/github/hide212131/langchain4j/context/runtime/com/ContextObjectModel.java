package io.github.hide212131.langchain4j.context.runtime.com;

import io.github.hide212131.langchain4j.context.runtime.component.ExecutionMessage;
import io.github.hide212131.langchain4j.context.runtime.signal.Subscription;
import io.github.hide212131.langchain4j.context.runtime.structure.CompiledSection;
import io.github.hide212131.langchain4j.context.runtime.structure.CompiledTimelineEntry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Context Object Model: the mutable document components write into while an execution runs.
 *
 * <p>Holds the registered tools, timeline, sections, metadata, refs to mounted instances, shared state
 * and the recompile request flag read by the stabilize loop. Not thread-safe: one execution drives it
 * from a single thread.
 */
public final class ContextObjectModel {

    private final Map<String, ExecutableTool> tools = new LinkedHashMap<>();
    private final List<CompiledTimelineEntry> timeline = new ArrayList<>();
    private final Map<String, CompiledSection> sections = new LinkedHashMap<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private final Map<String, Object> refs = new LinkedHashMap<>();
    private final Map<String, Object> state = new LinkedHashMap<>();
    private final List<StateListener> stateListeners = new CopyOnWriteArrayList<>();
    private final List<ExecutionMessage> queuedMessages = new ArrayList<>();
    private final List<String> recompileReasons = new ArrayList<>();
    private boolean recompileRequested;

    // tools

    public void addTool(ExecutableTool tool) {
        Objects.requireNonNull(tool, "tool");
        tools.put(tool.name(), tool);
    }

    public void removeTool(String name) {
        tools.remove(name);
    }

    public Optional<ExecutableTool> getTool(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public List<ExecutableTool> getTools() {
        return List.copyOf(tools.values());
    }

    // timeline and sections

    public void addTimelineEntry(CompiledTimelineEntry entry) {
        timeline.add(Objects.requireNonNull(entry, "entry"));
    }

    public List<CompiledTimelineEntry> getTimeline() {
        return Collections.unmodifiableList(timeline);
    }

    public void addSection(CompiledSection section) {
        Objects.requireNonNull(section, "section");
        sections.put(section.id(), section);
    }

    public Optional<CompiledSection> getSection(String id) {
        return Optional.ofNullable(sections.get(id));
    }

    public Map<String, CompiledSection> getSections() {
        return Collections.unmodifiableMap(sections);
    }

    // metadata

    public void addMetadata(String key, Object value) {
        Objects.requireNonNull(key, "key");
        if (value == null) {
            metadata.remove(key);
        } else {
            metadata.put(key, value);
        }
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    // refs

    public void setRef(String name, Object instance) {
        refs.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(instance, "instance"));
    }

    public void removeRef(String name) {
        refs.remove(name);
    }

    public <T> Optional<T> getRef(String name, Class<T> type) {
        Object value = refs.get(name);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    public Map<String, Object> getRefs() {
        return Collections.unmodifiableMap(refs);
    }

    // state

    public Object getState(String key) {
        return state.get(key);
    }

    public boolean hasState(String key) {
        return state.containsKey(key);
    }

    public void setState(String key, Object value) {
        Objects.requireNonNull(key, "key");
        boolean present = state.containsKey(key);
        Object previous = state.get(key);
        if (present && Objects.equals(previous, value)) {
            return;
        }
        state.put(key, value);
        for (StateListener listener : stateListeners) {
            listener.onChange(key, value, previous);
        }
    }

    public Subscription onStateChange(StateListener listener) {
        Objects.requireNonNull(listener, "listener");
        stateListeners.add(listener);
        return () -> stateListeners.remove(listener);
    }

    // messages

    public void queueMessage(ExecutionMessage message) {
        queuedMessages.add(Objects.requireNonNull(message, "message"));
    }

    public List<ExecutionMessage> getQueuedMessages() {
        return List.copyOf(queuedMessages);
    }

    public void clearQueuedMessages() {
        queuedMessages.clear();
    }

    // recompile requests

    public void requestRecompile(String reason) {
        recompileRequested = true;
        if (reason != null && !reason.isBlank()) {
            recompileReasons.add(reason);
        }
    }

    public void requestRecompile() {
        requestRecompile(null);
    }

    public boolean wasRecompileRequested() {
        return recompileRequested;
    }

    public List<String> getRecompileReasons() {
        return List.copyOf(recompileReasons);
    }

    public void resetRecompileRequest() {
        recompileRequested = false;
        recompileReasons.clear();
    }

    /** Drops per-tick content. Tools, refs and state survive. */
    public void clear() {
        timeline.clear();
        sections.clear();
        metadata.clear();
        resetRecompileRequest();
    }
}
