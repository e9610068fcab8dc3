package io.github.hide212131.langchain4j.context.runtime.structure;

import io.github.hide212131.langchain4j.context.runtime.render.ContentRenderer;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Conversation entry. The renderer is set only when a non-default renderer wrapped the entry.
 */
public record CompiledTimelineEntry(String kind, TimelineMessage message, List<String> tags, Visibility visibility,
        Map<String, Object> metadata, ContentRenderer renderer) {

    public static final String KIND_MESSAGE = "message";

    public CompiledTimelineEntry {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
        tags = tags == null ? List.of() : List.copyOf(tags);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static CompiledTimelineEntry message(TimelineMessage message) {
        return new CompiledTimelineEntry(KIND_MESSAGE, message, List.of(), null, Map.of(), null);
    }

    public MessageRole role() {
        return message.role();
    }
}
