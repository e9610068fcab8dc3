package io.github.hide212131.langchain4j.context.runtime.primitives;

import io.github.hide212131.langchain4j.context.runtime.structure.MessageRole;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Message carried by an entry element. {@code content} is a string or a list of content blocks and is
 * used only when the entry has no children.
 */
public record MessageSpec(MessageRole role, Object content, String id, Map<String, Object> metadata) {

    public MessageSpec {
        Objects.requireNonNull(role, "role");
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public MessageSpec(MessageRole role, Object content) {
        this(role, content, null, null);
    }
}
