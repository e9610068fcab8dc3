package io.github.hide212131.langchain4j.context.runtime.structure;

import io.github.hide212131.langchain4j.context.runtime.content.ContentBlock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** 役割付きのメッセージ本体。 */
public record TimelineMessage(MessageRole role, List<ContentBlock> content, String id, Map<String, Object> metadata) {

    public TimelineMessage {
        Objects.requireNonNull(role, "role");
        content = content == null ? List.of() : List.copyOf(content);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public TimelineMessage(MessageRole role, List<ContentBlock> content) {
        this(role, content, null, null);
    }
}
