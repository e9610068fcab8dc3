package io.github.hide212131.langchain4j.context.runtime.structure;

import io.github.hide212131.langchain4j.context.runtime.content.ContentBlock;
import io.github.hide212131.langchain4j.context.runtime.render.ContentRenderer;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** 現在の tick だけモデルへ渡され、保存されないコンテンツ。 */
public record CompiledEphemeral(String id, String type, List<ContentBlock> content, EphemeralPosition position,
        int order, List<String> tags, Visibility visibility, Map<String, Object> metadata,
        ContentRenderer renderer) {

    public CompiledEphemeral {
        content = content == null ? List.of() : List.copyOf(content);
        position = Objects.requireNonNullElse(position, EphemeralPosition.END);
        tags = tags == null ? List.of() : List.copyOf(tags);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
