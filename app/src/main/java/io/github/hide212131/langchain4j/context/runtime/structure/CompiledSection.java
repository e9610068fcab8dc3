package io.github.hide212131.langchain4j.context.runtime.structure;

import io.github.hide212131.langchain4j.context.runtime.render.ContentRenderer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Named block of system-level content. {@code content} is a string, a list (usually content blocks),
 * a map, or any other value supplied through props.
 */
public record CompiledSection(String id, String title, Object content, Visibility visibility, Audience audience,
        List<String> tags, Map<String, Object> metadata, ContentRenderer renderer) {

    public CompiledSection {
        Objects.requireNonNull(id, "id");
        content = content == null ? List.of() : content;
        tags = tags == null ? List.of() : List.copyOf(tags);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Combines this section with a later occurrence of the same id. Content is merged by shape, the other
     * fields take the later value when it is present.
     */
    public CompiledSection mergedWith(CompiledSection later) {
        Objects.requireNonNull(later, "later");
        return new CompiledSection(
                id,
                later.title != null ? later.title : title,
                mergeContent(content, later.content),
                later.visibility != null ? later.visibility : visibility,
                later.audience != null ? later.audience : audience,
                !later.tags.isEmpty() ? later.tags : tags,
                !later.metadata.isEmpty() ? later.metadata : metadata,
                later.renderer != null ? later.renderer : renderer);
    }

    /**
     * string + string joins with a newline, list + list concatenates, map + map merges shallowly (later wins).
     * Any other pair becomes a two-element list.
     */
    static Object mergeContent(Object existing, Object incoming) {
        if (existing instanceof String a && incoming instanceof String b) {
            return a + "\n" + b;
        }
        if (existing instanceof List<?> a && incoming instanceof List<?> b) {
            List<Object> combined = new ArrayList<>(a);
            combined.addAll(b);
            return Collections.unmodifiableList(combined);
        }
        if (existing instanceof Map<?, ?> a && incoming instanceof Map<?, ?> b) {
            Map<Object, Object> combined = new LinkedHashMap<>(a);
            combined.putAll(b);
            return Collections.unmodifiableMap(combined);
        }
        return Collections.unmodifiableList(Arrays.asList(existing, incoming));
    }
}
