package io.github.hide212131.langchain4j.context.runtime.content;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Block-level meaning of a text block, independent of any output format.
 *
 * @param type       heading, paragraph, list, table, quote or custom
 * @param attributes e.g. {@code level} for headings, {@code ordered} for lists
 */
public record Semantic(String type, Map<String, Object> attributes) {

    public static final String HEADING = "heading";
    public static final String PARAGRAPH = "paragraph";
    public static final String LIST = "list";
    public static final String TABLE = "table";
    public static final String QUOTE = "quote";
    public static final String CUSTOM = "custom";

    public Semantic {
        Objects.requireNonNull(type, "type");
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static Semantic of(String type) {
        return new Semantic(type, Map.of());
    }

    public static Semantic heading(int level) {
        return new Semantic(HEADING, Map.of("level", level));
    }

    public static Semantic list(boolean ordered) {
        return new Semantic(LIST, Map.of("ordered", ordered));
    }

    public static Semantic custom(String tag) {
        return new Semantic(CUSTOM, Map.of("tag", tag));
    }

    public int level() {
        return attributes.get("level") instanceof Number number ? number.intValue() : 1;
    }

    public boolean ordered() {
        return Boolean.TRUE.equals(attributes.get("ordered"));
    }
}
