package io.github.hide212131.langchain4j.context.runtime.structure;

import com.fasterxml.jackson.annotation.JsonValue;
import io.github.hide212131.langchain4j.context.runtime.content.ContentBlock;
import io.github.hide212131.langchain4j.context.runtime.render.ContentRenderer;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One slot of the system message, in tree order. Section items point at a section by id; message and
 * loose items carry their blocks inline.
 */
public record SystemMessageItem(Type type, String sectionId, List<ContentBlock> content, int index,
        ContentRenderer renderer) {

    public SystemMessageItem {
        Objects.requireNonNull(type, "type");
        content = content == null ? List.of() : List.copyOf(content);
        if (type == Type.SECTION && sectionId == null) {
            throw new IllegalArgumentException("section item requires a sectionId");
        }
    }

    public static SystemMessageItem section(String sectionId, int index, ContentRenderer renderer) {
        return new SystemMessageItem(Type.SECTION, sectionId, List.of(), index, renderer);
    }

    public static SystemMessageItem message(List<ContentBlock> content, int index, ContentRenderer renderer) {
        return new SystemMessageItem(Type.MESSAGE, null, content, index, renderer);
    }

    public static SystemMessageItem loose(List<ContentBlock> content, int index, ContentRenderer renderer) {
        return new SystemMessageItem(Type.LOOSE, null, content, index, renderer);
    }

    public enum Type {
        SECTION,
        MESSAGE,
        LOOSE;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
