package io.github.hide212131.langchain4j.context.runtime.content;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.github.hide212131.langchain4j.context.runtime.render.ContentRenderer;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Inline structure of a text block: a tree of text leaves and semantic wrappers such as
 * {@code strong} or {@code link}. A renderer attached to a root node formats that subtree.
 */
public record SemanticNode(String text, String semantic, Map<String, Object> attributes,
        List<SemanticNode> children, ContentRenderer renderer) {

    public static final String STRONG = "strong";
    public static final String EMPHASIS = "emphasis";
    public static final String UNDERLINE = "underline";
    public static final String STRIKETHROUGH = "strikethrough";
    public static final String CODE = "code";
    public static final String LINK = "link";
    public static final String LINE_BREAK = "line-break";
    public static final String LIST_ITEM = "list-item";
    public static final String CUSTOM = "custom";

    public SemanticNode {
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static SemanticNode leaf(String text) {
        return new SemanticNode(text, null, Map.of(), List.of(), null);
    }

    public static SemanticNode root(List<SemanticNode> children, ContentRenderer renderer) {
        return new SemanticNode(null, null, Map.of(), children, renderer);
    }

    @JsonIgnore
    public boolean isLeaf() {
        return text != null && children.isEmpty();
    }

    /** 書式を除いたテキスト。 */
    public String plainText() {
        if (text != null) {
            return text;
        }
        if (LINE_BREAK.equals(semantic)) {
            return "\n";
        }
        StringBuilder sb = new StringBuilder();
        children.forEach(child -> sb.append(child.plainText()));
        return sb.toString();
    }
}
