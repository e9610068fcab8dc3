package io.github.hide212131.langchain4j.context.runtime.content;

import io.github.hide212131.langchain4j.context.runtime.element.Element;
import io.github.hide212131.langchain4j.context.runtime.element.ElementType;
import io.github.hide212131.langchain4j.context.runtime.render.ContentRenderer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds {@link SemanticNode} trees from raw element children.
 */
public final class SemanticExtractor {

    private static final Map<String, String> INLINE_SEMANTICS = Map.ofEntries(
            Map.entry("b", SemanticNode.STRONG),
            Map.entry("strong", SemanticNode.STRONG),
            Map.entry("i", SemanticNode.EMPHASIS),
            Map.entry("em", SemanticNode.EMPHASIS),
            Map.entry("u", SemanticNode.UNDERLINE),
            Map.entry("s", SemanticNode.STRIKETHROUGH),
            Map.entry("del", SemanticNode.STRIKETHROUGH),
            Map.entry("inlinecode", SemanticNode.CODE),
            Map.entry("code", SemanticNode.CODE),
            Map.entry("a", SemanticNode.LINK),
            Map.entry("link", SemanticNode.LINK),
            Map.entry("br", SemanticNode.LINE_BREAK),
            Map.entry("li", SemanticNode.LIST_ITEM),
            Map.entry("listitem", SemanticNode.LIST_ITEM));

    private SemanticExtractor() {
    }

    public static SemanticNode extract(List<Object> children, ContentRenderer renderer) {
        return SemanticNode.root(nodes(children), renderer);
    }

    /** 子要素から書式を除いたテキストを取り出す。 */
    public static String plainText(List<Object> children) {
        return SemanticNode.root(nodes(children), null).plainText();
    }

    private static List<SemanticNode> nodes(List<Object> children) {
        List<SemanticNode> nodes = new ArrayList<>();
        for (Object child : children) {
            SemanticNode node = node(child);
            if (node != null) {
                nodes.add(node);
            }
        }
        return nodes;
    }

    private static SemanticNode node(Object child) {
        if (child instanceof String text) {
            return SemanticNode.leaf(text);
        }
        if (child instanceof Number || child instanceof Character) {
            return SemanticNode.leaf(child.toString());
        }
        if (child instanceof ContentBlock.Text text) {
            return text.semanticNode() != null ? text.semanticNode() : SemanticNode.leaf(text.text());
        }
        if (child instanceof Element element) {
            return elementNode(element);
        }
        return null;
    }

    private static SemanticNode elementNode(Element element) {
        String tag = tagOf(element);
        List<SemanticNode> children = nodes(element.children());
        if (children.isEmpty() && element.props().has("text")) {
            children = List.of(SemanticNode.leaf(element.props().getString("text")));
        }
        if (tag == null) {
            return new SemanticNode(null, null, Map.of(), children, null);
        }
        String semantic = INLINE_SEMANTICS.get(tag);
        Map<String, Object> attributes = new LinkedHashMap<>();
        if (semantic == null) {
            semantic = SemanticNode.CUSTOM;
            attributes.put("tag", tag);
        }
        if (SemanticNode.LINK.equals(semantic) && element.props().has("href")) {
            attributes.put("href", element.props().getString("href"));
        }
        return new SemanticNode(null, semantic, attributes, children, null);
    }

    private static String tagOf(Element element) {
        if (element.type() instanceof ElementType.HostTag host) {
            return host.name().toLowerCase(Locale.ROOT);
        }
        return null;
    }
}
