package io.github.hide212131.langchain4j.context.runtime.render;

import io.github.hide212131.langchain4j.context.runtime.content.SemanticNode;
import java.util.List;
import java.util.Map;

/**
 * Wraps structure in XML-style tags, for models that follow tagged prompts more reliably.
 */
public final class XmlRenderer extends AbstractContentRenderer {

    @Override
    public String name() {
        return "xml";
    }

    @Override
    protected String heading(int level, String body) {
        return "<h" + level + ">" + escape(body) + "</h" + level + ">";
    }

    @Override
    protected String list(boolean ordered, List<String> items) {
        String tag = ordered ? "ol" : "ul";
        StringBuilder sb = new StringBuilder("<").append(tag).append(">\n");
        items.forEach(item -> sb.append("  <li>").append(item).append("</li>\n"));
        return sb.append("</").append(tag).append(">").toString();
    }

    @Override
    protected String quote(String body) {
        return "<blockquote>" + body + "</blockquote>";
    }

    @Override
    protected String codeBlock(String language, String text) {
        String attribute = language == null ? "" : " language=\"" + escape(language) + "\"";
        return "<code" + attribute + ">" + escape(text) + "</code>";
    }

    @Override
    protected String inline(String semantic, String body, Map<String, Object> attributes) {
        return switch (semantic) {
            case SemanticNode.STRONG -> "<strong>" + body + "</strong>";
            case SemanticNode.EMPHASIS -> "<em>" + body + "</em>";
            case SemanticNode.UNDERLINE -> "<u>" + body + "</u>";
            case SemanticNode.STRIKETHROUGH -> "<s>" + body + "</s>";
            case SemanticNode.CODE -> "<code>" + body + "</code>";
            case SemanticNode.LINK -> "<a href=\"" + escape(String.valueOf(attributes.getOrDefault("href", "")))
                    + "\">" + body + "</a>";
            case SemanticNode.LINE_BREAK -> "<br/>";
            case SemanticNode.LIST_ITEM -> "<li>" + body + "</li>";
            default -> {
                Object tag = attributes.get("tag");
                yield tag == null ? body : "<" + tag + ">" + body + "</" + tag + ">";
            }
        };
    }

    @Override
    protected String media(String kind, String source, String label) {
        String labelAttribute = label == null ? "" : " label=\"" + escape(label) + "\"";
        return "<" + kind + " source=\"" + escape(String.valueOf(source)) + "\"" + labelAttribute + "/>";
    }

    @Override
    protected String annotated(String label, String body) {
        String tag = label.split(" ", 2)[0];
        return "<" + tag + ">" + escape(body == null ? "" : body) + "</" + tag + ">";
    }

    private static String escape(String value) {
        return value.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("\"", "&quot;");
    }
}
