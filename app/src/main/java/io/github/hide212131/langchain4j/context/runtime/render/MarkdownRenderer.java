package io.github.hide212131.langchain4j.context.runtime.render;

import io.github.hide212131.langchain4j.context.runtime.content.SemanticNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Markdown 形式の既定レンダラー。 */
public final class MarkdownRenderer extends AbstractContentRenderer {

    @Override
    public String name() {
        return "markdown";
    }

    @Override
    protected String heading(int level, String body) {
        int clamped = Math.max(1, Math.min(6, level));
        return "#".repeat(clamped) + " " + body;
    }

    @Override
    protected String list(boolean ordered, List<String> items) {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            lines.add((ordered ? (i + 1) + ". " : "- ") + items.get(i));
        }
        return String.join("\n", lines);
    }

    @Override
    protected String quote(String body) {
        return body.lines().map(line -> "> " + line).reduce((a, b) -> a + "\n" + b).orElse("> ");
    }

    @Override
    protected String codeBlock(String language, String text) {
        return "```" + (language == null ? "" : language) + "\n" + text + "\n```";
    }

    @Override
    protected String inline(String semantic, String body, Map<String, Object> attributes) {
        return switch (semantic) {
            case SemanticNode.STRONG -> "**" + body + "**";
            case SemanticNode.EMPHASIS -> "_" + body + "_";
            case SemanticNode.STRIKETHROUGH -> "~~" + body + "~~";
            case SemanticNode.CODE -> "`" + body + "`";
            case SemanticNode.LINK -> "[" + body + "](" + attributes.getOrDefault("href", "") + ")";
            case SemanticNode.LINE_BREAK -> "\n";
            case SemanticNode.LIST_ITEM -> "- " + body;
            default -> body;
        };
    }

    @Override
    protected String media(String kind, String source, String label) {
        String text = label == null ? kind : label;
        return "image".equals(kind) ? "![" + text + "](" + source + ")" : "[" + text + "](" + source + ")";
    }

    @Override
    protected String annotated(String label, String body) {
        return "[" + label + "] " + (body == null ? "" : body);
    }
}
