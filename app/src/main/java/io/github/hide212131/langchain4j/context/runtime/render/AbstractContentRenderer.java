package io.github.hide212131.langchain4j.context.runtime.render;

import io.github.hide212131.langchain4j.context.runtime.content.ContentBlock;
import io.github.hide212131.langchain4j.context.runtime.content.Semantic;
import io.github.hide212131.langchain4j.context.runtime.content.SemanticNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Dispatches blocks and semantic nodes to format-specific primitives.
 */
abstract class AbstractContentRenderer implements ContentRenderer {

    protected abstract String heading(int level, String body);

    protected abstract String list(boolean ordered, List<String> items);

    protected abstract String quote(String body);

    protected abstract String codeBlock(String language, String text);

    protected abstract String inline(String semantic, String body, Map<String, Object> attributes);

    protected abstract String media(String kind, String source, String label);

    protected abstract String annotated(String label, String body);

    @Override
    public String formatBlock(ContentBlock block) {
        if (block instanceof ContentBlock.Text text) {
            return formatText(text);
        }
        if (block instanceof ContentBlock.Code code) {
            return codeBlock(code.language(), code.text());
        }
        if (block instanceof ContentBlock.Json json) {
            return codeBlock("json", json.text());
        }
        if (block instanceof ContentBlock.Image image) {
            return media("image", image.source(), image.altText());
        }
        if (block instanceof ContentBlock.Document document) {
            return media("document", document.source(), document.title());
        }
        if (block instanceof ContentBlock.Audio audio) {
            return media("audio", audio.source(), audio.transcript());
        }
        if (block instanceof ContentBlock.Video video) {
            return media("video", video.source(), video.transcript());
        }
        if (block instanceof ContentBlock.ToolUse toolUse) {
            return annotated("tool_use " + toolUse.name(), String.valueOf(toolUse.input()));
        }
        if (block instanceof ContentBlock.ToolResult result) {
            return annotated("tool_result " + result.name(), format(result.content()));
        }
        if (block instanceof ContentBlock.Reasoning reasoning) {
            return annotated("reasoning", reasoning.text());
        }
        if (block instanceof ContentBlock.UserAction action) {
            return annotated("user_action " + action.action(), action.text());
        }
        if (block instanceof ContentBlock.SystemEvent event) {
            return annotated("system_event " + event.event(), event.text());
        }
        if (block instanceof ContentBlock.StateChange change) {
            String body = change.text() != null && !change.text().isEmpty()
                    ? change.text()
                    : "%s.%s: %s -> %s".formatted(change.entity(), change.field(), change.from(), change.to());
            return annotated("state_change", body);
        }
        return "";
    }

    @Override
    public String formatNode(SemanticNode node) {
        if (node.isLeaf()) {
            return node.text();
        }
        if (node.renderer() != null && node.renderer() != this && node.semantic() == null) {
            return node.renderer().formatNode(SemanticNode.root(node.children(), null));
        }
        String body = node.text() != null
                ? node.text()
                : node.children().stream().map(this::formatNode).collect(Collectors.joining());
        if (node.semantic() == null) {
            return body;
        }
        return inline(node.semantic(), body, node.attributes());
    }

    private String formatText(ContentBlock.Text text) {
        SemanticNode node = text.semanticNode();
        Semantic semantic = text.semantic();
        if (semantic != null && Semantic.LIST.equals(semantic.type()) && node != null) {
            return list(semantic.ordered(), listItems(node));
        }
        String body = node != null ? formatNode(node) : text.text();
        if (semantic == null) {
            return body;
        }
        return switch (semantic.type()) {
            case Semantic.HEADING -> heading(semantic.level(), body);
            case Semantic.QUOTE -> quote(body);
            default -> body;
        };
    }

    private List<String> listItems(SemanticNode node) {
        List<String> items = new ArrayList<>();
        for (SemanticNode child : node.children()) {
            if (SemanticNode.LIST_ITEM.equals(child.semantic())) {
                items.add(child.children().stream().map(this::formatNode).collect(Collectors.joining()));
            } else {
                String line = formatNode(child).trim();
                if (!line.isEmpty()) {
                    items.add(line);
                }
            }
        }
        return items;
    }
}
