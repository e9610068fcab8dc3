package io.github.hide212131.langchain4j.context.runtime.primitives;

import io.github.hide212131.langchain4j.context.runtime.com.ExecutableTool;
import io.github.hide212131.langchain4j.context.runtime.element.Element;
import io.github.hide212131.langchain4j.context.runtime.element.Elements;
import io.github.hide212131.langchain4j.context.runtime.element.Props;
import io.github.hide212131.langchain4j.context.runtime.render.ContentRenderer;
import io.github.hide212131.langchain4j.context.runtime.render.MarkdownRenderer;
import io.github.hide212131.langchain4j.context.runtime.render.XmlRenderer;
import io.github.hide212131.langchain4j.context.runtime.structure.MessageRole;
import java.util.Objects;
import java.util.Set;

/**
 * Built-in host elements understood by the structure collector, with builders for each.
 */
public final class Primitives {

    public static final String SECTION = "section";
    public static final String ENTRY = "entry";
    public static final String TIMELINE = "timeline";
    public static final String TOOL = "tool";
    public static final String EPHEMERAL = "ephemeral";
    public static final String RENDERER = "renderer";

    public static final String KIND_MESSAGE = "message";

    /** Content tags that become loose system content when they appear outside a section or message. */
    public static final Set<String> LOOSE_CONTENT_TAGS =
            Set.of("text", "code", "image", "json", "document", "audio", "video");

    private Primitives() {
    }

    // structure

    public static Element section(String id, Object content) {
        return Elements.host(SECTION, Props.of("id", id, "content", content));
    }

    public static Element section(Props props, Object... children) {
        return Elements.host(SECTION, props, children);
    }

    public static Element timeline(Object... children) {
        return Elements.host(TIMELINE, Props.empty(), children);
    }

    public static Element message(MessageRole role, Object content) {
        return Elements.host(ENTRY, Props.of("kind", KIND_MESSAGE, "message", new MessageSpec(role, content)));
    }

    /** Message whose content comes from its children. */
    public static Element message(MessageRole role, Props props, Object... children) {
        Props base = (props == null ? Props.empty() : props)
                .with("kind", KIND_MESSAGE)
                .with("message", new MessageSpec(role, null));
        return Elements.host(ENTRY, base, children);
    }

    public static Element userMessage(String content) {
        return message(MessageRole.USER, content);
    }

    public static Element assistantMessage(String content) {
        return message(MessageRole.ASSISTANT, content);
    }

    public static Element systemMessage(String content) {
        return message(MessageRole.SYSTEM, content);
    }

    public static Element tool(ExecutableTool definition) {
        return Elements.host(TOOL, Props.of("definition", Objects.requireNonNull(definition, "definition")));
    }

    /** Tool looked up by name in the COM at collection time. */
    public static Element tool(String name) {
        return Elements.host(TOOL, Props.of("definition", Objects.requireNonNull(name, "name")));
    }

    public static Element ephemeral(String content) {
        return Elements.host(EPHEMERAL, Props.of("content", content));
    }

    public static Element ephemeral(Props props, Object... children) {
        return Elements.host(EPHEMERAL, props, children);
    }

    // renderers

    public static Element renderer(ContentRenderer renderer, Object... children) {
        return Elements.host(RENDERER, Props.of("instance", Objects.requireNonNull(renderer, "renderer")), children);
    }

    public static Element markdown(Object... children) {
        return renderer(new MarkdownRenderer(), children);
    }

    public static Element xml(Object... children) {
        return renderer(new XmlRenderer(), children);
    }

    // content

    public static Element text(String text) {
        return Elements.host("text", Props.of("text", text));
    }

    public static Element text(Props props, Object... children) {
        return Elements.host("text", props, children);
    }

    public static Element code(String language, String text) {
        return Elements.host("code", Props.of("language", language, "text", text));
    }

    public static Element json(Object data) {
        return Elements.host("json", Props.of("data", data));
    }

    public static Element image(String source, String mimeType, String altText) {
        return Elements.host("image", Props.of("source", source, "mimeType", mimeType, "altText", altText));
    }

    public static Element document(String source, String mimeType, String title) {
        return Elements.host("document", Props.of("source", source, "mimeType", mimeType, "title", title));
    }

    public static Element audio(String source, String mimeType, String transcript) {
        return Elements.host("audio", Props.of("source", source, "mimeType", mimeType, "transcript", transcript));
    }

    public static Element video(String source, String mimeType, String transcript) {
        return Elements.host("video", Props.of("source", source, "mimeType", mimeType, "transcript", transcript));
    }

    public static Element heading(int level, Object... children) {
        return Elements.host("h" + level, Props.empty(), children);
    }

    public static Element paragraph(Object... children) {
        return Elements.host("paragraph", Props.empty(), children);
    }

    public static Element list(boolean ordered, Object... items) {
        return Elements.host("list", Props.of("ordered", ordered), items);
    }

    public static Element listItem(Object... children) {
        return Elements.host("li", Props.empty(), children);
    }

    // inline

    public static Element strong(Object... children) {
        return Elements.host("strong", Props.empty(), children);
    }

    public static Element em(Object... children) {
        return Elements.host("em", Props.empty(), children);
    }

    public static Element inlineCode(String text) {
        return Elements.host("inlinecode", Props.empty(), text);
    }

    public static Element link(String href, Object... children) {
        return Elements.host("a", Props.of("href", href), children);
    }
}
