package io.github.hide212131.langchain4j.context.runtime.content;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hide212131.langchain4j.context.runtime.element.Element;
import io.github.hide212131.langchain4j.context.runtime.element.ElementType;
import io.github.hide212131.langchain4j.context.runtime.element.Props;
import io.github.hide212131.langchain4j.context.runtime.render.ContentRenderer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps content element tags to {@link ContentBlockMapper}s. Host tags are matched by name, function
 * components by their display name, both case-insensitively.
 */
public final class ContentBlockRegistry {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final Map<String, ContentBlockMapper> mappers = new LinkedHashMap<>();

    public static ContentBlockRegistry defaults() {
        ContentBlockRegistry registry = new ContentBlockRegistry();
        registry.register("text", (element, renderer) -> textBlock(element, renderer, null));
        registry.register("paragraph", (element, renderer) -> textBlock(element, renderer,
                Semantic.of(Semantic.PARAGRAPH)));
        registry.register("p", (element, renderer) -> textBlock(element, renderer, Semantic.of(Semantic.PARAGRAPH)));
        for (int level = 1; level <= 6; level++) {
            Semantic heading = Semantic.heading(level);
            registry.register("h" + level, (element, renderer) -> textBlock(element, renderer, heading));
        }
        registry.register("header", (element, renderer) -> textBlock(element, renderer,
                Semantic.heading(element.props().getInt("level", 1))));
        registry.register("blockquote", (element, renderer) -> textBlock(element, renderer,
                Semantic.of(Semantic.QUOTE)));
        registry.register("list", (element, renderer) -> textBlock(element, renderer,
                Semantic.list(element.props().getBoolean("ordered", false))));
        registry.register("ul", (element, renderer) -> textBlock(element, renderer, Semantic.list(false)));
        registry.register("ol", (element, renderer) -> textBlock(element, renderer, Semantic.list(true)));
        registry.register("table", (element, renderer) -> textBlock(element, renderer, Semantic.of(Semantic.TABLE)));
        registry.register("image", (element, renderer) -> new ContentBlock.Image(
                element.props().getString("source"),
                element.props().getString("mimeType"),
                element.props().getString("altText")));
        registry.register("document", (element, renderer) -> new ContentBlock.Document(
                element.props().getString("source"),
                element.props().getString("mimeType"),
                element.props().getString("title")));
        registry.register("audio", (element, renderer) -> new ContentBlock.Audio(
                element.props().getString("source"),
                element.props().getString("mimeType"),
                element.props().getString("transcript")));
        registry.register("video", (element, renderer) -> new ContentBlock.Video(
                element.props().getString("source"),
                element.props().getString("mimeType"),
                element.props().getString("transcript")));
        registry.register("code", (element, renderer) -> new ContentBlock.Code(
                textOf(element), element.props().getString("language")));
        registry.register("json", (element, renderer) -> {
            Object data = element.props().get("data");
            String text = element.props().getString("text");
            return new ContentBlock.Json(text != null ? text : toJson(data), data);
        });
        registry.register("reasoning", (element, renderer) -> new ContentBlock.Reasoning(textOf(element)));
        registry.register("user-action", (element, renderer) -> new ContentBlock.UserAction(
                element.props().getString("action"),
                element.props().getString("actor"),
                textOf(element)));
        registry.register("system-event", (element, renderer) -> new ContentBlock.SystemEvent(
                element.props().getString("event"),
                element.props().getString("source"),
                textOf(element)));
        registry.register("state-change", (element, renderer) -> new ContentBlock.StateChange(
                element.props().getString("entity"),
                element.props().getString("field"),
                element.props().get("from"),
                element.props().get("to"),
                textOf(element)));
        return registry;
    }

    public ContentBlockRegistry register(String tag, ContentBlockMapper mapper) {
        Objects.requireNonNull(tag, "tag");
        mappers.put(tag.toLowerCase(Locale.ROOT), Objects.requireNonNull(mapper, "mapper"));
        return this;
    }

    public Optional<ContentBlockMapper> find(ElementType type) {
        String name = null;
        if (type instanceof ElementType.HostTag host) {
            name = host.name();
        } else if (type instanceof ElementType.FunctionType function) {
            name = function.displayName();
        }
        return name == null ? Optional.empty() : Optional.ofNullable(mappers.get(name.toLowerCase(Locale.ROOT)));
    }

    public boolean handles(ElementType type) {
        return find(type).isPresent();
    }

    /** Converts the element, or returns empty when no mapper matches or the mapper yields nothing. */
    public Optional<ContentBlock> map(Element element, ContentRenderer currentRenderer) {
        return find(element.type()).map(mapper -> mapper.map(element, currentRenderer));
    }

    private static ContentBlock textBlock(Element element, ContentRenderer renderer, Semantic semantic) {
        Props props = element.props();
        List<Object> children = element.children();
        if (!children.isEmpty()) {
            SemanticNode node = SemanticExtractor.extract(children, renderer);
            return new ContentBlock.Text(node.plainText(), node, semantic);
        }
        String text = props.getString("text", "");
        return new ContentBlock.Text(text, null, semantic);
    }

    private static String toJson(Object data) {
        if (data == null) {
            return "";
        }
        if (data instanceof String text) {
            return text;
        }
        try {
            return JSON.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("json content is not serializable: " + data.getClass().getName(), e);
        }
    }

    private static String textOf(Element element) {
        List<Object> children = element.children();
        if (!children.isEmpty()) {
            return SemanticExtractor.plainText(children);
        }
        return element.props().getString("text", "");
    }
}
