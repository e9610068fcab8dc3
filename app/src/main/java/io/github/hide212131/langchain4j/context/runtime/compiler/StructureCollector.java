package io.github.hide212131.langchain4j.context.runtime.compiler;

import io.github.hide212131.langchain4j.context.infra.logging.CompilerLogger;
import io.github.hide212131.langchain4j.context.runtime.com.ContextObjectModel;
import io.github.hide212131.langchain4j.context.runtime.com.ExecutableTool;
import io.github.hide212131.langchain4j.context.runtime.content.ContentBlock;
import io.github.hide212131.langchain4j.context.runtime.content.ContentBlockRegistry;
import io.github.hide212131.langchain4j.context.runtime.content.Semantic;
import io.github.hide212131.langchain4j.context.runtime.content.SemanticExtractor;
import io.github.hide212131.langchain4j.context.runtime.element.Element;
import io.github.hide212131.langchain4j.context.runtime.element.ElementType;
import io.github.hide212131.langchain4j.context.runtime.element.Props;
import io.github.hide212131.langchain4j.context.runtime.fiber.Fiber;
import io.github.hide212131.langchain4j.context.runtime.fiber.FiberArena;
import io.github.hide212131.langchain4j.context.runtime.primitives.MessageSpec;
import io.github.hide212131.langchain4j.context.runtime.primitives.Primitives;
import io.github.hide212131.langchain4j.context.runtime.render.ContentRenderer;
import io.github.hide212131.langchain4j.context.runtime.structure.Audience;
import io.github.hide212131.langchain4j.context.runtime.structure.CompiledEphemeral;
import io.github.hide212131.langchain4j.context.runtime.structure.CompiledSection;
import io.github.hide212131.langchain4j.context.runtime.structure.CompiledStructure;
import io.github.hide212131.langchain4j.context.runtime.structure.CompiledTimelineEntry;
import io.github.hide212131.langchain4j.context.runtime.structure.EphemeralPosition;
import io.github.hide212131.langchain4j.context.runtime.structure.MessageRole;
import io.github.hide212131.langchain4j.context.runtime.structure.SystemMessageItem;
import io.github.hide212131.langchain4j.context.runtime.structure.TimelineMessage;
import io.github.hide212131.langchain4j.context.runtime.structure.ToolEntry;
import io.github.hide212131.langchain4j.context.runtime.structure.Visibility;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Walks the fiber tree in order and builds a {@link CompiledStructure}. Collection reads the tree and
 * never changes it, so collecting twice without a reconcile yields equal structures.
 */
final class StructureCollector {

    private static final Set<String> STRUCTURAL_TAGS = Set.of(
            Primitives.SECTION, Primitives.ENTRY, Primitives.TIMELINE, Primitives.TOOL, Primitives.EPHEMERAL);

    private final FiberArena arena;
    private final ContextObjectModel com;
    private final ContentBlockRegistry contentRegistry;
    private final ContentRenderer defaultRenderer;
    private final CompilerLogger logger;

    StructureCollector(FiberArena arena, ContextObjectModel com, ContentBlockRegistry contentRegistry,
            ContentRenderer defaultRenderer, CompilerLogger logger) {
        this.arena = arena;
        this.com = com;
        this.contentRegistry = contentRegistry;
        this.defaultRenderer = defaultRenderer;
        this.logger = logger;
    }

    CompiledStructure collect(int rootId) {
        Accumulator acc = new Accumulator();
        if (rootId != FiberArena.NO_FIBER) {
            traverse(arena.get(rootId), acc, false);
        }
        List<ToolEntry> tools = new ArrayList<>();
        acc.tools.forEach((name, tool) -> tools.add(new ToolEntry(name, tool)));
        return new CompiledStructure(acc.sections, acc.timeline, acc.systemItems, tools, acc.ephemeral,
                com.getMetadata());
    }

    private void traverse(Fiber fiber, Accumulator acc, boolean inSectionOrMessage) {
        if (fiber.isHost(Primitives.RENDERER)) {
            if (fiber.props().get("instance") instanceof ContentRenderer renderer) {
                acc.renderers.push(renderer);
                try {
                    traverseChildren(fiber, acc, inSectionOrMessage);
                } finally {
                    acc.renderers.pop();
                }
            } else {
                logger.warn("renderer element {} has no renderer instance; children use the enclosing renderer",
                        fiber);
                traverseChildren(fiber, acc, inSectionOrMessage);
            }
            return;
        }
        if (fiber.isHost(Primitives.SECTION)) {
            collectSection(fiber, acc);
            traverseChildren(fiber, acc, true);
            return;
        }
        if (fiber.isHost(Primitives.EPHEMERAL)) {
            collectEphemeral(fiber, acc);
            return;
        }
        if (fiber.isHost(Primitives.ENTRY) && Primitives.KIND_MESSAGE.equals(fiber.props().getString("kind"))) {
            collectMessage(fiber, acc);
            traverseChildren(fiber, acc, true);
            return;
        }
        if (fiber.isHost(Primitives.TOOL)) {
            collectTool(fiber, acc);
            return;
        }
        if (!inSectionOrMessage && isLooseContent(fiber)) {
            ContentRenderer renderer = acc.currentRenderer();
            contentRegistry.map(fiber.asElement(), renderer).ifPresent(block ->
                    acc.systemItems.add(SystemMessageItem.loose(List.of(block), acc.nextIndex(), renderer)));
            return;
        }
        traverseChildren(fiber, acc, inSectionOrMessage);
    }

    private void traverseChildren(Fiber fiber, Accumulator acc, boolean inSectionOrMessage) {
        for (Fiber child : arena.children(fiber)) {
            traverse(child, acc, inSectionOrMessage);
        }
    }

    private void collectSection(Fiber fiber, Accumulator acc) {
        Props props = fiber.props();
        ContentRenderer renderer = acc.currentRenderer();
        String id = props.getString("id", "section-" + fiber.id());
        Object content;
        if (props.hasChildren()) {
            content = blocksMixed(fiber, renderer);
        } else if (props.has("content")) {
            content = props.get("content");
        } else {
            content = List.of();
        }
        CompiledSection section = new CompiledSection(id, props.getString("title"), content,
                Visibility.from(props.get("visibility")), Audience.from(props.get("audience")),
                props.getStringList("tags"), metadataOf(props), renderer);
        CompiledSection existing = acc.sections.get(id);
        if (existing == null) {
            acc.sections.put(id, section);
            acc.systemItems.add(SystemMessageItem.section(id, acc.nextIndex(), renderer));
        } else {
            acc.sections.put(id, existing.mergedWith(section));
        }
    }

    private void collectMessage(Fiber fiber, Accumulator acc) {
        Props props = fiber.props();
        MessageSpec spec = props.find("message", MessageSpec.class).orElse(null);
        MessageRole role = spec != null ? spec.role() : MessageRole.from(props.get("role"));
        ContentRenderer renderer = acc.currentRenderer();
        List<ContentBlock> content = props.hasChildren()
                ? blocksMixed(fiber, renderer)
                : toBlocks(spec != null ? spec.content() : props.get("content"));
        if (role == MessageRole.SYSTEM) {
            acc.systemItems.add(SystemMessageItem.message(content, acc.nextIndex(), renderer));
            return;
        }
        TimelineMessage message = spec != null
                ? new TimelineMessage(role, content, spec.id(), spec.metadata())
                : new TimelineMessage(role, content);
        acc.timeline.add(new CompiledTimelineEntry(CompiledTimelineEntry.KIND_MESSAGE, message,
                props.getStringList("tags"), Visibility.from(props.get("visibility")), metadataOf(props),
                acc.explicitRenderer()));
    }

    private void collectTool(Fiber fiber, Accumulator acc) {
        Object definition = fiber.props().get("definition");
        ExecutableTool tool = null;
        if (definition instanceof ExecutableTool executable) {
            tool = executable;
        } else if (definition instanceof String name) {
            tool = com.getTool(name).orElse(null);
        }
        if (tool == null) {
            logger.warn("tool element {} does not resolve to a registered tool", definition);
            return;
        }
        acc.tools.put(tool.name(), tool);
    }

    private void collectEphemeral(Fiber fiber, Accumulator acc) {
        Props props = fiber.props();
        List<ContentBlock> content = props.hasChildren()
                ? blocksMixed(fiber, acc.currentRenderer())
                : toBlocks(props.get("content"));
        acc.ephemeral.add(new CompiledEphemeral(props.getString("id"), props.getString("type"), content,
                EphemeralPosition.from(props.get("position")), props.getInt("order", 0),
                props.getStringList("tags"), Visibility.from(props.get("visibility")), metadataOf(props),
                acc.explicitRenderer()));
    }

    /**
     * Walks raw children in order and uses the reconciled fiber for each element child, matched by key or
     * by position among the element children.
     */
    private List<ContentBlock> blocksMixed(Fiber fiber, ContentRenderer renderer) {
        List<Fiber> children = arena.children(fiber);
        Map<Object, Fiber> byKey = new HashMap<>();
        for (int i = 0; i < children.size(); i++) {
            Fiber child = children.get(i);
            byKey.putIfAbsent(child.key() != null ? child.key() : Integer.valueOf(i), child);
        }
        List<ContentBlock> blocks = new ArrayList<>();
        int elementIndex = 0;
        for (Object raw : fiber.props().children()) {
            if (raw instanceof Element element) {
                Object lookup = element.key() != null ? element.key() : Integer.valueOf(elementIndex);
                elementIndex++;
                Fiber match = byKey.get(lookup);
                if (match != null) {
                    blocks.addAll(blocksFromFibers(List.of(match), renderer));
                } else {
                    blocks.addAll(blocksFromRaw(List.of(element), renderer));
                }
            } else {
                blocks.addAll(blocksFromRaw(List.of(raw), renderer));
            }
        }
        return blocks;
    }

    private List<ContentBlock> blocksFromFibers(List<Fiber> fibers, ContentRenderer renderer) {
        List<ContentBlock> blocks = new ArrayList<>();
        for (Fiber fiber : fibers) {
            if (fiber.isHost(Primitives.RENDERER)) {
                ContentRenderer nested = fiber.props().get("instance") instanceof ContentRenderer r ? r : renderer;
                blocks.addAll(blocksFromFibers(arena.children(fiber), nested));
                continue;
            }
            if (fiber.type() instanceof ElementType.HostTag host && STRUCTURAL_TAGS.contains(host.name())) {
                continue;
            }
            if (contentRegistry.handles(fiber.type())) {
                contentRegistry.map(fiber.asElement(), renderer).ifPresent(blocks::add);
                continue;
            }
            if (fiber.type() instanceof ElementType.HostTag) {
                blocks.add(customBlock(fiber.asElement(), renderer));
                continue;
            }
            blocks.addAll(blocksFromFibers(arena.children(fiber), renderer));
        }
        return blocks;
    }

    private List<ContentBlock> blocksFromRaw(List<Object> rawChildren, ContentRenderer renderer) {
        List<ContentBlock> blocks = new ArrayList<>();
        for (Object raw : rawChildren) {
            if (raw instanceof ContentBlock block) {
                blocks.add(block);
            } else if (raw instanceof Element element) {
                if (element.isHost(Primitives.RENDERER)) {
                    ContentRenderer nested =
                            element.props().get("instance") instanceof ContentRenderer r ? r : renderer;
                    blocks.addAll(blocksFromRaw(element.children(), nested));
                } else if (contentRegistry.handles(element.type())) {
                    contentRegistry.map(element, renderer).ifPresent(blocks::add);
                } else {
                    blocks.add(customBlock(element, renderer));
                }
            } else if (raw instanceof String || raw instanceof Number) {
                blocks.add(ContentBlock.text(raw.toString()));
            }
        }
        return blocks;
    }

    private static ContentBlock customBlock(Element element, ContentRenderer renderer) {
        var node = SemanticExtractor.extract(List.of(element), renderer);
        String tag = element.type().displayName().toLowerCase(Locale.ROOT);
        return new ContentBlock.Text(node.plainText(), node, Semantic.custom(tag));
    }

    private static List<ContentBlock> toBlocks(Object content) {
        if (content == null) {
            return List.of();
        }
        if (content instanceof String text) {
            return List.of(ContentBlock.text(text));
        }
        if (content instanceof ContentBlock block) {
            return List.of(block);
        }
        if (content instanceof List<?> list) {
            List<ContentBlock> blocks = new ArrayList<>();
            for (Object item : list) {
                if (item instanceof ContentBlock block) {
                    blocks.add(block);
                } else if (item instanceof String text) {
                    blocks.add(ContentBlock.text(text));
                }
            }
            return blocks;
        }
        return List.of(ContentBlock.text(content.toString()));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> metadataOf(Props props) {
        Object metadata = props.get("metadata");
        if (metadata instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            ((Map<Object, Object>) map).forEach((key, value) -> {
                if (key != null && value != null) {
                    copy.put(key.toString(), value);
                }
            });
            return copy;
        }
        return Map.of();
    }

    private static boolean isLooseContent(Fiber fiber) {
        return fiber.type() instanceof ElementType.HostTag host
                && Primitives.LOOSE_CONTENT_TAGS.contains(host.name());
    }

    private final class Accumulator {
        private final Map<String, CompiledSection> sections = new LinkedHashMap<>();
        private final List<CompiledTimelineEntry> timeline = new ArrayList<>();
        private final List<SystemMessageItem> systemItems = new ArrayList<>();
        private final Map<String, ExecutableTool> tools = new LinkedHashMap<>();
        private final List<CompiledEphemeral> ephemeral = new ArrayList<>();
        private final Deque<ContentRenderer> renderers = new ArrayDeque<>();
        private int index;

        int nextIndex() {
            return index++;
        }

        ContentRenderer currentRenderer() {
            return renderers.isEmpty() ? defaultRenderer : renderers.peek();
        }

        /** Renderer from an enclosing wrapper, {@code null} under the default one. */
        ContentRenderer explicitRenderer() {
            ContentRenderer current = currentRenderer();
            return current == defaultRenderer ? null : current;
        }
    }
}
