package io.github.hide212131.langchain4j.context.runtime.render;

import io.github.hide212131.langchain4j.context.runtime.content.ContentBlock;
import io.github.hide212131.langchain4j.context.runtime.structure.CompiledEphemeral;
import io.github.hide212131.langchain4j.context.runtime.structure.CompiledSection;
import io.github.hide212131.langchain4j.context.runtime.structure.CompiledStructure;
import io.github.hide212131.langchain4j.context.runtime.structure.CompiledTimelineEntry;
import io.github.hide212131.langchain4j.context.runtime.structure.SystemMessageItem;
import io.github.hide212131.langchain4j.context.runtime.structure.ToolEntry;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Prints a compiled structure as a Markdown report: system items in index order, then timeline, tools and
 * ephemeral entries. Each block is formatted with the renderer recorded on its item.
 */
public final class StructureFormatter {

    private final ContentRenderer defaultRenderer;

    public StructureFormatter() {
        this(new MarkdownRenderer());
    }

    public StructureFormatter(ContentRenderer defaultRenderer) {
        this.defaultRenderer = Objects.requireNonNull(defaultRenderer, "defaultRenderer");
    }

    public String format(CompiledStructure structure) {
        StringBuilder out = new StringBuilder();
        out.append("## System\n\n");
        List<SystemMessageItem> items = structure.systemMessageItems().stream()
                .sorted(Comparator.comparingInt(SystemMessageItem::index))
                .toList();
        for (SystemMessageItem item : items) {
            ContentRenderer renderer = rendererOf(item.renderer());
            if (item.type() == SystemMessageItem.Type.SECTION) {
                CompiledSection section = structure.section(item.sectionId()).orElse(null);
                if (section == null) {
                    continue;
                }
                if (section.title() != null) {
                    out.append("### ").append(section.title()).append("\n\n");
                }
                appendParagraph(out, sectionText(section.content(), rendererOf(section.renderer())));
            } else {
                appendParagraph(out, renderer.format(item.content()));
            }
        }
        if (!structure.timelineEntries().isEmpty()) {
            out.append("## Timeline\n\n");
            for (CompiledTimelineEntry entry : structure.timelineEntries()) {
                String body = rendererOf(entry.renderer()).format(entry.message().content());
                appendParagraph(out, "**" + entry.role().value() + "**: " + body);
            }
        }
        if (!structure.tools().isEmpty()) {
            out.append("## Tools\n\n");
            for (ToolEntry tool : structure.tools()) {
                out.append("- ").append(tool.name());
                if (tool.tool().description() != null) {
                    out.append(": ").append(tool.tool().description());
                }
                out.append('\n');
            }
            out.append('\n');
        }
        if (!structure.ephemeral().isEmpty()) {
            out.append("## Ephemeral\n\n");
            for (CompiledEphemeral ephemeral : structure.ephemeral()) {
                String body = rendererOf(ephemeral.renderer()).format(ephemeral.content());
                appendParagraph(out, "[" + ephemeral.position().value() + "] " + body);
            }
        }
        return out.toString().stripTrailing() + "\n";
    }

    private ContentRenderer rendererOf(ContentRenderer renderer) {
        return renderer == null ? defaultRenderer : renderer;
    }

    /** Merged section content may nest lists of blocks and strings. */
    private static String sectionText(Object content, ContentRenderer renderer) {
        if (content == null) {
            return "";
        }
        if (content instanceof String text) {
            return text;
        }
        if (content instanceof ContentBlock block) {
            return renderer.formatBlock(block);
        }
        if (content instanceof List<?> list) {
            return list.stream()
                    .map(item -> sectionText(item, renderer))
                    .filter(text -> !text.isEmpty())
                    .collect(Collectors.joining("\n\n"));
        }
        return content.toString();
    }

    private static void appendParagraph(StringBuilder out, String text) {
        if (text != null && !text.isBlank()) {
            out.append(text).append("\n\n");
        }
    }
}
