package io.github.hide212131.langchain4j.context.runtime.structure;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Output of one compile pass: everything the model adapter needs to build the next request.
 *
 * @param sections           sections keyed by id, in first-occurrence order
 * @param timelineEntries    non-system messages in tree order
 * @param systemMessageItems ordered parts of the system message
 * @param tools              tools deduplicated by name, last definition wins
 * @param ephemeral          content that is not persisted across ticks
 * @param metadata           COM metadata at the end of collection
 */
public record CompiledStructure(Map<String, CompiledSection> sections, List<CompiledTimelineEntry> timelineEntries,
        List<SystemMessageItem> systemMessageItems, List<ToolEntry> tools, List<CompiledEphemeral> ephemeral,
        Map<String, Object> metadata) {

    public CompiledStructure {
        sections = sections == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sections));
        timelineEntries = timelineEntries == null ? List.of() : List.copyOf(timelineEntries);
        systemMessageItems = systemMessageItems == null ? List.of() : List.copyOf(systemMessageItems);
        tools = tools == null ? List.of() : List.copyOf(tools);
        ephemeral = ephemeral == null ? List.of() : List.copyOf(ephemeral);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static CompiledStructure empty() {
        return new CompiledStructure(null, null, null, null, null, null);
    }

    public Optional<CompiledSection> section(String id) {
        return Optional.ofNullable(sections.get(id));
    }

    public Optional<ToolEntry> tool(String name) {
        return tools.stream().filter(entry -> entry.name().equals(name)).findFirst();
    }

    public List<String> toolNames() {
        return tools.stream().map(ToolEntry::name).toList();
    }
}
