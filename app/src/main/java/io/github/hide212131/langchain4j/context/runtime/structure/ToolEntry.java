package io.github.hide212131.langchain4j.context.runtime.structure;

import io.github.hide212131.langchain4j.context.runtime.com.ExecutableTool;
import java.util.Objects;

/** Tool collected from the tree, keyed by its name. */
public record ToolEntry(String name, ExecutableTool tool) {

    public ToolEntry {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(tool, "tool");
    }
}
