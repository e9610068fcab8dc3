package io.github.hide212131.langchain4j.context.runtime.com;

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import java.util.Objects;

/**
 * Tool definition offered to the model together with the handler that executes it.
 */
public record ExecutableTool(ToolSpecification specification, ToolHandler handler) {

    public ExecutableTool {
        Objects.requireNonNull(specification, "specification");
        Objects.requireNonNull(handler, "handler");
    }

    public static ExecutableTool of(String name, String description, ToolHandler handler) {
        ToolSpecification specification = ToolSpecification.builder()
                .name(name)
                .description(description)
                .build();
        return new ExecutableTool(specification, handler);
    }

    public String name() {
        return specification.name();
    }

    public String description() {
        return specification.description();
    }

    public String execute(ToolExecutionRequest request) {
        return handler.execute(request);
    }
}
