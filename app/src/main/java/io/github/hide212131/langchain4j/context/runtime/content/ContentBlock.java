package io.github.hide212131.langchain4j.context.runtime.content;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Typed unit of message content.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ContentBlock.Text.class, name = "text"),
    @JsonSubTypes.Type(value = ContentBlock.Image.class, name = "image"),
    @JsonSubTypes.Type(value = ContentBlock.Document.class, name = "document"),
    @JsonSubTypes.Type(value = ContentBlock.Audio.class, name = "audio"),
    @JsonSubTypes.Type(value = ContentBlock.Video.class, name = "video"),
    @JsonSubTypes.Type(value = ContentBlock.Code.class, name = "code"),
    @JsonSubTypes.Type(value = ContentBlock.Json.class, name = "json"),
    @JsonSubTypes.Type(value = ContentBlock.ToolUse.class, name = "tool_use"),
    @JsonSubTypes.Type(value = ContentBlock.ToolResult.class, name = "tool_result"),
    @JsonSubTypes.Type(value = ContentBlock.Reasoning.class, name = "reasoning"),
    @JsonSubTypes.Type(value = ContentBlock.UserAction.class, name = "user_action"),
    @JsonSubTypes.Type(value = ContentBlock.SystemEvent.class, name = "system_event"),
    @JsonSubTypes.Type(value = ContentBlock.StateChange.class, name = "state_change")
})
public sealed interface ContentBlock {

    String blockType();

    static Text text(String text) {
        return new Text(text, null, null);
    }

    /** Plain text, optionally with inline structure and a block-level semantic. */
    record Text(String text, SemanticNode semanticNode, Semantic semantic) implements ContentBlock {
        public Text {
            text = text == null ? "" : text;
        }

        @Override
        public String blockType() {
            return "text";
        }
    }

    record Image(String source, String mimeType, String altText) implements ContentBlock {
        @Override
        public String blockType() {
            return "image";
        }
    }

    record Document(String source, String mimeType, String title) implements ContentBlock {
        @Override
        public String blockType() {
            return "document";
        }
    }

    record Audio(String source, String mimeType, String transcript) implements ContentBlock {
        @Override
        public String blockType() {
            return "audio";
        }
    }

    record Video(String source, String mimeType, String transcript) implements ContentBlock {
        @Override
        public String blockType() {
            return "video";
        }
    }

    record Code(String text, String language) implements ContentBlock {
        public Code {
            text = text == null ? "" : text;
        }

        @Override
        public String blockType() {
            return "code";
        }
    }

    /** 構造化データ。text は data を表示用に整形したもの。 */
    record Json(String text, Object data) implements ContentBlock {
        @Override
        public String blockType() {
            return "json";
        }
    }

    record ToolUse(String toolUseId, String name, Map<String, Object> input) implements ContentBlock {
        public ToolUse {
            Objects.requireNonNull(name, "name");
            input = input == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(input));
        }

        @Override
        public String blockType() {
            return "tool_use";
        }
    }

    record ToolResult(String toolUseId, String name, List<ContentBlock> content, boolean error)
            implements ContentBlock {
        public ToolResult {
            content = content == null ? List.of() : List.copyOf(content);
        }

        @Override
        public String blockType() {
            return "tool_result";
        }
    }

    record Reasoning(String text) implements ContentBlock {
        @Override
        public String blockType() {
            return "reasoning";
        }
    }

    record UserAction(String action, String actor, String text) implements ContentBlock {
        @Override
        public String blockType() {
            return "user_action";
        }
    }

    record SystemEvent(String event, String source, String text) implements ContentBlock {
        @Override
        public String blockType() {
            return "system_event";
        }
    }

    record StateChange(String entity, String field, Object from, Object to, String text) implements ContentBlock {
        @Override
        public String blockType() {
            return "state_change";
        }
    }
}
