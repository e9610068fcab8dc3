package io.github.hide212131.langchain4j.context.runtime.structure;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** メッセージの発話者。 */
public enum MessageRole {
    USER("user"),
    ASSISTANT("assistant"),
    SYSTEM("system"),
    TOOL("tool"),
    EVENT("event");

    private final String value;

    MessageRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Unknown or missing roles resolve to {@link #USER}. */
    public static MessageRole from(Object raw) {
        if (raw instanceof MessageRole role) {
            return role;
        }
        if (raw == null) {
            return USER;
        }
        String normalized = raw.toString().trim().toLowerCase(Locale.ROOT);
        for (MessageRole role : values()) {
            if (role.value.equals(normalized)) {
                return role;
            }
        }
        return USER;
    }
}
