package io.github.hide212131.langchain4j.context.runtime.structure;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Where ephemeral content is placed relative to the persisted conversation.
 */
public enum EphemeralPosition {
    START("start"),
    END("end"),
    BEFORE_USER("before-user"),
    AFTER_SYSTEM("after-system"),
    FLOW("flow");

    private final String value;

    EphemeralPosition(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Missing or unknown values resolve to {@link #END}. */
    public static EphemeralPosition from(Object raw) {
        if (raw instanceof EphemeralPosition position) {
            return position;
        }
        if (raw == null) {
            return END;
        }
        String normalized = raw.toString().trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (EphemeralPosition position : values()) {
            if (position.value.equals(normalized)) {
                return position;
            }
        }
        return END;
    }
}
