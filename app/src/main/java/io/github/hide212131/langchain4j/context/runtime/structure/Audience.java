package io.github.hide212131.langchain4j.context.runtime.structure;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** セクションの想定読者。 */
public enum Audience {
    MODEL,
    HUMAN,
    SYSTEM;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Audience from(Object raw) {
        if (raw instanceof Audience audience) {
            return audience;
        }
        if (raw == null) {
            return null;
        }
        String normalized = raw.toString().trim().toUpperCase(Locale.ROOT);
        for (Audience audience : values()) {
            if (audience.name().equals(normalized)) {
                return audience;
            }
        }
        return null;
    }
}
