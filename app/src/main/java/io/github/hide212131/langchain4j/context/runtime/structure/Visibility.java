package io.github.hide212131.langchain4j.context.runtime.structure;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Who may see a section or entry. */
public enum Visibility {
    MODEL,
    OBSERVER,
    LOG;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Returns {@code null} for missing or unknown values. */
    public static Visibility from(Object raw) {
        if (raw instanceof Visibility visibility) {
            return visibility;
        }
        if (raw == null) {
            return null;
        }
        String normalized = raw.toString().trim().toUpperCase(Locale.ROOT);
        for (Visibility visibility : values()) {
            if (visibility.name().equals(normalized)) {
                return visibility;
            }
        }
        return null;
    }
}
