package io.github.hide212131.langchain4j.context.runtime.component;

import java.util.Map;
import java.util.Objects;

/** エラーハンドラに渡されるエラー情報。 */
public record EngineError(Throwable error, ErrorPhase phase, boolean recoverable, Map<String, Object> context) {

    public EngineError {
        Objects.requireNonNull(error, "error");
        Objects.requireNonNull(phase, "phase");
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    public EngineError(Throwable error, ErrorPhase phase, boolean recoverable) {
        this(error, phase, recoverable, Map.of());
    }
}
