package io.github.hide212131.langchain4j.context.runtime.component;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/** 実行中のエージェントへ外部から届くメッセージ。 */
public record ExecutionMessage(String id, String type, Object content, Instant timestamp) {

    public ExecutionMessage {
        id = id == null || id.isBlank() ? UUID.randomUUID().toString() : id;
        Objects.requireNonNull(type, "type");
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static ExecutionMessage of(String type, Object content) {
        return new ExecutionMessage(null, type, content, null);
    }
}
