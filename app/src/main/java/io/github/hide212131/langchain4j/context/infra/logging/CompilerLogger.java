package io.github.hide212131.langchain4j.context.infra.logging;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around SLF4J shared by the compiler, the stabilizer and the lifecycle notifications.
 */
public final class CompilerLogger {

    private final Logger logger;

    public CompilerLogger(Class<?> owner) {
        this(LoggerFactory.getLogger(Objects.requireNonNull(owner, "owner")));
    }

    public CompilerLogger(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public void info(String message, Object... args) {
        logger.info(message, args);
    }

    public void debug(String message, Object... args) {
        logger.debug(message, args);
    }

    public void warn(String message, Object... args) {
        logger.warn(message, args);
    }

    public void error(String message, Object... args) {
        logger.error(message, args);
    }

    public boolean isDebugEnabled() {
        return logger.isDebugEnabled();
    }
}
