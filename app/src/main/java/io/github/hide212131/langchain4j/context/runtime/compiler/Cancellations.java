package io.github.hide212131.langchain4j.context.runtime.compiler;

import java.util.concurrent.CancellationException;

/** Recognizes failures that only mean "the work was cancelled". */
final class Cancellations {

    private Cancellations() {
    }

    /** {@code true} when a {@link CancellationException} or {@link InterruptedException} is in the cause chain. */
    static boolean isCancellation(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof CancellationException || current instanceof InterruptedException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }
}
