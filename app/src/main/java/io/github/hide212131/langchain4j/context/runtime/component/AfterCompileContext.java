package io.github.hide212131.langchain4j.context.runtime.component;

/**
 * Position inside the stabilize loop.
 *
 * @param iteration     0-based index of the compile pass that just finished
 * @param maxIterations upper bound of the loop
 */
public record AfterCompileContext(int iteration, int maxIterations) {

    public AfterCompileContext {
        if (iteration < 0 || maxIterations < 1) {
            throw new IllegalArgumentException("invalid iteration %d of %d".formatted(iteration, maxIterations));
        }
    }

    public boolean isLastIteration() {
        return iteration + 1 >= maxIterations;
    }
}
