package io.github.hide212131.langchain4j.context.runtime.compiler;

import io.github.hide212131.langchain4j.context.infra.config.CompilerConfig;

/**
 * Settings of one {@link FiberCompiler#compileUntilStable} call.
 *
 * @param maxIterations  upper bound of compile passes, at least 1
 * @param trackMutations warn about components that change the object model without asking for a recompile
 */
public record StabilizationOptions(int maxIterations, boolean trackMutations) {

    public StabilizationOptions {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be >= 1: " + maxIterations);
        }
    }

    public static StabilizationOptions defaults() {
        return new StabilizationOptions(CompilerConfig.DEFAULT_MAX_ITERATIONS, false);
    }

    public static StabilizationOptions from(CompilerConfig config) {
        return new StabilizationOptions(config.maxIterations(), config.trackMutations());
    }
}
