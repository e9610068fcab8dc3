package io.github.hide212131.langchain4j.context.runtime.compiler;

import io.github.hide212131.langchain4j.context.infra.logging.CompilerLogger;
import io.github.hide212131.langchain4j.context.runtime.com.ContextObjectModel;
import io.github.hide212131.langchain4j.context.runtime.component.AfterCompileContext;
import io.github.hide212131.langchain4j.context.runtime.component.TickState;
import io.github.hide212131.langchain4j.context.runtime.element.Element;
import io.github.hide212131.langchain4j.context.runtime.structure.CompiledStructure;
import java.util.ArrayList;
import java.util.List;

/**
 * Recompiles until no component asks for another pass or the iteration limit is reached.
 */
final class CompileStabilizer {

    private final FiberCompiler compiler;
    private final ContextObjectModel com;
    private final CompilerLogger logger;

    CompileStabilizer(FiberCompiler compiler, ContextObjectModel com, CompilerLogger logger) {
        this.compiler = compiler;
        this.com = com;
        this.logger = logger;
    }

    StabilizationResult run(Element root, TickState state, StabilizationOptions options) {
        int maxIterations = options.maxIterations();
        List<String> reasons = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        CompiledStructure compiled;
        int iterations = 0;
        boolean requested;
        do {
            com.resetRecompileRequest();
            compiled = compiler.compile(root, state);
            warnings.addAll(compiler.notifyAfterCompile(compiled, state,
                    new AfterCompileContext(iterations, maxIterations), options.trackMutations()));
            requested = com.wasRecompileRequested();
            for (String reason : com.getRecompileReasons()) {
                reasons.add("[iteration " + iterations + "] " + reason);
            }
            iterations++;
            if (requested && iterations >= maxIterations) {
                logger.warn("compilation did not stabilize after {} iterations; reasons: {}", maxIterations, reasons);
                break;
            }
        } while (requested);
        boolean forcedStable = requested && iterations >= maxIterations;
        logger.debug("compilation finished after {} iteration(s), forcedStable={}", iterations, forcedStable);
        return new StabilizationResult(compiled, iterations, forcedStable, reasons, warnings);
    }
}
