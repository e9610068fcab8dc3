package io.github.hide212131.langchain4j.context.app.cli;

import io.github.hide212131.langchain4j.context.infra.config.CompilerConfig;
import io.github.hide212131.langchain4j.context.infra.config.CompilerConfigLoader;
import io.github.hide212131.langchain4j.context.infra.observability.LifecycleTracer;
import io.github.hide212131.langchain4j.context.infra.observability.ObservabilityConfig;
import io.github.hide212131.langchain4j.context.runtime.com.ContextObjectModel;
import io.github.hide212131.langchain4j.context.runtime.component.TickState;
import io.github.hide212131.langchain4j.context.runtime.compiler.FiberCompiler;
import io.github.hide212131.langchain4j.context.runtime.compiler.StabilizationOptions;
import io.github.hide212131.langchain4j.context.runtime.compiler.StabilizationResult;
import io.github.hide212131.langchain4j.context.runtime.instrument.ComponentHookRegistry;
import io.github.hide212131.langchain4j.context.runtime.instrument.TracingComponentMiddleware;
import io.github.hide212131.langchain4j.context.runtime.render.StructureFormatter;
import io.github.hide212131.langchain4j.context.runtime.structure.CompiledStructureJsonWriter;
import io.github.hide212131.langchain4j.context.runtime.tree.ElementTreeLoader;
import io.github.hide212131.langchain4j.context.runtime.tree.ElementTreeParseException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.function.Supplier;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Entry point that wires PicoCLI with the context compiler.
 */
@Command(name = "context-compiler", mixinStandardHelpOptions = true,
        description = "Compile an element tree into the structure sent to the model")
public final class ContextCompilerCliApp implements Runnable {

    public static void main(String[] args) {
        int exitCode = commandLineInstance().execute(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static CommandLine commandLineInstance() {
        return commandLineInstance(() -> new CompilerConfigLoader().load(), ObservabilityConfig::fromEnvironment);
    }

    static CommandLine commandLineInstance(Supplier<CompilerConfig> configSupplier,
            Supplier<ObservabilityConfig> observabilitySupplier) {
        CommandLine cmd = new CommandLine(new ContextCompilerCliApp());
        cmd.addSubcommand("compile", new CompileCommand(new ElementTreeLoader(), configSupplier, observabilitySupplier));
        return cmd;
    }

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    enum OutputFormat {
        json,
        markdown
    }

    @Command(name = "compile", description = "Compile a YAML element tree until it is stable")
    static final class CompileCommand implements Callable<Integer> {

        @Option(names = "--file", required = true, description = "YAML file describing the element tree")
        Path file;

        @Option(names = "--format", defaultValue = "json", description = "Output format: ${COMPLETION-CANDIDATES}")
        OutputFormat format;

        @Option(names = "--max-iterations", description = "Upper bound of compile passes (overrides the environment)")
        Integer maxIterations;

        @Option(names = "--track-mutations", description = "Warn about components that mutate without recompiling")
        boolean trackMutations;

        @Spec
        CommandSpec commandSpec;

        private final ElementTreeLoader loader;
        private final Supplier<CompilerConfig> configSupplier;
        private final Supplier<ObservabilityConfig> observabilitySupplier;

        CompileCommand(ElementTreeLoader loader, Supplier<CompilerConfig> configSupplier,
                Supplier<ObservabilityConfig> observabilitySupplier) {
            this.loader = loader;
            this.configSupplier = configSupplier;
            this.observabilitySupplier = observabilitySupplier;
        }

        @Override
        public Integer call() {
            PrintWriter out = commandSpec.commandLine().getOut();
            PrintWriter err = commandSpec.commandLine().getErr();
            ElementTreeLoader.LoadResult loaded;
            try {
                loaded = loader.load(file);
            } catch (ElementTreeParseException ex) {
                err.println("Error: " + ex.getMessage());
                return 2;
            }
            CompilerConfig config = configSupplier.get();
            if (maxIterations != null) {
                config = config.withMaxIterations(maxIterations);
            }
            if (trackMutations) {
                config = config.withTrackMutations(true);
            }

            ObservabilityConfig observability = observabilitySupplier.get();
            ComponentHookRegistry hooks = observability.isEnabled()
                    ? TracingComponentMiddleware.registryFor(LifecycleTracer.from(observability))
                    : new ComponentHookRegistry();

            ContextObjectModel com = new ContextObjectModel();
            loaded.tools().forEach(com::addTool);
            FiberCompiler compiler = new FiberCompiler(com, hooks);
            StabilizationResult result = compiler.compileUntilStable(loaded.root(), TickState.initial(),
                    StabilizationOptions.from(config));
            compiler.notifyComplete(result.compiled());
            compiler.unmount();

            if (result.forcedStable()) {
                err.println("Warning: compilation did not stabilize after " + result.iterations() + " iterations");
                result.recompileReasons().forEach(reason -> err.println("  - " + reason));
            }
            result.mutationWarnings().forEach(warning -> err.println("Warning: " + warning));

            if (format == OutputFormat.markdown) {
                out.print(new StructureFormatter().format(result.compiled()));
            } else {
                out.println(new CompiledStructureJsonWriter().write(result.compiled()));
            }
            out.flush();
            return 0;
        }
    }
}
