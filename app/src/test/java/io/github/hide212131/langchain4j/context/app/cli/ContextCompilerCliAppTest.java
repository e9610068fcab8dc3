package io.github.hide212131.langchain4j.context.app.cli;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hide212131.langchain4j.context.infra.config.CompilerConfig;
import io.github.hide212131.langchain4j.context.infra.observability.ObservabilityConfig;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class ContextCompilerCliAppTest {

    private static final String TREE = "src/test/resources/trees/basic-agent.yaml";

    private CommandLine commandLine;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        commandLine = ContextCompilerCliApp.commandLineInstance(CompilerConfig::defaults,
                ObservabilityConfig::disabled);
        out = new StringWriter();
        err = new StringWriter();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @Test
    void compileCommandPrintsJson() throws Exception {
        int exitCode = commandLine.execute("compile", "--file", TREE);

        assertThat(exitCode).isZero();
        JsonNode json = new ObjectMapper().readTree(out.toString());
        assertThat(json.at("/sections/intro/title").asText()).isEqualTo("Role");
        assertThat(json.at("/timelineEntries").size()).isEqualTo(2);
        assertThat(json.at("/tools/0/name").asText()).isEqualTo("search");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void compileCommandPrintsMarkdown() {
        int exitCode = commandLine.execute("compile", "--file", TREE, "--format", "markdown");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo("""
                ## System

                ### Role

                You are a careful research assistant.

                Cite every source.

                Answer in English.

                ## Timeline

                **user**: What is a fiber?

                **assistant**: A persistent node of the reconciled tree.

                ## Tools

                - search: Search the knowledge base
                """);
    }

    @Test
    void compileCommandWithMissingFile(@TempDir Path tempDir) {
        int exitCode = commandLine.execute("compile", "--file", tempDir.resolve("nope.yaml").toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).startsWith("Error: ").contains("nope.yaml");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void compileCommandWithInvalidTree(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("broken.yaml");
        Files.writeString(file, "tree:\n  props: {}\n");

        int exitCode = commandLine.execute("compile", "--file", file.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("type");
    }

    @Test
    void compileCommandRequiresFile() {
        int exitCode = commandLine.execute("compile");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("--file");
    }

    @Test
    void compileCommandAcceptsIterationOverride() {
        int exitCode = commandLine.execute("compile", "--file", TREE, "--max-iterations", "1",
                "--track-mutations");

        assertThat(exitCode).isZero();
        assertThat(err.toString()).doesNotContain("did not stabilize");
    }
}
