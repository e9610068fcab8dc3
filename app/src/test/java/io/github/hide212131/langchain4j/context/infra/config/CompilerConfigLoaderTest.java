package io.github.hide212131.langchain4j.context.infra.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.cdimascio.dotenv.Dotenv;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompilerConfigLoaderTest {

    private static Dotenv emptyDotenv(Path dir) {
        return Dotenv.configure().directory(dir.toString()).ignoreIfMissing().ignoreIfMalformed().load();
    }

    @Test
    @DisplayName("環境変数が空ならデフォルト値を返す")
    void defaultsWhenNothingConfigured(@TempDir Path tempDir) {
        CompilerConfigLoader loader = new CompilerConfigLoader(Map.of(), emptyDotenv(tempDir));

        CompilerConfig config = loader.load();

        assertThat(config.maxIterations()).isEqualTo(CompilerConfig.DEFAULT_MAX_ITERATIONS);
        assertThat(config.trackMutations()).isFalse();
        assertThat(config.development()).isFalse();
    }

    @Test
    @DisplayName("development モードでは未指定の変更追跡が有効になる")
    void developmentModeEnablesTracking(@TempDir Path tempDir) {
        CompilerConfigLoader loader = new CompilerConfigLoader(
                Map.of(CompilerConfigLoader.ENV_MODE, "Development"), emptyDotenv(tempDir));

        CompilerConfig config = loader.load();

        assertThat(config.development()).isTrue();
        assertThat(config.trackMutations()).isTrue();
    }

    @Test
    @DisplayName("明示した変更追跡の指定は development モードより優先される")
    void explicitTrackingWins(@TempDir Path tempDir) {
        CompilerConfigLoader loader = new CompilerConfigLoader(
                Map.of(CompilerConfigLoader.ENV_MODE, "development",
                        CompilerConfigLoader.ENV_TRACK_MUTATIONS, "false"),
                emptyDotenv(tempDir));

        assertThat(loader.load().trackMutations()).isFalse();
    }

    @Test
    @DisplayName("整数でない上限値は変数名を含む例外になる")
    void invalidMaxIterations(@TempDir Path tempDir) {
        CompilerConfigLoader loader = new CompilerConfigLoader(
                Map.of(CompilerConfigLoader.ENV_MAX_ITERATIONS, "many"), emptyDotenv(tempDir));

        assertThatThrownBy(loader::load)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(CompilerConfigLoader.ENV_MAX_ITERATIONS);
    }

    @Test
    @DisplayName("1 未満の上限値は拒否する")
    void nonPositiveMaxIterations(@TempDir Path tempDir) {
        CompilerConfigLoader loader = new CompilerConfigLoader(
                Map.of(CompilerConfigLoader.ENV_MAX_ITERATIONS, "0"), emptyDotenv(tempDir));

        assertThatThrownBy(loader::load)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("1 以上");
    }

    @Test
    @DisplayName("環境変数が優先され、存在しない場合のみ .env を読む")
    void preferEnvironmentOverDotenv(@TempDir Path tempDir) throws IOException {
        Files.writeString(
                tempDir.resolve(".env"),
                """
                CONTEXT_COMPILER_MAX_ITERATIONS=4
                CONTEXT_COMPILER_TRACK_MUTATIONS=true
                """,
                StandardCharsets.UTF_8);
        Dotenv dotenv = Dotenv.configure().directory(tempDir.toString()).load();

        CompilerConfig fromDotenv = new CompilerConfigLoader(Map.of(), dotenv).load();
        CompilerConfig fromEnvironment = new CompilerConfigLoader(
                Map.of(CompilerConfigLoader.ENV_MAX_ITERATIONS, "7"), dotenv).load();

        assertThat(fromDotenv.maxIterations()).isEqualTo(4);
        assertThat(fromDotenv.trackMutations()).isTrue();
        assertThat(fromEnvironment.maxIterations()).isEqualTo(7);
        assertThat(fromEnvironment.trackMutations()).isTrue();
    }

    @Test
    @DisplayName("CompilerConfig は 1 未満の上限値を受け付けない")
    void configRejectsInvalidMaxIterations() {
        assertThatThrownBy(() -> CompilerConfig.defaults().withMaxIterations(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
