package io.github.hide212131.langchain4j.context.infra.config;

import io.github.cdimascio.dotenv.Dotenv;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 環境変数を優先し、未設定の場合のみ .env をフォールバックしてコンパイラ設定を解決する。
 */
public final class CompilerConfigLoader {

    static final String ENV_MAX_ITERATIONS = "CONTEXT_COMPILER_MAX_ITERATIONS";
    static final String ENV_TRACK_MUTATIONS = "CONTEXT_COMPILER_TRACK_MUTATIONS";
    static final String ENV_MODE = "CONTEXT_COMPILER_ENV";

    private final Map<String, String> environment;
    private final Dotenv dotenv;

    public CompilerConfigLoader() {
        this(System.getenv(), Dotenv.configure().ignoreIfMalformed().ignoreIfMissing().load());
    }

    CompilerConfigLoader(Map<String, String> environment, Dotenv dotenv) {
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
        this.dotenv = Objects.requireNonNull(dotenv, "dotenv");
    }

    public CompilerConfig load() {
        boolean development = "development".equals(lower(trimToNull(resolveWithPriority(ENV_MODE))));
        int maxIterations = parseMaxIterations(trimToNull(resolveWithPriority(ENV_MAX_ITERATIONS)));
        String trackValue = trimToNull(resolveWithPriority(ENV_TRACK_MUTATIONS));
        boolean trackMutations = trackValue == null ? development : Boolean.parseBoolean(trackValue);
        return new CompilerConfig(maxIterations, trackMutations, development);
    }

    private int parseMaxIterations(String value) {
        if (value == null) {
            return CompilerConfig.DEFAULT_MAX_ITERATIONS;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException(ENV_MAX_ITERATIONS + " は整数で指定してください: " + value, e);
        }
        if (parsed < 1) {
            throw new IllegalStateException(ENV_MAX_ITERATIONS + " は 1 以上で指定してください: " + value);
        }
        return parsed;
    }

    private String resolveWithPriority(String key) {
        if (environment.containsKey(key)) {
            return environment.get(key);
        }
        return dotenv.get(key);
    }

    private static String lower(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
