package io.github.hide212131.langchain4j.context.infra.config;

/**
 * コンパイラの実行設定。
 *
 * @param maxIterations  stabilize ループの上限回数
 * @param trackMutations afterCompile 中の COM 変更を検出して警告するか
 * @param development    開発モード。未指定時は trackMutations の既定値になる
 */
public record CompilerConfig(int maxIterations, boolean trackMutations, boolean development) {

    public static final int DEFAULT_MAX_ITERATIONS = 10;

    public CompilerConfig {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1: " + maxIterations);
        }
    }

    public static CompilerConfig defaults() {
        return new CompilerConfig(DEFAULT_MAX_ITERATIONS, false, false);
    }

    public CompilerConfig withMaxIterations(int newMaxIterations) {
        return new CompilerConfig(newMaxIterations, trackMutations, development);
    }

    public CompilerConfig withTrackMutations(boolean newTrackMutations) {
        return new CompilerConfig(maxIterations, newTrackMutations, development);
    }
}
