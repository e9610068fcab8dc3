package io.github.hide212131.langchain4j.context.runtime.compiler;

import io.github.hide212131.langchain4j.context.runtime.structure.CompiledStructure;
import java.util.List;
import java.util.Objects;

/**
 * 安定化ループの結果。
 *
 * @param compiled         最後のパスで収集した構造
 * @param iterations       実行したコンパイルパス数
 * @param forcedStable     上限到達時にまだ再コンパイルが要求されていた場合 true
 * @param recompileReasons {@code [iteration n] reason} 形式で蓄積した理由
 * @param mutationWarnings 変更追跡で検出した警告
 */
public record StabilizationResult(CompiledStructure compiled, int iterations, boolean forcedStable,
        List<String> recompileReasons, List<String> mutationWarnings) {

    public StabilizationResult {
        Objects.requireNonNull(compiled, "compiled");
        recompileReasons = recompileReasons == null ? List.of() : List.copyOf(recompileReasons);
        mutationWarnings = mutationWarnings == null ? List.of() : List.copyOf(mutationWarnings);
    }
}
