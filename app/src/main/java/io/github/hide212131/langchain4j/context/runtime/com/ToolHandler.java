package io.github.hide212131.langchain4j.context.runtime.com;

import dev.langchain4j.agent.tool.ToolExecutionRequest;

/** ツール呼び出しを処理し、モデルへ返す文字列を作る。 */
@FunctionalInterface
public interface ToolHandler {

    String execute(ToolExecutionRequest request);
}
