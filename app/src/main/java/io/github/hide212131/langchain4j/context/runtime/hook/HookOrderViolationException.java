package io.github.hide212131.langchain4j.context.runtime.hook;

/**
 * フックの呼び出し順序や回数が前回のレンダリングと一致しない場合の例外。
 */
public class HookOrderViolationException extends RuntimeException {

    public HookOrderViolationException(String message) {
        super(message);
    }
}
