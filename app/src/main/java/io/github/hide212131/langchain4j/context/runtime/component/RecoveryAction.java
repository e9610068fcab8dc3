package io.github.hide212131.langchain4j.context.runtime.component;

/** エラーハンドラの判断。continue が true なら実行を続ける。 */
public record RecoveryAction(boolean shouldContinue, String recoveryMessage) {

    public static RecoveryAction continueWith(String recoveryMessage) {
        return new RecoveryAction(true, recoveryMessage);
    }

    public static RecoveryAction halt() {
        return new RecoveryAction(false, null);
    }
}
