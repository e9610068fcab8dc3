package io.github.hide212131.langchain4j.context.runtime.fiber;

/**
 * 解放済みまたは存在しないファイバー ID を参照した場合の例外。
 */
public class StaleFiberException extends RuntimeException {

    public StaleFiberException(int fiberId) {
        super("fiber " + fiberId + " is not live");
    }
}
