package io.github.hide212131.langchain4j.context.runtime.tree;

/** YAML ツリー文書を要素に変換できなかったことを表す例外。 */
public final class ElementTreeParseException extends RuntimeException {

    public ElementTreeParseException(String message) {
        super(message);
    }

    public ElementTreeParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
