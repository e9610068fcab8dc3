package io.github.hide212131.langchain4j.context.runtime.component;

/**
 * Marks a function component whose rendered element is itself a leaf wrapper: the reconciler adopts the
 * children of the returned element directly instead of mounting the returned element again.
 */
public interface TerminalComponent extends FunctionComponent {
}
