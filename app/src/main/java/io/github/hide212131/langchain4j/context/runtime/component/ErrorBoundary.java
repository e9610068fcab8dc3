package io.github.hide212131.langchain4j.context.runtime.component;

import io.github.hide212131.langchain4j.context.runtime.com.ContextObjectModel;

/**
 * Component that wants to see engine errors. {@code state.error()} describes the failure.
 */
public interface ErrorBoundary extends Component {

    /** Returns {@code null} to leave the error to other handlers. */
    RecoveryAction onError(ContextObjectModel com, TickState state);
}
