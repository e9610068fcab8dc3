package io.github.hide212131.langchain4j.context.runtime.component;

import io.github.hide212131.langchain4j.context.runtime.com.ContextObjectModel;
import io.github.hide212131.langchain4j.context.runtime.element.Element;
import io.github.hide212131.langchain4j.context.runtime.element.Props;
import java.util.Objects;

/**
 * Stateless render function. State lives in hooks, see
 * {@link io.github.hide212131.langchain4j.context.runtime.hook.Hooks}.
 */
@FunctionalInterface
public interface FunctionComponent {

    Element render(Props props, ContextObjectModel com, TickState state);

    default String displayName() {
        return "FunctionComponent";
    }

    /** 表示名付きの関数コンポーネントを作る。 */
    static FunctionComponent named(String name, FunctionComponent body) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
        return new FunctionComponent() {
            @Override
            public Element render(Props props, ContextObjectModel com, TickState state) {
                return body.render(props, com, state);
            }

            @Override
            public String displayName() {
                return name;
            }
        };
    }

    /** Named component flagged as {@link TerminalComponent}. */
    static FunctionComponent terminal(String name, FunctionComponent body) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
        return new TerminalComponent() {
            @Override
            public Element render(Props props, ContextObjectModel com, TickState state) {
                return body.render(props, com, state);
            }

            @Override
            public String displayName() {
                return name;
            }
        };
    }
}
