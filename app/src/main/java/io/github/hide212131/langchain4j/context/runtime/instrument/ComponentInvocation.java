package io.github.hide212131.langchain4j.context.runtime.instrument;

import io.github.hide212131.langchain4j.context.runtime.component.Component;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** ミドルウェアに渡される呼び出し情報。 */
public record ComponentInvocation(LifecycleMethod method, int fiberId, Component component, List<Object> arguments) {

    public ComponentInvocation {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(component, "component");
        arguments = arguments == null ? List.of() : Collections.unmodifiableList(Arrays.asList(arguments.toArray()));
    }

    public String componentName() {
        return component.name();
    }
}
