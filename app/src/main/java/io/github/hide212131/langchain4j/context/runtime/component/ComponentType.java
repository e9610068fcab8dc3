package io.github.hide212131.langchain4j.context.runtime.component;

import io.github.hide212131.langchain4j.context.runtime.com.ExecutableTool;
import io.github.hide212131.langchain4j.context.runtime.element.Props;
import java.util.Objects;
import java.util.function.Function;

/**
 * Factory for a component class, optionally carrying a static tool that is registered on mount and
 * removed on unmount. Two types are equal when they build the same class.
 */
public final class ComponentType<C extends Component> {

    private final Class<C> componentClass;
    private final Function<Props, C> factory;
    private final ExecutableTool staticTool;

    private ComponentType(Class<C> componentClass, Function<Props, C> factory, ExecutableTool staticTool) {
        this.componentClass = Objects.requireNonNull(componentClass, "componentClass");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.staticTool = staticTool;
    }

    public static <C extends Component> ComponentType<C> of(Class<C> componentClass, Function<Props, C> factory) {
        return new ComponentType<>(componentClass, factory, null);
    }

    public ComponentType<C> withTool(ExecutableTool tool) {
        return new ComponentType<>(componentClass, factory, Objects.requireNonNull(tool, "tool"));
    }

    public C create(Props props) {
        C instance = factory.apply(props == null ? Props.empty() : props);
        if (instance == null) {
            throw new IllegalStateException("factory of " + name() + " returned null");
        }
        return instance;
    }

    public Class<C> componentClass() {
        return componentClass;
    }

    /** Static tool or {@code null}. */
    public ExecutableTool staticTool() {
        return staticTool;
    }

    public String name() {
        return componentClass.getSimpleName();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof ComponentType<?> type && type.componentClass.equals(componentClass);
    }

    @Override
    public int hashCode() {
        return componentClass.hashCode();
    }

    @Override
    public String toString() {
        return "ComponentType[" + componentClass.getName() + "]";
    }
}
