package io.github.hide212131.langchain4j.context.runtime.element;

import io.github.hide212131.langchain4j.context.runtime.component.Component;
import io.github.hide212131.langchain4j.context.runtime.component.ComponentType;
import io.github.hide212131.langchain4j.context.runtime.component.FunctionComponent;
import java.util.Arrays;

/**
 * Factory methods for building element trees in code.
 */
public final class Elements {

    private Elements() {
    }

    public static Element create(ElementType type, Props props, Object... children) {
        Props base = props == null ? Props.empty() : props;
        if (children != null && children.length > 0) {
            base = base.with(Props.CHILDREN, Arrays.asList(children));
        }
        return new Element(type, base);
    }

    public static Element create(FunctionComponent component, Props props, Object... children) {
        return create(new ElementType.FunctionType(component), props, children);
    }

    public static Element create(ComponentType<?> componentType, Props props, Object... children) {
        return create(new ElementType.ClassType(componentType), props, children);
    }

    public static Element create(ComponentType<?> componentType) {
        return create(componentType, Props.empty());
    }

    public static Element create(FunctionComponent component) {
        return create(component, Props.empty());
    }

    public static Element instance(Component component, Props props) {
        return create(new ElementType.PrebuiltInstance(component), props);
    }

    public static Element host(String tag, Props props, Object... children) {
        return create(new ElementType.HostTag(tag), props, children);
    }

    public static Element fragment(Object... children) {
        return create(ElementType.Fragment.INSTANCE, Props.empty(), children);
    }
}
