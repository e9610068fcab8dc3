package io.github.hide212131.langchain4j.context.runtime.element;

import io.github.hide212131.langchain4j.context.runtime.component.Component;
import io.github.hide212131.langchain4j.context.runtime.component.ComponentType;
import io.github.hide212131.langchain4j.context.runtime.component.FunctionComponent;
import java.util.Objects;

/**
 * What an {@link Element} instantiates. Two elements are considered the same component when their types
 * are equal; the reconciler keeps the fiber (and its instance) alive across ticks only in that case.
 */
public sealed interface ElementType
        permits ElementType.HostTag, ElementType.FunctionType, ElementType.ClassType,
        ElementType.Fragment, ElementType.PrebuiltInstance {

    String displayName();

    /** 文字列タグで識別されるホスト要素。 */
    record HostTag(String name) implements ElementType {
        public HostTag {
            Objects.requireNonNull(name, "name");
            if (name.isBlank()) {
                throw new IllegalArgumentException("host tag name must not be blank");
            }
        }

        @Override
        public String displayName() {
            return name;
        }
    }

    /**
     * Function component. Equality is reference equality of the function object, so keep function
     * components in constants rather than creating them per render.
     */
    record FunctionType(FunctionComponent component) implements ElementType {
        public FunctionType {
            Objects.requireNonNull(component, "component");
        }

        @Override
        public String displayName() {
            return component.displayName();
        }
    }

    /** インスタンス化されるコンポーネント型。 */
    record ClassType(ComponentType<?> componentType) implements ElementType {
        public ClassType {
            Objects.requireNonNull(componentType, "componentType");
        }

        @Override
        public String displayName() {
            return componentType.name();
        }
    }

    /** Groups children without contributing a node of its own. */
    enum Fragment implements ElementType {
        INSTANCE;

        @Override
        public String displayName() {
            return "Fragment";
        }
    }

    /** 生成済みのインスタンスをそのまま要素として使う。 */
    record PrebuiltInstance(Component instance) implements ElementType {
        public PrebuiltInstance {
            Objects.requireNonNull(instance, "instance");
        }

        @Override
        public String displayName() {
            return instance.name();
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof PrebuiltInstance prebuilt && prebuilt.instance == instance;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(instance);
        }
    }
}
