package io.github.hide212131.langchain4j.context.runtime.instrument;

import io.github.hide212131.langchain4j.context.runtime.component.Component;
import java.util.Objects;

/**
 * Chooses which components a middleware applies to. Resolution order is class, tag, name, then global.
 */
public sealed interface ComponentSelector
        permits ComponentSelector.ByClass, ComponentSelector.ByTag, ComponentSelector.ByName,
        ComponentSelector.Global {

    boolean matches(Component component);

    int priority();

    static ComponentSelector byClass(Class<? extends Component> type) {
        return new ByClass(type);
    }

    static ComponentSelector byTag(String tag) {
        return new ByTag(tag);
    }

    static ComponentSelector byName(String name) {
        return new ByName(name);
    }

    static ComponentSelector global() {
        return Global.INSTANCE;
    }

    record ByClass(Class<? extends Component> type) implements ComponentSelector {
        public ByClass {
            Objects.requireNonNull(type, "type");
        }

        @Override
        public boolean matches(Component component) {
            return type.isInstance(component);
        }

        @Override
        public int priority() {
            return 0;
        }
    }

    record ByTag(String tag) implements ComponentSelector {
        public ByTag {
            Objects.requireNonNull(tag, "tag");
        }

        @Override
        public boolean matches(Component component) {
            return component.tags().contains(tag);
        }

        @Override
        public int priority() {
            return 1;
        }
    }

    record ByName(String name) implements ComponentSelector {
        public ByName {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public boolean matches(Component component) {
            return name.equals(component.name());
        }

        @Override
        public int priority() {
            return 2;
        }
    }

    enum Global implements ComponentSelector {
        INSTANCE;

        @Override
        public boolean matches(Component component) {
            return true;
        }

        @Override
        public int priority() {
            return 3;
        }
    }
}
