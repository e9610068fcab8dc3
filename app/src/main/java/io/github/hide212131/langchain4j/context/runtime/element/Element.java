package io.github.hide212131.langchain4j.context.runtime.element;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable description of a node: its type, its props and an optional key.
 */
public record Element(ElementType type, Props props, String key) {

    public Element {
        Objects.requireNonNull(type, "type");
        props = props == null ? Props.empty() : props;
        if (key == null) {
            key = props.key();
        }
    }

    public Element(ElementType type, Props props) {
        this(type, props, null);
    }

    public List<Object> children() {
        return props.children();
    }

    /** 子のうち Element だけを残す。文字列やコンテンツブロックはファイバーにならない。 */
    public List<Element> elementChildren() {
        return normalize(props.children());
    }

    public boolean isHost(String tag) {
        return type instanceof ElementType.HostTag host && host.name().equals(tag);
    }

    public boolean isFragment() {
        return type == ElementType.Fragment.INSTANCE;
    }

    public static List<Element> normalize(List<Object> rawChildren) {
        List<Element> elements = new ArrayList<>();
        for (Object child : rawChildren) {
            if (child instanceof Element element) {
                elements.add(element);
            }
        }
        return List.copyOf(elements);
    }
}
