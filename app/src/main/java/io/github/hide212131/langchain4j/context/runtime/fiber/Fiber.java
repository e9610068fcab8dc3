package io.github.hide212131.langchain4j.context.runtime.fiber;

import io.github.hide212131.langchain4j.context.runtime.component.Component;
import io.github.hide212131.langchain4j.context.runtime.element.Element;
import io.github.hide212131.langchain4j.context.runtime.element.ElementType;
import io.github.hide212131.langchain4j.context.runtime.element.Props;
import io.github.hide212131.langchain4j.context.runtime.hook.HookList;
import java.util.List;
import java.util.Objects;

/**
 * Persistent node of the reconciled tree. Parent and children are arena ids, never object references.
 * Only the reconciler mutates a fiber.
 */
public final class Fiber {

    private final int id;
    private final ElementType type;
    private Props props;
    private String key;
    private String ref;
    private Component instance;
    private HookList hooks;
    private int parent = FiberArena.NO_FIBER;
    private List<Integer> children = List.of();

    Fiber(int id, ElementType type, Props props, String key) {
        this.id = id;
        this.type = Objects.requireNonNull(type, "type");
        this.props = props == null ? Props.empty() : props;
        this.key = key;
    }

    public int id() {
        return id;
    }

    public ElementType type() {
        return type;
    }

    public Props props() {
        return props;
    }

    public void setProps(Props props) {
        this.props = Objects.requireNonNull(props, "props");
    }

    public String key() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
    }

    /** ref 名。インスタンスを COM に公開している場合のみ非 null。 */
    public String ref() {
        return ref;
    }

    public void setRef(String ref) {
        this.ref = ref;
    }

    public Component instance() {
        return instance;
    }

    public void setInstance(Component instance) {
        this.instance = instance;
    }

    public HookList hooks() {
        return hooks;
    }

    public void setHooks(HookList hooks) {
        this.hooks = hooks;
    }

    public int parent() {
        return parent;
    }

    public void setParent(int parent) {
        this.parent = parent;
    }

    public List<Integer> children() {
        return children;
    }

    public void setChildren(List<Integer> children) {
        this.children = List.copyOf(children);
    }

    public boolean isHost(String tag) {
        return type instanceof ElementType.HostTag host && host.name().equals(tag);
    }

    /** ファイバーを要素として見直したもの。コンテンツブロック変換に使う。 */
    public Element asElement() {
        return new Element(type, props, key);
    }

    @Override
    public String toString() {
        return "Fiber[" + id + " " + type.displayName() + (key == null ? "" : " key=" + key) + "]";
    }
}
