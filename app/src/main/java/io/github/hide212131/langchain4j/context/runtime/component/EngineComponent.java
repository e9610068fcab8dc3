package io.github.hide212131.langchain4j.context.runtime.component;

import io.github.hide212131.langchain4j.context.runtime.element.Props;
import io.github.hide212131.langchain4j.context.runtime.signal.PropBindings;
import io.github.hide212131.langchain4j.context.runtime.signal.Signal;
import java.util.Objects;

/**
 * Convenience base class holding props and a signal table.
 *
 * <pre>{@code
 * final class Greeting extends EngineComponent {
 *     private final Signal<String> name = bindProp("name", String.class, "world");
 *
 *     public Element render(ContextObjectModel com, TickState state) {
 *         return Primitives.section("greeting", "Hello " + name.get());
 *     }
 * }
 * }</pre>
 */
public abstract class EngineComponent implements Component {

    private final PropBindings propBindings = new PropBindings();
    private Props props;

    protected EngineComponent() {
        this(Props.empty());
    }

    protected EngineComponent(Props props) {
        this.props = props == null ? Props.empty() : props;
    }

    @Override
    public Props props() {
        return props;
    }

    @Override
    public void updateProps(Props props) {
        this.props = Objects.requireNonNull(props, "props");
    }

    @Override
    public PropBindings propBindings() {
        return propBindings;
    }

    /** prop と同期するシグナルを登録する。 */
    protected <T> Signal<T> bindProp(String propKey, Class<T> type, T defaultValue) {
        return propBindings.bind(propKey, type, defaultValue);
    }

    /** インスタンスが所有するシグナルを作る。アンマウント時に破棄される。 */
    protected <T> Signal<T> signal(T initialValue) {
        return propBindings.own(new Signal<>(initialValue));
    }
}
