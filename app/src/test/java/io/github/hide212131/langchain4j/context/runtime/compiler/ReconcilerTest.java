package io.github.hide212131.langchain4j.context.runtime.compiler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.hide212131.langchain4j.context.runtime.com.ContextObjectModel;
import io.github.hide212131.langchain4j.context.runtime.com.ExecutableTool;
import io.github.hide212131.langchain4j.context.runtime.component.Component;
import io.github.hide212131.langchain4j.context.runtime.component.ComponentType;
import io.github.hide212131.langchain4j.context.runtime.component.EngineComponent;
import io.github.hide212131.langchain4j.context.runtime.component.FunctionComponent;
import io.github.hide212131.langchain4j.context.runtime.component.TickState;
import io.github.hide212131.langchain4j.context.runtime.compiler.CompilerFixtures.Recording;
import io.github.hide212131.langchain4j.context.runtime.element.Element;
import io.github.hide212131.langchain4j.context.runtime.element.Elements;
import io.github.hide212131.langchain4j.context.runtime.element.Props;
import io.github.hide212131.langchain4j.context.runtime.fiber.Fiber;
import io.github.hide212131.langchain4j.context.runtime.primitives.Primitives;
import io.github.hide212131.langchain4j.context.runtime.structure.CompiledStructure;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ReconcilerTest {

    private static final FunctionComponent BOX = FunctionComponent.terminal("Box",
            (props, com, state) -> Elements.create(ReconcilerTest.BOX, props));

    private final List<String> log = new ArrayList<>();
    private final ContextObjectModel com = new ContextObjectModel();
    private final FiberCompiler compiler = new FiberCompiler(com);

    /** Logs mount and unmount under a fixed label. */
    static final class Marker extends EngineComponent {

        private final List<String> log;

        Marker(List<String> log) {
            this.log = log;
        }

        @Override
        public void onMount(ContextObjectModel com) {
            log.add("marker:mount");
        }

        @Override
        public void onUnmount(ContextObjectModel com) {
            log.add("marker:unmount");
        }
    }

    private ComponentType<Marker> markerType() {
        return ComponentType.of(Marker.class, props -> new Marker(log));
    }

    private Component instanceWithKey(String key) {
        return compiler.findFiberByKey(key).map(Fiber::instance).orElseThrow();
    }

    @Test
    @DisplayName("同じ位置・同じ型の要素はインスタンスを再利用する")
    void instancePersistsAcrossCompiles() {
        compiler.compile(Recording.element(log, "A"), TickState.initial());
        Component first = compiler.rootFiber().orElseThrow().instance();

        compiler.compile(Recording.element(log, "A"), TickState.of(2));
        Component second = compiler.rootFiber().orElseThrow().instance();

        assertThat(second).isSameAs(first);
        assertThat(log).containsExactly("A:mount", "A:render", "A:render");
    }

    @Test
    @DisplayName("[A, B] から [A] にすると B だけがアンマウントされる")
    void removedChildIsUnmounted() {
        // Given: two children
        compiler.compile(Elements.fragment(Recording.element(log, "A"), Recording.element(log, "B")),
                TickState.initial());
        log.clear();

        // When: B disappears
        compiler.compile(Elements.fragment(Recording.element(log, "A")), TickState.of(2));

        // Then: exactly one unmount, for B
        assertThat(log).filteredOn(event -> event.endsWith(":unmount")).containsExactly("B:unmount");
    }

    @Test
    @DisplayName("key を持つ子は位置が変わってもインスタンスを保つ")
    void keyedChildrenFollowTheirKey() {
        ComponentType<Recording> type = Recording.type(log);
        compiler.compile(Elements.fragment(
                Elements.create(type, Props.of("label", "A", Props.KEY, "a")),
                Elements.create(type, Props.of("label", "B", Props.KEY, "b"))), TickState.initial());
        Component a = instanceWithKey("a");
        Component b = instanceWithKey("b");

        compiler.compile(Elements.fragment(
                Elements.create(type, Props.of("label", "B", Props.KEY, "b")),
                Elements.create(type, Props.of("label", "A", Props.KEY, "a"))), TickState.of(2));

        assertThat(instanceWithKey("a")).isSameAs(a);
        assertThat(instanceWithKey("b")).isSameAs(b);
        assertThat(log).noneMatch(event -> event.endsWith(":unmount"));
        List<Fiber> children = compiler.arena().children(compiler.rootFiber().orElseThrow());
        assertThat(children).extracting(Fiber::key).containsExactly("b", "a");
    }

    @Test
    @DisplayName("型が変わると古いファイバーをアンマウントして新しく作る")
    void typeChangeReplacesFiber() {
        compiler.compile(Elements.fragment(Recording.element(log, "A")), TickState.initial());
        Component old = compiler.arena().children(compiler.rootFiber().orElseThrow()).get(0).instance();

        compiler.compile(Elements.fragment(Primitives.section("s", "text")), TickState.of(2));

        Fiber replaced = compiler.arena().children(compiler.rootFiber().orElseThrow()).get(0);
        assertThat(replaced.instance()).isNull();
        assertThat(replaced.isHost(Primitives.SECTION)).isTrue();
        assertThat(old).isNotNull();
        assertThat(log).contains("A:unmount");
    }

    @Test
    @DisplayName("空の props での再調整はインスタンスに直接設定した props を消さない")
    void emptyPropsDoNotBlankInstanceProps() {
        ComponentType<Recording> type = Recording.type(log);
        compiler.compile(Elements.create(type, Props.of("label", "A")), TickState.initial());
        Component instance = compiler.rootFiber().orElseThrow().instance();
        instance.updateProps(instance.props().with("temperature", 0.5));

        compiler.compile(Elements.create(type), TickState.of(2));

        assertThat(compiler.rootFiber().orElseThrow().instance()).isSameAs(instance);
        assertThat(instance.props().get("temperature")).isEqualTo(0.5);
        assertThat(instance.props().getString("label")).isEqualTo("A");
    }

    @Test
    @DisplayName("props に束縛したシグナルは再調整で更新される")
    void boundSignalFollowsProps() {
        compiler.compile(Recording.element(log, "A"), TickState.initial());
        Recording instance = (Recording) compiler.rootFiber().orElseThrow().instance();

        compiler.compile(Recording.element(log, "Z"), TickState.of(2));

        assertThat(instance.label()).isEqualTo("Z");
    }

    @Test
    @DisplayName("ref はマウントで公開され、アンマウントで取り除かれる")
    void refIsPublishedAndRemoved() {
        ComponentType<Recording> type = Recording.type(log);
        compiler.compile(Elements.create(type, Props.of("label", "A", Props.REF, "agent")), TickState.initial());

        assertThat(com.getRef("agent", Recording.class)).isPresent();

        compiler.unmount();

        assertThat(com.getRef("agent", Recording.class)).isEmpty();
        assertThat(compiler.rootFiber()).isEmpty();
        assertThat(compiler.arena().size()).isZero();
    }

    @Test
    @DisplayName("静的ツールはマウントで登録され、アンマウントで解除される")
    void staticToolFollowsMount() {
        ExecutableTool search = CompilerFixtures.tool("search");
        ComponentType<Recording> type = Recording.type(log).withTool(search);

        compiler.compile(Elements.fragment(Elements.create(type, Props.of("label", "A"))), TickState.initial());
        assertThat(com.getTool("search")).contains(search);

        compiler.compile(Elements.fragment(), TickState.of(2));
        assertThat(com.getTool("search")).isEmpty();
    }

    @Test
    @DisplayName("アンマウント時のキャンセル例外は抑止され、それ以外は伝播する")
    void cancellationIsSuppressedOnUnmount() {
        Component cancelled = new Component() {
            @Override
            public void onUnmount(ContextObjectModel com) {
                throw new CancellationException("execution cancelled");
            }
        };
        compiler.compile(Elements.instance(cancelled, Props.empty()), TickState.initial());
        compiler.unmount();
        assertThat(compiler.rootFiber()).isEmpty();

        FiberCompiler other = new FiberCompiler(new ContextObjectModel());
        Component failing = new Component() {
            @Override
            public void onUnmount(ContextObjectModel com) {
                throw new IllegalStateException("disk full");
            }
        };
        other.compile(Elements.instance(failing, Props.empty()), TickState.initial());
        assertThatThrownBy(other::unmount)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("disk full");
    }

    @Test
    @DisplayName("メッセージに abort を含むだけの例外はキャンセル扱いにならない")
    void abortInMessageIsNotCancellation() {
        Component failing = new Component() {
            @Override
            public void onUnmount(ContextObjectModel com) {
                throw new IllegalArgumentException("invalid value for setting 'abortThreshold'");
            }
        };
        compiler.compile(Elements.instance(failing, Props.empty()), TickState.initial());

        assertThatThrownBy(compiler::unmount)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("abortThreshold");
    }

    @Test
    @DisplayName("原因チェーンにキャンセル例外があればアンマウント時に抑止される")
    void wrappedCancellationIsSuppressed() {
        Component interrupted = new Component() {
            @Override
            public void onUnmount(ContextObjectModel com) {
                throw new IllegalStateException("shutdown", new InterruptedException());
            }
        };
        compiler.compile(Elements.instance(interrupted, Props.empty()), TickState.initial());

        compiler.unmount();

        assertThat(compiler.rootFiber()).isEmpty();
    }

    @Test
    @DisplayName("描画が途中で失敗してもファイバーツリーは前の tick のまま残る")
    void failedRenderKeepsPreviousTree() {
        // Given: a tree whose second child fails to render on tick 2
        Component flaky = new Component() {
            @Override
            public Element render(ContextObjectModel com, TickState state) {
                if (state.tick() == 2) {
                    throw new IllegalStateException("boom");
                }
                return null;
            }
        };
        Element flakyElement = Elements.instance(flaky, Props.empty());
        compiler.compile(Elements.fragment(Recording.element(log, "A"), flakyElement), TickState.initial());
        Component a = compiler.arena().children(compiler.rootFiber().orElseThrow()).get(0).instance();
        int liveFibers = compiler.arena().size();
        log.clear();

        // When: the first child changes type and the second child throws
        ComponentType<Marker> marker = markerType().withTool(CompilerFixtures.tool("lookup"));
        assertThatThrownBy(() -> compiler.compile(
                Elements.fragment(Elements.create(marker, Props.empty()), flakyElement), TickState.of(2)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("boom");

        // Then: the replacement is torn down again and A is untouched
        assertThat(log).containsExactly("marker:mount", "marker:unmount");
        assertThat(com.getTool("lookup")).isEmpty();
        assertThat(compiler.arena().size()).isEqualTo(liveFibers);
        assertThat(compiler.arena().children(compiler.rootFiber().orElseThrow()).get(0).instance()).isSameAs(a);

        // And: the next tick runs on the preserved tree
        compiler.notifyTickStart(TickState.of(3));
        compiler.compile(Elements.fragment(Recording.element(log, "A"), flakyElement), TickState.of(3));
        assertThat(log).contains("A:tickStart", "A:render");
        assertThat(log).doesNotContain("A:unmount");
        assertThat(compiler.arena().children(compiler.rootFiber().orElseThrow()).get(0).instance()).isSameAs(a);
    }

    @Test
    @DisplayName("型が変わっても同じ ref は新しいインスタンスを指す")
    void refMovesToReplacement() {
        compiler.compile(Elements.fragment(
                Elements.create(Recording.type(log), Props.of("label", "A", Props.REF, "agent"))),
                TickState.initial());

        compiler.compile(Elements.fragment(
                Elements.create(markerType(), Props.of(Props.REF, "agent"))), TickState.of(2));

        assertThat(log).contains("A:unmount");
        assertThat(com.getRef("agent", Marker.class)).isPresent();
    }

    @Test
    @DisplayName("自分自身を返す終端コンポーネントは子だけを調整する")
    void terminalComponentReconcilesChildren() {
        CompiledStructure compiled = compiler.compile(
                Elements.create(BOX, Props.empty(), Primitives.section("inside", "boxed")), TickState.initial());

        assertThat(compiled.section("inside")).isPresent();
        assertThat(compiled.section("inside").orElseThrow().content()).isEqualTo("boxed");
    }

    @Test
    @DisplayName("null を返すコンポーネントは何も出力しない")
    void nullRenderProducesNothing() {
        Element empty = Elements.instance(new Component() { }, Props.empty());

        CompiledStructure compiled = compiler.compile(empty, TickState.initial());

        assertThat(compiled.sections()).isEmpty();
        assertThat(compiled.systemMessageItems()).isEmpty();
        assertThat(compiler.rootFiber().orElseThrow().children()).isEmpty();
    }
}
