package io.github.hide212131.langchain4j.context.runtime.compiler;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.hide212131.langchain4j.context.runtime.com.ContextObjectModel;
import io.github.hide212131.langchain4j.context.runtime.component.FunctionComponent;
import io.github.hide212131.langchain4j.context.runtime.component.TickState;
import io.github.hide212131.langchain4j.context.runtime.element.Elements;
import io.github.hide212131.langchain4j.context.runtime.hook.Hooks;
import io.github.hide212131.langchain4j.context.runtime.primitives.Primitives;
import io.github.hide212131.langchain4j.context.runtime.signal.Signal;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FunctionComponentHooksTest {

    private final List<String> log = new ArrayList<>();
    private final ContextObjectModel com = new ContextObjectModel();
    private final FiberCompiler compiler = new FiberCompiler(com);

    private final FunctionComponent counter = FunctionComponent.named("Counter", (props, c, state) -> {
        Signal<Integer> count = Hooks.useState(0);
        Hooks.useEffect(() -> {
            if (count.get() < 2) {
                count.set(count.get() + 1);
            }
            return null;
        }, List.of(count.get()));
        return Primitives.section("count", "count " + count.get());
    });

    @Test
    @DisplayName("effect 内の状態更新で再コンパイルされ、値が落ち着くと安定する")
    void effectDrivenUpdatesStabilize() {
        StabilizationResult result = compiler.compileUntilStable(Elements.create(counter), TickState.initial(),
                StabilizationOptions.defaults());

        assertThat(result.iterations()).isEqualTo(3);
        assertThat(result.forcedStable()).isFalse();
        assertThat(result.recompileReasons()).hasSize(2)
                .allSatisfy(reason -> assertThat(reason).contains("state update in Counter"));
        assertThat(result.compiled().section("count").orElseThrow().content()).isEqualTo("count 2");
    }

    @Test
    @DisplayName("描画中の状態更新は再コンパイルを要求しない")
    void stateUpdateDuringRenderSchedulesNothing() {
        FunctionComponent eager = FunctionComponent.named("Eager", (props, c, state) -> {
            Signal<String> status = Hooks.useState("idle");
            status.set("ready");
            return Primitives.section("status", status.get());
        });

        StabilizationResult result = compiler.compileUntilStable(Elements.create(eager), TickState.initial(),
                StabilizationOptions.defaults());

        assertThat(result.iterations()).isEqualTo(1);
        assertThat(result.compiled().section("status").orElseThrow().content()).isEqualTo("ready");
    }

    @Test
    @DisplayName("useOnMount は初回コミットで一度だけ呼ばれる")
    void onMountRunsOnce() {
        FunctionComponent mounted = FunctionComponent.named("Mounted", (props, c, state) -> {
            Hooks.useOnMount(com -> log.add("mounted"));
            return null;
        });

        compiler.compile(Elements.create(mounted), TickState.initial());
        compiler.compile(Elements.create(mounted), TickState.of(2));
        compiler.compile(Elements.create(mounted), TickState.of(3));

        assertThat(log).containsExactly("mounted");
    }

    @Test
    @DisplayName("アンマウント時に effect のクリーンアップと useOnUnmount が呼ばれる")
    void unmountRunsCleanupAndCallbacks() {
        FunctionComponent watched = FunctionComponent.named("Watched", (props, c, state) -> {
            Hooks.useEffect(() -> {
                log.add("effect");
                return () -> log.add("cleanup");
            }, List.of());
            Hooks.useOnUnmount(com -> log.add("unmounted"));
            return null;
        });
        compiler.compile(Elements.create(watched), TickState.initial());
        compiler.compile(Elements.create(watched), TickState.of(2));

        compiler.unmount();

        assertThat(log).containsExactly("effect", "cleanup", "unmounted");
    }

    @Test
    @DisplayName("useComState は COM の状態と同期する")
    void comStateIsShared() {
        FunctionComponent writer = FunctionComponent.named("Writer", (props, c, state) -> {
            Signal<String> mode = Hooks.useComState("mode", "draft");
            return Primitives.section("mode", mode.get());
        });

        compiler.compile(Elements.create(writer), TickState.initial());
        assertThat(com.getState("mode")).isEqualTo("draft");

        com.setState("mode", "final");
        assertThat(compiler.compile(Elements.create(writer), TickState.of(2))
                .section("mode").orElseThrow().content()).isEqualTo("final");
    }

    @Test
    @DisplayName("useTickStart と useAfterCompile はコンパイラから呼ばれる")
    void tickAndAfterCompileHooksRun() {
        FunctionComponent observer = FunctionComponent.named("Observer", (props, c, state) -> {
            Hooks.useTickStart((com, tickState) -> log.add("tickStart " + tickState.tick()));
            Hooks.useAfterCompile((com, compiled, tickState, context) ->
                    log.add("afterCompile " + context.iteration()));
            return null;
        });

        compiler.compileUntilStable(Elements.create(observer), TickState.initial(), StabilizationOptions.defaults());
        compiler.notifyTickStart(TickState.of(2));

        assertThat(log).containsExactly("afterCompile 0", "tickStart 2");
    }
}
