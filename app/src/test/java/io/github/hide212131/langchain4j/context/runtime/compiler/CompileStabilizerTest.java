package io.github.hide212131.langchain4j.context.runtime.compiler;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.hide212131.langchain4j.context.infra.config.CompilerConfig;
import io.github.hide212131.langchain4j.context.runtime.com.ContextObjectModel;
import io.github.hide212131.langchain4j.context.runtime.component.AfterCompileContext;
import io.github.hide212131.langchain4j.context.runtime.component.Component;
import io.github.hide212131.langchain4j.context.runtime.component.TickState;
import io.github.hide212131.langchain4j.context.runtime.compiler.CompilerFixtures.Requester;
import io.github.hide212131.langchain4j.context.runtime.content.ContentBlock;
import io.github.hide212131.langchain4j.context.runtime.element.Element;
import io.github.hide212131.langchain4j.context.runtime.element.Elements;
import io.github.hide212131.langchain4j.context.runtime.element.Props;
import io.github.hide212131.langchain4j.context.runtime.primitives.Primitives;
import io.github.hide212131.langchain4j.context.runtime.structure.CompiledStructure;
import io.github.hide212131.langchain4j.context.runtime.structure.CompiledTimelineEntry;
import io.github.hide212131.langchain4j.context.runtime.structure.MessageRole;
import io.github.hide212131.langchain4j.context.runtime.structure.TimelineMessage;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CompileStabilizerTest {

    private final ContextObjectModel com = new ContextObjectModel();
    private final FiberCompiler compiler = new FiberCompiler(com);

    @Test
    @DisplayName("再コンパイルを要求しなければ 1 回で安定する")
    void stableOnFirstPass() {
        StabilizationResult result = compiler.compileUntilStable(
                Primitives.section("intro", "hello"), TickState.initial(), StabilizationOptions.defaults());

        assertThat(result.iterations()).isEqualTo(1);
        assertThat(result.forcedStable()).isFalse();
        assertThat(result.recompileReasons()).isEmpty();
        assertThat(result.compiled().section("intro")).isPresent();
    }

    @Test
    @DisplayName("常に再コンパイルを要求すると上限で打ち切り forcedStable になる")
    void alwaysRequestingIsForcedStable() {
        Component greedy = new Component() {
            @Override
            public void onAfterCompile(ContextObjectModel com, CompiledStructure compiled, TickState state,
                    AfterCompileContext context) {
                com.requestRecompile("never satisfied");
            }
        };

        StabilizationResult result = compiler.compileUntilStable(Elements.instance(greedy, Props.empty()),
                TickState.initial(), new StabilizationOptions(4, false));

        assertThat(result.forcedStable()).isTrue();
        assertThat(result.iterations()).isEqualTo(4);
        assertThat(result.recompileReasons())
                .hasSize(4)
                .first().isEqualTo("[iteration 0] never satisfied");
    }

    @Test
    @DisplayName("2 回だけ再コンパイルを要求すると 3 回で安定する")
    void requestingTwiceTakesThreePasses() {
        Element root = Elements.instance(new Requester(2), Props.empty());

        StabilizationResult result = compiler.compileUntilStable(root, TickState.initial(),
                StabilizationOptions.from(CompilerConfig.defaults()));

        assertThat(result.forcedStable()).isFalse();
        assertThat(result.iterations()).isEqualTo(3);
        assertThat(result.recompileReasons()).containsExactly("[iteration 0] pass 1", "[iteration 1] pass 2");
        assertThat(result.compiled().section("requests").orElseThrow().content()).isEqualTo("requested 2");
    }

    @Test
    @DisplayName("最後の反復で要求が止まれば forcedStable にならない")
    void stoppingOnLastIterationIsNotForced() {
        Element root = Elements.instance(new Requester(2), Props.empty());

        StabilizationResult result = compiler.compileUntilStable(root, TickState.initial(),
                new StabilizationOptions(3, false));

        assertThat(result.iterations()).isEqualTo(3);
        assertThat(result.forcedStable()).isFalse();
    }

    @Test
    @DisplayName("afterCompile には反復番号と上限が渡される")
    void afterCompileReceivesIterationContext() {
        List<AfterCompileContext> contexts = new ArrayList<>();
        Component observer = new Component() {
            @Override
            public void onAfterCompile(ContextObjectModel com, CompiledStructure compiled, TickState state,
                    AfterCompileContext context) {
                contexts.add(context);
                if (context.iteration() == 0) {
                    com.requestRecompile();
                }
            }
        };

        compiler.compileUntilStable(Elements.instance(observer, Props.empty()), TickState.initial(),
                new StabilizationOptions(2, false));

        assertThat(contexts).containsExactly(new AfterCompileContext(0, 2), new AfterCompileContext(1, 2));
        assertThat(contexts.get(1).isLastIteration()).isTrue();
    }

    @Test
    @DisplayName("変更追跡では再コンパイル要求なしの COM 変更を警告する")
    void mutationWithoutRequestIsReported() {
        Component sneaky = new Component() {
            @Override
            public String name() {
                return "Sneaky";
            }

            @Override
            public void onAfterCompile(ContextObjectModel com, CompiledStructure compiled, TickState state,
                    AfterCompileContext context) {
                com.addTimelineEntry(CompiledTimelineEntry.message(
                        new TimelineMessage(MessageRole.ASSISTANT, List.of(ContentBlock.text("note")))));
            }
        };
        Element root = Elements.instance(sneaky, Props.empty());

        StabilizationResult tracked = compiler.compileUntilStable(root, TickState.initial(),
                new StabilizationOptions(3, true));

        assertThat(tracked.iterations()).isEqualTo(1);
        assertThat(tracked.mutationWarnings()).singleElement().asString()
                .contains("Sneaky")
                .contains("timeline 0 -> 1");

        StabilizationResult untracked = new FiberCompiler(new ContextObjectModel())
                .compileUntilStable(root, TickState.initial(), new StabilizationOptions(3, false));
        assertThat(untracked.mutationWarnings()).isEmpty();
    }

    @Test
    @DisplayName("再コンパイルを要求した変更は警告しない")
    void mutationWithRequestIsNotReported() {
        Component honest = new Component() {
            @Override
            public void onAfterCompile(ContextObjectModel com, CompiledStructure compiled, TickState state,
                    AfterCompileContext context) {
                if (context.iteration() == 0) {
                    com.addMetadata("seen", true);
                    com.addTool(CompilerFixtures.tool("late"));
                    com.requestRecompile("tool added");
                }
            }
        };

        StabilizationResult result = compiler.compileUntilStable(Elements.instance(honest, Props.empty()),
                TickState.initial(), new StabilizationOptions(5, true));

        assertThat(result.mutationWarnings()).isEmpty();
        assertThat(result.iterations()).isEqualTo(2);
        assertThat(result.compiled().metadata()).containsEntry("seen", true);
    }
}
