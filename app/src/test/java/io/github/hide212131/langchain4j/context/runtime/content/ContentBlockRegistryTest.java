package io.github.hide212131.langchain4j.context.runtime.content;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.hide212131.langchain4j.context.runtime.component.FunctionComponent;
import io.github.hide212131.langchain4j.context.runtime.element.Element;
import io.github.hide212131.langchain4j.context.runtime.element.Elements;
import io.github.hide212131.langchain4j.context.runtime.element.Props;
import io.github.hide212131.langchain4j.context.runtime.primitives.Primitives;
import io.github.hide212131.langchain4j.context.runtime.render.ContentRenderer;
import io.github.hide212131.langchain4j.context.runtime.render.MarkdownRenderer;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ContentBlockRegistryTest {

    private final ContentBlockRegistry registry = ContentBlockRegistry.defaults();
    private final ContentRenderer renderer = new MarkdownRenderer();

    private ContentBlock map(Element element) {
        return registry.map(element, renderer).orElseThrow();
    }

    @Test
    @DisplayName("text は子要素から書式付きのテキストを作る")
    void textKeepsSemanticNode() {
        ContentBlock.Text block = (ContentBlock.Text) map(
                Primitives.text(Props.empty(), "Use ", Primitives.strong("care"), "."));

        assertThat(block.text()).isEqualTo("Use care.");
        assertThat(block.semanticNode()).isNotNull();
        assertThat(block.semanticNode().renderer()).isSameAs(renderer);
        assertThat(block.semantic()).isNull();
    }

    @Test
    @DisplayName("見出しはレベル付きのセマンティクスを持つ")
    void headingHasLevel() {
        ContentBlock.Text block = (ContentBlock.Text) map(Primitives.heading(3, "Rules"));

        assertThat(block.semantic().type()).isEqualTo(Semantic.HEADING);
        assertThat(block.semantic().level()).isEqualTo(3);
    }

    @Test
    @DisplayName("code と image はそれぞれ専用のブロックになる")
    void codeAndImage() {
        assertThat(map(Primitives.code("java", "int x;"))).isEqualTo(new ContentBlock.Code("int x;", "java"));
        assertThat(map(Primitives.image("https://example.com/a.png", "image/png", "diagram")))
                .isEqualTo(new ContentBlock.Image("https://example.com/a.png", "image/png", "diagram"));
    }

    @Test
    @DisplayName("json のデータは JSON 文字列として表示用テキストになる")
    void jsonDataIsSerialized() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("city", "Tokyo");
        data.put("days", 3);

        ContentBlock.Json block = (ContentBlock.Json) map(Primitives.json(data));

        assertThat(block.text()).isEqualTo("{\"city\":\"Tokyo\",\"days\":3}");
        assertThat(block.data()).isSameAs(data);
    }

    @Test
    @DisplayName("タグ名は大文字小文字を区別しない")
    void tagsAreCaseInsensitive() {
        registry.register("Callout", (element, r) -> ContentBlock.text("callout"));

        assertThat(registry.handles(Elements.host("callout", Props.empty()).type())).isTrue();
        assertThat(registry.handles(Elements.host("CODE", Props.empty()).type())).isTrue();
    }

    @Test
    @DisplayName("関数コンポーネントは表示名で照合される")
    void functionComponentsMatchByDisplayName() {
        FunctionComponent summary = FunctionComponent.named("Summary", (props, com, state) -> null);
        registry.register("summary",
                (element, r) -> ContentBlock.text("summary of " + element.props().getString("topic")));

        ContentBlock block = map(Elements.create(summary, Props.of("topic", "sales")));

        assertThat(block).isEqualTo(ContentBlock.text("summary of sales"));
    }

    @Test
    @DisplayName("未登録のタグは空を返す")
    void unknownTagIsEmpty() {
        assertThat(registry.map(Elements.host("marquee", Props.empty(), "x"), renderer)).isEmpty();
        assertThat(registry.handles(Elements.fragment().type())).isFalse();
    }
}
