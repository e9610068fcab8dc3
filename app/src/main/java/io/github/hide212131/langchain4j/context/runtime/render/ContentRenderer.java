package io.github.hide212131.langchain4j.context.runtime.render;

import io.github.hide212131.langchain4j.context.runtime.content.ContentBlock;
import io.github.hide212131.langchain4j.context.runtime.content.SemanticNode;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns content blocks into the text format shown to the model.
 */
public interface ContentRenderer {

    String name();

    String formatBlock(ContentBlock block);

    String formatNode(SemanticNode node);

    default String format(List<ContentBlock> blocks) {
        return blocks.stream()
                .map(this::formatBlock)
                .filter(text -> text != null && !text.isEmpty())
                .collect(Collectors.joining("\n\n"));
    }
}
