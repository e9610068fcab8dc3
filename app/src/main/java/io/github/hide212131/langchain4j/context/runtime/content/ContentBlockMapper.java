package io.github.hide212131.langchain4j.context.runtime.content;

import io.github.hide212131.langchain4j.context.runtime.element.Element;
import io.github.hide212131.langchain4j.context.runtime.render.ContentRenderer;

/** Converts a content element into a block. Returns {@code null} when the element yields nothing. */
@FunctionalInterface
public interface ContentBlockMapper {

    ContentBlock map(Element element, ContentRenderer currentRenderer);
}
