package io.github.hide212131.langchain4j.context.runtime.structure;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import io.github.hide212131.langchain4j.context.runtime.com.ExecutableTool;
import io.github.hide212131.langchain4j.context.runtime.render.ContentRenderer;
import java.io.IOException;
import java.util.Objects;

/**
 * Writes a {@link CompiledStructure} as JSON. Renderers are written by name and tools as
 * {@code {name, description}}.
 */
public final class CompiledStructureJsonWriter {

    private final ObjectMapper mapper;

    public CompiledStructureJsonWriter() {
        SimpleModule module = new SimpleModule("compiled-structure");
        module.addSerializer(ContentRenderer.class, new RendererSerializer());
        module.addSerializer(ExecutableTool.class, new ToolSerializer());
        this.mapper = new ObjectMapper()
                .registerModule(module)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    public String write(CompiledStructure structure) {
        Objects.requireNonNull(structure, "structure");
        try {
            return mapper.writeValueAsString(structure);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("CompiledStructure の JSON 変換に失敗しました。", ex);
        }
    }

    private static final class RendererSerializer extends JsonSerializer<ContentRenderer> {
        @Override
        public void serialize(ContentRenderer value, JsonGenerator gen, SerializerProvider serializers)
                throws IOException {
            gen.writeString(value.name());
        }
    }

    private static final class ToolSerializer extends JsonSerializer<ExecutableTool> {
        @Override
        public void serialize(ExecutableTool value, JsonGenerator gen, SerializerProvider serializers)
                throws IOException {
            gen.writeStartObject();
            gen.writeStringField("name", value.name());
            if (value.description() != null) {
                gen.writeStringField("description", value.description());
            }
            gen.writeEndObject();
        }
    }
}
