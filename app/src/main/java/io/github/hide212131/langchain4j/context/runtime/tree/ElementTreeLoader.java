package io.github.hide212131.langchain4j.context.runtime.tree;

import io.github.hide212131.langchain4j.context.runtime.com.ExecutableTool;
import io.github.hide212131.langchain4j.context.runtime.element.Element;
import io.github.hide212131.langchain4j.context.runtime.element.ElementType;
import io.github.hide212131.langchain4j.context.runtime.element.Elements;
import io.github.hide212131.langchain4j.context.runtime.element.Props;
import io.github.hide212131.langchain4j.context.runtime.primitives.MessageSpec;
import io.github.hide212131.langchain4j.context.runtime.primitives.Primitives;
import io.github.hide212131.langchain4j.context.runtime.structure.MessageRole;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * YAML で記述した要素ツリーを読み込む。
 *
 * <pre>
 * tools:
 *   - name: search
 *     description: Search the web
 * tree:
 *   type: fragment
 *   children:
 *     - type: section
 *       props: { id: intro }
 *       children: [ "You are a helpful agent." ]
 *     - type: message
 *       props: { role: user, content: "Hello" }
 *     - type: tool
 *       props: { name: search }
 * </pre>
 *
 * <p>{@code fragment}, {@code message}, {@code tool}, {@code markdown} and {@code xml} are built with
 * {@link Primitives}; any other type becomes a host element with that tag. Plain strings are text children.
 * Tools declared under {@code tools} have no executable handler.
 */
public final class ElementTreeLoader {

    public record LoadResult(Element root, List<ExecutableTool> tools) {

        public LoadResult {
            Objects.requireNonNull(root, "root");
            tools = tools == null ? List.of() : List.copyOf(tools);
        }
    }

    public LoadResult load(Path path) {
        Objects.requireNonNull(path, "path");
        if (!Files.exists(path)) {
            throw new ElementTreeParseException("ツリーファイルが見つかりません: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path)) {
            return load(reader);
        } catch (IOException ex) {
            throw new ElementTreeParseException("ツリーファイルの読み込みに失敗しました: " + path, ex);
        }
    }

    public LoadResult parse(String yamlText) {
        return load(new StringReader(Objects.requireNonNull(yamlText, "yamlText")));
    }

    private LoadResult load(Reader reader) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object loaded;
        try {
            loaded = yaml.load(reader);
        } catch (YAMLException ex) {
            throw new ElementTreeParseException("YAML の構文が不正です: " + ex.getMessage(), ex);
        }
        if (!(loaded instanceof Map<?, ?> document)) {
            throw new ElementTreeParseException("ツリー文書はマップである必要があります。");
        }
        Object tree = document.get("tree");
        if (!(tree instanceof Map<?, ?> rootNode)) {
            throw new ElementTreeParseException("tree が未定義、またはマップではありません。");
        }
        return new LoadResult(element(rootNode, "tree"), tools(document.get("tools")));
    }

    private static List<ExecutableTool> tools(Object raw) {
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> list)) {
            throw new ElementTreeParseException("tools は配列である必要があります。");
        }
        List<ExecutableTool> tools = new ArrayList<>();
        for (Object entry : list) {
            if (!(entry instanceof Map<?, ?> map) || !(map.get("name") instanceof String name) || name.isBlank()) {
                throw new ElementTreeParseException("tools の各要素には name が必要です。");
            }
            Object description = map.get("description");
            tools.add(ExecutableTool.of(name, description == null ? null : description.toString(), request -> {
                throw new UnsupportedOperationException("tool " + name + " is declared without a handler");
            }));
        }
        return tools;
    }

    private static Element element(Map<?, ?> node, String path) {
        if (!(node.get("type") instanceof String type) || type.isBlank()) {
            throw new ElementTreeParseException(path + ": type が必要です。");
        }
        Props props = props(node.get("props"), path);
        Object key = node.get("key");
        if (key != null) {
            props = props.with(Props.KEY, key.toString());
        }
        Object[] children = children(node.get("children"), path);
        switch (type) {
            case "fragment":
                return Elements.create(ElementType.Fragment.INSTANCE, props, children);
            case "message":
                MessageRole role = MessageRole.from(props.get("role"));
                if (children.length == 0) {
                    Props base = props.without("role").without("content")
                            .with("kind", Primitives.KIND_MESSAGE)
                            .with("message", new MessageSpec(role, props.get("content")));
                    return Elements.host(Primitives.ENTRY, base);
                }
                return Primitives.message(role, props.without("role"), children);
            case "tool":
                String name = props.getString("name");
                if (name == null) {
                    throw new ElementTreeParseException(path + ": tool には props.name が必要です。");
                }
                return Primitives.tool(name);
            case "markdown":
                return Primitives.markdown(children);
            case "xml":
                return Primitives.xml(children);
            default:
                return Elements.host(type, props, children);
        }
    }

    @SuppressWarnings("unchecked")
    private static Props props(Object raw, String path) {
        if (raw == null) {
            return Props.empty();
        }
        if (!(raw instanceof Map<?, ?> map)) {
            throw new ElementTreeParseException(path + ": props はマップである必要があります。");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        ((Map<Object, Object>) map).forEach((k, v) -> copy.put(String.valueOf(k), v));
        return Props.from(copy);
    }

    private static Object[] children(Object raw, String path) {
        if (raw == null) {
            return new Object[0];
        }
        if (!(raw instanceof List<?> list)) {
            throw new ElementTreeParseException(path + ": children は配列である必要があります。");
        }
        List<Object> children = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            Object child = list.get(i);
            String childPath = path + ".children[" + i + "]";
            if (child instanceof Map<?, ?> map) {
                children.add(element(map, childPath));
            } else if (child instanceof String || child instanceof Number) {
                children.add(child.toString());
            } else {
                throw new ElementTreeParseException(childPath + ": 要素か文字列である必要があります。");
            }
        }
        return children.toArray();
    }
}
