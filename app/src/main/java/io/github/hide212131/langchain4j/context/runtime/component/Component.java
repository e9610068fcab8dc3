package io.github.hide212131.langchain4j.context.runtime.component;

import io.github.hide212131.langchain4j.context.runtime.com.ContextObjectModel;
import io.github.hide212131.langchain4j.context.runtime.com.ExecutableTool;
import io.github.hide212131.langchain4j.context.runtime.element.Element;
import io.github.hide212131.langchain4j.context.runtime.element.Props;
import io.github.hide212131.langchain4j.context.runtime.signal.PropBindings;
import io.github.hide212131.langchain4j.context.runtime.structure.CompiledStructure;
import java.util.List;

/**
 * A stateful participant in the element tree. Every lifecycle method is optional.
 *
 * <p>Call order over the life of an instance:
 * {@code onMount} once, {@code onStart} once per execution, then per tick {@code onTickStart},
 * {@code render} (possibly several times while the structure stabilizes), {@code onAfterCompile} after each
 * compile pass, {@code onTickEnd}; finally {@code onComplete} and {@code onUnmount}.
 * Components that want to handle errors implement {@link ErrorBoundary}.
 */
public interface Component {

    default void onMount(ContextObjectModel com) {
    }

    default void onUnmount(ContextObjectModel com) {
    }

    default void onStart(ContextObjectModel com) {
    }

    default void onTickStart(ContextObjectModel com, TickState state) {
    }

    /** Returns the subtree for this tick, or {@code null} for nothing. */
    default Element render(ContextObjectModel com, TickState state) {
        return null;
    }

    default void onAfterCompile(ContextObjectModel com, CompiledStructure compiled, TickState state,
            AfterCompileContext context) {
    }

    default void onTickEnd(ContextObjectModel com, TickState state) {
    }

    default void onMessage(ContextObjectModel com, ExecutionMessage message, TickState state) {
    }

    default void onComplete(ContextObjectModel com, CompiledStructure finalStructure) {
    }

    /**
     * インスタンス固有のツール。tick 開始ごとに COM へ再登録される。
     * アンマウント時は登録中のツールと等しい場合だけ解除されるので、毎回同じツールを返すこと。
     */
    default ExecutableTool tool() {
        return null;
    }

    default String name() {
        return getClass().getSimpleName();
    }

    /** Tags used to select component hook middleware. */
    default List<String> tags() {
        return List.of();
    }

    default Props props() {
        return Props.empty();
    }

    default void updateProps(Props props) {
    }

    /** Signal table of the instance, or {@code null} when the component binds nothing. */
    default PropBindings propBindings() {
        return null;
    }
}
