package io.github.hide212131.langchain4j.context.runtime.signal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.hide212131.langchain4j.context.runtime.element.Props;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PropBindingsTest {

    @Test
    @DisplayName("マウント時に props の値がシグナルに入る")
    void initialValueComesFromProps() {
        PropBindings bindings = new PropBindings();
        Signal<String> name = bindings.bind("name", String.class, "default");

        bindings.applyInitial(Props.of("name", "agent"));

        assertThat(name.get()).isEqualTo("agent");
    }

    @Test
    @DisplayName("更新時にキーが無ければシグナルは変わらない")
    void updateWithoutKeyKeepsValue() {
        PropBindings bindings = new PropBindings();
        Signal<Integer> limit = bindings.bind("limit", Integer.class, 3);
        bindings.applyInitial(Props.of("limit", 5));

        bindings.applyUpdate(Props.of("other", true));
        assertThat(limit.get()).isEqualTo(5);

        bindings.applyUpdate(Props.of("limit", 8));
        assertThat(limit.get()).isEqualTo(8);
    }

    @Test
    @DisplayName("型が合わない値は無視される")
    void mismatchedTypeIsIgnored() {
        PropBindings bindings = new PropBindings();
        Signal<Integer> limit = bindings.bind("limit", Integer.class, 3);

        bindings.applyInitial(Props.of("limit", "many"));

        assertThat(limit.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("同じキーを二重に束縛できない")
    void duplicateBindingIsRejected() {
        PropBindings bindings = new PropBindings();
        bindings.bind("name", String.class, null);

        assertThatThrownBy(() -> bindings.bind("name", String.class, null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("name");
    }

    @Test
    @DisplayName("dispose で束縛シグナルと所有シグナルを破棄する")
    void disposeReleasesEverything() {
        PropBindings bindings = new PropBindings();
        Signal<String> bound = bindings.bind("name", String.class, null);
        Signal<Integer> owned = bindings.own(new Signal<>(0));

        bindings.dispose();

        assertThat(bound.isDisposed()).isTrue();
        assertThat(owned.isDisposed()).isTrue();
        assertThat(bindings.boundKeys()).containsExactly("name");
    }
}
