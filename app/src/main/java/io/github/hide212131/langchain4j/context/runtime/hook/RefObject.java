package io.github.hide212131.langchain4j.context.runtime.hook;

/** レンダリングをまたいで保持される可変参照。変更しても再コンパイルは要求されない。 */
public final class RefObject<T> {

    private T current;

    RefObject(T initialValue) {
        this.current = initialValue;
    }

    public T get() {
        return current;
    }

    public void set(T value) {
        this.current = value;
    }
}
