package io.github.hide212131.langchain4j.context.runtime.hook;

/** フック呼び出しの種別。再レンダリング時は同じ位置に同じ種別が来なければならない。 */
public enum HookKind {
    STATE,
    REDUCER,
    COM_STATE,
    WATCH,
    EFFECT,
    MEMO,
    REF,
    MOUNT,
    UNMOUNT,
    TICK_START,
    TICK_END,
    AFTER_COMPILE,
    MESSAGE
}
