package io.github.hide212131.langchain4j.context.runtime.instrument;

/**
 * Around-advice for a component lifecycle method. Call {@code next.proceed()} to continue the chain;
 * not calling it skips the component method.
 */
@FunctionalInterface
public interface ComponentHookMiddleware {

    Object around(ComponentInvocation invocation, Proceed next);

    @FunctionalInterface
    interface Proceed {
        Object proceed();
    }
}
