package io.eventbus.dispatch;

import io.eventbus.EventShadow;

/**
 * Cross-cutting hook around each listener delivery.
 *
 * <p>Interceptors run around listener invocation:
 * <ol>
 *   <li>{@link #beforeDispatch} in registration order</li>
 *   <li>{@link io.eventbus.EventListener#process}</li>
 *   <li>{@link #afterDispatch} in reverse registration order</li>
 * </ol>
 *
 * <p>If {@code beforeDispatch} throws, the listener is not invoked and the delivery counts
 * as failed. {@code afterDispatch} exceptions are logged and swallowed. Neither outcome
 * reports a disposition.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * NotificationDispatcher.builder()
 *     .interceptor(EventInterceptor.before(shadow ->
 *         audit.log(shadow.topic(), shadow.id())))
 *     .interceptor(EventInterceptor.after((shadow, error) -> {
 *         if (error != null) alerts.raise(shadow, error);
 *     }))
 *     ...
 * }</pre>
 */
public interface EventInterceptor {

    /**
     * Called before the listener is invoked.
     *
     * @param shadow the delivery about to happen
     * @throws Exception to skip the listener invocation
     */
    default void beforeDispatch(EventShadow shadow) throws Exception {
    }

    /**
     * Called after listener invocation (or after a beforeDispatch failure).
     *
     * @param shadow the delivery that happened
     * @param error  null on success, the exception on failure
     */
    default void afterDispatch(EventShadow shadow, Exception error) {
    }

    /**
     * Creates an interceptor with only a beforeDispatch hook.
     */
    static EventInterceptor before(BeforeHook hook) {
        return new EventInterceptor() {
            @Override
            public void beforeDispatch(EventShadow shadow) throws Exception {
                hook.accept(shadow);
            }
        };
    }

    /**
     * Creates an interceptor with only an afterDispatch hook.
     */
    static EventInterceptor after(AfterHook hook) {
        return new EventInterceptor() {
            @Override
            public void afterDispatch(EventShadow shadow, Exception error) {
                hook.accept(shadow, error);
            }
        };
    }

    @FunctionalInterface
    interface BeforeHook {
        void accept(EventShadow shadow) throws Exception;
    }

    @FunctionalInterface
    interface AfterHook {
        void accept(EventShadow shadow, Exception error);
    }
}
