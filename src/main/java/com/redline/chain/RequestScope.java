package com.redline.chain;

import java.util.concurrent.Callable;
import java.util.concurrent.Executor;

/**
 * Binds the {@link RequestContext} of the request being processed to the running thread.
 *
 * <p>The dispatcher binds the context around every piece of request code it runs: interceptor
 * and handler bodies, parameter providers, continuations and error handlers. Work handed to
 * other threads keeps the binding when it is wrapped with {@link #wrap(Runnable)} or submitted
 * through {@link #propagating(Executor)}. Two requests never see each other's context.</p>
 */
public final class RequestScope {
    private static final ThreadLocal<RequestContext> CURRENT = new ThreadLocal<>();

    private RequestScope() {
    }

    /**
     * Gets the context bound to the running thread.
     *
     * @return the context, or null outside request processing
     */
    public static RequestContext current() {
        return CURRENT.get();
    }

    /**
     * Runs code with a context bound, restoring the previous binding afterwards.
     *
     * @param context the context
     * @param callable the code
     * @param <T> the result type
     * @return the result
     * @throws Exception if the code fails
     */
    public static <T> T call(RequestContext context, Callable<T> callable) throws Exception {
        RequestContext previous = CURRENT.get();
        CURRENT.set(context);
        try {
            return callable.call();
        } finally {
            restore(previous);
        }
    }

    /**
     * Runs code with a context bound, restoring the previous binding afterwards.
     *
     * @param context the context
     * @param runnable the code
     */
    public static void run(RequestContext context, Runnable runnable) {
        RequestContext previous = CURRENT.get();
        CURRENT.set(context);
        try {
            runnable.run();
        } finally {
            restore(previous);
        }
    }

    /**
     * Captures the current context so the task runs with it on any thread.
     *
     * @param task the task
     * @return the wrapped task, or {@code task} itself outside request processing
     */
    public static Runnable wrap(Runnable task) {
        RequestContext captured = CURRENT.get();
        if (captured == null) {
            return task;
        }
        return () -> run(captured, task);
    }

    /**
     * Captures the current context so the task runs with it on any thread.
     *
     * @param task the task
     * @param <T> the result type
     * @return the wrapped task, or {@code task} itself outside request processing
     */
    public static <T> Callable<T> wrap(Callable<T> task) {
        RequestContext captured = CURRENT.get();
        if (captured == null) {
            return task;
        }
        return () -> call(captured, task);
    }

    /**
     * Wraps an executor so every submitted task keeps the submitter's context.
     *
     * @param executor the executor
     * @return the propagating executor
     */
    public static Executor propagating(Executor executor) {
        return task -> executor.execute(wrap(task));
    }

    private static void restore(RequestContext previous) {
        if (previous == null) {
            CURRENT.remove();
        } else {
            CURRENT.set(previous);
        }
    }
}
