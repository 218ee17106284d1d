package com.redline.util;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Helpers for values that may or may not be asynchronous.
 * Handlers, providers, processors and continuations may return either a plain value or a
 * {@link CompletionStage}; the dispatch core normalizes both through this class.
 */
public final class Futures {

    private Futures() {
    }

    /**
     * Lifts a plain value or a completion stage into a {@link CompletableFuture}.
     *
     * @param value a plain value, a {@link CompletionStage}, or null
     * @return a future completing with the (unwrapped) value
     */
    @SuppressWarnings("unchecked")
    public static CompletableFuture<Object> toFuture(Object value) {
        if (value instanceof CompletionStage) {
            return ((CompletionStage<Object>) value).toCompletableFuture();
        }
        return CompletableFuture.completedFuture(value);
    }

    /**
     * Strips the wrappers that {@link CompletableFuture} adds around a failure.
     *
     * @param failure the failure as observed by a completion callback
     * @return the original cause
     */
    public static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
