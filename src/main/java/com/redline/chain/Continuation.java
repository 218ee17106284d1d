package com.redline.chain;

/**
 * Code an interceptor schedules through {@link Chain#next(Continuation)}. It runs after every
 * deeper element of the chain has completed, in reverse registration order.
 */
@FunctionalInterface
public interface Continuation {

    /**
     * Runs the continuation.
     *
     * @return null, or a {@code CompletionStage} the chain waits for before unwinding further
     * @throws Exception on failure; the current response is replaced by an error response
     */
    Object run() throws Exception;
}
