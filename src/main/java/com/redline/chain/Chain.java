package com.redline.chain;

/**
 * Control surface of a request's chain, handed to interceptors and reachable from any code that
 * runs for the request through {@code Redline.chain()}.
 *
 * <p>An interceptor ends its own phase by calling {@link #next()} or {@link #interrupt()}.
 * Calling neither stalls the request until the dispatch deadline.</p>
 */
public interface Chain {

    /** Runs the next element of the chain. */
    void next();

    /**
     * Runs the next element of the chain and schedules {@code continuation} to run once every
     * deeper element has completed.
     *
     * @param continuation the code to run afterwards, may be null
     */
    void next(Continuation continuation);

    /** Stops the chain and keeps the current response. */
    void interrupt();

    /**
     * Stops the chain with a status. A status of 400 or more is sent to the error handlers;
     * a lower one produces an empty response with that status.
     *
     * @param statusCode the status
     */
    void interrupt(int statusCode);

    /**
     * Stops the chain with a response value. The value is written like a handler result and
     * wins over any response set later by a continuation.
     *
     * @param statusCode the status
     * @param value the response value
     */
    void interrupt(int statusCode, Object value);

    /**
     * Stops the chain with a response value and content type.
     *
     * @param statusCode the status
     * @param value the response value
     * @param contentType the content type, or null to infer one
     */
    void interrupt(int statusCode, Object value, String contentType);

    /**
     * Checks whether the chain was interrupted.
     *
     * @return true after any interrupt, explicit or caused by a failure
     */
    boolean isInterrupted();

    /**
     * Gets the failure that interrupted the chain.
     *
     * @return the failure, or null
     */
    Throwable getError();
}
