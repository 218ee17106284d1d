package com.redline.core;

import com.redline.param.Arguments;

/**
 * A route, interceptor or error handler body.
 *
 * <p>The return value of a route or error handler becomes the response value; it may be a
 * {@code CompletionStage} for asynchronous work. Interceptors usually return null and drive the
 * chain through {@link Redline#chain()}.</p>
 */
@FunctionalInterface
public interface Handler {

    /**
     * Handles the current request.
     *
     * @param args the resolved parameters
     * @return the response value, a {@code CompletionStage} of it, or null
     * @throws Exception on failure; routed to the error handlers
     */
    Object handle(Arguments args) throws Exception;
}
