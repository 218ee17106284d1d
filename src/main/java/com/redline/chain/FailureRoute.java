package com.redline.chain;

import com.redline.response.Response;

import java.util.concurrent.CompletableFuture;

/** Where a chain sends error statuses and failures. */
@FunctionalInterface
public interface FailureRoute {

    /**
     * Produces the error response for a status.
     *
     * @param statusCode the status
     * @param context the request context
     * @param error the failure, may be null
     * @return the response; never fails
     */
    CompletableFuture<Response> route(int statusCode, RequestContext context, Throwable error);

    /**
     * Checks whether a custom handler exists for a status. A chain that ends normally with such
     * a status is routed again so the handler can render it.
     *
     * @param statusCode the status
     * @param path the request path
     * @return true if a custom handler would be used
     */
    default boolean handles(int statusCode, String path) {
        return false;
    }
}
