package com.redline.error;

import com.redline.chain.ChainExecutor;
import com.redline.chain.ChainServices;
import com.redline.chain.FailureRoute;
import com.redline.chain.RequestContext;
import com.redline.core.Registry;
import com.redline.response.Response;

import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns an error status, with or without a failure, into a response.
 *
 * <p>A registered {@link ErrorHandler} for the status and path renders it in its own chain.
 * Without one, an expected abort ({@link RequestException}) is answered with its message as
 * plain text and everything else with the {@link ErrorPage}. When the error handler itself
 * fails, the error page is rendered for the original status.</p>
 */
public class ErrorRouter implements FailureRoute {
    private static final Logger logger = LoggerFactory.getLogger(ErrorRouter.class);

    private final Registry registry;
    private final ChainServices services;
    private final boolean showStackTraces;

    public ErrorRouter(Registry registry, ChainServices services, boolean showStackTraces) {
        this.registry = registry;
        this.services = services;
        this.showStackTraces = showStackTraces;
    }

    @Override
    public CompletableFuture<Response> route(int statusCode, RequestContext context, Throwable error) {
        String path = context.getRequest().getPath();
        ErrorHandler handler = registry.findErrorHandler(statusCode, path);
        if (handler == null) {
            return CompletableFuture.completedFuture(defaultResponse(statusCode, path, error));
        }

        logger.debug("{}: rendering {} with {}", context.getRequest(), statusCode, handler.getName());
        FailureRoute fallback = (status, ctx, handlerFailure) -> {
            logger.warn("Error handler {} failed for {}", handler.getName(), path, handlerFailure);
            return CompletableFuture.completedFuture(
                ErrorPage.render(statusCode, path, handlerFailure != null ? handlerFailure : error, showStackTraces));
        };
        try {
            return ChainExecutor.forErrorHandler(context, handler, statusCode, error,
                    registry.processorsFor(handler), services, fallback)
                .execute();
        } catch (RuntimeException e) {
            logger.error("Could not run error handler {}", handler.getName(), e);
            return CompletableFuture.completedFuture(ErrorPage.render(statusCode, path, e, showStackTraces));
        }
    }

    @Override
    public boolean handles(int statusCode, String path) {
        return registry.findErrorHandler(statusCode, path) != null;
    }

    private Response defaultResponse(int statusCode, String path, Throwable error) {
        if (error instanceof RequestException && error.getMessage() != null) {
            return Response.text(statusCode, error.getMessage());
        }
        return ErrorPage.render(statusCode, path, error, showStackTraces);
    }
}
