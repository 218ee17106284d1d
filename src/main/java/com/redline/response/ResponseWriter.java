package com.redline.response;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.redline.chain.RequestContext;
import com.redline.chain.RequestScope;
import com.redline.error.RequestException;
import com.redline.error.SerializationException;
import com.redline.inject.ServiceLocator;
import com.redline.util.Futures;
import com.redline.util.JsonUtil;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the response processors over a handler's return value and converts the result into a
 * {@link Response}.
 */
public class ResponseWriter {
    private static final Logger logger = LoggerFactory.getLogger(ResponseWriter.class);

    static final String JSON_TYPE = "application/json";
    static final String TEXT_TYPE = "text/plain; charset=utf-8";

    private final ServiceLocator locator;
    private final MimeTypes mimeTypes;

    public ResponseWriter(ServiceLocator locator, MimeTypes mimeTypes) {
        this.locator = locator;
        this.mimeTypes = mimeTypes;
    }

    /**
     * Writes a value.
     *
     * <p>A {@link RequestException} value is written as plain text before any processor runs.
     * An {@link ErrorResponse} replaces the status and is unwrapped. The processors then run in
     * order, each awaited before the next and each with the caller's request context bound, and
     * the final value is rendered by kind.</p>
     *
     * @param handlerName the name of the handler that produced the value
     * @param value the value
     * @param statusCode the provisional status
     * @param contentType an explicit content type, or null to infer one
     * @param processors the processors bound to the handler, in registration order
     * @return the response; fails with {@link SerializationException} if the value cannot be
     *     encoded, or with the failure of a processor
     */
    public CompletableFuture<Response> write(String handlerName, Object value, int statusCode,
                                             String contentType, List<BoundProcessor> processors) {
        if (value instanceof RequestException) {
            RequestException abort = (RequestException) value;
            return CompletableFuture.completedFuture(Response.text(abort.getStatusCode(), abort.getMessage()));
        }

        int status = statusCode;
        Object current = value;
        if (current instanceof ErrorResponse) {
            status = ((ErrorResponse) current).getStatusCode();
            current = ((ErrorResponse) current).getError();
        }

        // A processor after an asynchronous one may run on another thread
        RequestContext scope = RequestScope.current();
        CompletableFuture<Object> pipeline = CompletableFuture.completedFuture(current);
        for (BoundProcessor bound : processors) {
            pipeline = pipeline.thenCompose(v -> {
                try {
                    return Futures.toFuture(RequestScope.call(scope,
                        () -> bound.getProcessor().process(bound.getMetadata(), handlerName, v, locator)));
                } catch (Exception e) {
                    return CompletableFuture.failedFuture(e);
                }
            });
        }

        final int finalStatus = status;
        return pipeline.thenApply(v -> render(handlerName, ResponseValue.of(v), finalStatus, contentType));
    }

    /**
     * Renders a value with no processors.
     *
     * @param handlerName the name of the handler that produced the value
     * @param value the value
     * @param statusCode the provisional status
     * @param contentType an explicit content type, or null to infer one
     * @return the response
     */
    public CompletableFuture<Response> write(String handlerName, Object value, int statusCode,
                                             String contentType) {
        return write(handlerName, value, statusCode, contentType, List.of());
    }

    Response render(String handlerName, ResponseValue value, int statusCode, String contentType) {
        switch (value.getKind()) {
            case NONE:
                return new Response(statusCode);
            case RAW:
                return value.asResponse();
            case ERROR:
                return Response.text(value.asError().getStatusCode(), value.asError().getMessage());
            case MAPPING:
            case SEQUENCE:
                try {
                    return new Response(statusCode)
                        .type(contentType != null ? contentType : JSON_TYPE)
                        .body(JsonUtil.toJsonBytes(value.getValue()));
                } catch (JsonProcessingException e) {
                    logger.error("Cannot serialize the value returned by {}", handlerName, e);
                    throw new SerializationException(handlerName, e);
                }
            case FILE:
                Path path = value.asPath();
                try {
                    return new Response(statusCode)
                        .type(contentType != null ? contentType : mimeTypes.lookup(path.getFileName().toString()))
                        .body(Files.newInputStream(path));
                } catch (IOException e) {
                    throw new RequestException(404, "File not found: " + path.getFileName(), e);
                }
            default:
                return new Response(statusCode)
                    .type(contentType != null ? contentType : TEXT_TYPE)
                    .body(value.asText());
        }
    }
}
