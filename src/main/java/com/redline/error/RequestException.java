package com.redline.error;

/**
 * An intentional abort of request processing with an explicit HTTP status.
 *
 * <p>Thrown (or returned) by handler and interceptor code, for example
 * {@code throw new RequestException(404, "user not found")}. When no error handler is
 * registered for the status, the message is written verbatim as {@code text/plain}.</p>
 */
public class RequestException extends RuntimeException {
    private final int statusCode;

    /**
     * Creates a new request exception.
     *
     * @param statusCode the HTTP status to respond with
     * @param message the message sent to the client
     */
    public RequestException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * Creates a new request exception with a cause.
     *
     * @param statusCode the HTTP status to respond with
     * @param message the message sent to the client
     * @param cause the underlying failure
     */
    public RequestException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * Gets the HTTP status code of this abort.
     *
     * @return the status code
     */
    public int getStatusCode() {
        return statusCode;
    }
}
