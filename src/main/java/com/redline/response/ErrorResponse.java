package com.redline.response;

/**
 * Return value that sets the response status and carries a body value. The body is written
 * like any other handler result, so a map becomes JSON.
 *
 * <pre>
 * return new ErrorResponse(422, Map.of("field", "email", "error", "invalid"));
 * </pre>
 */
public class ErrorResponse {
    private final int statusCode;
    private final Object error;

    public ErrorResponse(int statusCode, Object error) {
        this.statusCode = statusCode;
        this.error = error;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public Object getError() {
        return error;
    }
}
