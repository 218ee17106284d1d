package com.redline.error;

/**
 * A declared handler parameter could not be resolved.
 * Defaults to 400 unless the failing provider raised a {@link RequestException} with its own
 * status.
 */
public class ParameterResolutionException extends RequestException {
    private final String handlerName;
    private final String parameterName;

    public ParameterResolutionException(int statusCode, String handlerName, String parameterName,
                                        String reason, Throwable cause) {
        super(statusCode, "Invalid parameter '" + parameterName + "' for handler '" + handlerName
                + "': " + reason, cause);
        this.handlerName = handlerName;
        this.parameterName = parameterName;
    }

    public String getHandlerName() {
        return handlerName;
    }

    public String getParameterName() {
        return parameterName;
    }
}
