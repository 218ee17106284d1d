package com.redline.plugin.exception;

import com.redline.core.Manager;
import com.redline.error.ErrorHandler;
import com.redline.error.HttpStatus;
import com.redline.error.RequestException;
import com.redline.plugin.AbstractPlugin;
import com.redline.response.ErrorResponse;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Plugin that renders the common error statuses as JSON instead of the built-in error page.
 *
 * <p>Uncaught exceptions reach the 500 handler, which maps a few well-known exception types to
 * a more precise status, as in {@code IllegalArgumentException} to 400. With
 * {@code -Dredline.dev=true} the exception class and message are included.</p>
 */
public class GlobalExceptionHandlerPlugin extends AbstractPlugin {
    private static final int[] HANDLED = {400, 401, 403, 404, 405, 500};

    public GlobalExceptionHandlerPlugin() {
        super("global-exception-handler", "1.0.0");
    }

    @Override
    protected void configure(Manager manager) {
        for (int status : HANDLED) {
            manager.addErrorHandler(new ErrorHandler(status, args -> {
                Throwable error = args.chain().getError();
                return errorResponse(status, error);
            }));
        }
    }

    /**
     * Builds a consistent error body for a status and the failure behind it.
     *
     * @param status the status being rendered
     * @param error the failure, may be null
     * @return the error response
     */
    static ErrorResponse errorResponse(int status, Throwable error) {
        int effective = status;
        String message = HttpStatus.phrase(status);

        // Customize status and message based on exception type
        if (error instanceof RequestException) {
            message = error.getMessage();
        } else if (status == 500 && error instanceof IllegalArgumentException) {
            effective = 400;
            message = HttpStatus.phrase(400);
        } else if (status == 500 && error instanceof SecurityException) {
            effective = 403;
            message = HttpStatus.phrase(403);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", true);
        body.put("status", effective);
        body.put("message", message != null ? message : "Error " + effective);

        // Include exception details in development mode
        if (error != null && Boolean.getBoolean("redline.dev")) {
            body.put("exception", error.getClass().getName());
            body.put("exceptionMessage", error.getMessage());
        }
        return new ErrorResponse(effective, body);
    }
}
