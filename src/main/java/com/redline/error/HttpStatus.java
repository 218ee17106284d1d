package com.redline.error;

import java.util.HashMap;
import java.util.Map;

/** Human-readable phrases for the status codes the diagnostic page knows about. */
public final class HttpStatus {
    public static final int OK = 200;
    public static final int NO_CONTENT = 204;
    public static final int FOUND = 302;
    public static final int BAD_REQUEST = 400;
    public static final int UNAUTHORIZED = 401;
    public static final int FORBIDDEN = 403;
    public static final int NOT_FOUND = 404;
    public static final int METHOD_NOT_ALLOWED = 405;
    public static final int INTERNAL_SERVER_ERROR = 500;

    private static final Map<Integer, String> PHRASES = new HashMap<>();

    static {
        PHRASES.put(BAD_REQUEST, "BAD REQUEST");
        PHRASES.put(UNAUTHORIZED, "UNAUTHORIZED");
        PHRASES.put(FORBIDDEN, "FORBIDDEN");
        PHRASES.put(NOT_FOUND, "NOT FOUND");
        PHRASES.put(METHOD_NOT_ALLOWED, "METHOD NOT ALLOWED");
        PHRASES.put(415, "UNSUPPORTED MEDIA TYPE");
        PHRASES.put(INTERNAL_SERVER_ERROR, "INTERNAL SERVER ERROR");
        PHRASES.put(503, "SERVICE UNAVAILABLE");
    }

    private HttpStatus() {
    }

    /**
     * Gets the phrase for a status code.
     *
     * @param statusCode the status code
     * @return the phrase, or null for codes outside the known set
     */
    public static String phrase(int statusCode) {
        return PHRASES.get(statusCode);
    }
}
