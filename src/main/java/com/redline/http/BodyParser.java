package com.redline.http;

import java.io.IOException;
import java.io.InputStream;

/**
 * Body-parsing collaborator. Invoked lazily, at most once per request; the request memoizes
 * the result.
 */
@FunctionalInterface
public interface BodyParser {

    /**
     * Parses a request body.
     *
     * @param contentType the request Content-Type, may be null
     * @param body the raw body stream
     * @return the parsed body with its detected type
     * @throws IOException if the body cannot be read or is malformed
     */
    ParsedBody parse(String contentType, InputStream body) throws IOException;
}
