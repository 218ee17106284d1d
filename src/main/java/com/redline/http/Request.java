package com.redline.http;

import java.io.IOException;
import java.util.Map;

/**
 * Read view of the incoming request, as seen by handlers, interceptors and parameter providers.
 *
 * <p>The body is parsed lazily on first access and memoized. The attributes map is shared by
 * every element of the request's chain and is the usual way for interceptors to hand values to
 * handlers.</p>
 */
public interface Request {

    /**
     * Gets the requested URI, including the query string.
     *
     * @return the requested URI
     */
    String getRequestedUri();

    /**
     * Gets the request path, without the query string.
     *
     * @return the path
     */
    String getPath();

    /**
     * Gets the HTTP method in upper case.
     *
     * @return the method
     */
    String getMethod();

    /**
     * Gets all query parameters. Only the first value of a repeated parameter is kept.
     *
     * @return an unmodifiable map of query parameters
     */
    Map<String, String> getQueryParams();

    /**
     * Gets a query parameter.
     *
     * @param name the parameter name
     * @return the value or null if not present
     */
    default String getQueryParam(String name) {
        return getQueryParams().get(name);
    }

    /**
     * Gets all headers. Lookups on the returned map are case-insensitive.
     *
     * @return an unmodifiable map of headers
     */
    Map<String, String> getHeaders();

    /**
     * Gets a request header.
     *
     * @param name the header name, case-insensitive
     * @return the header value or null if not present
     */
    default String getHeader(String name) {
        return getHeaders().get(name);
    }

    /**
     * Gets the Content-Type header.
     *
     * @return the content type or null if not present
     */
    default String getContentType() {
        return getHeader("Content-Type");
    }

    /**
     * Gets the body type detected from the Content-Type header.
     *
     * @return the body type, or null when the request has no Content-Type
     */
    default BodyType getBodyType() {
        return BodyType.detect(getContentType());
    }

    /**
     * Checks whether the body is multipart.
     *
     * @return true for {@code multipart/*} requests
     */
    default boolean isMultipart() {
        return BodyType.isMultipart(getContentType());
    }

    /**
     * Gets the parsed body. The first call parses the body; later calls return the same value.
     *
     * @return the parsed body, see {@link ParsedBody#getValue()}
     * @throws IOException if the body cannot be read or parsed
     */
    Object getBody() throws IOException;

    /**
     * Gets the session, creating one if needed.
     *
     * @return the session
     */
    Session getSession();

    /**
     * Gets the mutable attributes map shared by the request's chain.
     *
     * @return the attributes
     */
    Map<String, Object> getAttributes();

    /**
     * Gets a request attribute.
     *
     * @param name the attribute name
     * @param <T> the expected type
     * @return the attribute or null if not present
     */
    @SuppressWarnings("unchecked")
    default <T> T getAttribute(String name) {
        return (T) getAttributes().get(name);
    }

    /**
     * Sets a request attribute.
     *
     * @param name the attribute name
     * @param value the value
     */
    default void setAttribute(String name, Object value) {
        getAttributes().put(name, value);
    }

    /**
     * Gets the variables captured by the matched route template.
     *
     * @return an unmodifiable map of path variables, empty before matching
     */
    Map<String, String> getPathVariables();

    /**
     * Gets a path variable.
     *
     * @param name the variable name
     * @return the value or null if not present
     */
    default String getPathVariable(String name) {
        return getPathVariables().get(name);
    }

    /**
     * Sets the path variables. Called once by the dispatcher after matching.
     *
     * @param variables the captured variables
     */
    void setPathVariables(Map<String, String> variables);
}
