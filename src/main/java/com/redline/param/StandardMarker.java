package com.redline.param;

/** Markers served by {@link StandardProviders}. */
public enum StandardMarker implements ParameterMarker {
    /** A path variable, converted to the declared type. */
    PATH,
    /** A query parameter, converted to the declared type. */
    QUERY,
    /** A request header, converted to the declared type. */
    HEADER,
    /** A request attribute, usually set by an interceptor. */
    ATTRIBUTE,
    /** A service from the service locator. */
    SERVICE,
    /** The whole parsed body, converted to the declared type. */
    BODY,
    /** One field of a JSON object or form body. */
    FIELD,
    /** The request itself. */
    REQUEST
}
