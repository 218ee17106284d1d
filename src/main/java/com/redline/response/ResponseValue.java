package com.redline.response;

import com.redline.error.RequestException;

import java.io.File;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Closed classification of a handler's return value, used by {@link ResponseWriter} to pick a
 * wire format.
 */
public final class ResponseValue {

    /** The shapes a response value can take. */
    public enum Kind {
        /** No value: empty body. */
        NONE,
        /** A {@link Response}, written verbatim. */
        RAW,
        /** A {@link Map}, written as a JSON object. */
        MAPPING,
        /** A {@link List}, written as a JSON array. */
        SEQUENCE,
        /** A {@link File} or {@link Path}, streamed. */
        FILE,
        /** A {@link RequestException}, written as plain text with its status. */
        ERROR,
        /** Anything else, written through {@code toString()}. */
        TEXT
    }

    private static final ResponseValue NONE = new ResponseValue(Kind.NONE, null);

    private final Kind kind;
    private final Object value;

    private ResponseValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    /**
     * Classifies a value.
     *
     * @param value the value returned by a handler or processor, may be null
     * @return the tagged value
     */
    public static ResponseValue of(Object value) {
        if (value == null) {
            return NONE;
        } else if (value instanceof Response) {
            return new ResponseValue(Kind.RAW, value);
        } else if (value instanceof RequestException) {
            return new ResponseValue(Kind.ERROR, value);
        } else if (value instanceof Map) {
            return new ResponseValue(Kind.MAPPING, value);
        } else if (value instanceof List) {
            return new ResponseValue(Kind.SEQUENCE, value);
        } else if (value instanceof File) {
            return new ResponseValue(Kind.FILE, ((File) value).toPath());
        } else if (value instanceof Path) {
            return new ResponseValue(Kind.FILE, value);
        }
        return new ResponseValue(Kind.TEXT, value);
    }

    public Kind getKind() {
        return kind;
    }

    public Object getValue() {
        return value;
    }

    public Response asResponse() {
        return (Response) value;
    }

    public RequestException asError() {
        return (RequestException) value;
    }

    public Path asPath() {
        return (Path) value;
    }

    public String asText() {
        return String.valueOf(value);
    }
}
