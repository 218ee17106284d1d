package com.redline.http;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Base class holding the state every {@link Request} implementation shares: attributes, path
 * variables and the memoized body.
 */
public abstract class AbstractRequest implements Request {
    private final Map<String, Object> attributes = new ConcurrentHashMap<>();
    private final BodyParser bodyParser;
    private Map<String, String> pathVariables = Collections.emptyMap();
    private ParsedBody parsedBody;

    protected AbstractRequest(BodyParser bodyParser) {
        this.bodyParser = bodyParser != null ? bodyParser : new DefaultBodyParser();
    }

    /**
     * Opens the raw body stream. Called at most once.
     *
     * @return the body stream
     * @throws IOException if the body cannot be opened
     */
    protected abstract InputStream openBody() throws IOException;

    @Override
    public synchronized Object getBody() throws IOException {
        if (parsedBody == null) {
            try (InputStream in = openBody()) {
                parsedBody = bodyParser.parse(getContentType(), in);
            }
        }
        return parsedBody.getValue();
    }

    @Override
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @Override
    public Map<String, String> getPathVariables() {
        return pathVariables;
    }

    @Override
    public void setPathVariables(Map<String, String> variables) {
        this.pathVariables = variables == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new HashMap<>(variables));
    }

    @Override
    public String toString() {
        return getMethod() + " " + getRequestedUri();
    }
}
