package com.redline.http;

import com.redline.util.JsonUtil;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * In-memory request for dispatching without a network transport, mostly from tests.
 *
 * <pre>
 * Response response = app.dispatch(MockRequest.get("/users/7").build()).join();
 * </pre>
 */
public class MockRequest extends AbstractRequest {
    private final String method;
    private final String requestedUri;
    private final String path;
    private final Map<String, String> queryParams;
    private final Map<String, String> headers;
    private final byte[] body;
    private final Session session;

    private MockRequest(Builder builder) {
        super(builder.bodyParser);
        this.method = builder.method;
        this.requestedUri = builder.uri;
        URI uri = URI.create(builder.uri);
        this.path = uri.getPath() == null || uri.getPath().isEmpty() ? "/" : uri.getPath();
        this.queryParams = Collections.unmodifiableMap(parseQuery(uri.getRawQuery()));
        TreeMap<String, String> headerMap = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headerMap.putAll(builder.headers);
        this.headers = Collections.unmodifiableMap(headerMap);
        this.body = builder.body;
        this.session = builder.session != null ? builder.session : new MapSession();
    }

    public static Builder builder(String method, String uri) {
        return new Builder(method, uri);
    }

    public static Builder get(String uri) {
        return new Builder("GET", uri);
    }

    public static Builder post(String uri) {
        return new Builder("POST", uri);
    }

    public static Builder put(String uri) {
        return new Builder("PUT", uri);
    }

    public static Builder delete(String uri) {
        return new Builder("DELETE", uri);
    }

    @Override
    public String getRequestedUri() {
        return requestedUri;
    }

    @Override
    public String getPath() {
        return path;
    }

    @Override
    public String getMethod() {
        return method;
    }

    @Override
    public Map<String, String> getQueryParams() {
        return queryParams;
    }

    @Override
    public Map<String, String> getHeaders() {
        return headers;
    }

    @Override
    public Session getSession() {
        return session;
    }

    @Override
    protected InputStream openBody() {
        return new ByteArrayInputStream(body);
    }

    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = URLDecoder.decode(eq < 0 ? pair : pair.substring(0, eq), StandardCharsets.UTF_8);
            String value = eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            params.putIfAbsent(name, value);
        }
        return params;
    }

    /** Fluent builder for {@link MockRequest}. */
    public static class Builder {
        private final String method;
        private final String uri;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private byte[] body = new byte[0];
        private Session session;
        private BodyParser bodyParser;

        private Builder(String method, String uri) {
            this.method = method.toUpperCase(Locale.ROOT);
            this.uri = uri;
        }

        public Builder header(String name, String value) {
            headers.put(name, value);
            return this;
        }

        public Builder contentType(String contentType) {
            return header("Content-Type", contentType);
        }

        public Builder body(byte[] body) {
            this.body = body != null ? body : new byte[0];
            return this;
        }

        public Builder body(String contentType, String body) {
            contentType(contentType);
            return body(body.getBytes(StandardCharsets.UTF_8));
        }

        /**
         * Serializes a value with Jackson and sets it as an {@code application/json} body.
         *
         * @param value the value to serialize
         * @return this builder for method chaining
         * @throws IOException if the value cannot be serialized
         */
        public Builder json(Object value) throws IOException {
            contentType("application/json");
            return body(JsonUtil.toJsonBytes(value));
        }

        public Builder session(Session session) {
            this.session = session;
            return this;
        }

        public Builder bodyParser(BodyParser bodyParser) {
            this.bodyParser = bodyParser;
            return this;
        }

        public MockRequest build() {
            return new MockRequest(this);
        }
    }
}
