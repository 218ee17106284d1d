package com.redline.http;

import io.undertow.server.HttpServerExchange;
import io.undertow.server.session.SessionConfig;
import io.undertow.server.session.SessionManager;
import io.undertow.util.HeaderValues;

import java.io.InputStream;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * {@link Request} backed by an Undertow exchange. The exchange must be in blocking mode before
 * the body is read.
 */
public class UndertowRequest extends AbstractRequest {
    private final HttpServerExchange exchange;
    private final Map<String, String> headers;
    private final Map<String, String> queryParams;
    private Session session;

    public UndertowRequest(HttpServerExchange exchange, BodyParser bodyParser) {
        super(bodyParser);
        this.exchange = exchange;

        TreeMap<String, String> headerMap = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (HeaderValues values : exchange.getRequestHeaders()) {
            headerMap.put(values.getHeaderName().toString(), values.getFirst());
        }
        this.headers = Collections.unmodifiableMap(headerMap);

        Map<String, String> query = new LinkedHashMap<>();
        for (Map.Entry<String, Deque<String>> entry : exchange.getQueryParameters().entrySet()) {
            if (!entry.getValue().isEmpty()) {
                query.put(entry.getKey(), entry.getValue().getFirst());
            }
        }
        this.queryParams = Collections.unmodifiableMap(query);
    }

    @Override
    public String getRequestedUri() {
        String query = exchange.getQueryString();
        return query == null || query.isEmpty()
            ? exchange.getRequestURI()
            : exchange.getRequestURI() + "?" + query;
    }

    @Override
    public String getPath() {
        return exchange.getRequestPath();
    }

    @Override
    public String getMethod() {
        return exchange.getRequestMethod().toString();
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
    public synchronized Session getSession() {
        if (session == null) {
            SessionManager manager = exchange.getAttachment(SessionManager.ATTACHMENT_KEY);
            SessionConfig config = exchange.getAttachment(SessionConfig.ATTACHMENT_KEY);
            if (manager == null || config == null) {
                session = new MapSession();
            } else {
                io.undertow.server.session.Session undertowSession = manager.getSession(exchange, config);
                if (undertowSession == null) {
                    undertowSession = manager.createSession(exchange, config);
                }
                session = new UndertowSession(exchange, undertowSession);
            }
        }
        return session;
    }

    @Override
    protected InputStream openBody() {
        return exchange.getInputStream();
    }

    /**
     * Gets the underlying exchange.
     *
     * @return the exchange
     */
    public HttpServerExchange getExchange() {
        return exchange;
    }
}
