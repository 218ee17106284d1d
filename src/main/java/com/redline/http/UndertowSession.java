package com.redline.http;

import io.undertow.server.HttpServerExchange;

import java.util.Set;

/** {@link Session} view over an Undertow session. */
public class UndertowSession implements Session {
    private final HttpServerExchange exchange;
    private final io.undertow.server.session.Session delegate;

    public UndertowSession(HttpServerExchange exchange, io.undertow.server.session.Session delegate) {
        this.exchange = exchange;
        this.delegate = delegate;
    }

    @Override
    public String getId() {
        return delegate.getId();
    }

    @Override
    public Object getAttribute(String name) {
        return delegate.getAttribute(name);
    }

    @Override
    public void setAttribute(String name, Object value) {
        if (value == null) {
            delegate.removeAttribute(name);
        } else {
            delegate.setAttribute(name, value);
        }
    }

    @Override
    public Object removeAttribute(String name) {
        return delegate.removeAttribute(name);
    }

    @Override
    public Set<String> getAttributeNames() {
        return delegate.getAttributeNames();
    }

    @Override
    public void invalidate() {
        delegate.invalidate(exchange);
    }
}
