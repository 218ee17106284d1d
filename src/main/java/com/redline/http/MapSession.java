package com.redline.http;

import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/** In-memory session used by {@link MockRequest} and whenever no session manager is attached. */
public class MapSession implements Session {
    private final String id;
    private final Map<String, Object> attributes = new ConcurrentHashMap<>();

    public MapSession() {
        this(UUID.randomUUID().toString());
    }

    public MapSession(String id) {
        this.id = id;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public Object getAttribute(String name) {
        return attributes.get(name);
    }

    @Override
    public void setAttribute(String name, Object value) {
        if (value == null) {
            attributes.remove(name);
        } else {
            attributes.put(name, value);
        }
    }

    @Override
    public Object removeAttribute(String name) {
        return attributes.remove(name);
    }

    @Override
    public Set<String> getAttributeNames() {
        return Set.copyOf(attributes.keySet());
    }

    @Override
    public void invalidate() {
        attributes.clear();
    }
}
