package com.redline.http;

import java.util.Set;

/** The HTTP session bound to a request. */
public interface Session {

    String getId();

    Object getAttribute(String name);

    void setAttribute(String name, Object value);

    Object removeAttribute(String name);

    Set<String> getAttributeNames();

    /** Discards the session and all of its attributes. */
    void invalidate();
}
