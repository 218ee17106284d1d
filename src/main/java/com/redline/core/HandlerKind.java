package com.redline.core;

/** The kinds of handler a parameter provider can serve. */
public enum HandlerKind {
    ROUTE,
    INTERCEPTOR,
    ERROR_HANDLER
}
