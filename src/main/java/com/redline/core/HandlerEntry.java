package com.redline.core;

import com.redline.param.ParameterSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Common part of routes, interceptors and error handlers: a name, the handler body, its declared
 * parameters and the metadata objects that select parameter providers and response processors.
 *
 * <p>Entries are configured fluently and become immutable once the registry that holds them is
 * built.</p>
 *
 * @param <E> the concrete entry type, returned by the fluent setters
 */
public abstract class HandlerEntry<E extends HandlerEntry<E>> {
    private String name;
    private final Handler handler;
    private final List<ParameterSpec> parameters = new ArrayList<>();
    private final List<Object> metadata = new ArrayList<>();
    private volatile boolean sealed;

    protected HandlerEntry(String name, Handler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        this.name = name;
        this.handler = handler;
    }

    /**
     * Gets the kind of this entry, used to pick the parameter providers it may use.
     *
     * @return the kind
     */
    public abstract HandlerKind getKind();

    protected abstract E self();

    /**
     * Renames this entry.
     *
     * @param name the name used in logs, error messages and duplicate checks
     * @return this entry for method chaining
     */
    public E name(String name) {
        checkMutable();
        this.name = name;
        return self();
    }

    /**
     * Declares the handler's parameters, in resolution order.
     *
     * @param specs the parameter specs
     * @return this entry for method chaining
     */
    public E params(ParameterSpec... specs) {
        checkMutable();
        Collections.addAll(parameters, specs);
        return self();
    }

    /**
     * Attaches a metadata object, for example the configuration object a response processor is
     * registered for.
     *
     * @param value the metadata
     * @return this entry for method chaining
     */
    public E metadata(Object value) {
        checkMutable();
        metadata.add(value);
        return self();
    }

    public String getName() {
        return name;
    }

    public Handler getHandler() {
        return handler;
    }

    public List<ParameterSpec> getParameters() {
        return Collections.unmodifiableList(parameters);
    }

    public List<Object> getMetadata() {
        return Collections.unmodifiableList(metadata);
    }

    /**
     * Finds the first metadata object of a type.
     *
     * @param type the metadata type
     * @param <T> the metadata type
     * @return the metadata, or null if none is attached
     */
    public <T> T getMetadata(Class<T> type) {
        for (Object value : metadata) {
            if (type.isInstance(value)) {
                return type.cast(value);
            }
        }
        return null;
    }

    void seal() {
        sealed = true;
    }

    protected void checkMutable() {
        if (sealed) {
            throw new IllegalStateException(getName() + " is already registered and can no longer change");
        }
    }

    @Override
    public String toString() {
        return getKind() + " " + name;
    }
}
