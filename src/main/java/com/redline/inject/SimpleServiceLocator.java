package com.redline.inject;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Map-backed {@link ServiceLocator}. Bindings are either singletons or suppliers invoked on
 * every lookup.
 */
public class SimpleServiceLocator implements ServiceLocator {
    private final Map<Class<?>, Supplier<?>> bindings = new ConcurrentHashMap<>();

    /**
     * Binds a singleton instance.
     *
     * @param type the service type
     * @param instance the instance returned for every lookup
     * @param <T> the service type
     * @return this locator for method chaining
     */
    public <T> SimpleServiceLocator bind(Class<T> type, T instance) {
        bindings.put(type, () -> instance);
        return this;
    }

    /**
     * Binds a supplier.
     *
     * @param type the service type
     * @param provider invoked on every lookup
     * @param <T> the service type
     * @return this locator for method chaining
     */
    public <T> SimpleServiceLocator bindProvider(Class<T> type, Supplier<? extends T> provider) {
        bindings.put(type, provider);
        return this;
    }

    @Override
    public <T> T resolve(Class<T> type) {
        Supplier<?> supplier = bindings.get(type);
        return supplier == null ? null : type.cast(supplier.get());
    }

    public void clear() {
        bindings.clear();
    }
}
