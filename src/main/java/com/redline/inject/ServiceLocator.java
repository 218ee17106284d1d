package com.redline.inject;

/**
 * Opaque service lookup used by parameter providers, response processors and handlers.
 * The dispatch core never inspects how services are wired.
 */
@FunctionalInterface
public interface ServiceLocator {

    /**
     * Looks up a service.
     *
     * @param type the service type
     * @param <T> the service type
     * @return the instance, or null if nothing is bound to {@code type}
     */
    <T> T resolve(Class<T> type);
}
