package com.redline.response;

import com.redline.inject.ServiceLocator;

/**
 * Transforms a route's return value before it is written. Processors run in registration order
 * and may change the value's type, for example turning a domain object into a map.
 */
@FunctionalInterface
public interface ResponseProcessor {

    /**
     * Transforms a value.
     *
     * @param metadata the handler metadata that triggered this processor, or null for a
     *     processor registered without a metadata type
     * @param handlerName the route name
     * @param value the current value
     * @param locator the service locator
     * @return the new value, or a {@code CompletionStage} of it
     * @throws Exception if the value cannot be processed
     */
    Object process(Object metadata, String handlerName, Object value, ServiceLocator locator)
        throws Exception;
}
