package com.redline.param;

import com.redline.http.Request;
import com.redline.inject.ServiceLocator;

/**
 * Produces one handler parameter's value from the request.
 *
 * <p>Throwing a {@code RequestException} keeps its status code; any other failure becomes a 400.
 * Returning null fails a required parameter.</p>
 */
@FunctionalInterface
public interface ParameterProvider {

    /**
     * Provides a parameter value.
     *
     * @param metadata the spec's metadata, may be null
     * @param type the declared target type
     * @param handlerName the name of the handler being invoked
     * @param paramName the parameter name
     * @param request the current request
     * @param locator the service locator
     * @return the value, a {@code CompletionStage} of it, or null if there is none
     * @throws Exception if the value cannot be produced
     */
    Object provide(Object metadata, Class<?> type, String handlerName, String paramName,
                   Request request, ServiceLocator locator) throws Exception;
}
