package com.redline.core;

import com.redline.chain.Interceptor;
import com.redline.error.ErrorHandler;
import com.redline.param.ParameterMarker;
import com.redline.param.ParameterProvider;
import com.redline.response.ResponseProcessor;
import com.redline.routing.Route;

/**
 * Registration calls available to plugins and application code before setup completes.
 */
public interface Manager {

    Route addRoute(Route route);

    Interceptor addInterceptor(Interceptor interceptor);

    ErrorHandler addErrorHandler(ErrorHandler handler);

    /**
     * Registers a parameter provider.
     *
     * @param marker the marker it serves
     * @param provider the provider
     * @param kinds the handler kinds that may use it; routes only when empty
     */
    void addParameterProvider(ParameterMarker marker, ParameterProvider provider, HandlerKind... kinds);

    /**
     * Registers a response processor.
     *
     * @param metadataType the metadata type that triggers it, or null to apply it to every route
     * @param processor the processor
     */
    void addResponseProcessor(Class<?> metadataType, ResponseProcessor processor);
}
