package com.redline.chain;

import com.redline.inject.ServiceLocator;
import com.redline.param.ParameterResolver;
import com.redline.response.ResponseWriter;

/** The collaborators a {@link ChainExecutor} invokes for every element. */
public class ChainServices {
    private final ParameterResolver resolver;
    private final ResponseWriter writer;
    private final ServiceLocator locator;

    public ChainServices(ParameterResolver resolver, ResponseWriter writer, ServiceLocator locator) {
        this.resolver = resolver;
        this.writer = writer;
        this.locator = locator;
    }

    public ParameterResolver getResolver() {
        return resolver;
    }

    public ResponseWriter getWriter() {
        return writer;
    }

    public ServiceLocator getLocator() {
        return locator;
    }
}
