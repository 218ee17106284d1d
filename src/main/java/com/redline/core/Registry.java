package com.redline.core;

import com.redline.chain.Interceptor;
import com.redline.error.ConfigurationException;
import com.redline.error.ErrorHandler;
import com.redline.param.ParameterMarker;
import com.redline.param.ParameterProvider;
import com.redline.param.ParameterResolver;
import com.redline.param.StandardProviders;
import com.redline.response.BoundProcessor;
import com.redline.response.ResponseProcessor;
import com.redline.routing.Route;
import com.redline.routing.RouteMatch;
import com.redline.routing.Router;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Everything registered with one application: routes, interceptors, error handlers, parameter
 * providers and response processors.
 *
 * <p>The registry is filled during setup and then built once. Building validates the declared
 * parameters, binds response processors to each entry and orders the interceptors. After that it
 * is only read, so concurrent requests need no locking.</p>
 */
public class Registry {
    private static final Logger logger = LoggerFactory.getLogger(Registry.class);

    private final Router router = new Router();
    private final List<Interceptor> interceptors = new ArrayList<>();
    private final List<ErrorHandler> errorHandlers = new ArrayList<>();
    private final ParameterResolver resolver = new ParameterResolver();
    private final List<BoundProcessor> processors = new ArrayList<>();
    private final Map<HandlerEntry<?>, List<BoundProcessor>> boundProcessors = new IdentityHashMap<>();
    private volatile boolean built;

    public Registry() {
        StandardProviders.registerAll(resolver);
    }

    /**
     * Adds a route.
     *
     * @param route the route
     * @return the route
     * @throws ConfigurationException if a route with the same name exists for the method
     */
    public Route addRoute(Route route) {
        checkOpen();
        for (Route existing : router.getRoutes()) {
            if (existing.getMethod().equals(route.getMethod()) && existing.getName().equals(route.getName())) {
                throw new ConfigurationException("Duplicate route " + route.getName() + " for " + route.getMethod());
            }
        }
        return router.addRoute(route);
    }

    public Interceptor addInterceptor(Interceptor interceptor) {
        checkOpen();
        interceptors.add(interceptor);
        return interceptor;
    }

    /**
     * Adds an error handler.
     *
     * @param handler the handler
     * @return the handler
     * @throws ConfigurationException if a handler for the same status and pattern exists
     */
    public ErrorHandler addErrorHandler(ErrorHandler handler) {
        checkOpen();
        for (ErrorHandler existing : errorHandlers) {
            if (existing.getStatusCode() == handler.getStatusCode()
                && Objects.equals(existing.getUrlPattern(), handler.getUrlPattern())) {
                throw new ConfigurationException("Duplicate error handler for " + handler.getStatusCode()
                    + (handler.getUrlPattern() != null ? " on " + handler.getUrlPattern() : ""));
            }
        }
        errorHandlers.add(handler);
        return handler;
    }

    /**
     * Adds a parameter provider.
     *
     * @param marker the marker it serves
     * @param provider the provider
     * @param kinds the handler kinds that may use it; routes only when empty
     * @throws ConfigurationException if the marker already has a provider
     */
    public void addParameterProvider(ParameterMarker marker, ParameterProvider provider, HandlerKind... kinds) {
        checkOpen();
        resolver.register(marker, provider, kinds);
    }

    /**
     * Adds a response processor.
     *
     * @param metadataType the metadata type that triggers it, or null for every route
     * @param processor the processor
     */
    public void addResponseProcessor(Class<?> metadataType, ResponseProcessor processor) {
        checkOpen();
        processors.add(new BoundProcessor(metadataType, processor));
    }

    /**
     * Validates and freezes the registry.
     *
     * @throws ConfigurationException if a route name is duplicated or a declared parameter has
     *     no provider usable by its handler kind
     */
    public synchronized void build() {
        if (built) {
            return;
        }
        List<HandlerEntry<?>> entries = new ArrayList<>();
        entries.addAll(router.getRoutes());
        entries.addAll(interceptors);
        entries.addAll(errorHandlers);

        Set<String> routeNames = new HashSet<>();
        for (Route route : router.getRoutes()) {
            if (!routeNames.add(route.getMethod() + "|" + route.getName())) {
                throw new ConfigurationException("Duplicate route " + route.getName() + " for " + route.getMethod());
            }
        }
        for (HandlerEntry<?> entry : entries) {
            resolver.validate(entry);
        }

        // Stable sort: registration order within a group
        interceptors.sort(Comparator.comparingInt(Interceptor::getGroup));

        for (HandlerEntry<?> entry : entries) {
            List<BoundProcessor> bound = new ArrayList<>();
            for (BoundProcessor processor : processors) {
                if (processor.getMetadataType() == null && entry.getKind() != HandlerKind.ROUTE) {
                    continue;
                }
                bound.addAll(processor.bind(entry.getMetadata()));
            }
            boundProcessors.put(entry, Collections.unmodifiableList(bound));
            entry.seal();
        }
        built = true;
        logger.debug("Registry built: {} routes, {} interceptors, {} error handlers",
            router.getRoutes().size(), interceptors.size(), errorHandlers.size());
    }

    /** Removes every registration and restores the built-in parameter providers. */
    public synchronized void clear() {
        router.clear();
        interceptors.clear();
        errorHandlers.clear();
        processors.clear();
        boundProcessors.clear();
        resolver.clear();
        StandardProviders.registerAll(resolver);
        built = false;
    }

    public RouteMatch match(String method, String path) {
        return router.match(method, path);
    }

    public Set<String> allowedMethods(String path) {
        return router.allowedMethods(path);
    }

    /**
     * Lists the interceptors that apply to a path.
     *
     * @param path the request path
     * @return the interceptors, in group order
     */
    public List<Interceptor> interceptorsFor(String path) {
        List<Interceptor> matching = new ArrayList<>();
        for (Interceptor interceptor : interceptors) {
            if (interceptor.matches(path)) {
                matching.add(interceptor);
            }
        }
        return matching;
    }

    /**
     * Finds the error handler for a status and path.
     *
     * @param statusCode the status
     * @param path the request path
     * @return the first registered handler that matches, or null
     */
    public ErrorHandler findErrorHandler(int statusCode, String path) {
        for (ErrorHandler handler : errorHandlers) {
            if (handler.matches(statusCode, path)) {
                return handler;
            }
        }
        return null;
    }

    /**
     * Gets the response processors bound to an entry.
     *
     * @param entry a registered entry
     * @return the processors in registration order
     */
    public List<BoundProcessor> processorsFor(HandlerEntry<?> entry) {
        List<BoundProcessor> bound = boundProcessors.get(entry);
        return bound != null ? bound : Collections.emptyList();
    }

    public ParameterResolver getResolver() {
        return resolver;
    }

    public List<Route> getRoutes() {
        return router.getRoutes();
    }

    public List<Interceptor> getInterceptors() {
        return Collections.unmodifiableList(interceptors);
    }

    public List<ErrorHandler> getErrorHandlers() {
        return Collections.unmodifiableList(errorHandlers);
    }

    public boolean isBuilt() {
        return built;
    }

    private void checkOpen() {
        if (built) {
            throw new ConfigurationException("Registry is already built; register before setUp()");
        }
    }
}
