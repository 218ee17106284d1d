package com.redline.param;

import com.redline.chain.Chain;
import com.redline.chain.RequestContext;
import com.redline.chain.RequestScope;
import com.redline.core.HandlerEntry;
import com.redline.core.HandlerKind;
import com.redline.error.ConfigurationException;
import com.redline.error.ParameterResolutionException;
import com.redline.error.RequestException;
import com.redline.http.Request;
import com.redline.inject.ServiceLocator;
import com.redline.util.Futures;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a handler's declared parameters through the providers registered for their markers.
 *
 * <p>Parameters are resolved one at a time in declaration order; an asynchronous provider is
 * awaited before the next parameter is looked at. The first failure aborts the invocation with
 * a {@link ParameterResolutionException} naming the handler and the parameter. Providers run
 * with the caller's request context bound, even when an earlier provider completed on another
 * thread.</p>
 */
public class ParameterResolver {
    private static final Logger logger = LoggerFactory.getLogger(ParameterResolver.class);

    private final Map<ParameterMarker, Registration> providers = new LinkedHashMap<>();

    /**
     * Registers a provider.
     *
     * @param marker the marker it serves
     * @param provider the provider
     * @param kinds the handler kinds allowed to use it; ROUTE when empty
     * @throws ConfigurationException if the marker already has a provider
     */
    public void register(ParameterMarker marker, ParameterProvider provider, HandlerKind... kinds) {
        if (providers.containsKey(marker)) {
            throw new ConfigurationException("A parameter provider is already registered for " + marker.name());
        }
        Set<HandlerKind> allowed = kinds.length == 0 ? EnumSet.of(HandlerKind.ROUTE) : EnumSet.noneOf(HandlerKind.class);
        Collections.addAll(allowed, kinds);
        providers.put(marker, new Registration(provider, allowed));
    }

    /**
     * Checks whether a handler kind may use a marker.
     *
     * @param marker the marker
     * @param kind the handler kind
     * @return true if a provider is registered for the marker and allows the kind
     */
    public boolean supports(ParameterMarker marker, HandlerKind kind) {
        Registration registration = providers.get(marker);
        return registration != null && registration.kinds.contains(kind);
    }

    /**
     * Checks that every declared parameter of an entry has a provider usable by its kind and a
     * type other than void.
     *
     * @param entry the entry
     * @throws ConfigurationException for the first unsupported parameter
     */
    public void validate(HandlerEntry<?> entry) {
        for (ParameterSpec spec : entry.getParameters()) {
            if (!supports(spec.getMarker(), entry.getKind())) {
                throw new ConfigurationException(String.format(
                    "No parameter provider for %s on %s '%s' (parameter '%s')",
                    spec.getMarker().name(), entry.getKind(), entry.getName(), spec.getName()));
            }
            if (spec.getType() == void.class || spec.getType() == Void.class) {
                throw new ConfigurationException(String.format(
                    "Parameter '%s' on %s '%s' cannot be declared void",
                    spec.getName(), entry.getKind(), entry.getName()));
            }
        }
    }

    /**
     * Resolves an entry's parameters.
     *
     * @param entry the handler entry
     * @param request the request
     * @param chain the chain passed on to the handler
     * @param locator the service locator handed to providers
     * @return the arguments, or a future failed with {@link ParameterResolutionException}
     */
    public CompletableFuture<Arguments> resolve(HandlerEntry<?> entry, Request request, Chain chain,
                                                ServiceLocator locator) {
        List<ParameterSpec> specs = entry.getParameters();
        List<String> names = new ArrayList<>(specs.size());
        List<Object> values = new ArrayList<>(specs.size());
        RequestContext scope = RequestScope.current();

        CompletableFuture<Void> pending = CompletableFuture.completedFuture(null);
        for (ParameterSpec spec : specs) {
            pending = pending
                .thenCompose(ignored -> resolveOne(entry.getName(), spec, request, locator, scope))
                .thenAccept(value -> {
                    names.add(spec.getName());
                    values.add(value);
                });
        }
        return pending.thenApply(ignored -> new Arguments(names, values, request, chain));
    }

    private CompletableFuture<Object> resolveOne(String handlerName, ParameterSpec spec, Request request,
                                                 ServiceLocator locator, RequestContext scope) {
        Registration registration = providers.get(spec.getMarker());
        if (registration == null) {
            return CompletableFuture.failedFuture(new ParameterResolutionException(500, handlerName,
                spec.getName(), "no provider registered for " + spec.getMarker().name(), null));
        }

        CompletableFuture<Object> value;
        try {
            Callable<Object> provide = () -> registration.provider.provide(spec.getMetadata(), spec.getType(),
                handlerName, spec.getName(), request, locator);
            value = Futures.toFuture(scope != null ? RequestScope.call(scope, provide) : provide.call());
        } catch (Exception e) {
            value = CompletableFuture.failedFuture(e);
        }

        return value.handle((result, failure) -> {
            if (failure != null) {
                throw wrap(handlerName, spec, Futures.unwrap(failure));
            }
            if (result == null && spec.isRequired()) {
                throw new ParameterResolutionException(400, handlerName, spec.getName(),
                    "missing required value", null);
            }
            return result;
        });
    }

    private ParameterResolutionException wrap(String handlerName, ParameterSpec spec, Throwable cause) {
        if (cause instanceof ParameterResolutionException) {
            return (ParameterResolutionException) cause;
        }
        int status = cause instanceof RequestException ? ((RequestException) cause).getStatusCode() : 400;
        logger.debug("Parameter '{}' of {} failed", spec.getName(), handlerName, cause);
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new ParameterResolutionException(status, handlerName, spec.getName(), reason, cause);
    }

    /** Removes every provider. */
    public void clear() {
        providers.clear();
    }

    private static final class Registration {
        final ParameterProvider provider;
        final Set<HandlerKind> kinds;

        Registration(ParameterProvider provider, Set<HandlerKind> kinds) {
            this.provider = provider;
            this.kinds = kinds;
        }
    }
}
