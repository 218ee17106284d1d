package com.redline.chain;

import com.redline.core.HandlerEntry;
import com.redline.error.RequestException;
import com.redline.response.BoundProcessor;
import com.redline.response.Response;
import com.redline.routing.Route;
import com.redline.util.Futures;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one request through its chain: the matching interceptors in order, then the target.
 *
 * <p>Each element runs in two steps. Its <em>portion</em> is the synchronous call of its handler
 * plus the stage that call returns. Calls to {@link Chain#next()} or {@link Chain#interrupt()}
 * made while the portion is in progress take effect when it ends, so no two elements of a chain
 * ever run at the same time. Calls made later, from asynchronous code, take effect at once.</p>
 *
 * <p>Continuations passed to {@code next} are kept on a stack and run after the target, last
 * scheduled first, each awaited before the next one starts. They also run when the chain is
 * interrupted. A failure anywhere becomes an interrupt with the failure's status: the status of a
 * {@link RequestException}, 500 for anything else.</p>
 *
 * <p>An interrupt with a status of 400 or more goes to the failure route. Its value, if any, is
 * written instead only when no custom handler exists for that status.</p>
 */
public class ChainExecutor {
    private static final Logger logger = LoggerFactory.getLogger(ChainExecutor.class);

    private final RequestContext context;
    private final List<HandlerEntry<?>> elements;
    private final int targetIndex;
    private final int missingStatus;
    private final String allowHeader;
    private final List<BoundProcessor> processors;
    private final ChainServices services;
    private final FailureRoute failureRoute;
    private final int defaultStatus;
    private final boolean errorMode;

    private final ChainState[] states;
    private final Chain[] views;
    private final Deque<Continuation> continuations = new ArrayDeque<>();
    private final CompletableFuture<Response> result = new CompletableFuture<>();

    private int cursor = -1;
    private boolean portionActive;
    private boolean advanceRequested;
    private boolean interrupted;
    private boolean finishing;
    private boolean errorRouted;
    private Interrupt pendingInterrupt;
    private volatile Throwable error;

    // Response slot of an error handler chain, kept apart from the request's own response
    private Response localResponse;
    private boolean localLocked;

    private ChainExecutor(RequestContext context, List<HandlerEntry<?>> elements, int missingStatus,
                          String allowHeader, List<BoundProcessor> processors, ChainServices services,
                          FailureRoute failureRoute, int defaultStatus, boolean errorMode) {
        this.context = context;
        this.elements = elements;
        this.targetIndex = elements.size() - 1;
        this.missingStatus = missingStatus;
        this.allowHeader = allowHeader;
        this.processors = processors;
        this.services = services;
        this.failureRoute = failureRoute;
        this.defaultStatus = defaultStatus;
        this.errorMode = errorMode;
        this.states = new ChainState[elements.size()];
        Arrays.fill(states, ChainState.PENDING);
        this.views = new Chain[elements.size()];
        for (int i = 0; i < views.length; i++) {
            views[i] = new ElementChain(i);
        }
    }

    /**
     * Creates the chain of a request.
     *
     * @param context the request context
     * @param interceptors the matching interceptors, already ordered
     * @param route the matched route, or null when no route matches
     * @param processors the response processors bound to the route
     * @param allowedMethods methods that match the path when {@code route} is null; a non-empty
     *     set turns the missing route into a 405 instead of a 404
     * @param services the resolver, writer and locator
     * @param errors where error statuses and failures are sent
     * @return the executor
     */
    public static ChainExecutor forRoute(RequestContext context, List<Interceptor> interceptors, Route route,
                                         List<BoundProcessor> processors, Set<String> allowedMethods,
                                         ChainServices services, FailureRoute errors) {
        List<HandlerEntry<?>> elements = new ArrayList<>(interceptors);
        elements.add(route);
        boolean wrongMethod = route == null && !allowedMethods.isEmpty();
        return new ChainExecutor(context, elements, wrongMethod ? 405 : 404,
            wrongMethod ? String.join(", ", allowedMethods) : null,
            processors, services, errors, 200, false);
    }

    /**
     * Creates the one-element chain that runs an error handler.
     *
     * @param context the request context
     * @param handler the error handler
     * @param statusCode the status being handled, also the default status of its response
     * @param error the failure being handled, reported by the handler's {@link Chain#getError()}
     * @param processors the response processors bound to the handler
     * @param services the resolver, writer and locator
     * @param fallback renders the response when the handler itself fails
     * @return the executor
     */
    public static ChainExecutor forErrorHandler(RequestContext context, HandlerEntry<?> handler, int statusCode,
                                                Throwable error, List<BoundProcessor> processors,
                                                ChainServices services, FailureRoute fallback) {
        List<HandlerEntry<?>> elements = new ArrayList<>();
        elements.add(handler);
        ChainExecutor executor =
            new ChainExecutor(context, elements, 404, null, processors, services, fallback, statusCode, true);
        executor.error = error;
        return executor;
    }

    /**
     * Runs the chain.
     *
     * @return the final response; never completes exceptionally
     */
    public CompletableFuture<Response> execute() {
        Chain previous = context.getChain();
        if (errorMode) {
            result.whenComplete((response, failure) -> context.setChain(previous));
        }
        runElement(0);
        return result;
    }

    /**
     * Gets the name of the element the chain is waiting on.
     *
     * @return the element name
     */
    public synchronized String currentElementName() {
        return nameOf(cursor);
    }

    /**
     * Gets the state of an element.
     *
     * @param index the element index; the target is last
     * @return the state
     */
    public synchronized ChainState getState(int index) {
        return states[index];
    }

    /**
     * Stops reacting to the chain, for example once the dispatch deadline has passed.
     * Later calls to {@code next} and {@code interrupt} are ignored.
     */
    public synchronized void abandon() {
        finishing = true;
    }

    private void runElement(int index) {
        synchronized (this) {
            if (finishing) {
                return;
            }
            cursor = index;
            states[index] = ChainState.RUNNING;
            portionActive = true;
            advanceRequested = false;
        }
        context.setChain(views[index]);
        if (logger.isDebugEnabled()) {
            logger.debug("{}: running {}", context.getRequest(), nameOf(index));
        }
        startPortion(index).whenComplete((value, failure) -> endPortion(index, value, failure));
    }

    private CompletableFuture<Object> startPortion(int index) {
        HandlerEntry<?> entry = elements.get(index);
        if (entry == null) {
            return CompletableFuture.completedFuture(null);
        }
        if (entry instanceof Route) {
            Route route = (Route) entry;
            if (!route.getBodyTypes().isEmpty()
                && !route.getBodyTypes().contains(context.getRequest().getBodyType())) {
                return CompletableFuture.failedFuture(new RequestException(400,
                    "Unsupported body type " + context.getRequest().getBodyType() + " for " + route.getName()));
            }
        }
        try {
            return RequestScope.call(context, () -> services.getResolver()
                .resolve(entry, context.getRequest(), views[index], services.getLocator())
                .<Object>thenCompose(args -> {
                    try {
                        return Futures.toFuture(RequestScope.call(context, () -> entry.getHandler().handle(args)));
                    } catch (Exception e) {
                        return CompletableFuture.failedFuture(e);
                    }
                }));
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void endPortion(int index, Object value, Throwable failure) {
        boolean advance = false;
        boolean interruptNow = false;
        synchronized (this) {
            portionActive = false;
            if (finishing) {
                return;
            }
            if (failure == null) {
                if (interrupted) {
                    interruptNow = true;
                } else if (index != targetIndex) {
                    if (advanceRequested) {
                        advance = true;
                    } else if (states[index] == ChainState.RUNNING) {
                        states[index] = ChainState.SUSPENDED;
                    }
                }
            }
        }

        if (failure != null) {
            fail(failure);
        } else if (interruptNow) {
            finishInterrupted();
        } else if (index == targetIndex) {
            if (elements.get(index) == null) {
                missingTarget();
            } else {
                targetCompleted(value);
            }
        } else if (advance) {
            runElement(index + 1);
        }
    }

    private void next(int index, Continuation continuation) {
        synchronized (this) {
            if (finishing || interrupted) {
                logger.warn("{}: next() from {} ignored, chain already interrupted", context.getRequest(), nameOf(index));
                return;
            }
            if (index == targetIndex) {
                logger.debug("{}: next() from the target ignored", context.getRequest());
                return;
            }
            if (states[index] != ChainState.RUNNING && states[index] != ChainState.SUSPENDED) {
                logger.warn("{}: next() called twice by {}", context.getRequest(), nameOf(index));
                return;
            }
            if (continuation != null) {
                continuations.push(continuation);
            }
            states[index] = ChainState.COMPLETED;
            if (portionActive && cursor == index) {
                advanceRequested = true;
                return;
            }
        }
        runElement(index + 1);
    }

    private void interrupt(Integer statusCode, Object value, String contentType) {
        synchronized (this) {
            if (finishing || interrupted) {
                logger.warn("{}: interrupt() ignored, chain already interrupted", context.getRequest());
                return;
            }
            interrupted = true;
            pendingInterrupt = new Interrupt(statusCode, value, contentType, null);
            if (portionActive) {
                return;
            }
        }
        finishInterrupted();
    }

    private void missingTarget() {
        synchronized (this) {
            if (finishing || interrupted) {
                return;
            }
            interrupted = true;
            pendingInterrupt = new Interrupt(missingStatus, null, null, null);
        }
        logger.debug("{}: no route, responding {}", context.getRequest(), missingStatus);
        finishInterrupted();
    }

    private void fail(Throwable failure) {
        Throwable cause = Futures.unwrap(failure);
        int status = statusOf(cause);
        if (status >= 500) {
            logger.error("{}: {} failed", context.getRequest(), currentElementName(), cause);
        } else {
            logger.debug("{}: {} aborted with {}", context.getRequest(), currentElementName(), status, cause);
        }

        synchronized (this) {
            if (finishing) {
                logger.warn("{}: failure after the chain finished", context.getRequest(), cause);
                return;
            }
            recordError(cause);
            if (!interrupted) {
                interrupted = true;
                pendingInterrupt = new Interrupt(status, null, null, cause);
            }
        }
        finishInterrupted();
    }

    private void finishInterrupted() {
        Interrupt pending;
        synchronized (this) {
            if (finishing) {
                return;
            }
            finishing = true;
            pending = pendingInterrupt;
            if (cursor >= 0) {
                states[cursor] = ChainState.INTERRUPTED;
            }
        }
        if (!errorMode) {
            context.markInterrupted();
        }

        CompletableFuture<Void> responded;
        Integer status = pending.statusCode;
        if (status != null && status >= 400 && (pending.value == null || hasCustomHandler(status))) {
            responded = routeError(status, pending.error != null ? pending.error : error);
        } else if (status != null || pending.value != null) {
            responded = write(currentElementName(), pending.value, status != null ? status : defaultStatus,
                    pending.contentType, List.of())
                .handle((response, failure) -> {
                    if (failure == null) {
                        lockResponse(response);
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    Throwable cause = Futures.unwrap(failure);
                    recordError(cause);
                    return routeError(statusOf(cause), cause);
                })
                .thenCompose(f -> f);
        } else {
            responded = CompletableFuture.completedFuture(null);
        }

        responded
            .thenCompose(ignored -> unwind())
            .whenComplete((ignored, failure) -> complete(false));
    }

    private void targetCompleted(Object value) {
        synchronized (this) {
            if (finishing) {
                return;
            }
            states[targetIndex] = ChainState.COMPLETED;
        }
        write(nameOf(targetIndex), value, defaultStatus, null, processors)
            .whenComplete((response, failure) -> {
                if (failure != null) {
                    fail(failure);
                    return;
                }
                synchronized (this) {
                    if (finishing || interrupted) {
                        return;
                    }
                    finishing = true;
                }
                setResponse(response);
                unwind().whenComplete((ignored, unwindFailure) -> complete(true));
            });
    }

    // Processors run inside the request scope, like handlers
    private CompletableFuture<Response> write(String handlerName, Object value, int statusCode,
                                              String contentType, List<BoundProcessor> bound) {
        try {
            return RequestScope.call(context,
                () -> services.getWriter().write(handlerName, value, statusCode, contentType, bound));
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    // An error handler chain answers its own interrupts to avoid routing in a loop
    private boolean hasCustomHandler(int statusCode) {
        return !errorMode && failureRoute.handles(statusCode, context.getRequest().getPath());
    }

    private CompletableFuture<Void> unwind() {
        Continuation continuation;
        synchronized (this) {
            continuation = continuations.poll();
        }
        if (continuation == null) {
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<Object> pending;
        try {
            pending = Futures.toFuture(RequestScope.call(context, continuation::run));
        } catch (Exception e) {
            pending = CompletableFuture.failedFuture(e);
        }
        return pending
            .handle((value, failure) -> failure)
            .thenCompose(failure -> {
                if (failure == null) {
                    return CompletableFuture.<Void>completedFuture(null);
                }
                Throwable cause = Futures.unwrap(failure);
                logger.error("{}: continuation failed", context.getRequest(), cause);
                recordError(cause);
                return routeError(statusOf(cause), cause);
            })
            .thenCompose(ignored -> unwind());
    }

    private CompletableFuture<Void> routeError(int statusCode, Throwable cause) {
        return failureRoute.route(statusCode, context, cause)
            .handle((response, failure) -> {
                Response routed = response != null ? response : Response.internalServerError();
                if (allowHeader != null && statusCode == 405) {
                    routed.header("Allow", allowHeader);
                }
                forceResponse(routed);
                synchronized (this) {
                    errorRouted = true;
                }
                return null;
            });
    }

    private void complete(boolean normal) {
        boolean routed;
        synchronized (this) {
            for (int i = 0; i < states.length; i++) {
                if (states[i] != ChainState.PENDING && states[i] != ChainState.INTERRUPTED) {
                    states[i] = ChainState.FINISHED;
                }
            }
            routed = errorRouted;
        }

        Response response = currentResponse();
        if (response == null) {
            response = new Response(defaultStatus);
        }
        int status = response.getStatus();
        String path = context.getRequest().getPath();
        if (normal && !errorMode && !routed && status >= 400 && failureRoute.handles(status, path)) {
            Response unrouted = response;
            failureRoute.route(status, context, error)
                .whenComplete((routedResponse, failure) -> {
                    Response last = routedResponse != null ? routedResponse : unrouted;
                    context.forceResponse(last);
                    result.complete(last);
                });
            return;
        }
        result.complete(response);
    }

    private void recordError(Throwable cause) {
        error = cause;
        if (!errorMode) {
            context.setError(cause);
        }
    }

    private void setResponse(Response response) {
        if (!errorMode) {
            context.setResponse(response);
            return;
        }
        synchronized (this) {
            if (!localLocked) {
                localResponse = response;
            }
        }
    }

    private void lockResponse(Response response) {
        if (!errorMode) {
            context.lockResponse(response);
            return;
        }
        synchronized (this) {
            localResponse = response;
            localLocked = true;
        }
    }

    private void forceResponse(Response response) {
        if (!errorMode) {
            context.forceResponse(response);
            return;
        }
        synchronized (this) {
            localResponse = response;
        }
    }

    private synchronized Response currentResponse() {
        return errorMode ? localResponse : context.getResponse();
    }

    private String nameOf(int index) {
        if (index < 0) {
            return "chain";
        }
        HandlerEntry<?> entry = elements.get(index);
        return entry != null ? entry.getName() : "missing route";
    }

    private static int statusOf(Throwable failure) {
        return failure instanceof RequestException ? ((RequestException) failure).getStatusCode() : 500;
    }

    /** A requested interrupt, applied once the running portion has ended. */
    private static final class Interrupt {
        final Integer statusCode;
        final Object value;
        final String contentType;
        final Throwable error;

        Interrupt(Integer statusCode, Object value, String contentType, Throwable error) {
            this.statusCode = statusCode;
            this.value = value;
            this.contentType = contentType;
            this.error = error;
        }
    }

    /** The chain as seen by one element. */
    private final class ElementChain implements Chain {
        private final int index;

        ElementChain(int index) {
            this.index = index;
        }

        @Override
        public void next() {
            ChainExecutor.this.next(index, null);
        }

        @Override
        public void next(Continuation continuation) {
            ChainExecutor.this.next(index, continuation);
        }

        @Override
        public void interrupt() {
            ChainExecutor.this.interrupt(null, null, null);
        }

        @Override
        public void interrupt(int statusCode) {
            ChainExecutor.this.interrupt(statusCode, null, null);
        }

        @Override
        public void interrupt(int statusCode, Object value) {
            ChainExecutor.this.interrupt(statusCode, value, null);
        }

        @Override
        public void interrupt(int statusCode, Object value, String contentType) {
            ChainExecutor.this.interrupt(statusCode, value, contentType);
        }

        @Override
        public boolean isInterrupted() {
            synchronized (ChainExecutor.this) {
                return interrupted;
            }
        }

        @Override
        public Throwable getError() {
            return error;
        }
    }
}
