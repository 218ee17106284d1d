package com.redline.chain;

import com.redline.http.Request;
import com.redline.response.Response;

import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-request state shared by every element of a chain: the request, the response being built,
 * the failure that interrupted the chain and the chain view of the element currently running.
 *
 * <p>One context exists per in-flight request. Code running for the request reaches it through
 * {@link RequestScope}.</p>
 */
public class RequestContext {
    private static final Logger logger = LoggerFactory.getLogger(RequestContext.class);

    private final Request request;
    private final Executor executor;
    private volatile Response response;
    private volatile boolean responseLocked;
    private volatile Throwable error;
    private volatile boolean interrupted;
    private volatile Chain chain;

    public RequestContext(Request request) {
        this(request, ForkJoinPool.commonPool());
    }

    /**
     * Creates a context.
     *
     * @param request the request
     * @param executor runs asynchronous work started by the request's handlers
     */
    public RequestContext(Request request, Executor executor) {
        this.request = request;
        this.executor = executor;
    }

    public Request getRequest() {
        return request;
    }

    public Executor getExecutor() {
        return executor;
    }

    /**
     * Gets the response built so far.
     *
     * @return the response, or null before any element produced one
     */
    public Response getResponse() {
        return response;
    }

    /**
     * Replaces the response, unless an explicit interrupt value already fixed it.
     *
     * @param response the new response
     * @return true if the response was replaced
     */
    public boolean setResponse(Response response) {
        synchronized (this) {
            if (!responseLocked) {
                this.response = response;
                return true;
            }
        }
        logger.debug("Ignoring response {} for {}: fixed by interrupt", response, request);
        return false;
    }

    /**
     * Sets the response and keeps later {@link #setResponse(Response)} calls from replacing it.
     *
     * @param response the response
     */
    public synchronized void lockResponse(Response response) {
        this.response = response;
        this.responseLocked = true;
    }

    /**
     * Sets the response even when it is locked. Used for error responses.
     *
     * @param response the response
     */
    public synchronized void forceResponse(Response response) {
        this.response = response;
    }

    public boolean isResponseLocked() {
        return responseLocked;
    }

    public Throwable getError() {
        return error;
    }

    public void setError(Throwable error) {
        this.error = error;
    }

    public boolean isInterrupted() {
        return interrupted;
    }

    void markInterrupted() {
        this.interrupted = true;
    }

    public Chain getChain() {
        return chain;
    }

    void setChain(Chain chain) {
        this.chain = chain;
    }
}
