package com.redline.chain;

import com.redline.http.MockRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for binding request contexts to threads.
 */
@DisplayName("RequestScope Tests")
public class RequestScopeTest {

    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static RequestContext context(String path) {
        return new RequestContext(MockRequest.get(path).build());
    }

    @Test
    @DisplayName("Should bind a context only while code runs")
    void testRunBindsAndRestores() throws Exception {
        RequestContext context = context("/a");

        String path = RequestScope.call(context, () -> RequestScope.current().getRequest().getPath());

        assertEquals("/a", path);
        assertNull(RequestScope.current());
    }

    @Test
    @DisplayName("Should restore the outer context after a nested binding")
    void testNestedBinding() {
        RequestContext outer = context("/outer");
        RequestContext inner = context("/inner");

        RequestScope.run(outer, () -> {
            RequestScope.run(inner, () -> assertSame(inner, RequestScope.current()));
            assertSame(outer, RequestScope.current());
        });
    }

    @Test
    @DisplayName("Should restore the binding when code fails")
    void testRestoreOnFailure() {
        RequestContext context = context("/a");

        assertThrows(IllegalStateException.class, () -> RequestScope.call(context, () -> {
            throw new IllegalStateException("fail");
        }));
        assertNull(RequestScope.current());
    }

    @Test
    @DisplayName("Should carry the context to another thread through wrap")
    void testWrap() throws Exception {
        // Given: a task wrapped while a context is bound
        RequestContext context = context("/wrapped");
        CompletableFuture<RequestContext> seen = new CompletableFuture<>();
        Runnable body = () -> seen.complete(RequestScope.current());
        Runnable task = RequestScope.call(context, () -> RequestScope.wrap(body));

        // When: the task runs on another thread
        executor.execute(task);

        // Then: it sees the captured context
        assertSame(context, seen.get(5, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("Should leave tasks unchanged outside a request")
    void testWrapWithoutContext() {
        Runnable task = () -> { };

        assertSame(task, RequestScope.wrap(task));
    }

    @Test
    @DisplayName("Should keep concurrent requests apart")
    void testPropagatingExecutor() throws Exception {
        RequestContext first = context("/first");
        RequestContext second = context("/second");
        Executor propagating = RequestScope.propagating(executor);
        CompletableFuture<String> firstSeen = new CompletableFuture<>();
        CompletableFuture<String> secondSeen = new CompletableFuture<>();

        RequestScope.run(first, () -> propagating.execute(
            () -> firstSeen.complete(RequestScope.current().getRequest().getPath())));
        RequestScope.run(second, () -> propagating.execute(
            () -> secondSeen.complete(RequestScope.current().getRequest().getPath())));

        assertEquals("/first", firstSeen.get(5, TimeUnit.SECONDS));
        assertEquals("/second", secondSeen.get(5, TimeUnit.SECONDS));
    }
}
