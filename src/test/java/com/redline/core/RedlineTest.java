package com.redline.core;

import com.redline.chain.Interceptor;
import com.redline.error.ChainStallException;
import com.redline.error.ConfigurationException;
import com.redline.error.ErrorHandler;
import com.redline.http.BodyType;
import com.redline.http.MockRequest;
import com.redline.param.ParameterSpec;
import com.redline.response.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link Redline} request dispatch without a network transport.
 */
@DisplayName("Redline Dispatch Tests")
public class RedlineTest {

    private Redline app;

    @BeforeEach
    void setUp() {
        app = new Redline(new ServerConfig().setRequestTimeout(Duration.ofSeconds(5)));
    }

    @AfterEach
    void tearDown() {
        app.getThreadPool().shutdownNow();
    }

    private Response send(MockRequest request) throws Exception {
        app.setUp();
        return app.dispatch(request).get(10, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("Should refuse to dispatch before setup")
    void testDispatchBeforeSetUp() {
        assertThrows(IllegalStateException.class, () -> app.dispatch(MockRequest.get("/").build()));
    }

    @Test
    @DisplayName("Should write a text result with status 200")
    void testTextResult() throws Exception {
        // Given: a route returning a string
        app.get("/hello", args -> "Hello, World!");

        // When: the route is requested
        Response response = send(MockRequest.get("/hello").build());

        // Then: the text is written
        assertEquals(200, response.getStatus());
        assertEquals("Hello, World!", response.getBodyAsString());
        assertTrue(response.getContentType().startsWith("text/plain"));
    }

    @Test
    @DisplayName("Should write an empty 200 for a null result")
    void testNullResult() throws Exception {
        app.get("/empty", args -> null);

        Response response = send(MockRequest.get("/empty").build());

        assertEquals(200, response.getStatus());
        assertEquals(0, response.getBodyBytes().length);
    }

    @Test
    @DisplayName("Should write maps as JSON")
    void testJsonResult() throws Exception {
        app.get("/json", args -> Map.of("name", "redline"));

        Response response = send(MockRequest.get("/json").build());

        assertEquals(200, response.getStatus());
        assertEquals("application/json", response.getContentType());
        assertEquals("{\"name\":\"redline\"}", response.getBodyAsString());
    }

    @Test
    @DisplayName("Should bind and convert path variables")
    void testPathVariable() throws Exception {
        // Given: a route with an integer path parameter
        app.get("/users/:id", args -> {
            Integer id = args.get("id");
            return "user " + (id + 1);
        }).params(ParameterSpec.path("id", Integer.class));

        // When: a numeric id is requested
        Response response = send(MockRequest.get("/users/41").build());

        // Then: the handler receives an Integer
        assertEquals("user 42", response.getBodyAsString());
    }

    @Test
    @DisplayName("Should answer 400 naming the parameter when conversion fails")
    void testParameterConversionFailure() throws Exception {
        app.get("/users/:id", args -> "never").params(ParameterSpec.path("id", Integer.class));

        Response response = send(MockRequest.get("/users/abc").build());

        assertEquals(400, response.getStatus());
        String body = response.getBodyAsString();
        assertTrue(body.contains("'id'"), body);
        assertTrue(body.contains("GET /users/:id"), body);
    }

    @Test
    @DisplayName("Should pass a JSON body to the handler")
    void testJsonBody() throws Exception {
        app.post("/echo", args -> args.get("body"))
            .params(ParameterSpec.body(Map.class))
            .accepts(BodyType.JSON);

        Response response = send(MockRequest.post("/echo").json(Map.of("a", 1)).build());

        assertEquals(200, response.getStatus());
        assertEquals("{\"a\":1}", response.getBodyAsString());
    }

    @Test
    @DisplayName("Should reject a body type the route does not accept")
    void testRejectedBodyType() throws Exception {
        app.post("/echo", args -> "never").accepts(BodyType.JSON);

        Response response = send(MockRequest.post("/echo").body("text/plain", "hi").build());

        assertEquals(400, response.getStatus());
    }

    @Test
    @DisplayName("Should answer 404 when no route matches")
    void testNotFound() throws Exception {
        app.get("/exists", args -> "ok");

        Response response = send(MockRequest.get("/missing").build());

        assertEquals(404, response.getStatus());
        assertTrue(response.getBodyAsString().contains("/missing"));
    }

    @Test
    @DisplayName("Should answer 405 with an Allow header when only the method differs")
    void testMethodNotAllowed() throws Exception {
        app.get("/items", args -> "list");
        app.delete("/items", args -> "gone");

        Response response = send(MockRequest.post("/items").build());

        assertEquals(405, response.getStatus());
        assertEquals("DELETE, GET", response.getHeader("Allow"));
    }

    @Test
    @DisplayName("Should render a failing handler as 500")
    void testHandlerFailure() throws Exception {
        app.get("/boom", args -> {
            throw new IllegalStateException("kaboom");
        });

        Response response = send(MockRequest.get("/boom").build());

        assertEquals(500, response.getStatus());
        assertTrue(response.getBodyAsString().contains("kaboom"));
    }

    @Test
    @DisplayName("Should route a failure to a registered error handler")
    void testCustomErrorHandler() throws Exception {
        // Given: a 500 handler that reports the failure message
        app.get("/boom", args -> {
            throw new IllegalStateException("kaboom");
        });
        app.error(500, args -> "handled: " + args.chain().getError().getMessage());

        // When: the failing route is requested
        Response response = send(MockRequest.get("/boom").build());

        // Then: the handler renders the response with the error status
        assertEquals(500, response.getStatus());
        assertEquals("handled: kaboom", response.getBodyAsString());
    }

    @Test
    @DisplayName("Should abort with an error status")
    void testAbort() throws Exception {
        app.get("/secret", args -> {
            Redline.abort(403);
            return "never written";
        });
        app.error(403, args -> "forbidden here");

        Response response = send(MockRequest.get("/secret").build());

        assertEquals(403, response.getStatus());
        assertEquals("forbidden here", response.getBodyAsString());
    }

    @Test
    @DisplayName("Should send an error status returned normally to its handler")
    void testErrorStatusRerouted() throws Exception {
        app.get("/gone", args -> new Response(404));
        app.error(404, args -> "custom not found");

        Response response = send(MockRequest.get("/gone").build());

        assertEquals(404, response.getStatus());
        assertEquals("custom not found", response.getBodyAsString());
    }

    @Test
    @DisplayName("Should prefer an error handler scoped to the path")
    void testScopedErrorHandler() throws Exception {
        app.addErrorHandler(new ErrorHandler(404, "/api/.*", args -> "api not found"));
        app.error(404, args -> "site not found");

        Response api = send(MockRequest.get("/api/nothing").build());
        Response site = app.dispatch(MockRequest.get("/nothing").build()).get(10, TimeUnit.SECONDS);

        assertEquals("api not found", api.getBodyAsString());
        assertEquals("site not found", site.getBodyAsString());
    }

    @Test
    @DisplayName("Should send an error interrupt carrying a value to the handler for its status")
    void testInterruptValueRoutedToHandler() throws Exception {
        // Given: an interceptor interrupting with 404 and a raw value, and a 404 handler
        app.use(new Interceptor("/.*", args -> {
            args.chain().interrupt(404, "raw");
            return null;
        }));
        app.get("/p", args -> "never");
        app.error(404, args -> "custom 404");

        // When: the route is requested
        Response response = send(MockRequest.get("/p").build());

        // Then: the handler renders the response
        assertEquals(404, response.getStatus());
        assertEquals("custom 404", response.getBodyAsString());
    }

    @Test
    @DisplayName("Should write an error interrupt value when no handler exists for its status")
    void testInterruptValueWithoutHandler() throws Exception {
        app.use(new Interceptor("/.*", args -> {
            args.chain().interrupt(404, "raw");
            return null;
        }));
        app.get("/p", args -> "never");

        Response response = send(MockRequest.get("/p").build());

        assertEquals(404, response.getStatus());
        assertEquals("raw", response.getBodyAsString());
    }

    @Test
    @DisplayName("Should run response processors with the request context bound")
    void testResponseProcessorSeesRequest() throws Exception {
        // Given: a global processor that reads the ambient request
        app.addResponseProcessor(null, (metadata, handlerName, value, locator) ->
            value + "@" + Redline.request().getPath());
        app.get("/p", args -> "v");

        // When: the route is requested
        Response response = send(MockRequest.get("/p").build());

        // Then: the processed value is written
        assertEquals(200, response.getStatus());
        assertEquals("v@/p", response.getBodyAsString());
    }

    @Test
    @DisplayName("Should keep the request context for processors after an asynchronous one")
    void testProcessorAfterAsyncProcessor() throws Exception {
        // Given: an asynchronous processor followed by one that reads the ambient chain and request
        app.addResponseProcessor(null, (metadata, handlerName, value, locator) ->
            Redline.async(() -> value + "!"));
        app.addResponseProcessor(null, (metadata, handlerName, value, locator) ->
            value + (Redline.chain() != null ? "@" : "?") + Redline.request().getPath());
        app.get("/p", args -> "v");

        // When: the route is requested
        Response response = send(MockRequest.get("/p").build());

        // Then: both processors ran in order
        assertEquals(200, response.getStatus());
        assertEquals("v!@/p", response.getBodyAsString());
    }

    @Test
    @DisplayName("Should route a value that cannot be serialized to the 500 handler")
    void testSerializationFailureRouted() throws Exception {
        // Given: a route returning a map with a value Jackson cannot write
        app.get("/bad", args -> Map.of("bad", new Object()));
        app.error(500, args -> "handled " + args.chain().getError().getClass().getSimpleName());

        // When: the route is requested
        Response response = send(MockRequest.get("/bad").build());

        // Then: the serialization failure reaches the error handler
        assertEquals(500, response.getStatus());
        assertEquals("handled SerializationException", response.getBodyAsString());
    }

    @Test
    @DisplayName("Should answer a value that cannot be serialized with the 500 page")
    void testSerializationFailureDefaultPage() throws Exception {
        app.get("/bad", args -> Map.of("bad", new Object()));

        Response response = send(MockRequest.get("/bad").build());

        assertEquals(500, response.getStatus());
        assertTrue(response.getBodyAsString().contains("500 - INTERNAL SERVER ERROR"));
    }

    @Test
    @DisplayName("Should fall back to the error page when the error handler fails")
    void testFailingErrorHandler() throws Exception {
        // Given: a failing route and a 500 handler that fails too
        app.get("/boom", args -> {
            throw new IllegalStateException("kaboom");
        });
        app.error(500, args -> {
            throw new IllegalArgumentException("handler broke");
        });

        // When: the route is requested
        Response response = send(MockRequest.get("/boom").build());

        // Then: the built-in page reports the handler failure with the original status
        assertEquals(500, response.getStatus());
        String body = response.getBodyAsString();
        assertTrue(body.contains("500 - INTERNAL SERVER ERROR"), body);
        assertTrue(body.contains("handler broke"), body);
    }

    @Test
    @DisplayName("Should redirect relative to the requested URI")
    void testRedirect() throws Exception {
        app.get("/old/page", args -> {
            Redline.redirect("../new/page");
            return null;
        });

        Response response = send(MockRequest.get("/old/page").build());

        assertEquals(302, response.getStatus());
        assertEquals("/new/page", response.getHeader("Location"));
    }

    @Test
    @DisplayName("Should complete asynchronous handlers on the worker pool")
    void testAsyncHandler() throws Exception {
        app.get("/slow", args -> Redline.async(() -> {
            assertNotNull(Redline.request());
            return Thread.currentThread().getName();
        }));

        Response response = send(MockRequest.get("/slow").build());

        assertEquals(200, response.getStatus());
        assertTrue(response.getBodyAsString().startsWith("redline-worker-"));
    }

    @Test
    @DisplayName("Should answer 500 when an interceptor never advances the chain")
    void testStalledChain() throws Exception {
        // Given: a short deadline and an interceptor that neither continues nor interrupts
        app.getThreadPool().shutdownNow();
        app = new Redline(new ServerConfig().setRequestTimeout(Duration.ofMillis(200)));
        app.addInterceptor(new Interceptor("/.*", args -> null).name("sleepy"));
        app.get("/never", args -> "unreachable");

        // When: the route is requested
        Response response = send(MockRequest.get("/never").build());

        // Then: the deadline produces a 500 naming the stalled element
        assertEquals(500, response.getStatus());
        String body = response.getBodyAsString();
        assertTrue(body.contains("Chain did not advance past"), body);
        assertTrue(body.contains("sleepy"), body);
    }

    @Test
    @DisplayName("Should hand the stall failure to the 500 handler")
    void testStalledChainHandled() throws Exception {
        app.getThreadPool().shutdownNow();
        app = new Redline(new ServerConfig().setRequestTimeout(Duration.ofMillis(200)));
        app.addInterceptor(new Interceptor("/.*", args -> null));
        app.get("/never", args -> "unreachable");
        app.error(500, args -> args.chain().getError().getClass().getSimpleName());

        Response response = send(MockRequest.get("/never").build());

        assertEquals(500, response.getStatus());
        assertEquals(ChainStallException.class.getSimpleName(), response.getBodyAsString());
    }

    @Test
    @DisplayName("Should reject registrations after setup")
    void testRegistrationAfterSetUp() {
        app.get("/a", args -> "a");
        app.setUp();

        assertThrows(ConfigurationException.class, () -> app.get("/b", args -> "b"));
        assertTrue(app.isSetUp());
    }

    @Test
    @DisplayName("Should allow reconfiguration after tear down")
    void testTearDown() throws Exception {
        app.get("/a", args -> "a");
        app.setUp();
        app.tearDown();

        app.get("/b", args -> "b");
        Response response = send(MockRequest.get("/b").build());

        assertEquals("b", response.getBodyAsString());
        assertEquals(List.of("GET /b"), List.of(app.getRegistry().getRoutes().get(0).getName()));
    }

    @Test
    @DisplayName("Should fail outside a request")
    void testAmbientHelpersOutsideRequest() {
        assertThrows(IllegalStateException.class, Redline::request);
        assertThrows(IllegalStateException.class, Redline::chain);
    }
}
