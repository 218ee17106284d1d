package com.redline.error;

import com.redline.chain.ChainServices;
import com.redline.chain.RequestContext;
import com.redline.core.Registry;
import com.redline.http.MockRequest;
import com.redline.inject.SimpleServiceLocator;
import com.redline.param.ParameterSpec;
import com.redline.response.ErrorResponse;
import com.redline.response.Response;
import com.redline.response.ResponseWriter;
import com.redline.response.UndertowMimeTypes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for rendering error statuses through handlers and the built-in page.
 */
@DisplayName("ErrorRouter Tests")
public class ErrorRouterTest {

    private Registry registry;
    private ChainServices services;
    private RequestContext context;

    @BeforeEach
    void setUp() {
        registry = new Registry();
        SimpleServiceLocator locator = new SimpleServiceLocator();
        services = new ChainServices(registry.getResolver(),
            new ResponseWriter(locator, new UndertowMimeTypes()), locator);
        context = new RequestContext(MockRequest.get("/missing/page").build());
    }

    private Response route(int status, Throwable error) throws Exception {
        registry.build();
        ErrorRouter router = new ErrorRouter(registry, services, false);
        return router.route(status, context, error).get(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("Should render the error page when no handler is registered")
    void testDefaultPage() throws Exception {
        Response response = route(404, null);

        assertEquals(404, response.getStatus());
        assertTrue(response.getContentType().startsWith("text/html"));
        String body = response.getBodyAsString();
        assertTrue(body.contains("404 - NOT FOUND"), body);
        assertTrue(body.contains("/missing/page"), body);
    }

    @Test
    @DisplayName("Should answer an expected abort with its message")
    void testRequestExceptionMessage() throws Exception {
        Response response = route(409, new RequestException(409, "version conflict"));

        assertEquals(409, response.getStatus());
        assertEquals("version conflict", response.getBodyAsString());
    }

    @Test
    @DisplayName("Should include the failure but no stack trace when traces are off")
    void testUnexpectedFailure() throws Exception {
        Response response = route(500, new IllegalStateException("exploded"));

        String body = response.getBodyAsString();
        assertEquals(500, response.getStatus());
        assertTrue(body.contains("exploded"), body);
        assertFalse(body.contains("at com.redline"), body);
    }

    @Test
    @DisplayName("Should run a registered handler with the status as default")
    void testCustomHandler() throws Exception {
        // Given: a 404 handler reading the request path
        registry.addErrorHandler(new ErrorHandler(404, args -> "nothing at " + args.request().getPath()));

        // When: a 404 is routed
        Response response = route(404, null);

        // Then: the handler's value is written with status 404
        assertEquals(404, response.getStatus());
        assertEquals("nothing at /missing/page", response.getBodyAsString());
        assertNull(context.getResponse());
    }

    @Test
    @DisplayName("Should let an error handler choose another status")
    void testHandlerStatus() throws Exception {
        registry.addErrorHandler(new ErrorHandler(500, args ->
            new ErrorResponse(503, Map.of("retry", true))));

        Response response = route(500, new IllegalStateException());

        assertEquals(503, response.getStatus());
        assertEquals("{\"retry\":true}", response.getBodyAsString());
    }

    @Test
    @DisplayName("Should resolve handler parameters")
    void testHandlerParameters() throws Exception {
        context = new RequestContext(MockRequest.get("/missing/page?lang=fr").build());
        registry.addErrorHandler(new ErrorHandler(404, args -> "introuvable " + args.get("lang"))
            .params(ParameterSpec.query("lang", String.class)));

        Response response = route(404, null);

        assertEquals("introuvable fr", response.getBodyAsString());
    }

    @Test
    @DisplayName("Should fall back to the error page when the handler fails")
    void testHandlerFailure() throws Exception {
        // Given: a handler that throws
        registry.addErrorHandler(new ErrorHandler(403, args -> {
            throw new IllegalStateException("handler broke");
        }));

        // When: a 403 is routed
        Response response = route(403, null);

        // Then: the built-in page renders the original status and the handler failure
        assertEquals(403, response.getStatus());
        String body = response.getBodyAsString();
        assertTrue(body.contains("403 - FORBIDDEN"), body);
        assertTrue(body.contains("handler broke"), body);
    }

    @Test
    @DisplayName("Should only handle statuses with a matching handler")
    void testHandles() {
        registry.addErrorHandler(new ErrorHandler(404, "/api/.*", args -> "api"));
        registry.build();
        ErrorRouter router = new ErrorRouter(registry, services, true);

        assertTrue(router.handles(404, "/api/users"));
        assertFalse(router.handles(404, "/web"));
        assertFalse(router.handles(500, "/api/users"));
    }

    @Test
    @DisplayName("Should reject an invalid handler pattern")
    void testInvalidPattern() {
        assertThrows(ConfigurationException.class, () -> new ErrorHandler(404, "/api/(", args -> null));
    }
}
