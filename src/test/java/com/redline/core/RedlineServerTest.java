package com.redline.core;

import com.redline.error.ConfigurationException;
import com.redline.http.Session;
import com.redline.param.ParameterSpec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.CookieManager;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests that serve requests over HTTP through Undertow.
 */
@DisplayName("Redline Server Tests")
public class RedlineServerTest {

    private static final int REQUEST_TIMEOUT_SECONDS = 10;

    private Redline app;
    private HttpClient httpClient;

    @BeforeEach
    void setUp() {
        app = new Redline(new ServerConfig()
                .setHost("127.0.0.1")
                .setPort(0)
                .setIoThreads(1)
                .setWorkerThreads(4));

        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .cookieHandler(new CookieManager())
                .build();
    }

    @AfterEach
    void tearDown() {
        app.stop();
        app.getThreadPool().shutdownNow();
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create("http://127.0.0.1:" + app.getPort() + path))
                .timeout(Duration.ofSeconds(REQUEST_TIMEOUT_SECONDS))
                .GET()
                .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    @DisplayName("Should bind an ephemeral port and serve a text route")
    void testServeText() throws Exception {
        // Given: a running server with one route
        app.get("/hello", args -> "Hello, World!");
        app.listen();

        // When: the route is requested over HTTP
        HttpResponse<String> response = get("/hello");

        // Then: the body and status come back
        assertTrue(app.getPort() > 0);
        assertEquals(200, response.statusCode());
        assertEquals("Hello, World!", response.body());
    }

    @Test
    @DisplayName("Should serve JSON built from a path variable")
    void testServeJson() throws Exception {
        // Given: a route echoing its converted path variable
        app.get("/users/:id", args -> {
            Integer id = args.get("id");
            return Map.of("id", id);
        }).params(ParameterSpec.path("id", Integer.class));
        app.listen();

        // When: the route is requested
        HttpResponse<String> response = get("/users/42");

        // Then: JSON is written with its content type
        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("application/json"));
        assertEquals("{\"id\":42}", response.body());
    }

    @Test
    @DisplayName("Should answer unknown paths with the 404 page")
    void testNotFound() throws Exception {
        // Given: a running server without matching routes
        app.get("/hello", args -> "hi");
        app.listen();

        // When: an unknown path is requested
        HttpResponse<String> response = get("/nowhere");

        // Then: the error page is served
        assertEquals(404, response.statusCode());
        assertTrue(response.body().contains("404 - NOT FOUND"));
    }

    @Test
    @DisplayName("Should keep session attributes across requests")
    void testSession() throws Exception {
        // Given: a route counting visits in the session
        app.get("/visits", args -> {
            Session session = args.request().getSession();
            Integer visits = (Integer) session.getAttribute("visits");
            int next = visits == null ? 1 : visits + 1;
            session.setAttribute("visits", next);
            return String.valueOf(next);
        });
        app.listen();

        // When: the route is requested twice with the same cookie jar
        HttpResponse<String> first = get("/visits");
        HttpResponse<String> second = get("/visits");

        // Then: the second request sees the first one's write
        assertEquals("1", first.body());
        assertEquals("2", second.body());
    }

    @Test
    @DisplayName("Should fail fast when listening with an invalid configuration")
    void testListenWithInvalidConfiguration() {
        // Given: two routes sharing a name
        app.get("/a", args -> "a").name("dup");
        app.get("/b", args -> "b").name("dup");

        // When/Then: listen refuses to start
        assertThrows(ConfigurationException.class, () -> app.listen());
        assertEquals(-1, app.getPort());
    }
}
