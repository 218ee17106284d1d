package com.redline.plugin.monitor;

import com.redline.core.Redline;
import com.redline.http.MockRequest;
import com.redline.response.Response;
import com.redline.util.JsonUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for request monitoring.
 */
@DisplayName("MonitorPlugin Tests")
public class MonitorPluginTest {

    private Redline app;
    private MonitorPlugin monitor;

    @BeforeEach
    void setUp() {
        monitor = new MonitorPlugin();
        app = new Redline();
        app.register(monitor);
        app.get("/items/:id", args -> "item");
        app.setUp();
    }

    @AfterEach
    void tearDown() {
        app.getThreadPool().shutdownNow();
    }

    private Response send(String path) throws Exception {
        return app.dispatch(MockRequest.get(path).build()).get(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("Should normalize numeric path segments")
    void testNormalizePath() {
        assertEquals("/", MonitorPlugin.normalizePath("/"));
        assertEquals("/users/:id/posts", MonitorPlugin.normalizePath("/users/42/posts"));
        assertEquals("/users/me", MonitorPlugin.normalizePath("/users/me/"));
    }

    @Test
    @DisplayName("Should count requests, errors and paths")
    @SuppressWarnings("unchecked")
    void testCounters() throws Exception {
        // Given: two matched requests and one miss
        send("/items/1");
        send("/items/2");
        send("/nothing");

        // When: the data is read
        Map<String, Object> data = monitor.getMonitoringData();

        // Then: the counters reflect the final statuses
        Map<String, Object> requests = (Map<String, Object>) data.get("requests");
        assertEquals(3, requests.get("total"));
        assertEquals(0, requests.get("active"));
        assertEquals(1, requests.get("errors"));
        Map<String, Object> paths = (Map<String, Object>) data.get("paths");
        assertEquals(2, ((Map<String, Object>) paths.get("/items/:id")).get("requests"));
        assertEquals(1, ((Map<String, Object>) paths.get("/nothing")).get("errors"));
    }

    @Test
    @DisplayName("Should serve the statistics as JSON")
    @SuppressWarnings("unchecked")
    void testStatsRoute() throws Exception {
        send("/items/1");

        Response response = send(MonitorPlugin.STATS_PATH);

        assertEquals(200, response.getStatus());
        assertEquals("application/json", response.getContentType());
        Map<String, Object> data = JsonUtil.fromJsonMap(response.getBodyAsString());
        assertTrue(data.containsKey("uptime"));
        assertTrue(data.containsKey("jvm"));
        Map<String, Object> requests = (Map<String, Object>) data.get("requests");
        assertEquals(2, requests.get("total"));
        assertEquals(1, requests.get("active"));
    }
}
