package com.redline.plugin.jwt;

import com.redline.core.Redline;
import com.redline.http.MockRequest;
import com.redline.param.ParameterSpec;
import com.redline.response.Response;
import com.redline.util.JsonUtil;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for JWT authentication.
 */
@DisplayName("JwtPlugin Tests")
public class JwtPluginTest {

    private static final String SECRET = "0123456789abcdef0123456789abcdef-test";
    private static final String OTHER_SECRET = "fedcba9876543210fedcba9876543210-other";

    private Redline app;
    private JwtPlugin jwt;

    @BeforeEach
    void setUp() {
        jwt = new JwtPlugin(SECRET, new JwtPlugin.JwtConfig().setProtectPattern("/api/.*"));
        app = new Redline();
        app.register(jwt);
        app.get("/api/me", args -> ((Claims) args.get("claims")).getSubject())
            .params(ParameterSpec.of(JwtMarker.CLAIMS, "claims", Claims.class, null));
        app.get("/public/me", args -> "never")
            .params(ParameterSpec.of(JwtMarker.CLAIMS, "claims", Claims.class, null));
        app.use(jwt.protectWithRoles("/admin/.*", "admin"));
        app.get("/admin/panel", args -> "panel");
    }

    @AfterEach
    void tearDown() {
        app.getThreadPool().shutdownNow();
    }

    private Response send(MockRequest request) throws Exception {
        app.setUp();
        return app.dispatch(request).get(5, TimeUnit.SECONDS);
    }

    private static MockRequest bearer(String path, String token) {
        return MockRequest.get(path).header("Authorization", "Bearer " + token).build();
    }

    @Test
    @DisplayName("Should round-trip subject and claims through a token")
    void testGenerateAndValidate() {
        String token = jwt.generateToken("ada", Map.of("role", "admin"));

        Claims claims = jwt.validateToken(token);

        assertEquals("ada", claims.getSubject());
        assertEquals("admin", claims.get("role", String.class));
        assertEquals("ada", jwt.extractSubject(token));
        assertThrows(JwtException.class, () -> new JwtPlugin(OTHER_SECRET).validateToken(token));
    }

    @Test
    @DisplayName("Should let a valid token through and expose its claims")
    void testValidToken() throws Exception {
        Response response = send(bearer("/api/me", jwt.generateToken("ada")));

        assertEquals(200, response.getStatus());
        assertEquals("ada", response.getBodyAsString());
    }

    @Test
    @DisplayName("Should reject a missing token with a JSON 401")
    void testMissingToken() throws Exception {
        Response response = send(MockRequest.get("/api/me").build());

        assertEquals(401, response.getStatus());
        Map<String, Object> body = JsonUtil.fromJsonMap(response.getBodyAsString());
        assertEquals(true, body.get("error"));
        assertEquals("Missing authentication token", body.get("message"));
    }

    @Test
    @DisplayName("Should reject a token signed with another key")
    void testForeignSignature() throws Exception {
        String foreign = new JwtPlugin(OTHER_SECRET).generateToken("mallory");

        Response response = send(bearer("/api/me", foreign));

        assertEquals(401, response.getStatus());
    }

    @Test
    @DisplayName("Should reject a garbled token")
    void testMalformedToken() throws Exception {
        Response response = send(bearer("/api/me", "not.a.token"));

        assertEquals(401, response.getStatus());
    }

    @Test
    @DisplayName("Should reject an expired token")
    void testExpiredToken() throws Exception {
        JwtPlugin shortLived = new JwtPlugin(SECRET, new JwtPlugin.JwtConfig().setExpirationMs(1));
        String token = shortLived.generateToken("ada");
        Thread.sleep(1100);

        Response response = send(bearer("/api/me", token));

        assertEquals(401, response.getStatus());
        assertEquals("Token expired", JsonUtil.fromJsonMap(response.getBodyAsString()).get("message"));
    }

    @Test
    @DisplayName("Should enforce roles")
    void testRoles() throws Exception {
        Response user = send(bearer("/admin/panel", jwt.generateToken("bob", Map.of("role", "user"))));
        Response admin = app.dispatch(bearer("/admin/panel", jwt.generateToken("ada", Map.of("role", "admin"))))
            .get(5, TimeUnit.SECONDS);
        Response none = app.dispatch(bearer("/admin/panel", jwt.generateToken("eve")))
            .get(5, TimeUnit.SECONDS);

        assertEquals(403, user.getStatus());
        assertEquals("Insufficient permissions", JsonUtil.fromJsonMap(user.getBodyAsString()).get("message"));
        assertEquals(200, admin.getStatus());
        assertEquals("panel", admin.getBodyAsString());
        assertEquals(401, none.getStatus());
    }

    @Test
    @DisplayName("Should fail claims injection on an unprotected route with 401")
    void testClaimsWithoutAuthentication() throws Exception {
        Response response = send(MockRequest.get("/public/me").build());

        assertEquals(401, response.getStatus());
    }

    @Test
    @DisplayName("Should read the token from a query parameter when configured")
    void testQueryLookup() throws Exception {
        JwtPlugin queryJwt = new JwtPlugin(SECRET, new JwtPlugin.JwtConfig().setTokenLookup("query:token"));
        app.getThreadPool().shutdownNow();
        app = new Redline();
        app.register(queryJwt);
        app.use(queryJwt.protect("/q/.*"));
        app.get("/q/me", args -> "ok");

        Response ok = send(MockRequest.get("/q/me?token=" + queryJwt.generateToken("ada")).build());
        Response denied = app.dispatch(MockRequest.get("/q/me").build()).get(5, TimeUnit.SECONDS);

        assertEquals(200, ok.getStatus());
        assertEquals(401, denied.getStatus());
    }

    @Test
    @DisplayName("Should refuse a secret shorter than 256 bits")
    void testShortSecret() {
        assertThrows(RuntimeException.class, () -> new JwtPlugin("too-short"));
    }
}
