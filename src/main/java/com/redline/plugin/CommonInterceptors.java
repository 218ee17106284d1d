package com.redline.plugin;

import com.redline.chain.Interceptor;
import com.redline.core.Redline;
import com.redline.http.BasicAuth;
import com.redline.http.Request;
import com.redline.response.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * Collection of common interceptors.
 */
public final class CommonInterceptors {
    private static final Logger logger = LoggerFactory.getLogger(CommonInterceptors.class);

    public static final String REQUEST_ID = "requestId";

    private CommonInterceptors() {
    }

    /**
     * Creates an interceptor that logs each request and, once it completes, its status and
     * duration. The generated request id is stored as the {@value #REQUEST_ID} attribute.
     *
     * @param urlPattern the paths to log
     * @return the interceptor
     */
    public static Interceptor requestLogger(String urlPattern) {
        return new Interceptor(urlPattern, args -> {
            long startTime = System.currentTimeMillis();
            Request request = args.request();
            String requestId = UUID.randomUUID().toString().substring(0, 8);
            request.setAttribute(REQUEST_ID, requestId);

            logger.info("[{}] {} {} started", requestId, request.getMethod(), request.getPath());
            args.chain().next(() -> {
                Response response = Redline.response();
                logger.info("[{}] {} {} completed with status {} in {}ms",
                        requestId, request.getMethod(), request.getPath(),
                        response != null ? response.getStatus() : 200,
                        System.currentTimeMillis() - startTime);
                return null;
            });
            return null;
        }).name("request logger");
    }

    /**
     * Creates an interceptor that adds standard security headers to every response.
     *
     * @param urlPattern the paths to cover
     * @return the interceptor
     */
    public static Interceptor securityHeaders(String urlPattern) {
        return new Interceptor(urlPattern, args -> {
            args.chain().next(() -> {
                Response response = Redline.response();
                if (response != null) {
                    response.header("X-Content-Type-Options", "nosniff")
                        .header("X-Frame-Options", "DENY")
                        .header("Referrer-Policy", "no-referrer-when-downgrade");
                }
                return null;
            });
            return null;
        }).name("security headers");
    }

    /**
     * Creates an interceptor that requires HTTP Basic credentials. Unauthenticated requests get
     * a 401 with a {@code WWW-Authenticate} challenge for the realm.
     *
     * @param urlPattern the paths to protect
     * @param username the expected username
     * @param password the expected password
     * @param realm the challenge realm
     * @return the interceptor
     */
    public static Interceptor basicAuth(String urlPattern, String username, String password, String realm) {
        return new Interceptor(urlPattern, args -> {
            if (BasicAuth.authenticateBasic(username, password, realm)) {
                args.chain().next();
            } else {
                args.chain().interrupt(401, Redline.response());
            }
            return null;
        }).name("basic auth " + realm);
    }
}
