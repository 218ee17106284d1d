package com.redline.http;

import com.redline.core.Redline;
import com.redline.response.Response;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

/**
 * HTTP Basic access authentication against the current request.
 *
 * <pre>
 * app.addInterceptor(new Interceptor("/admin/.*", args -&gt; {
 *     if (BasicAuth.authenticateBasic("admin", "secret", "Admin area")) {
 *         Redline.chain().next();
 *     } else {
 *         Redline.chain().interrupt(401, Redline.response());
 *     }
 *     return null;
 * }));
 * </pre>
 */
public final class BasicAuth {
    private static final String BASIC = "Basic";

    private BasicAuth() {
    }

    /**
     * Decodes the {@code Authorization} header of the current request.
     *
     * @return the credentials, or null if the header is missing or not a valid Basic header
     */
    public static Credentials parseAuthorizationHeader() {
        return parseAuthorizationHeader(Redline.request());
    }

    /**
     * Decodes the {@code Authorization} header of a request.
     *
     * @param request the request
     * @return the credentials, or null if the header is missing or not a valid Basic header
     */
    public static Credentials parseAuthorizationHeader(Request request) {
        String[] tokens = tokens(request);
        if (tokens == null) {
            return null;
        }
        String auth;
        try {
            auth = new String(Base64.getDecoder().decode(tokens[1]), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return null;
        }
        int idx = auth.indexOf(':');
        if (idx <= 0) {
            return null;
        }
        return new Credentials(auth.substring(0, idx), auth.substring(idx + 1));
    }

    /**
     * Checks the current request's credentials. When they do not match and a realm is given, the
     * current response is replaced by a 401 carrying a {@code WWW-Authenticate} challenge; the
     * caller still decides whether to interrupt the chain.
     *
     * @param username the expected username
     * @param password the expected password
     * @param realm the challenge realm, may be null
     * @return true if the request carries exactly these credentials
     */
    public static boolean authenticateBasic(String username, String password, String realm) {
        boolean authenticated = matches(Redline.request(), username, password);
        if (!authenticated && realm != null) {
            Response challenge = new Response(401);
            Response current = Redline.response();
            if (current != null) {
                for (Map.Entry<String, String> header : current.getHeaders().entrySet()) {
                    challenge.header(header.getKey(), header.getValue());
                }
            }
            challenge.header("WWW-Authenticate", "Basic realm=\"" + realm + "\"");
            Redline.response(challenge);
        }
        return authenticated;
    }

    /**
     * Checks a request's credentials without touching the response.
     *
     * @param request the request
     * @param username the expected username
     * @param password the expected password
     * @return true if the request carries exactly these credentials
     */
    public static boolean matches(Request request, String username, String password) {
        String[] tokens = tokens(request);
        if (tokens == null) {
            return false;
        }
        String expected = Base64.getEncoder()
            .encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
        return expected.equals(tokens[1]);
    }

    private static String[] tokens(Request request) {
        String authorization = request.getHeader("Authorization");
        if (authorization == null) {
            return null;
        }
        String[] tokens = authorization.trim().split(" +");
        if (tokens.length != 2 || !BASIC.equals(tokens[0])) {
            return null;
        }
        return tokens;
    }
}
