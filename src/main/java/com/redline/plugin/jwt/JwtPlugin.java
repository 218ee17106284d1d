package com.redline.plugin.jwt;

import com.redline.chain.Interceptor;
import com.redline.core.HandlerKind;
import com.redline.core.Manager;
import com.redline.error.RequestException;
import com.redline.http.Request;
import com.redline.param.Arguments;
import com.redline.plugin.AbstractPlugin;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Date;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import javax.crypto.SecretKey;

/**
 * Plugin for JWT authentication.
 *
 * <p>{@link #protect(String)} creates an interceptor that validates the request's token and
 * stores its claims on the request; handlers receive them through a {@link JwtMarker#CLAIMS}
 * parameter. A missing or invalid token interrupts the chain with a JSON 401, a token without
 * one of the required roles with a JSON 403.</p>
 */
public class JwtPlugin extends AbstractPlugin {
  private static final String DEFAULT_AUTH_SCHEME = "Bearer";
  private static final String DEFAULT_TOKEN_LOOKUP = "header:Authorization";
  private static final String DEFAULT_CONTEXT_KEY = "user";

  private final SecretKey secretKey;
  private final JwtConfig config;

  /**
   * Creates a new JWT plugin with the specified secret key.
   *
   * @param secretKey the secret key for signing tokens, at least 32 bytes
   */
  public JwtPlugin(String secretKey) {
    this(secretKey, new JwtConfig());
  }

  /**
   * Creates a new JWT plugin with the specified secret key and configuration.
   *
   * @param secretKey the secret key for signing tokens, at least 32 bytes
   * @param config the JWT configuration
   */
  public JwtPlugin(String secretKey, JwtConfig config) {
    super("jwt", "1.0.0");
    this.secretKey = Keys.hmacShaKeyFor(secretKey.getBytes(StandardCharsets.UTF_8));
    this.config = config;
  }

  @Override
  protected void configure(Manager manager) {
    manager.addParameterProvider(
        JwtMarker.CLAIMS,
        (metadata, type, handlerName, paramName, request, locator) -> {
          Object claims = request.getAttribute(config.getContextKey());
          if (claims == null) {
            throw new RequestException(401, "Not authenticated");
          }
          return claims;
        },
        HandlerKind.ROUTE,
        HandlerKind.INTERCEPTOR);

    if (config.getProtectPattern() != null) {
      manager.addInterceptor(protect(config.getProtectPattern()));
    }
  }

  /**
   * Creates an interceptor that protects routes with JWT authentication.
   *
   * @param urlPattern the paths to protect
   * @return the interceptor
   */
  public Interceptor protect(String urlPattern) {
    return protectWithRoles(urlPattern);
  }

  /**
   * Creates an interceptor that protects routes with JWT authentication and role-based
   * authorization.
   *
   * @param urlPattern the paths to protect
   * @param roles the allowed roles; any authenticated user when empty
   * @return the interceptor
   */
  public Interceptor protectWithRoles(String urlPattern, String... roles) {
    return new Interceptor(urlPattern, args -> authenticate(args, roles))
        .name("jwt " + urlPattern)
        .group(config.getGroup());
  }

  private Object authenticate(Arguments args, String[] roles) {
    String token = extractToken(args.request());
    if (token == null) {
      return handleAuthError(args, "Missing authentication token");
    }

    Claims claims;
    try {
      claims = validateToken(token);
    } catch (ExpiredJwtException e) {
      return handleAuthError(args, "Token expired");
    } catch (SignatureException e) {
      return handleAuthError(args, "Invalid token signature");
    } catch (MalformedJwtException e) {
      return handleAuthError(args, "Malformed token");
    } catch (JwtException | IllegalArgumentException e) {
      return handleAuthError(args, "Invalid token: " + e.getMessage());
    }

    if (roles.length > 0) {
      String userRole = claims.get("role", String.class);
      if (userRole == null) {
        return handleAuthError(args, "No role specified in token");
      }
      if (!Arrays.asList(roles).contains(userRole)) {
        args.chain().interrupt(403, Map.of("error", true, "message", "Insufficient permissions"));
        return null;
      }
    }

    args.request().setAttribute(config.getContextKey(), claims);
    args.chain().next();
    return null;
  }

  /**
   * Generates a JWT token for the specified subject.
   *
   * @param subject the subject (usually a user ID)
   * @return the generated token
   */
  public String generateToken(String subject) {
    return generateToken(subject, new HashMap<>());
  }

  /**
   * Generates a JWT token for the specified subject with custom claims.
   *
   * @param subject the subject (usually a user ID)
   * @param claims the custom claims to include
   * @return the generated token
   */
  public String generateToken(String subject, Map<String, Object> claims) {
    long now = System.currentTimeMillis();

    JwtBuilder builder = Jwts.builder().subject(subject).issuedAt(new Date(now));
    for (Map.Entry<String, Object> entry : claims.entrySet()) {
      builder.claim(entry.getKey(), entry.getValue());
    }

    // Set expiration if configured
    if (config.getExpirationMs() > 0) {
      builder.expiration(new Date(now + config.getExpirationMs()));
    }

    return builder.signWith(secretKey).compact();
  }

  /**
   * Validates a JWT token and returns the claims.
   *
   * @param token the token to validate
   * @return the claims
   * @throws JwtException if the token is invalid
   */
  public Claims validateToken(String token) throws JwtException {
    return Jwts.parser().verifyWith(secretKey).build().parseSignedClaims(token).getPayload();
  }

  /**
   * Extracts a claim from a token.
   *
   * @param token the token
   * @param claimsResolver the function to extract the claim
   * @param <T> the type of the claim
   * @return the claim value
   */
  public <T> T extractClaim(String token, Function<Claims, T> claimsResolver) {
    return claimsResolver.apply(validateToken(token));
  }

  public String extractSubject(String token) {
    return extractClaim(token, Claims::getSubject);
  }

  /**
   * Extracts the token from the request.
   *
   * @param request the request
   * @return the token or null if not found
   */
  private String extractToken(Request request) {
    String[] parts = config.getTokenLookup().split(":");
    if (parts.length != 2) {
      return null;
    }

    String key = parts[1];
    switch (parts[0].toLowerCase(Locale.ROOT)) {
      case "header":
        String authHeader = request.getHeader(key);
        if (authHeader != null && authHeader.startsWith(config.getAuthScheme() + " ")) {
          return authHeader.substring(config.getAuthScheme().length() + 1);
        }
        break;
      case "query":
        return request.getQueryParam(key);
      default:
        break;
    }
    return null;
  }

  private Object handleAuthError(Arguments args, String message) {
    args.chain().interrupt(401, Map.of("error", true, "message", message));
    return null;
  }

  public JwtConfig getConfig() {
    return config;
  }

  /** Configuration for the JWT plugin. */
  public static class JwtConfig {
    private String authScheme = DEFAULT_AUTH_SCHEME;
    private String tokenLookup = DEFAULT_TOKEN_LOOKUP;
    private String contextKey = DEFAULT_CONTEXT_KEY;
    private String protectPattern;
    private int group = -50;
    private long expirationMs = 3600000; // 1 hour by default

    public String getAuthScheme() {
      return authScheme;
    }

    public JwtConfig setAuthScheme(String authScheme) {
      this.authScheme = authScheme;
      return this;
    }

    public String getTokenLookup() {
      return tokenLookup;
    }

    /**
     * Sets where the token is read from: {@code header:<name>} or {@code query:<name>}.
     *
     * @param tokenLookup the lookup
     * @return this configuration
     */
    public JwtConfig setTokenLookup(String tokenLookup) {
      this.tokenLookup = tokenLookup;
      return this;
    }

    public String getContextKey() {
      return contextKey;
    }

    public JwtConfig setContextKey(String contextKey) {
      this.contextKey = contextKey;
      return this;
    }

    public String getProtectPattern() {
      return protectPattern;
    }

    /**
     * Protects the matching paths when the plugin is registered.
     *
     * @param protectPattern the URL pattern, or null to add no interceptor
     * @return this configuration
     */
    public JwtConfig setProtectPattern(String protectPattern) {
      this.protectPattern = protectPattern;
      return this;
    }

    public int getGroup() {
      return group;
    }

    public JwtConfig setGroup(int group) {
      this.group = group;
      return this;
    }

    public long getExpirationMs() {
      return expirationMs;
    }

    public JwtConfig setExpirationMs(long expirationMs) {
      this.expirationMs = expirationMs;
      return this;
    }
  }
}
