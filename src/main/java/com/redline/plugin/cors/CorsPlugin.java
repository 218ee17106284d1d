package com.redline.plugin.cors;

import com.redline.chain.Interceptor;
import com.redline.core.Manager;
import com.redline.core.Redline;
import com.redline.http.Request;
import com.redline.plugin.AbstractPlugin;
import com.redline.response.Response;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Plugin for handling Cross-Origin Resource Sharing (CORS).
 *
 * <p>Preflight requests are answered with 204 before any route runs. For other requests with an
 * allowed origin the headers are added to the final response once the rest of the chain has
 * finished, error responses included.</p>
 */
public class CorsPlugin extends AbstractPlugin {
  private final CorsConfig config;

  /** Creates a new CORS plugin with default configuration. */
  public CorsPlugin() {
    this(new CorsConfig());
  }

  /**
   * Creates a new CORS plugin with the specified configuration.
   *
   * @param config the CORS configuration
   */
  public CorsPlugin(CorsConfig config) {
    super("cors", "1.0.0");
    this.config = config;
  }

  @Override
  protected void configure(Manager manager) {
    // Add the CORS interceptor globally if configured to do so
    if (config.isEnableGlobal()) {
      manager.addInterceptor(createInterceptor(config.getUrlPattern()));
    }
  }

  /**
   * Creates a CORS interceptor with the current configuration.
   *
   * @param urlPattern the paths it covers
   * @return the interceptor, in the earliest group
   */
  public Interceptor createInterceptor(String urlPattern) {
    return new Interceptor(
            urlPattern,
            args -> {
              Request request = args.request();
              String origin = request.getHeader("Origin");

              // Skip if no Origin header or if the origin is not allowed
              if (origin == null || !isOriginAllowed(origin)) {
                args.chain().next();
                return null;
              }

              if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
                Response preflight = new Response(204);
                applyHeaders(preflight, origin);
                preflight.header(
                    "Access-Control-Allow-Methods", String.join(", ", config.getAllowMethods()));
                if (!config.getAllowHeaders().isEmpty()) {
                  preflight.header(
                      "Access-Control-Allow-Headers", String.join(", ", config.getAllowHeaders()));
                }
                if (config.getMaxAge() > 0) {
                  preflight.header("Access-Control-Max-Age", String.valueOf(config.getMaxAge()));
                }
                args.chain().interrupt(204, preflight);
                return null;
              }

              args.chain()
                  .next(
                      () -> {
                        Response response = Redline.response();
                        if (response != null) {
                          applyHeaders(response, origin);
                        }
                        return null;
                      });
              return null;
            })
        .name("cors")
        .group(Integer.MIN_VALUE);
  }

  private void applyHeaders(Response response, String origin) {
    response.header("Access-Control-Allow-Origin", getAllowedOriginValue(origin));
    if (config.isAllowCredentials()) {
      response.header("Access-Control-Allow-Credentials", "true");
    }
    if (!config.getExposeHeaders().isEmpty()) {
      response.header("Access-Control-Expose-Headers", String.join(", ", config.getExposeHeaders()));
    }
  }

  /**
   * Checks if the origin is allowed based on the configuration.
   *
   * @param origin the origin to check
   * @return true if the origin is allowed
   */
  private boolean isOriginAllowed(String origin) {
    if (config.isAllowAllOrigins()) {
      return true;
    }
    return config.getAllowOrigins().contains(origin) || config.getAllowOrigins().contains("*");
  }

  /**
   * Gets the value for the Access-Control-Allow-Origin header.
   *
   * @param origin the request origin
   * @return the header value
   */
  private String getAllowedOriginValue(String origin) {
    // "*" is not allowed together with credentials
    if (config.isAllowAllOrigins() && !config.isAllowCredentials()) {
      return "*";
    }
    return origin;
  }

  public CorsConfig getConfig() {
    return config;
  }

  /** Configuration for the CORS plugin. */
  public static class CorsConfig {
    private boolean enableGlobal = true;
    private String urlPattern = "/.*";
    private boolean allowAllOrigins = true;
    private Set<String> allowOrigins = new LinkedHashSet<>();
    private Set<String> allowMethods =
        new LinkedHashSet<>(Arrays.asList("GET", "POST", "PUT", "DELETE", "OPTIONS"));
    private Set<String> allowHeaders =
        new LinkedHashSet<>(Arrays.asList("Origin", "Content-Type", "Accept", "Authorization"));
    private Set<String> exposeHeaders = new LinkedHashSet<>();
    private boolean allowCredentials = false;
    private long maxAge = 86400; // 24 hours

    public boolean isEnableGlobal() {
      return enableGlobal;
    }

    public CorsConfig setEnableGlobal(boolean enableGlobal) {
      this.enableGlobal = enableGlobal;
      return this;
    }

    public String getUrlPattern() {
      return urlPattern;
    }

    public CorsConfig setUrlPattern(String urlPattern) {
      this.urlPattern = urlPattern;
      return this;
    }

    public boolean isAllowAllOrigins() {
      return allowAllOrigins;
    }

    public CorsConfig setAllowAllOrigins(boolean allowAllOrigins) {
      this.allowAllOrigins = allowAllOrigins;
      return this;
    }

    public Set<String> getAllowOrigins() {
      return allowOrigins;
    }

    public CorsConfig addAllowOrigin(String origin) {
      this.allowOrigins.add(origin);
      return this;
    }

    public Set<String> getAllowMethods() {
      return allowMethods;
    }

    public CorsConfig setAllowMethods(Set<String> allowMethods) {
      this.allowMethods = allowMethods;
      return this;
    }

    public Set<String> getAllowHeaders() {
      return allowHeaders;
    }

    public CorsConfig setAllowHeaders(Set<String> allowHeaders) {
      this.allowHeaders = allowHeaders;
      return this;
    }

    public Set<String> getExposeHeaders() {
      return exposeHeaders;
    }

    public CorsConfig addExposeHeader(String header) {
      this.exposeHeaders.add(header);
      return this;
    }

    public boolean isAllowCredentials() {
      return allowCredentials;
    }

    public CorsConfig setAllowCredentials(boolean allowCredentials) {
      this.allowCredentials = allowCredentials;
      return this;
    }

    public long getMaxAge() {
      return maxAge;
    }

    public CorsConfig setMaxAge(long maxAge) {
      this.maxAge = maxAge;
      return this;
    }
  }
}
