package com.redline.core;

import com.redline.chain.Chain;
import com.redline.chain.ChainExecutor;
import com.redline.chain.ChainServices;
import com.redline.chain.Interceptor;
import com.redline.chain.RequestContext;
import com.redline.chain.RequestScope;
import com.redline.error.ChainStallException;
import com.redline.error.ErrorHandler;
import com.redline.error.ErrorPage;
import com.redline.error.ErrorRouter;
import com.redline.http.BodyParser;
import com.redline.http.DefaultBodyParser;
import com.redline.http.Request;
import com.redline.http.UndertowRequest;
import com.redline.inject.ServiceLocator;
import com.redline.inject.SimpleServiceLocator;
import com.redline.param.ParameterMarker;
import com.redline.param.ParameterProvider;
import com.redline.plugin.Plugin;
import com.redline.response.BoundProcessor;
import com.redline.response.MimeTypes;
import com.redline.response.Response;
import com.redline.response.ResponseProcessor;
import com.redline.response.ResponseWriter;
import com.redline.response.UndertowMimeTypes;
import com.redline.routing.Route;
import com.redline.routing.RouteMatch;
import com.redline.util.Banner;
import com.redline.util.Futures;
import com.redline.util.LogUtil;
import com.redline.util.LogUtil.Color;
import io.undertow.Undertow;
import io.undertow.UndertowOptions;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.session.InMemorySessionManager;
import io.undertow.server.session.SessionAttachmentHandler;
import io.undertow.server.session.SessionCookieConfig;
import io.undertow.util.HttpString;
import io.undertow.util.SameThreadExecutor;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xnio.Options;

/**
 * The application object of the Redline framework. Provides a fluent API to register routes,
 * interceptors, error handlers and plugins, and dispatches requests through them.
 *
 * <pre>
 * Redline app = new Redline(new ServerConfig().setPort(8080));
 * app.get("/users/:id", args -&gt; users.find(args.get("id")))
 *     .params(ParameterSpec.path("id", String.class));
 * app.error(404, args -&gt; Map.of("error", "Not Found"));
 * app.listen();
 * </pre>
 *
 * <p>Each instance owns its registry, so several applications can live in one process. Requests
 * can be dispatched in-process with {@link #dispatch(Request)} after {@link #setUp()}, which is
 * how the framework is tested, or served over HTTP with {@link #listen()}.</p>
 */
public class Redline implements Manager {
  private static final Logger logger = LoggerFactory.getLogger(Redline.class);

  private final ServerConfig config;
  private final Registry registry = new Registry();
  private final List<Plugin> plugins = new ArrayList<>();
  private final ThreadPool threadPool;

  private ServiceLocator serviceLocator = new SimpleServiceLocator();
  private BodyParser bodyParser = new DefaultBodyParser();
  private MimeTypes mimeTypes = new UndertowMimeTypes();

  private volatile ChainServices services;
  private volatile ErrorRouter errorRouter;
  private Undertow server;
  private volatile int boundPort = -1;

  /** Creates a new application with the default configuration. */
  public Redline() {
    this(new ServerConfig());
  }

  /**
   * Creates a new application.
   *
   * @param config the server configuration
   */
  public Redline(ServerConfig config) {
    this.config = config;
    int workers = Math.max(1, config.getWorkerThreads());
    ThreadPool.ThreadPoolConfig poolConfig = new ThreadPool.ThreadPoolConfig();
    poolConfig.setMaxPoolSize(workers).setCorePoolSize(Math.min(poolConfig.getCorePoolSize(), workers));
    this.threadPool = new ThreadPool(poolConfig);
  }

  /**
   * Sets the host for the server.
   *
   * @param host the host to bind to
   * @return this instance for method chaining
   */
  public Redline host(String host) {
    config.setHost(host);
    return this;
  }

  /**
   * Sets the port for the server.
   *
   * @param port the port to listen on; 0 picks a free port
   * @return this instance for method chaining
   */
  public Redline port(int port) {
    config.setPort(port);
    return this;
  }

  /**
   * Sets the service locator handed to parameter providers and response processors.
   *
   * @param serviceLocator the locator
   * @return this instance for method chaining
   */
  public Redline serviceLocator(ServiceLocator serviceLocator) {
    checkNotSetUp();
    this.serviceLocator = serviceLocator;
    return this;
  }

  public Redline bodyParser(BodyParser bodyParser) {
    checkNotSetUp();
    this.bodyParser = bodyParser;
    return this;
  }

  public Redline mimeTypes(MimeTypes mimeTypes) {
    checkNotSetUp();
    this.mimeTypes = mimeTypes;
    return this;
  }

  // Registration

  @Override
  public Route addRoute(Route route) {
    return registry.addRoute(route);
  }

  @Override
  public Interceptor addInterceptor(Interceptor interceptor) {
    return registry.addInterceptor(interceptor);
  }

  @Override
  public ErrorHandler addErrorHandler(ErrorHandler handler) {
    return registry.addErrorHandler(handler);
  }

  @Override
  public void addParameterProvider(
      ParameterMarker marker, ParameterProvider provider, HandlerKind... kinds) {
    registry.addParameterProvider(marker, provider, kinds);
  }

  @Override
  public void addResponseProcessor(Class<?> metadataType, ResponseProcessor processor) {
    registry.addResponseProcessor(metadataType, processor);
  }

  /**
   * Defines a route.
   *
   * @param method the HTTP method
   * @param path the route template
   * @param handler the handler function
   * @return the route, for declaring its parameters and metadata
   */
  public Route route(String method, String path, Handler handler) {
    return addRoute(new Route(method, path, handler));
  }

  public Route get(String path, Handler handler) {
    return route("GET", path, handler);
  }

  public Route post(String path, Handler handler) {
    return route("POST", path, handler);
  }

  public Route put(String path, Handler handler) {
    return route("PUT", path, handler);
  }

  public Route delete(String path, Handler handler) {
    return route("DELETE", path, handler);
  }

  public Route patch(String path, Handler handler) {
    return route("PATCH", path, handler);
  }

  /**
   * Adds an interceptor.
   *
   * @param interceptor the interceptor
   * @return this instance for method chaining
   */
  public Redline use(Interceptor interceptor) {
    addInterceptor(interceptor);
    return this;
  }

  /**
   * Defines the handler for an error status.
   *
   * @param statusCode the status
   * @param handler the handler function
   * @return the error handler, for declaring its parameters and metadata
   */
  public ErrorHandler error(int statusCode, Handler handler) {
    return addErrorHandler(new ErrorHandler(statusCode, handler));
  }

  /**
   * Registers a plugin with the application.
   *
   * @param plugin the plugin to register
   * @return this instance for method chaining
   */
  public Redline register(Plugin plugin) {
    logger.info(
        LogUtil.info("Registering plugin: " + LogUtil.highlight(plugin.getName(), Color.CYAN_BOLD)));
    plugins.add(plugin);
    plugin.register(this);
    return this;
  }

  /**
   * Gets a plugin by name.
   *
   * @param name the name of the plugin
   * @return the plugin or null if not found
   */
  public Plugin getPlugin(String name) {
    for (Plugin plugin : plugins) {
      if (plugin.getName().equals(name)) {
        return plugin;
      }
    }
    return null;
  }

  public boolean hasPlugin(String name) {
    return getPlugin(name) != null;
  }

  // Lifecycle

  /**
   * Builds the registry. Must be called once registration is complete and before requests are
   * dispatched; {@link #listen()} calls it.
   *
   * @throws com.redline.error.ConfigurationException if the registrations are inconsistent
   */
  public synchronized void setUp() {
    if (services != null) {
      return;
    }
    registry.build();
    ChainServices chainServices =
        new ChainServices(
            registry.getResolver(), new ResponseWriter(serviceLocator, mimeTypes), serviceLocator);
    errorRouter = new ErrorRouter(registry, chainServices, config.isShowStackTraces());
    services = chainServices;
    logger.info(
        LogUtil.info(
            String.format(
                "Set up %d routes, %d interceptors, %d error handlers",
                registry.getRoutes().size(),
                registry.getInterceptors().size(),
                registry.getErrorHandlers().size())));
  }

  /** Clears every registration and plugin so the application can be configured again. */
  public synchronized void tearDown() {
    registry.clear();
    plugins.clear();
    services = null;
    errorRouter = null;
    logger.debug("Registry cleared");
  }

  public boolean isSetUp() {
    return services != null;
  }

  // Dispatch

  /**
   * Dispatches a request through its chain.
   *
   * @param request the request
   * @return the response; the future never fails. A chain that does not finish within the
   *     configured request timeout is answered by the 500 handler with a {@link
   *     ChainStallException}.
   * @throws IllegalStateException if {@link #setUp()} has not been called
   */
  public CompletableFuture<Response> dispatch(Request request) {
    ChainServices chainServices = services;
    ErrorRouter errors = errorRouter;
    if (chainServices == null) {
      throw new IllegalStateException("setUp() must be called before dispatching requests");
    }

    RequestContext context = new RequestContext(request, threadPool);
    String path = request.getPath();
    RouteMatch match = registry.match(request.getMethod(), path);
    Route route = null;
    List<BoundProcessor> processors = Collections.emptyList();
    Set<String> allowed = Collections.emptySet();
    if (match != null) {
      route = match.getRoute();
      request.setPathVariables(match.getVariables());
      processors = registry.processorsFor(route);
    } else {
      allowed = registry.allowedMethods(path);
    }

    ChainExecutor executor =
        ChainExecutor.forRoute(
            context, registry.interceptorsFor(path), route, processors, allowed, chainServices, errors);
    long timeout = config.getRequestTimeout().toMillis();

    return executor
        .execute()
        .orTimeout(timeout, TimeUnit.MILLISECONDS)
        .handle(
            (response, failure) -> {
              if (failure == null) {
                return CompletableFuture.completedFuture(response);
              }
              Throwable cause = Futures.unwrap(failure);
              if (cause instanceof TimeoutException) {
                String element = executor.currentElementName();
                executor.abandon();
                ChainStallException stall = new ChainStallException(element, timeout);
                logger.error(LogUtil.error(request + ": " + stall.getMessage()));
                context.setError(stall);
                return errors
                    .route(500, context, stall)
                    .completeOnTimeout(
                        ErrorPage.render(500, path, stall, config.isShowStackTraces()),
                        timeout,
                        TimeUnit.MILLISECONDS);
              }
              logger.error(LogUtil.error("Error dispatching " + request), cause);
              return CompletableFuture.completedFuture(
                  ErrorPage.render(500, path, cause, config.isShowStackTraces()));
            })
        .thenCompose(f -> f);
  }

  // Server

  /** Starts the server and begins listening for requests. */
  public void listen() {
    setUp();

    // Notify plugins that the server is starting
    for (Plugin plugin : plugins) {
      logger.info(
          LogUtil.info("Starting plugin: " + LogUtil.highlight(plugin.getName(), Color.CYAN_BOLD)));
      plugin.onStart(this);
    }

    HttpHandler handler =
        new SessionAttachmentHandler(
            new RedlineHttpHandler(),
            new InMemorySessionManager("redline-sessions"),
            new SessionCookieConfig().setCookieName(config.getSessionCookie()));

    server =
        Undertow.builder()
            .addHttpListener(config.getPort(), config.getHost())
            .setHandler(handler)
            .setIoThreads(config.getIoThreads())
            .setWorkerThreads(config.getWorkerThreads())
            .setSocketOption(Options.TCP_NODELAY, true)
            .setSocketOption(Options.REUSE_ADDRESSES, true)
            .setServerOption(UndertowOptions.ALWAYS_SET_DATE, true)
            .setServerOption(UndertowOptions.ALWAYS_SET_KEEP_ALIVE, true)
            .build();
    server.start();

    InetSocketAddress address =
        (InetSocketAddress) server.getListenerInfo().get(0).getAddress();
    boundPort = address.getPort();

    logger.info(
        LogUtil.info(
            LogUtil.highlight("Redline server started", Color.GREEN_BOLD)
                + String.format(
                    " (IO threads: %d, worker threads: %d)",
                    config.getIoThreads(), config.getWorkerThreads())));
    Banner.display(config.getHost(), boundPort, routeTable());
  }

  /** Stops the server. */
  public void stop() {
    if (server == null) {
      return;
    }
    // Notify plugins that the server is stopping
    for (Plugin plugin : plugins) {
      logger.info(
          LogUtil.info("Stopping plugin: " + LogUtil.highlight(plugin.getName(), Color.CYAN_BOLD)));
      plugin.onStop(this);
    }

    server.stop();
    server = null;
    boundPort = -1;

    threadPool.shutdown();
    try {
      // Wait for tasks to complete
      if (!threadPool.awaitTermination(30, TimeUnit.SECONDS)) {
        threadPool.shutdownNow();
      }
    } catch (InterruptedException e) {
      threadPool.shutdownNow();
      Thread.currentThread().interrupt();
    }

    logger.info(LogUtil.info(LogUtil.highlight("Redline server stopped", Color.YELLOW_BOLD)));
  }

  /**
   * Gets the port the server listens on.
   *
   * @return the bound port, or -1 when not listening
   */
  public int getPort() {
    return boundPort;
  }

  public ServerConfig getConfig() {
    return config;
  }

  public Registry getRegistry() {
    return registry;
  }

  public ThreadPool getThreadPool() {
    return threadPool;
  }

  private List<String> routeTable() {
    List<String> table = new ArrayList<>();
    for (Route route : registry.getRoutes()) {
      table.add(route.getMethod() + " " + route.getPath());
    }
    return table;
  }

  private void checkNotSetUp() {
    if (services != null) {
      throw new IllegalStateException("Application is already set up");
    }
  }

  // Ambient helpers, usable from any code running for a request

  /**
   * Gets the request being processed.
   *
   * @return the request
   * @throws IllegalStateException outside request processing
   */
  public static Request request() {
    return current().getRequest();
  }

  /**
   * Gets the chain of the element currently running.
   *
   * @return the chain
   * @throws IllegalStateException outside request processing
   */
  public static Chain chain() {
    return current().getChain();
  }

  /**
   * Gets the response built so far. In an interceptor continuation this is the response of the
   * deeper elements.
   *
   * @return the response, or null if none was produced yet
   */
  public static Response response() {
    return current().getResponse();
  }

  /**
   * Replaces the current response. Ignored once an interrupt has fixed the response.
   *
   * @param response the new response
   * @return true if the response was replaced
   */
  public static boolean response(Response response) {
    return current().setResponse(response);
  }

  /**
   * Stops the chain and renders an error status.
   *
   * @param statusCode the status
   */
  public static void abort(int statusCode) {
    chain().interrupt(statusCode);
  }

  /**
   * Stops the chain with a 302 redirect. A relative URL is resolved against the requested URI.
   *
   * @param url the redirect target
   */
  public static void redirect(String url) {
    URI target = URI.create(request().getRequestedUri()).resolve(url);
    chain().interrupt(302, Response.found(target));
  }

  /**
   * Runs work on the application's worker pool with the current request context bound.
   *
   * @param task the work
   * @param <T> the result type
   * @return a future with the task's result, which a handler may return as is
   */
  public static <T> CompletableFuture<T> async(Callable<T> task) {
    RequestContext context = current();
    CompletableFuture<T> future = new CompletableFuture<>();
    context
        .getExecutor()
        .execute(
            () ->
                RequestScope.run(
                    context,
                    () -> {
                      try {
                        future.complete(task.call());
                      } catch (Exception e) {
                        future.completeExceptionally(e);
                      }
                    }));
    return future;
  }

  private static RequestContext current() {
    RequestContext context = RequestScope.current();
    if (context == null) {
      throw new IllegalStateException("No request is being processed on this thread");
    }
    return context;
  }

  /** Adapts Undertow exchanges to {@link #dispatch(Request)}. */
  private class RedlineHttpHandler implements HttpHandler {

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
      if (exchange.isInIoThread()) {
        exchange.dispatch(this);
        return;
      }
      exchange.startBlocking();
      Request request = new UndertowRequest(exchange, bodyParser);
      exchange.dispatch(
          SameThreadExecutor.INSTANCE,
          () -> {
            try {
              dispatch(request).whenComplete((response, failure) -> write(exchange, response, failure));
            } catch (RuntimeException e) {
              write(exchange, null, e);
            }
          });
    }

    private void write(HttpServerExchange exchange, Response response, Throwable failure) {
      try {
        if (failure != null || response == null) {
          logger.error(LogUtil.error("Error processing request " + exchange.getRequestPath()), failure);
          if (!exchange.isResponseStarted()) {
            exchange.setStatusCode(500);
          }
          return;
        }
        exchange.setStatusCode(response.getStatus());
        for (Map.Entry<String, String> header : response.getHeaders().entrySet()) {
          exchange.getResponseHeaders().put(HttpString.tryFromString(header.getKey()), header.getValue());
        }
        if (!response.isStreamed()) {
          exchange.setResponseContentLength(response.getBodyBytes().length);
        }
        try (InputStream in = response.openBody();
            OutputStream out = exchange.getOutputStream()) {
          in.transferTo(out);
        }
      } catch (IOException | RuntimeException e) {
        logger.error(LogUtil.error("Error writing response: " + e.getMessage()), e);
        if (!exchange.isResponseStarted()) {
          exchange.getResponseHeaders().clear();
          exchange.setStatusCode(500);
        }
      } finally {
        exchange.endExchange();
      }
    }
  }
}
