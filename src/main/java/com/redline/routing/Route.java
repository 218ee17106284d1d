package com.redline.routing;

import com.redline.core.Handler;
import com.redline.core.HandlerEntry;
import com.redline.core.HandlerKind;
import com.redline.http.BodyType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/** Represents a route in the application. */
public class Route extends HandlerEntry<Route> {
  private final String method;
  private final String path;
  private final RouteTemplate template;
  private final Set<BodyType> bodyTypes = EnumSet.noneOf(BodyType.class);

  /**
   * Creates a new route named after its method and path.
   *
   * @param method the HTTP method
   * @param path the route path
   * @param handler the handler function
   */
  public Route(String method, String path, Handler handler) {
    super(method.toUpperCase(Locale.ROOT) + " " + path, handler);
    this.method = method.toUpperCase(Locale.ROOT);
    this.path = path;
    this.template = PathProcessor.process(path);
  }

  /**
   * Restricts the body types this route accepts. A request whose detected body type is not
   * listed is rejected with 400.
   *
   * @param types the accepted body types
   * @return this route for method chaining
   */
  public Route accepts(BodyType... types) {
    checkMutable();
    Collections.addAll(bodyTypes, types);
    return this;
  }

  @Override
  public HandlerKind getKind() {
    return HandlerKind.ROUTE;
  }

  @Override
  protected Route self() {
    return this;
  }

  /**
   * Gets the HTTP method of the route.
   *
   * @return the method, upper case
   */
  public String getMethod() {
    return method;
  }

  /**
   * Gets the path of the route, as registered.
   *
   * @return the path
   */
  public String getPath() {
    return path;
  }

  public RouteTemplate getTemplate() {
    return template;
  }

  /**
   * Gets the accepted body types.
   *
   * @return the body types; empty when any body is accepted
   */
  public Set<BodyType> getBodyTypes() {
    return Collections.unmodifiableSet(bodyTypes);
  }
}
