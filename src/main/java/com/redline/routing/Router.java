package com.redline.routing;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Matches incoming requests to routes.
 *
 * <p>Routes are grouped by method and tried in registration order; the first structural match
 * wins. Two templates that can match the same path, such as {@code /users/:id} and
 * {@code /users/me}, are resolved by registration order alone, never by specificity.</p>
 *
 * <p>The router is filled during setup and only read while serving.</p>
 */
public class Router {
    private static final Logger logger = LoggerFactory.getLogger(Router.class);

    // Routes by upper-case method, in registration order
    private final Map<String, List<Route>> routesByMethod = new LinkedHashMap<>();

    // All routes for introspection
    private final List<Route> allRoutes = new ArrayList<>();

    /**
     * Adds a route to the router.
     *
     * @param route the route
     * @return the route for further customization
     */
    public Route addRoute(Route route) {
        allRoutes.add(route);
        routesByMethod.computeIfAbsent(route.getMethod(), k -> new ArrayList<>()).add(route);
        return route;
    }

    /**
     * Finds the route for a method and path.
     *
     * @param method the HTTP method, any case
     * @param path the decoded request path
     * @return the first matching route with its variables, or null if none matches
     */
    public RouteMatch match(String method, String path) {
        List<Route> candidates = routesByMethod.get(method.toUpperCase(Locale.ROOT));
        if (candidates == null) {
            return null;
        }
        for (Route route : candidates) {
            Map<String, String> variables = route.getTemplate().match(path);
            if (variables != null) {
                if (logger.isDebugEnabled()) {
                    logger.debug("{} {} matched {} with {}", method, path, route.getName(), variables);
                }
                return new RouteMatch(route, variables);
            }
        }
        return null;
    }

    /**
     * Lists the methods that have a route matching a path.
     *
     * @param path the decoded request path
     * @return the methods, sorted
     */
    public Set<String> allowedMethods(String path) {
        Set<String> methods = new TreeSet<>();
        for (Map.Entry<String, List<Route>> entry : routesByMethod.entrySet()) {
            for (Route route : entry.getValue()) {
                if (route.getTemplate().match(path) != null) {
                    methods.add(entry.getKey());
                    break;
                }
            }
        }
        return methods;
    }

    /**
     * Gets all routes.
     *
     * @return the list of routes, in registration order
     */
    public List<Route> getRoutes() {
        return new ArrayList<>(allRoutes);
    }

    /** Removes every route. */
    public void clear() {
        routesByMethod.clear();
        allRoutes.clear();
    }
}
