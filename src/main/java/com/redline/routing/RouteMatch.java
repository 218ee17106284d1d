package com.redline.routing;

import java.util.Collections;
import java.util.Map;

/** A matched route with the path variables extracted from the request. */
public final class RouteMatch {
    private final Route route;
    private final Map<String, String> variables;

    RouteMatch(Route route, Map<String, String> variables) {
        this.route = route;
        this.variables = Collections.unmodifiableMap(variables);
    }

    public Route getRoute() {
        return route;
    }

    /**
     * Gets the path variables.
     *
     * @return the variables in template declaration order
     */
    public Map<String, String> getVariables() {
        return variables;
    }
}
