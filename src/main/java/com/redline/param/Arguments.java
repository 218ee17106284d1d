package com.redline.param;

import com.redline.chain.Chain;
import com.redline.http.Request;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The resolved parameters of one handler invocation, by name and by declaration index, together
 * with the request and chain they were resolved for.
 */
public final class Arguments {
    private final List<String> names;
    private final List<Object> values;
    private final Request request;
    private final Chain chain;

    Arguments(List<String> names, List<Object> values, Request request, Chain chain) {
        this.names = Collections.unmodifiableList(new ArrayList<>(names));
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
        this.request = request;
        this.chain = chain;
    }

    /**
     * Creates arguments for a handler that declares no parameters.
     *
     * @param request the request
     * @param chain the chain
     * @return empty arguments
     */
    public static Arguments empty(Request request, Chain chain) {
        return new Arguments(List.of(), List.of(), request, chain);
    }

    /**
     * Gets a parameter by name.
     *
     * @param name the declared name
     * @param <T> the expected type
     * @return the value, null for a missing optional parameter
     * @throws IllegalArgumentException if no parameter has this name
     */
    @SuppressWarnings("unchecked")
    public <T> T get(String name) {
        int index = names.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("No parameter named '" + name + "'");
        }
        return (T) values.get(index);
    }

    /**
     * Gets a parameter by declaration index.
     *
     * @param index the index
     * @param <T> the expected type
     * @return the value
     */
    @SuppressWarnings("unchecked")
    public <T> T get(int index) {
        return (T) values.get(index);
    }

    public boolean has(String name) {
        return names.contains(name);
    }

    public int size() {
        return values.size();
    }

    public Request request() {
        return request;
    }

    public Chain chain() {
        return chain;
    }

    /**
     * Gets a path variable of the matched route, whether or not it was declared as a parameter.
     *
     * @param name the variable name
     * @return the raw value, or null
     */
    public String pathVariable(String name) {
        return request.getPathVariable(name);
    }

    /**
     * Gets the parameters as a map.
     *
     * @return name to value, in declaration order
     */
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            map.put(names.get(i), values.get(i));
        }
        return map;
    }
}
