package com.redline.routing;

import com.redline.error.ConfigurationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles route paths into {@link RouteTemplate}s.
 *
 * <p>Supported segment forms:</p>
 * <ul>
 *   <li>{@code users} a literal, compared exactly</li>
 *   <li>{@code :id} a variable matching one non-empty segment</li>
 *   <li>{@code :id(\d+)} a variable whose value must fully match the regex</li>
 *   <li>{@code :path*} a rest variable capturing the remaining path, possibly empty; last only</li>
 *   <li>{@code *} an unnamed rest wildcard; last only</li>
 * </ul>
 */
public class PathProcessor {

    private PathProcessor() {
    }

    /**
     * Compiles a route path.
     *
     * @param path the route path
     * @return the compiled template
     * @throws ConfigurationException if the path is malformed
     */
    public static RouteTemplate process(String path) {
        String normalizedPath = normalizePath(path);
        List<String> parts = split(normalizedPath);
        List<RouteTemplate.Segment> segments = new ArrayList<>();
        Set<String> names = new HashSet<>();

        for (int i = 0; i < parts.size(); i++) {
            String part = parts.get(i);
            boolean last = i == parts.size() - 1;

            if (part.equals("*")) {
                requireLast(path, part, last);
                segments.add(RouteTemplate.Segment.rest(null));
            } else if (part.startsWith(":")) {
                RouteTemplate.Segment segment = variable(path, part.substring(1));
                if (segment.kind == RouteTemplate.SegmentKind.REST) {
                    requireLast(path, part, last);
                }
                if (!names.add(segment.name)) {
                    throw new ConfigurationException("Duplicate variable '" + segment.name + "' in route " + path);
                }
                segments.add(segment);
            } else if (part.isEmpty()) {
                throw new ConfigurationException("Empty segment in route " + path);
            } else {
                segments.add(RouteTemplate.Segment.literal(part));
            }
        }
        return new RouteTemplate(normalizedPath, segments);
    }

    /**
     * Splits a path into segments. A leading slash and a single trailing slash are ignored, so
     * {@code /users/} and {@code /users} give the same segments.
     *
     * @param path the path
     * @return the segments; empty for the root path
     */
    static List<String> split(String path) {
        String trimmed = path == null ? "" : path;
        if (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        if (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.isEmpty()) {
            return new ArrayList<>();
        }
        return Arrays.asList(trimmed.split("/", -1));
    }

    /**
     * Normalizes a path by ensuring it starts with a slash and dropping a trailing slash.
     *
     * @param path the path to normalize
     * @return the normalized path
     */
    static String normalizePath(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        String normalized = path.startsWith("/") ? path : "/" + path;
        if (normalized.length() > 1 && normalized.endsWith("/")) {
            return normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    private static RouteTemplate.Segment variable(String path, String spec) {
        if (spec.endsWith("*")) {
            String name = spec.substring(0, spec.length() - 1);
            checkName(path, name);
            return RouteTemplate.Segment.rest(name);
        }
        int paren = spec.indexOf('(');
        if (paren < 0) {
            checkName(path, spec);
            return RouteTemplate.Segment.variable(spec, null);
        }
        if (!spec.endsWith(")")) {
            throw new ConfigurationException("Unclosed constraint in route " + path);
        }
        String name = spec.substring(0, paren);
        checkName(path, name);
        try {
            return RouteTemplate.Segment.variable(name, Pattern.compile(spec.substring(paren + 1, spec.length() - 1)));
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid constraint for '" + name + "' in route " + path + ": " + e.getDescription());
        }
    }

    private static void checkName(String path, String name) {
        if (name.isEmpty()) {
            throw new ConfigurationException("Unnamed variable in route " + path);
        }
    }

    private static void requireLast(String path, String part, boolean last) {
        if (!last) {
            throw new ConfigurationException("'" + part + "' must be the last segment of route " + path);
        }
    }
}
