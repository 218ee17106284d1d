package com.redline.routing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A compiled path template: literal segments, {@code :name} variables with an optional regex
 * constraint, and an optional trailing rest variable that captures the remaining path.
 * Instances are immutable.
 */
public final class RouteTemplate {
    private final String path;
    private final List<Segment> segments;
    private final List<String> variableNames;

    RouteTemplate(String path, List<Segment> segments) {
        this.path = path;
        this.segments = Collections.unmodifiableList(new ArrayList<>(segments));
        List<String> names = new ArrayList<>();
        for (Segment segment : segments) {
            if (segment.name != null) {
                names.add(segment.name);
            }
        }
        this.variableNames = Collections.unmodifiableList(names);
    }

    /**
     * Gets the normalized template text.
     *
     * @return the template
     */
    public String getPath() {
        return path;
    }

    /**
     * Gets the variable names in declaration order.
     *
     * @return the names
     */
    public List<String> getVariableNames() {
        return variableNames;
    }

    /**
     * Checks whether the template has no variables or wildcards.
     *
     * @return true for a literal template
     */
    public boolean isStatic() {
        for (Segment segment : segments) {
            if (segment.kind != SegmentKind.LITERAL) {
                return false;
            }
        }
        return true;
    }

    /**
     * Matches a request path.
     *
     * @param requestPath the decoded request path
     * @return the variables in declaration order, or null if the path does not match
     */
    public Map<String, String> match(String requestPath) {
        List<String> parts = PathProcessor.split(requestPath);
        Map<String, String> variables = new LinkedHashMap<>();

        int i = 0;
        for (Segment segment : segments) {
            if (segment.kind == SegmentKind.REST) {
                String rest = String.join("/", parts.subList(i, parts.size()));
                if (segment.name != null) {
                    variables.put(segment.name, rest);
                }
                return variables;
            }
            if (i >= parts.size()) {
                return null;
            }
            String part = parts.get(i++);
            if (segment.kind == SegmentKind.LITERAL) {
                if (!segment.text.equals(part)) {
                    return null;
                }
            } else {
                if (part.isEmpty()
                    || (segment.constraint != null && !segment.constraint.matcher(part).matches())) {
                    return null;
                }
                variables.put(segment.name, part);
            }
        }
        return i == parts.size() ? variables : null;
    }

    @Override
    public String toString() {
        return path;
    }

    enum SegmentKind {
        LITERAL,
        VARIABLE,
        REST
    }

    static final class Segment {
        final SegmentKind kind;
        final String text;
        final String name;
        final Pattern constraint;

        private Segment(SegmentKind kind, String text, String name, Pattern constraint) {
            this.kind = kind;
            this.text = text;
            this.name = name;
            this.constraint = constraint;
        }

        static Segment literal(String text) {
            return new Segment(SegmentKind.LITERAL, text, null, null);
        }

        static Segment variable(String name, Pattern constraint) {
            return new Segment(SegmentKind.VARIABLE, null, name, constraint);
        }

        static Segment rest(String name) {
            return new Segment(SegmentKind.REST, null, name, null);
        }
    }
}
