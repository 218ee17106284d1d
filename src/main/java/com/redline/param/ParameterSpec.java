package com.redline.param;

import com.redline.http.Request;

/**
 * A declared handler parameter: the marker that selects its provider, its name and target type,
 * optional marker metadata, and whether a missing value is an error. Immutable.
 */
public final class ParameterSpec {
    private final ParameterMarker marker;
    private final String name;
    private final Class<?> type;
    private final Object metadata;
    private final boolean required;

    private ParameterSpec(ParameterMarker marker, String name, Class<?> type, Object metadata,
                          boolean required) {
        this.marker = marker;
        this.name = name;
        this.type = type;
        this.metadata = metadata;
        this.required = required;
    }

    /**
     * Creates a required parameter served by a custom provider.
     *
     * @param marker the marker registered with the provider
     * @param name the parameter name
     * @param type the target type
     * @param metadata passed to the provider, may be null
     * @return the spec
     */
    public static ParameterSpec of(ParameterMarker marker, String name, Class<?> type, Object metadata) {
        return new ParameterSpec(marker, name, type, metadata, true);
    }

    public static ParameterSpec path(String name, Class<?> type) {
        return of(StandardMarker.PATH, name, type, null);
    }

    public static ParameterSpec query(String name, Class<?> type) {
        return of(StandardMarker.QUERY, name, type, null);
    }

    public static ParameterSpec header(String name, Class<?> type) {
        return of(StandardMarker.HEADER, name, type, null);
    }

    public static ParameterSpec attribute(String name, Class<?> type) {
        return of(StandardMarker.ATTRIBUTE, name, type, null);
    }

    public static ParameterSpec service(Class<?> type) {
        return of(StandardMarker.SERVICE, type.getSimpleName(), type, null);
    }

    public static ParameterSpec body(Class<?> type) {
        return of(StandardMarker.BODY, "body", type, null);
    }

    public static ParameterSpec field(String name, Class<?> type) {
        return of(StandardMarker.FIELD, name, type, null);
    }

    public static ParameterSpec request() {
        return of(StandardMarker.REQUEST, "request", Request.class, null);
    }

    /**
     * Gets a copy of this spec that resolves to null instead of failing when the provider finds
     * no value.
     *
     * @return the optional spec
     */
    public ParameterSpec optional() {
        return new ParameterSpec(marker, name, type, metadata, false);
    }

    /**
     * Gets a copy of this spec under another name. For path, query, header, attribute and field
     * parameters the name is also the key the value is looked up by.
     *
     * @param name the new name
     * @return the renamed spec
     */
    public ParameterSpec named(String name) {
        return new ParameterSpec(marker, name, type, metadata, required);
    }

    public ParameterMarker getMarker() {
        return marker;
    }

    public String getName() {
        return name;
    }

    public Class<?> getType() {
        return type;
    }

    public Object getMetadata() {
        return metadata;
    }

    public boolean isRequired() {
        return required;
    }

    @Override
    public String toString() {
        return marker.name() + " " + type.getSimpleName() + " " + name + (required ? "" : "?");
    }
}
