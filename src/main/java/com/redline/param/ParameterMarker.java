package com.redline.param;

/**
 * Tag that selects the {@link ParameterProvider} for a parameter. The built-in markers are the
 * constants of {@link StandardMarker}; plugins define their own, usually as an enum.
 */
public interface ParameterMarker {

    /**
     * Gets the marker name, used in configuration errors.
     *
     * @return the name
     */
    String name();
}
