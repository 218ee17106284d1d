package com.redline.error;

/**
 * Thrown while building the registry when routes, interceptors, error handlers or parameter
 * providers are declared inconsistently. A server whose setup fails never starts listening.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
