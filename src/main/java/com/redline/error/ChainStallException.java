package com.redline.error;

/**
 * A chain element neither called {@code next()} nor {@code interrupt()} before the request
 * deadline elapsed.
 */
public class ChainStallException extends RuntimeException {

    public ChainStallException(String elementName, long timeoutMillis) {
        super("Chain did not advance past '" + elementName + "' within " + timeoutMillis + "ms");
    }
}
