package com.redline.error;

/** The response writer could not convert a value into bytes. */
public class SerializationException extends RuntimeException {

    public SerializationException(String handlerName, Throwable cause) {
        super("Failed to serialize response of '" + handlerName + "': " + cause.getMessage(), cause);
    }
}
