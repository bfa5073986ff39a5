package com.theobroma.perf.util;

/**
 * A farm or lot that the request refers to does not exist. Mapped to HTTP 404.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
