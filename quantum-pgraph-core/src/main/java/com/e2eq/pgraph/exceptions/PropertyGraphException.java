package com.e2eq.pgraph.exceptions;

/**
 * Base type for failures raised by the property graph. All subclasses are unchecked
 * and surface synchronously to the caller; nothing is retried internally.
 */
public class PropertyGraphException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public PropertyGraphException(String message) {
        super(message);
    }

    public PropertyGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
