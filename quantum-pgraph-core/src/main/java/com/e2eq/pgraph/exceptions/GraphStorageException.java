package com.e2eq.pgraph.exceptions;

/**
 * Wraps a failure reported by the underlying storage engine.
 */
public class GraphStorageException extends PropertyGraphException {
    private static final long serialVersionUID = 1L;

    public GraphStorageException(String message) {
        super(message);
    }

    public GraphStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
