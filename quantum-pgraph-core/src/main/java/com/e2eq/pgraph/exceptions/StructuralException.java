package com.e2eq.pgraph.exceptions;

/**
 * Thrown when an object graph handed to decomposition cannot be flattened: nesting
 * deeper than the configured limit, or two distinct instances claiming the same pid
 * with different node types in one call.
 */
public class StructuralException extends PropertyGraphException {
    private static final long serialVersionUID = 1L;

    public StructuralException(String message) {
        super(message);
    }
}
