package com.e2eq.pgraph.typed;

import com.e2eq.pgraph.exceptions.PropertyGraphException;

/**
 * Thrown by {@link TypedEdgeGenerator} when an edge does not fit the catalog. Nothing is
 * written.
 */
public class EdgeValidationException extends PropertyGraphException {
    private static final long serialVersionUID = 1L;

    private final String subject;
    private final String predicate;

    public EdgeValidationException(String subject, String predicate, String message) {
        super("Edge validation failed for (" + subject + ", " + predicate + "): " + message);
        this.subject = subject;
        this.predicate = predicate;
    }

    public String getSubject() {
        return subject;
    }

    public String getPredicate() {
        return predicate;
    }
}
