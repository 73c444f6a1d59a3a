package com.e2eq.pgraph.exceptions;

import java.util.List;

/**
 * Thrown when an edge write references a pid that does not resolve to an existing row.
 * <p>
 * The failing edge is not written. Callers must create every referenced node before
 * the edge that points at it.
 * </p>
 */
public class ReferentialIntegrityException extends PropertyGraphException {
    private static final long serialVersionUID = 1L;

    private final String subject;
    private final String predicate;
    private final List<String> missingPids;

    public ReferentialIntegrityException(String subject, String predicate, List<String> missingPids) {
        super(buildMessage(subject, predicate, missingPids));
        this.subject = subject;
        this.predicate = predicate;
        this.missingPids = List.copyOf(missingPids);
    }

    private static String buildMessage(String subject, String predicate, List<String> missingPids) {
        return String.format(
            "Edge (%s, %s, ...) references unresolved pid(s) %s; create the nodes before the edge",
            subject, predicate, missingPids
        );
    }

    public String getSubject() {
        return subject;
    }

    public String getPredicate() {
        return predicate;
    }

    /**
     * The pids that could not be resolved, in the order they were referenced.
     */
    public List<String> getMissingPids() {
        return missingPids;
    }
}
