package com.e2eq.pgraph.model;

/**
 * An edge found while walking backwards from a pid towards its roots.
 * {@code depth} counts hops from the starting pid; {@code subjectOtype} is the node
 * type of the edge's subject.
 */
public record RootEdge(String edgePid,
                       String subject,
                       String predicate,
                       String object,
                       String namedGraph,
                       int depth,
                       String subjectOtype) {}
