package com.e2eq.pgraph.model;

/**
 * A triple reached during breadth-first traversal. Edges leaving the start node have depth 1.
 */
public record TraversalStep(String subject, String predicate, String object, int depth) {

    public Relation relation() {
        return new Relation(subject, predicate, object);
    }
}
