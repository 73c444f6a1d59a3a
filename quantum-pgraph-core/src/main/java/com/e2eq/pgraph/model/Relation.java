package com.e2eq.pgraph.model;

/**
 * One (subject, predicate, object) triple, expressed with pids. An edge with k objects
 * fans out to k relations.
 */
public record Relation(String subject, String predicate, String object) {}
