package com.e2eq.pgraph.model;

import java.util.List;
import java.util.Optional;

/**
 * An edge row read back with its endpoints translated to pids. {@code objects} keeps
 * the stored order.
 */
public record Edge(String pid, String subject, String predicate, List<String> objects, String namedGraph) {

    public Edge {
        objects = objects == null ? List.of() : List.copyOf(objects);
    }

    public Optional<String> namedGraphOpt() {
        return Optional.ofNullable(namedGraph);
    }
}
