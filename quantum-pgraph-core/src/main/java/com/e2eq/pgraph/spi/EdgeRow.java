package com.e2eq.pgraph.spi;

import java.util.List;

/**
 * Column values for writing an edge row. Endpoints are row ids that were resolved
 * before the write.
 */
public record EdgeRow(String pid,
                      long subject,
                      String predicate,
                      List<Long> objects,
                      String namedGraph,
                      String label,
                      String description,
                      List<String> altids,
                      long timestamp) {

    public EdgeRow {
        objects = List.copyOf(objects);
        altids = altids == null ? null : List.copyOf(altids);
    }
}
