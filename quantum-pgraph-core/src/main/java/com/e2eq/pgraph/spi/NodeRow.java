package com.e2eq.pgraph.spi;

import java.util.List;
import java.util.Map;

/**
 * Column values for writing a node row. {@code fields} holds the extension columns the
 * row's type declares, already normalized; every other extension column is written NULL.
 * {@code timestamp} is epoch milliseconds, used for tcreated on insert and tmodified always.
 */
public record NodeRow(String pid,
                      String otype,
                      String label,
                      String description,
                      List<String> altids,
                      Map<String, Object> fields,
                      long timestamp) {

    public NodeRow {
        altids = altids == null ? null : List.copyOf(altids);
        fields = fields == null ? Map.of() : fields;
    }
}
