package com.e2eq.pgraph.spi;

import java.util.Map;

/**
 * A stored row as read back. {@code values} holds label, description, altids and the
 * type's extension columns; for edges also s, p, o and n with endpoints as pids.
 */
public record NodeEntry(long rowId,
                        String pid,
                        String otype,
                        long tcreated,
                        long tmodified,
                        Map<String, Object> values) {}
