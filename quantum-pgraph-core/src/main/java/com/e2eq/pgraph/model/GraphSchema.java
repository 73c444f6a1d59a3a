package com.e2eq.pgraph.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The unified schema of the shared relation: every registered node type plus the merged
 * set of extension columns. Produced once by finalization and immutable afterwards.
 */
public record GraphSchema(String primaryKey,
                          String edgeType,
                          Map<String, TypeDescriptor> types,
                          Map<String, FieldType> columns) {

    public GraphSchema {
        types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
        columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public Optional<TypeDescriptor> type(String otype) {
        return Optional.ofNullable(types.get(otype));
    }

    public Optional<FieldType> columnType(String column) {
        return Optional.ofNullable(columns.get(column));
    }

    public Set<String> typeNames() {
        return types.keySet();
    }

    /**
     * Extension columns declared by {@code otype}; empty for edges and unknown types.
     */
    public Set<String> fieldsOf(String otype) {
        TypeDescriptor d = types.get(otype);
        return d == null ? Set.of() : Set.copyOf(d.fieldNames());
    }
}
