package com.e2eq.pgraph.core;

import com.e2eq.pgraph.exceptions.GraphConfigException;
import com.e2eq.pgraph.model.FieldType;
import com.e2eq.pgraph.model.GraphSchema;
import com.e2eq.pgraph.model.TypeDescriptor;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Merges node type descriptors into one {@link GraphSchema}. All checks run before
 * anything is returned, so a failure leaves no partial schema behind.
 */
public final class SchemaBuilder {

    private final GraphConfig config;

    public SchemaBuilder(GraphConfig config) {
        this.config = config;
    }

    public GraphSchema build(Collection<TypeDescriptor> descriptors) {
        Map<String, TypeDescriptor> types = new LinkedHashMap<>();
        Map<String, FieldType> columns = new LinkedHashMap<>();
        Map<String, String> declaredBy = new LinkedHashMap<>();
        for (TypeDescriptor d : descriptors) {
            if (d.name().isBlank()) {
                throw new GraphConfigException("Node type name must not be blank");
            }
            if (d.name().equals(config.edgeType())) {
                throw new GraphConfigException(d.name(), null, "Node type name '" + d.name() + "' is reserved for edges");
            }
            Set<String> seen = new HashSet<>();
            for (TypeDescriptor.FieldDef f : d.fields()) {
                if (!seen.add(f.name())) {
                    throw new GraphConfigException(d.name(), f.name(),
                            "Field '" + f.name() + "' is declared twice in type '" + d.name() + "'");
                }
                if (!GraphConfig.IDENTIFIER.matcher(f.name()).matches()) {
                    throw new GraphConfigException(d.name(), f.name(),
                            "Field '" + f.name() + "' of type '" + d.name() + "' is not a valid column name");
                }
                if (ReservedFields.isReserved(f.name(), config.primaryKeyField())) {
                    throw new GraphConfigException(d.name(), f.name(),
                            "Field '" + f.name() + "' of type '" + d.name() + "' redeclares a reserved column");
                }
                FieldType existing = columns.get(f.name());
                if (existing != null && existing != f.type()) {
                    throw new GraphConfigException(d.name(), f.name(), String.format(
                            "Field '%s' is %s in type '%s' but %s in type '%s'",
                            f.name(), f.type(), d.name(), existing, declaredBy.get(f.name())));
                }
                if (existing == null) {
                    columns.put(f.name(), f.type());
                    declaredBy.put(f.name(), d.name());
                }
            }
            types.put(d.name(), d);
        }
        return new GraphSchema(config.primaryKeyField(), config.edgeType(), types, columns);
    }
}
