package com.e2eq.pgraph.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Schema description persisted next to the shared relation so that a reader can
 * reattach to an existing graph without registering types again.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GraphMetadata(String version,
                            String primaryKey,
                            String edgeType,
                            Map<String, Map<String, FieldType>> nodeTypes,
                            List<String> edgeFields,
                            List<String> literalFields) {

    public static final String CURRENT_VERSION = "pgraph-1";

    public GraphMetadata {
        nodeTypes = nodeTypes == null ? Map.of() : nodeTypes;
        edgeFields = edgeFields == null ? List.of() : List.copyOf(edgeFields);
        literalFields = literalFields == null ? List.of() : List.copyOf(literalFields);
    }

    public static GraphMetadata of(GraphSchema schema) {
        Map<String, Map<String, FieldType>> types = new TreeMap<>();
        for (TypeDescriptor d : schema.types().values()) {
            Map<String, FieldType> fields = new LinkedHashMap<>();
            for (TypeDescriptor.FieldDef f : d.fields()) fields.put(f.name(), f.type());
            types.put(d.name(), fields);
        }
        List<String> edgeFields = List.of(schema.primaryKey(), "otype", "s", "p", "o", "n", "altids");
        List<String> literals = new ArrayList<>(schema.columns().keySet());
        literals.sort(null);
        return new GraphMetadata(CURRENT_VERSION, schema.primaryKey(), schema.edgeType(), types, edgeFields, literals);
    }

    /**
     * The stored node types as descriptors, in stored (name) order.
     */
    public List<TypeDescriptor> descriptors() {
        List<TypeDescriptor> out = new ArrayList<>();
        nodeTypes.forEach((name, fields) -> {
            List<TypeDescriptor.FieldDef> defs = new ArrayList<>();
            if (fields != null) fields.forEach((f, t) -> defs.add(new TypeDescriptor.FieldDef(f, t)));
            out.add(new TypeDescriptor(name, defs));
        });
        return out;
    }
}
