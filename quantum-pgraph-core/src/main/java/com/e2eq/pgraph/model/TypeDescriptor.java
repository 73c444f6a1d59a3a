package com.e2eq.pgraph.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Declares a node type: its name (the {@code otype} value) and the extension columns
 * rows of that type populate. Equality is structural, so registering an identical
 * descriptor twice is detectable.
 */
public record TypeDescriptor(String name, List<FieldDef> fields) {

    public record FieldDef(String name, FieldType type) {
        public FieldDef {
            Objects.requireNonNull(name, "field name");
            Objects.requireNonNull(type, "field type");
        }
    }

    public TypeDescriptor {
        Objects.requireNonNull(name, "type name");
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public static TypeDescriptor of(String name, FieldDef... fields) {
        return new TypeDescriptor(name, List.of(fields));
    }

    public Optional<FieldDef> field(String fieldName) {
        return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
    }

    public List<String> fieldNames() {
        return fields.stream().map(FieldDef::name).toList();
    }
}
