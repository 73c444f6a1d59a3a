package com.e2eq.pgraph.core;

import com.e2eq.pgraph.exceptions.GraphConfigException;
import com.e2eq.pgraph.exceptions.PropertyGraphException;
import com.e2eq.pgraph.model.FieldType;
import com.e2eq.pgraph.model.GraphEntity;
import com.e2eq.pgraph.model.TypeDescriptor;

import java.lang.invoke.MethodHandle;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Precomputed accessors for one entity class, split into literal fields (stored as columns
 * of the entity's own row) and reference fields (stored as edges to separate nodes).
 */
public final class EntityBinding {

    public static final class LiteralBinding {
        public final String column;
        public final FieldType type;
        final MethodHandle accessor;

        LiteralBinding(String column, FieldType type, MethodHandle accessor) {
            this.column = column;
            this.type = type;
            this.accessor = accessor;
        }
    }

    public static final class ReferenceBinding {
        public final String predicate;
        public final boolean collection;
        public final Class<?> targetType;
        final MethodHandle accessor;

        ReferenceBinding(String predicate, boolean collection, Class<?> targetType, MethodHandle accessor) {
            this.predicate = predicate;
            this.collection = collection;
            this.targetType = targetType;
            this.accessor = accessor;
        }
    }

    private final Class<? extends GraphEntity> entityClass;
    private final String otype;
    private final List<LiteralBinding> literals;
    private final List<ReferenceBinding> references;

    EntityBinding(Class<? extends GraphEntity> entityClass,
                  String otype,
                  List<LiteralBinding> literals,
                  List<ReferenceBinding> references) {
        this.entityClass = entityClass;
        this.otype = otype;
        this.literals = List.copyOf(literals);
        this.references = List.copyOf(references);
    }

    public Class<? extends GraphEntity> entityClass() {
        return entityClass;
    }

    public String otype() {
        return otype;
    }

    public List<LiteralBinding> literals() {
        return literals;
    }

    public List<ReferenceBinding> references() {
        return references;
    }

    public TypeDescriptor descriptor() {
        List<TypeDescriptor.FieldDef> defs = new ArrayList<>();
        for (LiteralBinding l : literals) defs.add(new TypeDescriptor.FieldDef(l.column, l.type));
        return new TypeDescriptor(otype, defs);
    }

    /**
     * Literal column values of {@code entity}, normalized to their canonical representation.
     */
    public Map<String, Object> literalValues(GraphEntity entity) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (LiteralBinding l : literals) {
            Object raw = read(l.accessor, entity, l.column);
            try {
                out.put(l.column, l.type.normalize(raw));
            } catch (IllegalArgumentException | ArithmeticException e) {
                throw new GraphConfigException(otype, l.column, "Cannot store field '" + l.column + "' of type '" + otype + "': " + e.getMessage());
            }
        }
        return out;
    }

    /**
     * Entities referenced through {@code ref}, in field order. Null elements are skipped.
     */
    public List<GraphEntity> referenced(ReferenceBinding ref, GraphEntity entity) {
        Object val = read(ref.accessor, entity, ref.predicate);
        List<GraphEntity> out = new ArrayList<>();
        if (val == null) return out;
        if (val instanceof Collection<?> c) {
            for (Object o : c) addEntity(out, o, ref);
        } else if (val.getClass().isArray()) {
            int len = Array.getLength(val);
            for (int i = 0; i < len; i++) addEntity(out, Array.get(val, i), ref);
        } else {
            addEntity(out, val, ref);
        }
        return out;
    }

    private void addEntity(List<GraphEntity> out, Object o, ReferenceBinding ref) {
        if (o == null) return;
        if (!(o instanceof GraphEntity ge)) {
            throw new GraphConfigException(otype, ref.predicate, "Reference field '" + ref.predicate + "' holds a non-entity value of type " + o.getClass().getName());
        }
        out.add(ge);
    }

    private Object read(MethodHandle accessor, GraphEntity entity, String name) {
        try {
            return accessor.invoke(entity);
        } catch (RuntimeException e) {
            throw e;
        } catch (Throwable t) {
            throw new PropertyGraphException("Failed to read field '" + name + "' of " + entityClass.getName(), t);
        }
    }
}
