package com.e2eq.pgraph.typed;

import com.e2eq.pgraph.exceptions.GraphConfigException;

import java.io.IOException;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed set of edge types, looked up by name, by triple or by endpoint type. Lookups
 * return types in catalog order.
 */
public final class EdgeTypeCatalog {

    public static final String ISAMPLES_RESOURCE = "/pgraph/isamples-edge-types.yaml";

    private final List<EdgeTypeDef> types;
    private final Map<String, EdgeTypeDef> byName;
    private final Map<String, EdgeTypeDef> byId;

    public EdgeTypeCatalog(Collection<EdgeTypeDef> types) {
        Map<String, EdgeTypeDef> names = new LinkedHashMap<>();
        Map<String, EdgeTypeDef> ids = new LinkedHashMap<>();
        for (EdgeTypeDef t : types) {
            if (names.putIfAbsent(t.name(), t) != null) {
                throw new GraphConfigException("Duplicate edge type name '" + t.name() + "'");
            }
            if (ids.putIfAbsent(t.id(), t) != null) {
                throw new GraphConfigException("Edge types '" + ids.get(t.id()).name() + "' and '" + t.name()
                        + "' declare the same pattern " + t);
            }
        }
        this.types = List.copyOf(types);
        this.byName = Collections.unmodifiableMap(names);
        this.byId = Collections.unmodifiableMap(ids);
    }

    /**
     * The bundled iSamples catalog: 14 edge types between the iSamples core entities.
     */
    public static EdgeTypeCatalog isamples() {
        try {
            return new YamlEdgeTypeCatalogLoader().loadFromClasspath(ISAMPLES_RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + ISAMPLES_RESOURCE, e);
        }
    }

    public List<EdgeTypeDef> all() {
        return types;
    }

    public int size() {
        return types.size();
    }

    public Optional<EdgeTypeDef> byName(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public Optional<EdgeTypeDef> byId(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public Optional<EdgeTypeDef> fromSpo(String subjectType, String predicate, String objectType) {
        if (subjectType == null || predicate == null || objectType == null) return Optional.empty();
        return byId(EdgeTypeDef.idOf(subjectType, predicate, objectType));
    }

    public List<EdgeTypeDef> fromPredicate(String predicate) {
        return types.stream().filter(t -> t.predicate().equals(predicate)).toList();
    }

    public List<EdgeTypeDef> bySubjectType(String subjectType) {
        return types.stream().filter(t -> t.subjectType().equals(subjectType)).toList();
    }

    public List<EdgeTypeDef> byObjectType(String objectType) {
        return types.stream().filter(t -> t.objectType().equals(objectType)).toList();
    }

    /**
     * Checks an observed {@code (subjectOtype, predicate, objectOtype)} against the type
     * with the given id or name.
     */
    public EdgeValidationResult validate(String edgeType, String subjectOtype, String predicate, String objectOtype) {
        EdgeTypeDef t = byId.get(edgeType);
        if (t == null) t = byName.get(edgeType);
        if (t == null) return EdgeValidationResult.failed("Unknown edge type: " + edgeType);
        if (!t.subjectType().equals(subjectOtype)) {
            return EdgeValidationResult.failed("Subject type mismatch: expected " + t.subjectType() + ", got " + subjectOtype);
        }
        if (!t.predicate().equals(predicate)) {
            return EdgeValidationResult.failed("Predicate mismatch: expected " + t.predicate() + ", got " + predicate);
        }
        if (!t.objectType().equals(objectOtype)) {
            return EdgeValidationResult.failed("Object type mismatch: expected " + t.objectType() + ", got " + objectOtype);
        }
        return EdgeValidationResult.ok();
    }
}
