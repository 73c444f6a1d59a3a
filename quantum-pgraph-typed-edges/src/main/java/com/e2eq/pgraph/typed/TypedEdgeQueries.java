package com.e2eq.pgraph.typed;

import com.e2eq.pgraph.core.PropertyGraph;
import com.e2eq.pgraph.model.Edge;
import com.e2eq.pgraph.model.Relation;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-side queries that classify edges by the otypes of their endpoints. Types are
 * inferred on every call; nothing extra is stored.
 */
public class TypedEdgeQueries {

    private static final Logger LOG = Logger.getLogger(TypedEdgeQueries.class);

    private final PropertyGraph graph;
    private final EdgeTypeCatalog catalog;

    public TypedEdgeQueries(PropertyGraph graph, EdgeTypeCatalog catalog) {
        this.graph = graph;
        this.catalog = catalog;
    }

    public EdgeTypeCatalog catalog() {
        return catalog;
    }

    /**
     * The catalog type matching the endpoints' otypes. Empty when either endpoint is
     * missing or is itself an edge, or when no type matches.
     */
    public Optional<EdgeTypeDef> inferEdgeType(String subjectPid, String predicate, String objectPid) {
        Optional<String> s = nodeOtype(subjectPid);
        if (s.isEmpty()) {
            LOG.debugf("Subject node not found: %s", subjectPid);
            return Optional.empty();
        }
        Optional<String> o = nodeOtype(objectPid);
        if (o.isEmpty()) {
            LOG.debugf("Object node not found: %s", objectPid);
            return Optional.empty();
        }
        return catalog.fromSpo(s.get(), predicate, o.get());
    }

    /**
     * Edges of the given type: predicate matches, subject has the subject type and every
     * object has the object type. {@code limit <= 0} means no limit.
     */
    public List<TypedEdge> edgesByType(EdgeTypeDef type, int limit) {
        Map<String, Optional<String>> otypes = new HashMap<>();
        List<TypedEdge> out = new ArrayList<>();
        for (Edge e : graph.getEdges(null, type.predicate(), 0)) {
            if (matches(e, type, otypes)) {
                out.add(new TypedEdge(e, type));
                if (limit > 0 && out.size() >= limit) break;
            }
        }
        return out;
    }

    private boolean matches(Edge e, EdgeTypeDef type, Map<String, Optional<String>> otypes) {
        if (e.objects().isEmpty()) return false;
        if (!type.subjectType().equals(cachedOtype(e.subject(), otypes).orElse(null))) return false;
        for (String o : e.objects()) {
            if (!type.objectType().equals(cachedOtype(o, otypes).orElse(null))) return false;
        }
        return true;
    }

    /**
     * Relations with their inferred type, optionally restricted to one type. With a type
     * filter only relations of that type are returned. {@code maxRows <= 0} means no limit.
     */
    public List<TypedRelation> typedRelations(String subject, EdgeTypeDef type, String object, long maxRows) {
        Map<String, Optional<String>> otypes = new HashMap<>();
        List<TypedRelation> out = new ArrayList<>();
        for (Relation r : graph.getRelations(subject, type == null ? null : type.predicate(), object)) {
            EdgeTypeDef inferred = inferCached(r, otypes);
            if (type != null && !type.equals(inferred)) continue;
            out.add(TypedRelation.of(r, inferred));
            if (maxRows > 0 && out.size() >= maxRows) break;
        }
        return out;
    }

    /**
     * One relation per object for every edge whose type starts at {@code subjectType},
     * grouped by type in catalog order. {@code limit} applies per type, counted in edges.
     */
    public List<TypedRelation> edgesBySubjectType(String subjectType, int limit) {
        return fanOut(catalog.bySubjectType(subjectType), limit);
    }

    public List<TypedRelation> edgesByObjectType(String objectType, int limit) {
        return fanOut(catalog.byObjectType(objectType), limit);
    }

    private List<TypedRelation> fanOut(List<EdgeTypeDef> types, int limit) {
        List<TypedRelation> out = new ArrayList<>();
        for (EdgeTypeDef t : types) {
            for (TypedEdge te : edgesByType(t, limit)) {
                for (String o : te.edge().objects()) {
                    out.add(new TypedRelation(te.edge().subject(), te.edge().predicate(), o, t));
                }
            }
        }
        return out;
    }

    /**
     * Checks one (subject, predicate, object) against the catalog and, when
     * {@code expected} is given, against that type.
     */
    public EdgeValidationResult validateEdge(String subjectPid, String predicate, String objectPid, EdgeTypeDef expected) {
        String s = nodeOtype(subjectPid).orElse("Unknown");
        String o = nodeOtype(objectPid).orElse("Unknown");
        Optional<EdgeTypeDef> inferred = catalog.fromSpo(s, predicate, o);
        if (inferred.isEmpty()) {
            return EdgeValidationResult.failed("Edge pattern (" + s + ", " + predicate + ", " + o
                    + ") does not match any known edge type");
        }
        if (expected != null && !expected.equals(inferred.get())) {
            return EdgeValidationResult.failed("Expected " + expected.name() + " but inferred " + inferred.get().name());
        }
        return EdgeValidationResult.ok();
    }

    /**
     * Edge count per type for types that occur at all, most frequent first.
     */
    public Map<EdgeTypeDef, Long> edgeTypeStatistics() {
        List<Map.Entry<EdgeTypeDef, Long>> counts = new ArrayList<>();
        for (EdgeTypeDef t : catalog.all()) {
            long n = edgesByType(t, 0).size();
            if (n > 0) counts.add(Map.entry(t, n));
        }
        counts.sort(Map.Entry.<EdgeTypeDef, Long>comparingByValue(Comparator.reverseOrder()));
        Map<EdgeTypeDef, Long> out = new LinkedHashMap<>();
        for (Map.Entry<EdgeTypeDef, Long> e : counts) out.put(e.getKey(), e.getValue());
        return out;
    }

    private EdgeTypeDef inferCached(Relation r, Map<String, Optional<String>> otypes) {
        Optional<String> s = cachedOtype(r.subject(), otypes);
        Optional<String> o = cachedOtype(r.object(), otypes);
        if (s.isEmpty() || o.isEmpty()) return null;
        return catalog.fromSpo(s.get(), r.predicate(), o.get()).orElse(null);
    }

    private Optional<String> cachedOtype(String pid, Map<String, Optional<String>> otypes) {
        return otypes.computeIfAbsent(pid, this::nodeOtype);
    }

    // otype of a node row; edges and unknown pids have none
    Optional<String> nodeOtype(String pid) {
        if (pid == null) return Optional.empty();
        String edgeType = graph.context().config().edgeType();
        return graph.otypeOf(pid).filter(t -> !t.equals(edgeType));
    }
}
