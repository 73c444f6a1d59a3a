package com.e2eq.pgraph.core;

import com.e2eq.pgraph.exceptions.GraphConfigException;
import com.e2eq.pgraph.exceptions.ReferentialIntegrityException;
import com.e2eq.pgraph.model.Edge;
import com.e2eq.pgraph.model.FieldType;
import com.e2eq.pgraph.model.GraphSchema;
import com.e2eq.pgraph.model.IdEntry;
import com.e2eq.pgraph.model.Relation;
import com.e2eq.pgraph.model.TypeDescriptor;
import com.e2eq.pgraph.spi.EdgeRow;
import com.e2eq.pgraph.spi.GraphStore;
import com.e2eq.pgraph.spi.NodeEntry;
import com.e2eq.pgraph.spi.NodeRow;
import com.e2eq.pgraph.spi.WriteTransaction;
import com.e2eq.pgraph.util.PagedIterable;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * Reads and writes individual node and edge rows. Writes are upserts keyed by pid: an
 * existing row keeps its row id and tcreated, everything else is replaced.
 */
public class GraphAccessor {

    private static final Logger LOG = Logger.getLogger(GraphAccessor.class);

    private final GraphContext ctx;
    private final GraphStore store;

    public GraphAccessor(GraphContext ctx, GraphStore store) {
        this.ctx = ctx;
        this.store = store;
    }

    // ---- writes ----

    /**
     * Writes a node row. {@code fields} must hold normalized values for fields the type declares.
     *
     * @return the row id of the written row
     */
    public long writeNode(String pid, String otype, String label, String description, List<String> altids, Map<String, Object> fields) {
        NodeRow row = new NodeRow(pid, otype, label, description, altids, fields, ctx.now());
        try (WriteTransaction tx = store.beginWrite()) {
            OptionalLong existing = store.pidToRowId(pid);
            long rowId;
            if (existing.isPresent()) {
                rowId = existing.getAsLong();
                store.updateNode(rowId, row);
                LOG.debugf("Updated node %s (%s) row_id=%d", pid, otype, rowId);
            } else {
                rowId = store.insertNode(row);
                LOG.debugf("Inserted node %s (%s) row_id=%d", pid, otype, rowId);
            }
            tx.commit();
            return rowId;
        }
    }

    /**
     * Writes a flat row of a registered type from a property map. Recognized keys are the
     * pid column, label, description, altids and the fields the type declares. A missing
     * pid is generated.
     *
     * @return the pid of the written row
     */
    public String addNodeEntry(String otype, Map<String, Object> data) {
        GraphSchema schema = schema();
        TypeDescriptor type = schema.type(otype)
                .orElseThrow(() -> new GraphConfigException(otype, null, "Type '" + otype + "' is not registered"));
        String pkField = ctx.config().primaryKeyField();
        Map<String, Object> fields = new LinkedHashMap<>();
        String pid = null;
        String label = null;
        String description = null;
        List<String> altids = null;
        for (Map.Entry<String, Object> e : data.entrySet()) {
            String key = e.getKey();
            Object value = e.getValue();
            if (key.equals(pkField)) {
                pid = value == null ? null : value.toString();
            } else if (key.equals(ReservedFields.LABEL)) {
                label = (String) FieldType.STRING.normalize(value);
            } else if (key.equals(ReservedFields.DESCRIPTION)) {
                description = (String) FieldType.STRING.normalize(value);
            } else if (key.equals(ReservedFields.ALTIDS)) {
                altids = stringList(value);
            } else if (key.equals(ReservedFields.OTYPE)) {
                if (value != null && !otype.equals(value)) {
                    throw new GraphConfigException(otype, key, "otype '" + value + "' does not match '" + otype + "'");
                }
            } else {
                TypeDescriptor.FieldDef def = type.field(key)
                        .orElseThrow(() -> new GraphConfigException(otype, key, "Type '" + otype + "' declares no field '" + key + "'"));
                try {
                    fields.put(key, def.type().normalize(value));
                } catch (IllegalArgumentException | ArithmeticException ex) {
                    throw new GraphConfigException(otype, key, "Cannot store field '" + key + "': " + ex.getMessage());
                }
            }
        }
        if (pid == null || pid.isBlank()) pid = newAnonymousPid();
        writeNode(pid, otype, label, description, altids, fields);
        return pid;
    }

    public String addEdge(String subject, String predicate, String object) {
        return addEdge(subject, predicate, List.of(object), null);
    }

    public String addEdge(String subject, String predicate, List<String> objects, String namedGraph) {
        return addEdge(subject, predicate, objects, namedGraph, null, null, null);
    }

    /**
     * Writes an edge from {@code subject} to every pid in {@code objects}, in order. The
     * edge pid is derived from its content, so writing the same edge twice updates one row.
     *
     * @return the edge pid
     * @throws ReferentialIntegrityException if any endpoint does not resolve; nothing is written
     */
    public String addEdge(String subject, String predicate, List<String> objects, String namedGraph,
                          String label, String description, List<String> altids) {
        if (subject == null) throw new IllegalArgumentException("Edge subject must not be null");
        if (predicate == null || predicate.isBlank()) throw new IllegalArgumentException("Edge predicate must not be blank");
        if (objects == null || objects.isEmpty()) throw new IllegalArgumentException("Edge needs at least one object");
        for (String o : objects) {
            if (o == null) throw new IllegalArgumentException("Edge objects must not contain null");
        }

        LinkedHashSet<String> endpoints = new LinkedHashSet<>();
        endpoints.add(subject);
        endpoints.addAll(objects);
        Map<String, Long> resolved = store.resolveAll(endpoints);
        List<String> missing = new ArrayList<>();
        for (String pid : endpoints) {
            if (!resolved.containsKey(pid)) missing.add(pid);
        }
        if (!missing.isEmpty()) {
            LOG.warnf("Rejected edge (%s, %s): unresolved %s", subject, predicate, missing);
            throw new ReferentialIntegrityException(subject, predicate, missing);
        }
        List<Long> objectIds = new ArrayList<>(objects.size());
        for (String o : objects) objectIds.add(resolved.get(o));

        String pid = EdgeIdentity.edgePid(ctx.config().anonymousPrefix(), subject, predicate, objects, namedGraph);
        EdgeRow row = new EdgeRow(pid, resolved.get(subject), predicate, objectIds, namedGraph, label, description, altids, ctx.now());
        try (WriteTransaction tx = store.beginWrite()) {
            OptionalLong existing = store.pidToRowId(pid);
            if (existing.isPresent()) {
                store.updateEdge(existing.getAsLong(), row);
            } else {
                store.insertEdge(row);
            }
            tx.commit();
        }
        LOG.debugf("Wrote edge %s: (%s, %s, %s)", pid, subject, predicate, objects);
        return pid;
    }

    String newAnonymousPid() {
        return ctx.config().anonymousPrefix() + UUID.randomUUID().toString().replace("-", "");
    }

    // ---- reads ----

    public Optional<Map<String, Object>> getNode(String pid) {
        return getNode(pid, 0);
    }

    /**
     * Property bag of the row with {@code pid}. With {@code expandDepth > 0} the targets of
     * the node's outgoing edges are inlined under the edge predicate, recursively up to
     * that depth: one target as a map, several as a list of maps. A predicate named like a
     * key already in the bag is not inlined.
     */
    public Optional<Map<String, Object>> getNode(String pid, int expandDepth) {
        if (pid == null) return Optional.empty();
        return store.findEntry(pid).map(entry -> toBag(entry, expandDepth));
    }

    private Map<String, Object> toBag(NodeEntry entry, int expandDepth) {
        Map<String, Object> bag = new LinkedHashMap<>();
        bag.put(ctx.config().primaryKeyField(), entry.pid());
        bag.put(ReservedFields.OTYPE, entry.otype());
        bag.put(ReservedFields.TCREATED, entry.tcreated());
        bag.put(ReservedFields.TMODIFIED, entry.tmodified());
        bag.putAll(entry.values());
        if (expandDepth > 0 && !isEdgeType(entry.otype())) {
            Map<String, List<Map<String, Object>>> inlined = new LinkedHashMap<>();
            for (Edge edge : allEdges(entry.rowId(), null)) {
                for (String target : edge.objects()) {
                    store.findEntry(target).ifPresent(t ->
                            inlined.computeIfAbsent(edge.predicate(), k -> new ArrayList<>()).add(toBag(t, expandDepth - 1)));
                }
            }
            inlined.forEach((predicate, targets) -> {
                // a literal field of the same name wins over the expansion
                if (bag.containsKey(predicate)) {
                    LOG.debugf("Not inlining '%s' on %s: the name is taken by a field", predicate, entry.pid());
                    return;
                }
                bag.put(predicate, targets.size() == 1 ? targets.get(0) : targets);
            });
        }
        return bag;
    }

    public Optional<Edge> getEdge(String pid) {
        if (pid == null) return Optional.empty();
        return store.findEntry(pid)
                .filter(e -> isEdgeType(e.otype()))
                .map(GraphAccessor::toEdge);
    }

    @SuppressWarnings("unchecked")
    static Edge toEdge(NodeEntry e) {
        Map<String, Object> v = e.values();
        return new Edge(e.pid(),
                (String) v.get(ReservedFields.SUBJECT),
                (String) v.get(ReservedFields.PREDICATE),
                (List<String>) v.get(ReservedFields.OBJECT),
                (String) v.get(ReservedFields.NAMED_GRAPH));
    }

    public Optional<String> otypeOf(String pid) {
        if (pid == null) return Optional.empty();
        return store.findEntry(pid).map(NodeEntry::otype);
    }

    /**
     * Edges matching an optional subject and predicate, ordered by edge row id.
     */
    public Iterable<Edge> getEdges(String subject, String predicate, long maxRows) {
        Long s = null;
        if (subject != null) {
            OptionalLong rid = store.pidToRowId(subject);
            if (rid.isEmpty()) return List.of();
            s = rid.getAsLong();
        }
        Long sRowId = s;
        return new PagedIterable<>(ctx.config().pageSize(), maxRows) {
            @Override
            protected List<Edge> fetch(long offset, int limit) {
                return store.findEdges(sRowId, predicate, offset, limit);
            }
        };
    }

    List<Edge> allEdges(long subjectRowId, String predicate) {
        List<Edge> out = new ArrayList<>();
        new PagedIterable<Edge>(ctx.config().pageSize(), 0) {
            @Override
            protected List<Edge> fetch(long offset, int limit) {
                return store.findEdges(subjectRowId, predicate, offset, limit);
            }
        }.forEach(out::add);
        return out;
    }

    /**
     * Triples matching the optional subject, predicate and object filters. Each edge fans
     * out to one relation per object; results are ordered by edge row id, then object
     * position. An unknown subject or object pid matches nothing.
     */
    public Iterable<Relation> getRelations(String subject, String predicate, String object, long maxRows) {
        Long s = null;
        Long o = null;
        if (subject != null) {
            OptionalLong rid = store.pidToRowId(subject);
            if (rid.isEmpty()) return List.of();
            s = rid.getAsLong();
        }
        if (object != null) {
            OptionalLong rid = store.pidToRowId(object);
            if (rid.isEmpty()) return List.of();
            o = rid.getAsLong();
        }
        Long sRowId = s;
        Long oRowId = o;
        return new PagedIterable<>(ctx.config().pageSize(), maxRows) {
            @Override
            protected List<Relation> fetch(long offset, int limit) {
                return store.findRelations(sRowId, predicate, oRowId, offset, limit);
            }
        };
    }

    public Iterable<IdEntry> getIds(String otype, long maxRows) {
        return new PagedIterable<>(ctx.config().pageSize(), maxRows) {
            @Override
            protected List<IdEntry> fetch(long offset, int limit) {
                return store.findIds(otype, offset, limit);
            }
        };
    }

    public Map<String, Long> objectCounts() {
        return store.countByOtype();
    }

    public Map<String, Long> predicateCounts() {
        return store.countByPredicate();
    }

    /**
     * Every subject that transitively references {@code pid}, ordered by row id.
     */
    public List<String> getRootsForPid(String pid) {
        if (pid == null) return List.of();
        OptionalLong rid = store.pidToRowId(pid);
        if (rid.isEmpty()) return List.of();
        return store.findRoots(rid.getAsLong());
    }

    boolean isEdgeType(String otype) {
        return ctx.config().edgeType().equals(otype);
    }

    private GraphSchema schema() {
        return ctx.registry().schema()
                .orElseThrow(() -> new GraphConfigException("The graph is not initialized"));
    }

    @SuppressWarnings("unchecked")
    private static List<String> stringList(Object value) {
        if (value == null) return null;
        return (List<String>) FieldType.STRING_LIST.normalize(value);
    }

    GraphStore store() {
        return store;
    }
}
