package com.e2eq.pgraph.core;

import com.e2eq.pgraph.exceptions.GraphConfigException;
import com.e2eq.pgraph.model.Edge;
import com.e2eq.pgraph.model.GraphEntity;
import com.e2eq.pgraph.model.GraphMetadata;
import com.e2eq.pgraph.model.GraphSchema;
import com.e2eq.pgraph.model.IdEntry;
import com.e2eq.pgraph.model.Relation;
import com.e2eq.pgraph.model.RootEdge;
import com.e2eq.pgraph.model.TraversalStep;
import com.e2eq.pgraph.model.TypeDescriptor;
import com.e2eq.pgraph.spi.GraphStore;
import com.e2eq.pgraph.spi.IdentityTranslator;
import com.e2eq.pgraph.spi.WriteTransaction;
import org.jboss.logging.Logger;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point for a property graph kept in a single shared relation.
 * <p>
 * Typical use: register types, {@link #initialize()}, then write with {@link #addNode}
 * and {@link #addEdge} and read through the query methods. Types stored by an earlier
 * session are picked up by {@code initialize()}, so a reader needs no registrations.
 * </p>
 */
public class PropertyGraph implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(PropertyGraph.class);

    private final GraphContext ctx;
    private final GraphStore store;
    private final GraphAccessor accessor;
    private final DecompositionEngine decomposition;
    private final TraversalEngine traversal;

    public PropertyGraph(GraphConfig config, GraphStore store) {
        this(GraphContext.of(config), store);
    }

    public PropertyGraph(GraphContext ctx, GraphStore store) {
        this.ctx = ctx;
        this.store = store;
        this.accessor = new GraphAccessor(ctx, store);
        this.decomposition = new DecompositionEngine(ctx, accessor);
        this.traversal = new TraversalEngine(ctx, accessor);
    }

    // ---- schema ----

    public PropertyGraph registerType(TypeDescriptor descriptor) {
        ctx.registry().registerType(descriptor);
        return this;
    }

    public PropertyGraph registerType(Class<? extends GraphEntity> entityClass) {
        ctx.registry().registerType(entityClass);
        return this;
    }

    public PropertyGraph registerTypes(Collection<TypeDescriptor> descriptors) {
        ctx.registry().registerTypes(descriptors);
        return this;
    }

    /**
     * Reattaches types stored with the graph, finalizes the schema, creates or extends the
     * relation and stores the resulting metadata. Calling it again has no effect.
     */
    public synchronized GraphSchema initialize() {
        Optional<GraphSchema> done = ctx.registry().schema();
        if (done.isPresent()) return done.get();
        Optional<GraphMetadata> stored = store.loadMetadata();
        if (stored.isPresent()) {
            GraphMetadata meta = stored.get();
            if (meta.primaryKey() != null && !meta.primaryKey().equals(ctx.config().primaryKeyField())) {
                throw new GraphConfigException("Stored graph uses pid column '" + meta.primaryKey()
                        + "' but the configuration names '" + ctx.config().primaryKeyField() + "'");
            }
            ctx.registry().registerTypes(meta.descriptors());
            LOG.debugf("Reattached %d stored type(s)", meta.nodeTypes().size());
        }
        GraphSchema schema = ctx.registry().finalizeSchema();
        store.initialize(schema);
        store.saveMetadata(GraphMetadata.of(schema));
        LOG.debugf("Initialized graph '%s' with types %s", ctx.config().tableName(), schema.typeNames());
        return schema;
    }

    public Optional<GraphMetadata> metadata() {
        return store.loadMetadata();
    }

    public GraphSchema schema() {
        return ctx.registry().schema()
                .orElseThrow(() -> new GraphConfigException("The graph is not initialized"));
    }

    // ---- writes ----

    /**
     * Starts an explicit write transaction. Writes issued before it is closed are committed
     * together by {@link WriteTransaction#commit()}.
     */
    public WriteTransaction beginWrite() {
        return store.beginWrite();
    }

    public String addNode(GraphEntity entity) {
        schema();
        return decomposition.addNode(entity);
    }

    public String addNodeEntry(String otype, Map<String, Object> data) {
        return accessor.addNodeEntry(otype, data);
    }

    public String addEdge(String subject, String predicate, String object) {
        schema();
        return accessor.addEdge(subject, predicate, object);
    }

    public String addEdge(String subject, String predicate, List<String> objects, String namedGraph) {
        schema();
        return accessor.addEdge(subject, predicate, objects, namedGraph);
    }

    public String addEdge(String subject, String predicate, List<String> objects, String namedGraph,
                          String label, String description, List<String> altids) {
        schema();
        return accessor.addEdge(subject, predicate, objects, namedGraph, label, description, altids);
    }

    // ---- reads ----

    public Optional<Map<String, Object>> getNode(String pid) {
        return accessor.getNode(pid, 0);
    }

    public Optional<Map<String, Object>> getNode(String pid, int expandDepth) {
        return accessor.getNode(pid, expandDepth);
    }

    public Optional<Edge> getEdge(String pid) {
        return accessor.getEdge(pid);
    }

    public Optional<String> otypeOf(String pid) {
        return accessor.otypeOf(pid);
    }

    public Iterable<Relation> getRelations(String subject, String predicate, String object) {
        return accessor.getRelations(subject, predicate, object, 0);
    }

    public Iterable<Relation> getRelations(String subject, String predicate, String object, long maxRows) {
        return accessor.getRelations(subject, predicate, object, maxRows);
    }

    public Iterable<Edge> getEdges(String subject, String predicate, long maxRows) {
        return accessor.getEdges(subject, predicate, maxRows);
    }

    public Iterable<IdEntry> getIds(String otype, long maxRows) {
        return accessor.getIds(otype, maxRows);
    }

    public Map<String, Long> objectCounts() {
        return accessor.objectCounts();
    }

    public Map<String, Long> predicateCounts() {
        return accessor.predicateCounts();
    }

    public List<String> getRootsForPid(String pid) {
        return accessor.getRootsForPid(pid);
    }

    public List<RootEdge> getRootEdgesForPid(Collection<String> pids, String targetType, Collection<String> predicates) {
        return traversal.getRootEdgesForPid(pids, targetType, predicates);
    }

    public Iterable<TraversalStep> breadthFirstTraversal(String startPid) {
        return traversal.breadthFirstTraversal(startPid);
    }

    public Iterable<TraversalStep> breadthFirstTraversal(String startPid, int maxDepth) {
        return traversal.breadthFirstTraversal(startPid, maxDepth);
    }

    public Set<String> getNodeIds(String pid) {
        return traversal.getNodeIds(pid);
    }

    public IdentityTranslator identity() {
        return store;
    }

    public GraphContext context() {
        return ctx;
    }

    @Override
    public void close() {
        store.close();
    }
}
