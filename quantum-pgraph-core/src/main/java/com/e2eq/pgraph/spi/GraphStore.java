package com.e2eq.pgraph.spi;

import com.e2eq.pgraph.model.Edge;
import com.e2eq.pgraph.model.GraphMetadata;
import com.e2eq.pgraph.model.GraphSchema;
import com.e2eq.pgraph.model.IdEntry;
import com.e2eq.pgraph.model.Relation;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence of the shared node/edge relation. Implementations own the physical layout;
 * callers deal in pids, row ids and normalized values only.
 * <p>
 * Filters typed {@code Long}/{@code String} are optional: null means unconstrained.
 * Paged finders take an offset and a limit and return results in a stable order so
 * callers can page through them.
 * </p>
 */
public interface GraphStore extends IdentityTranslator, AutoCloseable {

    /**
     * Creates the relation, sequence and metadata table if missing and adds any
     * extension columns the schema declares. Safe to call again with the same schema.
     */
    void initialize(GraphSchema schema);

    Optional<GraphMetadata> loadMetadata();

    void saveMetadata(GraphMetadata metadata);

    WriteTransaction beginWrite();

    long insertNode(NodeRow row);

    void updateNode(long rowId, NodeRow row);

    long insertEdge(EdgeRow row);

    void updateEdge(long rowId, EdgeRow row);

    Optional<NodeEntry> findEntry(String pid);

    // Edge fan-out, one relation per object, ordered by edge row id then object position
    List<Relation> findRelations(Long subject, String predicate, Long object, long offset, int limit);

    // Ordered by edge row id
    List<Edge> findEdges(Long subject, String predicate, long offset, int limit);

    // Edges whose object list contains the row, ordered by edge row id
    List<Edge> findEdgesReferencing(long objectRowId);

    // Ordered by row id
    List<IdEntry> findIds(String otype, long offset, int limit);

    Map<String, Long> countByOtype();

    Map<String, Long> countByPredicate();

    /**
     * Pids of every row that reaches {@code rowId} through one or more edges
     * (subject to object), ordered by row id.
     */
    List<String> findRoots(long rowId);

    @Override
    void close();
}
