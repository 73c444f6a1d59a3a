package com.e2eq.pgraph.duckdb;

import com.e2eq.pgraph.core.GraphConfig;
import com.e2eq.pgraph.exceptions.GraphStorageException;
import com.e2eq.pgraph.model.Edge;
import com.e2eq.pgraph.model.FieldType;
import com.e2eq.pgraph.model.GraphMetadata;
import com.e2eq.pgraph.model.GraphSchema;
import com.e2eq.pgraph.model.IdEntry;
import com.e2eq.pgraph.model.Relation;
import com.e2eq.pgraph.model.TypeDescriptor;
import com.e2eq.pgraph.spi.EdgeRow;
import com.e2eq.pgraph.spi.GraphStore;
import com.e2eq.pgraph.spi.NodeEntry;
import com.e2eq.pgraph.spi.NodeRow;
import com.e2eq.pgraph.spi.WriteTransaction;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * {@link GraphStore} over a single DuckDB connection.
 * <p>
 * Nodes and edges share one relation. Row ids come from a sequence and are assigned before
 * the insert. Edge endpoints are stored as row ids ({@code s} BIGINT, {@code o} BIGINT[])
 * and translated back to pids on read.
 * </p>
 * <p>
 * One connection means one writer. Writes outside an explicit transaction run in
 * auto-commit mode; {@link #beginWrite()} switches the connection to a transaction until
 * the outermost {@link WriteTransaction} closes. Pid/row id lookups are cached only for
 * the lifetime of that outermost transaction.
 * </p>
 */
public class DuckDbGraphStore implements GraphStore {

    private static final Logger LOG = Logger.getLogger(DuckDbGraphStore.class);

    private final Connection conn;
    private final GraphConfig config;
    private final NodeTableDdl ddl;
    private final DuckDbIdentityTranslator ids;
    private final MetadataRepo metadata;

    private GraphSchema schema;
    private int txDepth;
    private boolean rollbackOnly;

    public DuckDbGraphStore(Connection conn, GraphConfig config) {
        this(conn, config, new ObjectMapper());
    }

    public DuckDbGraphStore(Connection conn, GraphConfig config, ObjectMapper mapper) {
        this.conn = conn;
        this.config = config;
        this.ddl = new NodeTableDdl(config);
        this.ids = new DuckDbIdentityTranslator(conn, ddl, config.identityCacheSize());
        this.metadata = new MetadataRepo(conn, ddl, config.tableName(), mapper);
    }

    /**
     * Opens a connection to {@code config.url()}; {@code jdbc:duckdb:} gives a private
     * in-memory database.
     */
    public static DuckDbGraphStore open(GraphConfig config) {
        try {
            Connection conn = DriverManager.getConnection(config.url());
            LOG.debugf("Opened DuckDB connection %s", config.url());
            return new DuckDbGraphStore(conn, config);
        } catch (SQLException e) {
            throw new GraphStorageException("Failed to open " + config.url(), e);
        }
    }

    // ---- lifecycle ----

    @Override
    public synchronized void initialize(GraphSchema schema) {
        try (Statement st = conn.createStatement()) {
            for (String sql : ddl.statements(schema)) {
                LOG.debug(sql);
                st.execute(sql);
            }
        } catch (SQLException e) {
            throw new GraphStorageException("Failed to create relation " + config.tableName(), e);
        }
        this.schema = schema;
    }

    @Override
    public Optional<GraphMetadata> loadMetadata() {
        return metadata.load();
    }

    @Override
    public void saveMetadata(GraphMetadata graphMetadata) {
        metadata.save(graphMetadata);
    }

    @Override
    public synchronized WriteTransaction beginWrite() {
        if (txDepth == 0) {
            try {
                conn.setAutoCommit(false);
            } catch (SQLException e) {
                throw new GraphStorageException("Failed to start a write transaction", e);
            }
            rollbackOnly = false;
            ids.openScope();
        }
        txDepth++;
        return new Tx(txDepth == 1);
    }

    private final class Tx implements WriteTransaction {
        private final boolean outermost;
        private boolean committed;
        private boolean closed;

        Tx(boolean outermost) {
            this.outermost = outermost;
        }

        @Override
        public void commit() {
            synchronized (DuckDbGraphStore.this) {
                if (outermost && rollbackOnly) {
                    throw new GraphStorageException(
                            "Write transaction was marked rollback-only by a failed nested write; nothing was committed");
                }
                committed = true;
            }
        }

        @Override
        public void close() {
            if (closed) return;
            closed = true;
            finish(committed);
        }
    }

    private synchronized void finish(boolean committed) {
        if (!committed) rollbackOnly = true;
        if (--txDepth > 0) return;
        try {
            if (rollbackOnly) {
                conn.rollback();
                LOG.debug("Rolled back write transaction");
            } else {
                conn.commit();
            }
        } catch (SQLException e) {
            throw new GraphStorageException("Failed to end write transaction", e);
        } finally {
            ids.closeScope();
            try {
                conn.setAutoCommit(true);
            } catch (SQLException e) {
                LOG.warn("Failed to reset auto-commit", e);
            }
        }
    }

    @Override
    public synchronized void close() {
        try {
            conn.close();
        } catch (SQLException e) {
            throw new GraphStorageException("Failed to close connection", e);
        }
    }

    // ---- identity ----

    @Override
    public OptionalLong pidToRowId(String pid) {
        return ids.pidToRowId(pid);
    }

    @Override
    public Optional<String> rowIdToPid(long rowId) {
        return ids.rowIdToPid(rowId);
    }

    @Override
    public Map<String, Long> resolveAll(Collection<String> pids) {
        return ids.resolveAll(pids);
    }

    // ---- writes ----

    private long nextRowId() throws SQLException {
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT nextval('" + config.tableName() + "_row_id_seq')")) {
            rs.next();
            return rs.getLong(1);
        }
    }

    @Override
    public synchronized long insertNode(NodeRow row) {
        List<String> cols = new ArrayList<>(List.of("row_id", ddl.pid(), "tcreated", "tmodified", "otype", "label", "description", "altids"));
        List<String> marks = new ArrayList<>(List.of("?", "?", "?", "?", "?", "?", "?", "CAST(? AS VARCHAR[])"));
        List<Map.Entry<String, FieldType>> ext = declared(row);
        for (Map.Entry<String, FieldType> e : ext) {
            cols.add(NodeTableDdl.quote(e.getKey()));
            marks.add(ColumnCodec.placeholder(e.getValue()));
        }
        String sql = "INSERT INTO " + ddl.table() + " (" + String.join(", ", cols) + ") VALUES (" + String.join(", ", marks) + ")";
        try {
            long rowId = nextRowId();
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                int i = 1;
                ps.setLong(i++, rowId);
                ps.setString(i++, row.pid());
                ps.setLong(i++, row.timestamp());
                ps.setLong(i++, row.timestamp());
                ps.setString(i++, row.otype());
                ps.setString(i++, row.label());
                ps.setString(i++, row.description());
                ColumnCodec.bindList(conn, ps, i++, "VARCHAR", row.altids());
                for (Map.Entry<String, FieldType> e : ext) {
                    ColumnCodec.bind(conn, ps, i++, e.getValue(), row.fields().get(e.getKey()));
                }
                ps.executeUpdate();
            }
            ids.remember(row.pid(), rowId);
            return rowId;
        } catch (SQLException e) {
            throw new GraphStorageException("Failed to insert node " + row.pid(), e);
        }
    }

    @Override
    public synchronized void updateNode(long rowId, NodeRow row) {
        List<Map.Entry<String, FieldType>> ext = declared(row);
        StringBuilder sql = new StringBuilder("UPDATE ").append(ddl.table()).append(" SET ")
                .append(ddl.pid()).append(" = ?, otype = ?, label = ?, description = ?, altids = CAST(? AS VARCHAR[]), tmodified = ?, ")
                .append("s = NULL, p = NULL, o = NULL, n = NULL");
        appendExtensionAssignments(sql, row.fields().keySet());
        sql.append(" WHERE row_id = ?");
        try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            int i = 1;
            ps.setString(i++, row.pid());
            ps.setString(i++, row.otype());
            ps.setString(i++, row.label());
            ps.setString(i++, row.description());
            ColumnCodec.bindList(conn, ps, i++, "VARCHAR", row.altids());
            ps.setLong(i++, row.timestamp());
            for (Map.Entry<String, FieldType> e : ext) {
                ColumnCodec.bind(conn, ps, i++, e.getValue(), row.fields().get(e.getKey()));
            }
            ps.setLong(i, rowId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new GraphStorageException("Failed to update node " + row.pid(), e);
        }
    }

    @Override
    public synchronized long insertEdge(EdgeRow row) {
        String sql = "INSERT INTO " + ddl.table()
                + " (row_id, " + ddl.pid() + ", tcreated, tmodified, otype, label, description, altids, s, p, o, n)"
                + " VALUES (?, ?, ?, ?, ?, ?, ?, CAST(? AS VARCHAR[]), ?, ?, CAST(? AS BIGINT[]), ?)";
        try {
            long rowId = nextRowId();
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                int i = 1;
                ps.setLong(i++, rowId);
                ps.setString(i++, row.pid());
                ps.setLong(i++, row.timestamp());
                ps.setLong(i++, row.timestamp());
                ps.setString(i++, config.edgeType());
                ps.setString(i++, row.label());
                ps.setString(i++, row.description());
                ColumnCodec.bindList(conn, ps, i++, "VARCHAR", row.altids());
                ps.setLong(i++, row.subject());
                ps.setString(i++, row.predicate());
                ColumnCodec.bindList(conn, ps, i++, "BIGINT", row.objects());
                ps.setString(i, row.namedGraph());
                ps.executeUpdate();
            }
            ids.remember(row.pid(), rowId);
            return rowId;
        } catch (SQLException e) {
            throw new GraphStorageException("Failed to insert edge " + row.pid(), e);
        }
    }

    @Override
    public synchronized void updateEdge(long rowId, EdgeRow row) {
        StringBuilder sql = new StringBuilder("UPDATE ").append(ddl.table()).append(" SET ")
                .append(ddl.pid()).append(" = ?, otype = ?, label = ?, description = ?, altids = CAST(? AS VARCHAR[]), tmodified = ?, ")
                .append("s = ?, p = ?, o = CAST(? AS BIGINT[]), n = ?");
        appendExtensionAssignments(sql, List.of());
        sql.append(" WHERE row_id = ?");
        try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            int i = 1;
            ps.setString(i++, row.pid());
            ps.setString(i++, config.edgeType());
            ps.setString(i++, row.label());
            ps.setString(i++, row.description());
            ColumnCodec.bindList(conn, ps, i++, "VARCHAR", row.altids());
            ps.setLong(i++, row.timestamp());
            ps.setLong(i++, row.subject());
            ps.setString(i++, row.predicate());
            ColumnCodec.bindList(conn, ps, i++, "BIGINT", row.objects());
            ps.setString(i++, row.namedGraph());
            ps.setLong(i, rowId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new GraphStorageException("Failed to update edge " + row.pid(), e);
        }
    }

    // Declared columns get a bind placeholder in schema order, every other extension column is cleared.
    private void appendExtensionAssignments(StringBuilder sql, Collection<String> declared) {
        if (schema == null) return;
        for (Map.Entry<String, FieldType> col : schema.columns().entrySet()) {
            sql.append(", ").append(NodeTableDdl.quote(col.getKey())).append(" = ");
            sql.append(declared.contains(col.getKey()) ? ColumnCodec.placeholder(col.getValue()) : "NULL");
        }
    }

    // Extension columns present in the row, in schema column order.
    private List<Map.Entry<String, FieldType>> declared(NodeRow row) {
        List<Map.Entry<String, FieldType>> out = new ArrayList<>();
        if (row.fields().isEmpty()) return out;
        if (schema == null) {
            throw new IllegalStateException("Store is not initialized; cannot write extension columns");
        }
        for (String key : row.fields().keySet()) {
            if (!schema.columns().containsKey(key)) {
                throw new IllegalArgumentException("Column '" + key + "' is not part of the schema");
            }
        }
        for (Map.Entry<String, FieldType> col : schema.columns().entrySet()) {
            if (row.fields().containsKey(col.getKey())) out.add(col);
        }
        return out;
    }

    // ---- reads ----

    @Override
    public synchronized Optional<NodeEntry> findEntry(String pid) {
        StringBuilder sql = new StringBuilder("SELECT row_id, ").append(ddl.pid())
                .append(" AS entry_pid, otype, tcreated, tmodified, label, description, altids, s, p, o, n");
        if (schema != null) {
            for (Map.Entry<String, FieldType> col : schema.columns().entrySet()) {
                sql.append(", ").append(ColumnCodec.selectExpr(col.getKey(), col.getValue()));
            }
        }
        sql.append(" FROM ").append(ddl.table()).append(" WHERE ").append(ddl.pid()).append(" = ?");
        try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            ps.setString(1, pid);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                long rowId = rs.getLong("row_id");
                String otype = rs.getString("otype");
                Map<String, Object> values = new LinkedHashMap<>();
                values.put("label", rs.getString("label"));
                values.put("description", rs.getString("description"));
                values.put("altids", ColumnCodec.read(rs, "altids", FieldType.STRING_LIST));
                if (config.edgeType().equals(otype)) {
                    long s = rs.getLong("s");
                    List<Long> o = ColumnCodec.readRowIds(rs, "o");
                    values.put("p", rs.getString("p"));
                    values.put("n", rs.getString("n"));
                    List<Long> endpoints = new ArrayList<>(o);
                    endpoints.add(s);
                    Map<Long, String> pids = ids.pidsFor(endpoints);
                    values.put("s", pids.get(s));
                    List<String> objects = new ArrayList<>(o.size());
                    for (Long id : o) objects.add(pids.get(id));
                    values.put("o", objects);
                } else if (schema != null) {
                    Optional<TypeDescriptor> type = schema.type(otype);
                    if (type.isPresent()) {
                        for (TypeDescriptor.FieldDef f : type.get().fields()) {
                            values.put(f.name(), ColumnCodec.read(rs, f.name(), f.type()));
                        }
                    }
                }
                ids.remember(pid, rowId);
                return Optional.of(new NodeEntry(rowId, rs.getString("entry_pid"), otype,
                        rs.getLong("tcreated"), rs.getLong("tmodified"), values));
            }
        } catch (SQLException e) {
            throw new GraphStorageException("Failed to read entry " + pid, e);
        }
    }

    @Override
    public synchronized List<Relation> findRelations(Long subject, String predicate, Long object, long offset, int limit) {
        StringBuilder sql = new StringBuilder()
                .append("WITH fan AS (SELECT row_id AS erid, s, p, unnest(o) AS oid, unnest(range(len(o))) AS pos FROM ")
                .append(ddl.table()).append(" WHERE otype = ?");
        if (subject != null) sql.append(" AND s = ?");
        if (predicate != null) sql.append(" AND p = ?");
        sql.append(") SELECT sn.").append(ddl.pid()).append(" AS spid, fan.p AS pred, onode.").append(ddl.pid()).append(" AS opid")
                .append(" FROM fan JOIN ").append(ddl.table()).append(" sn ON sn.row_id = fan.s")
                .append(" JOIN ").append(ddl.table()).append(" onode ON onode.row_id = fan.oid");
        if (object != null) sql.append(" WHERE fan.oid = ?");
        sql.append(" ORDER BY fan.erid, fan.pos LIMIT ? OFFSET ?");
        try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            int i = 1;
            ps.setString(i++, config.edgeType());
            if (subject != null) ps.setLong(i++, subject);
            if (predicate != null) ps.setString(i++, predicate);
            if (object != null) ps.setLong(i++, object);
            ps.setLong(i++, limit);
            ps.setLong(i, offset);
            List<Relation> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new Relation(rs.getString("spid"), rs.getString("pred"), rs.getString("opid")));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new GraphStorageException("Failed to query relations", e);
        }
    }

    @Override
    public synchronized List<Edge> findEdges(Long subject, String predicate, long offset, int limit) {
        StringBuilder sql = new StringBuilder("SELECT row_id, ").append(ddl.pid())
                .append(" AS edge_pid, s, p, o, n FROM ").append(ddl.table()).append(" WHERE otype = ?");
        if (subject != null) sql.append(" AND s = ?");
        if (predicate != null) sql.append(" AND p = ?");
        sql.append(" ORDER BY row_id LIMIT ? OFFSET ?");
        try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            int i = 1;
            ps.setString(i++, config.edgeType());
            if (subject != null) ps.setLong(i++, subject);
            if (predicate != null) ps.setString(i++, predicate);
            ps.setLong(i++, limit);
            ps.setLong(i, offset);
            return readEdges(ps);
        } catch (SQLException e) {
            throw new GraphStorageException("Failed to query edges", e);
        }
    }

    @Override
    public synchronized List<Edge> findEdgesReferencing(long objectRowId) {
        String sql = "SELECT row_id, " + ddl.pid() + " AS edge_pid, s, p, o, n FROM " + ddl.table()
                + " WHERE otype = ? AND list_contains(o, ?) ORDER BY row_id";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, config.edgeType());
            ps.setLong(2, objectRowId);
            return readEdges(ps);
        } catch (SQLException e) {
            throw new GraphStorageException("Failed to query edges referencing row " + objectRowId, e);
        }
    }

    private record RawEdge(String pid, long s, String p, List<Long> o, String n) {}

    private List<Edge> readEdges(PreparedStatement ps) throws SQLException {
        List<RawEdge> raw = new ArrayList<>();
        List<Long> endpoints = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                RawEdge e = new RawEdge(rs.getString("edge_pid"), rs.getLong("s"), rs.getString("p"),
                        ColumnCodec.readRowIds(rs, "o"), rs.getString("n"));
                raw.add(e);
                endpoints.add(e.s());
                endpoints.addAll(e.o());
            }
        }
        Map<Long, String> pids = ids.pidsFor(endpoints);
        List<Edge> out = new ArrayList<>(raw.size());
        for (RawEdge e : raw) {
            List<String> objects = new ArrayList<>(e.o().size());
            for (Long id : e.o()) objects.add(pids.get(id));
            out.add(new Edge(e.pid(), pids.get(e.s()), e.p(), objects, e.n()));
        }
        return out;
    }

    @Override
    public synchronized List<IdEntry> findIds(String otype, long offset, int limit) {
        String sql = "SELECT " + ddl.pid() + " AS id_pid, otype FROM " + ddl.table()
                + (otype != null ? " WHERE otype = ?" : "")
                + " ORDER BY row_id LIMIT ? OFFSET ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int i = 1;
            if (otype != null) ps.setString(i++, otype);
            ps.setLong(i++, limit);
            ps.setLong(i, offset);
            List<IdEntry> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(new IdEntry(rs.getString("id_pid"), rs.getString("otype")));
            }
            return out;
        } catch (SQLException e) {
            throw new GraphStorageException("Failed to list ids", e);
        }
    }

    @Override
    public synchronized Map<String, Long> countByOtype() {
        return counts("SELECT otype, count(*) FROM " + ddl.table() + " GROUP BY otype ORDER BY otype", null);
    }

    @Override
    public synchronized Map<String, Long> countByPredicate() {
        return counts("SELECT p, count(*) FROM " + ddl.table() + " WHERE otype = ? GROUP BY p ORDER BY p", config.edgeType());
    }

    private Map<String, Long> counts(String sql, String param) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            if (param != null) ps.setString(1, param);
            Map<String, Long> out = new LinkedHashMap<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.put(rs.getString(1), rs.getLong(2));
            }
            return out;
        } catch (SQLException e) {
            throw new GraphStorageException("Failed to count rows", e);
        }
    }

    @Override
    public synchronized List<String> findRoots(long rowId) {
        String sql = "WITH RECURSIVE fan AS (SELECT s, unnest(o) AS oid FROM " + ddl.table() + " WHERE otype = ?),"
                + " roots(rid) AS (SELECT s FROM fan WHERE oid = ?"
                + " UNION SELECT fan.s FROM fan JOIN roots ON fan.oid = roots.rid)"
                + " SELECT x." + ddl.pid() + " FROM roots JOIN " + ddl.table() + " x ON x.row_id = roots.rid ORDER BY x.row_id";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, config.edgeType());
            ps.setLong(2, rowId);
            List<String> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(rs.getString(1));
            }
            return out;
        } catch (SQLException e) {
            throw new GraphStorageException("Failed to find roots of row " + rowId, e);
        }
    }

    public GraphConfig config() {
        return config;
    }
}
