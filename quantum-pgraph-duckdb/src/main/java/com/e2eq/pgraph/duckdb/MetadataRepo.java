package com.e2eq.pgraph.duckdb;

import com.e2eq.pgraph.exceptions.GraphStorageException;
import com.e2eq.pgraph.model.GraphMetadata;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Key/value side table next to the shared relation. The graph schema is stored as JSON
 * under the {@code graph} key.
 */
final class MetadataRepo {

    private static final Logger LOG = Logger.getLogger(MetadataRepo.class);
    static final String GRAPH_KEY = "graph";

    private final Connection conn;
    private final NodeTableDdl ddl;
    private final String tableName;
    private final ObjectMapper mapper;

    MetadataRepo(Connection conn, NodeTableDdl ddl, String tableName, ObjectMapper mapper) {
        this.conn = conn;
        this.ddl = ddl;
        this.tableName = tableName + "_metadata";
        this.mapper = mapper;
    }

    Optional<GraphMetadata> load() {
        try {
            if (!exists()) return Optional.empty();
            Optional<String> json = get(GRAPH_KEY);
            if (json.isEmpty()) return Optional.empty();
            return Optional.of(mapper.readValue(json.get(), GraphMetadata.class));
        } catch (SQLException e) {
            throw new GraphStorageException("Failed to read graph metadata from " + tableName, e);
        } catch (JsonProcessingException e) {
            throw new GraphStorageException("Stored graph metadata in " + tableName + " is not readable", e);
        }
    }

    void save(GraphMetadata metadata) {
        try {
            put(GRAPH_KEY, mapper.writeValueAsString(metadata));
            LOG.debugf("Stored metadata for %d node type(s)", metadata.nodeTypes().size());
        } catch (SQLException e) {
            throw new GraphStorageException("Failed to write graph metadata to " + tableName, e);
        } catch (JsonProcessingException e) {
            throw new GraphStorageException("Failed to serialize graph metadata", e);
        }
    }

    private boolean exists() throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT count(*) FROM information_schema.tables WHERE table_name = ?")) {
            ps.setString(1, tableName);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getLong(1) > 0;
            }
        }
    }

    private Optional<String> get(String key) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT \"value\" FROM " + ddl.metadataTable() + " WHERE \"key\" = ?")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        }
    }

    private void put(String key, String value) throws SQLException {
        try (PreparedStatement del = conn.prepareStatement(
                "DELETE FROM " + ddl.metadataTable() + " WHERE \"key\" = ?")) {
            del.setString(1, key);
            del.executeUpdate();
        }
        try (PreparedStatement ins = conn.prepareStatement(
                "INSERT INTO " + ddl.metadataTable() + " (\"key\", \"value\") VALUES (?, ?)")) {
            ins.setString(1, key);
            ins.setString(2, value);
            ins.executeUpdate();
        }
    }
}
