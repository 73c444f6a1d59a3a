package com.e2eq.pgraph.duckdb;

import com.e2eq.pgraph.exceptions.GraphStorageException;
import com.e2eq.pgraph.spi.IdentityTranslator;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Pid/row id translation against the shared relation. While a scope is open (one outermost
 * write transaction) resolved ids are kept in a bounded LRU cache in each direction; outside
 * a scope every lookup reads the relation. Only existing rows are cached, so a miss is never
 * remembered.
 */
final class DuckDbIdentityTranslator implements IdentityTranslator {

    private static final int BATCH = 512;

    private final Connection conn;
    private final NodeTableDdl ddl;
    private final Map<String, Long> rowIds;
    private final Map<Long, String> pids;
    private boolean scoped;

    DuckDbIdentityTranslator(Connection conn, NodeTableDdl ddl, int cacheSize) {
        this.conn = conn;
        this.ddl = ddl;
        this.rowIds = lru(cacheSize);
        this.pids = lru(cacheSize);
    }

    private static <K, V> Map<K, V> lru(int size) {
        return new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > size;
            }
        };
    }

    @Override
    public synchronized OptionalLong pidToRowId(String pid) {
        if (pid == null) return OptionalLong.empty();
        Long cached = scoped ? rowIds.get(pid) : null;
        if (cached != null) return OptionalLong.of(cached);
        String sql = "SELECT row_id FROM " + ddl.table() + " WHERE " + ddl.pid() + " = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, pid);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return OptionalLong.empty();
                long rowId = rs.getLong(1);
                remember(pid, rowId);
                return OptionalLong.of(rowId);
            }
        } catch (SQLException e) {
            throw new GraphStorageException("Failed to resolve pid " + pid, e);
        }
    }

    @Override
    public synchronized Optional<String> rowIdToPid(long rowId) {
        String cached = scoped ? pids.get(rowId) : null;
        if (cached != null) return Optional.of(cached);
        String sql = "SELECT " + ddl.pid() + " FROM " + ddl.table() + " WHERE row_id = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, rowId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                String pid = rs.getString(1);
                remember(pid, rowId);
                return Optional.of(pid);
            }
        } catch (SQLException e) {
            throw new GraphStorageException("Failed to resolve row id " + rowId, e);
        }
    }

    @Override
    public synchronized Map<String, Long> resolveAll(Collection<String> requested) {
        Map<String, Long> out = new LinkedHashMap<>();
        List<String> misses = new ArrayList<>();
        for (String pid : new LinkedHashSet<>(requested)) {
            if (pid == null) continue;
            Long cached = scoped ? rowIds.get(pid) : null;
            if (cached != null) out.put(pid, cached);
            else misses.add(pid);
        }
        for (int from = 0; from < misses.size(); from += BATCH) {
            List<String> chunk = misses.subList(from, Math.min(misses.size(), from + BATCH));
            String sql = "SELECT " + ddl.pid() + ", row_id FROM " + ddl.table()
                    + " WHERE " + ddl.pid() + " IN (" + String.join(", ", java.util.Collections.nCopies(chunk.size(), "?")) + ")";
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                for (int i = 0; i < chunk.size(); i++) ps.setString(i + 1, chunk.get(i));
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        String pid = rs.getString(1);
                        long rowId = rs.getLong(2);
                        out.put(pid, rowId);
                        remember(pid, rowId);
                    }
                }
            } catch (SQLException e) {
                throw new GraphStorageException("Failed to resolve " + chunk.size() + " pid(s)", e);
            }
        }
        return out;
    }

    /**
     * Pids for many row ids at once. Row ids with no row are absent from the result.
     */
    synchronized Map<Long, String> pidsFor(Collection<Long> requested) {
        Map<Long, String> out = new LinkedHashMap<>();
        List<Long> misses = new ArrayList<>();
        for (Long rowId : new LinkedHashSet<>(requested)) {
            String cached = scoped ? pids.get(rowId) : null;
            if (cached != null) out.put(rowId, cached);
            else misses.add(rowId);
        }
        for (int from = 0; from < misses.size(); from += BATCH) {
            List<Long> chunk = misses.subList(from, Math.min(misses.size(), from + BATCH));
            String sql = "SELECT row_id, " + ddl.pid() + " FROM " + ddl.table()
                    + " WHERE row_id IN (" + String.join(", ", java.util.Collections.nCopies(chunk.size(), "?")) + ")";
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                for (int i = 0; i < chunk.size(); i++) ps.setLong(i + 1, chunk.get(i));
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        long rowId = rs.getLong(1);
                        String pid = rs.getString(2);
                        out.put(rowId, pid);
                        remember(pid, rowId);
                    }
                }
            } catch (SQLException e) {
                throw new GraphStorageException("Failed to resolve " + chunk.size() + " row id(s)", e);
            }
        }
        return out;
    }

    synchronized void remember(String pid, long rowId) {
        if (!scoped) return;
        rowIds.put(pid, rowId);
        pids.put(rowId, pid);
    }

    synchronized void openScope() {
        rowIds.clear();
        pids.clear();
        scoped = true;
    }

    synchronized void closeScope() {
        scoped = false;
        rowIds.clear();
        pids.clear();
    }
}
