package com.e2eq.pgraph.core;

import com.e2eq.pgraph.exceptions.GraphConfigException;

import java.util.regex.Pattern;

/**
 * Settings for one property graph instance.
 *
 * @param url                   JDBC url of the storage engine, e.g. {@code jdbc:duckdb:} for in-memory
 * @param tableName             name of the shared relation
 * @param primaryKeyField       name of the pid column
 * @param edgeType              otype value marking edge rows
 * @param anonymousPrefix       prefix for generated pids and content-derived edge pids
 * @param identityCacheSize     entries kept per direction by the identity cache
 * @param pageSize              rows fetched per query by lazy iterables
 * @param maxDecompositionDepth nesting limit when flattening composite objects
 * @param maxTraversalDepth     default depth bound for breadth-first traversal, 0 = unbounded
 */
public record GraphConfig(String url,
                          String tableName,
                          String primaryKeyField,
                          String edgeType,
                          String anonymousPrefix,
                          int identityCacheSize,
                          int pageSize,
                          int maxDecompositionDepth,
                          int maxTraversalDepth) {

    public static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public GraphConfig {
        requireIdentifier("tableName", tableName);
        requireIdentifier("primaryKeyField", primaryKeyField);
        if (edgeType == null || edgeType.isBlank()) throw new GraphConfigException("edgeType must not be blank");
        if (anonymousPrefix == null) anonymousPrefix = "";
        if (pageSize <= 0) throw new GraphConfigException("pageSize must be positive, was " + pageSize);
        if (maxDecompositionDepth <= 0) throw new GraphConfigException("maxDecompositionDepth must be positive, was " + maxDecompositionDepth);
        if (maxTraversalDepth < 0) throw new GraphConfigException("maxTraversalDepth must not be negative, was " + maxTraversalDepth);
        if (identityCacheSize < 0) throw new GraphConfigException("identityCacheSize must not be negative, was " + identityCacheSize);
    }

    public static GraphConfig defaults() {
        return new GraphConfig("jdbc:duckdb:", "node", "pid", "_edge_", "anon_", 10_000, 1_000, 512, 0);
    }

    public static GraphConfig inMemory() {
        return defaults();
    }

    public GraphConfig withUrl(String url) {
        return new GraphConfig(url, tableName, primaryKeyField, edgeType, anonymousPrefix, identityCacheSize, pageSize, maxDecompositionDepth, maxTraversalDepth);
    }

    public GraphConfig withTableName(String tableName) {
        return new GraphConfig(url, tableName, primaryKeyField, edgeType, anonymousPrefix, identityCacheSize, pageSize, maxDecompositionDepth, maxTraversalDepth);
    }

    public GraphConfig withPrimaryKeyField(String primaryKeyField) {
        return new GraphConfig(url, tableName, primaryKeyField, edgeType, anonymousPrefix, identityCacheSize, pageSize, maxDecompositionDepth, maxTraversalDepth);
    }

    public GraphConfig withIdentityCacheSize(int identityCacheSize) {
        return new GraphConfig(url, tableName, primaryKeyField, edgeType, anonymousPrefix, identityCacheSize, pageSize, maxDecompositionDepth, maxTraversalDepth);
    }

    public GraphConfig withPageSize(int pageSize) {
        return new GraphConfig(url, tableName, primaryKeyField, edgeType, anonymousPrefix, identityCacheSize, pageSize, maxDecompositionDepth, maxTraversalDepth);
    }

    public GraphConfig withMaxDecompositionDepth(int maxDecompositionDepth) {
        return new GraphConfig(url, tableName, primaryKeyField, edgeType, anonymousPrefix, identityCacheSize, pageSize, maxDecompositionDepth, maxTraversalDepth);
    }

    public GraphConfig withMaxTraversalDepth(int maxTraversalDepth) {
        return new GraphConfig(url, tableName, primaryKeyField, edgeType, anonymousPrefix, identityCacheSize, pageSize, maxDecompositionDepth, maxTraversalDepth);
    }

    public static void requireIdentifier(String what, String value) {
        if (value == null || !IDENTIFIER.matcher(value).matches()) {
            throw new GraphConfigException(what + " must match " + IDENTIFIER.pattern() + " but was '" + value + "'");
        }
    }
}
