package com.e2eq.pgraph.duckdb;

import com.e2eq.pgraph.core.GraphConfig;
import com.e2eq.pgraph.model.FieldType;
import com.e2eq.pgraph.model.GraphSchema;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * DDL for the shared relation, its row id sequence and its metadata table.
 * <p>
 * The relation carries no indexes or unique constraints: DuckDB rewrites updates of list
 * columns as delete plus insert, which trips index uniqueness checks inside a transaction.
 * Pid uniqueness is kept by the store, which looks a pid up before inserting it.
 * </p>
 */
final class NodeTableDdl {

    private final String table;
    private final String pidColumn;

    NodeTableDdl(GraphConfig config) {
        this.table = config.tableName();
        this.pidColumn = config.primaryKeyField();
    }

    String table() {
        return quote(table);
    }

    String sequence() {
        return quote(table + "_row_id_seq");
    }

    String metadataTable() {
        return quote(table + "_metadata");
    }

    String pid() {
        return quote(pidColumn);
    }

    /**
     * Statements that create or extend the relation for {@code schema}. Every statement is
     * safe to run again.
     */
    List<String> statements(GraphSchema schema) {
        List<String> sql = new ArrayList<>();
        sql.add("CREATE SEQUENCE IF NOT EXISTS " + sequence() + " START 1");
        sql.add("CREATE TABLE IF NOT EXISTS " + table() + " (\n"
                + "    row_id BIGINT NOT NULL,\n"
                + "    " + pid() + " VARCHAR NOT NULL,\n"
                + "    tcreated BIGINT,\n"
                + "    tmodified BIGINT,\n"
                + "    otype VARCHAR,\n"
                + "    label VARCHAR,\n"
                + "    description VARCHAR,\n"
                + "    altids VARCHAR[],\n"
                + "    s BIGINT,\n"
                + "    p VARCHAR,\n"
                + "    o BIGINT[],\n"
                + "    n VARCHAR\n"
                + ")");
        for (Map.Entry<String, FieldType> col : schema.columns().entrySet()) {
            sql.add("ALTER TABLE " + table() + " ADD COLUMN IF NOT EXISTS " + quote(col.getKey()) + " " + ColumnCodec.sqlType(col.getValue()));
        }
        sql.add("CREATE TABLE IF NOT EXISTS " + metadataTable() + " (\"key\" VARCHAR NOT NULL, \"value\" VARCHAR)");
        return sql;
    }

    static String quote(String identifier) {
        GraphConfig.requireIdentifier("identifier", identifier);
        return "\"" + identifier + "\"";
    }
}
