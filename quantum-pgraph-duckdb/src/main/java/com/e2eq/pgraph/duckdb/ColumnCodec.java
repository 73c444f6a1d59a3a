package com.e2eq.pgraph.duckdb;

import com.e2eq.pgraph.model.FieldType;

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Maps {@link FieldType} values to DuckDB columns. TIMESTAMP values cross the driver as
 * epoch milliseconds and BLOB values as hex text, so every type binds and reads through
 * plain long, double, boolean, string and list parameters.
 */
final class ColumnCodec {
    private ColumnCodec() {}

    private static final HexFormat HEX = HexFormat.of();

    static String sqlType(FieldType type) {
        switch (type) {
            case STRING: return "VARCHAR";
            case INTEGER: return "BIGINT";
            case DOUBLE: return "DOUBLE";
            case BOOLEAN: return "BOOLEAN";
            case TIMESTAMP: return "TIMESTAMP";
            case STRING_LIST: return "VARCHAR[]";
            case INTEGER_LIST: return "BIGINT[]";
            case DOUBLE_LIST: return "DOUBLE[]";
            case BLOB: return "BLOB";
            default: throw new IllegalArgumentException("Unmapped field type " + type);
        }
    }

    /**
     * Bind expression for one value of {@code type}.
     */
    static String placeholder(FieldType type) {
        switch (type) {
            case TIMESTAMP: return "epoch_ms(CAST(? AS BIGINT))";
            case BLOB: return "unhex(CAST(? AS VARCHAR))";
            default: return "CAST(? AS " + sqlType(type) + ")";
        }
    }

    /**
     * Select expression reading {@code column} back in bindable form, aliased to the column name.
     */
    static String selectExpr(String column, FieldType type) {
        String q = NodeTableDdl.quote(column);
        switch (type) {
            case TIMESTAMP: return "epoch_ms(" + q + ") AS " + q;
            case BLOB: return "hex(" + q + ") AS " + q;
            default: return q;
        }
    }

    static void bind(Connection conn, PreparedStatement ps, int index, FieldType type, Object value) throws SQLException {
        if (value == null) {
            ps.setObject(index, null);
            return;
        }
        switch (type) {
            case STRING:
                ps.setString(index, (String) value);
                break;
            case INTEGER:
                ps.setLong(index, (Long) value);
                break;
            case DOUBLE:
                ps.setDouble(index, (Double) value);
                break;
            case BOOLEAN:
                ps.setBoolean(index, (Boolean) value);
                break;
            case TIMESTAMP:
                ps.setLong(index, ((Instant) value).toEpochMilli());
                break;
            case BLOB:
                ps.setString(index, HEX.formatHex((byte[]) value));
                break;
            case STRING_LIST:
            case INTEGER_LIST:
            case DOUBLE_LIST:
                bindList(conn, ps, index, sqlType(type.elementType()), (List<?>) value);
                break;
            default:
                throw new IllegalArgumentException("Unmapped field type " + type);
        }
    }

    static void bindList(Connection conn, PreparedStatement ps, int index, String elementSqlType, List<?> values) throws SQLException {
        if (values == null) {
            ps.setObject(index, null);
            return;
        }
        ps.setObject(index, conn.createArrayOf(elementSqlType, values.toArray()));
    }

    static Object read(ResultSet rs, String column, FieldType type) throws SQLException {
        switch (type) {
            case STRING:
                return rs.getString(column);
            case INTEGER:
            case TIMESTAMP: {
                long v = rs.getLong(column);
                if (rs.wasNull()) return null;
                return type == FieldType.TIMESTAMP ? Instant.ofEpochMilli(v) : Long.valueOf(v);
            }
            case DOUBLE: {
                double v = rs.getDouble(column);
                return rs.wasNull() ? null : v;
            }
            case BOOLEAN: {
                boolean v = rs.getBoolean(column);
                return rs.wasNull() ? null : v;
            }
            case BLOB: {
                String hex = rs.getString(column);
                return hex == null ? null : HEX.parseHex(hex);
            }
            case STRING_LIST:
            case INTEGER_LIST:
            case DOUBLE_LIST:
                return type.normalize(readList(rs, column));
            default:
                throw new IllegalArgumentException("Unmapped field type " + type);
        }
    }

    static List<Object> readList(ResultSet rs, String column) throws SQLException {
        Array array = rs.getArray(column);
        if (array == null) return null;
        Object[] items = (Object[]) array.getArray();
        List<Object> out = new ArrayList<>(items.length);
        for (Object item : items) out.add(item);
        return out;
    }

    static List<Long> readRowIds(ResultSet rs, String column) throws SQLException {
        List<Object> raw = readList(rs, column);
        if (raw == null) return List.of();
        List<Long> out = new ArrayList<>(raw.size());
        for (Object o : raw) out.add(((Number) o).longValue());
        return out;
    }
}
