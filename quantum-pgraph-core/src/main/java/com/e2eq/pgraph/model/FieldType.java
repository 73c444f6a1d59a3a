package com.e2eq.pgraph.model;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Semantic type of an extension column. Each type has one canonical Java representation
 * used everywhere values cross the storage boundary:
 * STRING=String, INTEGER=Long, DOUBLE=Double, BOOLEAN=Boolean, TIMESTAMP=Instant,
 * the list types are {@code List} of the element representation, BLOB=byte[].
 */
public enum FieldType {
    STRING(false),
    INTEGER(false),
    DOUBLE(false),
    BOOLEAN(false),
    TIMESTAMP(false),
    STRING_LIST(true),
    INTEGER_LIST(true),
    DOUBLE_LIST(true),
    BLOB(false);

    private final boolean list;

    FieldType(boolean list) {
        this.list = list;
    }

    public boolean isList() {
        return list;
    }

    /**
     * Element type of a list type, or the type itself for scalars.
     */
    public FieldType elementType() {
        switch (this) {
            case STRING_LIST: return STRING;
            case INTEGER_LIST: return INTEGER;
            case DOUBLE_LIST: return DOUBLE;
            default: return this;
        }
    }

    /**
     * List type holding elements of this scalar type, if there is one.
     */
    public Optional<FieldType> listOf() {
        switch (this) {
            case STRING: return Optional.of(STRING_LIST);
            case INTEGER: return Optional.of(INTEGER_LIST);
            case DOUBLE: return Optional.of(DOUBLE_LIST);
            default: return Optional.empty();
        }
    }

    /**
     * Coerces a Java value to this type's canonical representation.
     *
     * @throws IllegalArgumentException if the value cannot represent this type
     */
    public Object normalize(Object value) {
        if (value == null) return null;
        if (list) {
            List<Object> out = new ArrayList<>();
            FieldType element = elementType();
            if (value instanceof Collection<?> c) {
                for (Object v : c) out.add(element.normalize(v));
            } else if (value.getClass().isArray() && !(value instanceof byte[])) {
                int len = java.lang.reflect.Array.getLength(value);
                for (int i = 0; i < len; i++) out.add(element.normalize(java.lang.reflect.Array.get(value, i)));
            } else {
                throw new IllegalArgumentException("Expected a collection or array for " + this + " but got " + value.getClass().getName());
            }
            return Collections.unmodifiableList(out);
        }
        switch (this) {
            case STRING:
                if (value instanceof Enum<?> e) return e.name();
                if (value instanceof Collection<?> || value.getClass().isArray()) break;
                return value.toString();
            case INTEGER:
                if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
                    return ((Number) value).longValue();
                }
                if (value instanceof BigInteger bi) return bi.longValueExact();
                if (value instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue())) return n.longValue();
                break;
            case DOUBLE:
                if (value instanceof Number n) return n.doubleValue();
                break;
            case BOOLEAN:
                if (value instanceof Boolean) return value;
                break;
            case TIMESTAMP:
                if (value instanceof Instant) return value;
                if (value instanceof Date d) return d.toInstant();
                if (value instanceof OffsetDateTime odt) return odt.toInstant();
                if (value instanceof ZonedDateTime zdt) return zdt.toInstant();
                if (value instanceof LocalDateTime ldt) return ldt.toInstant(ZoneOffset.UTC);
                if (value instanceof Long ms) return Instant.ofEpochMilli(ms);
                break;
            case BLOB:
                if (value instanceof byte[]) return value;
                break;
            default:
                break;
        }
        throw new IllegalArgumentException("Value of type " + value.getClass().getName() + " is not a valid " + this);
    }

    /**
     * Maps a Java field type to a semantic type. Empty when the type has no column mapping,
     * e.g. entity references or maps.
     */
    public static Optional<FieldType> forJavaType(Class<?> rawType, Type genericType) {
        if (rawType == byte[].class) return Optional.of(BLOB);
        if (rawType.isArray()) {
            return scalarFor(rawType.getComponentType()).flatMap(FieldType::listOf);
        }
        if (Collection.class.isAssignableFrom(rawType)) {
            if (genericType instanceof ParameterizedType pt) {
                Type[] args = pt.getActualTypeArguments();
                if (args.length == 1 && args[0] instanceof Class<?> c) {
                    return scalarFor(c).flatMap(FieldType::listOf);
                }
            }
            return Optional.empty();
        }
        return scalarFor(rawType);
    }

    private static Optional<FieldType> scalarFor(Class<?> t) {
        if (t == String.class || CharSequence.class.isAssignableFrom(t) || t.isEnum()
                || t == UUID.class || t == URI.class || t == char.class || t == Character.class) {
            return Optional.of(STRING);
        }
        if (t == long.class || t == Long.class || t == int.class || t == Integer.class
                || t == short.class || t == Short.class || t == byte.class || t == Byte.class
                || t == BigInteger.class) {
            return Optional.of(INTEGER);
        }
        if (t == double.class || t == Double.class || t == float.class || t == Float.class || t == BigDecimal.class) {
            return Optional.of(DOUBLE);
        }
        if (t == boolean.class || t == Boolean.class) return Optional.of(BOOLEAN);
        if (t == Instant.class || Date.class.isAssignableFrom(t) || t == OffsetDateTime.class
                || t == ZonedDateTime.class || t == LocalDateTime.class) {
            return Optional.of(TIMESTAMP);
        }
        return Optional.empty();
    }
}
