package com.e2eq.pgraph.core;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Column names owned by the shared relation itself. Node types may not declare them.
 */
public final class ReservedFields {
    private ReservedFields() {}

    public static final String ROW_ID = "row_id";
    public static final String TCREATED = "tcreated";
    public static final String TMODIFIED = "tmodified";
    public static final String OTYPE = "otype";
    public static final String LABEL = "label";
    public static final String DESCRIPTION = "description";
    public static final String ALTIDS = "altids";
    public static final String SUBJECT = "s";
    public static final String PREDICATE = "p";
    public static final String OBJECT = "o";
    public static final String NAMED_GRAPH = "n";

    public static Set<String> names(String primaryKeyField) {
        Set<String> out = new LinkedHashSet<>();
        out.add(ROW_ID);
        out.add(primaryKeyField);
        out.add(TCREATED);
        out.add(TMODIFIED);
        out.add(OTYPE);
        out.add(LABEL);
        out.add(DESCRIPTION);
        out.add(ALTIDS);
        out.add(SUBJECT);
        out.add(PREDICATE);
        out.add(OBJECT);
        out.add(NAMED_GRAPH);
        return out;
    }

    public static boolean isReserved(String name, String primaryKeyField) {
        return names(primaryKeyField).contains(name);
    }
}
