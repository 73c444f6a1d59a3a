package com.e2eq.pgraph.typed;

import java.util.Objects;

/**
 * One allowed {@code (subjectType, predicate, objectType)} pattern. {@code name} is the
 * short catalog handle, {@link #id()} the triple joined with double underscores.
 */
public record EdgeTypeDef(String name,
                          String subjectType,
                          String predicate,
                          String objectType,
                          boolean multivalued,
                          String description) {

    public EdgeTypeDef {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(subjectType, "subjectType");
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(objectType, "objectType");
    }

    public static String idOf(String subjectType, String predicate, String objectType) {
        return subjectType + "__" + predicate + "__" + objectType;
    }

    public String id() {
        return idOf(subjectType, predicate, objectType);
    }

    public boolean matches(String subjectOtype, String edgePredicate, String objectOtype) {
        return subjectType.equals(subjectOtype) && predicate.equals(edgePredicate) && objectType.equals(objectOtype);
    }

    @Override
    public String toString() {
        return subjectType + " --" + predicate + "--> " + objectType;
    }
}
