package com.e2eq.pgraph.typed;

import com.e2eq.pgraph.model.Relation;

import java.util.Optional;

/**
 * A relation with the edge type inferred from its endpoints; {@code type} is null when no
 * catalog entry matches.
 */
public record TypedRelation(String subject, String predicate, String object, EdgeTypeDef type) {

    static TypedRelation of(Relation r, EdgeTypeDef type) {
        return new TypedRelation(r.subject(), r.predicate(), r.object(), type);
    }

    public Optional<EdgeTypeDef> edgeType() {
        return Optional.ofNullable(type);
    }
}
