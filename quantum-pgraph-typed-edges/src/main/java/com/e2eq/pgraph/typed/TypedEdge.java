package com.e2eq.pgraph.typed;

import com.e2eq.pgraph.model.Edge;

/**
 * A stored edge whose subject and every object match {@code type}.
 */
public record TypedEdge(Edge edge, EdgeTypeDef type) {
}
