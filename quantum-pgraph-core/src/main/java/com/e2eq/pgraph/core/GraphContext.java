package com.e2eq.pgraph.core;

import java.time.Clock;

/**
 * Everything a graph instance shares between its engines: settings, the type registry
 * and the clock used for row timestamps.
 */
public record GraphContext(GraphConfig config, TypeRegistry registry, Clock clock) {

    public static GraphContext of(GraphConfig config) {
        return new GraphContext(config, new TypeRegistry(config), Clock.systemUTC());
    }

    public long now() {
        return clock.millis();
    }
}
