package com.e2eq.pgraph.runtime;

import com.e2eq.pgraph.core.GraphConfig;
import com.e2eq.pgraph.core.PropertyGraph;
import com.e2eq.pgraph.core.YamlTypeLoader;
import com.e2eq.pgraph.duckdb.DuckDbGraphStore;
import com.e2eq.pgraph.model.TypeDescriptor;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Opens the DuckDB-backed {@link PropertyGraph} named by configuration, registers the node
 * types listed in the optional YAML catalog and exposes the initialized graph for injection.
 * Without a catalog the graph reattaches to whatever types the database already stores.
 */
@ApplicationScoped
public class PropertyGraphProducer {

    private static final Logger LOG = Logger.getLogger(PropertyGraphProducer.class);

    private final String url;
    private final String table;
    private final Optional<String> typesLocation;

    private PropertyGraph graph;

    @Inject
    public PropertyGraphProducer(@ConfigProperty(name = "quantum.pgraph.url", defaultValue = "jdbc:duckdb:") String url,
                                 @ConfigProperty(name = "quantum.pgraph.table", defaultValue = "node") String table,
                                 @ConfigProperty(name = "quantum.pgraph.types") Optional<String> typesLocation) {
        this.url = url;
        this.table = table;
        this.typesLocation = typesLocation;
    }

    @PostConstruct
    void init() {
        GraphConfig config = GraphConfig.defaults().withUrl(url).withTableName(table);
        PropertyGraph g = new PropertyGraph(config, DuckDbGraphStore.open(config));
        try {
            g.registerTypes(loadTypes());
            g.initialize();
        } catch (RuntimeException e) {
            g.close();
            throw e;
        }
        this.graph = g;
        LOG.infof("Property graph '%s' ready at %s", table, url);
    }

    private List<TypeDescriptor> loadTypes() {
        if (typesLocation.isEmpty() || typesLocation.get().isBlank()) return List.of();
        String location = typesLocation.get();
        try {
            return new YamlTypeLoader().loadFromClasspath(location);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load node types from " + location, e);
        }
    }

    @Produces
    public PropertyGraph graph() {
        return graph;
    }

    @PreDestroy
    void shutdown() {
        if (graph != null) graph.close();
    }
}
