package com.e2eq.pgraph.runtime;

import com.e2eq.pgraph.core.PropertyGraph;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PropertyGraphProducerTest {

    @Test
    void testProducesInitializedGraphFromCatalog() {
        PropertyGraphProducer producer = new PropertyGraphProducer("jdbc:duckdb:", "catalog_nodes",
                Optional.of("/pgraph/producer-types.yaml"));
        producer.init();
        try {
            PropertyGraph graph = producer.graph();
            assertTrue(graph.schema().type("Sample").isPresent());
            assertTrue(graph.schema().type("Agent").isPresent());
            graph.addNodeEntry("Agent", Map.of("pid", "a1", "name", "Ana"));
            assertEquals("Ana", graph.getNode("a1").orElseThrow().get("name"));
        } finally {
            producer.shutdown();
        }
    }

    @Test
    void testWithoutCatalogStartsEmpty() {
        PropertyGraphProducer producer = new PropertyGraphProducer("jdbc:duckdb:", "node", Optional.empty());
        producer.init();
        try {
            assertTrue(producer.graph().schema().typeNames().isEmpty());
        } finally {
            producer.shutdown();
        }
    }

    @Test
    void testMissingCatalogFails() {
        PropertyGraphProducer producer = new PropertyGraphProducer("jdbc:duckdb:", "node",
                Optional.of("/pgraph/does-not-exist.yaml"));
        assertThrows(IllegalStateException.class, producer::init);
    }
}
