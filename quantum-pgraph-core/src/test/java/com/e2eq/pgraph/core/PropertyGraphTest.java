package com.e2eq.pgraph.core;

import com.e2eq.pgraph.exceptions.GraphConfigException;
import com.e2eq.pgraph.model.FieldType;
import com.e2eq.pgraph.model.GraphMetadata;
import com.e2eq.pgraph.model.GraphSchema;
import com.e2eq.pgraph.model.TypeDescriptor;
import com.e2eq.pgraph.model.TypeDescriptor.FieldDef;
import com.e2eq.pgraph.spi.WriteTransaction;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PropertyGraphTest {

    private static final TypeDescriptor PERSON = TypeDescriptor.of("Person",
            new FieldDef("name", FieldType.STRING), new FieldDef("tags", FieldType.STRING_LIST));

    @Test
    void testInitializeIsIdempotent() {
        InMemoryGraphStoreTestDouble store = new InMemoryGraphStoreTestDouble();
        PropertyGraph graph = new PropertyGraph(GraphConfig.defaults(), store).registerType(PERSON);
        GraphSchema first = graph.initialize();
        assertSame(first, graph.initialize());
        assertEquals(1, store.getInitializeCalls());
    }

    @Test
    void testMetadataDescribesSchema() {
        InMemoryGraphStoreTestDouble store = new InMemoryGraphStoreTestDouble();
        PropertyGraph graph = new PropertyGraph(GraphConfig.defaults(), store).registerType(PERSON);
        graph.initialize();
        GraphMetadata meta = graph.metadata().orElseThrow();
        assertEquals(GraphMetadata.CURRENT_VERSION, meta.version());
        assertEquals("pid", meta.primaryKey());
        assertEquals("_edge_", meta.edgeType());
        assertEquals(Map.of("name", FieldType.STRING, "tags", FieldType.STRING_LIST), meta.nodeTypes().get("Person"));
        assertEquals(List.of("name", "tags"), meta.literalFields());
        assertTrue(meta.edgeFields().containsAll(List.of("s", "p", "o", "n")));
    }

    @Test
    void testReaderReattachesThroughMetadata() {
        InMemoryGraphStoreTestDouble store = new InMemoryGraphStoreTestDouble();
        PropertyGraph writer = new PropertyGraph(GraphConfig.defaults(), store).registerType(PERSON);
        writer.initialize();
        writer.addNodeEntry("Person", Map.of("pid", "a", "name", "Alice"));

        PropertyGraph reader = new PropertyGraph(GraphConfig.defaults(), store);
        reader.initialize();
        assertEquals("Alice", reader.getNode("a").orElseThrow().get("name"));
        assertTrue(reader.schema().type("Person").isPresent());

        // registering the same type again on a fresh session is still fine
        PropertyGraph again = new PropertyGraph(GraphConfig.defaults(), store).registerType(PERSON);
        again.initialize();
        assertEquals(PERSON, again.schema().type("Person").orElseThrow());
    }

    @Test
    void testReattachConflictFails() {
        InMemoryGraphStoreTestDouble store = new InMemoryGraphStoreTestDouble();
        new PropertyGraph(GraphConfig.defaults(), store).registerType(PERSON).initialize();

        PropertyGraph conflicting = new PropertyGraph(GraphConfig.defaults(), store)
                .registerType(TypeDescriptor.of("Person", new FieldDef("name", FieldType.INTEGER)));
        assertThrows(GraphConfigException.class, conflicting::initialize);
    }

    @Test
    void testWritesRequireInitialize() {
        PropertyGraph graph = new PropertyGraph(GraphConfig.defaults(), new InMemoryGraphStoreTestDouble()).registerType(PERSON);
        assertThrows(GraphConfigException.class, () -> graph.addNodeEntry("Person", Map.of("pid", "a")));
        assertThrows(GraphConfigException.class, () -> graph.addEdge("a", "p", "b"));
    }

    @Test
    void testRegistrationAfterInitializeFails() {
        PropertyGraph graph = new PropertyGraph(GraphConfig.defaults(), new InMemoryGraphStoreTestDouble()).registerType(PERSON);
        graph.initialize();
        assertThrows(GraphConfigException.class, () -> graph.registerType(TypeDescriptor.of("Late")));
    }

    @Test
    void testExplicitTransactionRollsBack() {
        PropertyGraph graph = new PropertyGraph(GraphConfig.defaults(), new InMemoryGraphStoreTestDouble()).registerType(PERSON);
        graph.initialize();
        try (WriteTransaction tx = graph.beginWrite()) {
            graph.addNodeEntry("Person", Map.of("pid", "a"));
            graph.addNodeEntry("Person", Map.of("pid", "b"));
            graph.addEdge("a", "knows", "b");
        }
        assertTrue(graph.objectCounts().isEmpty());

        try (WriteTransaction tx = graph.beginWrite()) {
            graph.addNodeEntry("Person", Map.of("pid", "a"));
            tx.commit();
        }
        assertEquals(Map.of("Person", 1L), graph.objectCounts());
    }
}
