package com.e2eq.pgraph.duckdb;

import com.e2eq.pgraph.core.GraphConfig;
import com.e2eq.pgraph.core.PropertyGraph;
import com.e2eq.pgraph.exceptions.GraphConfigException;
import com.e2eq.pgraph.model.FieldType;
import com.e2eq.pgraph.model.GraphMetadata;
import com.e2eq.pgraph.model.Relation;
import com.e2eq.pgraph.model.TypeDescriptor;
import com.e2eq.pgraph.model.TypeDescriptor.FieldDef;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DuckDbReattachTest {

    private static final TypeDescriptor SAMPLE = TypeDescriptor.of("Sample",
            new FieldDef("identifier", FieldType.STRING),
            new FieldDef("keywords", FieldType.STRING_LIST));
    private static final TypeDescriptor AGENT = TypeDescriptor.of("Agent",
            new FieldDef("name", FieldType.STRING));

    @TempDir
    Path dir;

    private GraphConfig fileConfig() {
        return GraphConfig.defaults()
                .withUrl("jdbc:duckdb:" + dir.resolve("graph.duckdb"))
                .withTableName("samples")
                .withPrimaryKeyField("id");
    }

    @Test
    void testReaderSeesTypesAndRowsWithoutRegistering() {
        GraphConfig config = fileConfig();
        try (PropertyGraph writer = new PropertyGraph(config, DuckDbGraphStore.open(config))) {
            writer.registerType(SAMPLE).registerType(AGENT).initialize();
            writer.addNodeEntry("Sample", Map.of("id", "s1", "identifier", "IGSN:1", "keywords", List.of("rock")));
            writer.addNodeEntry("Agent", Map.of("id", "ag", "name", "Ana"));
            writer.addEdge("s1", "registrant", "ag");
        }

        try (PropertyGraph reader = new PropertyGraph(config, DuckDbGraphStore.open(config))) {
            reader.initialize();
            assertEquals(List.of("Agent", "Sample"), reader.schema().typeNames().stream().sorted().toList());

            Map<String, Object> sample = reader.getNode("s1").orElseThrow();
            assertEquals("s1", sample.get("id"));
            assertEquals("IGSN:1", sample.get("identifier"));
            assertEquals(List.of("rock"), sample.get("keywords"));

            List<Relation> rels = new ArrayList<>();
            reader.getRelations(null, "registrant", null).forEach(rels::add);
            assertEquals(List.of(new Relation("s1", "registrant", "ag")), rels);

            GraphMetadata meta = reader.metadata().orElseThrow();
            assertEquals("id", meta.primaryKey());
            assertEquals(List.of("identifier", "keywords", "name"), meta.literalFields());
        }
    }

    @Test
    void testLaterSessionExtendsTheRelation() {
        GraphConfig config = fileConfig();
        try (PropertyGraph first = new PropertyGraph(config, DuckDbGraphStore.open(config))) {
            first.registerType(SAMPLE).initialize();
            first.addNodeEntry("Sample", Map.of("id", "s1", "identifier", "one"));
        }
        try (PropertyGraph second = new PropertyGraph(config, DuckDbGraphStore.open(config))) {
            second.registerType(TypeDescriptor.of("Site", new FieldDef("elevation", FieldType.DOUBLE)));
            second.initialize();
            second.addNodeEntry("Site", Map.of("id", "site1", "elevation", 12.5));
            assertEquals(12.5, second.getNode("site1").orElseThrow().get("elevation"));
            assertEquals("one", second.getNode("s1").orElseThrow().get("identifier"));
            assertEquals(Map.of("Sample", 1L, "Site", 1L), second.objectCounts());
        }
    }

    @Test
    void testConflictingTypeIsRejectedOnReattach() {
        GraphConfig config = fileConfig();
        try (PropertyGraph first = new PropertyGraph(config, DuckDbGraphStore.open(config))) {
            first.registerType(SAMPLE).initialize();
        }
        try (PropertyGraph second = new PropertyGraph(config, DuckDbGraphStore.open(config))) {
            second.registerType(TypeDescriptor.of("Sample", new FieldDef("identifier", FieldType.INTEGER)));
            assertThrows(GraphConfigException.class, second::initialize);
        }
    }

    @Test
    void testPidColumnMismatchIsRejected() {
        GraphConfig config = fileConfig();
        try (PropertyGraph first = new PropertyGraph(config, DuckDbGraphStore.open(config))) {
            first.registerType(SAMPLE).initialize();
        }
        GraphConfig other = config.withPrimaryKeyField("pid");
        try (PropertyGraph second = new PropertyGraph(other, DuckDbGraphStore.open(other))) {
            assertThrows(GraphConfigException.class, second::initialize);
        }
    }

    @Test
    void testInitializeTwiceOnOneStore() {
        GraphConfig config = GraphConfig.inMemory();
        try (DuckDbGraphStore store = DuckDbGraphStore.open(config)) {
            PropertyGraph graph = new PropertyGraph(config, store).registerType(SAMPLE);
            graph.initialize();
            graph.addNodeEntry("Sample", Map.of("pid", "s", "identifier", "x"));
            PropertyGraph again = new PropertyGraph(config, store).registerType(SAMPLE);
            again.initialize();
            assertEquals("x", again.getNode("s").orElseThrow().get("identifier"));
        }
    }
}
