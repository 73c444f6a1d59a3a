package com.e2eq.pgraph.duckdb;

import com.e2eq.pgraph.core.GraphConfig;
import com.e2eq.pgraph.core.PropertyGraph;
import com.e2eq.pgraph.exceptions.GraphStorageException;
import com.e2eq.pgraph.exceptions.ReferentialIntegrityException;
import com.e2eq.pgraph.exceptions.StructuralException;
import com.e2eq.pgraph.model.Edge;
import com.e2eq.pgraph.model.FieldType;
import com.e2eq.pgraph.model.GraphEntity;
import com.e2eq.pgraph.model.IdEntry;
import com.e2eq.pgraph.model.Relation;
import com.e2eq.pgraph.model.TraversalStep;
import com.e2eq.pgraph.model.TypeDescriptor;
import com.e2eq.pgraph.model.TypeDescriptor.FieldDef;
import com.e2eq.pgraph.spi.WriteTransaction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class DuckDbGraphStoreTest {

    static class Person extends GraphEntity {
        String name;
        List<Person> friends = new ArrayList<>();
        Person mentor;
    }

    private static final TypeDescriptor THING = TypeDescriptor.of("Thing",
            new FieldDef("name", FieldType.STRING),
            new FieldDef("count", FieldType.INTEGER),
            new FieldDef("weight", FieldType.DOUBLE),
            new FieldDef("active", FieldType.BOOLEAN),
            new FieldDef("seen", FieldType.TIMESTAMP),
            new FieldDef("tags", FieldType.STRING_LIST),
            new FieldDef("sizes", FieldType.INTEGER_LIST),
            new FieldDef("coords", FieldType.DOUBLE_LIST),
            new FieldDef("shape", FieldType.BLOB));

    private PropertyGraph graph;

    @BeforeEach
    void setUp() {
        GraphConfig config = GraphConfig.inMemory();
        graph = new PropertyGraph(config, DuckDbGraphStore.open(config));
        graph.registerType(THING);
        graph.registerType(Person.class);
        graph.initialize();
    }

    @AfterEach
    void tearDown() {
        graph.close();
    }

    private void thing(String pid) {
        graph.addNodeEntry("Thing", Map.of("pid", pid, "name", pid));
    }

    private static <T> List<T> list(Iterable<T> it) {
        List<T> out = new ArrayList<>();
        it.forEach(out::add);
        return out;
    }

    @Test
    void testKnowsScenario() {
        thing("a");
        thing("b");
        String edgePid = graph.addEdge("a", "knows", "b");

        assertEquals(List.of(new Relation("a", "knows", "b")), list(graph.getRelations("a", null, null)));
        assertEquals(List.of("a"), graph.getRootsForPid("b"));

        Edge edge = graph.getEdge(edgePid).orElseThrow();
        assertEquals("a", edge.subject());
        assertEquals(List.of("b"), edge.objects());
        assertNull(edge.namedGraph());
        assertEquals(Map.of("knows", 1L), graph.predicateCounts());
    }

    @Test
    void testMissingObjectWritesNothing() {
        thing("a");
        Map<String, Long> before = graph.objectCounts();

        ReferentialIntegrityException ex = assertThrows(ReferentialIntegrityException.class,
                () -> graph.addEdge("a", "knows", "missing"));
        assertEquals(List.of("missing"), ex.getMissingPids());
        assertEquals(before, graph.objectCounts());
        assertTrue(list(graph.getRelations(null, null, null)).isEmpty());
    }

    @Test
    void testIdentityRoundTrip() {
        thing("a");
        thing("b");
        graph.addEdge("a", "knows", "b");
        for (IdEntry id : graph.getIds(null, 0)) {
            long rowId = graph.identity().pidToRowId(id.pid()).orElseThrow();
            assertEquals(id.pid(), graph.identity().rowIdToPid(rowId).orElseThrow());
            assertEquals(rowId, graph.identity().pidToRowId(graph.identity().rowIdToPid(rowId).orElseThrow()).getAsLong());
        }
        assertEquals(OptionalLong.empty(), graph.identity().pidToRowId("nope"));
        assertTrue(graph.identity().rowIdToPid(999_999L).isEmpty());
        assertTrue(graph.getNode("nope").isEmpty());
    }

    @Test
    void testColumnValuesRoundTrip() {
        Instant seen = Instant.parse("2024-05-01T12:30:00.123Z");
        graph.addNodeEntry("Thing", Map.ofEntries(
                Map.entry("pid", "t1"),
                Map.entry("label", "first"),
                Map.entry("altids", List.of("x:1", "x:2")),
                Map.entry("name", "widget"),
                Map.entry("count", 7),
                Map.entry("weight", 2.5),
                Map.entry("active", true),
                Map.entry("seen", seen),
                Map.entry("tags", List.of("b", "a", "b")),
                Map.entry("sizes", List.of(3, 1)),
                Map.entry("coords", List.of(1.5, -2.0)),
                Map.entry("shape", new byte[]{0, 1, (byte) 0xfe})));

        Map<String, Object> node = graph.getNode("t1").orElseThrow();
        assertEquals("Thing", node.get("otype"));
        assertEquals("first", node.get("label"));
        assertEquals(List.of("x:1", "x:2"), node.get("altids"));
        assertEquals("widget", node.get("name"));
        assertEquals(7L, node.get("count"));
        assertEquals(2.5, node.get("weight"));
        assertEquals(Boolean.TRUE, node.get("active"));
        assertEquals(seen, node.get("seen"));
        assertEquals(List.of("b", "a", "b"), node.get("tags"));
        assertEquals(List.of(3L, 1L), node.get("sizes"));
        assertEquals(List.of(1.5, -2.0), node.get("coords"));
        assertArrayEquals(new byte[]{0, 1, (byte) 0xfe}, (byte[]) node.get("shape"));
    }

    @Test
    void testUpsertKeepsRowIdAndClearsDroppedFields() {
        graph.addNodeEntry("Thing", Map.of("pid", "t", "name", "old", "count", 1));
        long rowId = graph.identity().pidToRowId("t").orElseThrow();
        long created = (Long) graph.getNode("t").orElseThrow().get("tcreated");

        graph.addNodeEntry("Thing", Map.of("pid", "t", "name", "new"));

        Map<String, Object> node = graph.getNode("t").orElseThrow();
        assertEquals(rowId, graph.identity().pidToRowId("t").getAsLong());
        assertEquals("new", node.get("name"));
        assertNull(node.get("count"));
        assertEquals(created, node.get("tcreated"));
        assertTrue((Long) node.get("tmodified") >= created);
        assertEquals(Map.of("Thing", 1L), graph.objectCounts());
    }

    @Test
    void testSameEdgeTwiceIsOneRow() {
        thing("a");
        thing("b");
        String first = graph.addEdge("a", "knows", "b");
        String second = graph.addEdge("a", "knows", "b");
        assertEquals(first, second);
        assertEquals(1L, graph.objectCounts().get("_edge_"));
    }

    @Test
    void testFanOutMatchesObjectCount() {
        thing("s");
        List<String> objects = List.of("o1", "o2", "o3", "o4");
        objects.forEach(this::thing);
        graph.addEdge("s", "has", objects, null);

        List<Relation> rels = list(graph.getRelations("s", "has", null));
        assertEquals(4, rels.size());
        assertEquals(objects, rels.stream().map(Relation::object).toList());
        assertEquals(List.of(new Relation("s", "has", "o3")), list(graph.getRelations(null, null, "o3")));
        assertEquals(2, list(graph.getRelations(null, null, null, 2)).size());
    }

    @Test
    void testDecomposeSharedReference() {
        Person shared = new Person();
        shared.setPid("shared");
        shared.name = "Shared";
        Person root = new Person();
        root.setPid("root");
        root.name = "Root";
        root.mentor = shared;
        root.friends.add(shared);

        graph.addNode(root);

        assertEquals(2L, graph.objectCounts().get("Person"));
        List<Relation> rels = list(graph.getRelations("root", null, null));
        assertEquals(2, rels.size());
        assertTrue(rels.stream().allMatch(r -> r.object().equals("shared")));
        assertEquals(java.util.Set.of("root", "shared"), graph.getNodeIds("root"));

        Map<String, Object> expanded = graph.getNode("root", 1).orElseThrow();
        @SuppressWarnings("unchecked")
        Map<String, Object> mentor = (Map<String, Object>) expanded.get("mentor");
        assertEquals("Shared", mentor.get("name"));
    }

    @Test
    void testTraversalOverCycleTerminates() {
        thing("a");
        thing("b");
        thing("c");
        graph.addEdge("a", "next", "b");
        graph.addEdge("b", "next", "c");
        graph.addEdge("c", "next", "a");

        List<TraversalStep> steps = list(graph.breadthFirstTraversal("a"));
        assertEquals(3, steps.size());
        assertEquals(new TraversalStep("a", "next", "b", 1), steps.get(0));
        assertEquals(new TraversalStep("b", "next", "c", 2), steps.get(1));
        assertEquals(new TraversalStep("c", "next", "a", 3), steps.get(2));

        thing("lonely");
        assertFalse(graph.breadthFirstTraversal("lonely").iterator().hasNext());
    }

    @Test
    void testRootsAreTransitive() {
        for (String p : List.of("x", "y", "z", "w", "other")) thing(p);
        graph.addEdge("y", "contains", "x");
        graph.addEdge("z", "contains", "y");
        graph.addEdge("w", "contains", "z");

        assertEquals(List.of("y", "z", "w"), graph.getRootsForPid("x"));
        assertEquals(List.of(), graph.getRootsForPid("w"));
        assertEquals(List.of(), graph.getRootsForPid("unknown"));
    }

    @Test
    void testUncommittedTransactionRollsBack() {
        thing("keep");
        try (WriteTransaction tx = graph.beginWrite()) {
            thing("drop");
            graph.addEdge("keep", "knows", "drop");
            assertTrue(graph.identity().pidToRowId("drop").isPresent());
        }
        assertTrue(graph.identity().pidToRowId("drop").isEmpty());
        assertTrue(graph.getNode("drop").isEmpty());
        assertEquals(Map.of("Thing", 1L), graph.objectCounts());

        try (WriteTransaction tx = graph.beginWrite()) {
            thing("kept");
            tx.commit();
        }
        assertTrue(graph.getNode("kept").isPresent());
    }

    @Test
    void testIdsPageInRowOrder() {
        for (int i = 0; i < 5; i++) thing("t" + i);
        List<String> pids = list(graph.getIds("Thing", 0)).stream().map(IdEntry::pid).toList();
        assertEquals(List.of("t0", "t1", "t2", "t3", "t4"), pids);
        assertEquals(3, list(graph.getIds("Thing", 3)).size());
        assertTrue(list(graph.getIds("Nothing", 0)).isEmpty());
    }

    @Test
    void testFailedNestedWriteMakesOuterCommitFail() {
        GraphConfig config = GraphConfig.inMemory().withMaxDecompositionDepth(2);
        try (PropertyGraph shallow = new PropertyGraph(config, DuckDbGraphStore.open(config))) {
            shallow.registerType(Person.class).initialize();
            Person a = new Person();
            a.setPid("a");
            Person b = new Person();
            b.setPid("b");
            Person deep = new Person();
            deep.mentor = new Person();
            deep.mentor.mentor = new Person();

            WriteTransaction tx = shallow.beginWrite();
            shallow.addNode(a);
            assertThrows(StructuralException.class, () -> shallow.addNode(deep));
            shallow.addNode(b);
            assertThrows(GraphStorageException.class, tx::commit);
            tx.close();

            assertTrue(shallow.getNode("a").isEmpty());
            assertTrue(shallow.getNode("b").isEmpty());
            assertTrue(shallow.objectCounts().isEmpty());
        }
    }

    @Test
    void testLookupsSeeRowsDeletedBehindTheGraph() throws SQLException {
        GraphConfig config = GraphConfig.inMemory();
        Connection conn = DriverManager.getConnection(config.url());
        try (PropertyGraph shared = new PropertyGraph(config, new DuckDbGraphStore(conn, config))) {
            shared.registerType(THING).initialize();
            shared.addNodeEntry("Thing", Map.of("pid", "a", "name", "a"));
            shared.addNodeEntry("Thing", Map.of("pid", "b", "name", "b"));
            assertTrue(shared.identity().pidToRowId("b").isPresent());

            try (Statement st = conn.createStatement()) {
                st.execute("DELETE FROM " + config.tableName() + " WHERE pid = 'b'");
            }

            assertTrue(shared.identity().pidToRowId("b").isEmpty());
            ReferentialIntegrityException ex = assertThrows(ReferentialIntegrityException.class,
                    () -> shared.addEdge("a", "knows", "b"));
            assertEquals(List.of("b"), ex.getMissingPids());
            assertTrue(shared.predicateCounts().isEmpty());
        }
    }
}
