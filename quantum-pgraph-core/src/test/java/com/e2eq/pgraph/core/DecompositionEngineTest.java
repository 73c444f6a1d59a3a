package com.e2eq.pgraph.core;

import com.e2eq.pgraph.exceptions.GraphConfigException;
import com.e2eq.pgraph.exceptions.GraphStorageException;
import com.e2eq.pgraph.exceptions.StructuralException;
import com.e2eq.pgraph.model.Edge;
import com.e2eq.pgraph.model.Relation;
import com.e2eq.pgraph.spi.WriteTransaction;
import com.e2eq.pgraph.core.TestEntities.Agent;
import com.e2eq.pgraph.core.TestEntities.Link;
import com.e2eq.pgraph.core.TestEntities.Sample;
import com.e2eq.pgraph.core.TestEntities.SamplingSite;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DecompositionEngineTest {

    private InMemoryGraphStoreTestDouble store;
    private PropertyGraph graph;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStoreTestDouble();
        graph = new PropertyGraph(GraphConfig.defaults().withMaxDecompositionDepth(5), store);
        graph.registerType(Sample.class).registerType(Link.class);
        graph.initialize();
    }

    private static List<Relation> relations(Iterable<Relation> it) {
        List<Relation> out = new ArrayList<>();
        it.forEach(out::add);
        return out;
    }

    @Test
    void testCompositeBecomesNodesAndEdges() {
        Sample s = new Sample();
        s.setPid("sample-1");
        s.identifier = "IGSN:1";
        s.keywords = List.of("rock", "basalt");
        s.collected = Instant.parse("2023-05-01T00:00:00Z");
        s.registrant = new Agent("agent-1", "Alice");
        s.site = new SamplingSite();
        s.site.siteName = "Ridge";

        String pid = graph.addNode(s);

        assertEquals("sample-1", pid);
        assertNotNull(s.site.getPid());
        assertTrue(s.site.getPid().startsWith("anon_"));
        Map<String, Long> counts = graph.objectCounts();
        assertEquals(1L, counts.get("Sample"));
        assertEquals(1L, counts.get("Agent"));
        assertEquals(1L, counts.get("Site"));
        assertEquals(2L, counts.get("_edge_"));

        Map<String, Object> bag = graph.getNode("sample-1").orElseThrow();
        assertEquals("IGSN:1", bag.get("identifier"));
        assertEquals(List.of("rock", "basalt"), bag.get("keywords"));
        assertFalse(bag.containsKey("row_id"));
        assertFalse(bag.containsKey("scratch"));

        assertEquals(List.of(
                new Relation("sample-1", "registrant", "agent-1"),
                new Relation("sample-1", "site", s.site.getPid())),
                relations(graph.getRelations("sample-1", null, null)));
    }

    @Test
    void testChildRowsPrecedeTheirEdge() {
        Sample s = new Sample();
        s.registrant = new Agent("agent-1", "Alice");
        graph.addNode(s);
        Edge edge = graph.getEdges(s.getPid(), "registrant", 0).iterator().next();
        assertTrue(store.rowIdOf("agent-1") < store.rowIdOf(edge.pid()));
        assertTrue(store.rowIdOf(s.getPid()) < store.rowIdOf("agent-1"));
    }

    @Test
    void testListBecomesOneEdgeWithOrderedObjects() {
        Sample s = new Sample();
        s.setPid("s");
        s.curators.add(new Agent("c3", "C"));
        s.curators.add(new Agent("c1", "A"));
        s.curators.add(new Agent("c2", "B"));
        graph.addNode(s);

        assertEquals(Map.of("curators", 1L), graph.predicateCounts());
        Edge edge = graph.getEdges("s", "curators", 0).iterator().next();
        assertEquals(List.of("c3", "c1", "c2"), edge.objects());
        assertEquals(3, relations(graph.getRelations("s", "curators", null)).size());
    }

    @Test
    void testSharedInstanceWrittenOnce() {
        Agent shared = new Agent(null, "Shared");
        Sample s = new Sample();
        s.setPid("s");
        s.registrant = shared;
        s.curators.add(shared);
        s.curators.add(shared);
        graph.addNode(s);

        assertEquals(1L, graph.objectCounts().get("Agent"));
        Edge curators = graph.getEdges("s", "curators", 0).iterator().next();
        assertEquals(List.of(shared.getPid(), shared.getPid()), curators.objects());
    }

    @Test
    void testCycleTerminates() {
        Agent a = new Agent("a", "A");
        Agent b = new Agent("b", "B");
        a.affiliation = b;
        b.affiliation = a;
        Sample s = new Sample();
        s.setPid("s");
        s.registrant = a;
        graph.addNode(s);

        assertEquals(2L, graph.objectCounts().get("Agent"));
        List<Relation> rels = relations(graph.getRelations(null, "affiliation", null));
        assertTrue(rels.contains(new Relation("a", "affiliation", "b")));
        assertTrue(rels.contains(new Relation("b", "affiliation", "a")));
    }

    @Test
    void testDepthLimit() {
        graph.addNode(TestEntities.chain(5));
        assertEquals(5L, graph.objectCounts().get("Link"));

        Map<String, Long> countsBefore = graph.objectCounts();
        assertThrows(StructuralException.class, () -> graph.addNode(TestEntities.chain(6)));
        assertEquals(countsBefore, graph.objectCounts());
    }

    @Test
    void testDeepChainUsesNoJavaRecursion() {
        InMemoryGraphStoreTestDouble deepStore = new InMemoryGraphStoreTestDouble();
        PropertyGraph deep = new PropertyGraph(GraphConfig.defaults().withMaxDecompositionDepth(20_000), deepStore);
        deep.registerType(Link.class).initialize();
        deep.addNode(TestEntities.chain(10_000));
        assertEquals(10_000L, deep.objectCounts().get("Link"));
    }

    @Test
    void testSamePidDifferentTypesRejected() {
        Sample s = new Sample();
        s.setPid("s");
        s.registrant = new Agent("dup", "A");
        s.site = new SamplingSite();
        s.site.setPid("dup");
        assertThrows(StructuralException.class, () -> graph.addNode(s));
        assertTrue(graph.getNode("s").isEmpty());
        assertTrue(graph.objectCounts().isEmpty());
    }

    @Test
    void testUnregisteredClassRejected() {
        assertThrows(GraphConfigException.class, () -> graph.addNode(new TestEntities.Unregistered()));
    }

    @Test
    void testUnregisteredClassDoesNotSpoilEnclosingTransaction() {
        try (WriteTransaction tx = graph.beginWrite()) {
            graph.addNode(new Agent("a", "A"));
            assertThrows(GraphConfigException.class, () -> graph.addNode(new TestEntities.Unregistered()));
            graph.addNode(new Agent("b", "B"));
            tx.commit();
        }
        assertTrue(graph.getNode("a").isPresent());
        assertTrue(graph.getNode("b").isPresent());
    }

    @Test
    void testFailedNestedWriteMakesOuterCommitFail() {
        WriteTransaction tx = graph.beginWrite();
        graph.addNode(new Agent("a", "A"));
        assertThrows(StructuralException.class, () -> graph.addNode(TestEntities.chain(6)));
        graph.addNode(new Agent("b", "B"));

        GraphStorageException ex = assertThrows(GraphStorageException.class, tx::commit);
        assertTrue(ex.getMessage().contains("rollback-only"));
        tx.close();

        assertTrue(graph.getNode("a").isEmpty());
        assertTrue(graph.getNode("b").isEmpty());
        assertTrue(graph.objectCounts().isEmpty());
    }

    @Test
    void testAddingTwiceUpsertsRows() {
        Sample s = new Sample();
        s.setPid("s");
        s.identifier = "v1";
        s.registrant = new Agent("a", "A");
        graph.addNode(s);
        s.identifier = "v2";
        graph.addNode(s);

        assertEquals(1L, graph.objectCounts().get("Sample"));
        assertEquals(1L, graph.objectCounts().get("_edge_"));
        assertEquals("v2", graph.getNode("s").orElseThrow().get("identifier"));
    }
}
