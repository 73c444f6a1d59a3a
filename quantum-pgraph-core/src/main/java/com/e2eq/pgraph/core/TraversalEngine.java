package com.e2eq.pgraph.core;

import com.e2eq.pgraph.model.Edge;
import com.e2eq.pgraph.model.Relation;
import com.e2eq.pgraph.model.RootEdge;
import com.e2eq.pgraph.model.TraversalStep;
import com.e2eq.pgraph.spi.GraphStore;
import com.e2eq.pgraph.spi.NodeEntry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Walks the graph along edges, forwards from a start node or backwards towards roots.
 * Visited sets make every walk finite on cyclic graphs.
 */
public class TraversalEngine {

    private final GraphContext ctx;
    private final GraphAccessor accessor;
    private final GraphStore store;

    public TraversalEngine(GraphContext ctx, GraphAccessor accessor) {
        this.ctx = ctx;
        this.accessor = accessor;
        this.store = accessor.store();
    }

    public Iterable<TraversalStep> breadthFirstTraversal(String startPid) {
        return breadthFirstTraversal(startPid, ctx.config().maxTraversalDepth());
    }

    /**
     * Triples reachable from {@code startPid} in breadth-first order. Edges leaving the
     * start node have depth 1. Each triple is produced once and each node is expanded
     * once. Nodes are expanded lazily as the iterator advances.
     *
     * @param maxDepth deepest step produced, 0 for no bound
     */
    public Iterable<TraversalStep> breadthFirstTraversal(String startPid, int maxDepth) {
        return () -> new BfsIterator(startPid, maxDepth);
    }

    private final class BfsIterator implements Iterator<TraversalStep> {
        private final int maxDepth;
        private final ArrayDeque<Map.Entry<String, Integer>> frontier = new ArrayDeque<>();
        private final Set<String> expanded = new HashSet<>();
        private final Set<Relation> seen = new HashSet<>();
        private final ArrayDeque<TraversalStep> ready = new ArrayDeque<>();

        BfsIterator(String startPid, int maxDepth) {
            this.maxDepth = maxDepth;
            if (startPid != null && store.pidToRowId(startPid).isPresent()) {
                frontier.add(Map.entry(startPid, 0));
                expanded.add(startPid);
            }
        }

        @Override
        public boolean hasNext() {
            while (ready.isEmpty() && !frontier.isEmpty()) {
                expand(frontier.poll());
            }
            return !ready.isEmpty();
        }

        @Override
        public TraversalStep next() {
            if (!hasNext()) throw new NoSuchElementException();
            return ready.poll();
        }

        private void expand(Map.Entry<String, Integer> node) {
            int depth = node.getValue() + 1;
            if (maxDepth > 0 && depth > maxDepth) return;
            OptionalLong rowId = store.pidToRowId(node.getKey());
            if (rowId.isEmpty()) return;
            for (Edge edge : accessor.allEdges(rowId.getAsLong(), null)) {
                for (String object : edge.objects()) {
                    Relation r = new Relation(edge.subject(), edge.predicate(), object);
                    if (!seen.add(r)) continue;
                    ready.add(new TraversalStep(r.subject(), r.predicate(), r.object(), depth));
                    if (expanded.add(object)) {
                        frontier.add(Map.entry(object, depth));
                    }
                }
            }
        }
    }

    /**
     * Pids of the nodes that make up the composite rooted at {@code pid}: the pid itself
     * and every node reachable from it through outgoing edges. Empty if pid is unknown.
     */
    public Set<String> getNodeIds(String pid) {
        Set<String> out = new LinkedHashSet<>();
        if (pid == null || store.pidToRowId(pid).isEmpty()) return out;
        out.add(pid);
        for (TraversalStep step : breadthFirstTraversal(pid, 0)) {
            out.add(step.object());
        }
        return out;
    }

    /**
     * Edges found walking backwards from {@code pids}: first the edges whose objects
     * include one of the pids (depth 1), then the edges pointing at those edges' subjects,
     * and so on. {@code predicates} restricts which edges are followed; {@code targetType}
     * restricts which edges are reported to those whose subject has that otype.
     */
    public List<RootEdge> getRootEdgesForPid(Collection<String> pids, String targetType, Collection<String> predicates) {
        Set<String> allowed = predicates == null ? Set.of() : new HashSet<>(predicates);
        List<RootEdge> out = new ArrayList<>();
        Map<String, String> otypes = new HashMap<>();
        Set<String> expanded = new HashSet<>();
        Set<String> seenEdges = new HashSet<>();
        ArrayDeque<Map.Entry<String, Integer>> frontier = new ArrayDeque<>();
        if (pids != null) {
            for (String pid : pids) {
                if (pid != null && expanded.add(pid)) frontier.add(Map.entry(pid, 1));
            }
        }
        while (!frontier.isEmpty()) {
            Map.Entry<String, Integer> next = frontier.poll();
            String object = next.getKey();
            int depth = next.getValue();
            OptionalLong rowId = store.pidToRowId(object);
            if (rowId.isEmpty()) continue;
            for (Edge edge : store.findEdgesReferencing(rowId.getAsLong())) {
                if (!allowed.isEmpty() && !allowed.contains(edge.predicate())) continue;
                if (!seenEdges.add(edge.pid() + "\u0000" + object)) continue;
                String stype = otypes.computeIfAbsent(edge.subject(),
                        s -> store.findEntry(s).map(NodeEntry::otype).orElse(null));
                if (targetType == null || targetType.equals(stype)) {
                    out.add(new RootEdge(edge.pid(), edge.subject(), edge.predicate(), object,
                            edge.namedGraph(), depth, stype));
                }
                if (expanded.add(edge.subject())) {
                    frontier.add(Map.entry(edge.subject(), depth + 1));
                }
            }
        }
        return out;
    }
}
