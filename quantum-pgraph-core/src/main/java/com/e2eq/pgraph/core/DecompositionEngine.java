package com.e2eq.pgraph.core;

import com.e2eq.pgraph.exceptions.GraphConfigException;
import com.e2eq.pgraph.exceptions.StructuralException;
import com.e2eq.pgraph.model.GraphEntity;
import com.e2eq.pgraph.spi.GraphStore;
import com.e2eq.pgraph.spi.WriteTransaction;
import org.jboss.logging.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Flattens a composite {@link GraphEntity} into node rows and edge rows.
 * <p>
 * Each entity becomes one node row holding its literal fields. Each non-empty reference
 * field becomes one edge whose predicate is the field id and whose objects are the
 * referenced pids in field order. A node row is written before any of its children are
 * visited, and every child row is written before the edge that points at it.
 * </p>
 * <p>
 * Instances are tracked by identity for the duration of one call: an instance referenced
 * from several places is written once, and cycles end at the instance already in progress.
 * The walk uses an explicit stack so nesting depth is bounded by configuration rather
 * than by the Java call stack.
 * </p>
 */
public class DecompositionEngine {

    private static final Logger LOG = Logger.getLogger(DecompositionEngine.class);

    private final GraphContext ctx;
    private final GraphAccessor accessor;
    private final GraphStore store;

    public DecompositionEngine(GraphContext ctx, GraphAccessor accessor) {
        this.ctx = ctx;
        this.accessor = accessor;
        this.store = accessor.store();
    }

    private static final class Frame {
        final GraphEntity entity;
        final EntityBinding binding;
        final String pid;
        final int depth;
        final Iterator<EntityBinding.ReferenceBinding> refs;

        Frame(GraphEntity entity, EntityBinding binding, String pid, int depth) {
            this.entity = entity;
            this.binding = binding;
            this.pid = pid;
            this.depth = depth;
            this.refs = binding.references().iterator();
        }
    }

    /**
     * Writes {@code root} and everything it references in one write transaction.
     *
     * @return the pid of the root node
     */
    public String addNode(GraphEntity root) {
        if (root == null) throw new IllegalArgumentException("Cannot add a null entity");
        bindingOf(root);
        try (WriteTransaction tx = store.beginWrite()) {
            Walk walk = new Walk();
            Frame top = walk.enter(root, 1);
            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(top);
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (!frame.refs.hasNext()) {
                    stack.pop();
                    continue;
                }
                EntityBinding.ReferenceBinding ref = frame.refs.next();
                List<GraphEntity> targets = frame.binding.referenced(ref, frame.entity);
                if (targets.isEmpty()) continue;
                List<String> objectPids = new ArrayList<>(targets.size());
                List<Frame> entered = new ArrayList<>();
                for (GraphEntity target : targets) {
                    String known = walk.visited.get(target);
                    if (known != null) {
                        objectPids.add(known);
                    } else {
                        Frame child = walk.enter(target, frame.depth + 1);
                        entered.add(child);
                        objectPids.add(child.pid);
                    }
                }
                accessor.addEdge(frame.pid, ref.predicate, objectPids, null);
                // children are expanded in field order
                for (int i = entered.size() - 1; i >= 0; i--) stack.push(entered.get(i));
            }
            tx.commit();
            LOG.debugf("Decomposed %s into %d node(s)", top.pid, walk.visited.size());
            return top.pid;
        }
    }

    private EntityBinding bindingOf(GraphEntity entity) {
        return ctx.registry().bindingFor(entity.getClass())
                .orElseThrow(() -> new GraphConfigException(AnnotationTypeLoader.otypeOf(entity.getClass()), null,
                        "Entity class " + entity.getClass().getName() + " is not registered"));
    }

    private final class Walk {
        final IdentityHashMap<GraphEntity, String> visited = new IdentityHashMap<>();
        final Map<String, String> otypeByPid = new HashMap<>();

        Frame enter(GraphEntity entity, int depth) {
            int max = ctx.config().maxDecompositionDepth();
            if (depth > max) {
                throw new StructuralException("Object nesting exceeds the maximum depth of " + max
                        + " at " + entity.getClass().getName());
            }
            EntityBinding binding = bindingOf(entity);
            if (entity.getPid() == null || entity.getPid().isBlank()) {
                entity.setPid(accessor.newAnonymousPid());
            }
            String pid = entity.getPid();
            String previous = otypeByPid.putIfAbsent(pid, binding.otype());
            if (previous != null && !previous.equals(binding.otype())) {
                throw new StructuralException("Pid '" + pid + "' is used by two different objects of types '"
                        + previous + "' and '" + binding.otype() + "'");
            }
            visited.put(entity, pid);
            accessor.writeNode(pid, binding.otype(), entity.getLabel(), entity.getDescription(),
                    entity.getAltids(), binding.literalValues(entity));
            return new Frame(entity, binding, pid, depth);
        }
    }
}
