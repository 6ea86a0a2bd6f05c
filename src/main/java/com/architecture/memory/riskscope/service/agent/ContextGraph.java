package com.architecture.memory.riskscope.service.agent;

import com.architecture.memory.riskscope.dto.graph.GraphNodeRef;
import com.architecture.memory.riskscope.service.graph.GraphRetry;
import com.architecture.memory.riskscope.service.graph.GraphStoreAdapter;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory neighborhood of the file under investigation.
 *
 * <p>Growth is an explicit breadth-first walk over an arena of visited node ids, each tagged
 * with the hop at which it was reached. Frontier lookups carry the node's label so the store
 * can anchor on the right index. Depth never exceeds {@code maxDepth} and the single
 * expansion beyond the first hop can happen at most once.</p>
 */
public class ContextGraph {

    static final int MAX_FRONTIER = 50;
    static final int MAX_NODES = 500;

    private final GraphStoreAdapter graph;
    private final int maxDepth;

    private final Map<String, Integer> depthById = new LinkedHashMap<>();
    private final Map<String, GraphNodeRef> refsById = new LinkedHashMap<>();
    private final Map<String, GraphNodeRef> nodes = new LinkedHashMap<>();
    private int depth;
    private boolean expanded;

    public ContextGraph(GraphStoreAdapter graph, int maxDepth) {
        this.graph = graph;
        this.maxDepth = maxDepth;
    }

    /**
     * Places the roots at hop 0 and loads their 1-hop neighbors.
     *
     * @return number of neighbor nodes added
     */
    public int loadInitial(Collection<String> roots) {
        if (!depthById.isEmpty()) {
            throw new IllegalStateException("Context already loaded");
        }
        roots.forEach(r -> {
            depthById.put(r, 0);
            refsById.put(r, GraphNodeRef.file(r));
        });
        return grow(0);
    }

    /**
     * Loads the next hop out from the current frontier.
     *
     * @return number of nodes added
     * @throws IllegalStateException if already expanded or at the depth cap
     */
    public int expand() {
        if (!canExpand()) {
            throw new IllegalStateException(expanded
                    ? "Context already expanded"
                    : "Context at maximum depth " + maxDepth);
        }
        expanded = true;
        return grow(depth);
    }

    public boolean canExpand() {
        return !expanded && !depthById.isEmpty() && depth < maxDepth;
    }

    private int grow(int frontierDepth) {
        Deque<GraphNodeRef> frontier = new ArrayDeque<>();
        depthById.forEach((id, d) -> {
            if (d == frontierDepth && frontier.size() < MAX_FRONTIER) {
                frontier.add(refsById.get(id));
            }
        });

        int added = 0;
        while (!frontier.isEmpty() && depthById.size() < MAX_NODES) {
            GraphNodeRef ref = frontier.poll();
            Set<GraphNodeRef> neighbors = GraphRetry.retryOnce("neighbors", () -> graph.neighbors(ref, 1));
            for (GraphNodeRef node : neighbors) {
                if (depthById.size() >= MAX_NODES) {
                    break;
                }
                if (depthById.putIfAbsent(node.getId(), frontierDepth + 1) == null) {
                    refsById.put(node.getId(), node);
                    nodes.put(node.getId(), node);
                    added++;
                }
            }
        }
        depth = frontierDepth + 1;
        return added;
    }

    public int size() {
        return nodes.size();
    }

    public int getDepth() {
        return depth;
    }

    public boolean isExpanded() {
        return expanded;
    }

    public Integer depthOf(String id) {
        return depthById.get(id);
    }

    public List<GraphNodeRef> nodesAt(int hop) {
        return nodes.values().stream()
                .filter(n -> depthById.get(n.getId()) == hop)
                .toList();
    }

    public List<GraphNodeRef> files() {
        return nodes.values().stream().filter(GraphNodeRef::isFile).toList();
    }
}
