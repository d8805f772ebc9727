package co.fanki.flowengine.flow.domain;

import co.fanki.flowengine.shared.Preconditions;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;

/**
 * Breadth-first closures over the edges of a flow.
 *
 * <p>Every walk keeps a visited set, so loop-back edges terminate. The
 * closures follow edges only: an edge pointing at a node id that is not in
 * the graph still contributes that id.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GraphTraversal {

    private GraphTraversal() {
    }

    /**
     * Collects every node reachable from the given one, following edge
     * direction.
     *
     * @param graph the flow snapshot
     * @param nodeId the node to start from, included in the result
     * @return the reachable ids in discovery order
     */
    public static Set<String> downstream(final FlowGraph graph,
            final String nodeId) {
        return walk(graph, nodeId, true);
    }

    /**
     * Collects every node that leads to the given one, walking edges
     * backwards.
     *
     * @param graph the flow snapshot
     * @param nodeId the node to start from, included in the result
     * @return the upstream ids in discovery order
     */
    public static Set<String> upstream(final FlowGraph graph,
            final String nodeId) {
        return walk(graph, nodeId, false);
    }

    /**
     * Computes the branch to highlight when a node is selected.
     *
     * @param graph the flow snapshot
     * @param nodeId the selected node
     * @param mode which side of the node to include
     * @return the branch node ids and the edges between them
     */
    public static ConnectedBranch connectedBranch(final FlowGraph graph,
            final String nodeId, final BranchMode mode) {
        Preconditions.requireNonNull(mode, "Branch mode is required");

        final Set<String> nodeIds = switch (mode) {
            case DOWNSTREAM -> downstream(graph, nodeId);
            case UPSTREAM -> upstream(graph, nodeId);
            case FULL -> {
                final Set<String> both = new LinkedHashSet<>(
                        downstream(graph, nodeId));
                both.addAll(upstream(graph, nodeId));
                yield both;
            }
        };

        final List<String> edgeIds = new ArrayList<>();
        for (final FlowEdge edge : graph.edges()) {
            if (nodeIds.contains(edge.source())
                    && nodeIds.contains(edge.target())) {
                edgeIds.add(edge.id());
            }
        }
        return new ConnectedBranch(new ArrayList<>(nodeIds), edgeIds);
    }

    /**
     * Lists the question nodes that come before the given node, the ones
     * whose answers its text may pipe in.
     *
     * <p>The starting node itself is only listed when a loop-back edge
     * leads to it again.</p>
     *
     * @param graph the flow snapshot
     * @param nodeId the node whose ancestors are wanted
     * @return the ancestor question nodes in discovery order, no duplicates
     */
    public static List<FlowNode> ancestorQuestionNodes(final FlowGraph graph,
            final String nodeId) {
        Preconditions.requireNonNull(graph, "Graph is required");

        final Set<String> visited = new LinkedHashSet<>();
        final Queue<String> queue = new ArrayDeque<>();
        final List<FlowNode> ancestors = new ArrayList<>();
        queue.add(nodeId);

        while (!queue.isEmpty()) {
            final String current = queue.poll();
            for (final FlowEdge edge : graph.incoming(current)) {
                if (visited.add(edge.source())) {
                    queue.add(edge.source());
                    final FlowNode source = graph.node(edge.source());
                    if (source != null && source.isQuestion()) {
                        ancestors.add(source);
                    }
                }
            }
        }
        return ancestors;
    }

    private static Set<String> walk(final FlowGraph graph,
            final String nodeId, final boolean forward) {
        Preconditions.requireNonNull(graph, "Graph is required");
        Preconditions.requireNonNull(nodeId, "Node id is required");

        final Set<String> visited = new LinkedHashSet<>();
        final Queue<String> queue = new ArrayDeque<>();
        visited.add(nodeId);
        queue.add(nodeId);

        while (!queue.isEmpty()) {
            final String current = queue.poll();
            final List<FlowEdge> edges = forward
                    ? graph.outgoing(current)
                    : graph.incoming(current);
            for (final FlowEdge edge : edges) {
                final String next = forward ? edge.target() : edge.source();
                if (visited.add(next)) {
                    queue.add(next);
                }
            }
        }
        return Collections.unmodifiableSet(visited);
    }
}
