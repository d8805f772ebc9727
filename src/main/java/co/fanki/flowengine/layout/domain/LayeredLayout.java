package co.fanki.flowengine.layout.domain;

import co.fanki.flowengine.flow.domain.FlowEdge;
import co.fanki.flowengine.flow.domain.FlowNode;
import co.fanki.flowengine.flow.domain.Position;
import co.fanki.flowengine.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

/**
 * Full auto-arrange of a flow as a layered drawing.
 *
 * <p>Each connected part of the graph is drawn on its own, in four
 * steps:</p>
 * <ol>
 *   <li><b>Cycle breaking.</b> A depth first walk from the roots (start
 *   nodes, then nodes nothing points to, then any node left, in input
 *   order) drops every edge that closes a loop.</li>
 *   <li><b>Ranking.</b> Each node's rank is its longest distance from a
 *   root over the remaining edges.</li>
 *   <li><b>Ordering.</b> Alternating barycenter sweeps reorder the nodes of
 *   each rank to reduce edge crossings.</li>
 *   <li><b>Placement.</b> Ranks are laid along the primary axis and the
 *   nodes of a rank along the cross axis, each rank centered on the widest
 *   one.</li>
 * </ol>
 * <p>Connected parts are stacked along the cross axis in the order of
 * their first node. Previous positions are ignored. Self loops and edges
 * naming unknown nodes play no part. Returned positions are top-left
 * corners.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class LayeredLayout {

    private static final Logger LOG = LoggerFactory.getLogger(
            LayeredLayout.class);

    /** Down and up sweeps of the crossing reduction. */
    private static final int ORDERING_PASSES = 4;

    private LayeredLayout() {
    }

    /**
     * Arranges the nodes.
     *
     * @param nodes the nodes
     * @param edges the edges between them
     * @param options the direction, node size and separations
     * @return the nodes in input order with their new positions
     */
    public static List<FlowNode> layout(final List<FlowNode> nodes,
            final List<FlowEdge> edges, final LayoutOptions options) {
        Preconditions.requireNonNull(nodes, "Nodes are required");
        Preconditions.requireNonNull(edges, "Edges are required");
        Preconditions.requireNonNull(options, "Options are required");
        if (nodes.isEmpty()) {
            return List.of();
        }

        final LayeredGraph graph = LayeredGraph.of(nodes, edges);
        final Map<String, Position> positions = new HashMap<>();

        double crossOffset = 0;
        int parts = 0;
        for (final List<String> component : graph.components()) {
            final List<List<String>> layers = order(graph,
                    rank(graph, component));
            crossOffset = place(layers, options, crossOffset, positions)
                    + options.nodeSeparation();
            parts++;
        }

        final List<FlowNode> result = new ArrayList<>(nodes.size());
        for (final FlowNode node : nodes) {
            result.add(node.withPosition(positions.get(node.id())));
        }
        LOG.debug("Laid out {} nodes in {} connected parts", nodes.size(),
                parts);
        return result;
    }

    // -- Ranking -------------------------------------------------------------

    /**
     * Ranks one connected part by longest path over its acyclic edges.
     *
     * @return the node ids of each rank, in topological discovery order
     */
    private static List<List<String>> rank(final LayeredGraph graph,
            final List<String> component) {
        final Map<String, List<String>> acyclic = breakCycles(graph,
                component);

        final Map<String, Integer> inDegree = new HashMap<>();
        for (final String id : component) {
            inDegree.putIfAbsent(id, 0);
            for (final String target : acyclic.get(id)) {
                inDegree.merge(target, 1, Integer::sum);
            }
        }

        final Map<String, Integer> ranks = new LinkedHashMap<>();
        final Queue<String> queue = new ArrayDeque<>();
        for (final String id : component) {
            if (inDegree.get(id) == 0) {
                queue.add(id);
                ranks.put(id, 0);
            }
        }
        final List<String> topological = new ArrayList<>(component.size());
        while (!queue.isEmpty()) {
            final String current = queue.poll();
            topological.add(current);
            final int next = ranks.get(current) + 1;
            for (final String target : acyclic.get(current)) {
                ranks.merge(target, next, Math::max);
                if (inDegree.merge(target, -1, Integer::sum) == 0) {
                    queue.add(target);
                }
            }
        }

        final List<List<String>> layers = new ArrayList<>();
        for (final String id : topological) {
            final int rank = ranks.get(id);
            while (layers.size() <= rank) {
                layers.add(new ArrayList<>());
            }
            layers.get(rank).add(id);
        }
        return layers;
    }

    /**
     * Walks depth first from the roots and keeps every edge except those
     * pointing back at a node still on the walk.
     *
     * @return the acyclic successors of each node of the part
     */
    private static Map<String, List<String>> breakCycles(
            final LayeredGraph graph, final List<String> component) {
        final Map<String, List<String>> acyclic = new HashMap<>();
        for (final String id : component) {
            acyclic.put(id, new ArrayList<>());
        }

        final Set<String> done = new HashSet<>();
        final Set<String> onStack = new HashSet<>();
        final Map<String, Integer> nextEdge = new HashMap<>();

        for (final String root : roots(graph, component)) {
            if (done.contains(root)) {
                continue;
            }
            final Deque<String> stack = new ArrayDeque<>();
            stack.push(root);
            onStack.add(root);

            while (!stack.isEmpty()) {
                final String current = stack.peek();
                final List<String> successors = graph.successors(current);
                final int index = nextEdge.getOrDefault(current, 0);
                if (index >= successors.size()) {
                    stack.pop();
                    onStack.remove(current);
                    done.add(current);
                    continue;
                }
                nextEdge.put(current, index + 1);

                final String target = successors.get(index);
                if (onStack.contains(target)) {
                    continue;
                }
                acyclic.get(current).add(target);
                if (!done.contains(target)) {
                    stack.push(target);
                    onStack.add(target);
                }
            }
        }
        return acyclic;
    }

    private static List<String> roots(final LayeredGraph graph,
            final List<String> component) {
        final Set<String> roots = new LinkedHashSet<>();
        for (final String id : component) {
            if (graph.isStart(id)) {
                roots.add(id);
            }
        }
        for (final String id : component) {
            if (graph.predecessors(id).isEmpty()) {
                roots.add(id);
            }
        }
        roots.addAll(component);
        return new ArrayList<>(roots);
    }

    // -- Ordering ------------------------------------------------------------

    /**
     * Reorders each rank by the mean index of its neighbours in the ranks
     * already swept, alternating downward and upward sweeps.
     */
    private static List<List<String>> order(final LayeredGraph graph,
            final List<List<String>> layers) {
        final Map<String, Integer> rankOf = new HashMap<>();
        final Map<String, Integer> indexOf = new HashMap<>();
        for (int r = 0; r < layers.size(); r++) {
            for (int i = 0; i < layers.get(r).size(); i++) {
                rankOf.put(layers.get(r).get(i), r);
                indexOf.put(layers.get(r).get(i), i);
            }
        }

        for (int pass = 0; pass < ORDERING_PASSES; pass++) {
            final boolean downward = pass % 2 == 0;
            if (downward) {
                for (int r = 1; r < layers.size(); r++) {
                    sortLayer(layers.get(r), graph, rankOf, indexOf, true);
                }
            } else {
                for (int r = layers.size() - 2; r >= 0; r--) {
                    sortLayer(layers.get(r), graph, rankOf, indexOf, false);
                }
            }
        }
        return layers;
    }

    private static void sortLayer(final List<String> layer,
            final LayeredGraph graph, final Map<String, Integer> rankOf,
            final Map<String, Integer> indexOf, final boolean downward) {
        if (layer.isEmpty()) {
            return;
        }
        final int rank = rankOf.get(layer.get(0));
        final Map<String, Double> barycenter = new HashMap<>();

        for (final String id : layer) {
            final List<String> neighbours = downward
                    ? graph.predecessors(id)
                    : graph.successors(id);
            double sum = 0;
            int count = 0;
            for (final String neighbour : neighbours) {
                final Integer neighbourRank = rankOf.get(neighbour);
                if (neighbourRank == null) {
                    continue;
                }
                final boolean swept = downward
                        ? neighbourRank < rank
                        : neighbourRank > rank;
                if (swept) {
                    sum += indexOf.get(neighbour);
                    count++;
                }
            }
            barycenter.put(id, count == 0
                    ? indexOf.get(id)
                    : sum / count);
        }

        layer.sort(Comparator
                .comparingDouble((String id) -> barycenter.get(id))
                .thenComparingInt(indexOf::get));
        for (int i = 0; i < layer.size(); i++) {
            indexOf.put(layer.get(i), i);
        }
    }

    // -- Placement -----------------------------------------------------------

    /**
     * Places one connected part.
     *
     * @return the cross axis coordinate where the part ends
     */
    private static double place(final List<List<String>> layers,
            final LayoutOptions options, final double crossOffset,
            final Map<String, Position> positions) {
        final boolean horizontal = options.direction().isHorizontal();
        final double primarySize = horizontal
                ? options.nodeWidth() : options.nodeHeight();
        final double crossSize = horizontal
                ? options.nodeHeight() : options.nodeWidth();
        final double rankStep = primarySize + options.rankSeparation();
        final double crossStep = crossSize + options.nodeSeparation();

        int widest = 0;
        for (final List<String> layer : layers) {
            widest = Math.max(widest, layer.size());
        }
        final double extent = extent(widest, crossSize, options);

        for (int r = 0; r < layers.size(); r++) {
            final List<String> layer = layers.get(r);
            final double centering = (extent
                    - extent(layer.size(), crossSize, options)) / 2;
            final double primaryCenter = options.margin() + r * rankStep
                    + primarySize / 2;

            for (int i = 0; i < layer.size(); i++) {
                final double crossCenter = options.margin() + crossOffset
                        + centering + i * crossStep + crossSize / 2;
                final double x = horizontal ? primaryCenter : crossCenter;
                final double y = horizontal ? crossCenter : primaryCenter;
                positions.put(layer.get(i), Position.of(
                        x - options.nodeWidth() / 2,
                        y - options.nodeHeight() / 2));
            }
        }
        return crossOffset + extent;
    }

    private static double extent(final int count, final double crossSize,
            final LayoutOptions options) {
        return count == 0 ? 0
                : count * crossSize + (count - 1) * options.nodeSeparation();
    }
}
