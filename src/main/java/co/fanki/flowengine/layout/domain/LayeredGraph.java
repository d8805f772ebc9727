package co.fanki.flowengine.layout.domain;

import co.fanki.flowengine.flow.domain.FlowEdge;
import co.fanki.flowengine.flow.domain.FlowNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

/**
 * The adjacency {@link LayeredLayout} works on: distinct node ids in input
 * order, and the distinct edges between two different known nodes.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class LayeredGraph {

    private final Map<String, FlowNode> nodes;
    private final Map<String, Set<String>> successors;
    private final Map<String, Set<String>> predecessors;

    private LayeredGraph(final Map<String, FlowNode> theNodes,
            final Map<String, Set<String>> theSuccessors,
            final Map<String, Set<String>> thePredecessors) {
        this.nodes = theNodes;
        this.successors = theSuccessors;
        this.predecessors = thePredecessors;
    }

    static LayeredGraph of(final List<FlowNode> nodeList,
            final List<FlowEdge> edgeList) {
        final Map<String, FlowNode> nodes = new LinkedHashMap<>();
        final Map<String, Set<String>> successors = new LinkedHashMap<>();
        final Map<String, Set<String>> predecessors = new LinkedHashMap<>();
        for (final FlowNode node : nodeList) {
            if (nodes.putIfAbsent(node.id(), node) == null) {
                successors.put(node.id(), new LinkedHashSet<>());
                predecessors.put(node.id(), new LinkedHashSet<>());
            }
        }
        for (final FlowEdge edge : edgeList) {
            if (edge.source().equals(edge.target())
                    || !nodes.containsKey(edge.source())
                    || !nodes.containsKey(edge.target())) {
                continue;
            }
            successors.get(edge.source()).add(edge.target());
            predecessors.get(edge.target()).add(edge.source());
        }
        return new LayeredGraph(nodes, successors, predecessors);
    }

    List<String> successors(final String id) {
        return new ArrayList<>(successors.get(id));
    }

    List<String> predecessors(final String id) {
        return new ArrayList<>(predecessors.get(id));
    }

    boolean isStart(final String id) {
        return nodes.get(id).isStart();
    }

    /**
     * Splits the nodes into weakly connected parts.
     *
     * @return the parts ordered by their first node, each in input order
     */
    List<List<String>> components() {
        final Set<String> seen = new HashSet<>();
        final List<List<String>> components = new ArrayList<>();

        for (final String id : nodes.keySet()) {
            if (seen.contains(id)) {
                continue;
            }
            final Set<String> members = new HashSet<>();
            final Queue<String> queue = new ArrayDeque<>();
            seen.add(id);
            members.add(id);
            queue.add(id);
            while (!queue.isEmpty()) {
                final String current = queue.poll();
                final List<String> neighbours = new ArrayList<>(
                        successors.get(current));
                neighbours.addAll(predecessors.get(current));
                for (final String neighbour : neighbours) {
                    if (seen.add(neighbour)) {
                        members.add(neighbour);
                        queue.add(neighbour);
                    }
                }
            }
            final List<String> ordered = new ArrayList<>();
            for (final String candidate : nodes.keySet()) {
                if (members.contains(candidate)) {
                    ordered.add(candidate);
                }
            }
            components.add(ordered);
        }
        return components;
    }
}
