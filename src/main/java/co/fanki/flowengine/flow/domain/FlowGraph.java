package co.fanki.flowengine.flow.domain;

import co.fanki.flowengine.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of a flow: the node array and the edge array.
 *
 * <p>Every editor action produces a new snapshot; nothing in the engine
 * mutates one. The snapshot keeps both arrays in their declared order
 * (edge order is significant for routing) and indexes them for lookup.
 * It does not enforce any structural invariant: dangling edges, missing
 * start nodes and duplicate default edges are representable, and are
 * reported by {@link FlowValidator}.</p>
 *
 * <p>When two nodes share an id, lookups resolve to the first one.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FlowGraph {

    private static final FlowGraph EMPTY = new FlowGraph(List.of(), List.of());

    private final List<FlowNode> nodes;
    private final List<FlowEdge> edges;

    /** Maps node id to node, first occurrence wins. */
    private final Map<String, FlowNode> nodesById;

    /** Maps node id to its outgoing edges in declared order. */
    private final Map<String, List<FlowEdge>> outgoing;

    /** Maps node id to its incoming edges in declared order. */
    private final Map<String, List<FlowEdge>> incoming;

    private FlowGraph(final List<FlowNode> theNodes,
            final List<FlowEdge> theEdges) {
        this.nodes = List.copyOf(theNodes);
        this.edges = List.copyOf(theEdges);
        this.nodesById = new LinkedHashMap<>();
        for (final FlowNode node : nodes) {
            nodesById.putIfAbsent(node.id(), node);
        }
        this.outgoing = new HashMap<>();
        this.incoming = new HashMap<>();
        for (final FlowEdge edge : edges) {
            outgoing.computeIfAbsent(edge.source(), k -> new ArrayList<>())
                    .add(edge);
            incoming.computeIfAbsent(edge.target(), k -> new ArrayList<>())
                    .add(edge);
        }
    }

    /**
     * Creates a snapshot from the node and edge arrays.
     *
     * @param nodes the nodes in declared order
     * @param edges the edges in declared order
     * @return the snapshot
     */
    public static FlowGraph of(final List<FlowNode> nodes,
            final List<FlowEdge> edges) {
        Preconditions.requireNonNull(nodes, "Nodes are required");
        Preconditions.requireNonNull(edges, "Edges are required");
        return new FlowGraph(nodes, edges);
    }

    /**
     * Returns the snapshot with no nodes and no edges.
     *
     * @return the empty snapshot
     */
    public static FlowGraph empty() {
        return EMPTY;
    }

    // -- Queries -------------------------------------------------------------

    /**
     * Returns the nodes in declared order.
     *
     * @return unmodifiable node list
     */
    public List<FlowNode> nodes() {
        return nodes;
    }

    /**
     * Returns the edges in declared order.
     *
     * @return unmodifiable edge list
     */
    public List<FlowEdge> edges() {
        return edges;
    }

    /**
     * Returns the node with the given id.
     *
     * @param nodeId the node id
     * @return the node, or null if not in this snapshot
     */
    public FlowNode node(final String nodeId) {
        return nodeId == null ? null : nodesById.get(nodeId);
    }

    /**
     * Checks if the snapshot contains a node id.
     *
     * @param nodeId the node id
     * @return true if a node has that id
     */
    public boolean contains(final String nodeId) {
        return nodeId != null && nodesById.containsKey(nodeId);
    }

    /**
     * Returns the distinct node ids in declared order.
     *
     * @return unmodifiable id set
     */
    public Set<String> nodeIds() {
        return Collections.unmodifiableSet(
                new LinkedHashSet<>(nodesById.keySet()));
    }

    /**
     * Returns the edges leaving a node, in declared order.
     *
     * @param nodeId the source node id
     * @return unmodifiable edge list, empty if none
     */
    public List<FlowEdge> outgoing(final String nodeId) {
        final List<FlowEdge> result = outgoing.get(nodeId);
        return result == null ? List.of() : Collections.unmodifiableList(result);
    }

    /**
     * Returns the edges entering a node, in declared order.
     *
     * @param nodeId the target node id
     * @return unmodifiable edge list, empty if none
     */
    public List<FlowEdge> incoming(final String nodeId) {
        final List<FlowEdge> result = incoming.get(nodeId);
        return result == null ? List.of() : Collections.unmodifiableList(result);
    }

    /**
     * Returns the nodes of a type, in declared order.
     *
     * @param type the node type
     * @return the matching nodes
     */
    public List<FlowNode> nodesOfType(final NodeType type) {
        return nodes.stream().filter(n -> n.type() == type).toList();
    }

    public List<FlowNode> startNodes() {
        return nodesOfType(NodeType.START);
    }

    public List<FlowNode> questionNodes() {
        return nodesOfType(NodeType.QUESTION);
    }

    public List<FlowNode> endNodes() {
        return nodesOfType(NodeType.END);
    }

    /**
     * Returns the single start node.
     *
     * @return the first start node, or null if there is none
     */
    public FlowNode startNode() {
        for (final FlowNode node : nodes) {
            if (node.isStart()) {
                return node;
            }
        }
        return null;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    // -- Copies --------------------------------------------------------------

    /**
     * Returns a snapshot with the node added, or replaced when a node with
     * the same id already exists.
     *
     * @param node the node
     * @return the new snapshot
     */
    public FlowGraph withNode(final FlowNode node) {
        Preconditions.requireNonNull(node, "Node is required");
        final List<FlowNode> result = new ArrayList<>(nodes.size() + 1);
        boolean replaced = false;
        for (final FlowNode existing : nodes) {
            if (existing.id().equals(node.id())) {
                result.add(node);
                replaced = true;
            } else {
                result.add(existing);
            }
        }
        if (!replaced) {
            result.add(node);
        }
        return new FlowGraph(result, edges);
    }

    /**
     * Returns a snapshot without the node and without every edge attached
     * to it.
     *
     * @param nodeId the node id
     * @return the new snapshot
     */
    public FlowGraph withoutNode(final String nodeId) {
        final List<FlowNode> keptNodes = nodes.stream()
                .filter(n -> !n.id().equals(nodeId))
                .toList();
        final List<FlowEdge> keptEdges = edges.stream()
                .filter(e -> !e.source().equals(nodeId)
                        && !e.target().equals(nodeId))
                .toList();
        return new FlowGraph(keptNodes, keptEdges);
    }

    /**
     * Returns a snapshot with the edge appended, or replaced in place when
     * an edge with the same id already exists.
     *
     * @param edge the edge
     * @return the new snapshot
     */
    public FlowGraph withEdge(final FlowEdge edge) {
        Preconditions.requireNonNull(edge, "Edge is required");
        final List<FlowEdge> result = new ArrayList<>(edges.size() + 1);
        boolean replaced = false;
        for (final FlowEdge existing : edges) {
            if (existing.id().equals(edge.id())) {
                result.add(edge);
                replaced = true;
            } else {
                result.add(existing);
            }
        }
        if (!replaced) {
            result.add(edge);
        }
        return new FlowGraph(nodes, result);
    }

    /**
     * Returns a snapshot without the edge.
     *
     * @param edgeId the edge id
     * @return the new snapshot
     */
    public FlowGraph withoutEdge(final String edgeId) {
        return new FlowGraph(nodes, edges.stream()
                .filter(e -> !e.id().equals(edgeId))
                .toList());
    }

    /**
     * Returns a snapshot where a question lost one of its options, along
     * with every edge routed through that option's handle.
     *
     * @param nodeId the question node id
     * @param optionId the option id
     * @return the new snapshot, or this one if there is no such option
     */
    public FlowGraph withoutOption(final String nodeId,
            final String optionId) {
        final FlowNode node = node(nodeId);
        if (node == null || node.questionData() == null
                || !node.questionData().hasOption(optionId)) {
            return this;
        }
        final QuestionNodeData question = node.questionData();
        final List<QuestionOption> keptOptions = question.options().stream()
                .filter(o -> !o.id().equals(optionId))
                .toList();
        final FlowNode edited = node.withData(
                question.withOptions(keptOptions));

        final List<FlowNode> keptNodes = nodes.stream()
                .map(n -> n.id().equals(nodeId) ? edited : n)
                .toList();
        final List<FlowEdge> keptEdges = edges.stream()
                .filter(e -> !(e.source().equals(nodeId)
                        && optionId.equals(e.sourceHandle())))
                .toList();
        return new FlowGraph(keptNodes, keptEdges);
    }

    /**
     * Returns a snapshot with the given nodes replacing those of the same
     * id, keeping declared order and edges.
     *
     * @param positioned the repositioned nodes
     * @return the new snapshot
     */
    public FlowGraph withNodePositions(final List<FlowNode> positioned) {
        final Map<String, FlowNode> byId = new HashMap<>();
        for (final FlowNode node : positioned) {
            byId.putIfAbsent(node.id(), node);
        }
        return new FlowGraph(nodes.stream()
                .map(n -> byId.getOrDefault(n.id(), n))
                .toList(), edges);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FlowGraph)) {
            return false;
        }
        final FlowGraph that = (FlowGraph) o;
        return nodes.equals(that.nodes) && edges.equals(that.edges);
    }

    @Override
    public int hashCode() {
        return 31 * nodes.hashCode() + edges.hashCode();
    }

    @Override
    public String toString() {
        return "FlowGraph{nodes=" + nodes.size()
                + ", edges=" + edges.size() + "}";
    }
}
