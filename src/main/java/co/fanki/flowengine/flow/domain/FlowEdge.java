package co.fanki.flowengine.flow.domain;

import co.fanki.flowengine.shared.Preconditions;

/**
 * A directed transition between two screens.
 *
 * <p>An edge is routed in one of three ways: through an option handle
 * ({@code sourceHandle} names an option id of the source question), through
 * a {@code condition} on the answer, or, when it has neither, as the
 * default edge of its source.</p>
 *
 * @param id the edge id
 * @param source the source node id
 * @param target the target node id
 * @param sourceHandle the option id this edge routes, or null
 * @param condition the answer predicate, or null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FlowEdge(String id, String source, String target,
        String sourceHandle, EdgeCondition condition) {

    /** Validates the edge shape. Endpoints are checked by the validator. */
    public FlowEdge {
        Preconditions.requireNonBlank(id, "Edge id is required");
        Preconditions.requireNonBlank(source, "Edge source is required");
        Preconditions.requireNonBlank(target, "Edge target is required");
        if (sourceHandle != null && sourceHandle.isBlank()) {
            sourceHandle = null;
        }
    }

    /**
     * Creates an unconditioned edge.
     *
     * @param id the edge id
     * @param source the source node id
     * @param target the target node id
     * @return the default edge
     */
    public static FlowEdge of(final String id, final String source,
            final String target) {
        return new FlowEdge(id, source, target, null, null);
    }

    /** Whether this edge has neither a handle nor a condition. */
    public boolean isDefault() {
        return sourceHandle == null && condition == null;
    }

    public boolean hasHandle() {
        return sourceHandle != null;
    }

    public boolean hasCondition() {
        return condition != null;
    }

    /**
     * Returns a copy gated by another condition.
     *
     * @param newCondition the condition, null to remove it
     * @return the copy
     */
    public FlowEdge withCondition(final EdgeCondition newCondition) {
        return new FlowEdge(id, source, target, sourceHandle, newCondition);
    }
}
