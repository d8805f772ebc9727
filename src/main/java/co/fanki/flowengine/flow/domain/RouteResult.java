package co.fanki.flowengine.flow.domain;

import co.fanki.flowengine.shared.Preconditions;

/**
 * Where the respondent goes after a screen.
 *
 * @param outcome the kind of transition
 * @param nodeId the next node, only set when the outcome is
 *        {@link Outcome#NEXT}
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record RouteResult(Outcome outcome, String nodeId) {

    /** The flow is over: an end screen, or a screen with no way out. */
    public static final RouteResult TERMINAL =
            new RouteResult(Outcome.TERMINAL, null);

    /**
     * Edges leave the screen but none accepts the answer; the screen acts
     * as the last one.
     */
    public static final RouteResult DEAD_END =
            new RouteResult(Outcome.DEAD_END, null);

    /** The kinds of transition. */
    public enum Outcome {
        NEXT,
        TERMINAL,
        DEAD_END
    }

    /** Validates that only a NEXT result names a node. */
    public RouteResult {
        Preconditions.requireNonNull(outcome, "Outcome is required");
        Preconditions.require((outcome == Outcome.NEXT) == (nodeId != null),
                "Only a NEXT result carries a node id");
    }

    /**
     * Creates a transition to a node.
     *
     * @param nodeId the next node id
     * @return the result
     */
    public static RouteResult next(final String nodeId) {
        return new RouteResult(Outcome.NEXT, nodeId);
    }

    public boolean hasNext() {
        return outcome == Outcome.NEXT;
    }
}
