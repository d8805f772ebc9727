package co.fanki.flowengine.flow.domain;

import co.fanki.flowengine.shared.DomainException;

import java.util.Locale;

/**
 * Which side of a node {@link GraphTraversal#connectedBranch} highlights.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum BranchMode {

    /** Everything reachable from the node plus everything leading to it. */
    FULL,

    /** Everything reachable from the node. */
    DOWNSTREAM,

    /** Everything leading to the node. */
    UPSTREAM;

    /**
     * Resolves a mode from its name, ignoring case.
     *
     * @param name the mode name, null means {@link #FULL}
     * @return the mode
     * @throws DomainException if the name is unknown
     */
    public static BranchMode fromName(final String name) {
        if (name == null || name.isBlank()) {
            return FULL;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            throw new DomainException("Unknown branch mode: " + name,
                    DomainException.INVALID_FLOW_JSON, e);
        }
    }
}
