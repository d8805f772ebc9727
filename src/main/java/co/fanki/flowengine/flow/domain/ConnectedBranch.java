package co.fanki.flowengine.flow.domain;

import java.util.List;

/**
 * The nodes and edges highlighted around a selected node.
 *
 * @param nodeIds the node ids in discovery order
 * @param edgeIds the ids of edges whose both ends are in {@code nodeIds}
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ConnectedBranch(List<String> nodeIds, List<String> edgeIds) {

    /** Copies both lists. */
    public ConnectedBranch {
        nodeIds = List.copyOf(nodeIds);
        edgeIds = List.copyOf(edgeIds);
    }
}
