package co.fanki.flowengine.layout.domain;

import co.fanki.flowengine.shared.Preconditions;

/**
 * Settings of {@link LayeredLayout}.
 *
 * @param direction the axis ranks grow along
 * @param nodeWidth the width every node is drawn with
 * @param nodeHeight the height every node is drawn with
 * @param rankSeparation the gap between two consecutive ranks
 * @param nodeSeparation the gap between two nodes of the same rank
 * @param margin the gap between the canvas origin and the drawing
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record LayoutOptions(LayoutDirection direction, double nodeWidth,
        double nodeHeight, double rankSeparation, double nodeSeparation,
        double margin) {

    /** Validates the settings. */
    public LayoutOptions {
        Preconditions.requireNonNull(direction, "Direction is required");
        Preconditions.requirePositive(nodeWidth,
                "Node width must be positive");
        Preconditions.requirePositive(nodeHeight,
                "Node height must be positive");
        Preconditions.requireNonNegative(rankSeparation,
                "Rank separation cannot be negative");
        Preconditions.requireNonNegative(nodeSeparation,
                "Node separation cannot be negative");
        Preconditions.requireNonNegative(margin, "Margin cannot be negative");
    }

    /**
     * Left to right, 280 by 180 nodes, ranks 80 apart, nodes 50 apart and
     * a margin of 40.
     *
     * @return the default settings
     */
    public static LayoutOptions defaults() {
        return new LayoutOptions(LayoutDirection.LR, 280, 180, 80, 50, 40);
    }

    public LayoutOptions withDirection(final LayoutDirection newDirection) {
        return new LayoutOptions(newDirection, nodeWidth, nodeHeight,
                rankSeparation, nodeSeparation, margin);
    }

    public LayoutOptions withSeparations(final double newRankSeparation,
            final double newNodeSeparation) {
        return new LayoutOptions(direction, nodeWidth, nodeHeight,
                newRankSeparation, newNodeSeparation, margin);
    }

    public LayoutOptions withNodeSize(final double width,
            final double height) {
        return new LayoutOptions(direction, width, height, rankSeparation,
                nodeSeparation, margin);
    }
}
