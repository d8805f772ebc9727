package co.fanki.flowengine.layout.domain;

import co.fanki.flowengine.shared.Preconditions;

/**
 * Settings of {@link TidyLayout}.
 *
 * @param nodeWidth the width every node is drawn with
 * @param nodeHeight the height every node is drawn with
 * @param minGapX the minimum horizontal gap between two nodes
 * @param minGapY the minimum vertical gap between two nodes
 * @param gridSize the grid every coordinate is snapped to
 * @param direction the reading direction
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record TidyOptions(double nodeWidth, double nodeHeight,
        double minGapX, double minGapY, double gridSize,
        LayoutDirection direction) {

    /** Validates the settings. */
    public TidyOptions {
        Preconditions.requirePositive(nodeWidth,
                "Node width must be positive");
        Preconditions.requirePositive(nodeHeight,
                "Node height must be positive");
        Preconditions.requireNonNegative(minGapX,
                "Horizontal gap cannot be negative");
        Preconditions.requireNonNegative(minGapY,
                "Vertical gap cannot be negative");
        Preconditions.requirePositive(gridSize, "Grid size must be positive");
        Preconditions.requireNonNull(direction, "Direction is required");
    }

    /**
     * 280 by 180 nodes, 40 gaps, a 20 grid, left to right.
     *
     * @return the default settings
     */
    public static TidyOptions defaults() {
        return new TidyOptions(280, 180, 40, 40, 20, LayoutDirection.LR);
    }

    public TidyOptions withDirection(final LayoutDirection newDirection) {
        return new TidyOptions(nodeWidth, nodeHeight, minGapX, minGapY,
                gridSize, newDirection);
    }

    public TidyOptions withGridSize(final double newGridSize) {
        return new TidyOptions(nodeWidth, nodeHeight, minGapX, minGapY,
                newGridSize, direction);
    }
}
