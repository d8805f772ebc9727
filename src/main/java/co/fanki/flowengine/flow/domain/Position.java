package co.fanki.flowengine.flow.domain;

import co.fanki.flowengine.shared.ValueObject;

/**
 * Top-left corner of a node on the editor canvas.
 *
 * @param x the horizontal coordinate
 * @param y the vertical coordinate
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Position(double x, double y) implements ValueObject {

    /** The canvas origin. */
    public static final Position ORIGIN = new Position(0, 0);

    /**
     * Creates a position.
     *
     * @param x the horizontal coordinate
     * @param y the vertical coordinate
     * @return the position
     */
    public static Position of(final double x, final double y) {
        return new Position(x, y);
    }
}
