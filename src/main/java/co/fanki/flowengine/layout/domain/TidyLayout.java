package co.fanki.flowengine.layout.domain;

import co.fanki.flowengine.flow.domain.FlowNode;
import co.fanki.flowengine.flow.domain.Position;
import co.fanki.flowengine.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Incremental cleanup of a hand-arranged canvas.
 *
 * <p>Unlike {@link LayeredLayout} this keeps the author's arrangement and
 * only moves what it must:</p>
 * <ol>
 *   <li>nodes are sorted in reading order: by a coarse bucket of half a
 *   node along the primary axis, then by the cross axis;</li>
 *   <li>each node is checked against every node before it and pushed
 *   clear of any it overlaps, along the axis needing the smaller move
 *   (the primary axis on a tie);</li>
 *   <li>every coordinate is snapped to the grid;</li>
 *   <li>snapping can bring nodes back together, so each node is advanced
 *   along the primary axis, one grid-aligned step at a time, until it is
 *   clear of every node before it.</li>
 * </ol>
 * <p>Two nodes overlap when their boxes, grown by the minimum gaps, touch.
 * The output never overlaps, every coordinate is a multiple of the grid
 * size, and running the layout on its own output changes nothing.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class TidyLayout {

    private static final Logger LOG = LoggerFactory.getLogger(
            TidyLayout.class);

    private TidyLayout() {
    }

    /**
     * Tidies the nodes.
     *
     * @param nodes the nodes, in any order
     * @param options the node size, gaps, grid and direction
     * @return the nodes in input order with their new positions
     */
    public static List<FlowNode> layout(final List<FlowNode> nodes,
            final TidyOptions options) {
        Preconditions.requireNonNull(nodes, "Nodes are required");
        Preconditions.requireNonNull(options, "Options are required");
        if (nodes.isEmpty()) {
            return List.of();
        }

        final boolean horizontal = options.direction().isHorizontal();
        final int count = nodes.size();
        final double[] xs = new double[count];
        final double[] ys = new double[count];
        for (int i = 0; i < count; i++) {
            xs[i] = nodes.get(i).position().x();
            ys[i] = nodes.get(i).position().y();
        }

        final List<Integer> order = readingOrder(xs, ys, options);

        pushApart(xs, ys, order, options, horizontal);

        for (int i = 0; i < count; i++) {
            xs[i] = snap(xs[i], options.gridSize());
            ys[i] = snap(ys[i], options.gridSize());
        }

        advanceAlongPrimary(xs, ys, order, options, horizontal);

        final List<FlowNode> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            result.add(nodes.get(i).withPosition(Position.of(xs[i], ys[i])));
        }
        LOG.debug("Tidied {} nodes", count);
        return result;
    }

    private static List<Integer> readingOrder(final double[] xs,
            final double[] ys, final TidyOptions options) {
        final boolean horizontal = options.direction().isHorizontal();
        final double[] primary = horizontal ? xs : ys;
        final double[] secondary = horizontal ? ys : xs;
        final double bucketSize = (horizontal
                ? options.nodeWidth() : options.nodeHeight()) / 2;

        final List<Integer> order = new ArrayList<>(xs.length);
        for (int i = 0; i < xs.length; i++) {
            order.add(i);
        }
        order.sort(Comparator
                .comparingDouble((Integer i) ->
                        Math.floor(primary[i] / bucketSize))
                .thenComparingDouble(i -> secondary[i])
                .thenComparingInt(i -> i));
        return order;
    }

    private static void pushApart(final double[] xs, final double[] ys,
            final List<Integer> order, final TidyOptions options,
            final boolean horizontal) {
        final double stepX = options.nodeWidth() + options.minGapX();
        final double stepY = options.nodeHeight() + options.minGapY();

        for (int i = 1; i < order.size(); i++) {
            final int current = order.get(i);
            for (int j = 0; j < i; j++) {
                final int previous = order.get(j);
                if (!overlaps(xs, ys, previous, current, options)) {
                    continue;
                }
                final double pushX = xs[previous] + stepX - xs[current];
                final double pushY = ys[previous] + stepY - ys[current];
                final boolean alongX = horizontal
                        ? pushX <= pushY
                        : pushX < pushY;
                if (alongX) {
                    xs[current] = xs[previous] + stepX;
                } else {
                    ys[current] = ys[previous] + stepY;
                }
            }
        }
    }

    private static void advanceAlongPrimary(final double[] xs,
            final double[] ys, final List<Integer> order,
            final TidyOptions options, final boolean horizontal) {
        final double grid = options.gridSize();
        final double stepX = options.nodeWidth() + options.minGapX();
        final double stepY = options.nodeHeight() + options.minGapY();

        for (int i = 1; i < order.size(); i++) {
            final int current = order.get(i);
            boolean moved = true;
            while (moved) {
                moved = false;
                for (int j = 0; j < i; j++) {
                    final int previous = order.get(j);
                    if (!overlaps(xs, ys, previous, current, options)) {
                        continue;
                    }
                    if (horizontal) {
                        xs[current] = ceil(xs[previous] + stepX, grid);
                    } else {
                        ys[current] = ceil(ys[previous] + stepY, grid);
                    }
                    moved = true;
                }
            }
        }
    }

    /** Boxes grown by the minimum gaps touch. */
    static boolean overlaps(final double[] xs, final double[] ys,
            final int a, final int b, final TidyOptions options) {
        final double w = options.nodeWidth() + options.minGapX();
        final double h = options.nodeHeight() + options.minGapY();
        return !(xs[a] >= xs[b] + w
                || xs[a] + w <= xs[b]
                || ys[a] >= ys[b] + h
                || ys[a] + h <= ys[b]);
    }

    private static double snap(final double value, final double grid) {
        return normalize(Math.round(value / grid) * grid);
    }

    /**
     * Rounds up to a whole number of grid steps. The result is never below
     * the value, even when the division rounds the step count down.
     */
    static double ceil(final double value, final double grid) {
        long steps = (long) Math.ceil(value / grid);
        while (steps * grid < value) {
            steps++;
        }
        return normalize(steps * grid);
    }

    /** Avoids -0.0 leaking into positions. */
    private static double normalize(final double value) {
        return value == 0 ? 0 : value;
    }
}
