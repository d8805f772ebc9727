package co.fanki.flowengine.layout.application;

import co.fanki.flowengine.flow.domain.FlowEdge;
import co.fanki.flowengine.flow.domain.FlowNode;
import co.fanki.flowengine.layout.domain.LayeredLayout;
import co.fanki.flowengine.layout.domain.LayoutDirection;
import co.fanki.flowengine.layout.domain.LayoutOptions;
import co.fanki.flowengine.layout.domain.TidyLayout;
import co.fanki.flowengine.layout.domain.TidyOptions;
import co.fanki.flowengine.shared.DomainException;
import co.fanki.flowengine.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Arranges flow canvases with the configured defaults, optionally
 * overridden per request.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class LayoutService {

    private static final Logger LOG = LoggerFactory.getLogger(
            LayoutService.class);

    private final LayoutOptions layoutOptions;

    private final TidyOptions tidyOptions;

    /**
     * Creates a new LayoutService.
     *
     * @param theLayoutOptions the layered layout defaults
     * @param theTidyOptions the tidy layout defaults
     */
    public LayoutService(final LayoutOptions theLayoutOptions,
            final TidyOptions theTidyOptions) {
        this.layoutOptions = Preconditions.requireNonNull(theLayoutOptions,
                "Layout options are required");
        this.tidyOptions = Preconditions.requireNonNull(theTidyOptions,
                "Tidy options are required");
    }

    /**
     * Runs the full layered auto-arrange.
     *
     * @param nodes the nodes
     * @param edges the edges
     * @param direction TB or LR, null for the configured direction
     * @param nodeWidth the node width, null for the configured one
     * @param nodeHeight the node height, null for the configured one
     * @return the nodes with their new positions
     * @throws DomainException if an override is not valid
     */
    public List<FlowNode> arrange(final List<FlowNode> nodes,
            final List<FlowEdge> edges, final String direction,
            final Double nodeWidth, final Double nodeHeight) {

        LayoutOptions options = layoutOptions;
        try {
            if (direction != null) {
                options = options.withDirection(
                        LayoutDirection.fromCode(direction));
            }
            if (nodeWidth != null || nodeHeight != null) {
                options = options.withNodeSize(
                        nodeWidth != null ? nodeWidth : options.nodeWidth(),
                        nodeHeight != null ? nodeHeight : options.nodeHeight());
            }
        } catch (final IllegalArgumentException e) {
            throw new DomainException(e.getMessage(),
                    DomainException.INVALID_LAYOUT, e);
        }

        LOG.info("Arranging {} nodes and {} edges {}", nodes.size(),
                edges.size(), options.direction());
        return LayeredLayout.layout(nodes, edges, options);
    }

    /**
     * Pushes overlapping nodes apart and snaps them to the grid.
     *
     * @param nodes the nodes
     * @param direction TB or LR, null for the configured direction
     * @param gridSize the grid unit, null for the configured one
     * @return the nodes with their new positions
     * @throws DomainException if an override is not valid
     */
    public List<FlowNode> tidy(final List<FlowNode> nodes,
            final String direction, final Double gridSize) {

        TidyOptions options = tidyOptions;
        try {
            if (direction != null) {
                options = options.withDirection(
                        LayoutDirection.fromCode(direction));
            }
            if (gridSize != null) {
                options = options.withGridSize(gridSize);
            }
        } catch (final IllegalArgumentException e) {
            throw new DomainException(e.getMessage(),
                    DomainException.INVALID_LAYOUT, e);
        }

        LOG.info("Tidying {} nodes on a {} grid", nodes.size(),
                options.gridSize());
        return TidyLayout.layout(nodes, options);
    }
}
