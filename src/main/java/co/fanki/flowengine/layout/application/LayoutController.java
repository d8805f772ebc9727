package co.fanki.flowengine.layout.application;

import co.fanki.flowengine.flow.domain.FlowJsonCodec;
import co.fanki.flowengine.flow.domain.FlowNode;
import co.fanki.flowengine.shared.DomainException;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for arranging flow canvases.
 *
 * <p>Both endpoints answer with the request's nodes, in request order,
 * carrying their new positions.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/layout")
@Tag(name = "Layout", description = "Auto-arrange flow canvases")
public class LayoutController {

    private static final Logger LOG = LoggerFactory.getLogger(
            LayoutController.class);

    private final LayoutService layoutService;

    /**
     * Creates a new LayoutController.
     *
     * @param theLayoutService the layout service
     */
    public LayoutController(final LayoutService theLayoutService) {
        this.layoutService = theLayoutService;
    }

    /**
     * Runs the layered auto-arrange.
     *
     * @param request the nodes, edges and optional overrides
     * @return the arranged nodes
     */
    @PostMapping("/full")
    @Operation(summary = "Auto-arrange",
            description = "Lays the flow out in ranks from the start node,"
                    + " ignoring the current positions")
    public ResponseEntity<?> full(@RequestBody final FullLayoutRequest request) {

        try {
            final List<FlowNode> nodes = layoutService.arrange(
                    FlowJsonCodec.readNodes(request.nodes()),
                    FlowJsonCodec.readEdges(request.edges()),
                    request.direction(), request.nodeWidth(),
                    request.nodeHeight());
            return ResponseEntity.ok(Map.of("nodes",
                    FlowJsonCodec.writeNodes(nodes)));
        } catch (final DomainException e) {
            LOG.warn("Layout failed: {}", e.getMessage());
            return ResponseEntity.badRequest().body(
                    Map.of("error", e.getMessage(),
                            "errorCode", e.getErrorCode()));
        }
    }

    /**
     * Tidies the current arrangement.
     *
     * @param request the nodes and optional overrides
     * @return the tidied nodes
     */
    @PostMapping("/tidy")
    @Operation(summary = "Tidy up",
            description = "Removes overlaps and snaps to the grid while"
                    + " keeping the current arrangement")
    public ResponseEntity<?> tidy(@RequestBody final TidyRequest request) {

        try {
            final List<FlowNode> nodes = layoutService.tidy(
                    FlowJsonCodec.readNodes(request.nodes()),
                    request.direction(), request.gridSize());
            return ResponseEntity.ok(Map.of("nodes",
                    FlowJsonCodec.writeNodes(nodes)));
        } catch (final DomainException e) {
            LOG.warn("Tidy failed: {}", e.getMessage());
            return ResponseEntity.badRequest().body(
                    Map.of("error", e.getMessage(),
                            "errorCode", e.getErrorCode()));
        }
    }

    /**
     * Request body for the layered auto-arrange.
     *
     * @param nodes the stored node array
     * @param edges the stored edge array
     * @param direction TB or LR, may be absent
     * @param nodeWidth the node width, may be absent
     * @param nodeHeight the node height, may be absent
     */
    public record FullLayoutRequest(JsonNode nodes, JsonNode edges,
            String direction, Double nodeWidth, Double nodeHeight) {}

    /**
     * Request body for the tidy cleanup.
     *
     * @param nodes the stored node array
     * @param direction TB or LR, may be absent
     * @param gridSize the grid unit, may be absent
     */
    public record TidyRequest(JsonNode nodes, String direction,
            Double gridSize) {}
}
