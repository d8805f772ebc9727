package co.fanki.flowengine.flow.application;

import co.fanki.flowengine.flow.domain.ConnectedBranch;
import co.fanki.flowengine.flow.domain.FlowGraph;
import co.fanki.flowengine.flow.domain.FlowJsonCodec;
import co.fanki.flowengine.flow.domain.FlowOutline;
import co.fanki.flowengine.flow.domain.OutlineBuildResult;
import co.fanki.flowengine.flow.domain.RouteResult;
import co.fanki.flowengine.flow.domain.ScoreCalculator;
import co.fanki.flowengine.flow.domain.ValidationIssue;
import co.fanki.flowengine.flow.domain.ValidationReport;
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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for working with questionnaire flows.
 *
 * <p>Every request carries the flow as the stored {@code nodes} and
 * {@code edges} arrays; nothing is persisted between requests.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/flows")
@Tag(name = "Flows",
        description = "Validate, route, pipe and score questionnaire flows")
public class FlowController {

    private static final Logger LOG = LoggerFactory.getLogger(
            FlowController.class);

    private final FlowService flowService;

    /**
     * Creates a new FlowController.
     *
     * @param theFlowService the flow service
     */
    public FlowController(final FlowService theFlowService) {
        this.flowService = theFlowService;
    }

    /**
     * Validates a flow.
     *
     * @param request the flow
     * @return whether publishing is blocked, and every issue found
     */
    @PostMapping("/validate")
    @Operation(summary = "Validate a flow",
            description = "Returns the errors that block publishing and the"
                    + " warnings that do not")
    public ResponseEntity<?> validate(
            @RequestBody final GraphRequest request) {

        try {
            final ValidationReport report = flowService.validate(
                    FlowJsonCodec.readGraph(request.nodes(), request.edges()));
            return ResponseEntity.ok(reportBody(report));
        } catch (final DomainException e) {
            return badRequest("Flow validation failed", e);
        }
    }

    /**
     * Routes a respondent to the next screen.
     *
     * @param request the flow, the current node and the answer
     * @return the outcome and the next node id when there is one
     */
    @PostMapping("/next")
    @Operation(summary = "Next screen",
            description = "Picks the screen that follows an answer: the"
                    + " chosen option's connection, then a matching"
                    + " condition, then the default connection")
    public ResponseEntity<?> next(@RequestBody final NextRequest request) {

        LOG.info("Routing from node {}", request.currentNodeId());

        try {
            final RouteResult result = flowService.next(
                    FlowJsonCodec.readGraph(request.nodes(), request.edges()),
                    request.currentNodeId(),
                    FlowJsonCodec.readAnswer(request.answer()));

            final Map<String, Object> body = new LinkedHashMap<>();
            body.put("outcome", result.outcome().name());
            body.put("nodeId", result.nodeId());
            return ResponseEntity.ok(body);
        } catch (final DomainException e) {
            return badRequest("Routing failed", e);
        }
    }

    /**
     * Pipes earlier answers into a text.
     *
     * @param request the text, the answers and an optional fallback
     * @return the resolved text
     */
    @PostMapping("/pipes/resolve")
    @Operation(summary = "Resolve answer pipes",
            description = "Replaces {{nodeId:label}} tokens with the"
                    + " respondent's answers")
    public ResponseEntity<?> resolvePipes(
            @RequestBody final PipesRequest request) {

        try {
            final Map<String, Object> body = new LinkedHashMap<>();
            body.put("text", flowService.resolvePipes(request.text(),
                    FlowJsonCodec.readAnswers(request.answers()),
                    request.fallback()));
            return ResponseEntity.ok(body);
        } catch (final DomainException e) {
            return badRequest("Pipe resolution failed", e);
        }
    }

    /**
     * Collects the branch around a node.
     *
     * @param request the flow, the node and the branch mode
     * @return the node and edge ids of the branch
     */
    @PostMapping("/branch")
    @Operation(summary = "Connected branch",
            description = "Nodes and edges downstream, upstream or both ways"
                    + " from the selected node")
    public ResponseEntity<?> branch(@RequestBody final BranchRequest request) {

        try {
            final ConnectedBranch branch = flowService.branch(
                    FlowJsonCodec.readGraph(request.nodes(), request.edges()),
                    request.nodeId(), request.mode());
            return ResponseEntity.ok(Map.of(
                    "nodeIds", branch.nodeIds(),
                    "edgeIds", branch.edgeIds()));
        } catch (final DomainException e) {
            return badRequest("Branch lookup failed", e);
        }
    }

    /**
     * Lists the questions answered before a node.
     *
     * @param request the flow and the node
     * @return the ancestor question nodes in stored form
     */
    @PostMapping("/ancestors")
    @Operation(summary = "Ancestor questions",
            description = "Questions whose answers may be piped into the"
                    + " selected node's text")
    public ResponseEntity<?> ancestors(
            @RequestBody final NodeRequest request) {

        try {
            return ResponseEntity.ok(FlowJsonCodec.writeNodes(
                    flowService.ancestors(FlowJsonCodec.readGraph(
                            request.nodes(), request.edges()),
                            request.nodeId())));
        } catch (final DomainException e) {
            return badRequest("Ancestor lookup failed", e);
        }
    }

    /**
     * Scores a submission.
     *
     * @param request the flow and the answers
     * @return the score and the maximum score
     */
    @PostMapping("/score")
    @Operation(summary = "Score a submission",
            description = "Adds up the points earned over the scored"
                    + " questions")
    public ResponseEntity<?> score(@RequestBody final ScoreRequest request) {

        try {
            final ScoreCalculator.Score score = flowService.score(
                    FlowJsonCodec.readGraph(request.nodes(), request.edges()),
                    FlowJsonCodec.readAnswers(request.answers()));
            return ResponseEntity.ok(Map.of(
                    "score", score.score(),
                    "maxScore", score.maxScore()));
        } catch (final DomainException e) {
            return badRequest("Scoring failed", e);
        }
    }

    /**
     * Builds a flow from a question outline.
     *
     * @param outline the outline
     * @return the laid out flow with its validation issues
     */
    @PostMapping("/outline")
    @Operation(summary = "Build a flow from an outline",
            description = "Chains the outlined questions, applies the branch"
                    + " hints, arranges the result and validates it")
    public ResponseEntity<?> outline(@RequestBody final FlowOutline outline) {

        LOG.info("Building flow from outline '{}'", outline.title());

        try {
            final OutlineBuildResult result =
                    flowService.buildFromOutline(outline);

            final Map<String, Object> body = new LinkedHashMap<>();
            body.put("title", result.title());
            body.put("description", result.description());
            body.put("nodes", FlowJsonCodec.writeNodes(result.graph().nodes()));
            body.put("edges", FlowJsonCodec.writeEdges(result.graph().edges()));
            body.putAll(reportBody(result.report()));
            return ResponseEntity.ok(body);
        } catch (final DomainException e) {
            return badRequest("Outline build failed", e);
        }
    }

    // -- Helpers -------------------------------------------------------------

    private static Map<String, Object> reportBody(
            final ValidationReport report) {
        final List<Map<String, Object>> issues = new ArrayList<>();
        for (final ValidationIssue issue : report.issues()) {
            final Map<String, Object> json = new LinkedHashMap<>();
            json.put("severity", issue.severity().name());
            json.put("nodeId", issue.nodeId());
            json.put("edgeId", issue.edgeId());
            json.put("message", issue.message());
            issues.add(json);
        }
        final Map<String, Object> body = new LinkedHashMap<>();
        body.put("blocking", report.isBlocking());
        body.put("issues", issues);
        return body;
    }

    private static ResponseEntity<?> badRequest(final String what,
            final DomainException e) {
        LOG.warn("{}: {}", what, e.getMessage());
        return ResponseEntity.badRequest().body(
                Map.of("error", e.getMessage(),
                        "errorCode", e.getErrorCode()));
    }

    // -- Requests ------------------------------------------------------------

    /**
     * Request body carrying a flow.
     *
     * @param nodes the stored node array
     * @param edges the stored edge array
     */
    public record GraphRequest(JsonNode nodes, JsonNode edges) {}

    /**
     * Request body for routing.
     *
     * @param nodes the stored node array
     * @param edges the stored edge array
     * @param currentNodeId the node being left
     * @param answer the answer given on it, may be absent
     */
    public record NextRequest(JsonNode nodes, JsonNode edges,
            String currentNodeId, JsonNode answer) {}

    /**
     * Request body for pipe resolution.
     *
     * @param text the text with pipe tokens
     * @param answers the answers keyed by node id
     * @param fallback the text for missing answers, may be absent
     */
    public record PipesRequest(String text, JsonNode answers,
            String fallback) {}

    /**
     * Request body for branch lookups.
     *
     * @param nodes the stored node array
     * @param edges the stored edge array
     * @param nodeId the selected node
     * @param mode full, downstream or upstream
     */
    public record BranchRequest(JsonNode nodes, JsonNode edges,
            String nodeId, String mode) {}

    /**
     * Request body naming a node of a flow.
     *
     * @param nodes the stored node array
     * @param edges the stored edge array
     * @param nodeId the selected node
     */
    public record NodeRequest(JsonNode nodes, JsonNode edges,
            String nodeId) {}

    /**
     * Request body for scoring.
     *
     * @param nodes the stored node array
     * @param edges the stored edge array
     * @param answers the answers keyed by node id
     */
    public record ScoreRequest(JsonNode nodes, JsonNode edges,
            JsonNode answers) {}
}
