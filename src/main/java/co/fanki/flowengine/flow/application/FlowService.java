package co.fanki.flowengine.flow.application;

import co.fanki.flowengine.flow.domain.AnswerPipes;
import co.fanki.flowengine.flow.domain.AnswerValue;
import co.fanki.flowengine.flow.domain.BranchMode;
import co.fanki.flowengine.flow.domain.ConnectedBranch;
import co.fanki.flowengine.flow.domain.FlowGraph;
import co.fanki.flowengine.flow.domain.FlowNode;
import co.fanki.flowengine.flow.domain.FlowOutline;
import co.fanki.flowengine.flow.domain.FlowRouter;
import co.fanki.flowengine.flow.domain.FlowValidator;
import co.fanki.flowengine.flow.domain.GraphTraversal;
import co.fanki.flowengine.flow.domain.OutlineBuildResult;
import co.fanki.flowengine.flow.domain.OutlineFlowBuilder;
import co.fanki.flowengine.flow.domain.RouteResult;
import co.fanki.flowengine.flow.domain.ScoreCalculator;
import co.fanki.flowengine.flow.domain.ValidationReport;
import co.fanki.flowengine.shared.DomainException;
import co.fanki.flowengine.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Application service over the flow domain.
 *
 * <p>Each call works on the snapshot it is given; nothing is kept between
 * calls.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class FlowService {

    private static final Logger LOG = LoggerFactory.getLogger(
            FlowService.class);

    private final OutlineFlowBuilder outlineFlowBuilder;

    /**
     * Creates a new FlowService.
     *
     * @param theOutlineFlowBuilder the builder of flows from outlines
     */
    public FlowService(final OutlineFlowBuilder theOutlineFlowBuilder) {
        this.outlineFlowBuilder = Preconditions.requireNonNull(
                theOutlineFlowBuilder, "Outline builder is required");
    }

    /**
     * Validates a flow before it is published.
     *
     * @param graph the flow snapshot
     * @return the validation report
     */
    public ValidationReport validate(final FlowGraph graph) {
        final ValidationReport report = FlowValidator.report(graph);
        LOG.info("Validated flow with {} nodes: {} errors, {} warnings",
                graph.nodeCount(), report.errors().size(),
                report.warnings().size());
        return report;
    }

    /**
     * Decides the screen that follows an answer.
     *
     * @param graph the flow snapshot
     * @param currentNodeId the node just answered
     * @param answer the answer, may be null
     * @return the routing outcome
     * @throws DomainException if no node id is given
     */
    public RouteResult next(final FlowGraph graph, final String currentNodeId,
            final AnswerValue answer) {
        final RouteResult result = FlowRouter.nextNode(graph,
                requireNodeId(currentNodeId), answer);
        if (result.outcome() == RouteResult.Outcome.DEAD_END) {
            LOG.warn("No connection matches the answer on node {}",
                    currentNodeId);
        }
        return result;
    }

    /**
     * Pipes earlier answers into a text.
     *
     * @param text the text with pipe tokens
     * @param answers the answers by node id
     * @param fallback the text for missing answers, null for the default
     * @return the resolved text
     */
    public String resolvePipes(final String text,
            final Map<String, AnswerValue> answers, final String fallback) {
        return AnswerPipes.resolve(text, answers,
                fallback == null ? AnswerPipes.DEFAULT_FALLBACK : fallback);
    }

    /**
     * Collects the nodes and edges around a selected node.
     *
     * @param graph the flow snapshot
     * @param nodeId the selected node
     * @param mode the branch mode name, null for the full branch
     * @return the branch
     * @throws DomainException if the mode is unknown or no node id is given
     */
    public ConnectedBranch branch(final FlowGraph graph, final String nodeId,
            final String mode) {
        return GraphTraversal.connectedBranch(graph, requireNodeId(nodeId),
                BranchMode.fromName(mode));
    }

    /**
     * Lists the questions answered before a node can be shown.
     *
     * @param graph the flow snapshot
     * @param nodeId the node whose text pipes answers
     * @return the ancestor question nodes
     * @throws DomainException if no node id is given
     */
    public List<FlowNode> ancestors(final FlowGraph graph,
            final String nodeId) {
        return GraphTraversal.ancestorQuestionNodes(graph,
                requireNodeId(nodeId));
    }

    /**
     * Scores a submission.
     *
     * @param graph the flow snapshot
     * @param answers the answers by node id
     * @return the score and maximum score
     */
    public ScoreCalculator.Score score(final FlowGraph graph,
            final Map<String, AnswerValue> answers) {
        final ScoreCalculator.Score score = ScoreCalculator.calculate(graph,
                answers);
        LOG.info("Scored submission: {}/{}", score.score(), score.maxScore());
        return score;
    }

    /**
     * Builds a laid out flow from a question outline.
     *
     * @param outline the outline
     * @return the flow with its validation report
     * @throws DomainException if the outline cannot be built
     */
    public OutlineBuildResult buildFromOutline(final FlowOutline outline) {
        final OutlineBuildResult result = outlineFlowBuilder.build(outline);
        LOG.info("Built flow '{}' from outline, usable: {}", result.title(),
                result.isUsable());
        return result;
    }

    private static String requireNodeId(final String nodeId) {
        if (nodeId == null || nodeId.isBlank()) {
            throw new DomainException("Node id is required",
                    DomainException.INVALID_REQUEST);
        }
        return nodeId;
    }
}
