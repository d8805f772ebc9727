package co.fanki.flowengine.flow.domain;

import co.fanki.flowengine.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides which screen follows the current one.
 *
 * <p>Edges leaving the current node are considered in this order:</p>
 * <ol>
 *   <li>on an option-bearing question, the first edge whose handle is one
 *   of the chosen options;</li>
 *   <li>the first edge, in declared order, whose condition accepts the
 *   answer;</li>
 *   <li>the first default edge.</li>
 * </ol>
 * <p>An end node, a node with no outgoing edges or an unknown node is
 * {@link RouteResult#TERMINAL}. When edges exist but none applies the
 * result is {@link RouteResult#DEAD_END}. Edges pointing at nodes that are
 * not in the graph are never taken. Routing never throws for a well-typed
 * graph.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FlowRouter {

    private static final Logger LOG = LoggerFactory.getLogger(
            FlowRouter.class);

    private FlowRouter() {
    }

    /**
     * Routes from a node given the answer recorded there.
     *
     * @param graph the flow snapshot
     * @param currentNodeId the screen being left
     * @param answer the answer given on it, null when there is none (the
     *        start screen)
     * @return the transition
     */
    public static RouteResult nextNode(final FlowGraph graph,
            final String currentNodeId, final AnswerValue answer) {
        Preconditions.requireNonNull(graph, "Graph is required");

        final FlowNode current = graph.node(currentNodeId);
        if (current == null || current.isEnd()) {
            return RouteResult.TERMINAL;
        }
        final List<FlowEdge> edges = graph.outgoing(currentNodeId);
        if (edges.isEmpty()) {
            return RouteResult.TERMINAL;
        }

        if (answer != null && current.isOptionBearing()) {
            final Set<String> chosen = chosenOptionIds(current, answer);
            for (final FlowEdge edge : edges) {
                if (edge.hasHandle() && chosen.contains(edge.sourceHandle())
                        && graph.contains(edge.target())) {
                    return RouteResult.next(edge.target());
                }
            }
        }

        for (final FlowEdge edge : edges) {
            if (!edge.hasHandle() && edge.hasCondition()
                    && graph.contains(edge.target())
                    && ConditionEvaluator.matches(edge.condition(), answer)) {
                return RouteResult.next(edge.target());
            }
        }

        for (final FlowEdge edge : edges) {
            if (edge.isDefault() && graph.contains(edge.target())) {
                return RouteResult.next(edge.target());
            }
        }

        LOG.debug("Dead end at node {}: none of its {} edges accepts the"
                + " answer", currentNodeId, edges.size());
        return RouteResult.DEAD_END;
    }

    /**
     * Resolves the option ids an answer picks on a node. Each answer value
     * is matched against option ids first and option texts second.
     *
     * @param node the option-bearing node
     * @param answer the answer
     * @return the chosen option ids in answer order
     */
    public static Set<String> chosenOptionIds(final FlowNode node,
            final AnswerValue answer) {
        final Set<String> chosen = new LinkedHashSet<>();
        if (answer == null) {
            return chosen;
        }
        final List<QuestionOption> options = node.options();
        for (final String value : answer.asList()) {
            QuestionOption match = null;
            for (final QuestionOption option : options) {
                if (option.id().equals(value)) {
                    match = option;
                    break;
                }
            }
            if (match == null) {
                for (final QuestionOption option : options) {
                    if (option.text().equals(value)) {
                        match = option;
                        break;
                    }
                }
            }
            if (match != null) {
                chosen.add(match.id());
            }
        }
        return chosen;
    }

    // -- Respondent progress -------------------------------------------------

    /**
     * Leaves the start screen.
     *
     * @param graph the flow snapshot
     * @return the progress on the first screen after start, finished when
     *         the flow has no start node or the start leads nowhere
     */
    public static RespondentProgress begin(final FlowGraph graph) {
        Preconditions.requireNonNull(graph, "Graph is required");

        final FlowNode start = graph.startNode();
        if (start == null) {
            return RespondentProgress.at(null).stop();
        }
        return move(graph, RespondentProgress.at(start.id()), null);
    }

    /**
     * Records the answer to the current screen and moves on.
     *
     * @param graph the flow snapshot
     * @param progress the respondent's progress
     * @param answer the answer to the current screen, may be null
     * @return the new progress; unchanged when already finished
     */
    public static RespondentProgress advance(final FlowGraph graph,
            final RespondentProgress progress, final AnswerValue answer) {
        Preconditions.requireNonNull(graph, "Graph is required");
        Preconditions.requireNonNull(progress, "Progress is required");
        if (progress.finished()) {
            return progress;
        }

        RespondentProgress answered = progress;
        final FlowNode current = graph.node(progress.currentNodeId());
        if (answer != null && current != null && current.isQuestion()) {
            answered = progress.answer(current.id(), answer,
                    ScoreCalculator.pointsFor(current, answer));
        }
        return move(graph, answered, answer);
    }

    /**
     * Returns to the previous screen, keeping the answers given so far.
     *
     * @param progress the respondent's progress
     * @return the progress one screen back, or unchanged at the first one
     */
    public static RespondentProgress back(final RespondentProgress progress) {
        Preconditions.requireNonNull(progress, "Progress is required");
        return progress.previous();
    }

    private static RespondentProgress move(final FlowGraph graph,
            final RespondentProgress progress, final AnswerValue answer) {
        final RouteResult route = nextNode(graph, progress.currentNodeId(),
                answer);
        if (!route.hasNext()) {
            return progress.stop();
        }
        final FlowNode target = graph.node(route.nodeId());
        return progress.moveTo(route.nodeId(), target.isEnd());
    }
}
