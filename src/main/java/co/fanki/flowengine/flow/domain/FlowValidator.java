package co.fanki.flowengine.flow.domain;

import co.fanki.flowengine.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static analysis of a flow before it is published.
 *
 * <p>Every check runs on every call and contributes its own issues; the
 * order of the checks only decides the order of the messages. Errors
 * block publishing:</p>
 * <ul>
 *   <li>no start node, or more than one</li>
 *   <li>no end node reachable from the start node</li>
 *   <li>an edge whose source or target is not a node</li>
 *   <li>more than one default edge leaving a node</li>
 *   <li>an option-bearing question with fewer than two options</li>
 *   <li>an edge routed through an option the source does not have</li>
 *   <li>a question with empty text</li>
 * </ul>
 * <p>Warnings do not block: a question unreachable from the start node, a
 * pipe token naming a node that is gone, and a loop reachable from the
 * start node.</p>
 *
 * <p>Issues are returned, never thrown.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FlowValidator {

    private static final Logger LOG = LoggerFactory.getLogger(
            FlowValidator.class);

    private static final int MIN_OPTIONS = 2;

    private FlowValidator() {
    }

    /**
     * Validates a flow snapshot.
     *
     * @param graph the flow snapshot
     * @return the report with every issue found
     */
    public static ValidationReport report(final FlowGraph graph) {
        return new ValidationReport(validate(graph));
    }

    /**
     * Validates a flow snapshot.
     *
     * @param graph the flow snapshot
     * @return the issues in check order, empty for a clean flow
     */
    public static List<ValidationIssue> validate(final FlowGraph graph) {
        Preconditions.requireNonNull(graph, "Graph is required");

        final List<ValidationIssue> issues = new ArrayList<>();
        final FlowNode start = checkStartNodes(graph, issues);
        final Set<String> reachable = start == null
                ? Set.of()
                : GraphTraversal.downstream(graph, start.id());

        checkEndReachable(graph, start, reachable, issues);
        checkDanglingEdges(graph, issues);
        checkDefaultEdges(graph, issues);
        checkOptions(graph, issues);
        checkHandles(graph, issues);
        checkQuestionText(graph, issues);
        if (start != null) {
            checkOrphans(graph, reachable, issues);
        }
        checkPipes(graph, issues);
        if (start != null) {
            checkCycles(graph, start.id(), issues);
        }

        if (LOG.isDebugEnabled()) {
            final long errors = issues.stream()
                    .filter(ValidationIssue::isError).count();
            LOG.debug("Validated flow with {} nodes and {} edges: {} errors,"
                    + " {} warnings", graph.nodeCount(), graph.edgeCount(),
                    errors, issues.size() - errors);
        }
        return issues;
    }

    private static FlowNode checkStartNodes(final FlowGraph graph,
            final List<ValidationIssue> issues) {
        final List<FlowNode> starts = graph.startNodes();
        if (starts.isEmpty()) {
            issues.add(ValidationIssue.error("Flow must have a start node"));
            return null;
        }
        if (starts.size() > 1) {
            for (int i = 1; i < starts.size(); i++) {
                issues.add(ValidationIssue.nodeError(starts.get(i).id(),
                        "Flow can only have one start node"));
            }
        }
        return starts.get(0);
    }

    private static void checkEndReachable(final FlowGraph graph,
            final FlowNode start, final Set<String> reachable,
            final List<ValidationIssue> issues) {
        if (graph.endNodes().isEmpty()) {
            issues.add(ValidationIssue.error(
                    "Flow must have at least one end node"));
            return;
        }
        if (start == null) {
            return;
        }
        final boolean endReachable = graph.endNodes().stream()
                .anyMatch(end -> reachable.contains(end.id()));
        if (!endReachable) {
            issues.add(ValidationIssue.nodeError(start.id(),
                    "No end node can be reached from the start node"));
        }
    }

    private static void checkDanglingEdges(final FlowGraph graph,
            final List<ValidationIssue> issues) {
        for (final FlowEdge edge : graph.edges()) {
            if (!graph.contains(edge.source())) {
                issues.add(ValidationIssue.edgeError(edge.id(),
                        "Edge leaves from missing node " + edge.source()));
            }
            if (!graph.contains(edge.target())) {
                issues.add(ValidationIssue.edgeError(edge.id(),
                        "Edge points to missing node " + edge.target()));
            }
        }
    }

    private static void checkDefaultEdges(final FlowGraph graph,
            final List<ValidationIssue> issues) {
        final Map<String, Integer> defaults = new LinkedHashMap<>();
        for (final FlowEdge edge : graph.edges()) {
            if (edge.isDefault()) {
                defaults.merge(edge.source(), 1, Integer::sum);
            }
        }
        defaults.forEach((source, count) -> {
            if (count > 1) {
                issues.add(ValidationIssue.nodeError(source, "Node has "
                        + count + " default connections; only one is"
                        + " allowed"));
            }
        });
    }

    private static void checkOptions(final FlowGraph graph,
            final List<ValidationIssue> issues) {
        for (final FlowNode node : graph.questionNodes()) {
            if (node.isOptionBearing()
                    && node.options().size() < MIN_OPTIONS) {
                issues.add(ValidationIssue.nodeError(node.id(),
                        "Question needs at least " + MIN_OPTIONS
                                + " options"));
            }
        }
    }

    private static void checkHandles(final FlowGraph graph,
            final List<ValidationIssue> issues) {
        for (final FlowEdge edge : graph.edges()) {
            if (!edge.hasHandle()) {
                continue;
            }
            final FlowNode source = graph.node(edge.source());
            if (source == null) {
                continue;
            }
            final QuestionNodeData question = source.questionData();
            if (question == null || !question.hasOption(edge.sourceHandle())) {
                issues.add(ValidationIssue.edgeError(edge.id(),
                        "Edge is routed through option "
                                + edge.sourceHandle()
                                + " which does not exist on its source"));
            }
        }
    }

    private static void checkQuestionText(final FlowGraph graph,
            final List<ValidationIssue> issues) {
        for (final FlowNode node : graph.questionNodes()) {
            if (node.questionData().questionText().isBlank()) {
                issues.add(ValidationIssue.nodeError(node.id(),
                        "Question text cannot be empty"));
            }
        }
    }

    private static void checkOrphans(final FlowGraph graph,
            final Set<String> reachable, final List<ValidationIssue> issues) {
        for (final FlowNode node : graph.questionNodes()) {
            if (!reachable.contains(node.id())) {
                issues.add(ValidationIssue.nodeWarning(node.id(),
                        "Question cannot be reached from the start node"));
            }
        }
    }

    private static void checkPipes(final FlowGraph graph,
            final List<ValidationIssue> issues) {
        final Set<String> existing = graph.nodeIds();
        for (final FlowNode node : graph.nodes()) {
            final Set<String> broken = new LinkedHashSet<>();
            for (final String text : node.data().textFields()) {
                broken.addAll(AnswerPipes.findBrokenReferences(text,
                        existing));
            }
            if (!broken.isEmpty()) {
                issues.add(ValidationIssue.nodeWarning(node.id(),
                        "Text references " + broken.size()
                                + " deleted question(s); piped answers will"
                                + " show fallback text"));
            }
        }
    }

    /**
     * Walks depth first from the start node and flags each node entered
     * again while still on the walk stack.
     */
    private static void checkCycles(final FlowGraph graph,
            final String startId, final List<ValidationIssue> issues) {
        final Set<String> done = new HashSet<>();
        final Set<String> onStack = new HashSet<>();
        final Map<String, Integer> nextEdge = new HashMap<>();
        final Set<String> loopHeads = new LinkedHashSet<>();
        final Deque<String> stack = new ArrayDeque<>();

        stack.push(startId);
        onStack.add(startId);

        while (!stack.isEmpty()) {
            final String current = stack.peek();
            final List<FlowEdge> edges = graph.outgoing(current);
            final int index = nextEdge.getOrDefault(current, 0);

            if (index >= edges.size()) {
                stack.pop();
                onStack.remove(current);
                done.add(current);
                continue;
            }
            nextEdge.put(current, index + 1);

            final String target = edges.get(index).target();
            if (!graph.contains(target)) {
                continue;
            }
            if (onStack.contains(target)) {
                loopHeads.add(target);
            } else if (!done.contains(target)) {
                stack.push(target);
                onStack.add(target);
            }
        }

        for (final String head : loopHeads) {
            issues.add(ValidationIssue.nodeWarning(head,
                    "Flow loops back to this node; respondents may see it"
                            + " more than once"));
        }
    }
}
