package co.fanki.flowengine.flow.domain;

import co.fanki.flowengine.layout.domain.LayeredLayout;
import co.fanki.flowengine.layout.domain.LayoutDirection;
import co.fanki.flowengine.layout.domain.LayoutOptions;
import co.fanki.flowengine.shared.DomainException;
import co.fanki.flowengine.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Turns a {@link FlowOutline} into a laid out, validated flow.
 *
 * <p>The questions become a chain {@code start -> q1 -> ... -> end} of
 * default edges. Each branch hint then adds a conditional edge; when the
 * hint jumps along an existing default edge, that edge gets the condition
 * instead of being duplicated. Hints naming unknown questions are skipped.
 * The result is arranged left to right and run through
 * {@link FlowValidator}; the caller decides whether a blocking report
 * makes the flow unusable.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class OutlineFlowBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(
            OutlineFlowBuilder.class);

    /** The arrangement generated flows are shown with. */
    public static final LayoutOptions OUTLINE_LAYOUT = LayoutOptions.defaults()
            .withDirection(LayoutDirection.LR)
            .withSeparations(100, 60);

    /** Branch target naming the end screen. */
    private static final String END_TARGET = "end";

    private final FlowElements elements;

    /**
     * Creates a builder drawing ids from the given factory.
     *
     * @param theElements the element factory
     */
    public OutlineFlowBuilder(final FlowElements theElements) {
        this.elements = Preconditions.requireNonNull(theElements,
                "Element factory is required");
    }

    /**
     * Builds the flow.
     *
     * @param outline the outline
     * @return the flow with its validation report
     * @throws DomainException if the outline has no questions, repeats a
     *         question id or names an unknown question or condition type
     */
    public OutlineBuildResult build(final FlowOutline outline) {
        Preconditions.requireNonNull(outline, "Outline is required");
        if (outline.questions().isEmpty()) {
            throw new DomainException("Outline must have at least one"
                    + " question", DomainException.INVALID_OUTLINE);
        }

        final FlowNode start = startNode(outline.startNode());
        final FlowNode end = endNode(outline.endNode());

        final Map<String, String> nodeIds = new HashMap<>();
        final List<FlowNode> questions = new ArrayList<>();
        for (final FlowOutline.QuestionDraft draft : outline.questions()) {
            final FlowNode node = questionNode(draft);
            if (draft.id() != null
                    && nodeIds.putIfAbsent(draft.id(), node.id()) != null) {
                throw new DomainException("Duplicate question id in outline: "
                        + draft.id(), DomainException.INVALID_OUTLINE);
            }
            questions.add(node);
        }

        final List<FlowEdge> edges = new ArrayList<>();
        edges.add(elements.createEdge(start.id(), questions.get(0).id()));
        for (int i = 0; i < questions.size() - 1; i++) {
            edges.add(elements.createEdge(questions.get(i).id(),
                    questions.get(i + 1).id()));
        }
        edges.add(elements.createEdge(
                questions.get(questions.size() - 1).id(), end.id()));

        for (final FlowOutline.BranchHint hint : outline.branching()) {
            addBranch(hint, nodeIds, end.id(), edges);
        }

        final List<FlowNode> nodes = new ArrayList<>();
        nodes.add(start);
        nodes.addAll(questions);
        nodes.add(end);

        final FlowGraph graph = FlowGraph.of(
                LayeredLayout.layout(nodes, edges, OUTLINE_LAYOUT), edges);
        final ValidationReport report = FlowValidator.report(graph);

        LOG.debug("Built flow '{}' with {} questions and {} edges, blocking:"
                + " {}", outline.title(), questions.size(), edges.size(),
                report.isBlocking());
        return new OutlineBuildResult(outline.title(), outline.description(),
                graph, report);
    }

    private FlowNode startNode(final FlowOutline.StartDraft draft) {
        final FlowNode node = elements.createStartNode(Position.ORIGIN);
        if (draft == null) {
            return node;
        }
        return node.withData(new StartNodeData(draft.title(),
                draft.description(), draft.buttonText()));
    }

    private FlowNode endNode(final FlowOutline.EndDraft draft) {
        final FlowNode node = elements.createEndNode(Position.ORIGIN);
        if (draft == null) {
            return node;
        }
        return node.withData(new EndNodeData(draft.title(),
                draft.description(), draft.showScore(), null));
    }

    private FlowNode questionNode(final FlowOutline.QuestionDraft draft) {
        if (draft == null || draft.type() == null) {
            throw new DomainException("Outline question needs a type",
                    DomainException.INVALID_OUTLINE);
        }
        final QuestionType type = resolve(() ->
                QuestionType.fromWireName(draft.type()));
        final FlowNode node = elements.createQuestionNode(Position.ORIGIN,
                type);

        QuestionNodeData data = node.questionData()
                .withQuestionText(draft.text())
                .withDescription(draft.description())
                .withRequired(draft.required() == null || draft.required());

        if (type.isOptionBearing() && draft.options() != null) {
            final List<QuestionOption> options = new ArrayList<>();
            for (final String text : draft.options()) {
                options.add(elements.createOption(text));
            }
            data = data.withOptions(options);
        }

        if (type.isScaled()) {
            data = data.withScale(
                    draft.min() != null ? draft.min() : data.minValue(),
                    draft.max() != null ? draft.max() : data.maxValue(),
                    draft.minLabel() != null
                            ? draft.minLabel() : data.minLabel(),
                    draft.maxLabel() != null
                            ? draft.maxLabel() : data.maxLabel());
        } else if (type == QuestionType.NUMBER) {
            data = data.withScale(draft.min(), draft.max(), null, null);
        }
        return node.withData(data);
    }

    private void addBranch(final FlowOutline.BranchHint hint,
            final Map<String, String> nodeIds, final String endId,
            final List<FlowEdge> edges) {
        final String source = nodeIds.get(hint.from());
        final String target = END_TARGET.equals(hint.target())
                ? endId : nodeIds.get(hint.target());
        if (source == null || target == null || hint.condition() == null
                || hint.value() == null) {
            LOG.debug("Skipping branch from {} to {}", hint.from(),
                    hint.target());
            return;
        }

        final ConditionType type = resolve(() ->
                ConditionType.fromWireName(hint.condition()));
        final EdgeCondition condition = hint.value() instanceof Number number
                ? EdgeCondition.of(type, number.doubleValue())
                : EdgeCondition.of(type, String.valueOf(hint.value()));

        for (int i = 0; i < edges.size(); i++) {
            final FlowEdge edge = edges.get(i);
            if (edge.source().equals(source) && edge.target().equals(target)
                    && !edge.hasCondition()) {
                edges.set(i, edge.withCondition(condition));
                return;
            }
        }
        edges.add(elements.createEdge(source, target, condition, null));
    }

    /** Reports an unknown wire name as a fault of the outline. */
    private static <T> T resolve(final Supplier<T> lookup) {
        try {
            return lookup.get();
        } catch (final DomainException e) {
            throw new DomainException(e.getMessage(),
                    DomainException.INVALID_OUTLINE, e);
        }
    }
}
