package co.fanki.flowengine.flow.domain;

import co.fanki.flowengine.shared.Preconditions;

import java.util.List;

/**
 * Creates nodes, edges and options with editor defaults and unique ids.
 *
 * <p>Construction never fails and never validates the graph: every
 * factory returns an element whose defaults are internally consistent
 * (an option-bearing question always starts with enough options), and
 * structural checks are left to {@link FlowValidator}.</p>
 *
 * <p>Node ids read {@code <type>-<suffix>}, edge ids
 * {@code edge-<source>-<target>-<suffix>} and option ids
 * {@code opt-<suffix>}, the suffix coming from the {@link IdGenerator}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FlowElements {

    private static final FlowElements DEFAULT =
            new FlowElements(IdGenerator.uuid());

    private final IdGenerator ids;

    /**
     * Creates a factory drawing id suffixes from the given generator.
     *
     * @param theIds the id generator
     */
    public FlowElements(final IdGenerator theIds) {
        this.ids = Preconditions.requireNonNull(theIds,
                "Id generator is required");
    }

    /**
     * Returns the factory backed by random UUIDs.
     *
     * @return the shared default factory
     */
    public static FlowElements defaults() {
        return DEFAULT;
    }

    /**
     * Generates a node id for the given type.
     *
     * @param type the node type
     * @return the new id
     */
    public String nodeId(final NodeType type) {
        return type.wireName() + "-" + ids.nextId();
    }

    /**
     * Generates an edge id between two nodes.
     *
     * @param source the source node id
     * @param target the target node id
     * @return the new id
     */
    public String edgeId(final String source, final String target) {
        return "edge-" + source + "-" + target + "-" + ids.nextId();
    }

    /**
     * Creates an unscored option with a fresh id.
     *
     * @param text the option text
     * @return the option
     */
    public QuestionOption createOption(final String text) {
        return QuestionOption.of("opt-" + ids.nextId(), text);
    }

    /**
     * Creates a start node with the default intro copy.
     *
     * @param position the canvas position
     * @return the start node
     */
    public FlowNode createStartNode(final Position position) {
        return new FlowNode(nodeId(NodeType.START), NodeType.START,
                position, StartNodeData.defaults());
    }

    /**
     * Creates a single-choice question with the default options.
     *
     * @param position the canvas position
     * @return the question node
     */
    public FlowNode createQuestionNode(final Position position) {
        return createQuestionNode(position,
                QuestionType.MULTIPLE_CHOICE_SINGLE);
    }

    /**
     * Creates a question node with the defaults of its type.
     *
     * @param position the canvas position
     * @param questionType the question type
     * @return the question node
     */
    public FlowNode createQuestionNode(final Position position,
            final QuestionType questionType) {
        return new FlowNode(nodeId(NodeType.QUESTION), NodeType.QUESTION,
                position, defaultQuestionData(questionType));
    }

    /**
     * Creates an end node with the default outro copy.
     *
     * @param position the canvas position
     * @return the end node
     */
    public FlowNode createEndNode(final Position position) {
        return new FlowNode(nodeId(NodeType.END), NodeType.END, position,
                EndNodeData.defaults());
    }

    /**
     * Creates the default edge between two nodes.
     *
     * @param source the source node id
     * @param target the target node id
     * @return the edge
     */
    public FlowEdge createEdge(final String source, final String target) {
        return createEdge(source, target, null, null);
    }

    /**
     * Creates an edge gated by a condition or an option handle.
     *
     * @param source the source node id
     * @param target the target node id
     * @param condition the answer predicate, may be null
     * @param sourceHandle the option id, may be null
     * @return the edge
     */
    public FlowEdge createEdge(final String source, final String target,
            final EdgeCondition condition, final String sourceHandle) {
        return new FlowEdge(edgeId(source, target), source, target,
                sourceHandle, condition);
    }

    /**
     * Builds the payload a freshly dropped question of the type starts
     * with.
     *
     * @param questionType the question type
     * @return the default payload
     */
    public QuestionNodeData defaultQuestionData(
            final QuestionType questionType) {
        final QuestionNodeData base = QuestionNodeData.of(questionType,
                "Your question here");

        return switch (questionType) {
            case MULTIPLE_CHOICE_SINGLE, MULTIPLE_CHOICE_MULTI ->
                    base.withOptions(List.of(
                            createOption("Option 1"),
                            createOption("Option 2")));
            case YES_NO -> base.withOptions(List.of(
                    createOption("Yes"),
                    createOption("No")));
            case DROPDOWN -> base.withOptions(List.of(
                    createOption("Option 1"),
                    createOption("Option 2"),
                    createOption("Option 3")));
            case RATING -> base.withScale(1.0, 5.0, "Poor", "Excellent");
            case NPS -> base.withScale(0.0, 10.0, "Not likely",
                    "Very likely");
            case SHORT_TEXT -> base.withTextInput("Enter your answer...", 100);
            case LONG_TEXT -> base.withTextInput("Enter your answer...", 1000);
            case NUMBER -> base.withTextInput("Enter a number...", null);
            case EMAIL -> base.withTextInput("you@example.com", null);
            case DATE -> base.withTextInput("Select a date...", null);
        };
    }
}
