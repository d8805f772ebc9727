package co.fanki.flowengine.flow.domain;

import co.fanki.flowengine.shared.Preconditions;

import java.util.List;

/**
 * A screen of the flow graph.
 *
 * @param id the node id, unique within a flow
 * @param type the kind of screen
 * @param position the top-left corner on the editor canvas
 * @param data the type-specific payload, matching {@code type}
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FlowNode(String id, NodeType type, Position position,
        NodeData data) {

    /** Validates the node shape. */
    public FlowNode {
        Preconditions.requireNonBlank(id, "Node id is required");
        Preconditions.requireNonNull(type, "Node type is required");
        Preconditions.requireNonNull(position, "Node position is required");
        Preconditions.requireNonNull(data, "Node data is required");
        Preconditions.require(data.nodeType() == type,
                "Node " + id + " of type " + type.wireName()
                        + " cannot carry " + data.nodeType().wireName()
                        + " data");
    }

    /**
     * Creates a node whose type is taken from its payload.
     *
     * @param id the node id
     * @param position the canvas position
     * @param data the payload
     * @return the node
     */
    public static FlowNode of(final String id, final Position position,
            final NodeData data) {
        Preconditions.requireNonNull(data, "Node data is required");
        return new FlowNode(id, data.nodeType(), position, data);
    }

    public boolean isStart() {
        return type == NodeType.START;
    }

    public boolean isQuestion() {
        return type == NodeType.QUESTION;
    }

    public boolean isEnd() {
        return type == NodeType.END;
    }

    /**
     * Returns the question payload.
     *
     * @return the payload, or null when this is not a question node
     */
    public QuestionNodeData questionData() {
        return data instanceof QuestionNodeData q ? q : null;
    }

    /**
     * Checks if this is a question whose answers are picked from options.
     *
     * @return true for option-bearing question nodes
     */
    public boolean isOptionBearing() {
        final QuestionNodeData question = questionData();
        return question != null && question.questionType().isOptionBearing();
    }

    /**
     * Returns the options of this node.
     *
     * @return the options, empty for nodes without options
     */
    public List<QuestionOption> options() {
        final QuestionNodeData question = questionData();
        return question == null ? List.of() : question.options();
    }

    /**
     * Returns a copy of this node at another position.
     *
     * @param newPosition the new position
     * @return the moved copy
     */
    public FlowNode withPosition(final Position newPosition) {
        return new FlowNode(id, type, newPosition, data);
    }

    /**
     * Returns a copy of this node with another payload of the same type.
     *
     * @param newData the new payload
     * @return the edited copy
     */
    public FlowNode withData(final NodeData newData) {
        return new FlowNode(id, type, position, newData);
    }
}
