package co.fanki.flowengine.flow.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Intro copy of the start screen.
 *
 * @param title the heading
 * @param description the intro text
 * @param buttonText the label of the button that begins the flow
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record StartNodeData(String title, String description,
        String buttonText) implements NodeData {

    /** Default start screen copy. */
    public static StartNodeData defaults() {
        return new StartNodeData("Welcome",
                "Thank you for taking this assessment.", "Start");
    }

    @Override
    public NodeType nodeType() {
        return NodeType.START;
    }

    @Override
    public List<String> textFields() {
        final List<String> fields = new ArrayList<>();
        if (title != null) {
            fields.add(title);
        }
        if (description != null) {
            fields.add(description);
        }
        return fields;
    }
}
