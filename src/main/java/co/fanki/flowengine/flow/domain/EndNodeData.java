package co.fanki.flowengine.flow.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Outro copy of an end screen.
 *
 * @param title the heading
 * @param description the closing text
 * @param showScore whether the accumulated score is shown
 * @param redirectUrl where to send the respondent afterwards, or null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record EndNodeData(String title, String description,
        boolean showScore, String redirectUrl) implements NodeData {

    /** Default end screen copy. */
    public static EndNodeData defaults() {
        return new EndNodeData("Thank You!",
                "Your response has been recorded.", false, null);
    }

    @Override
    public NodeType nodeType() {
        return NodeType.END;
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
