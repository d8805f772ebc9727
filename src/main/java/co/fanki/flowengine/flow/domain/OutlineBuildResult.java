package co.fanki.flowengine.flow.domain;

/**
 * A graph built from an outline, laid out and validated.
 *
 * @param title the questionnaire title
 * @param description the questionnaire description, may be null
 * @param graph the laid out flow
 * @param report the validation of the flow
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record OutlineBuildResult(String title, String description,
        FlowGraph graph, ValidationReport report) {

    /** Whether the built flow can be used as is. */
    public boolean isUsable() {
        return !report.isBlocking();
    }
}
