package co.fanki.flowengine.flow.domain;

import co.fanki.flowengine.shared.Preconditions;

/**
 * One finding of {@link FlowValidator}.
 *
 * @param severity whether the issue blocks publishing
 * @param nodeId the offending node, or null
 * @param edgeId the offending edge, or null
 * @param message the text shown to the author
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ValidationIssue(Severity severity, String nodeId,
        String edgeId, String message) {

    /** Validates the issue. */
    public ValidationIssue {
        Preconditions.requireNonNull(severity, "Severity is required");
        Preconditions.requireNonBlank(message, "Message is required");
    }

    public static ValidationIssue error(final String message) {
        return new ValidationIssue(Severity.ERROR, null, null, message);
    }

    public static ValidationIssue nodeError(final String nodeId,
            final String message) {
        return new ValidationIssue(Severity.ERROR, nodeId, null, message);
    }

    public static ValidationIssue edgeError(final String edgeId,
            final String message) {
        return new ValidationIssue(Severity.ERROR, null, edgeId, message);
    }

    public static ValidationIssue nodeWarning(final String nodeId,
            final String message) {
        return new ValidationIssue(Severity.WARNING, nodeId, null, message);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
