package co.fanki.flowengine.flow.domain;

import co.fanki.flowengine.shared.Preconditions;

import java.util.List;

/**
 * The issues found in one flow snapshot.
 *
 * <p>A report with any {@link Severity#ERROR} issue is blocking: the flow
 * must not be published. Warnings alone never block.</p>
 *
 * @param issues the issues in the order the checks produced them
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ValidationReport(List<ValidationIssue> issues) {

    /** Copies the issues. */
    public ValidationReport {
        Preconditions.requireNonNull(issues, "Issues are required");
        issues = List.copyOf(issues);
    }

    public boolean isBlocking() {
        return issues.stream().anyMatch(ValidationIssue::isError);
    }

    public List<ValidationIssue> errors() {
        return issues.stream().filter(ValidationIssue::isError).toList();
    }

    public List<ValidationIssue> warnings() {
        return issues.stream().filter(i -> !i.isError()).toList();
    }

    public boolean isClean() {
        return issues.isEmpty();
    }
}
