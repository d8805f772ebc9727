package co.fanki.flowengine.flow.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static co.fanki.flowengine.flow.domain.FlowFixtures.choice;
import static co.fanki.flowengine.flow.domain.FlowFixtures.edge;
import static co.fanki.flowengine.flow.domain.FlowFixtures.end;
import static co.fanki.flowengine.flow.domain.FlowFixtures.handle;
import static co.fanki.flowengine.flow.domain.FlowFixtures.start;
import static co.fanki.flowengine.flow.domain.FlowFixtures.text;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link FlowValidator}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class FlowValidatorTest {

    private static boolean hasIssue(final List<ValidationIssue> issues,
            final Severity severity, final String nodeId,
            final String messagePrefix) {
        return issues.stream().anyMatch(i -> i.severity() == severity
                && (nodeId == null || nodeId.equals(i.nodeId()))
                && i.message().startsWith(messagePrefix));
    }

    // -- Clean flows ---------------------------------------------------------

    @Test
    void whenValidating_givenLinearFlow_shouldReportNothing() {
        final FlowGraph graph = FlowGraph.of(
                List.of(start("s"), text("q", "Your name?"), end("e")),
                List.of(edge("s", "q"), edge("q", "e")));

        final ValidationReport report = FlowValidator.report(graph);

        assertTrue(report.isClean());
        assertFalse(report.isBlocking());
    }

    @Test
    void whenValidating_givenOptionBranches_shouldReportNothing() {
        final FlowGraph graph = FlowGraph.of(
                List.of(start("s"), choice("q", "Color?", "Red", "Blue"),
                        end("e1"), end("e2")),
                List.of(edge("s", "q"), handle("q", "q-a", "e1"),
                        handle("q", "q-b", "e2")));

        assertTrue(FlowValidator.validate(graph).isEmpty());
    }

    // -- Errors --------------------------------------------------------------

    @Test
    void whenValidating_givenEmptyFlow_shouldRequireStartAndEnd() {
        final List<ValidationIssue> issues = FlowValidator.validate(
                FlowGraph.empty());

        assertTrue(hasIssue(issues, Severity.ERROR, null,
                "Flow must have a start node"));
        assertTrue(hasIssue(issues, Severity.ERROR, null,
                "Flow must have at least one end node"));
    }

    @Test
    void whenValidating_givenTwoStarts_shouldFlagTheSecond() {
        final FlowGraph graph = FlowGraph.of(
                List.of(start("s1"), start("s2"), end("e")),
                List.of(edge("s1", "e"), edge("s2", "e")));

        final List<ValidationIssue> issues = FlowValidator.validate(graph);

        assertTrue(hasIssue(issues, Severity.ERROR, "s2",
                "Flow can only have one start node"));
        assertFalse(hasIssue(issues, Severity.ERROR, "s1",
                "Flow can only have one start node"));
    }

    @Test
    void whenValidating_givenUnreachableEnd_shouldFlagStart() {
        final FlowGraph graph = FlowGraph.of(
                List.of(start("s"), text("q", "Why?"), end("e")),
                List.of(edge("s", "q")));

        assertTrue(hasIssue(FlowValidator.validate(graph), Severity.ERROR,
                "s", "No end node can be reached"));
    }

    @Test
    void whenValidating_givenDanglingEdge_shouldFlagTheEdge() {
        final FlowGraph graph = FlowGraph.of(
                List.of(start("s"), end("e")),
                List.of(edge("s", "e"), edge("s", "ghost")));

        final List<ValidationIssue> issues = FlowValidator.validate(graph);

        assertTrue(issues.stream().anyMatch(i -> "s->ghost".equals(i.edgeId())
                && i.message().equals("Edge points to missing node ghost")));
    }

    @Test
    void whenValidating_givenTwoDefaultEdges_shouldFlagTheSource() {
        final FlowGraph graph = FlowGraph.of(
                List.of(start("s"), text("q", "Why?"), end("e1"), end("e2")),
                List.of(edge("s", "q"), edge("q", "e1"), edge("q", "e2")));

        assertTrue(hasIssue(FlowValidator.validate(graph), Severity.ERROR,
                "q", "Node has 2 default connections"));
    }

    @Test
    void whenValidating_givenSingleOption_shouldRequireTwo() {
        final FlowGraph graph = FlowGraph.of(
                List.of(start("s"), choice("q", "Pick", "Only"), end("e")),
                List.of(edge("s", "q"), edge("q", "e")));

        assertTrue(hasIssue(FlowValidator.validate(graph), Severity.ERROR,
                "q", "Question needs at least 2 options"));
    }

    @Test
    void whenValidating_givenHandleOfRemovedOption_shouldFlagTheEdge() {
        final FlowGraph graph = FlowGraph.of(
                List.of(start("s"), choice("q", "Color?", "Red", "Blue"),
                        end("e")),
                List.of(edge("s", "q"), edge("q", "e"),
                        handle("q", "q-z", "e")));

        final List<ValidationIssue> issues = FlowValidator.validate(graph);

        assertTrue(issues.stream().anyMatch(i -> i.isError()
                && "q:q-z->e".equals(i.edgeId())));
    }

    @Test
    void whenValidating_givenBlankQuestionText_shouldBlock() {
        final FlowGraph graph = FlowGraph.of(
                List.of(start("s"), text("q", "  "), end("e")),
                List.of(edge("s", "q"), edge("q", "e")));

        final ValidationReport report = FlowValidator.report(graph);

        assertTrue(report.isBlocking());
        assertTrue(hasIssue(report.errors(), Severity.ERROR, "q",
                "Question text cannot be empty"));
    }

    // -- Warnings ------------------------------------------------------------

    @Test
    void whenValidating_givenOrphanQuestion_shouldOnlyWarn() {
        final FlowGraph graph = FlowGraph.of(
                List.of(start("s"), text("orphan", "Hidden?"), end("e")),
                List.of(edge("s", "e"), edge("orphan", "e")));

        final ValidationReport report = FlowValidator.report(graph);

        assertFalse(report.isBlocking());
        assertTrue(hasIssue(report.warnings(), Severity.WARNING, "orphan",
                "Question cannot be reached"));
    }

    @Test
    void whenValidating_givenPipeToDeletedQuestion_shouldWarn() {
        final FlowGraph graph = FlowGraph.of(
                List.of(start("s"),
                        text("q", "Hi {{gone:Name}}, aged {{lost:Age}}?"),
                        end("e")),
                List.of(edge("s", "q"), edge("q", "e")));

        final List<ValidationIssue> issues = FlowValidator.validate(graph);

        assertEquals(1, issues.size());
        assertTrue(hasIssue(issues, Severity.WARNING, "q",
                "Text references 2 deleted question(s)"));
    }

    @Test
    void whenValidating_givenLoopBack_shouldWarnOnLoopHead() {
        final FlowGraph graph = FlowGraph.of(
                List.of(start("s"), choice("q", "Again?", "Yes", "No"),
                        end("e")),
                List.of(edge("s", "q"), handle("q", "q-a", "q"),
                        handle("q", "q-b", "e")));

        final ValidationReport report = FlowValidator.report(graph);

        assertFalse(report.isBlocking());
        assertEquals(1, report.warnings().size());
        assertTrue(hasIssue(report.warnings(), Severity.WARNING, "q",
                "Flow loops back to this node"));
    }
}
