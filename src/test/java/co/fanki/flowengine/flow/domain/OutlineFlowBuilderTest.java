package co.fanki.flowengine.flow.domain;

import co.fanki.flowengine.shared.DomainException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link OutlineFlowBuilder}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class OutlineFlowBuilderTest {

    private OutlineFlowBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new OutlineFlowBuilder(
                new FlowElements(FlowFixtures.sequence()));
    }

    private static FlowOutline.QuestionDraft draft(final String id,
            final QuestionType type, final String text,
            final String... options) {
        return new FlowOutline.QuestionDraft(id,
                type == null ? null : type.wireName(), text, null, null,
                options.length == 0 ? null : List.of(options), null, null,
                null, null);
    }

    private static FlowOutline outline(
            final List<FlowOutline.QuestionDraft> questions,
            final List<FlowOutline.BranchHint> branching) {
        return new FlowOutline("Survey", "A short survey",
                new FlowOutline.StartDraft("Welcome", "Hello", "Begin"),
                new FlowOutline.EndDraft("Done", "Thanks", true),
                questions, branching);
    }

    private static FlowNode questionWithText(final FlowGraph graph,
            final String text) {
        return graph.questionNodes().stream()
                .filter(n -> n.questionData().questionText().equals(text))
                .findFirst().orElseThrow();
    }

    @Test
    void whenBuilding_givenBranchOnExistingLink_shouldConditionThatLink() {
        final OutlineBuildResult result = builder.build(outline(
                List.of(draft("q1", QuestionType.YES_NO, "Own a pet?",
                                "Yes", "No"),
                        draft("q2", QuestionType.SHORT_TEXT, "Pet name?"),
                        draft("q3", QuestionType.RATING, "How happy?")),
                List.of(new FlowOutline.BranchHint("q1",
                                "equals", "Yes", "q2"),
                        new FlowOutline.BranchHint("q1",
                                "equals", "No", "end"))));

        final FlowGraph graph = result.graph();
        assertEquals(5, graph.nodeCount());
        assertEquals(5, graph.edgeCount());
        assertTrue(result.isUsable());
        assertTrue(result.report().isClean());

        final FlowNode q1 = questionWithText(graph, "Own a pet?");
        assertTrue(graph.outgoing(q1.id()).stream()
                .allMatch(FlowEdge::hasCondition));

        final FlowNode end = graph.endNodes().get(0);
        assertEquals(RouteResult.next(end.id()), FlowRouter.nextNode(graph,
                q1.id(), AnswerValue.text("No")));
    }

    @Test
    void whenBuilding_givenLinearOutline_shouldArrangeLeftToRight() {
        final OutlineBuildResult result = builder.build(outline(
                List.of(draft("a", QuestionType.SHORT_TEXT, "First?"),
                        draft("b", QuestionType.SHORT_TEXT, "Second?")),
                null));

        final List<FlowNode> nodes = result.graph().nodes();
        assertEquals(40, nodes.get(0).position().x());
        for (int i = 1; i < nodes.size(); i++) {
            assertEquals(nodes.get(i - 1).position().x() + 380,
                    nodes.get(i).position().x());
            assertEquals(nodes.get(0).position().y(),
                    nodes.get(i).position().y());
        }
        assertEquals("Survey", result.title());
        assertEquals("Welcome", ((StartNodeData) nodes.get(0).data()).title());
    }

    @Test
    void whenBuilding_givenUnknownBranchQuestion_shouldSkipTheHint() {
        final OutlineBuildResult result = builder.build(outline(
                List.of(draft("a", QuestionType.NUMBER, "Age?")),
                List.of(new FlowOutline.BranchHint("a",
                        "greater_than", 18, "missing"))));

        assertEquals(2, result.graph().edgeCount());
        assertTrue(result.isUsable());
    }

    @Test
    void whenBuilding_givenNumericHint_shouldStoreNumericCondition() {
        final OutlineBuildResult result = builder.build(outline(
                List.of(draft("a", QuestionType.NUMBER, "Age?"),
                        draft("b", QuestionType.SHORT_TEXT, "Why?")),
                List.of(new FlowOutline.BranchHint("a",
                        "greater_than", 18, "end"))));

        final EdgeCondition condition = result.graph().edges().stream()
                .filter(FlowEdge::hasCondition).findFirst().orElseThrow()
                .condition();
        assertTrue(condition.numeric());
        assertEquals("18", condition.value());
    }

    @Test
    void whenBuilding_givenScaleOverride_shouldKeepMissingDefaults() {
        final FlowOutline.QuestionDraft rating = new FlowOutline.QuestionDraft(
                "r", "rating", "Rate us", null, false, null, null,
                10.0, null, "Great");

        final FlowNode node = builder.build(outline(List.of(rating), null))
                .graph().questionNodes().get(0);

        final QuestionNodeData data = node.questionData();
        assertEquals(1.0, data.minValue());
        assertEquals(10.0, data.maxValue());
        assertEquals("Poor", data.minLabel());
        assertEquals("Great", data.maxLabel());
        assertEquals(false, data.required());
    }

    @Test
    void whenBuilding_givenOptionTexts_shouldCreateOptions() {
        final FlowNode node = builder.build(outline(List.of(
                draft("c", QuestionType.DROPDOWN, "Country?", "AR", "UY")),
                null)).graph().questionNodes().get(0);

        assertEquals(List.of("AR", "UY"), node.options().stream()
                .map(QuestionOption::text).toList());
        assertNotNull(node.options().get(0).id());
    }

    @Test
    void whenBuilding_givenNoQuestions_shouldThrowDomainException() {
        final DomainException e = assertThrows(DomainException.class,
                () -> builder.build(outline(List.of(), null)));

        assertEquals(DomainException.INVALID_OUTLINE, e.getErrorCode());
    }

    @Test
    void whenBuilding_givenDuplicateIds_shouldThrowDomainException() {
        assertThrows(DomainException.class, () -> builder.build(outline(
                List.of(draft("a", QuestionType.SHORT_TEXT, "One?"),
                        draft("a", QuestionType.SHORT_TEXT, "Two?")),
                null)));
    }

    @Test
    void whenBuilding_givenQuestionWithoutType_shouldThrowDomainException() {
        assertThrows(DomainException.class, () -> builder.build(outline(
                List.of(draft("a", null, "Typeless?")), null)));
    }

    @Test
    void whenBuilding_givenUnknownQuestionType_shouldReportOutlineFault() {
        final FlowOutline.QuestionDraft essay = new FlowOutline.QuestionDraft(
                "a", "essay", "Tell us everything", null, null, null, null,
                null, null, null);

        final DomainException e = assertThrows(DomainException.class,
                () -> builder.build(outline(List.of(essay), null)));

        assertEquals(DomainException.INVALID_OUTLINE, e.getErrorCode());
        assertTrue(e.getMessage().contains("essay"));
    }

    @Test
    void whenBuilding_givenUnknownConditionType_shouldReportOutlineFault() {
        final DomainException e = assertThrows(DomainException.class,
                () -> builder.build(outline(
                        List.of(draft("a", QuestionType.NUMBER, "Age?")),
                        List.of(new FlowOutline.BranchHint("a", "between",
                                18, "end")))));

        assertEquals(DomainException.INVALID_OUTLINE, e.getErrorCode());
    }
}
