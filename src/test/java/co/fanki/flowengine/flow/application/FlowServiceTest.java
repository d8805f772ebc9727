package co.fanki.flowengine.flow.application;

import co.fanki.flowengine.flow.domain.AnswerValue;
import co.fanki.flowengine.flow.domain.FlowGraph;
import co.fanki.flowengine.flow.domain.FlowOutline;
import co.fanki.flowengine.flow.domain.OutlineBuildResult;
import co.fanki.flowengine.flow.domain.OutlineFlowBuilder;
import co.fanki.flowengine.flow.domain.RouteResult;
import co.fanki.flowengine.flow.domain.ValidationReport;
import co.fanki.flowengine.shared.DomainException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static co.fanki.flowengine.flow.domain.FlowFixtures.edge;
import static co.fanki.flowengine.flow.domain.FlowFixtures.end;
import static co.fanki.flowengine.flow.domain.FlowFixtures.start;
import static co.fanki.flowengine.flow.domain.FlowFixtures.text;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link FlowService}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class FlowServiceTest {

    private OutlineFlowBuilder outlineFlowBuilder;
    private FlowService flowService;

    @BeforeEach
    void setUp() {
        outlineFlowBuilder = mock(OutlineFlowBuilder.class);
        flowService = new FlowService(outlineFlowBuilder);
    }

    private FlowGraph linear() {
        return FlowGraph.of(
                List.of(start("s"), text("q", "Name?"), end("e")),
                List.of(edge("s", "q"), edge("q", "e")));
    }

    @Test
    void whenValidating_givenLinearFlow_shouldNotBlock() {
        final ValidationReport report = flowService.validate(linear());

        assertTrue(report.isClean());
    }

    @Test
    void whenRouting_givenAnsweredQuestion_shouldMoveOn() {
        assertEquals(RouteResult.next("e"), flowService.next(linear(), "q",
                AnswerValue.text("Ana")));
    }

    @Test
    void whenRouting_givenBlankNodeId_shouldThrowDomainException() {
        final DomainException e = assertThrows(DomainException.class,
                () -> flowService.next(linear(), " ", null));

        assertEquals(DomainException.INVALID_REQUEST, e.getErrorCode());
    }

    @Test
    void whenResolvingPipes_givenNoFallback_shouldUseDefault() {
        assertEquals("Hi Ana and ...", flowService.resolvePipes(
                "Hi {{q:Name}} and {{x:Other}}",
                Map.of("q", AnswerValue.text("Ana")), null));
    }

    @Test
    void whenCollectingBranch_givenUnknownMode_shouldThrowDomainException() {
        assertThrows(DomainException.class,
                () -> flowService.branch(linear(), "q", "sideways"));
    }

    @Test
    void whenListingAncestors_givenEndNode_shouldReturnQuestion() {
        assertEquals("q", flowService.ancestors(linear(), "e").get(0).id());
    }

    @Test
    void whenBuildingFromOutline_givenOutline_shouldDelegateToBuilder() {
        final FlowOutline outline = new FlowOutline("T", null, null, null,
                List.of(), null);
        final OutlineBuildResult built = new OutlineBuildResult("T", null,
                linear(), new ValidationReport(List.of()));
        when(outlineFlowBuilder.build(outline)).thenReturn(built);

        assertSame(built, flowService.buildFromOutline(outline));
        verify(outlineFlowBuilder).build(outline);
    }
}
