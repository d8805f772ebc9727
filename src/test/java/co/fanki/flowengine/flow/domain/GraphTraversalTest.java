package co.fanki.flowengine.flow.domain;

import co.fanki.flowengine.shared.DomainException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static co.fanki.flowengine.flow.domain.FlowFixtures.edge;
import static co.fanki.flowengine.flow.domain.FlowFixtures.end;
import static co.fanki.flowengine.flow.domain.FlowFixtures.start;
import static co.fanki.flowengine.flow.domain.FlowFixtures.text;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link GraphTraversal}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class GraphTraversalTest {

    /** s -> a -> {b, c} -> d -> e. */
    private FlowGraph diamond() {
        return FlowGraph.of(
                List.of(start("s"), text("a", "A"), text("b", "B"),
                        text("c", "C"), text("d", "D"), end("e")),
                List.of(edge("s", "a"), edge("a", "b"), edge("a", "c"),
                        edge("b", "d"), edge("c", "d"), edge("d", "e")));
    }

    @Test
    void whenWalkingDownstream_givenDiamond_shouldIncludeBothArms() {
        assertEquals(Set.of("b", "d", "e"),
                GraphTraversal.downstream(diamond(), "b"));
        assertEquals(Set.of("a", "b", "c", "d", "e"),
                GraphTraversal.downstream(diamond(), "a"));
    }

    @Test
    void whenWalkingUpstream_givenDiamond_shouldReachStart() {
        assertEquals(Set.of("s", "a", "b", "c", "d"),
                GraphTraversal.upstream(diamond(), "d"));
    }

    @Test
    void whenWalking_givenCycle_shouldTerminate() {
        final FlowGraph graph = FlowGraph.of(
                List.of(start("s"), text("a", "A"), text("b", "B"), end("e")),
                List.of(edge("s", "a"), edge("a", "b"), edge("b", "a"),
                        edge("b", "e")));

        assertEquals(Set.of("a", "b", "e"),
                GraphTraversal.downstream(graph, "a"));
        assertEquals(Set.of("s", "a", "b"),
                GraphTraversal.upstream(graph, "b"));
    }

    @Test
    void whenCollectingBranch_givenDownstreamMode_shouldKeepInnerEdges() {
        final ConnectedBranch branch = GraphTraversal.connectedBranch(
                diamond(), "b", BranchMode.DOWNSTREAM);

        assertEquals(List.of("b", "d", "e"), branch.nodeIds());
        assertEquals(List.of("b->d", "d->e"), branch.edgeIds());
    }

    @Test
    void whenCollectingBranch_givenFullMode_shouldJoinBothSides() {
        final ConnectedBranch branch = GraphTraversal.connectedBranch(
                diamond(), "b", BranchMode.FULL);

        assertEquals(Set.of("s", "a", "b", "d", "e"),
                Set.copyOf(branch.nodeIds()));
        assertEquals(List.of("s->a", "a->b", "b->d", "d->e"),
                branch.edgeIds());
    }

    @Test
    void whenListingAncestors_givenDiamond_shouldReturnQuestionsOnly() {
        final List<String> ids = GraphTraversal.ancestorQuestionNodes(
                diamond(), "d").stream().map(FlowNode::id).toList();

        assertEquals(List.of("b", "c", "a"), ids);
    }

    @Test
    void whenListingAncestors_givenLoopBack_shouldIncludeTheNodeItself() {
        final FlowGraph graph = FlowGraph.of(
                List.of(start("s"), text("a", "A"), end("e")),
                List.of(edge("s", "a"), edge("a", "a"), edge("a", "e")));

        final List<FlowNode> ancestors =
                GraphTraversal.ancestorQuestionNodes(graph, "a");

        assertEquals(1, ancestors.size());
        assertEquals("a", ancestors.get(0).id());
    }

    @Test
    void whenListingAncestors_givenTwoQuestionCycle_shouldListEachOnce() {
        final FlowGraph graph = FlowGraph.of(
                List.of(start("s"), text("q1", "One"), text("q2", "Two"),
                        end("e")),
                List.of(edge("s", "q1"), edge("q1", "q2"), edge("q2", "q1"),
                        edge("q2", "e")));

        final List<String> fromFirst = GraphTraversal.ancestorQuestionNodes(
                graph, "q1").stream().map(FlowNode::id).toList();
        final List<String> fromSecond = GraphTraversal.ancestorQuestionNodes(
                graph, "q2").stream().map(FlowNode::id).toList();

        assertEquals(List.of("q2", "q1"), fromFirst);
        assertEquals(List.of("q1", "q2"), fromSecond);
    }

    @Test
    void whenParsingMode_givenMixedCase_shouldResolve() {
        assertEquals(BranchMode.UPSTREAM, BranchMode.fromName("Upstream"));
        assertEquals(BranchMode.FULL, BranchMode.fromName(null));
        assertTrue(assertThrows(DomainException.class,
                () -> BranchMode.fromName("sideways")).getMessage()
                .contains("sideways"));
    }
}
