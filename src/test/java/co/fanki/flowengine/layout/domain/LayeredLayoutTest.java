package co.fanki.flowengine.layout.domain;

import co.fanki.flowengine.flow.domain.FlowEdge;
import co.fanki.flowengine.flow.domain.FlowNode;
import co.fanki.flowengine.flow.domain.Position;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static co.fanki.flowengine.flow.domain.FlowFixtures.at;
import static co.fanki.flowengine.flow.domain.FlowFixtures.edge;
import static co.fanki.flowengine.flow.domain.FlowFixtures.end;
import static co.fanki.flowengine.flow.domain.FlowFixtures.start;
import static co.fanki.flowengine.flow.domain.FlowFixtures.text;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link LayeredLayout}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class LayeredLayoutTest {

    private static Map<String, Position> positions(final List<FlowNode> nodes) {
        return nodes.stream().collect(Collectors.toMap(FlowNode::id,
                FlowNode::position));
    }

    private static boolean overlap(final Position a, final Position b,
            final LayoutOptions options) {
        return a.x() < b.x() + options.nodeWidth()
                && b.x() < a.x() + options.nodeWidth()
                && a.y() < b.y() + options.nodeHeight()
                && b.y() < a.y() + options.nodeHeight();
    }

    @Test
    void whenLayingOut_givenChain_shouldPlaceOneRankPerStep() {
        final List<FlowNode> result = LayeredLayout.layout(
                List.of(start("s"), text("q", "Q"), end("e")),
                List.of(edge("s", "q"), edge("q", "e")),
                LayoutOptions.defaults());

        final Map<String, Position> at = positions(result);
        assertEquals(Position.of(40, 40), at.get("s"));
        assertEquals(Position.of(400, 40), at.get("q"));
        assertEquals(Position.of(760, 40), at.get("e"));
    }

    @Test
    void whenLayingOut_givenTopToBottom_shouldUseVerticalRanks() {
        final List<FlowNode> result = LayeredLayout.layout(
                List.of(start("s"), end("e")),
                List.of(edge("s", "e")),
                LayoutOptions.defaults().withDirection(LayoutDirection.TB));

        final Map<String, Position> at = positions(result);
        assertEquals(at.get("s").x(), at.get("e").x());
        assertEquals(at.get("s").y() + 180 + 80, at.get("e").y());
    }

    @Test
    void whenLayingOut_givenBranches_shouldRankByLongestPath() {
        final List<FlowNode> result = LayeredLayout.layout(
                List.of(start("s"), text("a", "A"), text("b", "B"),
                        end("e")),
                List.of(edge("s", "a"), edge("a", "b"), edge("b", "e"),
                        edge("s", "e")),
                LayoutOptions.defaults());

        final Map<String, Position> at = positions(result);
        assertTrue(at.get("e").x() > at.get("b").x());
        assertTrue(at.get("b").x() > at.get("a").x());
    }

    @Test
    void whenLayingOut_givenSiblings_shouldNotOverlapAndCenterParent() {
        final LayoutOptions options = LayoutOptions.defaults();
        final List<FlowNode> result = LayeredLayout.layout(
                List.of(start("s"), text("a", "A"), text("b", "B"),
                        text("c", "C")),
                List.of(edge("s", "a"), edge("s", "b"), edge("s", "c")),
                options);

        final Map<String, Position> at = positions(result);
        assertTrue(!overlap(at.get("a"), at.get("b"), options));
        assertTrue(!overlap(at.get("b"), at.get("c"), options));
        assertEquals(at.get("b").y(), at.get("s").y());
    }

    @Test
    void whenLayingOut_givenLoopBack_shouldStillTerminateAndRank() {
        final List<FlowNode> result = LayeredLayout.layout(
                List.of(start("s"), text("a", "A"), text("b", "B"),
                        end("e")),
                List.of(edge("s", "a"), edge("a", "b"), edge("b", "a"),
                        edge("b", "e")),
                LayoutOptions.defaults());

        final Map<String, Position> at = positions(result);
        assertTrue(at.get("a").x() < at.get("b").x());
        assertTrue(at.get("b").x() < at.get("e").x());
    }

    @Test
    void whenLayingOut_givenDisconnectedParts_shouldStackThem() {
        final LayoutOptions options = LayoutOptions.defaults();
        final List<FlowNode> result = LayeredLayout.layout(
                List.of(start("s"), end("e"), text("x", "X"), text("y", "Y")),
                List.of(edge("s", "e"), edge("x", "y")),
                options);

        final Map<String, Position> at = positions(result);
        assertEquals(at.get("s").x(), at.get("x").x());
        assertEquals(at.get("s").y() + 180 + 50, at.get("x").y());
    }

    @Test
    void whenLayingOut_givenPreviousPositions_shouldIgnoreThem() {
        final List<FlowNode> nodes = List.of(start("s"), end("e"));
        final List<FlowEdge> edges = List.of(edge("s", "e"));

        final List<FlowNode> fresh = LayeredLayout.layout(nodes, edges,
                LayoutOptions.defaults());
        final List<FlowNode> moved = LayeredLayout.layout(
                List.of(at(start("s"), 999, -5), at(end("e"), 3, 3)), edges,
                LayoutOptions.defaults());

        assertEquals(positions(fresh), positions(moved));
    }

    @Test
    void whenLayingOut_givenSelfLoopAndUnknownTarget_shouldIgnoreThoseEdges() {
        final List<FlowNode> result = LayeredLayout.layout(
                List.of(start("s"), end("e")),
                List.of(edge("s", "s"), edge("s", "ghost"), edge("s", "e")),
                LayoutOptions.defaults());

        assertEquals(2, result.size());
        assertNotEquals(result.get(0).position(), result.get(1).position());
    }

    @Test
    void whenLayingOut_givenNoNodes_shouldReturnEmpty() {
        assertTrue(LayeredLayout.layout(List.of(), List.of(),
                LayoutOptions.defaults()).isEmpty());
    }

    @Test
    void whenLayingOut_givenAnyInput_shouldKeepInputOrder() {
        final List<FlowNode> nodes = List.of(end("e"), text("q", "Q"),
                start("s"));

        final List<FlowNode> result = LayeredLayout.layout(nodes,
                List.of(edge("s", "q"), edge("q", "e")),
                LayoutOptions.defaults());

        assertEquals(nodes.stream().map(FlowNode::id).toList(),
                result.stream().map(FlowNode::id).toList());
        assertEquals(Position.of(760, 40), result.get(0).position());
    }
}
