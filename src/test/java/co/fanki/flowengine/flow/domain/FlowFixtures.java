package co.fanki.flowengine.flow.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Builders for small flows with readable ids.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FlowFixtures {

    private FlowFixtures() {
    }

    public static FlowNode start(final String id) {
        return FlowNode.of(id, Position.ORIGIN, StartNodeData.defaults());
    }

    public static FlowNode end(final String id) {
        return FlowNode.of(id, Position.ORIGIN, EndNodeData.defaults());
    }

    public static FlowNode text(final String id, final String text) {
        return FlowNode.of(id, Position.ORIGIN,
                QuestionNodeData.of(QuestionType.SHORT_TEXT, text));
    }

    public static FlowNode number(final String id, final String text) {
        return FlowNode.of(id, Position.ORIGIN,
                QuestionNodeData.of(QuestionType.NUMBER, text));
    }

    /**
     * A single choice question whose options are {@code <id>-a},
     * {@code <id>-b}, ... in the order of the given texts.
     */
    public static FlowNode choice(final String id, final String text,
            final String... optionTexts) {
        final List<QuestionOption> options = new ArrayList<>();
        for (int i = 0; i < optionTexts.length; i++) {
            options.add(QuestionOption.of(id + "-" + (char) ('a' + i),
                    optionTexts[i]));
        }
        return FlowNode.of(id, Position.ORIGIN,
                QuestionNodeData.of(QuestionType.MULTIPLE_CHOICE_SINGLE, text)
                        .withOptions(options));
    }

    public static FlowNode at(final FlowNode node, final double x,
            final double y) {
        return node.withPosition(Position.of(x, y));
    }

    public static FlowEdge edge(final String source, final String target) {
        return FlowEdge.of(source + "->" + target, source, target);
    }

    public static FlowEdge handle(final String source, final String option,
            final String target) {
        return new FlowEdge(source + ":" + option + "->" + target, source,
                target, option, null);
    }

    public static FlowEdge when(final String source, final String target,
            final ConditionType type, final String value) {
        return new FlowEdge(source + "?" + value + "->" + target, source,
                target, null, EdgeCondition.of(type, value));
    }

    /** An id generator counting 1, 2, 3... */
    public static IdGenerator sequence() {
        final int[] next = {0};
        return () -> String.valueOf(++next[0]);
    }
}
