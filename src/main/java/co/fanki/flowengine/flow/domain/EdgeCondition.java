package co.fanki.flowengine.flow.domain;

import co.fanki.flowengine.shared.Preconditions;
import co.fanki.flowengine.shared.ValueObject;

/**
 * Predicate gating an edge on the respondent's answer.
 *
 * <p>The stored value is either a string or a number; {@code numeric}
 * remembers which so the persisted shape round trips unchanged. The value
 * is always kept in its text form, numbers rendered the way
 * {@link AnswerValue#formatNumber(double)} renders them.</p>
 *
 * @param type the predicate
 * @param value the comparison value in text form
 * @param numeric whether the value was stored as a number
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record EdgeCondition(ConditionType type, String value,
        boolean numeric) implements ValueObject {

    /** Validates the condition. */
    public EdgeCondition {
        Preconditions.requireNonNull(type, "Condition type is required");
        Preconditions.requireNonNull(value, "Condition value is required");
    }

    /**
     * Creates a condition compared against a text value.
     *
     * @param type the predicate
     * @param value the comparison text
     * @return the condition
     */
    public static EdgeCondition of(final ConditionType type,
            final String value) {
        return new EdgeCondition(type, value, false);
    }

    /**
     * Creates a condition compared against a numeric value.
     *
     * @param type the predicate
     * @param value the comparison number
     * @return the condition
     */
    public static EdgeCondition of(final ConditionType type,
            final double value) {
        return new EdgeCondition(type, AnswerValue.formatNumber(value), true);
    }
}
