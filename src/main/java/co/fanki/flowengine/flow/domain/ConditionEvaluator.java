package co.fanki.flowengine.flow.domain;

import co.fanki.flowengine.shared.Preconditions;

import java.util.Locale;

/**
 * Evaluates an edge condition against a respondent's answer.
 *
 * <p>Coercion table:</p>
 * <ul>
 *   <li>{@code equals}, {@code not_equals}: text compares as text; a
 *   number compares numerically against a numeric value and as text
 *   otherwise; choices test membership of the exact value.
 *   {@code not_equals} is always the inverse of {@code equals}.</li>
 *   <li>{@code contains}: case-insensitive substring for text and numbers,
 *   membership for choices.</li>
 *   <li>{@code greater_than}, {@code less_than}: both sides as numbers; a
 *   side that is not a finite number never matches, and choices never
 *   do.</li>
 * </ul>
 * <p>An absent answer matches no condition.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ConditionEvaluator {

    private ConditionEvaluator() {
    }

    /**
     * Checks if the answer satisfies the condition.
     *
     * @param condition the edge condition
     * @param answer the answer, may be null
     * @return true if the edge may be taken
     */
    public static boolean matches(final EdgeCondition condition,
            final AnswerValue answer) {
        Preconditions.requireNonNull(condition, "Condition is required");
        if (answer == null) {
            return false;
        }
        final String value = condition.value();

        return switch (condition.type()) {
            case EQUALS -> isEqual(answer, value);
            case NOT_EQUALS -> !isEqual(answer, value);
            case CONTAINS -> contains(answer, value);
            case GREATER_THAN -> compare(answer, value) > 0;
            case LESS_THAN -> compare(answer, value) < 0;
        };
    }

    private static boolean isEqual(final AnswerValue answer,
            final String value) {
        if (answer instanceof AnswerValue.Choices choices) {
            return choices.values().contains(value);
        }
        if (answer instanceof AnswerValue.Numeric numeric) {
            final Double expected = toNumber(value);
            if (expected != null) {
                return Double.compare(numeric.value(), expected) == 0;
            }
        }
        return answer.display().equals(value);
    }

    private static boolean contains(final AnswerValue answer,
            final String value) {
        if (answer instanceof AnswerValue.Choices choices) {
            return choices.values().contains(value);
        }
        return answer.display().toLowerCase(Locale.ROOT)
                .contains(value.toLowerCase(Locale.ROOT));
    }

    /**
     * Compares answer and value as numbers.
     *
     * @return the sign of answer minus value, or 0 when either side is not
     *         a number so that neither ordering condition matches
     */
    private static int compare(final AnswerValue answer, final String value) {
        final Double expected = toNumber(value);
        if (expected == null) {
            return 0;
        }
        final Double actual;
        if (answer instanceof AnswerValue.Numeric numeric) {
            actual = Double.isFinite(numeric.value()) ? numeric.value() : null;
        } else if (answer instanceof AnswerValue.Text text) {
            actual = toNumber(text.value());
        } else {
            actual = null;
        }
        if (actual == null || actual.doubleValue() == expected.doubleValue()) {
            return 0;
        }
        return actual < expected ? -1 : 1;
    }

    /**
     * Parses a finite number.
     *
     * @param text the text, may be blank
     * @return the number, or null if the text is not a finite number
     */
    static Double toNumber(final String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            final double number = Double.parseDouble(text.trim());
            return Double.isFinite(number) ? number : null;
        } catch (final NumberFormatException e) {
            return null;
        }
    }
}
