package co.fanki.flowengine.flow.domain;

import co.fanki.flowengine.shared.Preconditions;
import co.fanki.flowengine.shared.ValueObject;

import java.util.List;

/**
 * A respondent's answer to one question.
 *
 * <p>Answers are always one of three shapes: free text, a list of chosen
 * option values, or a number. A single choice question answers with a
 * {@link Text} holding the option id or text; a multi choice question
 * answers with {@link Choices}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface AnswerValue extends ValueObject {

    /**
     * Returns the answer as shown inside piped text.
     *
     * @return the display form; choices are joined with a comma
     */
    String display();

    /**
     * Returns the individual values of the answer.
     *
     * @return a one-element list for text and numbers, the choices otherwise
     */
    List<String> asList();

    /**
     * Checks if the respondent gave nothing usable.
     *
     * @return true for empty text or an empty choice list
     */
    boolean isEmpty();

    static AnswerValue text(final String value) {
        return new Text(value);
    }

    static AnswerValue choices(final List<String> values) {
        return new Choices(values);
    }

    static AnswerValue choices(final String... values) {
        return new Choices(List.of(values));
    }

    static AnswerValue number(final double value) {
        return new Numeric(value);
    }

    /**
     * Renders a number the way answers and conditions compare it: integral
     * values without a fractional part.
     *
     * @param value the number
     * @return the text form, e.g. {@code 5} or {@code 2.5}
     */
    static String formatNumber(final double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)
                && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    /** A free text answer. */
    record Text(String value) implements AnswerValue {

        public Text {
            Preconditions.requireNonNull(value, "Answer text is required");
        }

        @Override
        public String display() {
            return value;
        }

        @Override
        public List<String> asList() {
            return List.of(value);
        }

        @Override
        public boolean isEmpty() {
            return value.isEmpty();
        }
    }

    /** The chosen values of a multi selection. */
    record Choices(List<String> values) implements AnswerValue {

        public Choices {
            Preconditions.requireNonNull(values, "Answer choices are required");
            values = List.copyOf(values);
        }

        @Override
        public String display() {
            return String.join(", ", values);
        }

        @Override
        public List<String> asList() {
            return values;
        }

        @Override
        public boolean isEmpty() {
            return values.isEmpty();
        }
    }

    /** A numeric answer, as given to rating, NPS and number questions. */
    record Numeric(double value) implements AnswerValue {

        @Override
        public String display() {
            return formatNumber(value);
        }

        @Override
        public List<String> asList() {
            return List.of(display());
        }

        @Override
        public boolean isEmpty() {
            return false;
        }
    }
}
