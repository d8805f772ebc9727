package co.fanki.flowengine.flow.domain;

import co.fanki.flowengine.shared.Preconditions;
import co.fanki.flowengine.shared.ValueObject;

/**
 * One selectable answer of an option-bearing question.
 *
 * <p>The option id doubles as the edge {@code sourceHandle} when the
 * option has its own route.</p>
 *
 * @param id the option id, unique within its question
 * @param text the text shown to the respondent
 * @param points the score awarded when chosen, null when unscored
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record QuestionOption(String id, String text, Integer points)
        implements ValueObject {

    /** Validates the option id. */
    public QuestionOption {
        Preconditions.requireNonBlank(id, "Option id is required");
        text = text == null ? "" : text;
    }

    /**
     * Creates an unscored option.
     *
     * @param id the option id
     * @param text the option text
     * @return the option
     */
    public static QuestionOption of(final String id, final String text) {
        return new QuestionOption(id, text, null);
    }

    /**
     * Returns a copy of this option worth the given points.
     *
     * @param thePoints the points, null to unscore
     * @return the scored option
     */
    public QuestionOption withPoints(final Integer thePoints) {
        return new QuestionOption(id, text, thePoints);
    }
}
