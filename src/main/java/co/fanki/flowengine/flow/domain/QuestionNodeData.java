package co.fanki.flowengine.flow.domain;

import co.fanki.flowengine.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Payload of a question screen.
 *
 * <p>Immutable: every {@code with...} method returns a new instance. Only
 * the fields that make sense for the question type are populated; the
 * others stay null. Option-bearing types carry {@link #options()}, scaled
 * types carry the min/max range and its labels, text types carry a
 * placeholder and a maximum length.</p>
 *
 * <p>Scoring lives here as well: each option may be worth points, and the
 * question itself may be worth {@link #points()} when the answer equals
 * {@link #correctAnswer()}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class QuestionNodeData implements NodeData {

    private final QuestionType questionType;
    private final String questionText;
    private final String description;
    private final boolean required;
    private final List<QuestionOption> options;
    private final boolean enableBranching;
    private final Double minValue;
    private final Double maxValue;
    private final String minLabel;
    private final String maxLabel;
    private final String placeholder;
    private final Integer maxLength;
    private final Integer minSelections;
    private final Integer maxSelections;
    private final Integer points;
    private final List<String> correctAnswer;

    private QuestionNodeData(
            final QuestionType theQuestionType,
            final String theQuestionText,
            final String theDescription,
            final boolean isRequired,
            final List<QuestionOption> theOptions,
            final boolean isBranchingEnabled,
            final Double theMinValue,
            final Double theMaxValue,
            final String theMinLabel,
            final String theMaxLabel,
            final String thePlaceholder,
            final Integer theMaxLength,
            final Integer theMinSelections,
            final Integer theMaxSelections,
            final Integer thePoints,
            final List<String> theCorrectAnswer) {
        this.questionType = Preconditions.requireNonNull(theQuestionType,
                "Question type is required");
        this.questionText = theQuestionText == null ? "" : theQuestionText;
        this.description = theDescription;
        this.required = isRequired;
        this.options = theOptions == null ? null : List.copyOf(theOptions);
        this.enableBranching = isBranchingEnabled;
        this.minValue = theMinValue;
        this.maxValue = theMaxValue;
        this.minLabel = theMinLabel;
        this.maxLabel = theMaxLabel;
        this.placeholder = thePlaceholder;
        this.maxLength = theMaxLength;
        this.minSelections = theMinSelections;
        this.maxSelections = theMaxSelections;
        this.points = thePoints;
        this.correctAnswer = theCorrectAnswer == null
                ? null : List.copyOf(theCorrectAnswer);
    }

    /**
     * Creates a bare question with no type-specific fields.
     *
     * <p>Use {@link FlowElements#createQuestionNode} for a question with
     * the editor defaults of its type.</p>
     *
     * @param questionType the question type
     * @param questionText the question text
     * @return the question payload
     */
    public static QuestionNodeData of(final QuestionType questionType,
            final String questionText) {
        return new QuestionNodeData(questionType, questionText, null, true,
                null, false, null, null, null, null, null, null, null, null,
                null, null);
    }

    /**
     * Reconstitutes a question payload from its stored form.
     *
     * @param questionType the question type
     * @param questionText the question text
     * @param description the helper text, may be null
     * @param required whether an answer is mandatory
     * @param options the options, null for types without options
     * @param enableBranching whether each option shows its own handle
     * @param minValue the lower bound of a scale, may be null
     * @param maxValue the upper bound of a scale, may be null
     * @param minLabel the label of the lower bound, may be null
     * @param maxLabel the label of the upper bound, may be null
     * @param placeholder the input placeholder, may be null
     * @param maxLength the maximum text length, may be null
     * @param minSelections the minimum selections of a multi choice
     * @param maxSelections the maximum selections of a multi choice
     * @param points the points for a correct answer, may be null
     * @param correctAnswer the correct answer values, may be null
     * @return the question payload
     */
    public static QuestionNodeData reconstitute(
            final QuestionType questionType,
            final String questionText,
            final String description,
            final boolean required,
            final List<QuestionOption> options,
            final boolean enableBranching,
            final Double minValue,
            final Double maxValue,
            final String minLabel,
            final String maxLabel,
            final String placeholder,
            final Integer maxLength,
            final Integer minSelections,
            final Integer maxSelections,
            final Integer points,
            final List<String> correctAnswer) {
        return new QuestionNodeData(questionType, questionText, description,
                required, options, enableBranching, minValue, maxValue,
                minLabel, maxLabel, placeholder, maxLength, minSelections,
                maxSelections, points, correctAnswer);
    }

    @Override
    public NodeType nodeType() {
        return NodeType.QUESTION;
    }

    @Override
    public List<String> textFields() {
        final List<String> fields = new ArrayList<>();
        fields.add(questionText);
        if (description != null) {
            fields.add(description);
        }
        return fields;
    }

    // -- Copies --------------------------------------------------------------

    /**
     * Returns a copy with a different question text.
     *
     * @param text the new text
     * @return the copy
     */
    public QuestionNodeData withQuestionText(final String text) {
        return new QuestionNodeData(questionType, text, description,
                required, options, enableBranching, minValue, maxValue,
                minLabel, maxLabel, placeholder, maxLength, minSelections,
                maxSelections, points, correctAnswer);
    }

    /**
     * Returns a copy with a different helper text.
     *
     * @param text the new helper text, may be null
     * @return the copy
     */
    public QuestionNodeData withDescription(final String text) {
        return new QuestionNodeData(questionType, questionText, text,
                required, options, enableBranching, minValue, maxValue,
                minLabel, maxLabel, placeholder, maxLength, minSelections,
                maxSelections, points, correctAnswer);
    }

    /**
     * Returns a copy with a different required flag.
     *
     * @param isRequired whether an answer is mandatory
     * @return the copy
     */
    public QuestionNodeData withRequired(final boolean isRequired) {
        return new QuestionNodeData(questionType, questionText, description,
                isRequired, options, enableBranching, minValue, maxValue,
                minLabel, maxLabel, placeholder, maxLength, minSelections,
                maxSelections, points, correctAnswer);
    }

    /**
     * Returns a copy with a different options list.
     *
     * @param theOptions the new options
     * @return the copy
     */
    public QuestionNodeData withOptions(final List<QuestionOption> theOptions) {
        return new QuestionNodeData(questionType, questionText, description,
                required, theOptions, enableBranching, minValue, maxValue,
                minLabel, maxLabel, placeholder, maxLength, minSelections,
                maxSelections, points, correctAnswer);
    }

    /**
     * Returns a copy with a different numeric range.
     *
     * @param min the lower bound, may be null
     * @param max the upper bound, may be null
     * @param theMinLabel the lower bound label, may be null
     * @param theMaxLabel the upper bound label, may be null
     * @return the copy
     */
    public QuestionNodeData withScale(final Double min, final Double max,
            final String theMinLabel, final String theMaxLabel) {
        return new QuestionNodeData(questionType, questionText, description,
                required, options, enableBranching, min, max,
                theMinLabel, theMaxLabel, placeholder, maxLength,
                minSelections, maxSelections, points, correctAnswer);
    }

    /**
     * Returns a copy with a different text input configuration.
     *
     * @param thePlaceholder the placeholder, may be null
     * @param theMaxLength the maximum length, may be null
     * @return the copy
     */
    public QuestionNodeData withTextInput(final String thePlaceholder,
            final Integer theMaxLength) {
        return new QuestionNodeData(questionType, questionText, description,
                required, options, enableBranching, minValue, maxValue,
                minLabel, maxLabel, thePlaceholder, theMaxLength,
                minSelections, maxSelections, points, correctAnswer);
    }

    /**
     * Returns a copy scored with a correct answer.
     *
     * @param thePoints the points for a correct answer, may be null
     * @param theCorrectAnswer the correct values, may be null
     * @return the copy
     */
    public QuestionNodeData withScoring(final Integer thePoints,
            final List<String> theCorrectAnswer) {
        return new QuestionNodeData(questionType, questionText, description,
                required, options, enableBranching, minValue, maxValue,
                minLabel, maxLabel, placeholder, maxLength, minSelections,
                maxSelections, thePoints, theCorrectAnswer);
    }

    // -- Queries -------------------------------------------------------------

    /**
     * Finds an option by id.
     *
     * @param optionId the option id
     * @return the option, or null if this question has no such option
     */
    public QuestionOption option(final String optionId) {
        for (final QuestionOption option : options()) {
            if (option.id().equals(optionId)) {
                return option;
            }
        }
        return null;
    }

    /**
     * Checks if this question has an option with the given id.
     *
     * @param optionId the option id
     * @return true if the option exists
     */
    public boolean hasOption(final String optionId) {
        return option(optionId) != null;
    }

    public QuestionType questionType() {
        return questionType;
    }

    public String questionText() {
        return questionText;
    }

    public String description() {
        return description;
    }

    public boolean required() {
        return required;
    }

    /**
     * Returns the options of this question.
     *
     * @return unmodifiable options, empty when the type has none
     */
    public List<QuestionOption> options() {
        return options == null ? List.of() : options;
    }

    /** Whether the options list is present at all, even if empty. */
    public boolean hasOptionsList() {
        return options != null;
    }

    public boolean enableBranching() {
        return enableBranching;
    }

    public Double minValue() {
        return minValue;
    }

    public Double maxValue() {
        return maxValue;
    }

    public String minLabel() {
        return minLabel;
    }

    public String maxLabel() {
        return maxLabel;
    }

    public String placeholder() {
        return placeholder;
    }

    public Integer maxLength() {
        return maxLength;
    }

    public Integer minSelections() {
        return minSelections;
    }

    public Integer maxSelections() {
        return maxSelections;
    }

    public Integer points() {
        return points;
    }

    /**
     * Returns the correct answer values.
     *
     * @return the values, or null when the question is not graded
     */
    public List<String> correctAnswer() {
        return correctAnswer;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QuestionNodeData)) {
            return false;
        }
        final QuestionNodeData that = (QuestionNodeData) o;
        return required == that.required
                && enableBranching == that.enableBranching
                && questionType == that.questionType
                && questionText.equals(that.questionText)
                && Objects.equals(description, that.description)
                && Objects.equals(options, that.options)
                && Objects.equals(minValue, that.minValue)
                && Objects.equals(maxValue, that.maxValue)
                && Objects.equals(minLabel, that.minLabel)
                && Objects.equals(maxLabel, that.maxLabel)
                && Objects.equals(placeholder, that.placeholder)
                && Objects.equals(maxLength, that.maxLength)
                && Objects.equals(minSelections, that.minSelections)
                && Objects.equals(maxSelections, that.maxSelections)
                && Objects.equals(points, that.points)
                && Objects.equals(correctAnswer, that.correctAnswer);
    }

    @Override
    public int hashCode() {
        return Objects.hash(questionType, questionText, description,
                required, options, enableBranching, minValue, maxValue,
                minLabel, maxLabel, placeholder, maxLength, minSelections,
                maxSelections, points, correctAnswer);
    }

    @Override
    public String toString() {
        return "QuestionNodeData{" + questionType.wireName()
                + ", text='" + questionText + "'"
                + ", options=" + options().size() + "}";
    }
}
