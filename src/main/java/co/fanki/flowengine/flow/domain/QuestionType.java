package co.fanki.flowengine.flow.domain;

import co.fanki.flowengine.shared.DomainException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The closed set of question kinds a question node can ask.
 *
 * <p>Option-bearing types carry an options list and may route each option
 * through its own edge. Scaled types carry a numeric range with labels.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum QuestionType {

    MULTIPLE_CHOICE_SINGLE("multiple_choice_single", "Multiple Choice", true, false),
    MULTIPLE_CHOICE_MULTI("multiple_choice_multi", "Checkboxes", true, false),
    SHORT_TEXT("short_text", "Short Text", false, false),
    LONG_TEXT("long_text", "Long Text", false, false),
    RATING("rating", "Rating Scale", false, true),
    YES_NO("yes_no", "Yes / No", true, false),
    NUMBER("number", "Number", false, false),
    EMAIL("email", "Email", false, false),
    DROPDOWN("dropdown", "Dropdown", true, false),
    DATE("date", "Date", false, false),
    NPS("nps", "NPS Score", false, true);

    private final String wireName;
    private final String label;
    private final boolean optionBearing;
    private final boolean scaled;

    QuestionType(final String theWireName, final String theLabel,
            final boolean isOptionBearing, final boolean isScaled) {
        this.wireName = theWireName;
        this.label = theLabel;
        this.optionBearing = isOptionBearing;
        this.scaled = isScaled;
    }

    /**
     * Returns the name used in the stored node array.
     *
     * @return the snake case wire name
     */
    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Returns the human readable label shown in the editor menus.
     *
     * @return the label
     */
    public String label() {
        return label;
    }

    /** Whether answers are picked from an options list. */
    public boolean isOptionBearing() {
        return optionBearing;
    }

    /** Whether the question is a bounded numeric scale. */
    public boolean isScaled() {
        return scaled;
    }

    /**
     * Resolves a question type from its stored name.
     *
     * @param name the wire name, e.g. {@code yes_no}
     * @return the question type
     * @throws DomainException if the name is unknown
     */
    @JsonCreator
    public static QuestionType fromWireName(final String name) {
        for (final QuestionType type : values()) {
            if (type.wireName.equals(name)) {
                return type;
            }
        }
        throw new DomainException("Unknown question type: " + name,
                DomainException.INVALID_FLOW_JSON);
    }
}
