package co.fanki.flowengine.flow.domain;

import co.fanki.flowengine.shared.DomainException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Predicates an edge condition can apply to a respondent's answer.
 *
 * <p>The coercion rules for each predicate live in
 * {@link ConditionEvaluator}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ConditionType {

    EQUALS("equals"),
    NOT_EQUALS("not_equals"),
    CONTAINS("contains"),
    GREATER_THAN("greater_than"),
    LESS_THAN("less_than");

    private final String wireName;

    ConditionType(final String theWireName) {
        this.wireName = theWireName;
    }

    /**
     * Returns the name used in the stored edge array.
     *
     * @return the snake case wire name
     */
    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a condition type from its stored name.
     *
     * @param name the wire name, e.g. {@code greater_than}
     * @return the condition type
     * @throws DomainException if the name is unknown
     */
    @JsonCreator
    public static ConditionType fromWireName(final String name) {
        for (final ConditionType type : values()) {
            if (type.wireName.equals(name)) {
                return type;
            }
        }
        throw new DomainException("Unknown condition type: " + name,
                DomainException.INVALID_FLOW_JSON);
    }
}
