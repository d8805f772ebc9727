package co.fanki.flowengine.flow.domain;

import co.fanki.flowengine.shared.DomainException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The three kinds of screen in a flow.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum NodeType {

    /** The welcome screen, exactly one per publishable flow. */
    START("start"),

    /** A screen that asks the respondent one question. */
    QUESTION("question"),

    /** A closing screen; reaching one finishes the flow. */
    END("end");

    private final String wireName;

    NodeType(final String theWireName) {
        this.wireName = theWireName;
    }

    /**
     * Returns the name used in the stored node array.
     *
     * @return the lower case wire name
     */
    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a node type from its stored name.
     *
     * @param name the wire name, e.g. {@code question}
     * @return the node type
     * @throws DomainException if the name is unknown
     */
    @JsonCreator
    public static NodeType fromWireName(final String name) {
        for (final NodeType type : values()) {
            if (type.wireName.equals(name)) {
                return type;
            }
        }
        throw new DomainException("Unknown node type: " + name,
                DomainException.INVALID_FLOW_JSON);
    }
}
