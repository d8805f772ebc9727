package co.fanki.flowengine.flow.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A questionnaire described as a linear list of questions plus branch
 * hints, the shape a generator produces before it becomes a graph.
 *
 * @param title the questionnaire title
 * @param description the questionnaire description, may be null
 * @param startNode the intro copy, may be null for the defaults
 * @param endNode the outro copy, may be null for the defaults
 * @param questions the questions in the order they are asked
 * @param branching the jumps off the linear order, may be null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FlowOutline(
        String title,
        String description,
        StartDraft startNode,
        EndDraft endNode,
        List<QuestionDraft> questions,
        List<BranchHint> branching
) {

    /** Intro copy of the start screen. */
    public record StartDraft(String title, String description,
            String buttonText) {
    }

    /** Outro copy of the end screen. */
    public record EndDraft(String title, String description,
            boolean showScore) {
    }

    /**
     * One question of the outline.
     *
     * @param id the outline-local id branch hints refer to
     * @param type the question type wire name, e.g. {@code yes_no}
     * @param text the question text
     * @param description the helper text, may be null
     * @param required whether an answer is mandatory, null means true
     * @param options the option texts of option-bearing types, may be null
     * @param min the scale or number lower bound, may be null
     * @param max the scale or number upper bound, may be null
     * @param minLabel the lower bound label, may be null
     * @param maxLabel the upper bound label, may be null
     */
    public record QuestionDraft(
            String id,
            String type,
            String text,
            String description,
            Boolean required,
            List<String> options,
            Double min,
            Double max,
            String minLabel,
            String maxLabel
    ) {
    }

    /**
     * A conditional jump from one question to another, or to the end.
     *
     * @param from the outline id of the source question
     * @param condition the condition wire name, e.g. {@code equals}
     * @param value the comparison value, a string or a number
     * @param target the outline id of the target question, or
     *        {@code end}
     */
    public record BranchHint(
            String from,
            String condition,
            Object value,
            @JsonProperty("goto") String target
    ) {
    }

    public List<BranchHint> branching() {
        return branching == null ? List.of() : branching;
    }

    public List<QuestionDraft> questions() {
        return questions == null ? List.of() : questions;
    }
}
