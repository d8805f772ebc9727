package co.fanki.flowengine.flow.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Where a respondent stands in a flow.
 *
 * <p>The engine keeps no session: the caller holds this value and hands it
 * back to {@link FlowRouter} on each step, getting a new value in return.
 * The score is the sum of the points earned at each answered question, so
 * answering a question again after going back replaces its points instead
 * of adding to them.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class RespondentProgress {

    private final String currentNodeId;
    private final List<String> history;
    private final Map<String, AnswerValue> answers;
    private final Map<String, Integer> points;
    private final boolean finished;

    RespondentProgress(final String theCurrentNodeId,
            final List<String> theHistory,
            final Map<String, AnswerValue> theAnswers,
            final Map<String, Integer> thePoints,
            final boolean isFinished) {
        this.currentNodeId = theCurrentNodeId;
        this.history = List.copyOf(theHistory);
        this.answers = Collections.unmodifiableMap(
                new LinkedHashMap<>(theAnswers));
        this.points = Collections.unmodifiableMap(
                new LinkedHashMap<>(thePoints));
        this.finished = isFinished;
    }

    /**
     * Creates the progress of a respondent standing on a screen with
     * nothing answered yet.
     *
     * @param nodeId the current node id
     * @return the progress
     */
    public static RespondentProgress at(final String nodeId) {
        return new RespondentProgress(nodeId, List.of(), Map.of(), Map.of(),
                false);
    }

    RespondentProgress moveTo(final String nodeId, final boolean isFinished) {
        final List<String> newHistory = new ArrayList<>(history);
        if (currentNodeId != null) {
            newHistory.add(currentNodeId);
        }
        return new RespondentProgress(nodeId, newHistory, answers, points,
                isFinished);
    }

    RespondentProgress stop() {
        return new RespondentProgress(currentNodeId, history, answers, points,
                true);
    }

    RespondentProgress answer(final String nodeId, final AnswerValue answer,
            final int earned) {
        final Map<String, AnswerValue> newAnswers =
                new LinkedHashMap<>(answers);
        newAnswers.put(nodeId, answer);
        final Map<String, Integer> newPoints = new LinkedHashMap<>(points);
        newPoints.put(nodeId, earned);
        return new RespondentProgress(currentNodeId, history, newAnswers,
                newPoints, finished);
    }

    RespondentProgress previous() {
        if (history.isEmpty()) {
            return this;
        }
        final String back = history.get(history.size() - 1);
        return new RespondentProgress(back,
                history.subList(0, history.size() - 1), answers, points,
                false);
    }

    /**
     * Returns the screen the respondent is on.
     *
     * @return the node id, or null when the flow has no start node
     */
    public String currentNodeId() {
        return currentNodeId;
    }

    /** The screens visited before the current one, oldest first. */
    public List<String> history() {
        return history;
    }

    /** The answers given so far, keyed by node id. */
    public Map<String, AnswerValue> answers() {
        return answers;
    }

    /**
     * Returns the running score.
     *
     * @return the points earned over every answered question
     */
    public int score() {
        return points.values().stream().mapToInt(Integer::intValue).sum();
    }

    public boolean finished() {
        return finished;
    }

    public boolean canGoBack() {
        return !history.isEmpty();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RespondentProgress)) {
            return false;
        }
        final RespondentProgress that = (RespondentProgress) o;
        return finished == that.finished
                && Objects.equals(currentNodeId, that.currentNodeId)
                && history.equals(that.history)
                && answers.equals(that.answers)
                && points.equals(that.points);
    }

    @Override
    public int hashCode() {
        return Objects.hash(currentNodeId, history, answers, points,
                finished);
    }

    @Override
    public String toString() {
        return "RespondentProgress{current=" + currentNodeId
                + ", history=" + history + ", score=" + score()
                + ", finished=" + finished + "}";
    }
}
