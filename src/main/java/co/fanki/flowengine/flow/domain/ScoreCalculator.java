package co.fanki.flowengine.flow.domain;

import co.fanki.flowengine.shared.Preconditions;

import java.util.List;
import java.util.Map;

/**
 * Scores a respondent's answers.
 *
 * <p>Points come from two places on a question: each option may be worth
 * points, and the question itself may be worth points when answered with
 * its {@code correctAnswer}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ScoreCalculator {

    private ScoreCalculator() {
    }

    /**
     * The result of scoring a full submission.
     *
     * @param score the points earned
     * @param maxScore the points available over the answered questions
     */
    public record Score(int score, int maxScore) {
    }

    /**
     * Computes the points one answer earns on its question.
     *
     * <p>When any chosen option carries points the answer earns their sum;
     * otherwise it earns the question's points if it is correct.</p>
     *
     * @param node the answered node
     * @param answer the answer, may be null
     * @return the points earned, zero for anything that is not scored
     */
    public static int pointsFor(final FlowNode node, final AnswerValue answer) {
        if (node == null || answer == null || !node.isQuestion()) {
            return 0;
        }
        if (node.isOptionBearing()) {
            int total = 0;
            boolean scored = false;
            for (final String optionId
                    : FlowRouter.chosenOptionIds(node, answer)) {
                final Integer points = node.questionData().option(optionId)
                        .points();
                if (points != null) {
                    total += points;
                    scored = true;
                }
            }
            if (scored) {
                return total;
            }
        }
        final QuestionNodeData question = node.questionData();
        final Integer points = question.points();
        return points != null && isCorrect(question, answer) ? points : 0;
    }

    /**
     * Scores a submission: every answered question with points adds them
     * to the maximum, and to the score when answered correctly.
     *
     * @param graph the flow snapshot
     * @param answers the answers keyed by node id
     * @return the score and the maximum score
     */
    public static Score calculate(final FlowGraph graph,
            final Map<String, AnswerValue> answers) {
        Preconditions.requireNonNull(graph, "Graph is required");
        Preconditions.requireNonNull(answers, "Answers are required");

        int score = 0;
        int maxScore = 0;
        for (final Map.Entry<String, AnswerValue> entry : answers.entrySet()) {
            final FlowNode node = graph.node(entry.getKey());
            if (node == null || node.questionData() == null) {
                continue;
            }
            final QuestionNodeData question = node.questionData();
            final Integer points = question.points();
            if (points == null || points == 0) {
                continue;
            }
            maxScore += points;
            if (isCorrect(question, entry.getValue())) {
                score += points;
            }
        }
        return new Score(score, maxScore);
    }

    /**
     * Checks an answer against the question's correct answer: same number
     * of values, each of them among the correct ones.
     *
     * @param question the question
     * @param answer the answer, may be null
     * @return true if the question is graded and the answer is correct
     */
    public static boolean isCorrect(final QuestionNodeData question,
            final AnswerValue answer) {
        final List<String> correct = question.correctAnswer();
        if (correct == null || correct.isEmpty() || answer == null) {
            return false;
        }
        final List<String> given = answer.asList();
        return given.size() == correct.size() && correct.containsAll(given);
    }
}
