package co.fanki.flowengine.flow.domain;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static co.fanki.flowengine.flow.domain.FlowFixtures.choice;
import static co.fanki.flowengine.flow.domain.FlowFixtures.edge;
import static co.fanki.flowengine.flow.domain.FlowFixtures.end;
import static co.fanki.flowengine.flow.domain.FlowFixtures.start;
import static co.fanki.flowengine.flow.domain.FlowFixtures.text;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ScoreCalculator}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ScoreCalculatorTest {

    private static FlowNode graded(final FlowNode node, final int points,
            final String... correct) {
        return node.withData(node.questionData()
                .withScoring(points, List.of(correct)));
    }

    private FlowGraph quiz() {
        return FlowGraph.of(
                List.of(start("s"),
                        graded(choice("capital", "Capital of France?",
                                "Paris", "Lyon"), 5, "Paris"),
                        graded(text("planet", "Red planet?"), 3, "Mars"),
                        text("name", "Your name?"),
                        end("e")),
                List.of(edge("s", "capital"), edge("capital", "planet"),
                        edge("planet", "name"), edge("name", "e")));
    }

    @Test
    void whenScoring_givenAllCorrect_shouldEarnEveryPoint() {
        final ScoreCalculator.Score score = ScoreCalculator.calculate(quiz(),
                Map.of("capital", AnswerValue.text("Paris"),
                        "planet", AnswerValue.text("Mars"),
                        "name", AnswerValue.text("Ana")));

        assertEquals(new ScoreCalculator.Score(8, 8), score);
    }

    @Test
    void whenScoring_givenOneWrong_shouldStillCountItsMaximum() {
        final ScoreCalculator.Score score = ScoreCalculator.calculate(quiz(),
                Map.of("capital", AnswerValue.text("Lyon"),
                        "planet", AnswerValue.text("Mars")));

        assertEquals(3, score.score());
        assertEquals(8, score.maxScore());
    }

    @Test
    void whenScoring_givenUnansweredOrUnknownNodes_shouldIgnoreThem() {
        final ScoreCalculator.Score score = ScoreCalculator.calculate(quiz(),
                Map.of("ghost", AnswerValue.text("Paris")));

        assertEquals(new ScoreCalculator.Score(0, 0), score);
    }

    @Test
    void whenCheckingCorrectness_givenMultiSelect_shouldNeedTheExactSet() {
        final QuestionNodeData question = QuestionNodeData.of(
                QuestionType.MULTIPLE_CHOICE_MULTI, "Primes?")
                .withScoring(4, List.of("2", "3"));

        assertTrue(ScoreCalculator.isCorrect(question,
                AnswerValue.choices("3", "2")));
        assertFalse(ScoreCalculator.isCorrect(question,
                AnswerValue.choices("2")));
        assertFalse(ScoreCalculator.isCorrect(question,
                AnswerValue.choices("2", "3", "4")));
    }

    @Test
    void whenPricingAnswer_givenOptionPoints_shouldSumChosenOptions() {
        final FlowNode node = choice("q", "Habits", "Run", "Swim", "Read");
        final QuestionNodeData data = node.questionData();
        final FlowNode pointed = node.withData(data.withOptions(List.of(
                data.options().get(0).withPoints(2),
                data.options().get(1).withPoints(5),
                data.options().get(2))));

        assertEquals(7, ScoreCalculator.pointsFor(pointed,
                AnswerValue.choices("Run", "Swim")));
        assertEquals(0, ScoreCalculator.pointsFor(pointed,
                AnswerValue.choices("Read")));
    }
}
