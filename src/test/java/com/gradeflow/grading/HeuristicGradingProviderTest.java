package com.gradeflow.grading;

import com.gradeflow.models.Criterion;
import com.gradeflow.models.RubricDefinition;
import com.gradeflow.models.ScoreResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class HeuristicGradingProviderTest {

    private static final RubricDefinition RUBRIC = RubricDefinition.of(
            new Criterion("Photosynthesis", 10, "Explains chlorophyll and sunlight conversion"),
            new Criterion("Writing", 10));

    private final HeuristicGradingProvider provider = new HeuristicGradingProvider();

    @Test
    void producesParseableResultWithinBounds() throws Exception {
        String text = "Plants use chlorophyll to capture sunlight. " + "More words follow here. ".repeat(40);
        String response = provider.requestGrading(new GradingRequest(text, RUBRIC, 0.5, 0));
        ScoreResult result = new ScoreResultParser().parse(response, RUBRIC);

        assertEquals(2, result.getCriteriaScores().size());
        assertEquals(20.0, result.getMaxScore());
        assertTrue(result.getTotalScore() > 0 && result.getTotalScore() <= 20.0);
        assertTrue(result.getCriteriaScores().get(0).getPoints() > result.getCriteriaScores().get(1).getPoints());
    }

    @Test
    void longerSubmissionsScoreHigher() {
        assertTrue(HeuristicGradingProvider.lengthRatio(10) < HeuristicGradingProvider.lengthRatio(100));
        assertTrue(HeuristicGradingProvider.lengthRatio(100) < HeuristicGradingProvider.lengthRatio(500));
    }

    @Test
    void stricterGradingScoresLower() throws Exception {
        String text = "word ".repeat(200);
        ScoreResultParser parser = new ScoreResultParser();
        double lenient = parser.parse(provider.requestGrading(new GradingRequest(text, RUBRIC, 0.0, 0)), RUBRIC).getTotalScore();
        double strict = parser.parse(provider.requestGrading(new GradingRequest(text, RUBRIC, 1.0, 0)), RUBRIC).getTotalScore();
        assertTrue(strict < lenient);
    }
}
