package com.gradeflow.grading;

import com.gradeflow.models.AccuracyMetrics;
import com.gradeflow.models.Criterion;
import com.gradeflow.models.CriterionScore;
import com.gradeflow.models.RubricDefinition;
import com.gradeflow.models.ScoreResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AccuracyValidatorTest {

    private static final RubricDefinition FOUR_BY_FIVE = RubricDefinition.of(
            new Criterion("Thesis", 5),
            new Criterion("Evidence", 5),
            new Criterion("Organization", 5),
            new Criterion("Style", 5));

    private final AccuracyValidator validator = new AccuracyValidator();

    private static ScoreResult result(double total, double... points) {
        String[] names = {"Thesis", "Evidence", "Organization", "Style"};
        CriterionScore[] scores = new CriterionScore[points.length];
        for (int i = 0; i < points.length; i++) {
            scores[i] = new CriterionScore(names[i], points[i], 5, "Feedback for " + names[i]);
        }
        return new ScoreResult(total, 20, List.of(scores), "Overall fine.");
    }

    @Test
    void correctsMisreportedTotal() {
        ValidationResult validation = validator.validate(result(19, 5, 5, 5, 5), FOUR_BY_FIVE);

        assertEquals(20.0, validation.validated().getTotalScore());
        assertEquals(1.0, validation.correctionMagnitude(), 1e-9);
        assertEquals(0.95, validation.metrics().mathematicalAccuracy(), 1e-9);
        assertTrue(validation.wasCorrected());
    }

    @Test
    void recomputesTotalFromSevenCriteria() {
        double[] maxes = {5, 4, 3, 2, 2, 2, 2};
        Criterion[] criteria = new Criterion[maxes.length];
        CriterionScore[] scores = new CriterionScore[maxes.length];
        for (int i = 0; i < maxes.length; i++) {
            criteria[i] = new Criterion("C" + i, maxes[i]);
            scores[i] = new CriterionScore("C" + i, maxes[i], maxes[i], "");
        }
        ScoreResult raw = new ScoreResult(19, 20, List.of(scores), "");

        ValidationResult validation = validator.validate(raw, RubricDefinition.of(criteria));
        assertEquals(20.0, validation.validated().getTotalScore());
        assertTrue(validation.metrics().mathematicalAccuracy() < 1.0);
    }

    @Test
    void clampsPointsAboveMaximum() {
        ValidationResult validation = validator.validate(result(17, 7, 4, 3, 3), FOUR_BY_FIVE);
        ScoreResult validated = validation.validated();

        assertEquals(5.0, validated.getCriteriaScores().get(0).getPoints());
        assertEquals(15.0, validated.getTotalScore());
        assertTrue(validation.corrections().stream().anyMatch(c -> c.contains("clamped")));
    }

    @Test
    void negativeAndNaNPointsBecomeZero() {
        ValidationResult validation = validator.validate(result(Double.NaN, -2, Double.NaN, 3, 3), FOUR_BY_FIVE);
        ScoreResult validated = validation.validated();

        assertEquals(0.0, validated.getCriteriaScores().get(0).getPoints());
        assertEquals(0.0, validated.getCriteriaScores().get(1).getPoints());
        assertEquals(6.0, validated.getTotalScore());
        assertEquals(0.0, validation.metrics().mathematicalAccuracy());
    }

    @Test
    void validatedResultHoldsInvariants() {
        ValidationResult validation = validator.validate(result(13.37, 3.33, 3.34, 3.35, 3.35), FOUR_BY_FIVE);
        ScoreResult validated = validation.validated();

        double sum = 0.0;
        for (CriterionScore score : validated.getCriteriaScores()) {
            assertTrue(score.getPoints() >= 0 && score.getPoints() <= score.getMaxPoints());
            sum += score.getPoints();
        }
        assertEquals(AccuracyValidator.roundOneDecimal(sum), validated.getTotalScore());
        assertEquals(20.0, validated.getMaxScore());
        AccuracyMetrics metrics = validation.metrics();
        assertTrue(metrics.confidence() >= 0 && metrics.confidence() <= 1);
    }

    @Test
    void roundingNeverExceedsFractionalMaximum() {
        RubricDefinition rubric = RubricDefinition.of(new Criterion("A", 2.25), new Criterion("B", 2.25));
        ScoreResult raw = new ScoreResult(4.5, 4.5, List.of(
                new CriterionScore("A", 2.25, 2.25, "a"),
                new CriterionScore("B", 2.25, 2.25, "b")), "");

        ScoreResult validated = validator.validate(raw, rubric).validated();
        for (CriterionScore score : validated.getCriteriaScores()) {
            assertEquals(2.2, score.getPoints());
            assertTrue(score.getPoints() <= score.getMaxPoints());
        }
        assertEquals(4.4, validated.getTotalScore());
        assertTrue(validated.getTotalScore() <= validated.getMaxScore());
        assertEquals("A: 2.2/2.25", validated.getCriteriaScores().get(0).toString());

        ValidationResult again = validator.validate(validated, rubric);
        assertEquals(validated, again.validated());
        assertFalse(again.wasCorrected());
    }

    @Test
    void validationIsIdempotent() {
        ScoreResult once = validator.validate(result(19, 5, 4.44, 3.26, 7), FOUR_BY_FIVE).validated();
        ValidationResult twice = validator.validate(once, FOUR_BY_FIVE);

        assertEquals(once, twice.validated());
        assertFalse(twice.wasCorrected());
        assertEquals(1.0, twice.metrics().mathematicalAccuracy());
    }

    @Test
    void alignsCriteriaToRubric() {
        RubricDefinition rubric = RubricDefinition.of(
                new Criterion("Thesis", 10),
                new Criterion("Evidence", 10),
                new Criterion("Style", 10));
        ScoreResult raw = new ScoreResult(21, 30, List.of(
                new CriterionScore("evidence", 6, 10, "e"),
                new CriterionScore("Argument", 8, 10, "a"),
                new CriterionScore("Spelling", 7, 10, "s")), "");

        ValidationResult validation = validator.validate(raw, rubric);
        List<CriterionScore> scores = validation.validated().getCriteriaScores();

        assertEquals(List.of("Thesis", "Evidence", "Style"), List.of(
                scores.get(0).getName(), scores.get(1).getName(), scores.get(2).getName()));
        assertEquals(8.0, scores.get(0).getPoints());
        assertEquals(6.0, scores.get(1).getPoints());
        assertEquals(7.0, scores.get(2).getPoints());
        assertEquals(2, validation.corrections().stream().filter(c -> c.contains("matched by position")).count());
    }

    @Test
    void missingCriterionScoresZeroAndExtraIsDropped() {
        RubricDefinition rubric = RubricDefinition.of(new Criterion("Thesis", 10), new Criterion("Style", 10));
        ScoreResult raw = new ScoreResult(9, 20, List.of(new CriterionScore("Thesis", 9, 10, "ok")), "");

        ScoreResult validated = validator.validate(raw, rubric).validated();
        assertEquals(2, validated.getCriteriaScores().size());
        assertEquals(0.0, validated.getCriteriaScores().get(1).getPoints());
        assertEquals("Not assessed", validated.getCriteriaScores().get(1).getFeedback());

        ScoreResult extra = new ScoreResult(12, 20, List.of(
                new CriterionScore("Thesis", 5, 10, ""),
                new CriterionScore("Style", 5, 10, ""),
                new CriterionScore("Bonus", 2, 10, "")), "");
        ValidationResult dropped = validator.validate(extra, rubric);
        assertEquals(10.0, dropped.validated().getTotalScore());
        assertTrue(dropped.corrections().stream().anyMatch(c -> c.contains("Bonus")));
    }

    @Test
    void detailedFeedbackScoresHigherThanTerseFeedback() {
        RubricDefinition rubric = RubricDefinition.of(new Criterion("Analysis", 10));
        ScoreResult terse = new ScoreResult(7, 10, List.of(new CriterionScore("Analysis", 7, 10, "ok")), "Good.");
        ScoreResult detailed = new ScoreResult(7, 10, List.of(new CriterionScore("Analysis", 7, 10,
                "The analysis demonstrates a clear grasp of the data, for example in section 2.")),
                "Overall a strong submission. Its main strength is the analysis; however, the conclusion "
                        + "is rushed. Consider adding a paragraph that specifically ties the findings back "
                        + "to the research question.");

        assertTrue(validator.feedbackQuality(detailed) > validator.feedbackQuality(terse));
        assertTrue(validator.feedbackQuality(detailed) <= 1.0);
    }

    @Test
    void extremeOrUnevenScoresAreLessReasonable() {
        ScoreResult balanced = result(12, 3, 3, 3, 3);
        ScoreResult perfect = result(20, 5, 5, 5, 5);
        ScoreResult uneven = result(10, 5, 0, 5, 0);

        assertEquals(1.0, validator.scoreReasonableness(balanced), 1e-9);
        assertTrue(validator.scoreReasonableness(perfect) < validator.scoreReasonableness(balanced));
        assertTrue(validator.scoreReasonableness(uneven) < validator.scoreReasonableness(balanced));
    }
}
