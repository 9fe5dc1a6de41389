package com.gradeflow.grading;

import com.gradeflow.models.AccuracyMetrics;
import com.gradeflow.models.Criterion;
import com.gradeflow.models.CriterionScore;
import com.gradeflow.models.RubricDefinition;
import com.gradeflow.models.ScoreResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Corrects a provider score result against the rubric and rates how trustworthy it is.
 *
 * <p>Pure and idempotent: validating an already validated result returns an equal result and
 * records no corrections. The validated total is always the one-decimal sum of the rounded
 * criterion points, so it never drifts from the breakdown. Rounding never takes a criterion above its maximum.
 */
public class AccuracyValidator {
    private static final Logger logger = LoggerFactory.getLogger(AccuracyValidator.class);

    public static final double TOTAL_TOLERANCE = 0.05;

    private static final String[] STRUCTURE_WORDS = {
            "overall", "strength", "improvement", "however", "weakness"
    };
    private static final String[] CONSTRUCTIVE_WORDS = {
            "suggest", "recommend", "improve", "consider", "could", "should", "next step", "enhance", "strengthen"
    };
    private static final String[] EVIDENCE_MARKERS = {
            "for example", "specifically", "demonstrates", "shows", "evident", "such as",
            "quote", "\"", "line ", "section", "paragraph", "implementation"
    };

    public ValidationResult validate(ScoreResult raw, RubricDefinition rubric) {
        List<String> corrections = new ArrayList<>();
        List<CriterionScore> clamped = alignAndClamp(raw.getCriteriaScores(), rubric, corrections);

        double recomputedTotal = 0.0;
        for (CriterionScore score : clamped) {
            recomputedTotal += score.getPoints();
        }

        double correctionMagnitude = 0.0;
        double difference = Math.abs(recomputedTotal - raw.getTotalScore());
        if (Double.isNaN(raw.getTotalScore()) || difference > TOTAL_TOLERANCE) {
            correctionMagnitude = Double.isNaN(difference) ? rubric.getMaxTotalPoints() : difference;
            corrections.add(String.format(Locale.ROOT, "Total corrected from %.2f to %.2f",
                    raw.getTotalScore(), recomputedTotal));
        }

        List<CriterionScore> rounded = new ArrayList<>(clamped.size());
        double roundedSum = 0.0;
        for (CriterionScore score : clamped) {
            double points = roundWithin(score.getPoints(), score.getMaxPoints());
            rounded.add(score.withPoints(points));
            roundedSum += points;
        }

        ScoreResult validated = new ScoreResult(
                roundOneDecimal(roundedSum),
                rubric.getMaxTotalPoints(),
                rounded,
                raw.getFeedback());

        double maxTotal = rubric.getMaxTotalPoints();
        double mathematicalAccuracy = maxTotal > 0
                ? 1.0 - Math.min(1.0, correctionMagnitude / maxTotal)
                : (correctionMagnitude > 0 ? 0.0 : 1.0);
        AccuracyMetrics metrics = AccuracyMetrics.of(
                mathematicalAccuracy,
                feedbackQuality(validated),
                scoreReasonableness(validated));

        for (String correction : corrections) {
            logger.warn("Validation correction: {}", correction);
        }
        logger.debug("Validated result {} with confidence {} ({})",
                validated, String.format("%.3f", metrics.confidence()), metrics.level());

        return new ValidationResult(validated, metrics, corrections, correctionMagnitude);
    }

    /**
     * One score per rubric criterion, in rubric order, with rubric max points and points clamped into range.
     * Raw entries are matched by name first; leftovers are paired by position.
     */
    private List<CriterionScore> alignAndClamp(List<CriterionScore> rawScores, RubricDefinition rubric,
                                               List<String> corrections) {
        List<Criterion> criteria = rubric.getCriteria();
        CriterionScore[] matched = new CriterionScore[criteria.size()];
        boolean[] used = new boolean[rawScores.size()];

        for (int i = 0; i < criteria.size(); i++) {
            String key = normalize(criteria.get(i).getName());
            for (int j = 0; j < rawScores.size(); j++) {
                if (!used[j] && key.equals(normalize(rawScores.get(j).getName()))) {
                    matched[i] = rawScores.get(j);
                    used[j] = true;
                    break;
                }
            }
        }
        int next = 0;
        for (int i = 0; i < criteria.size(); i++) {
            if (matched[i] != null) {
                continue;
            }
            while (next < rawScores.size() && used[next]) {
                next++;
            }
            if (next < rawScores.size()) {
                matched[i] = rawScores.get(next);
                used[next] = true;
                corrections.add("Criterion '" + rawScores.get(next).getName() + "' matched by position to '"
                        + criteria.get(i).getName() + "'");
            }
        }
        for (int j = 0; j < rawScores.size(); j++) {
            if (!used[j]) {
                corrections.add("Dropped criterion not in rubric: '" + rawScores.get(j).getName() + "'");
            }
        }

        List<CriterionScore> result = new ArrayList<>(criteria.size());
        for (int i = 0; i < criteria.size(); i++) {
            Criterion criterion = criteria.get(i);
            CriterionScore source = matched[i];
            if (source == null) {
                corrections.add("Criterion '" + criterion.getName() + "' missing from result, scored 0");
                result.add(new CriterionScore(criterion.getName(), 0.0, criterion.getMaxPoints(), "Not assessed"));
                continue;
            }
            double points = clamp(source.getPoints(), criterion.getMaxPoints());
            if (Double.compare(points, source.getPoints()) != 0) {
                corrections.add(String.format(Locale.ROOT, "Criterion '%s' clamped from %.2f to %.2f",
                        criterion.getName(), source.getPoints(), points));
            }
            result.add(new CriterionScore(criterion.getName(), points, criterion.getMaxPoints(), source.getFeedback()));
        }
        return result;
    }

    double feedbackQuality(ScoreResult result) {
        String overall = result.getFeedback();
        String lower = overall.toLowerCase(Locale.ROOT);
        double score = 0.0;

        if (overall.length() > 150) {
            score += 0.25;
        } else if (overall.length() > 75) {
            score += 0.15;
        } else if (overall.length() > 25) {
            score += 0.05;
        }
        if (containsAny(lower, STRUCTURE_WORDS)) {
            score += 0.1;
        }
        if (containsAny(lower, CONSTRUCTIVE_WORDS)) {
            score += 0.1;
        }

        StringBuilder allFeedback = new StringBuilder(lower);
        int detailed = 0;
        for (CriterionScore criterion : result.getCriteriaScores()) {
            allFeedback.append(' ').append(criterion.getFeedback().toLowerCase(Locale.ROOT));
            if (criterion.getFeedback().trim().length() > 20) {
                detailed++;
            }
        }
        int evidence = countMarkers(allFeedback.toString(), EVIDENCE_MARKERS);
        if (evidence >= 3) {
            score += 0.2;
        } else if (evidence >= 1) {
            score += 0.1;
        }
        if (!result.getCriteriaScores().isEmpty()) {
            score += 0.35 * detailed / result.getCriteriaScores().size();
        }
        return Math.min(1.0, score);
    }

    double scoreReasonableness(ScoreResult result) {
        if (result.getMaxScore() <= 0) {
            return 0.5;
        }
        double ratio = result.getTotalScore() / result.getMaxScore();
        double rangeScore;
        if (ratio >= 0.05 && ratio <= 0.95) {
            rangeScore = 1.0;
        } else if (ratio >= 0.0 && ratio <= 1.0) {
            rangeScore = 0.8;
        } else {
            rangeScore = 0.2;
        }

        List<Double> ratios = new ArrayList<>();
        for (CriterionScore criterion : result.getCriteriaScores()) {
            if (criterion.getMaxPoints() > 0) {
                ratios.add(criterion.getPoints() / criterion.getMaxPoints());
            }
        }
        double distributionScore = ratios.size() > 1 ? Math.max(0.0, 1.0 - standardDeviation(ratios) * 1.5) : 1.0;
        return rangeScore * 0.6 + distributionScore * 0.4;
    }

    static double roundOneDecimal(double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * One-decimal rounding that never lands above {@code maxPoints}, which may itself carry more decimals
     */
    static double roundWithin(double points, double maxPoints) {
        double rounded = roundOneDecimal(points);
        if (rounded <= maxPoints) {
            return rounded;
        }
        return BigDecimal.valueOf(maxPoints).setScale(1, RoundingMode.FLOOR).doubleValue();
    }

    private static double clamp(double points, double maxPoints) {
        if (Double.isNaN(points)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(maxPoints, points));
    }

    private static double standardDeviation(List<Double> values) {
        double mean = 0.0;
        for (double v : values) {
            mean += v;
        }
        mean /= values.size();
        double squares = 0.0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        return Math.sqrt(squares / (values.size() - 1));
    }

    private static boolean containsAny(String text, String[] words) {
        for (String word : words) {
            if (text.contains(word)) {
                return true;
            }
        }
        return false;
    }

    private static int countMarkers(String text, String[] markers) {
        int count = 0;
        for (String marker : markers) {
            if (text.contains(marker)) {
                count++;
            }
        }
        return count;
    }

    private static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
