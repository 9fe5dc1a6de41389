package com.gradeflow.models;

/**
 * Reliability indicators of a validated result, every component in [0,1]
 */
public record AccuracyMetrics(
        double mathematicalAccuracy,
        double feedbackQuality,
        double scoreReasonableness,
        double confidence,
        ConfidenceLevel level
) {
    public static final double MATH_WEIGHT = 0.4;
    public static final double FEEDBACK_WEIGHT = 0.3;
    public static final double REASONABLENESS_WEIGHT = 0.3;

    public static AccuracyMetrics of(double mathematicalAccuracy, double feedbackQuality, double scoreReasonableness) {
        double math = clampUnit(mathematicalAccuracy);
        double feedback = clampUnit(feedbackQuality);
        double reasonableness = clampUnit(scoreReasonableness);
        double confidence = clampUnit(MATH_WEIGHT * math + FEEDBACK_WEIGHT * feedback + REASONABLENESS_WEIGHT * reasonableness);
        return new AccuracyMetrics(math, feedback, reasonableness, confidence, ConfidenceLevel.of(confidence));
    }

    private static double clampUnit(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    public enum ConfidenceLevel {
        HIGH,
        MEDIUM,
        LOW;

        public static ConfidenceLevel of(double confidence) {
            if (confidence >= 0.9) return HIGH;
            else if (confidence >= 0.7) return MEDIUM;
            else return LOW;
        }
    }
}
