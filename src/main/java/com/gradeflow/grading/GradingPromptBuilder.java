package com.gradeflow.grading;

import com.gradeflow.models.Criterion;

/**
 * Builds the provider prompt for a {@link GradingRequest}
 */
public final class GradingPromptBuilder {

    private GradingPromptBuilder() {
    }

    public static String buildPrompt(GradingRequest request) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are a concise academic evaluator. Follow the rubric exactly; do not invent criteria.\n");
        prompt.append("Only award points clearly supported by evidence in the submission.\n");
        prompt.append("STRICTNESS: ").append(String.format("%.2f", request.strictness()))
              .append(" (0 = lenient, 1 = strict). ").append(strictnessGuidance(request.strictness())).append("\n\n");

        prompt.append("RUBRIC:\n");
        for (Criterion criterion : request.rubric().getCriteria()) {
            prompt.append("- ").append(criterion.getName())
                  .append(" (max ").append(formatPoints(criterion.getMaxPoints())).append(" points)");
            if (!criterion.getDescription().isBlank()) {
                prompt.append(": ").append(criterion.getDescription());
            }
            prompt.append("\n");
        }
        prompt.append("MAXIMUM TOTAL: ").append(formatPoints(request.rubric().getMaxTotalPoints())).append("\n\n");

        prompt.append("STUDENT SUBMISSION:\n");
        prompt.append(request.text()).append("\n\n");

        prompt.append("Return your response in this JSON format:\n");
        prompt.append("{\n");
        prompt.append("  \"total_score\": <sum of criteria points>,\n");
        prompt.append("  \"max_score\": ").append(formatPoints(request.rubric().getMaxTotalPoints())).append(",\n");
        prompt.append("  \"criteria_scores\": [\n");
        prompt.append("    {\"name\": \"<criterion name>\", \"points\": <number>, \"max_points\": <number>, \"feedback\": \"<evidence-based feedback>\"}\n");
        prompt.append("  ],\n");
        prompt.append("  \"feedback\": \"<overall feedback with one concrete next step>\"\n");
        prompt.append("}\n\n");

        if (request.isReformulated()) {
            prompt.append("IMPORTANT: your previous answer could not be parsed. ");
            prompt.append("Reply with ONE JSON object and nothing else: no markdown, no code fences, no commentary. ");
            prompt.append("Use exactly the criterion names listed in the rubric and plain numbers for points.\n\n");
        }

        prompt.append("FINAL REMINDER:\n");
        prompt.append("- Each criterion's points must be between 0 and its max_points\n");
        prompt.append("- total_score must equal the sum of the criteria points\n");
        prompt.append("- Return ONLY valid JSON - no extra text\n");
        return prompt.toString();
    }

    static String strictnessGuidance(double strictness) {
        if (strictness >= 0.8) {
            return "Withhold points unless the evidence fully meets the criterion.";
        } else if (strictness >= 0.4) {
            return "Award partial credit for partially met criteria.";
        } else {
            return "Give the benefit of the doubt where the intent is clear.";
        }
    }

    private static String formatPoints(double points) {
        return points == Math.rint(points) ? String.valueOf((long) points) : String.valueOf(points);
    }
}
