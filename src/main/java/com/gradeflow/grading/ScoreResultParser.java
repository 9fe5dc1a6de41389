package com.gradeflow.grading;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gradeflow.models.Criterion;
import com.gradeflow.models.CriterionScore;
import com.gradeflow.models.RubricDefinition;
import com.gradeflow.models.ScoreResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the provider's free-text answer into a raw {@link ScoreResult}.
 * The result is not validated; only its shape is checked.
 */
public class ScoreResultParser {
    private final ObjectMapper objectMapper;

    public ScoreResultParser() {
        this(new ObjectMapper());
    }

    public ScoreResultParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ScoreResult parse(String response, RubricDefinition rubric) throws MalformedResponseException {
        if (response == null || response.isBlank()) {
            throw new MalformedResponseException("Empty provider response");
        }

        // Extract JSON from response (models sometimes wrap it in prose or code fences)
        int jsonStart = response.indexOf('{');
        int jsonEnd = response.lastIndexOf('}') + 1;
        if (jsonStart < 0 || jsonEnd <= jsonStart) {
            throw new MalformedResponseException("No JSON object in provider response");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response.substring(jsonStart, jsonEnd));
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("Provider response is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedResponseException("Provider response is not a JSON object");
        }

        JsonNode criteriaNode = first(root, "criteria_scores", "criteriaScores", "criteria");
        if (criteriaNode == null || !criteriaNode.isArray() || criteriaNode.size() == 0) {
            throw new MalformedResponseException("Provider response has no criteria_scores");
        }

        List<CriterionScore> criteria = new ArrayList<>();
        double criteriaSum = 0.0;
        for (JsonNode item : criteriaNode) {
            String name = text(first(item, "name", "criterion", "category"));
            if (name == null || name.isBlank()) {
                throw new MalformedResponseException("Criterion entry without a name");
            }
            double points = number(first(item, "points", "score"), "points of " + name);
            JsonNode maxNode = first(item, "max_points", "maxPoints", "max");
            double maxPoints = maxNode != null
                    ? number(maxNode, "max_points of " + name)
                    : rubric.findCriterion(name).map(Criterion::getMaxPoints).orElse(0.0);
            String feedback = text(first(item, "feedback", "comment", "justification"));
            criteria.add(new CriterionScore(name.trim(), points, maxPoints, feedback));
            criteriaSum += points;
        }

        JsonNode totalNode = first(root, "total_score", "totalScore", "score");
        double total = totalNode != null ? number(totalNode, "total_score") : criteriaSum;
        JsonNode maxNode = first(root, "max_score", "maxScore", "total");
        double maxScore = maxNode != null ? number(maxNode, "max_score") : rubric.getMaxTotalPoints();
        String feedback = text(first(root, "feedback", "grading_feedback", "overall_feedback"));

        return new ScoreResult(total, maxScore, criteria, feedback);
    }

    private static JsonNode first(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    private static double number(JsonNode node, String field) throws MalformedResponseException {
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new MalformedResponseException("Non-numeric " + field + ": " + node.asText());
            }
        }
        throw new MalformedResponseException("Non-numeric " + field);
    }

    private static String text(JsonNode node) {
        return node == null ? null : node.asText();
    }
}
