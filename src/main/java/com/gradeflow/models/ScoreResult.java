package com.gradeflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A grading result. The provider's raw output and the validator's corrected output share this shape.
 */
public final class ScoreResult {
    private final double totalScore;
    private final double maxScore;
    private final List<CriterionScore> criteriaScores;
    private final String feedback;

    @JsonCreator
    public ScoreResult(
            @JsonProperty("totalScore") double totalScore,
            @JsonProperty("maxScore") double maxScore,
            @JsonProperty("criteriaScores") List<CriterionScore> criteriaScores,
            @JsonProperty("feedback") String feedback) {
        this.totalScore = totalScore;
        this.maxScore = maxScore;
        this.criteriaScores = criteriaScores != null ? List.copyOf(criteriaScores) : List.of();
        this.feedback = feedback != null ? feedback : "";
    }

    public double getTotalScore() { return totalScore; }
    public double getMaxScore() { return maxScore; }
    public List<CriterionScore> getCriteriaScores() { return criteriaScores; }
    public String getFeedback() { return feedback; }

    @JsonIgnore
    public double getPercentage() {
        return maxScore > 0 ? totalScore / maxScore * 100.0 : 0.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScoreResult)) return false;
        ScoreResult other = (ScoreResult) o;
        return Double.compare(totalScore, other.totalScore) == 0
                && Double.compare(maxScore, other.maxScore) == 0
                && criteriaScores.equals(other.criteriaScores)
                && feedback.equals(other.feedback);
    }

    @Override
    public int hashCode() {
        return Objects.hash(totalScore, maxScore, criteriaScores, feedback);
    }

    @Override
    public String toString() {
        return "ScoreResult{" + totalScore + "/" + maxScore + ", criteria=" + criteriaScores + "}";
    }
}
