package com.gradeflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Points awarded for one rubric criterion
 */
public final class CriterionScore {
    private final String name;
    private final double points;
    private final double maxPoints;
    private final String feedback;

    @JsonCreator
    public CriterionScore(
            @JsonProperty("name") String name,
            @JsonProperty("points") double points,
            @JsonProperty("maxPoints") double maxPoints,
            @JsonProperty("feedback") String feedback) {
        this.name = name;
        this.points = points;
        this.maxPoints = maxPoints;
        this.feedback = feedback != null ? feedback : "";
    }

    public String getName() { return name; }
    public double getPoints() { return points; }
    public double getMaxPoints() { return maxPoints; }
    public String getFeedback() { return feedback; }

    public CriterionScore withPoints(double newPoints) {
        return new CriterionScore(name, newPoints, maxPoints, feedback);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CriterionScore)) return false;
        CriterionScore other = (CriterionScore) o;
        return Double.compare(points, other.points) == 0
                && Double.compare(maxPoints, other.maxPoints) == 0
                && Objects.equals(name, other.name)
                && feedback.equals(other.feedback);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, points, maxPoints, feedback);
    }

    @Override
    public String toString() {
        return name + ": " + points + "/" + maxPoints;
    }
}
