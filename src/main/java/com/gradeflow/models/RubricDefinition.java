package com.gradeflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Ordered, immutable scoring schema shared read-only by every submission of a job.
 */
public final class RubricDefinition {
    private final List<Criterion> criteria;

    @JsonCreator
    public RubricDefinition(@JsonProperty("criteria") List<Criterion> criteria) {
        this.criteria = criteria != null ? List.copyOf(criteria) : List.of();
    }

    public static RubricDefinition of(Criterion... criteria) {
        return new RubricDefinition(List.of(criteria));
    }

    public List<Criterion> getCriteria() { return criteria; }

    @JsonIgnore
    public double getMaxTotalPoints() {
        double total = 0.0;
        for (Criterion criterion : criteria) {
            total += criterion.getMaxPoints();
        }
        return total;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return criteria.isEmpty();
    }

    /**
     * Case-insensitive lookup by criterion name
     */
    public Optional<Criterion> findCriterion(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        return criteria.stream()
                .filter(c -> c.getName().trim().toLowerCase(Locale.ROOT).equals(key))
                .findFirst();
    }

    @Override
    public String toString() {
        return "RubricDefinition{" +
                "criteria=" + criteria.size() +
                ", maxTotalPoints=" + getMaxTotalPoints() +
                '}';
    }
}
