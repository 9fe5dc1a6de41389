package com.gradeflow.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single rubric criterion with its maximum point value
 */
public final class Criterion {
    private final String name;
    private final double maxPoints;
    private final String description;

    @JsonCreator
    public Criterion(
            @JsonProperty("name") String name,
            @JsonProperty("maxPoints") double maxPoints,
            @JsonProperty("description") String description) {
        this.name = Objects.requireNonNull(name, "name");
        this.maxPoints = maxPoints;
        this.description = description != null ? description : "";
    }

    public Criterion(String name, double maxPoints) {
        this(name, maxPoints, "");
    }

    public String getName() { return name; }
    public double getMaxPoints() { return maxPoints; }
    public String getDescription() { return description; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Criterion)) return false;
        Criterion other = (Criterion) o;
        return Double.compare(maxPoints, other.maxPoints) == 0
                && name.equals(other.name)
                && description.equals(other.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, maxPoints, description);
    }

    @Override
    public String toString() {
        return "Criterion{" +
                "name='" + name + '\'' +
                ", maxPoints=" + maxPoints +
                '}';
    }
}
