package org.example.pysolver.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A raw requirement string that could not be parsed.
 */
@JsonPropertyOrder({"requirement", "details"})
public class UnparsedRequirement {

    private final String requirement;
    private final String details;

    public UnparsedRequirement(String requirement, String details) {
        this.requirement = requirement;
        this.details = details;
    }

    @JsonProperty("requirement")
    public String getRequirement() {
        return requirement;
    }

    @JsonProperty("details")
    public String getDetails() {
        return details;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UnparsedRequirement that = (UnparsedRequirement) o;
        return Objects.equals(requirement, that.requirement) && Objects.equals(details, that.details);
    }

    @Override
    public int hashCode() {
        return Objects.hash(requirement, details);
    }

    @Override
    public String toString() {
        return "UnparsedRequirement{requirement='" + requirement + "', details='" + details + "'}";
    }
}
