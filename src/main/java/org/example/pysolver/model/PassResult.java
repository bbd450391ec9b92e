package org.example.pysolver.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Everything one resolution pass produced for its installation index.
 *
 * <p>Failures never escape a pass: they are collected here next to the successfully
 * probed entries, so callers can tell "explored but failed" from "never reached".</p>
 */
@JsonPropertyOrder({"tree", "errors", "unparsed", "unresolved", "environment"})
public class PassResult {

    private final String indexUrl;
    private final List<DependencyEntry> tree;
    private final List<ResolutionError> errors;
    private final List<UnresolvedRequirement> unresolved;
    private final List<UnparsedRequirement> unparsed;
    private EnvironmentSnapshot environment;

    /**
     * Creates an empty result for the pass installing from the given index.
     */
    public PassResult(String indexUrl) {
        this.indexUrl = Objects.requireNonNull(indexUrl, "indexUrl cannot be null");
        this.tree = new ArrayList<>();
        this.errors = new ArrayList<>();
        this.unresolved = new ArrayList<>();
        this.unparsed = new ArrayList<>();
        this.environment = EnvironmentSnapshot.empty();
    }

    // Getters

    @JsonIgnore
    public String getIndexUrl() {
        return indexUrl;
    }

    @JsonProperty("tree")
    public List<DependencyEntry> getTree() {
        return Collections.unmodifiableList(tree);
    }

    @JsonProperty("errors")
    public List<ResolutionError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    @JsonProperty("unresolved")
    public List<UnresolvedRequirement> getUnresolved() {
        return Collections.unmodifiableList(unresolved);
    }

    @JsonProperty("unparsed")
    public List<UnparsedRequirement> getUnparsed() {
        return Collections.unmodifiableList(unparsed);
    }

    @JsonProperty("environment")
    public EnvironmentSnapshot getEnvironment() {
        return environment;
    }

    // Modification methods

    public void addEntry(DependencyEntry entry) {
        tree.add(Objects.requireNonNull(entry, "entry cannot be null"));
    }

    public void addError(ResolutionError error) {
        errors.add(Objects.requireNonNull(error, "error cannot be null"));
    }

    public void addUnresolved(UnresolvedRequirement requirement) {
        unresolved.add(Objects.requireNonNull(requirement, "requirement cannot be null"));
    }

    public void addUnparsed(UnparsedRequirement requirement) {
        unparsed.add(Objects.requireNonNull(requirement, "requirement cannot be null"));
    }

    public void setEnvironment(EnvironmentSnapshot environment) {
        this.environment = environment != null ? environment : EnvironmentSnapshot.empty();
    }

    // Query methods

    /**
     * Returns all probed entries for the given package name (any version).
     */
    public List<DependencyEntry> findEntries(String packageName) {
        String normalized = PackageKey.normalizeName(packageName);
        return tree.stream()
                .filter(e -> PackageKey.normalizeName(e.getPackageName()).equals(normalized))
                .collect(Collectors.toList());
    }

    /**
     * Returns the errors recorded with the given type.
     */
    public List<ResolutionError> getErrors(ResolutionError.Type type) {
        return errors.stream()
                .filter(e -> e.getType() == type)
                .collect(Collectors.toList());
    }

    /**
     * Returns true if the pass recorded no failure of any kind.
     */
    @JsonIgnore
    public boolean isClean() {
        return errors.isEmpty() && unresolved.isEmpty() && unparsed.isEmpty();
    }

    @Override
    public String toString() {
        return "PassResult{" +
                "indexUrl=" + indexUrl +
                ", tree=" + tree.size() +
                ", errors=" + errors.size() +
                ", unresolved=" + unresolved.size() +
                ", unparsed=" + unparsed.size() +
                ", environment=" + environment.getPackageCount() +
                '}';
    }

    /**
     * Returns a detailed string representation of the pass.
     */
    public String toDetailedString() {
        StringBuilder sb = new StringBuilder();
        sb.append("PassResult (").append(indexUrl).append("):\n");
        sb.append("  Tree (").append(tree.size()).append("):\n");
        for (DependencyEntry entry : tree) {
            sb.append("    - ").append(entry.getPackageName()).append("==").append(entry.getPackageVersion()).append("\n");
            for (Dependency dependency : entry.getDependencies()) {
                sb.append("        -> ").append(dependency.getEdgeDescription()).append("\n");
            }
        }
        sb.append("  Errors (").append(errors.size()).append("):\n");
        for (ResolutionError error : errors) {
            sb.append("    - ").append(error).append("\n");
        }
        return sb.toString();
    }
}
