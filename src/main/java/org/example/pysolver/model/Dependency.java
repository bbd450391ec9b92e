package org.example.pysolver.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A dependency declared by an installed package, as reported by the environment.
 * This is an edge in the dependency graph.
 *
 * <p>{@code resolvedVersions} is filled in by the graph builder, one element per
 * configured index in configuration order. Entries of the environment snapshot keep
 * it empty.</p>
 */
@JsonPropertyOrder({"package_name", "required_version", "resolved_versions"})
public class Dependency {

    private final String packageName;
    private final String requiredVersion;
    private final List<ResolvedVersions> resolvedVersions;

    /**
     * Creates a new Dependency.
     *
     * @param packageName     the name of the required package
     * @param requiredVersion the range expression the parent declares, e.g. {@code >=2.0}
     */
    public Dependency(String packageName, String requiredVersion) {
        this.packageName = Objects.requireNonNull(packageName, "packageName cannot be null");
        this.requiredVersion = requiredVersion != null ? requiredVersion : "";
        this.resolvedVersions = new ArrayList<>();
    }

    @JsonProperty("package_name")
    public String getPackageName() {
        return packageName;
    }

    @JsonProperty("required_version")
    public String getRequiredVersion() {
        return requiredVersion;
    }

    @JsonProperty("resolved_versions")
    public List<ResolvedVersions> getResolvedVersions() {
        return Collections.unmodifiableList(resolvedVersions);
    }

    /**
     * Appends the resolution against the next configured index.
     */
    public void addResolvedVersions(ResolvedVersions resolved) {
        resolvedVersions.add(Objects.requireNonNull(resolved, "resolved cannot be null"));
    }

    /**
     * Returns a string representation of this dependency edge.
     */
    @JsonIgnore
    public String getEdgeDescription() {
        return packageName + (requiredVersion.isEmpty() ? " (any)" : " (" + requiredVersion + ")");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Dependency that = (Dependency) o;
        return packageName.equals(that.packageName) &&
               requiredVersion.equals(that.requiredVersion) &&
               resolvedVersions.equals(that.resolvedVersions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(packageName, requiredVersion, resolvedVersions);
    }

    @Override
    public String toString() {
        return getEdgeDescription();
    }
}
