package org.example.pysolver.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Concrete versions satisfying a dependency range at one index.
 */
@JsonPropertyOrder({"index_url", "versions"})
public class ResolvedVersions {

    private final String indexUrl;
    private final List<String> versions;

    public ResolvedVersions(String indexUrl, List<String> versions) {
        this.indexUrl = Objects.requireNonNull(indexUrl, "indexUrl cannot be null");
        this.versions = versions != null ? List.copyOf(versions) : List.of();
    }

    @JsonProperty("index_url")
    public String getIndexUrl() {
        return indexUrl;
    }

    @JsonProperty("versions")
    public List<String> getVersions() {
        return versions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResolvedVersions that = (ResolvedVersions) o;
        return indexUrl.equals(that.indexUrl) && versions.equals(that.versions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(indexUrl, versions);
    }

    @Override
    public String toString() {
        return indexUrl + " -> " + versions;
    }
}
