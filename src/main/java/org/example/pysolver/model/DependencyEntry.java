package org.example.pysolver.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One installed package together with the dependencies it really declares.
 * This is a node in the dependency graph.
 *
 * <p>Entries produced by a probe carry the index URL and the artifact hashes published
 * by that index; entries of the environment snapshot carry neither.</p>
 */
@JsonPropertyOrder({"package_name", "package_version", "index_url", "content_hashes", "dependencies"})
public class DependencyEntry {

    private final String packageName;
    private final String packageVersion;
    private final String indexUrl;
    private final Set<String> contentHashes;
    private final List<Dependency> dependencies;

    private DependencyEntry(Builder builder) {
        this.packageName = Objects.requireNonNull(builder.packageName, "packageName cannot be null");
        this.packageVersion = Objects.requireNonNull(builder.packageVersion, "packageVersion cannot be null");
        this.indexUrl = builder.indexUrl;
        this.contentHashes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.contentHashes));
        this.dependencies = Collections.unmodifiableList(new ArrayList<>(builder.dependencies));
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonProperty("package_name")
    public String getPackageName() {
        return packageName;
    }

    @JsonProperty("package_version")
    public String getPackageVersion() {
        return packageVersion;
    }

    /**
     * Returns the index the package was installed from, or null for snapshot entries.
     */
    @JsonProperty("index_url")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String getIndexUrl() {
        return indexUrl;
    }

    @JsonProperty("content_hashes")
    public Set<String> getContentHashes() {
        return contentHashes;
    }

    @JsonProperty("dependencies")
    public List<Dependency> getDependencies() {
        return dependencies;
    }

    public PackageKey toPackageKey() {
        return new PackageKey(packageName, packageVersion);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DependencyEntry that = (DependencyEntry) o;
        return packageName.equals(that.packageName) &&
               packageVersion.equals(that.packageVersion) &&
               Objects.equals(indexUrl, that.indexUrl) &&
               contentHashes.equals(that.contentHashes) &&
               dependencies.equals(that.dependencies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(packageName, packageVersion, indexUrl, contentHashes, dependencies);
    }

    @Override
    public String toString() {
        return packageName + "==" + packageVersion +
               (indexUrl != null ? " from " + indexUrl : "") +
               " (" + dependencies.size() + " dependencies)";
    }

    /**
     * Builder for DependencyEntry.
     */
    public static class Builder {
        private String packageName;
        private String packageVersion;
        private String indexUrl;
        private final List<String> contentHashes = new ArrayList<>();
        private final List<Dependency> dependencies = new ArrayList<>();

        public Builder packageName(String packageName) {
            this.packageName = packageName;
            return this;
        }

        public Builder packageVersion(String packageVersion) {
            this.packageVersion = packageVersion;
            return this;
        }

        public Builder indexUrl(String indexUrl) {
            this.indexUrl = indexUrl;
            return this;
        }

        public Builder contentHashes(List<String> contentHashes) {
            this.contentHashes.clear();
            if (contentHashes != null) {
                this.contentHashes.addAll(contentHashes);
            }
            return this;
        }

        public Builder addDependency(Dependency dependency) {
            this.dependencies.add(dependency);
            return this;
        }

        public Builder dependencies(List<Dependency> dependencies) {
            this.dependencies.clear();
            if (dependencies != null) {
                this.dependencies.addAll(dependencies);
            }
            return this;
        }

        public DependencyEntry build() {
            return new DependencyEntry(this);
        }
    }
}
