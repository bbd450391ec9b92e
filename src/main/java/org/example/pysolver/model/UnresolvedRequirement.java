package org.example.pysolver.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * An initial requirement whose range matched no version at the pass's index.
 */
@JsonPropertyOrder({"package_name", "version_spec", "index"})
public class UnresolvedRequirement {

    private final String packageName;
    private final String versionSpec;
    private final String index;

    public UnresolvedRequirement(String packageName, String versionSpec, String index) {
        this.packageName = Objects.requireNonNull(packageName, "packageName cannot be null");
        this.versionSpec = versionSpec != null ? versionSpec : "";
        this.index = index;
    }

    @JsonProperty("package_name")
    public String getPackageName() {
        return packageName;
    }

    @JsonProperty("version_spec")
    public String getVersionSpec() {
        return versionSpec;
    }

    @JsonProperty("index")
    public String getIndex() {
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UnresolvedRequirement that = (UnresolvedRequirement) o;
        return packageName.equals(that.packageName) &&
               versionSpec.equals(that.versionSpec) &&
               Objects.equals(index, that.index);
    }

    @Override
    public int hashCode() {
        return Objects.hash(packageName, versionSpec, index);
    }

    @Override
    public String toString() {
        return packageName + versionSpec + " @ " + index;
    }
}
