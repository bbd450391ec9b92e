package org.example.pysolver.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A package version that was reached by the traversal but could not be probed.
 */
@JsonPropertyOrder({"package_name", "index", "version", "type", "details"})
public class ResolutionError {

    /**
     * Kind of probe failure.
     */
    public enum Type {
        /** The installation (or an inventory query) failed at the process level. */
        COMMAND_ERROR("command_error"),
        /** Installation succeeded but the package is missing from the environment inventory. */
        NOT_SITE_PACKAGE("not_site_package");

        private final String value;

        Type(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }

    static final String NOT_SITE_PACKAGE_MESSAGE =
            "Failed to get information about installed package, probably not site package";

    private final String packageName;
    private final String index;
    private final String version;
    private final Type type;
    private final Map<String, Object> details;

    public ResolutionError(String packageName, String index, String version, Type type, Map<String, Object> details) {
        this.packageName = Objects.requireNonNull(packageName, "packageName cannot be null");
        this.index = index;
        this.version = version;
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.details = details != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
                : Collections.emptyMap();
    }

    public static ResolutionError commandError(String packageName, String index, String version,
                                               Map<String, Object> details) {
        return new ResolutionError(packageName, index, version, Type.COMMAND_ERROR, details);
    }

    public static ResolutionError notSitePackage(String packageName, String index, String version) {
        return new ResolutionError(packageName, index, version, Type.NOT_SITE_PACKAGE,
                Map.of("message", NOT_SITE_PACKAGE_MESSAGE));
    }

    @JsonProperty("package_name")
    public String getPackageName() {
        return packageName;
    }

    @JsonProperty("index")
    public String getIndex() {
        return index;
    }

    @JsonProperty("version")
    public String getVersion() {
        return version;
    }

    @JsonProperty("type")
    public Type getType() {
        return type;
    }

    @JsonProperty("details")
    public Map<String, Object> getDetails() {
        return details;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResolutionError that = (ResolutionError) o;
        return packageName.equals(that.packageName) &&
               Objects.equals(index, that.index) &&
               Objects.equals(version, that.version) &&
               type == that.type &&
               details.equals(that.details);
    }

    @Override
    public int hashCode() {
        return Objects.hash(packageName, index, version, type, details);
    }

    @Override
    public String toString() {
        return type.getValue() + ": " + packageName + "==" + version + " from " + index;
    }
}
