package org.example.pysolver.requirement;

import java.util.Objects;

/**
 * A single {@code operator version} clause of a requirement, e.g. {@code >=1.0}.
 */
public class VersionSpecifier {

    private final String operator;
    private final String version;

    public VersionSpecifier(String operator, String version) {
        this.operator = Objects.requireNonNull(operator, "operator cannot be null");
        this.version = Objects.requireNonNull(version, "version cannot be null");
    }

    public String getOperator() {
        return operator;
    }

    public String getVersion() {
        return version;
    }

    /**
     * Returns true if the version ends with a {@code .*} wildcard.
     */
    public boolean isWildcard() {
        return version.endsWith(".*");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VersionSpecifier that = (VersionSpecifier) o;
        return operator.equals(that.operator) && version.equals(that.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, version);
    }

    @Override
    public String toString() {
        return operator + version;
    }
}
