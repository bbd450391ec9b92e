package org.example.pysolver.requirement;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A parsed requirement: package name plus an ordered list of version specifiers.
 * An empty specifier list means any version.
 */
public class Requirement {

    private final String name;
    private final List<VersionSpecifier> specifiers;
    private final List<String> extras;
    private final String marker;

    public Requirement(String name, List<VersionSpecifier> specifiers) {
        this(name, specifiers, List.of(), null);
    }

    public Requirement(String name, List<VersionSpecifier> specifiers, List<String> extras, String marker) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.specifiers = specifiers != null ? List.copyOf(specifiers) : List.of();
        this.extras = extras != null ? List.copyOf(extras) : List.of();
        this.marker = marker;
    }

    public String getName() {
        return name;
    }

    public List<VersionSpecifier> getSpecifiers() {
        return specifiers;
    }

    public List<String> getExtras() {
        return extras;
    }

    /**
     * Returns the environment marker, or null if the requirement has none.
     */
    public String getMarker() {
        return marker;
    }

    /**
     * Returns the range expression, e.g. {@code >=1.0,<2.0}. Empty for any version.
     */
    public String getVersionSpec() {
        return specifiers.stream()
                .map(VersionSpecifier::toString)
                .collect(Collectors.joining(","));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Requirement that = (Requirement) o;
        return name.equals(that.name) &&
               specifiers.equals(that.specifiers) &&
               extras.equals(that.extras) &&
               Objects.equals(marker, that.marker);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, specifiers, extras, marker);
    }

    @Override
    public String toString() {
        return name + getVersionSpec();
    }
}
