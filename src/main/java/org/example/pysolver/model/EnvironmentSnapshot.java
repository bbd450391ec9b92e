package org.example.pysolver.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.List;

/**
 * Inventory of the probe environment taken before any package was installed.
 * Reported as a baseline only; the traversal never reads it.
 */
public class EnvironmentSnapshot {

    private static final EnvironmentSnapshot EMPTY = new EnvironmentSnapshot(Collections.emptyList());

    private final List<DependencyEntry> packages;

    public EnvironmentSnapshot(List<DependencyEntry> packages) {
        this.packages = packages != null ? List.copyOf(packages) : List.of();
    }

    public static EnvironmentSnapshot empty() {
        return EMPTY;
    }

    @JsonValue
    public List<DependencyEntry> getPackages() {
        return packages;
    }

    public int getPackageCount() {
        return packages.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return packages.equals(((EnvironmentSnapshot) o).packages);
    }

    @Override
    public int hashCode() {
        return packages.hashCode();
    }

    @Override
    public String toString() {
        return "EnvironmentSnapshot{packages=" + packages.size() + '}';
    }
}
