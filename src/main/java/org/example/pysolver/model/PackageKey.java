package org.example.pysolver.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Identifies one concrete package version: {@code (name, version)}.
 *
 * <p>Names are compared in their PEP 503 normalized form, so {@code Foo_Bar},
 * {@code foo-bar} and {@code foo.bar} are the same package. The original spelling is
 * kept for display and for commands.</p>
 */
public class PackageKey {

    private final String name;
    private final String version;
    private final String normalizedName;

    public PackageKey(String name, String version) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.version = Objects.requireNonNull(version, "version cannot be null");
        this.normalizedName = normalizeName(name);
    }

    /**
     * Normalizes a package name as PEP 503 does: lowercase, runs of {@code -_.} become {@code -}.
     */
    public static String normalizeName(String name) {
        return name.trim().replaceAll("[-_.]+", "-").toLowerCase(Locale.ROOT);
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public String getNormalizedName() {
        return normalizedName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PackageKey that = (PackageKey) o;
        return normalizedName.equals(that.normalizedName) && version.equals(that.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(normalizedName, version);
    }

    @Override
    public String toString() {
        return name + "==" + version;
    }
}
