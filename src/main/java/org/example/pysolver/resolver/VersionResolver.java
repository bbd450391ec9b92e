package org.example.pysolver.resolver;

import org.example.pysolver.exception.PackageNotFoundException;
import org.example.pysolver.solver.PythonSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves a package range to concrete versions at one index, never failing.
 *
 * <p>An unknown package and any other failure both yield an empty list; they differ
 * only in how they are logged.</p>
 */
public class VersionResolver {

    private static final Logger log = LoggerFactory.getLogger(VersionResolver.class);

    /** What pipdeptree reports for a dependency declared without a range. */
    static final String ANY_VERSION = "Any";

    private final PythonSolver solver;

    public VersionResolver(PythonSolver solver) {
        this.solver = Objects.requireNonNull(solver, "solver cannot be null");
    }

    public String getIndexUrl() {
        return solver.getIndex().getUrl();
    }

    /**
     * Returns every version of the package satisfying the range, ascending.
     *
     * @param packageName the package name
     * @param versionSpec the range expression; null, empty or {@code Any} means any version
     */
    public List<String> resolveVersions(String packageName, String versionSpec) {
        String spec = normalizeSpec(versionSpec);
        try {
            Map<String, List<String>> resolved = solver.solve(List.of(packageName + spec), true);
            if (resolved.size() != 1) {
                throw new IllegalStateException("Resolution of one package ended with " + resolved.size() + " packages");
            }
            return resolved.values().iterator().next();
        } catch (PackageNotFoundException e) {
            log.info("No versions were resolved for {} with version specification {} for package index {}",
                    packageName, spec, getIndexUrl());
            return List.of();
        } catch (Exception e) {
            log.error("Failed to resolve versions for {} with version spec {} on {}",
                    packageName, spec, getIndexUrl(), e);
            return List.of();
        }
    }

    static String normalizeSpec(String versionSpec) {
        if (versionSpec == null) {
            return "";
        }
        String trimmed = versionSpec.trim();
        return trimmed.equalsIgnoreCase(ANY_VERSION) ? "" : trimmed;
    }

    @Override
    public String toString() {
        return "VersionResolver{" + getIndexUrl() + "}";
    }
}
