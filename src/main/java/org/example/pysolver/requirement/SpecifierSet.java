package org.example.pysolver.requirement;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Conjunction of version specifiers, matched with PEP 440 semantics.
 *
 * <p>Pre-releases are only accepted when a specifier names one explicitly, or when
 * nothing but pre-releases satisfies the set.</p>
 */
public class SpecifierSet {

    private final List<VersionSpecifier> specifiers;

    public SpecifierSet(List<VersionSpecifier> specifiers) {
        this.specifiers = specifiers != null ? List.copyOf(specifiers) : List.of();
    }

    public List<VersionSpecifier> getSpecifiers() {
        return specifiers;
    }

    /**
     * Returns true if the version satisfies every specifier, ignoring the pre-release policy.
     */
    public boolean contains(String version) {
        Optional<PythonVersion> parsed = PythonVersion.tryParse(version);
        for (VersionSpecifier specifier : specifiers) {
            if (!matches(specifier, version, parsed.orElse(null))) {
                return false;
            }
        }
        return parsed.isPresent() || !specifiers.isEmpty();
    }

    /**
     * Filters the given versions down to the ones this set accepts, sorted ascending.
     * Versions that are not valid PEP 440 are dropped unless matched with {@code ===}.
     */
    public List<String> filter(List<String> versions) {
        List<String> finals = new ArrayList<>();
        List<String> prereleases = new ArrayList<>();
        boolean allowPrereleases = namesPrerelease();

        for (String version : versions) {
            if (!contains(version)) {
                continue;
            }
            boolean prerelease = PythonVersion.tryParse(version)
                    .map(PythonVersion::isPrerelease)
                    .orElse(false);
            if (prerelease && !allowPrereleases) {
                prereleases.add(version);
            } else {
                finals.add(version);
            }
        }

        List<String> accepted = finals.isEmpty() ? prereleases : finals;
        return accepted.stream()
                .distinct()
                .sorted(versionOrder())
                .collect(Collectors.toList());
    }

    /**
     * Orders version strings by PEP 440; unparsable ones sort first, lexically.
     */
    public static Comparator<String> versionOrder() {
        return (a, b) -> {
            Optional<PythonVersion> left = PythonVersion.tryParse(a);
            Optional<PythonVersion> right = PythonVersion.tryParse(b);
            if (left.isPresent() && right.isPresent()) {
                return left.get().compareTo(right.get());
            }
            if (left.isPresent() != right.isPresent()) {
                return left.isPresent() ? 1 : -1;
            }
            return a.compareTo(b);
        };
    }

    private boolean namesPrerelease() {
        return specifiers.stream()
                .filter(s -> !s.getOperator().equals("!="))
                .map(s -> PythonVersion.tryParse(stripWildcard(s.getVersion())))
                .anyMatch(v -> v.map(PythonVersion::isPrerelease).orElse(false));
    }

    private boolean matches(VersionSpecifier specifier, String rawVersion, PythonVersion candidate) {
        String operator = specifier.getOperator();
        if (operator.equals("===")) {
            return rawVersion.trim().equalsIgnoreCase(specifier.getVersion().trim());
        }
        if (candidate == null) {
            return false;
        }

        switch (operator) {
            case "==":
                return equalTo(specifier, candidate);
            case "!=":
                return !equalTo(specifier, candidate);
            case "~=":
                return compatibleWith(specifier, candidate);
            case "<=":
                return candidate.getPublicVersion().compareTo(target(specifier)) <= 0;
            case ">=":
                return candidate.getPublicVersion().compareTo(target(specifier)) >= 0;
            case "<":
                return lessThan(target(specifier), candidate);
            case ">":
                return greaterThan(target(specifier), candidate);
            default:
                throw new IllegalStateException("Unsupported operator: " + operator);
        }
    }

    private boolean equalTo(VersionSpecifier specifier, PythonVersion candidate) {
        if (specifier.isWildcard()) {
            PythonVersion prefix = PythonVersion.parse(stripWildcard(specifier.getVersion()));
            return prefix.getEpoch() == candidate.getEpoch() &&
                   hasReleasePrefix(candidate.getRelease(), prefix.getRelease());
        }
        PythonVersion target = target(specifier);
        PythonVersion compared = target.hasLocal() ? candidate : candidate.getPublicVersion();
        return compared.compareTo(target) == 0;
    }

    private boolean compatibleWith(VersionSpecifier specifier, PythonVersion candidate) {
        PythonVersion target = target(specifier);
        List<Long> release = target.getRelease();
        if (candidate.getPublicVersion().compareTo(target) < 0) {
            return false;
        }
        List<Long> prefix = release.subList(0, Math.max(1, release.size() - 1));
        return candidate.getEpoch() == target.getEpoch() && hasReleasePrefix(candidate.getRelease(), prefix);
    }

    private boolean lessThan(PythonVersion target, PythonVersion candidate) {
        PythonVersion version = candidate.getPublicVersion();
        if (version.compareTo(target) >= 0) {
            return false;
        }
        // <V does not admit pre-releases of V itself unless V is a pre-release
        return target.isPrerelease() || !version.isPrerelease() ||
               version.getBaseVersion().compareTo(target.getBaseVersion()) != 0;
    }

    private boolean greaterThan(PythonVersion target, PythonVersion candidate) {
        PythonVersion version = candidate.getPublicVersion();
        if (version.compareTo(target) <= 0) {
            return false;
        }
        // >V does not admit post-releases of V itself unless V is a post-release
        return target.isPostRelease() || !version.isPostRelease() ||
               version.getBaseVersion().compareTo(target.getBaseVersion()) != 0;
    }

    private static boolean hasReleasePrefix(List<Long> release, List<Long> prefix) {
        for (int i = 0; i < prefix.size(); i++) {
            long segment = i < release.size() ? release.get(i) : 0;
            if (segment != prefix.get(i)) {
                return false;
            }
        }
        return true;
    }

    private static PythonVersion target(VersionSpecifier specifier) {
        return PythonVersion.parse(specifier.getVersion());
    }

    private static String stripWildcard(String version) {
        return version.endsWith(".*") ? version.substring(0, version.length() - 2) : version;
    }

    @Override
    public String toString() {
        return specifiers.stream().map(VersionSpecifier::toString).collect(Collectors.joining(","));
    }
}
