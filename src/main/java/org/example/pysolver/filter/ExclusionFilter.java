package org.example.pysolver.filter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Decides which seed requirements are left out of resolution.
 *
 * <p>Only seeds are filtered. An excluded package that some other package depends on
 * is still resolved and probed as a transitive dependency.</p>
 */
public class ExclusionFilter {

    private static final Logger log = LoggerFactory.getLogger(ExclusionFilter.class);

    private final List<PackageNameMatcher> excludeMatchers;

    /**
     * @param excludePatterns package names or glob patterns (null or empty = exclude none)
     * @throws IllegalArgumentException if a pattern is invalid
     */
    public ExclusionFilter(Collection<String> excludePatterns) {
        this.excludeMatchers = parsePatterns(excludePatterns);
    }

    public static ExclusionFilter none() {
        return new ExclusionFilter(Collections.emptyList());
    }

    /**
     * Returns true if the package matches any exclude pattern.
     */
    public boolean isExcluded(String packageName) {
        for (PackageNameMatcher matcher : excludeMatchers) {
            if (matcher.matches(packageName)) {
                log.debug("Package {} excluded by pattern {}", packageName, matcher.getPattern());
                return true;
            }
        }
        return false;
    }

    public boolean isEmpty() {
        return excludeMatchers.isEmpty();
    }

    public List<String> getExcludePatterns() {
        return excludeMatchers.stream()
                .map(PackageNameMatcher::getPattern)
                .collect(Collectors.toList());
    }

    private static List<PackageNameMatcher> parsePatterns(Collection<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            return Collections.emptyList();
        }
        return patterns.stream()
                .filter(p -> p != null && !p.trim().isEmpty())
                .map(PackageNameMatcher::new)
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "ExclusionFilter{" + getExcludePatterns() + "}";
    }
}
