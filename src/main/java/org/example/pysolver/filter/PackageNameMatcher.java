package org.example.pysolver.filter;

import org.example.pysolver.model.PackageKey;

import java.util.regex.Pattern;

/**
 * Matches Python package names against glob-style patterns.
 *
 * <p>Both the pattern and the tested name are normalized first (lower case, runs of
 * {@code -}, {@code _} and {@code .} collapsed to a single {@code -}), so
 * {@code Zope.*} matches {@code zope_interface}.</p>
 *
 * <p>Wildcards:</p>
 * <ul>
 *   <li>{@code *} - matches zero or more characters</li>
 *   <li>{@code ?} - matches exactly one character</li>
 * </ul>
 *
 * <p>Examples:</p>
 * <ul>
 *   <li>{@code setuptools} - just setuptools</li>
 *   <li>{@code types-*} - all typeshed stub packages</li>
 *   <li>{@code django-?x} - matches django-4x, django-5x, etc.</li>
 * </ul>
 */
public class PackageNameMatcher {

    private final String originalPattern;
    private final Pattern namePattern;

    /**
     * Creates a new matcher for the given pattern.
     *
     * @param pattern the glob pattern
     * @throws IllegalArgumentException if pattern is blank
     */
    public PackageNameMatcher(String pattern) {
        if (pattern == null || pattern.trim().isEmpty()) {
            throw new IllegalArgumentException("Pattern cannot be null or empty");
        }

        this.originalPattern = pattern.trim();
        this.namePattern = globToRegex(normalizeGlob(originalPattern));
    }

    /**
     * Tests if the given package name matches this pattern.
     */
    public boolean matches(String packageName) {
        if (packageName == null) {
            return false;
        }
        return namePattern.matcher(PackageKey.normalizeName(packageName)).matches();
    }

    public String getPattern() {
        return originalPattern;
    }

    // normalizes the literal parts only, wildcards must survive
    private static String normalizeGlob(String glob) {
        return glob.replaceAll("[-_.]+", "-").toLowerCase();
    }

    private static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        regex.append("^");

        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            switch (c) {
                case '*':
                    regex.append(".*");
                    break;
                case '?':
                    regex.append(".");
                    break;
                default:
                    regex.append(Pattern.quote(String.valueOf(c)));
            }
        }

        regex.append("$");
        return Pattern.compile(regex.toString());
    }

    @Override
    public String toString() {
        return "PackageNameMatcher{" + originalPattern + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PackageNameMatcher that = (PackageNameMatcher) o;
        return originalPattern.equals(that.originalPattern);
    }

    @Override
    public int hashCode() {
        return originalPattern.hashCode();
    }
}
