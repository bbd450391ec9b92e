package org.example.pysolver.requirement;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A PEP 440 version.
 *
 * <p>Ordering follows PEP 440: dev releases sort before pre-releases, pre-releases
 * before the final release, and post releases after it. Trailing zeros in the release
 * segment are not significant, so {@code 1.0 == 1.0.0}.</p>
 */
public final class PythonVersion implements Comparable<PythonVersion> {

    private static final Pattern VERSION_PATTERN = Pattern.compile(
            "^v?" +
            "(?:(?<epoch>[0-9]+)!)?" +
            "(?<release>[0-9]+(?:\\.[0-9]+)*)" +
            "(?<pre>[-_.]?(?<preL>alpha|beta|preview|pre|rc|a|b|c)[-_.]?(?<preN>[0-9]+)?)?" +
            "(?<post>-(?<postN1>[0-9]+)|[-_.]?(?<postL>post|rev|r)[-_.]?(?<postN2>[0-9]+)?)?" +
            "(?<dev>[-_.]?dev[-_.]?(?<devN>[0-9]+)?)?" +
            "(?:\\+(?<local>[a-z0-9]+(?:[-_.][a-z0-9]+)*))?$",
            Pattern.CASE_INSENSITIVE);

    private final String original;
    private final long epoch;
    private final List<Long> release;
    private final String preLabel;
    private final long preNumber;
    private final Long post;
    private final Long dev;
    private final List<String> local;

    private PythonVersion(String original, long epoch, List<Long> release, String preLabel,
                          long preNumber, Long post, Long dev, List<String> local) {
        this.original = original;
        this.epoch = epoch;
        this.release = release;
        this.preLabel = preLabel;
        this.preNumber = preNumber;
        this.post = post;
        this.dev = dev;
        this.local = local;
    }

    /**
     * Parses a version string.
     *
     * @throws IllegalArgumentException if the string is not a valid PEP 440 version
     */
    public static PythonVersion parse(String version) {
        return tryParse(version).orElseThrow(
                () -> new IllegalArgumentException("Invalid version: '" + version + "'"));
    }

    /**
     * Parses a version string, returning empty for anything that is not PEP 440.
     */
    public static Optional<PythonVersion> tryParse(String version) {
        if (version == null) {
            return Optional.empty();
        }
        Matcher m = VERSION_PATTERN.matcher(version.trim());
        if (!m.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(fromMatch(version.trim(), m));
        } catch (NumberFormatException e) {
            // numeric segment does not fit in a long
            return Optional.empty();
        }
    }

    private static PythonVersion fromMatch(String version, Matcher m) {
        long epoch = m.group("epoch") != null ? Long.parseLong(m.group("epoch")) : 0;

        List<Long> release = new ArrayList<>();
        for (String part : m.group("release").split("\\.")) {
            release.add(Long.parseLong(part));
        }

        String preLabel = null;
        long preNumber = 0;
        if (m.group("pre") != null) {
            preLabel = normalizePreLabel(m.group("preL"));
            preNumber = m.group("preN") != null ? Long.parseLong(m.group("preN")) : 0;
        }

        Long post = null;
        if (m.group("post") != null) {
            String number = m.group("postN1") != null ? m.group("postN1") : m.group("postN2");
            post = number != null ? Long.parseLong(number) : 0L;
        }

        Long dev = null;
        if (m.group("dev") != null) {
            dev = m.group("devN") != null ? Long.parseLong(m.group("devN")) : 0L;
        }

        List<String> local = Collections.emptyList();
        if (m.group("local") != null) {
            local = List.of(m.group("local").toLowerCase(Locale.ROOT).split("[-_.]"));
        }

        return new PythonVersion(version, epoch, Collections.unmodifiableList(release),
                preLabel, preNumber, post, dev, local);
    }

    private static String normalizePreLabel(String label) {
        switch (label.toLowerCase(Locale.ROOT)) {
            case "a":
            case "alpha":
                return "a";
            case "b":
            case "beta":
                return "b";
            default:
                return "rc";
        }
    }

    public long getEpoch() {
        return epoch;
    }

    public List<Long> getRelease() {
        return release;
    }

    public boolean isPrerelease() {
        return preLabel != null || dev != null;
    }

    public boolean isPostRelease() {
        return post != null;
    }

    public boolean hasLocal() {
        return !local.isEmpty();
    }

    /**
     * Returns this version without its local segment.
     */
    public PythonVersion getPublicVersion() {
        if (local.isEmpty()) {
            return this;
        }
        return new PythonVersion(original.substring(0, original.indexOf('+')), epoch, release,
                preLabel, preNumber, post, dev, Collections.emptyList());
    }

    /**
     * Returns the version with epoch and release only, e.g. {@code 1.2} for {@code 1.2rc1.post3}.
     */
    public PythonVersion getBaseVersion() {
        return new PythonVersion(baseString(), epoch, release, null, 0, null, null, Collections.emptyList());
    }

    private String baseString() {
        StringBuilder sb = new StringBuilder();
        if (epoch != 0) {
            sb.append(epoch).append('!');
        }
        for (int i = 0; i < release.size(); i++) {
            if (i > 0) sb.append('.');
            sb.append(release.get(i));
        }
        return sb.toString();
    }

    @Override
    public int compareTo(PythonVersion other) {
        int result = Long.compare(epoch, other.epoch);
        if (result != 0) return result;

        result = compareRelease(release, other.release);
        if (result != 0) return result;

        result = Integer.compare(preRank(), other.preRank());
        if (result != 0) return result;
        if (preLabel != null && other.preLabel != null) {
            result = Long.compare(preNumber, other.preNumber);
            if (result != 0) return result;
        }

        // absent post sorts before any post
        result = Long.compare(post != null ? post : -1L, other.post != null ? other.post : -1L);
        if (result != 0) return result;

        // absent dev sorts after any dev
        result = Long.compare(dev != null ? dev : Long.MAX_VALUE, other.dev != null ? other.dev : Long.MAX_VALUE);
        if (result != 0) return result;

        return compareLocal(local, other.local);
    }

    /**
     * Rank of the pre-release part: dev-only releases first, then a, b, rc, then final releases.
     */
    private int preRank() {
        if (preLabel == null) {
            return (post == null && dev != null) ? -1 : 3;
        }
        switch (preLabel) {
            case "a":
                return 0;
            case "b":
                return 1;
            default:
                return 2;
        }
    }

    private static int compareRelease(List<Long> a, List<Long> b) {
        int length = Math.max(a.size(), b.size());
        for (int i = 0; i < length; i++) {
            long left = i < a.size() ? a.get(i) : 0;
            long right = i < b.size() ? b.get(i) : 0;
            if (left != right) {
                return Long.compare(left, right);
            }
        }
        return 0;
    }

    private static int compareLocal(List<String> a, List<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return Boolean.compare(!a.isEmpty(), !b.isEmpty());
        }
        int length = Math.min(a.size(), b.size());
        for (int i = 0; i < length; i++) {
            String left = a.get(i);
            String right = b.get(i);
            boolean leftNumeric = left.chars().allMatch(Character::isDigit);
            boolean rightNumeric = right.chars().allMatch(Character::isDigit);
            int result;
            if (leftNumeric && rightNumeric) {
                result = new BigInteger(left).compareTo(new BigInteger(right));
            } else if (leftNumeric != rightNumeric) {
                // numeric segments sort after alphanumeric ones
                result = leftNumeric ? 1 : -1;
            } else {
                result = left.compareTo(right);
            }
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(a.size(), b.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return compareTo((PythonVersion) o) == 0;
    }

    @Override
    public int hashCode() {
        List<Long> trimmed = new ArrayList<>(release);
        while (trimmed.size() > 1 && trimmed.get(trimmed.size() - 1) == 0L) {
            trimmed.remove(trimmed.size() - 1);
        }
        return Objects.hash(epoch, trimmed, preLabel, preNumber, post, dev, local);
    }

    @Override
    public String toString() {
        return original;
    }
}
