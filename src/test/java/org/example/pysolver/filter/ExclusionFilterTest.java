package org.example.pysolver.filter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ExclusionFilter.
 */
class ExclusionFilterTest {

    @Test
    @DisplayName("should exclude nothing without patterns")
    void shouldExcludeNothingWithoutPatterns() {
        assertThat(ExclusionFilter.none().isExcluded("flask")).isFalse();
        assertThat(new ExclusionFilter(null).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("should exclude plain names case-insensitively")
    void shouldExcludePlainNames() {
        ExclusionFilter filter = new ExclusionFilter(Set.of("setuptools"));

        assertThat(filter.isExcluded("SetupTools")).isTrue();
        assertThat(filter.isExcluded("wheel")).isFalse();
    }

    @Test
    @DisplayName("should exclude by any matching pattern")
    void shouldExcludeByAnyPattern() {
        ExclusionFilter filter = new ExclusionFilter(List.of("pip", "types-*"));

        assertThat(filter.isExcluded("pip")).isTrue();
        assertThat(filter.isExcluded("types-six")).isTrue();
        assertThat(filter.isExcluded("six")).isFalse();
    }

    @Test
    @DisplayName("should skip blank and null patterns")
    void shouldSkipBlankPatterns() {
        ExclusionFilter filter = new ExclusionFilter(Arrays.asList("  ", null, "wheel"));

        assertThat(filter.getExcludePatterns()).containsExactly("wheel");
    }
}
