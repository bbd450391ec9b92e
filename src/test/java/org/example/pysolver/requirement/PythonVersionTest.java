package org.example.pysolver.requirement;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PythonVersion.
 */
class PythonVersionTest {

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @ParameterizedTest
        @ValueSource(strings = {"1", "1.0", "2.31.0", "1!2.0", "1.0a1", "1.0.beta2", "1.0rc1", "1.0-1",
                "1.0.post2", "1.0.dev3", "1.0+ubuntu.1", "v1.2", "2020.1.1"})
        @DisplayName("should accept valid versions")
        void shouldAcceptValidVersions(String version) {
            assertThat(PythonVersion.tryParse(version)).isPresent();
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "abc", "1.0-beta-gamma", "1..0", "latest", "1.0+"})
        @DisplayName("should reject invalid versions")
        void shouldRejectInvalidVersions(String version) {
            assertThat(PythonVersion.tryParse(version)).isEmpty();
        }

        @ParameterizedTest
        @ValueSource(strings = {"99999999999999999999", "1.99999999999999999999", "99999999999999999999!1.0",
                "1.0a99999999999999999999", "1.0.post99999999999999999999", "1.0.dev99999999999999999999"})
        @DisplayName("should reject versions with numbers too large to compare")
        void shouldRejectOversizedSegments(String version) {
            assertThat(PythonVersion.tryParse(version)).isEmpty();
            assertThatThrownBy(() -> PythonVersion.parse(version)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should throw for invalid version on parse")
        void shouldThrowOnParse() {
            assertThatThrownBy(() -> PythonVersion.parse("nope"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("nope");
        }

        @Test
        @DisplayName("should expose release parts")
        void shouldExposeParts() {
            PythonVersion version = PythonVersion.parse("2!1.4.2rc1+local");

            assertThat(version.getEpoch()).isEqualTo(2);
            assertThat(version.getRelease()).containsExactly(1L, 4L, 2L);
            assertThat(version.isPrerelease()).isTrue();
            assertThat(version.hasLocal()).isTrue();
            assertThat(version.getPublicVersion().hasLocal()).isFalse();
            assertThat(version.getBaseVersion()).hasToString("2!1.4.2");
        }

        @Test
        @DisplayName("should keep the original text")
        void shouldKeepOriginalText() {
            assertThat(PythonVersion.parse("1.0.0-1")).hasToString("1.0.0-1");
        }
    }

    @Nested
    @DisplayName("Ordering")
    class Ordering {

        @ParameterizedTest
        @CsvSource({
                "1.0, 1.0.0",
                "1.0a1, 1.0.alpha1",
                "1.0c1, 1.0rc1",
                "1.0-1, 1.0.post1",
                "1.0.dev, 1.0.dev0"
        })
        @DisplayName("should treat equivalent spellings as equal")
        void shouldTreatSpellingsAsEqual(String left, String right) {
            assertThat(PythonVersion.parse(left)).isEqualTo(PythonVersion.parse(right));
            assertThat(PythonVersion.parse(left).hashCode()).isEqualTo(PythonVersion.parse(right).hashCode());
        }

        @Test
        @DisplayName("should sort in PEP 440 order")
        void shouldSortInPep440Order() {
            List<String> expected = List.of(
                    "1.0.dev1", "1.0a1.dev1", "1.0a1", "1.0a2", "1.0b1", "1.0rc1", "1.0",
                    "1.0+abc", "1.0+5", "1.0.post1.dev1", "1.0.post1", "1.1", "1!0.5");
            List<PythonVersion> shuffled = expected.stream().map(PythonVersion::parse).collect(Collectors.toList());
            Collections.reverse(shuffled);

            List<PythonVersion> sorted = new ArrayList<>(shuffled);
            Collections.sort(sorted);

            assertThat(sorted).extracting(PythonVersion::toString).containsExactlyElementsOf(expected);
        }

        @Test
        @DisplayName("should compare numerically not lexically")
        void shouldCompareNumerically() {
            assertThat(PythonVersion.parse("1.10")).isGreaterThan(PythonVersion.parse("1.9"));
        }
    }
}
