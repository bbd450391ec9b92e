package org.example.pysolver.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PackageKey.
 */
class PackageKeyTest {

    @ParameterizedTest
    @CsvSource({
            "Flask, flask",
            "zope.interface, zope-interface",
            "typing__extensions, typing-extensions",
            "Foo-._Bar, foo-bar"
    })
    @DisplayName("should normalize names")
    void shouldNormalizeNames(String name, String expected) {
        assertThat(PackageKey.normalizeName(name)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should be equal regardless of name spelling")
    void shouldIgnoreNameSpelling() {
        PackageKey first = new PackageKey("Zope.Interface", "5.0");
        PackageKey second = new PackageKey("zope_interface", "5.0");

        assertThat(first).isEqualTo(second);
        assertThat(first.hashCode()).isEqualTo(second.hashCode());
        assertThat(first.getName()).isEqualTo("Zope.Interface");
    }

    @Test
    @DisplayName("should distinguish versions")
    void shouldDistinguishVersions() {
        Set<PackageKey> visited = new HashSet<>();

        assertThat(visited.add(new PackageKey("six", "1.15.0"))).isTrue();
        assertThat(visited.add(new PackageKey("SIX", "1.15.0"))).isFalse();
        assertThat(visited.add(new PackageKey("six", "1.16.0"))).isTrue();
    }

    @Test
    @DisplayName("should reject null parts")
    void shouldRejectNulls() {
        assertThatThrownBy(() -> new PackageKey(null, "1.0")).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new PackageKey("six", null)).isInstanceOf(NullPointerException.class);
    }
}
