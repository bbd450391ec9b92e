package org.example.pysolver.resolver;

import org.example.pysolver.environment.EnvironmentProbe;
import org.example.pysolver.environment.ProbeResult;
import org.example.pysolver.exception.IndexException;
import org.example.pysolver.exception.PackageNotFoundException;
import org.example.pysolver.index.PackageIndex;
import org.example.pysolver.model.Dependency;
import org.example.pysolver.model.DependencyEntry;
import org.example.pysolver.model.PackageKey;
import org.example.pysolver.model.PassResult;
import org.example.pysolver.model.ResolvedVersions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PythonDependencyResolver.
 */
@ExtendWith(MockitoExtension.class)
class PythonDependencyResolverTest {

    private static final String PYPI = "https://pypi.org/simple";
    private static final String MIRROR = "https://mirror.example.com/simple";

    @Mock
    private PackageIndex pypi;
    @Mock
    private PackageIndex mirror;

    private final List<EnvironmentProbe> probes = new ArrayList<>();
    private final List<Integer> requestedPythonVersions = new ArrayList<>();
    private PythonDependencyResolver resolver;

    @BeforeEach
    void setUp() throws IndexException {
        lenient().when(pypi.getUrl()).thenReturn(PYPI);
        lenient().when(mirror.getUrl()).thenReturn(MIRROR);
        lenient().when(pypi.getPackageVersions("app")).thenReturn(List.of("1.0"));
        lenient().when(pypi.getPackageVersions("six")).thenReturn(List.of("1.15.0", "1.16.0"));
        lenient().when(mirror.getPackageVersions("app")).thenThrow(new PackageNotFoundException("app", MIRROR));
        lenient().when(mirror.getPackageVersions("six")).thenReturn(List.of("1.16.0"));

        Map<String, PackageIndex> indexes = Map.of(PYPI, pypi, MIRROR, mirror);
        resolver = new PythonDependencyResolver(indexes::get, pythonVersion -> {
            requestedPythonVersions.add(pythonVersion);
            EnvironmentProbe probe = mock(EnvironmentProbe.class);
            lenient().when(probe.probe(any(), any())).thenAnswer(inv -> {
                PackageKey key = inv.getArgument(0);
                PackageIndex index = inv.getArgument(1);
                DependencyEntry.Builder entry = DependencyEntry.builder()
                        .packageName(key.getName())
                        .packageVersion(key.getVersion())
                        .indexUrl(index.getUrl());
                if (key.getName().equals("app")) {
                    entry.addDependency(new Dependency("six", ">=1.16"));
                }
                return ProbeResult.success(entry.build());
            });
            probes.add(probe);
            return probe;
        });
    }

    @Test
    @DisplayName("should run one pass per index in configuration order")
    void shouldRunOnePassPerIndex() {
        List<PassResult> results = resolver.resolve(List.of("app"), List.of(PYPI, MIRROR), 3, Set.of(), true);

        assertThat(results).extracting(PassResult::getIndexUrl).containsExactly(PYPI, MIRROR);
        assertThat(probes).hasSize(2);
        assertThat(requestedPythonVersions).containsExactly(3, 3);
    }

    @Test
    @DisplayName("should resolve seeds on the pass's own index")
    void shouldResolveSeedsOnOwnIndex() {
        List<PassResult> results = resolver.resolve(List.of("app"), List.of(PYPI, MIRROR), 3, Set.of(), true);

        assertThat(results.get(0).findEntries("app")).hasSize(1);
        assertThat(results.get(1).getTree()).isEmpty();
        assertThat(results.get(1).getUnresolved()).singleElement()
                .satisfies(unresolved -> assertThat(unresolved.getIndex()).isEqualTo(MIRROR));
    }

    @Test
    @DisplayName("should resolve dependencies against every index")
    void shouldResolveDependenciesAgainstEveryIndex() {
        List<PassResult> results = resolver.resolve(List.of("app"), List.of(PYPI, MIRROR), 3, null, true);

        Dependency six = results.get(0).findEntries("app").get(0).getDependencies().get(0);
        assertThat(six.getResolvedVersions()).containsExactly(
                new ResolvedVersions(PYPI, List.of("1.16.0")),
                new ResolvedVersions(MIRROR, List.of("1.16.0")));
        assertThat(results.get(0).findEntries("six")).hasSize(1);
    }

    @Test
    @DisplayName("should pass Python version to the environment")
    void shouldPassPythonVersion() {
        resolver.resolve(List.of("six"), List.of(PYPI), 2, Set.of(), false);

        assertThat(requestedPythonVersions).containsExactly(2);
    }

    @Test
    @DisplayName("should return empty list without indexes")
    void shouldReturnEmptyWithoutIndexes() {
        assertThat(resolver.resolve(List.of("six"), List.of(), 3, Set.of(), true)).isEmpty();
        assertThat(probes).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 4, 27})
    @DisplayName("should reject unknown Python version before doing anything")
    void shouldRejectUnknownPythonVersion(int pythonVersion) {
        assertThatThrownBy(() -> resolver.resolve(List.of("six"), List.of(PYPI), pythonVersion, Set.of(), true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown Python version");
        assertThat(probes).isEmpty();
    }
}
