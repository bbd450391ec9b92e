package org.example.pysolver.environment;

import org.example.pysolver.exception.CommandException;
import org.example.pysolver.exception.IndexException;
import org.example.pysolver.index.PackageIndex;
import org.example.pysolver.model.DependencyEntry;
import org.example.pysolver.model.EnvironmentSnapshot;
import org.example.pysolver.model.PackageKey;
import org.example.pysolver.model.ResolutionError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Learns the direct dependencies of a package version by installing it into the
 * environment and reading back what got installed.
 *
 * <p>Probes never throw: command failures and missing metadata come back as
 * {@link ProbeResult} error records. The environment is restored after every
 * successful install.</p>
 */
public class EnvironmentProbe {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentProbe.class);

    private final PythonEnvironment environment;

    public EnvironmentProbe(PythonEnvironment environment) {
        this.environment = Objects.requireNonNull(environment, "environment cannot be null");
    }

    public PythonEnvironment getEnvironment() {
        return environment;
    }

    /**
     * Provisions the environment (virtualenv plus pipdeptree).
     *
     * @throws CommandException if provisioning fails
     */
    public void prepare() throws CommandException {
        environment.create();
    }

    /**
     * Captures the current inventory of the environment.
     *
     * @throws CommandException if the inventory cannot be read
     */
    public EnvironmentSnapshot snapshot() throws CommandException {
        List<DependencyEntry> packages = environment.listPackages().stream()
                .map(p -> p.toEntryBuilder().build())
                .collect(Collectors.toList());
        log.debug("Environment holds {} packages", packages.size());
        return new EnvironmentSnapshot(packages);
    }

    /**
     * Installs {@code key} from {@code index}, reads its declared dependencies and
     * restores the environment.
     */
    public ProbeResult probe(PackageKey key, PackageIndex index) {
        String name = key.getName();
        String version = key.getVersion();
        String indexUrl = index.getUrl();

        final InstallationScope scope;
        try {
            scope = environment.install(name, version, indexUrl);
        } catch (CommandException e) {
            log.warn("Failed to install {}=={} from {}: {}", name, version, indexUrl, e.getMessage());
            return ProbeResult.failure(ResolutionError.commandError(name, indexUrl, version, e.toDetails()));
        }

        try (scope) {
            Optional<InstalledPackage> installed = environment.findPackage(name);
            if (installed.isEmpty()) {
                log.warn("Failed to get information about installed package {}=={}, probably not site package",
                        name, version);
                return ProbeResult.failure(ResolutionError.notSitePackage(name, indexUrl, version));
            }

            InstalledPackage pkg = installed.get();
            if (!pkg.getInstalledVersion().equals(version)) {
                log.warn("Requested to install version {} of package {}, but installed version is {}, "
                        + "error is not fatal", version, name, pkg.getInstalledVersion());
            }
            if (!pkg.getPackageName().equals(name)) {
                log.warn("Requested to install package {}, but installed package name is {}, error is not fatal",
                        name, pkg.getPackageName());
            }

            DependencyEntry entry = pkg.toEntryBuilder()
                    .indexUrl(indexUrl)
                    .contentHashes(fetchHashes(index, pkg.getPackageName(), pkg.getInstalledVersion()))
                    .build();
            log.debug("Probed {}=={} on {}: {} direct dependencies",
                    name, version, indexUrl, entry.getDependencies().size());
            return ProbeResult.success(entry);
        } catch (CommandException e) {
            log.warn("Failed to inspect {}=={} after installation: {}", name, version, e.getMessage());
            return ProbeResult.failure(ResolutionError.commandError(name, indexUrl, version, e.toDetails()));
        }
    }

    private List<String> fetchHashes(PackageIndex index, String name, String version) {
        try {
            return index.getPackageHashes(name, version);
        } catch (IndexException e) {
            log.warn("Failed to obtain artifact hashes for {}=={} from {}: {}",
                    name, version, index.getUrl(), e.getMessage());
            return List.of();
        }
    }
}
