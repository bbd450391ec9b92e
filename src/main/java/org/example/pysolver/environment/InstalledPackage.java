package org.example.pysolver.environment;

import com.fasterxml.jackson.databind.JsonNode;
import org.example.pysolver.model.Dependency;
import org.example.pysolver.model.DependencyEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One package of the environment inventory, as reported by {@code pipdeptree --json}.
 */
public class InstalledPackage {

    private final String key;
    private final String packageName;
    private final String installedVersion;
    private final List<Dependency> dependencies;

    public InstalledPackage(String key, String packageName, String installedVersion, List<Dependency> dependencies) {
        this.key = Objects.requireNonNull(key, "key cannot be null");
        this.packageName = Objects.requireNonNull(packageName, "packageName cannot be null");
        this.installedVersion = Objects.requireNonNull(installedVersion, "installedVersion cannot be null");
        this.dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
    }

    /**
     * Reads one element of the pipdeptree JSON array.
     *
     * <pre>
     * {"package": {"key": ..., "package_name": ..., "installed_version": ...},
     *  "dependencies": [{"key": ..., "package_name": ..., "installed_version": ..., "required_version": ...}]}
     * </pre>
     *
     * @throws IllegalArgumentException if mandatory fields are missing
     */
    public static InstalledPackage fromJson(JsonNode node) {
        JsonNode pkg = node.path("package");
        String packageName = text(pkg, "package_name");
        String key = pkg.hasNonNull("key") ? pkg.get("key").asText() : packageName;
        String version = text(pkg, "installed_version");

        List<Dependency> dependencies = new ArrayList<>();
        for (JsonNode dependency : node.path("dependencies")) {
            String requiredVersion = dependency.hasNonNull("required_version")
                    ? dependency.get("required_version").asText()
                    : null;
            dependencies.add(new Dependency(text(dependency, "package_name"), requiredVersion));
        }
        return new InstalledPackage(key, packageName, version, dependencies);
    }

    private static String text(JsonNode node, String field) {
        if (!node.hasNonNull(field)) {
            throw new IllegalArgumentException("pipdeptree entry lacks '" + field + "': " + node);
        }
        return node.get(field).asText();
    }

    public String getKey() {
        return key;
    }

    public String getPackageName() {
        return packageName;
    }

    public String getInstalledVersion() {
        return installedVersion;
    }

    public List<Dependency> getDependencies() {
        return dependencies;
    }

    /**
     * Converts to a graph entry. Each call yields fresh {@link Dependency} objects, so
     * entries never share resolution state.
     */
    public DependencyEntry.Builder toEntryBuilder() {
        DependencyEntry.Builder builder = DependencyEntry.builder()
                .packageName(packageName)
                .packageVersion(installedVersion);
        for (Dependency dependency : dependencies) {
            builder.addDependency(new Dependency(dependency.getPackageName(), dependency.getRequiredVersion()));
        }
        return builder;
    }

    @Override
    public String toString() {
        return packageName + "==" + installedVersion;
    }
}
