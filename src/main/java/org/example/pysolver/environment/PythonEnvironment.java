package org.example.pysolver.environment;

import com.fasterxml.jackson.databind.JsonNode;
import org.example.pysolver.command.CommandResult;
import org.example.pysolver.command.CommandRunner;
import org.example.pysolver.exception.CommandException;
import org.example.pysolver.model.PackageKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A virtualenv that packages get installed into and inspected in.
 *
 * <p>Mutations go through {@link #install(String, String, String)}, which hands back an
 * {@link InstallationScope} that puts the previous state back when closed.</p>
 */
public class PythonEnvironment {

    private static final Logger log = LoggerFactory.getLogger(PythonEnvironment.class);

    private final Path virtualenvDirectory;
    private final int pythonVersion;
    private final CommandRunner commandRunner;

    public PythonEnvironment(Path virtualenvDirectory, int pythonVersion, CommandRunner commandRunner) {
        this.virtualenvDirectory = Objects.requireNonNull(virtualenvDirectory, "virtualenvDirectory cannot be null");
        this.commandRunner = Objects.requireNonNull(commandRunner, "commandRunner cannot be null");
        if (pythonVersion != 2 && pythonVersion != 3) {
            throw new IllegalArgumentException("Unknown Python version: " + pythonVersion);
        }
        this.pythonVersion = pythonVersion;
    }

    /**
     * Creates (or clears) the virtualenv and installs pipdeptree into it.
     *
     * @throws CommandException if virtualenv or pip fails
     */
    public void create() throws CommandException {
        log.info("Creating Python {} virtualenv in {}", pythonVersion, virtualenvDirectory);
        commandRunner.run(List.of("virtualenv", "--clear", "-p", "python" + pythonVersion,
                virtualenvDirectory.toString()));
        commandRunner.run(List.of(getPythonBinary(), "-m", "pip", "install", "pipdeptree"));
    }

    public String getPythonBinary() {
        return virtualenvDirectory.resolve("bin").resolve("python" + pythonVersion).toString();
    }

    public Path getVirtualenvDirectory() {
        return virtualenvDirectory;
    }

    public int getPythonVersion() {
        return pythonVersion;
    }

    /**
     * Returns the whole inventory of the environment.
     *
     * @throws CommandException if pipdeptree fails or prints something unexpected
     */
    public List<InstalledPackage> listPackages() throws CommandException {
        List<String> command = List.of(getPythonBinary(), "-m", "pipdeptree", "--json");
        log.debug("Obtaining pip dependency tree using: {}", String.join(" ", command));
        CommandResult result = commandRunner.runJson(command);

        JsonNode json = result.getJson();
        if (json == null || !json.isArray()) {
            throw new CommandException("pipdeptree did not print a JSON array",
                    command, result.getReturnCode(), result.getStdout(), result.getStderr(), false);
        }

        List<InstalledPackage> packages = new ArrayList<>();
        for (JsonNode node : json) {
            try {
                packages.add(InstalledPackage.fromJson(node));
            } catch (IllegalArgumentException e) {
                throw new CommandException("Unexpected pipdeptree output: " + e.getMessage(),
                        command, result.getReturnCode(), result.getStdout(), result.getStderr(), false);
            }
        }
        return packages;
    }

    /**
     * Looks a package up in the inventory by its key. Keys are compared after name
     * normalization, so {@code Zope.Interface} finds {@code zope-interface}.
     *
     * @throws CommandException if the inventory cannot be queried
     */
    public Optional<InstalledPackage> findPackage(String packageName) throws CommandException {
        String wanted = PackageKey.normalizeName(packageName);
        // pipdeptree's --packages filter is unreliable across versions, so filter here
        return listPackages().stream()
                .filter(p -> PackageKey.normalizeName(p.getKey()).equals(wanted))
                .findFirst();
    }

    /**
     * Force-installs exactly {@code packageName==version} from the index without its
     * dependencies. The returned scope restores the previous state when closed.
     *
     * @throws CommandException if the baseline cannot be read or the installation fails;
     *                          in that case nothing needs to be restored
     */
    public InstallationScope install(String packageName, String version, String indexUrl) throws CommandException {
        String previousVersion = findPackage(packageName)
                .map(InstalledPackage::getInstalledVersion)
                .orElse(null);

        List<String> command = new ArrayList<>(installCommand(packageName, version));
        if (indexUrl != null) {
            command.add("--index-url");
            command.add(indexUrl);
        }

        log.debug("Installing requirement {} in version {}", packageName, version);
        commandRunner.run(command);
        return new InstallationScope(this, packageName, version, previousVersion);
    }

    CommandResult reinstall(String packageName, String version) throws CommandException {
        log.debug("Installing previous version {} of package {}", version, packageName);
        return commandRunner.run(installCommand(packageName, version), false, false);
    }

    CommandResult uninstall(String packageName) throws CommandException {
        log.debug("Removing installed package {}", packageName);
        return commandRunner.run(List.of(getPythonBinary(), "-m", "pip", "uninstall", "--yes", packageName),
                false, false);
    }

    private List<String> installCommand(String packageName, String version) {
        return List.of(getPythonBinary(), "-m", "pip", "install",
                "--force-reinstall", "--no-cache-dir", "--no-deps",
                packageName + "==" + version);
    }

    @Override
    public String toString() {
        return "PythonEnvironment{" + virtualenvDirectory + ", python" + pythonVersion + '}';
    }
}
