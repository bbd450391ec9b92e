package org.example.pysolver.environment;

import org.example.pysolver.command.CommandResult;
import org.example.pysolver.exception.CommandException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A package installed into the environment for inspection.
 *
 * <p>Closing the scope puts the environment back: the previously installed version is
 * reinstalled, or the package is removed if there was none. Restoration problems are
 * logged and never thrown; they can only affect later probes.</p>
 */
public class InstallationScope implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InstallationScope.class);

    private final PythonEnvironment environment;
    private final String packageName;
    private final String version;
    private final String previousVersion;
    private boolean closed;

    InstallationScope(PythonEnvironment environment, String packageName, String version, String previousVersion) {
        this.environment = environment;
        this.packageName = packageName;
        this.version = version;
        this.previousVersion = previousVersion;
    }

    public String getPackageName() {
        return packageName;
    }

    public String getVersion() {
        return version;
    }

    /**
     * Returns the version installed before this scope was opened, or null.
     */
    public String getPreviousVersion() {
        return previousVersion;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        log.debug("Restoring previous environment setup after installation of {}", packageName);

        try {
            if (previousVersion != null) {
                CommandResult result = environment.reinstall(packageName, previousVersion);
                if (!result.isSuccess()) {
                    log.warn("Failed to restore previous environment for package {} (installed version {}, "
                            + "previous version {}), the error is not fatal but can affect future actions",
                            packageName, version, previousVersion);
                }
            } else {
                CommandResult result = environment.uninstall(packageName);
                if (!result.isSuccess()) {
                    log.warn("Failed to restore previous environment by removing package {} (installed version {}), "
                            + "the error is not fatal but can affect future actions", packageName, version);
                }
            }
        } catch (CommandException e) {
            log.warn("Failed to restore previous environment after installing {}=={}: {}; "
                    + "the error is not fatal but can affect future actions", packageName, version, e.getMessage());
        }
    }
}
