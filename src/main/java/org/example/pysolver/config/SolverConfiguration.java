package org.example.pysolver.config;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Plugin configuration model.
 * Contains all configuration parameters for the resolve goal.
 */
public class SolverConfiguration {

    public static final String DEFAULT_INDEX_URL = "https://pypi.org/simple";

    /**
     * Requirement strings, inline and read from the requirements file.
     */
    private List<String> requirements = new ArrayList<>();

    /**
     * pip requirements file the requirements were read from, if any.
     */
    private File requirementsFile;

    /**
     * Index URLs, in resolution order.
     * Default: PyPI.
     */
    private List<String> indexUrls = new ArrayList<>(List.of(DEFAULT_INDEX_URL));

    /**
     * Major Python version, 2 or 3.
     * Default: 3
     */
    private int pythonVersion = 3;

    /**
     * Seed packages to skip, as names or glob patterns.
     */
    private List<String> excludePackages = new ArrayList<>();

    /**
     * Whether discovered dependencies are probed too.
     * Default: true
     */
    private boolean transitive = true;

    /**
     * Directory of the probing virtualenv.
     */
    private File virtualenvDirectory;

    /**
     * Where the JSON report is written.
     */
    private File outputFile;

    /**
     * Timeout of every external command.
     * Default: 600
     */
    private long commandTimeoutSeconds = 600;

    /**
     * Attempts per index request.
     * Default: 3
     */
    private int indexRetryAttempts = 3;

    /**
     * Server ID for index credentials lookup in settings.xml.
     */
    private String indexServerId;

    /**
     * Whether to fail the build on resolution or report errors.
     * Default: false
     */
    private boolean failOnError = false;

    public List<String> getRequirements() {
        return requirements;
    }

    public void setRequirements(List<String> requirements) {
        this.requirements = requirements != null ? new ArrayList<>(requirements) : new ArrayList<>();
    }

    public File getRequirementsFile() {
        return requirementsFile;
    }

    public void setRequirementsFile(File requirementsFile) {
        this.requirementsFile = requirementsFile;
    }

    public List<String> getIndexUrls() {
        return indexUrls;
    }

    public void setIndexUrls(List<String> indexUrls) {
        this.indexUrls = indexUrls != null ? new ArrayList<>(indexUrls) : new ArrayList<>();
    }

    public int getPythonVersion() {
        return pythonVersion;
    }

    public void setPythonVersion(int pythonVersion) {
        this.pythonVersion = pythonVersion;
    }

    public List<String> getExcludePackages() {
        return excludePackages;
    }

    public void setExcludePackages(List<String> excludePackages) {
        this.excludePackages = excludePackages != null ? new ArrayList<>(excludePackages) : new ArrayList<>();
    }

    public boolean isTransitive() {
        return transitive;
    }

    public void setTransitive(boolean transitive) {
        this.transitive = transitive;
    }

    public File getVirtualenvDirectory() {
        return virtualenvDirectory;
    }

    public void setVirtualenvDirectory(File virtualenvDirectory) {
        this.virtualenvDirectory = virtualenvDirectory;
    }

    public File getOutputFile() {
        return outputFile;
    }

    public void setOutputFile(File outputFile) {
        this.outputFile = outputFile;
    }

    public long getCommandTimeoutSeconds() {
        return commandTimeoutSeconds;
    }

    public void setCommandTimeoutSeconds(long commandTimeoutSeconds) {
        this.commandTimeoutSeconds = commandTimeoutSeconds;
    }

    public int getIndexRetryAttempts() {
        return indexRetryAttempts;
    }

    public void setIndexRetryAttempts(int indexRetryAttempts) {
        this.indexRetryAttempts = indexRetryAttempts;
    }

    public String getIndexServerId() {
        return indexServerId;
    }

    public void setIndexServerId(String indexServerId) {
        this.indexServerId = indexServerId;
    }

    public boolean isFailOnError() {
        return failOnError;
    }

    public void setFailOnError(boolean failOnError) {
        this.failOnError = failOnError;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SolverConfiguration that = (SolverConfiguration) o;
        return pythonVersion == that.pythonVersion &&
                transitive == that.transitive &&
                commandTimeoutSeconds == that.commandTimeoutSeconds &&
                indexRetryAttempts == that.indexRetryAttempts &&
                failOnError == that.failOnError &&
                Objects.equals(requirements, that.requirements) &&
                Objects.equals(requirementsFile, that.requirementsFile) &&
                Objects.equals(indexUrls, that.indexUrls) &&
                Objects.equals(excludePackages, that.excludePackages) &&
                Objects.equals(virtualenvDirectory, that.virtualenvDirectory) &&
                Objects.equals(outputFile, that.outputFile) &&
                Objects.equals(indexServerId, that.indexServerId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(requirements, requirementsFile, indexUrls, pythonVersion, excludePackages,
                transitive, virtualenvDirectory, outputFile, commandTimeoutSeconds, indexRetryAttempts,
                indexServerId, failOnError);
    }

    @Override
    public String toString() {
        return "SolverConfiguration{" +
                "requirements=" + requirements +
                ", requirementsFile=" + requirementsFile +
                ", indexUrls=" + indexUrls +
                ", pythonVersion=" + pythonVersion +
                ", excludePackages=" + excludePackages +
                ", transitive=" + transitive +
                ", virtualenvDirectory=" + virtualenvDirectory +
                ", outputFile=" + outputFile +
                ", commandTimeoutSeconds=" + commandTimeoutSeconds +
                ", indexRetryAttempts=" + indexRetryAttempts +
                ", indexServerId='" + indexServerId + '\'' +
                ", failOnError=" + failOnError +
                '}';
    }

    /**
     * Builder for SolverConfiguration.
     */
    public static class Builder {
        private final SolverConfiguration config = new SolverConfiguration();

        public Builder requirements(List<String> requirements) {
            config.setRequirements(requirements);
            return this;
        }

        public Builder requirementsFile(File requirementsFile) {
            config.setRequirementsFile(requirementsFile);
            return this;
        }

        public Builder indexUrls(List<String> indexUrls) {
            config.setIndexUrls(indexUrls);
            return this;
        }

        public Builder pythonVersion(int pythonVersion) {
            config.setPythonVersion(pythonVersion);
            return this;
        }

        public Builder excludePackages(List<String> excludePackages) {
            config.setExcludePackages(excludePackages);
            return this;
        }

        public Builder transitive(boolean transitive) {
            config.setTransitive(transitive);
            return this;
        }

        public Builder virtualenvDirectory(File virtualenvDirectory) {
            config.setVirtualenvDirectory(virtualenvDirectory);
            return this;
        }

        public Builder outputFile(File outputFile) {
            config.setOutputFile(outputFile);
            return this;
        }

        public Builder commandTimeoutSeconds(long commandTimeoutSeconds) {
            config.setCommandTimeoutSeconds(commandTimeoutSeconds);
            return this;
        }

        public Builder indexRetryAttempts(int indexRetryAttempts) {
            config.setIndexRetryAttempts(indexRetryAttempts);
            return this;
        }

        public Builder indexServerId(String indexServerId) {
            config.setIndexServerId(indexServerId);
            return this;
        }

        public Builder failOnError(boolean failOnError) {
            config.setFailOnError(failOnError);
            return this;
        }

        public SolverConfiguration build() {
            return config;
        }
    }
}
