package org.example.pysolver;

import okhttp3.OkHttpClient;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugin.descriptor.PluginDescriptor;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;
import org.apache.maven.settings.Server;
import org.apache.maven.settings.Settings;
import org.example.pysolver.command.CommandRunner;
import org.example.pysolver.command.ProcessCommandRunner;
import org.example.pysolver.config.ConfigurationValidator;
import org.example.pysolver.config.RequirementsFileReader;
import org.example.pysolver.config.SolverConfiguration;
import org.example.pysolver.environment.EnvironmentProbe;
import org.example.pysolver.environment.PythonEnvironment;
import org.example.pysolver.exception.ConfigurationException;
import org.example.pysolver.index.PackageIndexFactory;
import org.example.pysolver.index.RetryExecutor;
import org.example.pysolver.index.SimpleApiPackageIndex;
import org.example.pysolver.model.PassResult;
import org.example.pysolver.report.JsonReportWriter;
import org.example.pysolver.report.ReportWriter;
import org.example.pysolver.report.ResolutionSummary;
import org.example.pysolver.report.SolverReport;
import org.example.pysolver.resolver.DependencyResolver;
import org.example.pysolver.resolver.PythonDependencyResolver;

import java.io.File;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Resolves Python requirements against package indexes and writes a JSON report.
 *
 * Usage: mvn pysolver:resolve -Dpysolver.requirements=flask>=2.0
 */
@Mojo(name = "resolve", requiresProject = false, threadSafe = false)
public class ResolveRequirementsMojo extends AbstractMojo {

    // ========== Requirements ==========

    /**
     * Requirement strings, e.g. {@code flask>=2.0,<3}.
     */
    @Parameter(property = "pysolver.requirements")
    private List<String> requirements;

    /**
     * pip requirements file; its requirements are appended to {@code requirements}.
     */
    @Parameter(property = "pysolver.requirementsFile")
    private File requirementsFile;

    // ========== Resolution ==========

    /**
     * Index URLs, in resolution order.
     */
    @Parameter(property = "pysolver.indexUrls", defaultValue = SolverConfiguration.DEFAULT_INDEX_URL)
    private List<String> indexUrls;

    /**
     * Major Python version: 2 or 3.
     */
    @Parameter(property = "pysolver.pythonVersion", defaultValue = "3")
    private int pythonVersion;

    /**
     * Requirements to skip, as package names or glob patterns.
     */
    @Parameter(property = "pysolver.excludePackages")
    private List<String> excludePackages;

    /**
     * Whether discovered dependencies are probed too.
     */
    @Parameter(property = "pysolver.transitive", defaultValue = "true")
    private boolean transitive;

    /**
     * Virtualenv used for probing. It is cleared at the start of each pass.
     */
    @Parameter(property = "pysolver.virtualenvDirectory",
            defaultValue = "${project.build.directory}/pysolver/venv")
    private File virtualenvDirectory;

    /**
     * JSON report location.
     */
    @Parameter(property = "pysolver.outputFile",
            defaultValue = "${project.build.directory}/pysolver/report.json")
    private File outputFile;

    /**
     * Timeout of every virtualenv, pip and pipdeptree invocation.
     */
    @Parameter(property = "pysolver.commandTimeoutSeconds", defaultValue = "600")
    private long commandTimeoutSeconds;

    /**
     * Attempts per index request on transient network failures.
     */
    @Parameter(property = "pysolver.indexRetryAttempts", defaultValue = "3")
    private int indexRetryAttempts;

    /**
     * Server ID for index credentials lookup in settings.xml.
     */
    @Parameter(property = "pysolver.indexServerId")
    private String indexServerId;

    /**
     * Whether to fail the build when resolution records problems or the report cannot be written.
     */
    @Parameter(property = "pysolver.failOnError", defaultValue = "false")
    private boolean failOnError;

    // ========== Maven Injected Components ==========

    @Parameter(defaultValue = "${settings}", readonly = true)
    private Settings settings;

    @Parameter(defaultValue = "${plugin}", readonly = true)
    private PluginDescriptor pluginDescriptor;

    // ========== Execution ==========

    @Override
    public void execute() throws MojoExecutionException, MojoFailureException {
        logBanner();

        ResolutionSummary summary;
        try {
            SolverConfiguration config = buildConfiguration();

            validateConfiguration(config);

            logConfigurationSummary(config);

            summary = executeResolution(config);

        } catch (ConfigurationException e) {
            // Configuration errors always fail the build (ignore failOnError)
            logError("Configuration validation failed", e);
            throw new MojoExecutionException("Plugin configuration is invalid: " + e.getMessage(), e);

        } catch (Exception e) {
            handleError(e);
            return;
        }

        if (summary.hasProblems()) {
            String message = summary.getTotalProblems() + " requirement(s) or package(s) could not be resolved, see "
                    + outputFile;
            if (failOnError) {
                throw new MojoFailureException(message);
            }
            getLog().warn(message);
        }

        logSuccess();
    }

    /**
     * Builds the plugin configuration from Mojo parameters.
     */
    private SolverConfiguration buildConfiguration() throws ConfigurationException {
        List<String> allRequirements = new ArrayList<>();
        if (requirements != null) {
            allRequirements.addAll(requirements);
        }
        if (requirementsFile != null) {
            List<String> fromFile = new RequirementsFileReader().read(requirementsFile.toPath());
            getLog().debug("Read " + fromFile.size() + " requirements from " + requirementsFile);
            allRequirements.addAll(fromFile);
        }

        return new SolverConfiguration.Builder()
                .requirements(allRequirements)
                .requirementsFile(requirementsFile)
                .indexUrls(indexUrls)
                .pythonVersion(pythonVersion)
                .excludePackages(excludePackages)
                .transitive(transitive)
                .virtualenvDirectory(virtualenvDirectory)
                .outputFile(outputFile)
                .commandTimeoutSeconds(commandTimeoutSeconds)
                .indexRetryAttempts(indexRetryAttempts)
                .indexServerId(indexServerId)
                .failOnError(failOnError)
                .build();
    }

    private void validateConfiguration(SolverConfiguration config) throws ConfigurationException {
        ConfigurationValidator validator = new ConfigurationValidator();
        validator.validateOrThrow(config);
        getLog().debug("Configuration validated successfully");
    }

    /**
     * Runs all passes and writes the report.
     */
    private ResolutionSummary executeResolution(SolverConfiguration config) throws Exception {
        getLog().info("Starting requirement resolution...");
        Instant started = Instant.now();
        long start = System.currentTimeMillis();

        DependencyResolver resolver = createResolver(config);
        List<PassResult> results = resolver.resolve(
                config.getRequirements(),
                config.getIndexUrls(),
                config.getPythonVersion(),
                new LinkedHashSet<>(config.getExcludePackages()),
                config.isTransitive());

        long duration = System.currentTimeMillis() - start;
        ResolutionSummary summary = ResolutionSummary.of(results, duration);

        SolverReport report = new SolverReport(
                SolverReport.metadata()
                        .analyzerVersion(pluginDescriptor != null ? pluginDescriptor.getVersion() : null)
                        .datetime(started.toString())
                        .pythonVersion(config.getPythonVersion())
                        .indexUrls(config.getIndexUrls())
                        .transitive(config.isTransitive())
                        .excludePackages(config.getExcludePackages())
                        .durationMs(duration)
                        .build(),
                results);

        getLog().info("Writing report to " + config.getOutputFile());
        ReportWriter writer = new JsonReportWriter();
        writer.write(report, config.getOutputFile().toPath());

        logResolutionResult(summary, config.getOutputFile());
        return summary;
    }

    /**
     * Wires the resolver: one HTTP index client per URL and one virtualenv probe per pass.
     */
    protected DependencyResolver createResolver(SolverConfiguration config) {
        String username = null;
        String password = null;
        if (config.getIndexServerId() != null && !config.getIndexServerId().trim().isEmpty()) {
            Server server = settings != null ? settings.getServer(config.getIndexServerId()) : null;
            if (server != null) {
                username = server.getUsername();
                password = server.getPassword();
                getLog().debug("Index credentials loaded from server: " + config.getIndexServerId());
            } else {
                getLog().warn("Server not found in settings.xml: " + config.getIndexServerId());
            }
        }

        OkHttpClient httpClient = SimpleApiPackageIndex.defaultHttpClient();
        RetryExecutor retryExecutor = new RetryExecutor(config.getIndexRetryAttempts(), 2000);
        String indexUser = username;
        String indexPassword = password;
        PackageIndexFactory indexFactory = url ->
                new SimpleApiPackageIndex(url, httpClient, retryExecutor, indexUser, indexPassword);

        CommandRunner commandRunner = new ProcessCommandRunner(config.getCommandTimeoutSeconds(), null);
        return new PythonDependencyResolver(
                indexFactory,
                version -> new EnvironmentProbe(new PythonEnvironment(
                        config.getVirtualenvDirectory().toPath(), version, commandRunner)));
    }

    private void logResolutionResult(ResolutionSummary summary, File report) {
        getLog().info("============================================================");
        getLog().info("Resolution Results:");
        getLog().info("  Indexes resolved: " + summary.getPasses());
        getLog().info("  Packages probed: " + summary.getEntries());
        getLog().info("  Command errors: " + summary.getCommandErrors());
        getLog().info("  Not site packages: " + summary.getNotSitePackages());
        getLog().info("  Unresolved requirements: " + summary.getUnresolved());
        getLog().info("  Unparsed requirements: " + summary.getUnparsed());
        getLog().info("  Execution time: " + summary.getExecutionTimeMs() + "ms");
        getLog().info("  Report: " + report);
        getLog().info("============================================================");
    }

    /**
     * Handles errors based on failOnError flag.
     */
    private void handleError(Exception e) throws MojoExecutionException {
        logError("Resolution failed", e);

        if (failOnError) {
            throw new MojoExecutionException("PySolver resolution failed: " + e.getMessage(), e);
        } else {
            getLog().warn("Resolution failed but continuing build (failOnError=false)");
        }
    }

    // ========== Logging ==========

    private void logBanner() {
        getLog().info("============================================================");
        getLog().info("PySolver Maven Plugin - Requirement Resolution");
        getLog().info("============================================================");
    }

    private void logConfigurationSummary(SolverConfiguration config) {
        getLog().info("Configuration:");
        getLog().info("  Requirements: " + config.getRequirements().size());
        for (String url : config.getIndexUrls()) {
            getLog().info("  Index: " + maskUrl(url));
        }
        getLog().info("  Python version: " + config.getPythonVersion());
        getLog().info("  Transitive: " + config.isTransitive());

        if (!config.getExcludePackages().isEmpty()) {
            getLog().info("  Exclude packages: " + config.getExcludePackages());
        }

        getLog().info("  Virtualenv: " + config.getVirtualenvDirectory());
        getLog().info("  Fail on error: " + config.isFailOnError());
        getLog().info("============================================================");
    }

    private void logSuccess() {
        getLog().info("============================================================");
        getLog().info("Resolution completed");
        getLog().info("============================================================");
    }

    private void logError(String message, Exception e) {
        getLog().error("============================================================");
        getLog().error("PySolver Resolution Failed: " + message);
        getLog().error("============================================================");
        getLog().error("Error: " + e.getMessage());
        if (getLog().isDebugEnabled()) {
            getLog().debug("Stack trace:", e);
        }
        getLog().error("============================================================");
    }

    /**
     * Masks credentials embedded in an index URL for logging.
     */
    private String maskUrl(String url) {
        if (url == null) return "null";
        return url.replaceAll("://[^@/]+@", "://***@");
    }
}
