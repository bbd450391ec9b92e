package org.example.pysolver.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.pysolver.exception.CommandException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs commands with {@link ProcessBuilder}.
 *
 * <p>Output streams are redirected to temporary files so that a chatty process
 * cannot block on a full pipe while we wait for it.</p>
 */
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    private final long timeoutSeconds;
    private final File workingDirectory;
    private final ObjectMapper objectMapper;

    /**
     * Creates a runner with a 600 second timeout in the current directory.
     */
    public ProcessCommandRunner() {
        this(600, null);
    }

    /**
     * @param timeoutSeconds   how long a single command may run before it is killed
     * @param workingDirectory directory to run commands in (null = current directory)
     */
    public ProcessCommandRunner(long timeoutSeconds, File workingDirectory) {
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeoutSeconds must be positive, but was: " + timeoutSeconds);
        }
        this.timeoutSeconds = timeoutSeconds;
        this.workingDirectory = workingDirectory;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public CommandResult run(List<String> command, boolean parseJson, boolean raiseOnError) throws CommandException {
        Objects.requireNonNull(command, "command cannot be null");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command cannot be empty");
        }

        log.debug("Running command: {}", String.join(" ", command));

        Path stdoutFile = null;
        Path stderrFile = null;
        Process process = null;
        try {
            stdoutFile = Files.createTempFile("pysolver-out", ".log");
            stderrFile = Files.createTempFile("pysolver-err", ".log");

            ProcessBuilder builder = new ProcessBuilder(command)
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(stderrFile.toFile());
            if (workingDirectory != null) {
                builder.directory(workingDirectory);
            }

            process = builder.start();
            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(5, TimeUnit.SECONDS);
                throw new CommandException(
                        "Command timed out after " + timeoutSeconds + "s",
                        command, -1, read(stdoutFile), read(stderrFile), true);
            }

            int returnCode = process.exitValue();
            String stdout = read(stdoutFile);
            String stderr = read(stderrFile);
            log.debug("Command finished with return code {}", returnCode);

            if (returnCode != 0 && raiseOnError) {
                throw new CommandException(
                        "Command exited with return code " + returnCode,
                        command, returnCode, stdout, stderr, false);
            }

            JsonNode json = null;
            if (parseJson && returnCode == 0) {
                json = parseJson(command, returnCode, stdout, stderr);
            }
            return new CommandResult(command, returnCode, stdout, stderr, json);

        } catch (IOException e) {
            throw new CommandException("Failed to run command: " + e.getMessage(), command, e);
        } catch (InterruptedException e) {
            if (process != null) {
                process.destroyForcibly();
            }
            Thread.currentThread().interrupt();
            throw new CommandException("Interrupted while waiting for command", command, e);
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    private JsonNode parseJson(List<String> command, int returnCode, String stdout, String stderr)
            throws CommandException {
        try {
            return objectMapper.readTree(stdout);
        } catch (JsonProcessingException e) {
            throw new CommandException(
                    "Command output is not valid JSON: " + e.getOriginalMessage(),
                    command, returnCode, stdout, stderr, false);
        }
    }

    /**
     * Reads captured output as UTF-8; malformed bytes become U+FFFD instead of failing.
     */
    private String read(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    private void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete temporary file {}: {}", file, e.getMessage());
        }
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }
}
