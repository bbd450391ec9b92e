package org.example.pysolver.exception;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exception thrown when an external command fails, times out or cannot be started.
 *
 * <p>{@link #toDetails()} gives a serializable payload that ends up in the
 * {@code details} of a {@code command_error} record.</p>
 */
public class CommandException extends SolverException {

    private final List<String> command;
    private final int returnCode;
    private final String stdout;
    private final String stderr;
    private final boolean timeout;

    public CommandException(String message, List<String> command, int returnCode,
                            String stdout, String stderr, boolean timeout) {
        super(message);
        this.command = List.copyOf(command);
        this.returnCode = returnCode;
        this.stdout = stdout;
        this.stderr = stderr;
        this.timeout = timeout;
    }

    public CommandException(String message, List<String> command, Throwable cause) {
        super(message, cause);
        this.command = List.copyOf(command);
        this.returnCode = -1;
        this.stdout = null;
        this.stderr = null;
        this.timeout = false;
    }

    public List<String> getCommand() {
        return command;
    }

    public int getReturnCode() {
        return returnCode;
    }

    public String getStdout() {
        return stdout;
    }

    public String getStderr() {
        return stderr;
    }

    public boolean isTimeout() {
        return timeout;
    }

    /**
     * Returns the failure as a map suitable for JSON serialization.
     */
    public Map<String, Object> toDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("command", String.join(" ", command));
        details.put("message", getMessage());
        details.put("return_code", returnCode);
        details.put("stdout", stdout);
        details.put("stderr", stderr);
        details.put("timeout", timeout);
        return details;
    }
}
