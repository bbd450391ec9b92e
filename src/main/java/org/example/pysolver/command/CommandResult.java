package org.example.pysolver.command;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Outcome of a finished external command.
 */
public class CommandResult {

    private final List<String> command;
    private final int returnCode;
    private final String stdout;
    private final String stderr;
    private final JsonNode json;

    public CommandResult(List<String> command, int returnCode, String stdout, String stderr, JsonNode json) {
        this.command = List.copyOf(command);
        this.returnCode = returnCode;
        this.stdout = stdout != null ? stdout : "";
        this.stderr = stderr != null ? stderr : "";
        this.json = json;
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

    /**
     * Returns stdout parsed as JSON, or null if parsing was not requested.
     */
    public JsonNode getJson() {
        return json;
    }

    public boolean isSuccess() {
        return returnCode == 0;
    }

    @Override
    public String toString() {
        return "CommandResult{command=" + String.join(" ", command) + ", returnCode=" + returnCode + '}';
    }
}
