package org.example.pysolver.command;

import org.example.pysolver.exception.CommandException;

import java.util.List;

/**
 * Runs external commands on behalf of the environment probe.
 */
public interface CommandRunner {

    /**
     * Runs the command and waits for it to finish.
     *
     * @param command      the program and its arguments
     * @param parseJson    whether stdout should be parsed as JSON
     * @param raiseOnError whether a non-zero exit code should raise
     * @return the command result
     * @throws CommandException if the command fails (and raiseOnError is set), times out,
     *                          cannot be started, or its output is not valid JSON
     */
    CommandResult run(List<String> command, boolean parseJson, boolean raiseOnError) throws CommandException;

    /**
     * Runs the command, raising on a non-zero exit code.
     */
    default CommandResult run(List<String> command) throws CommandException {
        return run(command, false, true);
    }

    /**
     * Runs the command and parses its stdout as JSON, raising on a non-zero exit code.
     */
    default CommandResult runJson(List<String> command) throws CommandException {
        return run(command, true, true);
    }
}
