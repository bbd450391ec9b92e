package org.example.pysolver.exception;

/**
 * Exception thrown when the resolution report cannot be written.
 */
public class ReportException extends SolverException {

    public ReportException(String message) {
        super(message);
    }

    public ReportException(String message, Throwable cause) {
        super(message, cause);
    }
}
