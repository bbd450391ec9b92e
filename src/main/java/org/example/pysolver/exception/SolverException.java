package org.example.pysolver.exception;

/**
 * Base exception for all PySolver plugin errors.
 */
public class SolverException extends Exception {

    public SolverException(String message) {
        super(message);
    }

    public SolverException(String message, Throwable cause) {
        super(message, cause);
    }
}
