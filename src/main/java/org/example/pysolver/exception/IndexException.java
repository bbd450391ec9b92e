package org.example.pysolver.exception;

/**
 * Exception thrown when a package index cannot be queried.
 */
public class IndexException extends SolverException {

    private final boolean serverError;

    public IndexException(String message) {
        this(message, false);
    }

    /**
     * @param serverError whether the index answered with a 5xx status
     */
    public IndexException(String message, boolean serverError) {
        super(message);
        this.serverError = serverError;
    }

    public IndexException(String message, Throwable cause) {
        super(message, cause);
        this.serverError = false;
    }

    /**
     * Returns true if the index reported a server-side failure, which may go away on retry.
     */
    public boolean isServerError() {
        return serverError;
    }
}
