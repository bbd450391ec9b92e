package org.example.pysolver.exception;

import java.util.List;

/**
 * Exception thrown when configuration validation fails.
 */
public class ConfigurationException extends SolverException {

    private final List<String> validationErrors;

    public ConfigurationException(String message) {
        this(message, List.of());
    }

    public ConfigurationException(String message, List<String> validationErrors) {
        super(message);
        this.validationErrors = List.copyOf(validationErrors);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.validationErrors = List.of();
    }

    public List<String> getValidationErrors() {
        return validationErrors;
    }
}
