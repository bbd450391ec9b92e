package org.example.pysolver.exception;

/**
 * Exception thrown when a requirement string cannot be parsed.
 */
public class RequirementParseException extends SolverException {

    private final String requirement;

    public RequirementParseException(String requirement, String message) {
        super(message);
        this.requirement = requirement;
    }

    public String getRequirement() {
        return requirement;
    }
}
