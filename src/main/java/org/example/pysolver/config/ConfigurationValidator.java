package org.example.pysolver.config;

import org.example.pysolver.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Validates plugin configuration parameters.
 * Throws ConfigurationException if validation fails.
 */
public class ConfigurationValidator {

    private static final Set<Integer> VALID_PYTHON_VERSIONS = Set.of(2, 3);

    /**
     * Validates the plugin configuration.
     *
     * @param config the configuration to validate
     * @return list of validation errors (empty if valid)
     */
    public List<String> validate(SolverConfiguration config) {
        List<String> errors = new ArrayList<>();

        validateRequired(config, errors);
        validateValues(config, errors);

        return errors;
    }

    /**
     * Validates configuration and throws exception if invalid.
     *
     * @param config the configuration to validate
     * @throws ConfigurationException if validation fails
     */
    public void validateOrThrow(SolverConfiguration config) throws ConfigurationException {
        List<String> errors = validate(config);
        if (!errors.isEmpty()) {
            throw new ConfigurationException(
                    "Invalid plugin configuration:\n- " + String.join("\n- ", errors),
                    errors
            );
        }
    }

    private void validateRequired(SolverConfiguration config, List<String> errors) {
        if (config.getRequirements().stream().allMatch(this::isBlank)) {
            errors.add("at least one requirement is required (requirements or requirementsFile)");
        }

        if (config.getIndexUrls().isEmpty()) {
            errors.add("at least one index URL is required");
        }

        if (config.getOutputFile() == null) {
            errors.add("outputFile is required");
        }

        if (config.getVirtualenvDirectory() == null) {
            errors.add("virtualenvDirectory is required");
        }
    }

    private void validateValues(SolverConfiguration config, List<String> errors) {
        for (String url : config.getIndexUrls()) {
            if (isBlank(url)) {
                errors.add("indexUrls contains empty URL");
            } else if (!url.startsWith("http://") && !url.startsWith("https://")) {
                errors.add("index URL must start with http:// or https://, but was: " + url);
            }
        }

        if (!VALID_PYTHON_VERSIONS.contains(config.getPythonVersion())) {
            errors.add("pythonVersion must be 2 or 3, but was: " + config.getPythonVersion());
        }

        for (String pattern : config.getExcludePackages()) {
            if (isBlank(pattern)) {
                errors.add("excludePackages contains empty pattern");
            } else if (pattern.trim().chars().anyMatch(Character::isWhitespace)) {
                errors.add("excludePackages contains invalid pattern: " + pattern +
                           ". Must be a package name (with optional * or ? wildcards)");
            }
        }

        if (config.getCommandTimeoutSeconds() <= 0) {
            errors.add("commandTimeoutSeconds must be > 0, but was: " + config.getCommandTimeoutSeconds());
        }

        if (config.getIndexRetryAttempts() < 1) {
            errors.add("indexRetryAttempts must be >= 1, but was: " + config.getIndexRetryAttempts());
        }
    }

    private boolean isBlank(String str) {
        return str == null || str.trim().isEmpty();
    }
}
