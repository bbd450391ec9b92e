package org.example.pysolver.requirement;

import org.example.pysolver.exception.RequirementParseException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Parses PEP 508 style requirement strings such as
 * {@code requests[socks]>=2.0,<3; python_version >= "3.6"}.
 *
 * <p>Direct URL references ({@code name @ https://...}) are not supported.</p>
 */
public class RequirementParser {

    private static final Pattern REQUIREMENT_PATTERN = Pattern.compile(
            "^(?<name>[A-Za-z0-9](?:[A-Za-z0-9._-]*[A-Za-z0-9])?)\\s*" +
            "(?:\\[(?<extras>[^\\]]*)\\])?\\s*" +
            "(?<rest>.*)$");

    private static final Pattern SPECIFIER_PATTERN = Pattern.compile(
            "^(?<op>~=|===|==|!=|<=|>=|<|>)\\s*(?<version>[A-Za-z0-9.*+!_-]+)$");

    private static final Pattern EXTRA_PATTERN = Pattern.compile("^[A-Za-z0-9](?:[A-Za-z0-9._-]*[A-Za-z0-9])?$");

    private static final Set<String> WILDCARD_OPERATORS = Set.of("==", "!=");

    /**
     * Parses a single requirement.
     *
     * @param requirement the raw requirement string
     * @return the parsed requirement
     * @throws RequirementParseException if the string is not a valid requirement
     */
    public Requirement parse(String requirement) throws RequirementParseException {
        if (requirement == null || requirement.trim().isEmpty()) {
            throw new RequirementParseException(requirement, "Requirement cannot be null or empty");
        }

        String trimmed = requirement.trim();
        String marker = null;
        int markerIndex = trimmed.indexOf(';');
        if (markerIndex >= 0) {
            marker = trimmed.substring(markerIndex + 1).trim();
            trimmed = trimmed.substring(0, markerIndex).trim();
            if (marker.isEmpty()) {
                throw new RequirementParseException(requirement,
                        "Empty environment marker in requirement '" + requirement + "'");
            }
        }

        Matcher matcher = REQUIREMENT_PATTERN.matcher(trimmed);
        if (!matcher.matches()) {
            throw new RequirementParseException(requirement,
                    "Invalid requirement '" + requirement + "': expected a package name");
        }

        String name = matcher.group("name");
        List<String> extras = parseExtras(requirement, matcher.group("extras"));
        String rest = matcher.group("rest").trim();

        if (rest.startsWith("@")) {
            throw new RequirementParseException(requirement,
                    "Direct URL references are not supported: '" + requirement + "'");
        }

        List<VersionSpecifier> specifiers = parseSpecifiers(requirement, rest);
        return new Requirement(name, specifiers, extras, marker);
    }

    private List<String> parseExtras(String requirement, String extras) throws RequirementParseException {
        if (extras == null || extras.isBlank()) {
            return List.of();
        }
        List<String> result = Arrays.stream(extras.split(","))
                .map(String::trim)
                .collect(Collectors.toList());
        for (String extra : result) {
            if (!EXTRA_PATTERN.matcher(extra).matches()) {
                throw new RequirementParseException(requirement,
                        "Invalid extra '" + extra + "' in requirement '" + requirement + "'");
            }
        }
        return result;
    }

    private List<VersionSpecifier> parseSpecifiers(String requirement, String spec) throws RequirementParseException {
        if (spec.startsWith("(")) {
            if (!spec.endsWith(")")) {
                throw new RequirementParseException(requirement,
                        "Unbalanced parenthesis in requirement '" + requirement + "'");
            }
            spec = spec.substring(1, spec.length() - 1).trim();
        }
        if (spec.isEmpty()) {
            return List.of();
        }

        List<VersionSpecifier> specifiers = new ArrayList<>();
        for (String clause : spec.split(",", -1)) {
            specifiers.add(parseSpecifier(requirement, clause.trim()));
        }
        return specifiers;
    }

    private VersionSpecifier parseSpecifier(String requirement, String clause) throws RequirementParseException {
        Matcher matcher = SPECIFIER_PATTERN.matcher(clause);
        if (!matcher.matches()) {
            throw new RequirementParseException(requirement,
                    "Invalid version specifier '" + clause + "' in requirement '" + requirement + "'");
        }

        String operator = matcher.group("op");
        String version = matcher.group("version");
        if (operator.equals("===")) {
            return new VersionSpecifier(operator, version);
        }

        String checked = version;
        if (version.endsWith(".*")) {
            if (!WILDCARD_OPERATORS.contains(operator)) {
                throw new RequirementParseException(requirement,
                        "Wildcard versions are only allowed with == and != in requirement '" + requirement + "'");
            }
            checked = version.substring(0, version.length() - 2);
        }
        if (PythonVersion.tryParse(checked).isEmpty() || checked.contains("*")) {
            throw new RequirementParseException(requirement,
                    "Invalid version '" + version + "' in requirement '" + requirement + "'");
        }
        if (operator.equals("~=") && PythonVersion.parse(checked).getRelease().size() < 2) {
            throw new RequirementParseException(requirement,
                    "Compatible release clause needs at least two release segments: '" + clause + "'");
        }
        return new VersionSpecifier(operator, version);
    }
}
