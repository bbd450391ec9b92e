package org.example.pysolver.solver;

import org.example.pysolver.exception.IndexException;
import org.example.pysolver.exception.RequirementParseException;
import org.example.pysolver.index.PackageIndex;
import org.example.pysolver.requirement.Requirement;
import org.example.pysolver.requirement.RequirementParser;
import org.example.pysolver.requirement.SpecifierSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns requirement ranges into concrete versions published on one index.
 */
public class PythonSolver {

    private static final Logger log = LoggerFactory.getLogger(PythonSolver.class);

    private final PackageIndex index;
    private final RequirementParser parser;

    public PythonSolver(PackageIndex index) {
        this(index, new RequirementParser());
    }

    public PythonSolver(PackageIndex index, RequirementParser parser) {
        this.index = Objects.requireNonNull(index, "index cannot be null");
        this.parser = Objects.requireNonNull(parser, "parser cannot be null");
    }

    public PackageIndex getIndex() {
        return index;
    }

    /**
     * Solves each requirement against the index.
     *
     * @param requirements requirement strings, e.g. {@code flask>=1.0,<2}
     * @param allVersions  true to return every matching version, false for the highest only
     * @return package name to matching versions (ascending), in requirement order
     * @throws org.example.pysolver.exception.PackageNotFoundException if a package is unknown to the index
     * @throws IndexException            if the index cannot be queried
     * @throws RequirementParseException if a requirement is malformed
     */
    public Map<String, List<String>> solve(List<String> requirements, boolean allVersions)
            throws IndexException, RequirementParseException {
        Map<String, List<String>> result = new LinkedHashMap<>();

        for (String raw : requirements) {
            Requirement requirement = parser.parse(raw);
            List<String> published = index.getPackageVersions(requirement.getName());
            List<String> matching = new SpecifierSet(requirement.getSpecifiers()).filter(published);

            log.debug("{} of {} published versions of {} match {} on {}",
                    matching.size(), published.size(), requirement.getName(),
                    requirement.getVersionSpec().isEmpty() ? "any" : requirement.getVersionSpec(),
                    index.getUrl());

            if (!allVersions && !matching.isEmpty()) {
                matching = List.of(matching.get(matching.size() - 1));
            }
            result.put(requirement.getName(), matching);
        }

        return result;
    }
}
