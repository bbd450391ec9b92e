package org.example.pysolver.resolver;

import org.example.pysolver.environment.EnvironmentProbeFactory;
import org.example.pysolver.filter.ExclusionFilter;
import org.example.pysolver.index.PackageIndex;
import org.example.pysolver.index.PackageIndexFactory;
import org.example.pysolver.model.PassResult;
import org.example.pysolver.requirement.RequirementParser;
import org.example.pysolver.solver.PythonSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Runs one graph-building pass per configured index.
 *
 * <p>Each pass gets a fresh environment probe and its own traversal state; only the
 * index clients and version resolvers are shared between passes.</p>
 */
public class PythonDependencyResolver implements DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(PythonDependencyResolver.class);

    private final PackageIndexFactory indexFactory;
    private final EnvironmentProbeFactory probeFactory;
    private final RequirementParser parser;

    public PythonDependencyResolver(PackageIndexFactory indexFactory, EnvironmentProbeFactory probeFactory) {
        this(indexFactory, probeFactory, new RequirementParser());
    }

    public PythonDependencyResolver(PackageIndexFactory indexFactory, EnvironmentProbeFactory probeFactory,
                                    RequirementParser parser) {
        this.indexFactory = Objects.requireNonNull(indexFactory, "indexFactory cannot be null");
        this.probeFactory = Objects.requireNonNull(probeFactory, "probeFactory cannot be null");
        this.parser = Objects.requireNonNull(parser, "parser cannot be null");
    }

    @Override
    public List<PassResult> resolve(List<String> requirements, List<String> indexUrls, int pythonVersion,
                                    Set<String> excludePackages, boolean transitive) {
        if (pythonVersion != 2 && pythonVersion != 3) {
            throw new IllegalArgumentException("Unknown Python version: " + pythonVersion);
        }
        Objects.requireNonNull(requirements, "requirements cannot be null");
        Objects.requireNonNull(indexUrls, "indexUrls cannot be null");

        List<PackageIndex> indexes = new ArrayList<>();
        List<VersionResolver> resolvers = new ArrayList<>();
        for (String indexUrl : indexUrls) {
            PackageIndex index = indexFactory.create(indexUrl);
            indexes.add(index);
            resolvers.add(new VersionResolver(new PythonSolver(index, parser)));
        }

        ExclusionFilter exclusionFilter = new ExclusionFilter(excludePackages);

        List<PassResult> results = new ArrayList<>();
        for (int i = 0; i < indexes.size(); i++) {
            log.info("Resolving {} requirements using index {} ({}/{})",
                    requirements.size(), indexUrls.get(i), i + 1, indexes.size());
            DependencyGraphBuilder builder = new DependencyGraphBuilder(
                    indexes.get(i),
                    resolvers.get(i),
                    resolvers,
                    probeFactory.create(pythonVersion),
                    parser,
                    exclusionFilter,
                    transitive);
            results.add(builder.build(requirements));
        }
        return results;
    }
}
