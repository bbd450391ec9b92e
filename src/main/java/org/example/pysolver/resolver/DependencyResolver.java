package org.example.pysolver.resolver;

import org.example.pysolver.model.PassResult;

import java.util.List;
import java.util.Set;

/**
 * Interface for requirement resolvers.
 */
public interface DependencyResolver {

    /**
     * Resolves the requirements once per index, using that index as the installation
     * source and all indexes for cross-resolution of discovered dependencies.
     *
     * @param requirements    requirement strings, e.g. {@code flask>=1.0}
     * @param indexUrls       index URLs, in resolution order
     * @param pythonVersion   major Python version, 2 or 3
     * @param excludePackages names or glob patterns of seeds to skip (null = none)
     * @param transitive      true to follow discovered dependencies
     * @return one result per index, aligned with {@code indexUrls}
     * @throws IllegalArgumentException if pythonVersion is neither 2 nor 3
     */
    List<PassResult> resolve(List<String> requirements, List<String> indexUrls, int pythonVersion,
                             Set<String> excludePackages, boolean transitive);
}
