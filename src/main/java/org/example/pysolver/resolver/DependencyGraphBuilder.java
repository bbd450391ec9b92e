package org.example.pysolver.resolver;

import org.example.pysolver.environment.EnvironmentProbe;
import org.example.pysolver.environment.ProbeResult;
import org.example.pysolver.exception.CommandException;
import org.example.pysolver.exception.RequirementParseException;
import org.example.pysolver.filter.ExclusionFilter;
import org.example.pysolver.index.PackageIndex;
import org.example.pysolver.model.Dependency;
import org.example.pysolver.model.DependencyEntry;
import org.example.pysolver.model.PackageKey;
import org.example.pysolver.model.PassResult;
import org.example.pysolver.model.ResolutionError;
import org.example.pysolver.model.ResolvedVersions;
import org.example.pysolver.model.UnparsedRequirement;
import org.example.pysolver.model.UnresolvedRequirement;
import org.example.pysolver.requirement.Requirement;
import org.example.pysolver.requirement.RequirementParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the dependency graph for one pass, installing every package from a single index.
 *
 * <p>Traversal:</p>
 * <ol>
 *   <li>Seed the work stack with every version of every requirement available on the
 *       pass's own index</li>
 *   <li>Capture the environment inventory</li>
 *   <li>Pop and probe until the stack is empty; resolve each discovered dependency
 *       against all indexes and, in transitive mode, push unseen versions</li>
 * </ol>
 *
 * <p>The stack is LIFO, so the most recently discovered packages are probed first. A
 * (name, version) pair is probed at most once per pass. Failures are recorded in the
 * {@link PassResult} and never abort the pass.</p>
 *
 * <p>Instances are single-use.</p>
 */
public class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    static final String PROVISIONING_TOOL = "virtualenv";
    static final String INVENTORY_TOOL = "pipdeptree";

    private final PackageIndex index;
    private final VersionResolver ownResolver;
    private final List<VersionResolver> allResolvers;
    private final EnvironmentProbe probe;
    private final RequirementParser parser;
    private final ExclusionFilter exclusionFilter;
    private final boolean transitive;

    private final Set<PackageKey> visited = new HashSet<>();
    private final Deque<PackageKey> stack = new ArrayDeque<>();

    /**
     * @param index           the index packages get installed from in this pass
     * @param ownResolver     resolver bound to {@code index}, used for the seeds
     * @param allResolvers    resolvers of all configured indexes, in configuration order
     * @param probe           the environment probe owning the virtualenv
     * @param parser          requirement parser
     * @param exclusionFilter seeds to skip
     * @param transitive      true to follow discovered dependencies
     */
    public DependencyGraphBuilder(PackageIndex index, VersionResolver ownResolver, List<VersionResolver> allResolvers,
                                  EnvironmentProbe probe, RequirementParser parser,
                                  ExclusionFilter exclusionFilter, boolean transitive) {
        this.index = Objects.requireNonNull(index, "index cannot be null");
        this.ownResolver = Objects.requireNonNull(ownResolver, "ownResolver cannot be null");
        this.allResolvers = List.copyOf(allResolvers);
        this.probe = Objects.requireNonNull(probe, "probe cannot be null");
        this.parser = Objects.requireNonNull(parser, "parser cannot be null");
        this.exclusionFilter = exclusionFilter != null ? exclusionFilter : ExclusionFilter.none();
        this.transitive = transitive;
    }

    /**
     * Runs the pass.
     *
     * @param requirements requirement strings
     * @return the pass result, never null
     */
    public PassResult build(List<String> requirements) {
        String indexUrl = index.getUrl();
        PassResult result = new PassResult(indexUrl);

        boolean provisioned = provision(result);

        for (String requirement : requirements) {
            seed(requirement, result);
        }

        if (!provisioned) {
            log.warn("Environment for index {} is not available, {} seeded packages will not be probed",
                    indexUrl, stack.size());
            return result;
        }

        try {
            result.setEnvironment(probe.snapshot());
        } catch (CommandException e) {
            log.error("Failed to obtain environment details for index {}: {}", indexUrl, e.getMessage());
            result.addError(ResolutionError.commandError(INVENTORY_TOOL, indexUrl, null, e.toDetails()));
            return result;
        }

        while (!stack.isEmpty()) {
            PackageKey key = stack.pop();
            log.info("Using index {} to discover package {} in version {}", indexUrl, key.getName(), key.getVersion());

            ProbeResult probed = probe.probe(key, index);
            if (!probed.isSuccess()) {
                log.debug("There was an error during package {} in version {} discovery from {}: {}",
                        key.getName(), key.getVersion(), indexUrl, probed.getError());
                result.addError(probed.getError());
                continue;
            }

            DependencyEntry entry = probed.getEntry();
            result.addEntry(entry);
            expand(entry);
        }

        log.info("Pass for index {} finished: {} entries, {} errors, {} unresolved, {} unparsed",
                indexUrl, result.getTree().size(), result.getErrors().size(),
                result.getUnresolved().size(), result.getUnparsed().size());
        if (log.isDebugEnabled()) {
            log.debug(result.toDetailedString());
        }
        return result;
    }

    private boolean provision(PassResult result) {
        try {
            probe.prepare();
            return true;
        } catch (CommandException e) {
            log.error("Failed to provision environment for index {}: {}", index.getUrl(), e.getMessage());
            result.addError(ResolutionError.commandError(PROVISIONING_TOOL, index.getUrl(), null, e.toDetails()));
            return false;
        }
    }

    private void seed(String raw, PassResult result) {
        log.debug("Parsing requirement {}", raw);
        Requirement requirement;
        try {
            requirement = parser.parse(raw);
        } catch (RequirementParseException e) {
            log.warn("Failed to parse requirement {}: {}", raw, e.getMessage());
            result.addUnparsed(new UnparsedRequirement(raw, e.getMessage()));
            return;
        }

        if (exclusionFilter.isExcluded(requirement.getName())) {
            log.info("Skipping excluded requirement {}", raw);
            return;
        }

        String versionSpec = requirement.getVersionSpec();
        List<String> versions = ownResolver.resolveVersions(requirement.getName(), versionSpec);
        if (versions.isEmpty()) {
            log.warn("No versions were resolved for dependency {} in version {}", requirement.getName(), versionSpec);
            result.addUnresolved(new UnresolvedRequirement(requirement.getName(), versionSpec, index.getUrl()));
            return;
        }

        for (String version : versions) {
            admit(new PackageKey(requirement.getName(), version));
        }
    }

    private void expand(DependencyEntry entry) {
        for (Dependency dependency : entry.getDependencies()) {
            for (VersionResolver resolver : allResolvers) {
                log.info("Resolving dependency versions for {} with range {} from {}",
                        dependency.getPackageName(), dependency.getRequiredVersion(), resolver.getIndexUrl());
                List<String> versions = resolver.resolveVersions(
                        dependency.getPackageName(), dependency.getRequiredVersion());
                log.debug("Resolved versions for package {} with range specifier {}: {}",
                        dependency.getPackageName(), dependency.getRequiredVersion(), versions);
                dependency.addResolvedVersions(new ResolvedVersions(resolver.getIndexUrl(), versions));

                if (!transitive) {
                    continue;
                }
                // versions from any index are admitted, the visited set ignores the index
                for (String version : versions) {
                    admit(new PackageKey(dependency.getPackageName(), version));
                }
            }
        }
    }

    private void admit(PackageKey key) {
        if (visited.add(key)) {
            stack.push(key);
        }
    }

    Set<PackageKey> getVisited() {
        return visited;
    }
}
