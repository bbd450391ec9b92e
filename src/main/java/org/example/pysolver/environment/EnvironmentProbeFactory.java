package org.example.pysolver.environment;

/**
 * Supplies a fresh probe for each resolution pass.
 */
@FunctionalInterface
public interface EnvironmentProbeFactory {

    EnvironmentProbe create(int pythonVersion);
}
