package org.example.pysolver.index;

/**
 * Creates the client for one configured index URL.
 */
@FunctionalInterface
public interface PackageIndexFactory {

    PackageIndex create(String indexUrl);
}
