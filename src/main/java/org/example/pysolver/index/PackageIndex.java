package org.example.pysolver.index;

import org.example.pysolver.exception.IndexException;
import org.example.pysolver.exception.PackageNotFoundException;

import java.util.List;

/**
 * A Python package index (a PEP 503 "simple" repository such as PyPI).
 */
public interface PackageIndex {

    /**
     * Returns the index URL, as configured.
     */
    String getUrl();

    /**
     * Returns every version the index publishes for the package, in index order.
     *
     * @throws PackageNotFoundException if the index does not know the package
     * @throws IndexException           if the index cannot be queried
     */
    List<String> getPackageVersions(String packageName) throws IndexException;

    /**
     * Returns the sha256 digests of all artifacts published for the given version.
     *
     * @throws IndexException if the index cannot be queried
     */
    List<String> getPackageHashes(String packageName, String version) throws IndexException;
}
