package org.example.pysolver.exception;

/**
 * Exception thrown when a package index does not know the requested package.
 */
public class PackageNotFoundException extends IndexException {

    private final String packageName;
    private final String indexUrl;

    public PackageNotFoundException(String packageName, String indexUrl) {
        super("Package " + packageName + " was not found on index " + indexUrl);
        this.packageName = packageName;
        this.indexUrl = indexUrl;
    }

    public String getPackageName() {
        return packageName;
    }

    public String getIndexUrl() {
        return indexUrl;
    }
}
