package org.example.pysolver.environment;

import org.example.pysolver.model.DependencyEntry;
import org.example.pysolver.model.ResolutionError;

import java.util.Objects;

/**
 * Outcome of probing one package version: either an entry or an error record.
 */
public class ProbeResult {

    /**
     * Probe outcome tag.
     */
    public enum Status {
        SUCCESS,
        COMMAND_ERROR,
        NOT_SITE_PACKAGE
    }

    private final Status status;
    private final DependencyEntry entry;
    private final ResolutionError error;

    private ProbeResult(Status status, DependencyEntry entry, ResolutionError error) {
        this.status = status;
        this.entry = entry;
        this.error = error;
    }

    public static ProbeResult success(DependencyEntry entry) {
        return new ProbeResult(Status.SUCCESS, Objects.requireNonNull(entry, "entry cannot be null"), null);
    }

    public static ProbeResult failure(ResolutionError error) {
        Objects.requireNonNull(error, "error cannot be null");
        Status status = error.getType() == ResolutionError.Type.NOT_SITE_PACKAGE
                ? Status.NOT_SITE_PACKAGE
                : Status.COMMAND_ERROR;
        return new ProbeResult(status, null, error);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    /**
     * Returns the probed entry; null unless the probe succeeded.
     */
    public DependencyEntry getEntry() {
        return entry;
    }

    /**
     * Returns the error record; null if the probe succeeded.
     */
    public ResolutionError getError() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "ProbeResult{success, " + entry + "}"
                : "ProbeResult{" + status + ", " + error + "}";
    }
}
