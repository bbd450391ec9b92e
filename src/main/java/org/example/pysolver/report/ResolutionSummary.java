package org.example.pysolver.report;

import org.example.pysolver.model.PassResult;
import org.example.pysolver.model.ResolutionError;

import java.util.List;

/**
 * Totals over all passes of a run.
 */
public class ResolutionSummary {

    private final int passes;
    private final int entries;
    private final int commandErrors;
    private final int notSitePackages;
    private final int unresolved;
    private final int unparsed;
    private final long executionTimeMs;

    private ResolutionSummary(Builder builder) {
        this.passes = builder.passes;
        this.entries = builder.entries;
        this.commandErrors = builder.commandErrors;
        this.notSitePackages = builder.notSitePackages;
        this.unresolved = builder.unresolved;
        this.unparsed = builder.unparsed;
        this.executionTimeMs = builder.executionTimeMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ResolutionSummary of(List<PassResult> results, long timeMs) {
        Builder builder = builder().passes(results.size()).executionTimeMs(timeMs);
        int entries = 0;
        int commandErrors = 0;
        int notSitePackages = 0;
        int unresolved = 0;
        int unparsed = 0;
        for (PassResult result : results) {
            entries += result.getTree().size();
            commandErrors += result.getErrors(ResolutionError.Type.COMMAND_ERROR).size();
            notSitePackages += result.getErrors(ResolutionError.Type.NOT_SITE_PACKAGE).size();
            unresolved += result.getUnresolved().size();
            unparsed += result.getUnparsed().size();
        }
        return builder
                .entries(entries)
                .commandErrors(commandErrors)
                .notSitePackages(notSitePackages)
                .unresolved(unresolved)
                .unparsed(unparsed)
                .build();
    }

    public int getPasses() {
        return passes;
    }

    public int getEntries() {
        return entries;
    }

    public int getCommandErrors() {
        return commandErrors;
    }

    public int getNotSitePackages() {
        return notSitePackages;
    }

    public int getUnresolved() {
        return unresolved;
    }

    public int getUnparsed() {
        return unparsed;
    }

    public long getExecutionTimeMs() {
        return executionTimeMs;
    }

    public int getTotalProblems() {
        return commandErrors + notSitePackages + unresolved + unparsed;
    }

    public boolean hasProblems() {
        return getTotalProblems() > 0;
    }

    @Override
    public String toString() {
        return String.format(
                "ResolutionSummary{passes=%d, entries=%d, errors=[command=%d, notSitePackage=%d], "
                        + "unresolved=%d, unparsed=%d, time=%dms}",
                passes, entries, commandErrors, notSitePackages, unresolved, unparsed, executionTimeMs
        );
    }

    public static class Builder {
        private int passes;
        private int entries;
        private int commandErrors;
        private int notSitePackages;
        private int unresolved;
        private int unparsed;
        private long executionTimeMs;

        public Builder passes(int passes) {
            this.passes = passes;
            return this;
        }

        public Builder entries(int entries) {
            this.entries = entries;
            return this;
        }

        public Builder commandErrors(int commandErrors) {
            this.commandErrors = commandErrors;
            return this;
        }

        public Builder notSitePackages(int notSitePackages) {
            this.notSitePackages = notSitePackages;
            return this;
        }

        public Builder unresolved(int unresolved) {
            this.unresolved = unresolved;
            return this;
        }

        public Builder unparsed(int unparsed) {
            this.unparsed = unparsed;
            return this;
        }

        public Builder executionTimeMs(long executionTimeMs) {
            this.executionTimeMs = executionTimeMs;
            return this;
        }

        public ResolutionSummary build() {
            return new ResolutionSummary(this);
        }
    }
}
