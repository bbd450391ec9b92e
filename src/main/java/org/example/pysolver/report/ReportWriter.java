package org.example.pysolver.report;

import org.example.pysolver.exception.ReportException;

import java.nio.file.Path;

/**
 * Interface for resolution report writers.
 */
public interface ReportWriter {

    /**
     * Writes the report, creating parent directories as needed.
     *
     * @param report the report to write
     * @param file   target file, overwritten if it exists
     * @throws ReportException if the report cannot be written
     */
    void write(SolverReport report, Path file) throws ReportException;
}
