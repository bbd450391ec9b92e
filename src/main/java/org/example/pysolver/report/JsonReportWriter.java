package org.example.pysolver.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.example.pysolver.exception.ReportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the report as pretty-printed JSON.
 */
public class JsonReportWriter implements ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(JsonReportWriter.class);

    private final ObjectMapper objectMapper;

    public JsonReportWriter() {
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void write(SolverReport report, Path file) throws ReportException {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(file.toFile(), report);
            log.info("Report with {} pass results written to {}", report.getResult().size(), file);
        } catch (IOException e) {
            throw new ReportException("Failed to write report to " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Renders the report as a JSON string.
     */
    public String toJson(SolverReport report) throws ReportException {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (IOException e) {
            throw new ReportException("Failed to serialize report: " + e.getMessage(), e);
        }
    }
}
