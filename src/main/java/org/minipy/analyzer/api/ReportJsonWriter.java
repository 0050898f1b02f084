package org.minipy.analyzer.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.UncheckedIOException;

/**
 * Renders {@link AnalysisReport}s as JSON. Shared by the HTTP endpoint and the CLI.
 * Instances are thread-safe.
 */
public class ReportJsonWriter {

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Writes the report as compact JSON.
     * @param report The report.
     * @return The JSON text.
     */
    public String toJson(AnalysisReport report) {
        try {
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize analysis report", e);
        }
    }

    /**
     * Writes the report as indented JSON.
     * @param report The report.
     * @return The JSON text.
     */
    public String toPrettyJson(AnalysisReport report) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize analysis report", e);
        }
    }
}
