package io.troupe.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.troupe.core.report.Report;
import io.troupe.core.run.RunRecord;

/**
 * JSON export of reports and run records for presentation consumers.
 *
 * <p>Reports round-trip. Run records are export-only: they embed composed agents and attempt
 * logs meant for display, not for reconstruction.
 */
public final class ReportSerializer {

    private static final ObjectMapper MAPPER = TemplateSerializer.createMapper();

    private ReportSerializer() {}

    public static String toJson(Report report) {
        try {
            return MAPPER.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize report: " + e.getMessage(), e);
        }
    }

    public static Report fromJson(String json) {
        try {
            return MAPPER.readValue(json, Report.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize report: " + e.getMessage(), e);
        }
    }

    /**
     * Serializes a run record with its report, composition, results and attempt log.
     *
     * @param run finished run, not null
     * @return indented JSON, never null
     * @throws IllegalArgumentException if serialization fails
     */
    public static String toJson(RunRecord run) {
        try {
            return MAPPER.writeValueAsString(run);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize run: " + e.getMessage(), e);
        }
    }
}
