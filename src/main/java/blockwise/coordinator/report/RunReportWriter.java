package blockwise.coordinator.report;

import blockwise.coordinator.model.RunResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes {@link RunReport}s as JSON.
 */
public final class RunReportWriter {

    private static final Logger log = LoggerFactory.getLogger(RunReportWriter.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .enable(SerializationFeature.INDENT_OUTPUT);

    public String toJson(RunReport report) {
        try {
            return MAPPER.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize run report", e);
        }
    }

    public String toJson(RunResult result) {
        return toJson(RunReport.from(result));
    }

    public RunReport fromJson(String json) {
        try {
            return MAPPER.readValue(json, RunReport.class);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to parse run report", e);
        }
    }

    /**
     * Write the report to {@code path}, creating parent directories.
     */
    public Path write(RunResult result, Path path) {
        RunReport report = RunReport.from(result);
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            Files.writeString(path, toJson(report));
        } catch (IOException e) {
            throw new RuntimeException("Failed to write run report to " + path, e);
        }
        log.info("Run report written to {}", path);
        return path;
    }
}
