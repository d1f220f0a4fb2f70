package blockwise.coordinator.report;

import blockwise.coordinator.model.RunResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * JSON summary of a finished run.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunReport(
        @JsonProperty("status") String status,
        @JsonProperty("cancelled") boolean cancelled,
        @JsonProperty("elapsedMs") long elapsedMs,
        @JsonProperty("finishedAt") Instant finishedAt,
        @JsonProperty("totalBlocks") int totalBlocks,
        @JsonProperty("tasks") List<TaskReport> tasks) {

    public static RunReport from(RunResult result, Instant finishedAt) {
        return new RunReport(
                result.succeeded() ? "SUCCEEDED" : "FAILED",
                result.wasCancelled(),
                result.elapsed().toMillis(),
                finishedAt,
                result.totalBlocks(),
                result.summaries().values().stream().map(TaskReport::from).toList());
    }

    public static RunReport from(RunResult result) {
        return from(result, Instant.now());
    }

    public boolean succeeded() {
        return "SUCCEEDED".equals(status);
    }
}
