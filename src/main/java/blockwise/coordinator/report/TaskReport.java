package blockwise.coordinator.report;

import blockwise.coordinator.model.BlockFailure;
import blockwise.coordinator.model.ExecutionSummary;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Final counters of one task.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record TaskReport(
        @JsonProperty("taskId") String taskId,
        @JsonProperty("totalBlocks") int totalBlocks,
        @JsonProperty("completed") int completed,
        @JsonProperty("skipped") int skipped,
        @JsonProperty("failed") int failed,
        @JsonProperty("orphaned") int orphaned,
        @JsonProperty("cancelled") int cancelled,
        @JsonProperty("retried") int retried,
        @JsonProperty("failures") List<String> failures) {

    public TaskReport {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static TaskReport from(ExecutionSummary summary) {
        return new TaskReport(
                summary.taskId(),
                summary.totalBlocks(),
                summary.completed(),
                summary.skipped(),
                summary.failed(),
                summary.orphaned(),
                summary.cancelled(),
                summary.retried(),
                summary.failures().stream().map(BlockFailure::toString).toList());
    }
}
