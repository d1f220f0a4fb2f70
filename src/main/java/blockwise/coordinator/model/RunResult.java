package blockwise.coordinator.model;

import blockwise.coordinator.error.RunFailedException;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of a blockwise run: the final summary of every task, in
 * scheduling order.
 */
public final class RunResult {

    private final Map<String, ExecutionSummary> summaries;
    private final Duration elapsed;
    private final boolean cancelled;

    public RunResult(Map<String, ExecutionSummary> summaries, Duration elapsed, boolean cancelled) {
        this.summaries = Collections.unmodifiableMap(new LinkedHashMap<>(summaries));
        this.elapsed = elapsed;
        this.cancelled = cancelled;
    }

    public Map<String, ExecutionSummary> summaries() {
        return summaries;
    }

    public Optional<ExecutionSummary> summary(String taskId) {
        return Optional.ofNullable(summaries.get(taskId));
    }

    public Duration elapsed() {
        return elapsed;
    }

    /** Whether a cancel request reached the run. */
    public boolean wasCancelled() {
        return cancelled;
    }

    public boolean succeeded() {
        return summaries.values().stream().allMatch(ExecutionSummary::succeeded);
    }

    public int totalBlocks() {
        return summaries.values().stream().mapToInt(ExecutionSummary::totalBlocks).sum();
    }

    public int totalFailed() {
        return summaries.values().stream().mapToInt(ExecutionSummary::failed).sum();
    }

    public int totalOrphaned() {
        return summaries.values().stream().mapToInt(ExecutionSummary::orphaned).sum();
    }

    public int totalCancelled() {
        return summaries.values().stream().mapToInt(ExecutionSummary::cancelled).sum();
    }

    /** Exit status for callers that map runs onto a process result. */
    public int exitCode() {
        return succeeded() ? 0 : 1;
    }

    public RunResult throwIfFailed() {
        if (!succeeded()) {
            throw new RunFailedException(this);
        }
        return this;
    }

    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append(succeeded() ? "succeeded" : "failed")
                .append(" in ").append(elapsed.toMillis()).append("ms");
        for (ExecutionSummary summary : summaries.values()) {
            sb.append("; ").append(summary.taskId())
                    .append(" completed=").append(summary.completed())
                    .append(" skipped=").append(summary.skipped())
                    .append(" failed=").append(summary.failed())
                    .append(" orphaned=").append(summary.orphaned())
                    .append(" cancelled=").append(summary.cancelled());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "RunResult{" + describe() + '}';
    }
}
