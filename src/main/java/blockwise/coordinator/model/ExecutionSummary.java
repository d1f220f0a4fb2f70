package blockwise.coordinator.model;

import java.util.List;

/**
 * Immutable snapshot of one task's block counters. {@code completed}
 * includes {@code skipped} blocks.
 */
public record ExecutionSummary(
        String taskId,
        int totalBlocks,
        int ready,
        int processing,
        int pending,
        int completed,
        int skipped,
        int failed,
        int orphaned,
        int cancelled,
        int retried,
        List<BlockFailure> failures) {

    public boolean isDone() {
        return completed + failed + orphaned + cancelled == totalBlocks;
    }

    /** Every block completed: nothing failed, orphaned or cancelled. */
    public boolean succeeded() {
        return isDone() && failed == 0 && orphaned == 0 && cancelled == 0;
    }

    /** Calculate progress percentage */
    public int progressPercent() {
        if (totalBlocks == 0)
            return 100;
        return (int) ((completed + failed + orphaned + cancelled) * 100L / totalBlocks);
    }

    @Override
    public String toString() {
        return taskId + ": " + completed + "/" + totalBlocks + " completed"
                + " (" + skipped + " skipped)"
                + ", " + failed + " failed"
                + ", " + orphaned + " orphaned"
                + ", " + cancelled + " cancelled"
                + ", " + ready + " ready"
                + ", " + processing + " processing"
                + ", " + pending + " pending";
    }
}
