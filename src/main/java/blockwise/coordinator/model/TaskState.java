package blockwise.coordinator.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable per-task counters. Owned by the scheduler and only touched from
 * the dispatcher thread; everyone else reads {@link ExecutionSummary}
 * snapshots.
 */
public final class TaskState {

    private final String taskId;
    private final int totalBlocks;

    private int ready;
    private int processing;
    private int completed;
    private int skipped;
    private int failed;
    private int orphaned;
    private int cancelled;
    private int retried;
    private final List<BlockFailure> failures = new ArrayList<>();

    public TaskState(String taskId, int totalBlocks) {
        this.taskId = taskId;
        this.totalBlocks = totalBlocks;
    }

    public String taskId() {
        return taskId;
    }

    public int totalBlocks() {
        return totalBlocks;
    }

    public int ready() {
        return ready;
    }

    public int processing() {
        return processing;
    }

    public int completed() {
        return completed;
    }

    public int skipped() {
        return skipped;
    }

    public int failed() {
        return failed;
    }

    public int orphaned() {
        return orphaned;
    }

    public int cancelled() {
        return cancelled;
    }

    public int retried() {
        return retried;
    }

    /** Blocks still waiting on upstream work. Derived, never stored. */
    public int pending() {
        return totalBlocks - (ready + processing + completed + failed + orphaned + cancelled);
    }

    public boolean isDone() {
        return completed + failed + orphaned + cancelled == totalBlocks;
    }

    // Transitions below are driven by BlockScheduler only

    public void addReady(int n) {
        ready += n;
    }

    public void claimed() {
        ready--;
        processing++;
    }

    public void requeued() {
        processing--;
        ready++;
        retried++;
    }

    public void completed(boolean wasSkipped) {
        processing--;
        completed++;
        if (wasSkipped) {
            skipped++;
        }
    }

    public void failed(BlockFailure failure) {
        processing--;
        failed++;
        failures.add(failure);
    }

    public void orphaned(int n) {
        orphaned += n;
    }

    public void cancelledWhileReady(int n) {
        ready -= n;
        cancelled += n;
    }

    public void cancelledWhilePending(int n) {
        cancelled += n;
    }

    public void cancelledWhileProcessing() {
        processing--;
        cancelled++;
    }

    public ExecutionSummary snapshot() {
        return new ExecutionSummary(taskId, totalBlocks, ready, processing, pending(),
                completed, skipped, failed, orphaned, cancelled, retried, List.copyOf(failures));
    }

    @Override
    public String toString() {
        return snapshot().toString();
    }
}
