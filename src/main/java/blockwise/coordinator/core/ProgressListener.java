package blockwise.coordinator.core;

import blockwise.coordinator.model.ExecutionSummary;
import blockwise.coordinator.model.RunResult;

/**
 * Receives block counters while a run progresses. Called from the
 * dispatcher thread, so implementations must return quickly.
 */
public interface ProgressListener {

    /** A task's counters changed. */
    void onProgress(ExecutionSummary summary);

    /** The run finished (successfully or not). */
    default void onRunFinished(RunResult result) {
    }
}
