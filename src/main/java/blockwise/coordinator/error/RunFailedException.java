package blockwise.coordinator.error;

import blockwise.coordinator.model.RunResult;

/**
 * Raised from {@link RunResult#throwIfFailed()} when a run left failed,
 * orphaned or cancelled blocks behind.
 */
public class RunFailedException extends BlockwiseException {

    private final transient RunResult result;

    public RunFailedException(RunResult result) {
        super("Blockwise run failed: " + result.describe());
        this.result = result;
    }

    public RunResult result() {
        return result;
    }
}
