package blockwise.coordinator.model;

/**
 * Block lifecycle state. Only the scheduler moves a block between states.
 */
public enum BlockStatus {
    /** Waiting for upstream blocks */
    PENDING,
    /** All dependencies satisfied, waiting for a worker */
    READY,
    /** Handed to a worker */
    CLAIMED,
    /** Worker is inside the process function */
    RUNNING,
    /** Processed, or found already done by the check function */
    SUCCESS,
    /** Process function faulted and the retry budget is spent */
    FAILED,
    /** Can never run because an upstream block failed */
    ORPHANED,
    /** Stopped by a cancel request before it could finish */
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == ORPHANED || this == CANCELLED;
    }

    /** Claimed or running: a worker holds the block. */
    public boolean isActive() {
        return this == CLAIMED || this == RUNNING;
    }
}
