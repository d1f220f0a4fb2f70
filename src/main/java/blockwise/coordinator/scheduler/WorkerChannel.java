package blockwise.coordinator.scheduler;

import blockwise.coordinator.model.Block;
import blockwise.coordinator.model.BlockKey;

import java.util.Optional;

/**
 * How a worker talks to the dispatcher. Workers never touch block state;
 * they ask for work and report what happened.
 */
public interface WorkerChannel {

    /**
     * Block until the dispatcher hands out a block, or until there is no
     * more work for this run.
     *
     * @return the claimed block, or empty when the worker should exit
     */
    Optional<Block> claim(String workerId) throws InterruptedException;

    /** The worker is about to invoke the process function. */
    void started(String workerId, BlockKey block);

    /** Final word on a claimed block. */
    void report(String workerId, BlockKey block, BlockOutcome outcome);

    /** Whether a cancel request has been made for this run. */
    boolean isCancelRequested();
}
