package blockwise.coordinator.repository;

import blockwise.coordinator.model.Block;
import blockwise.coordinator.model.BlockKey;

import java.util.Optional;

/**
 * Persistent record of blocks that finished successfully, so that a later
 * run over the same tasks can skip them.
 * Implementations can use JDBC or in-memory storage.
 */
public interface BlockDoneRepository {

    /**
     * Whether the block was recorded as done. A record whose write region
     * differs from the block's (the task id was reused for another layout)
     * does not count and is dropped.
     *
     * @param block the block about to run
     * @return true if a matching completion record exists
     */
    boolean isDone(Block block);

    /**
     * Record a block as done. Recording the same block twice is not an
     * error.
     *
     * @param block the finished block
     */
    void markDone(Block block);

    /**
     * Find the completion record of a block.
     *
     * @param key the block
     * @return the record if the block is done
     */
    Optional<BlockDoneRecord> find(BlockKey key);

    /**
     * Count completion records for a task.
     *
     * @param taskId the task ID
     * @return count
     */
    int countByTask(String taskId);

    /**
     * Forget every completion record of a task, so it is fully reprocessed.
     *
     * @param taskId the task ID
     * @return number of records removed
     */
    int clear(String taskId);
}
