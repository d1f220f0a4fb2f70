package blockwise.coordinator.model;

import java.util.Objects;

/**
 * Identity of a block across the whole run: owning task plus block id.
 */
public record BlockKey(String taskId, long blockId) implements Comparable<BlockKey> {

    public BlockKey {
        Objects.requireNonNull(taskId, "taskId is required");
    }

    @Override
    public int compareTo(BlockKey o) {
        int byTask = taskId.compareTo(o.taskId);
        return byTask != 0 ? byTask : Long.compare(blockId, o.blockId);
    }

    @Override
    public String toString() {
        return taskId + "#" + blockId;
    }
}
