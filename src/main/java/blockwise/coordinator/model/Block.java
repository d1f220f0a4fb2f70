package blockwise.coordinator.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Unit of schedulable work: the region a process function reads and the
 * region it writes. Immutable; the block's state is held by the scheduler.
 */
public final class Block {

    private final BlockKey key;
    private final long[] gridPosition;
    private final Roi readRoi;
    private final Roi writeRoi;

    public Block(String taskId, long blockId, long[] gridPosition, Roi readRoi, Roi writeRoi) {
        this.key = new BlockKey(taskId, blockId);
        this.gridPosition = Objects.requireNonNull(gridPosition, "gridPosition is required").clone();
        this.readRoi = Objects.requireNonNull(readRoi, "readRoi is required");
        this.writeRoi = Objects.requireNonNull(writeRoi, "writeRoi is required");
        if (!readRoi.contains(writeRoi)) {
            throw new IllegalArgumentException("read roi " + readRoi + " does not contain write roi " + writeRoi);
        }
    }

    public BlockKey key() {
        return key;
    }

    public String taskId() {
        return key.taskId();
    }

    public long blockId() {
        return key.blockId();
    }

    public long[] gridPosition() {
        return gridPosition.clone();
    }

    public Roi readRoi() {
        return readRoi;
    }

    public Roi writeRoi() {
        return writeRoi;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Block block))
            return false;
        return key.equals(block.key);
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        return "Block{" + key + ", grid=" + Arrays.toString(gridPosition)
                + ", read=" + readRoi + ", write=" + writeRoi + '}';
    }
}
