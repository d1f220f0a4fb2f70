package blockwise.coordinator.partition;

import blockwise.coordinator.model.Block;
import blockwise.coordinator.model.GridCursor;
import blockwise.coordinator.model.Roi;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The blocks of one task, laid out on a regular grid over the task's total
 * region. Block ids are row-major grid indices, so {@code block(id)} and
 * {@link #blocksIntersecting(Roi)} are plain arithmetic.
 */
public final class BlockGrid {

    private final String taskId;
    private final Roi totalRoi;
    private final long[] blockShape;
    private final long[] context;
    private final long[] gridShape;
    private final long[] conflictStride;
    private final List<Block> blocks;

    BlockGrid(String taskId, Roi totalRoi, long[] blockShape, long[] context, long[] gridShape,
            long[] conflictStride, List<Block> blocks) {
        this.taskId = taskId;
        this.totalRoi = totalRoi;
        this.blockShape = blockShape;
        this.context = context;
        this.gridShape = gridShape;
        this.conflictStride = conflictStride;
        this.blocks = Collections.unmodifiableList(blocks);
    }

    public String taskId() {
        return taskId;
    }

    public Roi totalRoi() {
        return totalRoi;
    }

    public long[] blockShape() {
        return blockShape.clone();
    }

    public long[] context() {
        return context.clone();
    }

    public long[] gridShape() {
        return gridShape.clone();
    }

    /** All blocks in block id order. */
    public List<Block> blocks() {
        return blocks;
    }

    public int size() {
        return blocks.size();
    }

    public Block block(long blockId) {
        if (blockId < 0 || blockId >= blocks.size()) {
            throw new IllegalArgumentException("task " + taskId + " has no block " + blockId);
        }
        return blocks.get((int) blockId);
    }

    /** Row-major index of a grid position. */
    public long blockIdOf(long[] gridPosition) {
        long id = 0;
        for (int d = 0; d < gridShape.length; d++) {
            id = id * gridShape[d] + gridPosition[d];
        }
        return id;
    }

    /**
     * Blocks whose write region intersects {@code roi}, in block id order.
     */
    public List<Block> blocksIntersecting(Roi roi) {
        Roi clipped = totalRoi.intersect(roi);
        List<Block> result = new ArrayList<>();
        if (clipped.isEmpty()) {
            return result;
        }
        int dims = gridShape.length;
        long[] low = new long[dims];
        long[] extent = new long[dims];
        for (int d = 0; d < dims; d++) {
            long first = (clipped.offset(d) - totalRoi.offset(d)) / blockShape[d];
            long last = (clipped.end(d) - 1 - totalRoi.offset(d)) / blockShape[d];
            low[d] = first;
            extent[d] = last - first + 1;
        }
        long[] step = new long[dims];
        long[] position = new long[dims];
        do {
            for (int d = 0; d < dims; d++) {
                position[d] = low[d] + step[d];
            }
            result.add(blocks.get((int) blockIdOf(position)));
        } while (GridCursor.advance(step, extent));
        return result;
    }

    /**
     * Colour of a block for read/write conflict sequencing. Blocks sharing a
     * colour never read each other's write region; lower colours run first.
     */
    public int conflictLevel(Block block) {
        long[] position = block.gridPosition();
        int level = 0;
        for (int d = 0; d < position.length; d++) {
            level = (int) (level * conflictStride[d] + position[d] % conflictStride[d]);
        }
        return level;
    }

    @Override
    public String toString() {
        return "BlockGrid{task='" + taskId + "', total=" + totalRoi
                + ", blockShape=" + Arrays.toString(blockShape)
                + ", grid=" + Arrays.toString(gridShape)
                + ", blocks=" + blocks.size() + '}';
    }
}
