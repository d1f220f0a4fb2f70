package blockwise.coordinator.partition;

import blockwise.coordinator.error.PartitionException;
import blockwise.coordinator.model.Block;
import blockwise.coordinator.model.GridCursor;
import blockwise.coordinator.model.Roi;
import blockwise.coordinator.model.Task;
import blockwise.coordinator.model.TaskConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Cuts a task's total region into blocks.
 * <p>
 * Write regions tile the total region without overlap (boundary blocks are
 * clipped). Read regions are the write regions grown by the task's context
 * and clipped to the total region.
 */
public final class BlockPartitioner {

    private static final Logger log = LoggerFactory.getLogger(BlockPartitioner.class);

    /** Upper bound on blocks per task; block ids index a list. */
    static final long MAX_BLOCKS = Integer.MAX_VALUE - 8;

    private BlockPartitioner() {
    }

    public static BlockGrid partition(Task task) {
        return partition(task.id(), task.totalRoi(), task.config());
    }

    public static BlockGrid partition(String taskId, Roi totalRoi, TaskConfig config) {
        long[] blockShape = config.blockShape();
        long[] context = config.context();

        if (totalRoi.isEmpty()) {
            throw new PartitionException("task " + taskId + " has an empty total roi " + totalRoi);
        }
        if (blockShape.length != totalRoi.dims()) {
            throw new PartitionException("task " + taskId + ": block shape " + Arrays.toString(blockShape)
                    + " does not match total roi " + totalRoi);
        }

        long[] gridShape = totalRoi.gridShape(blockShape);
        long count = 1;
        for (long g : gridShape) {
            count *= g;
            if (count > MAX_BLOCKS) {
                throw new PartitionException("task " + taskId + " would have more than " + MAX_BLOCKS + " blocks");
            }
        }

        List<Block> blocks = new ArrayList<>((int) count);
        long[] position = new long[gridShape.length];
        long blockId = 0;
        do {
            Roi write = totalRoi.tileAt(position, blockShape);
            Roi read = write.grow(context).intersect(totalRoi);
            blocks.add(new Block(taskId, blockId++, position, read, write));
        } while (GridCursor.advance(position, gridShape));

        log.debug("Partitioned task {} into {} blocks (grid {}, block shape {}, context {})",
                taskId, blocks.size(), Arrays.toString(gridShape), Arrays.toString(blockShape),
                Arrays.toString(context));

        return new BlockGrid(taskId, totalRoi, blockShape, context, gridShape,
                conflictStride(blockShape, context), blocks);
    }

    /**
     * Per dimension, the smallest colour period such that two blocks of the
     * same colour are far enough apart that neither reads the other's write
     * region.
     */
    static long[] conflictStride(long[] blockShape, long[] context) {
        long[] stride = new long[blockShape.length];
        for (int d = 0; d < stride.length; d++) {
            stride[d] = (context[d] + blockShape[d] - 1) / blockShape[d] + 1;
        }
        return stride;
    }
}
