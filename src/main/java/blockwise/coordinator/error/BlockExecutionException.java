package blockwise.coordinator.error;

import blockwise.coordinator.model.BlockKey;

/**
 * A process function raised for a block. Recorded in the task summary,
 * never thrown out of the dispatcher.
 */
public class BlockExecutionException extends BlockwiseException {

    private final BlockKey block;

    public BlockExecutionException(BlockKey block, Throwable cause) {
        super("Block " + block + " failed: " + describe(cause), cause);
        this.block = block;
    }

    public BlockKey block() {
        return block;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown fault";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
