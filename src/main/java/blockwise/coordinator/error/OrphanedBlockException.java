package blockwise.coordinator.error;

import blockwise.coordinator.model.BlockKey;

/**
 * A block can never run because an upstream block failed permanently.
 */
public class OrphanedBlockException extends BlockwiseException {

    private final BlockKey block;
    private final BlockKey failedUpstream;

    public OrphanedBlockException(BlockKey block, BlockKey failedUpstream) {
        super("Block " + block + " orphaned by failed block " + failedUpstream);
        this.block = block;
        this.failedUpstream = failedUpstream;
    }

    public BlockKey block() {
        return block;
    }

    public BlockKey failedUpstream() {
        return failedUpstream;
    }
}
