package blockwise.coordinator.error;

/**
 * Invalid total ROI, block shape or context for partitioning.
 */
public class PartitionException extends BlockwiseException {

    public PartitionException(String message) {
        super(message);
    }
}
