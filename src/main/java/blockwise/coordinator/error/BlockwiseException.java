package blockwise.coordinator.error;

/**
 * Base class for all errors raised by the blockwise coordinator.
 */
public class BlockwiseException extends RuntimeException {

    public BlockwiseException(String message) {
        super(message);
    }

    public BlockwiseException(String message, Throwable cause) {
        super(message, cause);
    }
}
