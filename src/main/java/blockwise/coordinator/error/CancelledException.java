package blockwise.coordinator.error;

/**
 * The run was stopped before the block (or the caller's wait) completed.
 */
public class CancelledException extends BlockwiseException {

    public CancelledException(String message) {
        super(message);
    }

    public CancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
