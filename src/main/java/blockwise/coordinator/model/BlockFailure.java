package blockwise.coordinator.model;

/**
 * A block that ended in {@link BlockStatus#FAILED}, with the fault that
 * ended its last attempt.
 */
public record BlockFailure(BlockKey block, int attempts, String error) {

    @Override
    public String toString() {
        return block + " after " + attempts + " attempt(s): " + error;
    }
}
