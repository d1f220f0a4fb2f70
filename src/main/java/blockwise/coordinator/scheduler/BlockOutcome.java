package blockwise.coordinator.scheduler;

/**
 * What a worker reports back for a claimed block.
 */
public record BlockOutcome(Kind kind, Throwable error) {

    public enum Kind {
        /** Process function returned normally */
        SUCCESS,
        /** Check function found the block already done */
        SKIPPED,
        /** Process function threw */
        FAILED,
        /** Interrupted by a hard cancel */
        CANCELLED
    }

    public static BlockOutcome success() {
        return new BlockOutcome(Kind.SUCCESS, null);
    }

    public static BlockOutcome skipped() {
        return new BlockOutcome(Kind.SKIPPED, null);
    }

    public static BlockOutcome failed(Throwable error) {
        return new BlockOutcome(Kind.FAILED, error);
    }

    public static BlockOutcome cancelled() {
        return new BlockOutcome(Kind.CANCELLED, null);
    }
}
