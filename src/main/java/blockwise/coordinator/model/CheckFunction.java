package blockwise.coordinator.model;

/**
 * Tells whether a block's output already exists, so the block can be
 * skipped. An exception is treated as "not done".
 */
@FunctionalInterface
public interface CheckFunction {

    boolean isDone(Block block) throws Exception;
}
