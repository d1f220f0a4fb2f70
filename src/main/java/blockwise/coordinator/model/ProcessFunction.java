package blockwise.coordinator.model;

/**
 * Caller-supplied work for one block. Returning normally means success,
 * throwing means the block faulted. Implementations own any array storage
 * they read from or write to and should be idempotent, since a faulted
 * block may be processed again.
 */
@FunctionalInterface
public interface ProcessFunction {

    void process(Block block) throws Exception;
}
