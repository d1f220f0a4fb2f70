package blockwise.coordinator.scheduler;

import blockwise.coordinator.model.Block;
import blockwise.coordinator.model.BlockKey;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Messages consumed by the dispatcher thread.
 */
interface DispatcherMessage {

    record Claim(String workerId, CompletableFuture<Optional<Block>> reply) implements DispatcherMessage {
    }

    record Started(String workerId, BlockKey block) implements DispatcherMessage {
    }

    record Outcome(String workerId, BlockKey block, BlockOutcome outcome) implements DispatcherMessage {
    }

    record Cancel() implements DispatcherMessage {
    }
}
