package blockwise.coordinator.worker;

import blockwise.coordinator.model.Block;
import blockwise.coordinator.model.CheckFunction;
import blockwise.coordinator.model.Task;
import blockwise.coordinator.repository.BlockDoneRepository;
import blockwise.coordinator.scheduler.BlockOutcome;
import blockwise.coordinator.scheduler.WorkerChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.Function;

/**
 * A single worker thread.
 * Loops: claim -> check -> process -> report, until the dispatcher has no
 * more work. Stops cleanly on Thread.interrupt().
 */
public final class BlockWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(BlockWorker.class);

    private final String workerId;
    private final WorkerChannel channel;
    private final Function<String, Task> tasks;
    private final BlockDoneRepository doneRepository; // optional

    private int processed;

    public BlockWorker(String workerId, WorkerChannel channel, Function<String, Task> tasks,
            BlockDoneRepository doneRepository) {
        this.workerId = workerId;
        this.channel = channel;
        this.tasks = tasks;
        this.doneRepository = doneRepository;
    }

    @Override
    public void run() {
        Thread.currentThread().setName("blockwise-" + workerId);
        log.debug("Worker {} started", workerId);

        try {
            while (!Thread.currentThread().isInterrupted()) {
                Optional<Block> claimed = channel.claim(workerId);
                if (claimed.isEmpty()) {
                    break;
                }
                Block block = claimed.get();
                channel.report(workerId, block.key(), execute(block));
                processed++;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("Worker {} stopped on unexpected error", workerId, e);
            throw e;
        }

        log.debug("Worker {} stopped after {} block(s)", workerId, processed);
    }

    /**
     * Run one claimed block. Never throws: every fault becomes an outcome.
     */
    BlockOutcome execute(Block block) {
        Task task = tasks.apply(block.taskId());

        if (alreadyDone(task, block)) {
            return BlockOutcome.skipped();
        }

        channel.started(workerId, block.key());
        try {
            task.processFunction().process(block);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return interrupted(block, e);
        } catch (Throwable e) {
            // Errors from user code count as block faults; the block is still reported
            if (Thread.currentThread().isInterrupted() && channel.isCancelRequested()) {
                return BlockOutcome.cancelled();
            }
            log.debug("Worker {}: block {} raised", workerId, block.key(), e);
            return BlockOutcome.failed(e);
        }

        if (doneRepository != null) {
            try {
                doneRepository.markDone(block);
            } catch (RuntimeException e) {
                log.warn("Worker {}: block {} finished but could not be recorded: {}",
                        workerId, block.key(), e.getMessage());
            }
        }
        return BlockOutcome.success();
    }

    private BlockOutcome interrupted(Block block, InterruptedException e) {
        if (channel.isCancelRequested()) {
            log.debug("Worker {}: block {} interrupted by cancel", workerId, block.key());
            return BlockOutcome.cancelled();
        }
        return BlockOutcome.failed(e);
    }

    private boolean alreadyDone(Task task, Block block) {
        try {
            if (doneRepository != null && doneRepository.isDone(block)) {
                return true;
            }
        } catch (RuntimeException e) {
            log.error("Completion store lookup failed for block {}: {}", block.key(), e.getMessage());
        }

        CheckFunction check = task.checkFunction();
        if (check == null) {
            return false;
        }
        try {
            return check.isDone(block);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Throwable e) {
            // check can fail intermittently; fall back to processing the block
            log.error("Check function failed for block {} of task {}: {}", block.key(), task.id(), e.getMessage());
            return false;
        }
    }

    public String workerId() {
        return workerId;
    }
}
