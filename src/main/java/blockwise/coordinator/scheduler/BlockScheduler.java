package blockwise.coordinator.scheduler;

import blockwise.coordinator.error.BlockExecutionException;
import blockwise.coordinator.error.OrphanedBlockException;
import blockwise.coordinator.graph.DependencyGraph;
import blockwise.coordinator.model.Block;
import blockwise.coordinator.model.BlockFailure;
import blockwise.coordinator.model.BlockKey;
import blockwise.coordinator.model.BlockStatus;
import blockwise.coordinator.model.ExecutionSummary;
import blockwise.coordinator.model.Task;
import blockwise.coordinator.model.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Block state machine for one run.
 * <p>
 * {@code PENDING -> READY -> CLAIMED -> RUNNING -> SUCCESS | FAILED}, plus
 * {@code ORPHANED} for blocks behind a permanent failure and
 * {@code CANCELLED} for blocks stopped by a cancel request.
 * <p>
 * Picking order: tasks are served round-robin in topological order,
 * starting after the task served last and skipping tasks that already hold
 * {@code numWorkers} blocks; within a task the lowest ready block id wins.
 * <p>
 * Not thread-safe. The dispatcher thread is the only caller.
 */
public final class BlockScheduler {

    private static final Logger log = LoggerFactory.getLogger(BlockScheduler.class);

    private final DependencyGraph graph;
    private final List<Task> tasks;
    private final Map<String, TaskBlocks> blocksByTask = new LinkedHashMap<>();
    private final Map<BlockKey, BlockKey> orphanedBy = new HashMap<>();

    private int lastServed = -1;
    private int terminal;
    private boolean cancelled;

    public BlockScheduler(DependencyGraph graph) {
        this.graph = graph;
        this.tasks = graph.tasks();

        for (Task task : tasks) {
            int n = graph.numBlocks(task.id());
            TaskBlocks tb = new TaskBlocks(task, n);
            for (int i = 0; i < n; i++) {
                tb.remainingUpstream[i] = graph.upstream(new BlockKey(task.id(), i)).size();
            }
            blocksByTask.put(task.id(), tb);
        }
        for (Block root : graph.roots()) {
            makeReady(blocksByTask.get(root.taskId()), root.blockId());
        }
    }

    public DependencyGraph graph() {
        return graph;
    }

    /**
     * Hand the next ready block to a worker, {@code READY -> CLAIMED}.
     *
     * @return empty when nothing is ready, every task with ready blocks is
     *         at its worker limit, or the run was cancelled
     */
    public Optional<Block> acquireBlock() {
        if (cancelled) {
            return Optional.empty();
        }
        int n = tasks.size();
        for (int i = 1; i <= n; i++) {
            int index = (lastServed + i) % n;
            Optional<Block> block = acquireFrom(blocksByTask.get(tasks.get(index).id()));
            if (block.isPresent()) {
                lastServed = index;
                return block;
            }
        }
        return Optional.empty();
    }

    /**
     * Hand the next ready block of one task to a worker.
     */
    public Optional<Block> acquireBlock(String taskId) {
        if (cancelled) {
            return Optional.empty();
        }
        return acquireFrom(taskBlocks(taskId));
    }

    private Optional<Block> acquireFrom(TaskBlocks tb) {
        if (tb.ready.isEmpty() || tb.state.processing() >= tb.task.numWorkers()) {
            return Optional.empty();
        }
        long blockId = tb.ready.poll();
        tb.status[(int) blockId] = BlockStatus.CLAIMED;
        tb.state.claimed();
        Block block = graph.grid(tb.task.id()).block(blockId);
        log.debug("Claimed block {}", block.key());
        return Optional.of(block);
    }

    /**
     * The worker has entered the process function, {@code CLAIMED -> RUNNING}.
     */
    public void markRunning(BlockKey key) {
        TaskBlocks tb = taskBlocks(key.taskId());
        BlockStatus current = tb.status[index(tb, key)];
        if (current != BlockStatus.CLAIMED) {
            throw new IllegalStateException("block " + key + " cannot start from " + current);
        }
        tb.status[(int) key.blockId()] = BlockStatus.RUNNING;
    }

    /**
     * Fold a worker's report into the block table.
     *
     * @return the block's status after the report
     */
    public BlockStatus release(BlockKey key, BlockOutcome outcome) {
        TaskBlocks tb = taskBlocks(key.taskId());
        int i = index(tb, key);
        BlockStatus current = tb.status[i];
        if (!current.isActive()) {
            throw new IllegalStateException("block " + key + " is not held by a worker (" + current + ")");
        }
        if (outcome.kind() == BlockOutcome.Kind.SUCCESS && current != BlockStatus.RUNNING) {
            throw new IllegalStateException("block " + key + " succeeded without running");
        }

        switch (outcome.kind()) {
            case SUCCESS, SKIPPED -> succeed(tb, i, outcome.kind() == BlockOutcome.Kind.SKIPPED);
            case FAILED -> fail(tb, i, outcome.error());
            case CANCELLED -> {
                if (cancelled) {
                    tb.status[i] = BlockStatus.CANCELLED;
                    tb.state.cancelledWhileProcessing();
                    terminal++;
                } else {
                    fail(tb, i, outcome.error());
                }
            }
        }
        return tb.status[i];
    }

    private void succeed(TaskBlocks tb, int i, boolean skipped) {
        tb.status[i] = BlockStatus.SUCCESS;
        tb.state.completed(skipped);
        terminal++;

        BlockKey key = new BlockKey(tb.task.id(), i);
        if (skipped) {
            log.debug("Skipped block {}, already done", key);
        } else {
            log.debug("Completed block {}", key);
        }
        for (BlockKey down : graph.downstream(key)) {
            TaskBlocks dtb = blocksByTask.get(down.taskId());
            int di = (int) down.blockId();
            if (--dtb.remainingUpstream[di] == 0 && dtb.status[di] == BlockStatus.PENDING) {
                makeReady(dtb, di);
            }
        }
    }

    private void fail(TaskBlocks tb, int i, Throwable error) {
        BlockKey key = new BlockKey(tb.task.id(), i);
        tb.attempts[i]++;

        if (!cancelled && tb.attempts[i] <= tb.task.maxRetries()) {
            tb.status[i] = BlockStatus.READY;
            tb.ready.add((long) i);
            tb.state.requeued();
            log.warn("Block {} failed (attempt {} of {}), retrying: {}",
                    key, tb.attempts[i], tb.task.maxRetries() + 1, describe(error));
            return;
        }

        BlockExecutionException fault = new BlockExecutionException(key, error);
        tb.status[i] = BlockStatus.FAILED;
        tb.state.failed(new BlockFailure(key, tb.attempts[i], fault.getMessage()));
        terminal++;
        log.warn("Block {} failed permanently after {} attempt(s): {}", key, tb.attempts[i], describe(error));

        int orphans = orphanDownstream(key);
        if (orphans > 0) {
            log.warn("Block {} failure orphaned {} downstream block(s)", key, orphans);
        }
    }

    /**
     * Mark everything reachable downstream of a failed block as orphaned.
     */
    private int orphanDownstream(BlockKey failed) {
        int count = 0;
        Deque<BlockKey> queue = new ArrayDeque<>(graph.downstream(failed));
        while (!queue.isEmpty()) {
            BlockKey down = queue.poll();
            TaskBlocks dtb = blocksByTask.get(down.taskId());
            int di = (int) down.blockId();
            BlockStatus status = dtb.status[di];
            if (status.isTerminal()) {
                continue;
            }
            if (status != BlockStatus.PENDING) {
                // a block with a failed upstream can never have been released
                throw new IllegalStateException("block " + down + " is " + status + " behind failed block " + failed);
            }
            dtb.status[di] = BlockStatus.ORPHANED;
            dtb.state.orphaned(1);
            orphanedBy.put(down, failed);
            terminal++;
            count++;
            queue.addAll(graph.downstream(down));
        }
        return count;
    }

    /**
     * Stop scheduling: every pending or ready block becomes cancelled.
     * Claimed and running blocks are left to their workers.
     *
     * @return number of blocks cancelled
     */
    public int cancel() {
        if (cancelled) {
            return 0;
        }
        cancelled = true;
        int count = 0;
        for (TaskBlocks tb : blocksByTask.values()) {
            int fromReady = 0;
            int fromPending = 0;
            for (int i = 0; i < tb.status.length; i++) {
                if (tb.status[i] == BlockStatus.READY) {
                    tb.status[i] = BlockStatus.CANCELLED;
                    fromReady++;
                } else if (tb.status[i] == BlockStatus.PENDING) {
                    tb.status[i] = BlockStatus.CANCELLED;
                    fromPending++;
                }
            }
            tb.ready.clear();
            tb.state.cancelledWhileReady(fromReady);
            tb.state.cancelledWhilePending(fromPending);
            count += fromReady + fromPending;
        }
        terminal += count;
        log.info("Cancelled {} block(s) that had not started", count);
        return count;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /** Every block of every task is terminal. */
    public boolean isDone() {
        return terminal == graph.totalBlocks();
    }

    /** Whether any block is ready right now, ignoring worker limits. */
    public boolean hasReady() {
        return blocksByTask.values().stream().anyMatch(tb -> !tb.ready.isEmpty());
    }

    public int activeCount() {
        return blocksByTask.values().stream().mapToInt(tb -> tb.state.processing()).sum();
    }

    public BlockStatus status(BlockKey key) {
        TaskBlocks tb = taskBlocks(key.taskId());
        return tb.status[index(tb, key)];
    }

    /** Attempts made so far (failed attempts included). */
    public int attempts(BlockKey key) {
        TaskBlocks tb = taskBlocks(key.taskId());
        return tb.attempts[index(tb, key)];
    }

    /** Why a block was orphaned, if it was. */
    public Optional<OrphanedBlockException> orphanReason(BlockKey key) {
        BlockKey cause = orphanedBy.get(key);
        return cause == null ? Optional.empty() : Optional.of(new OrphanedBlockException(key, cause));
    }

    public ExecutionSummary summary(String taskId) {
        return taskBlocks(taskId).state.snapshot();
    }

    /** Snapshots of every task, in scheduling order. */
    public Map<String, ExecutionSummary> summaries() {
        Map<String, ExecutionSummary> result = new LinkedHashMap<>();
        for (TaskBlocks tb : blocksByTask.values()) {
            result.put(tb.task.id(), tb.state.snapshot());
        }
        return result;
    }

    private void makeReady(TaskBlocks tb, long blockId) {
        tb.status[(int) blockId] = BlockStatus.READY;
        tb.ready.add(blockId);
        tb.state.addReady(1);
    }

    private TaskBlocks taskBlocks(String taskId) {
        TaskBlocks tb = blocksByTask.get(taskId);
        if (tb == null) {
            throw new IllegalArgumentException("unknown task: " + taskId);
        }
        return tb;
    }

    private static int index(TaskBlocks tb, BlockKey key) {
        if (key.blockId() < 0 || key.blockId() >= tb.status.length) {
            throw new IllegalArgumentException("task " + key.taskId() + " has no block " + key.blockId());
        }
        return (int) key.blockId();
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown fault";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getName();
    }

    /** Per-task block table. */
    private static final class TaskBlocks {
        final Task task;
        final TaskState state;
        final BlockStatus[] status;
        final int[] remainingUpstream;
        final int[] attempts;
        final PriorityQueue<Long> ready = new PriorityQueue<>();

        TaskBlocks(Task task, int blockCount) {
            this.task = task;
            this.state = new TaskState(task.id(), blockCount);
            this.status = new BlockStatus[blockCount];
            this.remainingUpstream = new int[blockCount];
            this.attempts = new int[blockCount];
            Arrays.fill(status, BlockStatus.PENDING);
        }
    }
}
