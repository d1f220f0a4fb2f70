package blockwise.coordinator.scheduler;

import blockwise.coordinator.graph.DependencyGraph;
import blockwise.coordinator.model.Block;
import blockwise.coordinator.model.BlockKey;
import blockwise.coordinator.model.BlockStatus;
import blockwise.coordinator.model.ExecutionSummary;
import blockwise.coordinator.model.Roi;
import blockwise.coordinator.model.Task;
import blockwise.coordinator.model.TaskConfig;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the block state machine directly, one transition at a time.
 */
class BlockSchedulerTest {

    private static Task task(String id, long length, int workers, int retries, String... requires) {
        return Task.builder()
                .id(id)
                .totalRoi(Roi.of(0, length))
                .config(TaskConfig.builder().blockShape(10).numWorkers(workers).maxRetries(retries).build())
                .processFunction(block -> {
                })
                .requires(requires)
                .build();
    }

    private static BlockScheduler scheduler(Task... tasks) {
        return new BlockScheduler(new DependencyGraph(List.of(tasks)));
    }

    private static Block acquire(BlockScheduler scheduler) {
        return scheduler.acquireBlock().orElseThrow(() -> new AssertionError("expected a ready block"));
    }

    private static void succeed(BlockScheduler scheduler, Block block) {
        scheduler.markRunning(block.key());
        assertEquals(BlockStatus.SUCCESS, scheduler.release(block.key(), BlockOutcome.success()));
    }

    @Test
    void handsOutLowestReadyBlockFirst() {
        BlockScheduler scheduler = scheduler(task("t", 50, 5, 0));

        List<Long> order = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            order.add(acquire(scheduler).blockId());
        }

        assertEquals(List.of(0L, 1L, 2L, 3L, 4L), order);
        assertEquals(BlockStatus.CLAIMED, scheduler.status(new BlockKey("t", 0)));
        assertEquals(5, scheduler.activeCount());
    }

    @Test
    void respectsPerTaskWorkerLimit() {
        BlockScheduler scheduler = scheduler(task("t", 50, 2, 0));

        Block first = acquire(scheduler);
        acquire(scheduler);

        assertTrue(scheduler.acquireBlock().isEmpty());
        assertTrue(scheduler.hasReady());

        succeed(scheduler, first);
        assertEquals(2, acquire(scheduler).blockId());
    }

    @Test
    void servesIndependentTasksRoundRobin() {
        BlockScheduler scheduler = scheduler(task("a", 30, 3, 0), task("b", 30, 3, 0));

        List<String> order = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            Block block = acquire(scheduler);
            order.add(block.key().toString());
        }

        assertEquals(List.of("a#0", "b#0", "a#1", "b#1"), order);
    }

    @Test
    void downstreamBecomesReadyWhenUpstreamSucceeds() {
        BlockScheduler scheduler = scheduler(task("a", 20, 2, 0), task("b", 20, 2, 0, "a"));

        assertEquals(BlockStatus.PENDING, scheduler.status(new BlockKey("b", 0)));
        Block a0 = acquire(scheduler);
        Block a1 = acquire(scheduler);
        assertTrue(scheduler.acquireBlock().isEmpty());

        succeed(scheduler, a1);
        assertEquals(BlockStatus.READY, scheduler.status(new BlockKey("b", 1)));
        assertEquals(BlockStatus.PENDING, scheduler.status(new BlockKey("b", 0)));

        Optional<Block> b1 = scheduler.acquireBlock("b");
        assertEquals(new BlockKey("b", 1), b1.orElseThrow().key());
        succeed(scheduler, a0);
        succeed(scheduler, b1.get());
        succeed(scheduler, acquire(scheduler));

        assertTrue(scheduler.isDone());
        assertTrue(scheduler.summary("a").succeeded());
        assertTrue(scheduler.summary("b").succeeded());
    }

    @Test
    void retriesFailedBlockUntilBudgetIsSpent() {
        BlockScheduler scheduler = scheduler(task("t", 10, 1, 2));
        BlockKey key = new BlockKey("t", 0);

        for (int attempt = 1; attempt <= 2; attempt++) {
            Block block = acquire(scheduler);
            scheduler.markRunning(key);
            assertEquals(BlockStatus.READY, scheduler.release(key, BlockOutcome.failed(new RuntimeException("flaky"))));
            assertEquals(attempt, scheduler.attempts(key));
            assertEquals(key, block.key());
        }

        acquire(scheduler);
        scheduler.markRunning(key);
        assertEquals(BlockStatus.FAILED, scheduler.release(key, BlockOutcome.failed(new RuntimeException("still"))));

        ExecutionSummary summary = scheduler.summary("t");
        assertEquals(1, summary.failed());
        assertEquals(2, summary.retried());
        assertEquals(3, summary.failures().get(0).attempts());
        assertTrue(scheduler.isDone());
    }

    @Test
    void retryThenSuccessCompletesTheBlock() {
        BlockScheduler scheduler = scheduler(task("t", 10, 1, 1));
        BlockKey key = new BlockKey("t", 0);

        acquire(scheduler);
        scheduler.markRunning(key);
        scheduler.release(key, BlockOutcome.failed(new IllegalStateException("once")));
        succeed(scheduler, acquire(scheduler));

        ExecutionSummary summary = scheduler.summary("t");
        assertEquals(1, summary.completed());
        assertEquals(0, summary.failed());
        assertEquals(1, summary.retried());
    }

    @Test
    void permanentFailureOrphansDownstreamTransitively() {
        BlockScheduler scheduler = scheduler(
                task("a", 20, 2, 0),
                task("b", 20, 2, 0, "a"),
                task("c", 20, 2, 0, "b"));

        Block a0 = acquire(scheduler);
        Block a1 = acquire(scheduler);
        scheduler.markRunning(a0.key());
        assertEquals(BlockStatus.FAILED, scheduler.release(a0.key(), BlockOutcome.failed(new RuntimeException("boom"))));

        assertEquals(BlockStatus.ORPHANED, scheduler.status(new BlockKey("b", 0)));
        assertEquals(BlockStatus.ORPHANED, scheduler.status(new BlockKey("c", 0)));
        assertEquals(BlockStatus.PENDING, scheduler.status(new BlockKey("b", 1)));
        assertEquals(new BlockKey("a", 0),
                scheduler.orphanReason(new BlockKey("c", 0)).orElseThrow().failedUpstream());

        succeed(scheduler, a1);
        succeed(scheduler, acquire(scheduler));
        succeed(scheduler, acquire(scheduler));

        assertTrue(scheduler.isDone());
        assertEquals(1, scheduler.summary("a").failed());
        assertEquals(1, scheduler.summary("b").orphaned());
        assertEquals(1, scheduler.summary("b").completed());
        assertEquals(1, scheduler.summary("c").orphaned());
        assertTrue(scheduler.orphanReason(new BlockKey("b", 1)).isEmpty());
    }

    @Test
    void skippedBlocksCountAsCompletedAndReleaseDownstream() {
        BlockScheduler scheduler = scheduler(task("a", 10, 1, 0), task("b", 10, 1, 0, "a"));

        Block a0 = acquire(scheduler);
        assertEquals(BlockStatus.SUCCESS, scheduler.release(a0.key(), BlockOutcome.skipped()));

        assertEquals(BlockStatus.READY, scheduler.status(new BlockKey("b", 0)));
        assertEquals(1, scheduler.summary("a").skipped());
        assertEquals(1, scheduler.summary("a").completed());
    }

    @Test
    void cancelStopsEverythingThatHasNotStarted() {
        BlockScheduler scheduler = scheduler(task("a", 30, 1, 0), task("b", 30, 1, 0, "a"));

        Block running = acquire(scheduler);

        assertEquals(5, scheduler.cancel());
        assertTrue(scheduler.acquireBlock().isEmpty());
        assertFalse(scheduler.isDone());

        succeed(scheduler, running);

        assertTrue(scheduler.isDone());
        ExecutionSummary a = scheduler.summary("a");
        ExecutionSummary b = scheduler.summary("b");
        assertEquals(1, a.completed());
        assertEquals(2, a.cancelled());
        assertEquals(3, b.cancelled());
        assertEquals(0, a.ready() + a.pending() + b.ready() + b.pending());
    }

    @Test
    void cancelledOutcomeOnlyCountsAfterCancel() {
        BlockScheduler scheduler = scheduler(task("t", 20, 2, 3));
        Block first = acquire(scheduler);
        Block second = acquire(scheduler);

        // without a cancel request an interrupted block is just a failed attempt
        assertEquals(BlockStatus.READY, scheduler.release(first.key(), BlockOutcome.cancelled()));

        scheduler.cancel();
        assertEquals(BlockStatus.CANCELLED, scheduler.release(second.key(), BlockOutcome.cancelled()));
        assertTrue(scheduler.isDone());
        assertEquals(2, scheduler.summary("t").cancelled());
    }

    @Test
    void rejectsIllegalTransitions() {
        BlockScheduler scheduler = scheduler(task("t", 20, 1, 0));
        BlockKey key = new BlockKey("t", 0);

        assertThrows(IllegalStateException.class, () -> scheduler.markRunning(key));
        assertThrows(IllegalStateException.class, () -> scheduler.release(key, BlockOutcome.success()));

        acquire(scheduler);
        assertThrows(IllegalStateException.class, () -> scheduler.release(key, BlockOutcome.success()));
        assertThrows(IllegalArgumentException.class, () -> scheduler.status(new BlockKey("t", 99)));
        assertThrows(IllegalArgumentException.class, () -> scheduler.status(new BlockKey("nope", 0)));
    }

    @Test
    void countersStayConsistentThroughoutARun() {
        BlockScheduler scheduler = scheduler(task("a", 50, 2, 0), task("b", 50, 2, 0, "a"));

        while (!scheduler.isDone()) {
            Block block = acquire(scheduler);
            if (block.key().equals(new BlockKey("a", 2))) {
                scheduler.markRunning(block.key());
                scheduler.release(block.key(), BlockOutcome.failed(new RuntimeException("bad")));
            } else {
                succeed(scheduler, block);
            }
            for (ExecutionSummary s : scheduler.summaries().values()) {
                assertEquals(s.totalBlocks(), s.pending() + s.ready() + s.processing()
                        + s.completed() + s.failed() + s.orphaned() + s.cancelled());
                assertTrue(s.pending() >= 0);
            }
        }

        assertEquals(4, scheduler.summary("a").completed());
        assertEquals(1, scheduler.summary("b").orphaned());
        assertEquals(4, scheduler.summary("b").completed());
    }
}
