package blockwise.coordinator.scheduler;

import blockwise.coordinator.core.ProgressBus;
import blockwise.coordinator.graph.DependencyGraph;
import blockwise.coordinator.model.Block;
import blockwise.coordinator.model.BlockKey;
import blockwise.coordinator.model.Roi;
import blockwise.coordinator.model.RunResult;
import blockwise.coordinator.model.Task;
import blockwise.coordinator.model.TaskConfig;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives a dispatcher thread by hand, acting as the workers.
 */
class DispatcherTest {

    private Thread thread;

    @AfterEach
    void stop() throws InterruptedException {
        if (thread != null) {
            thread.interrupt();
            thread.join(5000);
        }
    }

    private static Task task(String id, long length, String... requires) {
        return Task.builder()
                .id(id)
                .totalRoi(Roi.of(0, length))
                .config(TaskConfig.builder().blockShape(10).numWorkers(2).build())
                .processFunction(block -> {
                })
                .requires(requires)
                .build();
    }

    private Dispatcher start(Task... tasks) {
        Dispatcher dispatcher = new Dispatcher(new BlockScheduler(new DependencyGraph(List.of(tasks))),
                new ProgressBus());
        thread = new Thread(dispatcher);
        thread.start();
        return dispatcher;
    }

    private static void finish(Dispatcher dispatcher, Block block) {
        dispatcher.started("w", block.key());
        dispatcher.report("w", block.key(), BlockOutcome.success());
    }

    @Test
    void answersEmptyOnceEveryBlockIsDone() throws Exception {
        Dispatcher dispatcher = start(task("t", 20));

        Block first = dispatcher.claim("w").orElseThrow();
        finish(dispatcher, first);
        Block second = dispatcher.claim("w").orElseThrow();
        finish(dispatcher, second);

        RunResult result = dispatcher.result().get(10, TimeUnit.SECONDS);
        assertTrue(result.succeeded());
        assertEquals(List.of(0L, 1L), List.of(first.blockId(), second.blockId()));
        assertEquals(Optional.empty(), dispatcher.claim("w"));
        assertTrue(dispatcher.isClosed());
    }

    @Test
    void parkedClaimIsServedWhenUpstreamFinishes() throws Exception {
        Dispatcher dispatcher = start(task("a", 10), task("b", 10, "a"));

        Block a0 = dispatcher.claim("w1").orElseThrow();
        CompletableFuture<Optional<Block>> waiting = CompletableFuture.supplyAsync(() -> {
            try {
                return dispatcher.claim("w2");
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });

        Thread.sleep(100);
        assertFalse(waiting.isDone());

        finish(dispatcher, a0);
        Block b0 = waiting.get(10, TimeUnit.SECONDS).orElseThrow();
        assertEquals(new BlockKey("b", 0), b0.key());

        finish(dispatcher, b0);
        assertTrue(dispatcher.result().get(10, TimeUnit.SECONDS).succeeded());
    }

    @Test
    void cancelWithNothingRunningEndsTheRun() throws Exception {
        Dispatcher dispatcher = start(task("a", 50), task("b", 50, "a"));

        dispatcher.requestCancel();
        RunResult result = dispatcher.result().get(10, TimeUnit.SECONDS);

        assertTrue(dispatcher.isCancelRequested());
        assertTrue(result.wasCancelled());
        assertEquals(10, result.totalCancelled());
        assertEquals(Optional.empty(), dispatcher.claim("late"));
    }

    @Test
    void interruptedOutcomeWithoutCancelIsAFailure() throws Exception {
        Dispatcher dispatcher = start(task("t", 10));

        Block block = dispatcher.claim("w").orElseThrow();
        dispatcher.started("w", block.key());
        dispatcher.report("w", block.key(), BlockOutcome.cancelled());

        RunResult result = dispatcher.result().get(10, TimeUnit.SECONDS);
        assertEquals(1, result.totalFailed());
        assertFalse(result.wasCancelled());
    }

    @Test
    void protocolViolationAbortsTheRun() {
        Dispatcher dispatcher = start(task("t", 10));

        // success for a block nobody claimed
        dispatcher.report("w", new BlockKey("t", 0), BlockOutcome.success());

        Exception e = assertThrows(Exception.class, () -> dispatcher.result().get(10, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertTrue(dispatcher.isClosed());
    }
}
