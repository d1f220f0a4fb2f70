package blockwise.coordinator.model;

import blockwise.coordinator.error.RunFailedException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskStateTest {

    @Test
    void pendingIsDerivedFromOtherCounters() {
        TaskState state = new TaskState("t", 10);
        assertEquals(10, state.pending());

        state.addReady(3);
        state.claimed();
        state.completed(false);
        state.claimed();

        assertEquals(1, state.ready());
        assertEquals(1, state.processing());
        assertEquals(1, state.completed());
        assertEquals(7, state.pending());
        assertFalse(state.isDone());
    }

    @Test
    void skippedCountsAsCompleted() {
        TaskState state = new TaskState("t", 1);
        state.addReady(1);
        state.claimed();
        state.completed(true);

        ExecutionSummary summary = state.snapshot();
        assertEquals(1, summary.completed());
        assertEquals(1, summary.skipped());
        assertTrue(summary.succeeded());
        assertEquals(100, summary.progressPercent());
    }

    @Test
    void failureAndOrphansMakeSummaryUnsuccessful() {
        TaskState state = new TaskState("t", 3);
        state.addReady(1);
        state.claimed();
        state.failed(new BlockFailure(new BlockKey("t", 0), 1, "boom"));
        state.orphaned(2);

        ExecutionSummary summary = state.snapshot();
        assertTrue(summary.isDone());
        assertFalse(summary.succeeded());
        assertEquals(1, summary.failures().size());
        assertEquals(0, summary.pending());
    }

    @Test
    void runResultAggregatesSummaries() {
        TaskState ok = new TaskState("a", 1);
        ok.addReady(1);
        ok.claimed();
        ok.completed(false);
        TaskState cancelled = new TaskState("b", 2);
        cancelled.cancelledWhilePending(2);

        RunResult result = new RunResult(Map.of("a", ok.snapshot(), "b", cancelled.snapshot()),
                Duration.ofMillis(5), true);

        assertFalse(result.succeeded());
        assertEquals(3, result.totalBlocks());
        assertEquals(2, result.totalCancelled());
        assertEquals(1, result.exitCode());
        assertTrue(result.wasCancelled());
        RunFailedException e = assertThrows(RunFailedException.class, result::throwIfFailed);
        assertSame(result, e.result());
    }
}
