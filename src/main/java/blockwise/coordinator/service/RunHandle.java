package blockwise.coordinator.service;

import blockwise.coordinator.error.BlockwiseException;
import blockwise.coordinator.error.CancelledException;
import blockwise.coordinator.model.ExecutionSummary;
import blockwise.coordinator.model.RunResult;
import blockwise.coordinator.scheduler.Dispatcher;
import blockwise.coordinator.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A run in progress. Lets the caller watch progress, cancel, and wait for
 * the result.
 */
public final class RunHandle {

    private static final Logger log = LoggerFactory.getLogger(RunHandle.class);

    private final String runId;
    private final Dispatcher dispatcher;
    private final WorkerPool pool;

    RunHandle(String runId, Dispatcher dispatcher, WorkerPool pool) {
        this.runId = runId;
        this.dispatcher = dispatcher;
        this.pool = pool;
    }

    public String runId() {
        return runId;
    }

    /**
     * Stop starting new blocks. Running blocks finish normally; every
     * pending or ready block becomes cancelled.
     */
    public void cancel() {
        cancel(false);
    }

    /**
     * @param hardKill also interrupt workers inside a process function
     */
    public void cancel(boolean hardKill) {
        log.info("Cancel requested for run {} (hardKill={})", runId, hardKill);
        dispatcher.requestCancel();
        if (hardKill) {
            pool.interruptAll();
        }
    }

    public boolean isDone() {
        return dispatcher.result().isDone();
    }

    /** Latest counters of every task. */
    public Map<String, ExecutionSummary> progress() {
        return dispatcher.latestProgress();
    }

    /**
     * Wait for the run to finish.
     *
     * @throws CancelledException  if the waiting thread is interrupted
     * @throws BlockwiseException  if the dispatcher itself failed
     */
    public RunResult await() {
        try {
            return dispatcher.result().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancelledException("interrupted while waiting for run " + runId, e);
        } catch (ExecutionException e) {
            throw unwrap(e);
        }
    }

    /**
     * Wait at most {@code timeout}.
     *
     * @return the result, or empty if the run is still going
     */
    public Optional<RunResult> await(Duration timeout) {
        try {
            return Optional.of(dispatcher.result().get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancelledException("interrupted while waiting for run " + runId, e);
        } catch (ExecutionException e) {
            throw unwrap(e);
        }
    }

    private BlockwiseException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof BlockwiseException be) {
            return be;
        }
        return new BlockwiseException("run " + runId + " aborted: " + cause.getMessage(), cause);
    }
}
