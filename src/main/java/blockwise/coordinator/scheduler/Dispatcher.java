package blockwise.coordinator.scheduler;

import blockwise.coordinator.core.ProgressBus;
import blockwise.coordinator.error.BlockwiseException;
import blockwise.coordinator.error.CancelledException;
import blockwise.coordinator.model.Block;
import blockwise.coordinator.model.BlockKey;
import blockwise.coordinator.model.ExecutionSummary;
import blockwise.coordinator.model.RunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single owner of the {@link BlockScheduler}. Runs on its own thread and
 * consumes worker messages one at a time, so every block transition and
 * every counter update happens on this thread.
 * <p>
 * Claims that cannot be served right away are parked and answered as soon
 * as a block becomes ready. Once every block is terminal, all parked and
 * future claims are answered with "no more work".
 */
public final class Dispatcher implements Runnable, WorkerChannel {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    /** How often a waiting worker re-checks whether the run has closed. */
    private static final long CLAIM_POLL_MS = 200;

    private final BlockScheduler scheduler;
    private final ProgressBus progress;
    private final BlockingQueue<DispatcherMessage> inbox = new LinkedBlockingQueue<>();
    private final Deque<DispatcherMessage.Claim> waiting = new ArrayDeque<>();
    private final Map<BlockKey, String> holders = new HashMap<>();
    private final Map<String, ExecutionSummary> published = new HashMap<>();
    private final CompletableFuture<RunResult> result = new CompletableFuture<>();

    private volatile boolean closed;
    private volatile boolean cancelRequested;
    private volatile Map<String, ExecutionSummary> latest;

    public Dispatcher(BlockScheduler scheduler, ProgressBus progress) {
        this.scheduler = scheduler;
        this.progress = progress;
        this.latest = scheduler.summaries();
    }

    @Override
    public void run() {
        long startNanos = System.nanoTime();
        Thread.currentThread().setName("blockwise-dispatcher");
        log.info("Dispatcher started: {} blocks in {} task(s)",
                scheduler.graph().totalBlocks(), scheduler.graph().tasks().size());

        try {
            publishProgress();
            while (!scheduler.isDone()) {
                DispatcherMessage msg = inbox.take();
                handle(msg);
                serveWaiting();
                checkNotStalled();
                publishProgress();
            }
            close();
            RunResult runResult = new RunResult(scheduler.summaries(),
                    Duration.ofNanos(System.nanoTime() - startNanos), scheduler.isCancelled());
            log.info("Dispatcher finished: {}", runResult.describe());
            progress.fireRunFinished(runResult);
            result.complete(runResult);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abort(new CancelledException("dispatcher interrupted", e));
        } catch (RuntimeException e) {
            log.error("Dispatcher error, aborting run", e);
            abort(e);
        }
    }

    private void handle(DispatcherMessage msg) {
        if (msg instanceof DispatcherMessage.Claim claim) {
            waiting.add(claim);
        } else if (msg instanceof DispatcherMessage.Started started) {
            scheduler.markRunning(started.block());
        } else if (msg instanceof DispatcherMessage.Outcome outcome) {
            holders.remove(outcome.block());
            BlockOutcome reported = outcome.outcome();
            if (reported.kind() == BlockOutcome.Kind.CANCELLED && !scheduler.isCancelled()) {
                reported = BlockOutcome.failed(new CancelledException("worker " + outcome.workerId()
                        + " was interrupted without a cancel request"));
            }
            scheduler.release(outcome.block(), reported);
        } else if (msg instanceof DispatcherMessage.Cancel) {
            scheduler.cancel();
        } else {
            throw new IllegalArgumentException("unknown dispatcher message: " + msg);
        }
    }

    private void serveWaiting() {
        while (!waiting.isEmpty()) {
            Optional<Block> next = scheduler.acquireBlock();
            if (next.isEmpty()) {
                return;
            }
            Block block = next.get();
            DispatcherMessage.Claim claim = waiting.poll();
            if (claim.reply().complete(next)) {
                String previous = holders.put(block.key(), claim.workerId());
                if (previous != null) {
                    throw new IllegalStateException("block " + block.key() + " handed to " + claim.workerId()
                            + " while held by " + previous);
                }
            } else {
                // the worker gave up waiting (interrupted); nobody holds this block
                scheduler.release(block.key(), scheduler.isCancelled()
                        ? BlockOutcome.cancelled()
                        : BlockOutcome.failed(new CancelledException("worker " + claim.workerId() + " went away")));
            }
        }
    }

    private void checkNotStalled() {
        if (!scheduler.isDone() && scheduler.activeCount() == 0 && !scheduler.hasReady()) {
            throw new IllegalStateException("no block is ready or running but the run is not done");
        }
    }

    private void publishProgress() {
        Map<String, ExecutionSummary> now = scheduler.summaries();
        latest = now;
        for (ExecutionSummary summary : now.values()) {
            if (!summary.equals(published.get(summary.taskId()))) {
                published.put(summary.taskId(), summary);
                progress.fireProgress(summary);
            }
        }
    }

    private void close() {
        closed = true;
        while (!waiting.isEmpty()) {
            waiting.poll().reply().complete(Optional.empty());
        }
        DispatcherMessage msg;
        while ((msg = inbox.poll()) != null) {
            if (msg instanceof DispatcherMessage.Claim claim) {
                claim.reply().complete(Optional.empty());
            }
        }
    }

    private void abort(RuntimeException cause) {
        try {
            scheduler.cancel();
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
        cancelRequested = true;
        close();
        result.completeExceptionally(cause);
    }

    // ---- WorkerChannel, called from worker threads ----

    @Override
    public Optional<Block> claim(String workerId) throws InterruptedException {
        if (closed) {
            return Optional.empty();
        }
        CompletableFuture<Optional<Block>> reply = new CompletableFuture<>();
        inbox.add(new DispatcherMessage.Claim(workerId, reply));
        try {
            while (true) {
                try {
                    return reply.get(CLAIM_POLL_MS, TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    if (closed && reply.complete(Optional.empty())) {
                        return Optional.empty();
                    }
                }
            }
        } catch (InterruptedException e) {
            // a block handed out while we were being interrupted must still be reported
            if (!reply.complete(Optional.empty())) {
                reply.getNow(Optional.empty()).ifPresent(block -> report(workerId, block.key(),
                        cancelRequested ? BlockOutcome.cancelled()
                                : BlockOutcome.failed(new CancelledException("worker " + workerId + " interrupted"))));
            }
            throw e;
        } catch (ExecutionException e) {
            throw new BlockwiseException("claim failed for worker " + workerId, e.getCause());
        }
    }

    @Override
    public void started(String workerId, BlockKey block) {
        inbox.add(new DispatcherMessage.Started(workerId, block));
    }

    @Override
    public void report(String workerId, BlockKey block, BlockOutcome outcome) {
        inbox.add(new DispatcherMessage.Outcome(workerId, block, outcome));
    }

    @Override
    public boolean isCancelRequested() {
        return cancelRequested;
    }

    // ---- control, called from any thread ----

    /**
     * Ask the dispatcher to cancel every block that has not started.
     */
    public void requestCancel() {
        cancelRequested = true;
        inbox.add(new DispatcherMessage.Cancel());
    }

    public CompletableFuture<RunResult> result() {
        return result;
    }

    public boolean isClosed() {
        return closed;
    }

    /** Most recent snapshot of every task, in scheduling order. */
    public Map<String, ExecutionSummary> latestProgress() {
        return latest;
    }
}
