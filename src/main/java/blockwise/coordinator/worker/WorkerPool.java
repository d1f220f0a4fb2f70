package blockwise.coordinator.worker;

import blockwise.coordinator.model.Task;
import blockwise.coordinator.repository.BlockDoneRepository;
import blockwise.coordinator.scheduler.WorkerChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Fixed pool of {@link BlockWorker} threads for one run.
 * <p>
 * Sizing: the sum of every task's {@code numWorkers}, capped at the
 * configured total. Per-task limits are enforced by the scheduler, not
 * here.
 */
public final class WorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final int size;
    private final Duration shutdownTimeout;
    private final ExecutorService executor;
    private final List<Future<?>> workers = new ArrayList<>();

    public WorkerPool(int size) {
        this(size, Duration.ofSeconds(30));
    }

    public WorkerPool(int size, Duration shutdownTimeout) {
        if (size <= 0) {
            throw new IllegalArgumentException("pool size must be positive");
        }
        this.size = size;
        this.shutdownTimeout = shutdownTimeout;
        this.executor = Executors.newFixedThreadPool(size, r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Pool size for a set of tasks: sum of their worker counts, at most
     * {@code maxTotalWorkers}.
     */
    public static int poolSize(List<Task> tasks, int maxTotalWorkers) {
        long requested = 0;
        for (Task task : tasks) {
            requested += task.numWorkers();
        }
        return (int) Math.max(1, Math.min(requested, maxTotalWorkers));
    }

    /**
     * Start all workers against the given channel.
     */
    public synchronized void start(WorkerChannel channel, Function<String, Task> tasks,
            BlockDoneRepository doneRepository) {
        if (!workers.isEmpty()) {
            throw new IllegalStateException("worker pool already started");
        }
        for (int i = 1; i <= size; i++) {
            workers.add(executor.submit(new BlockWorker("worker-" + i, channel, tasks, doneRepository)));
        }
        log.info("Started {} worker(s)", size);
    }

    public int size() {
        return size;
    }

    /**
     * Interrupt every worker, including ones inside a process function.
     */
    public void interruptAll() {
        log.info("Interrupting {} worker(s)", size);
        executor.shutdownNow();
    }

    /**
     * Wait for all workers to exit.
     *
     * @return true if they all exited within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        executor.shutdown();
        return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
                log.warn("Worker pool forcefully stopped");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
