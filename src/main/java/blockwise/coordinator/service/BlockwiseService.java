package blockwise.coordinator.service;

import blockwise.coordinator.config.SchedulerConfig;
import blockwise.coordinator.core.ProgressBus;
import blockwise.coordinator.error.CyclicDependencyException;
import blockwise.coordinator.error.PartitionException;
import blockwise.coordinator.graph.DependencyGraph;
import blockwise.coordinator.model.RunResult;
import blockwise.coordinator.model.Task;
import blockwise.coordinator.model.TaskConfig;
import blockwise.coordinator.repository.BlockDoneRepository;
import blockwise.coordinator.scheduler.BlockScheduler;
import blockwise.coordinator.scheduler.Dispatcher;
import blockwise.coordinator.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Entry point for blockwise runs.
 * Validates the task graph, then starts a dispatcher thread and a worker
 * pool for the run.
 */
public class BlockwiseService {

    private static final Logger log = LoggerFactory.getLogger(BlockwiseService.class);

    private final SchedulerConfig config;
    private final BlockDoneRepository doneRepository; // optional
    private final ProgressBus progressBus;

    public BlockwiseService(SchedulerConfig config, BlockDoneRepository doneRepository, ProgressBus progressBus) {
        this.config = config;
        this.doneRepository = doneRepository;
        this.progressBus = progressBus;
    }

    public BlockwiseService(SchedulerConfig config) {
        this(config, null, new ProgressBus());
    }

    /**
     * Run tasks to completion and return the per-task summaries.
     * Check {@link RunResult#succeeded()} or call
     * {@link RunResult#throwIfFailed()} for the overall outcome.
     *
     * @throws CyclicDependencyException if the tasks form a cycle
     * @throws PartitionException        if a task cannot be partitioned
     */
    public RunResult run(List<Task> tasks) {
        return start(tasks).await();
    }

    public RunResult run(Task... tasks) {
        return run(List.of(tasks));
    }

    /**
     * Start a run in the background. Graph and partition errors are raised
     * here, before any block runs.
     */
    public RunHandle start(List<Task> tasks) {
        DependencyGraph graph = new DependencyGraph(withDefaults(tasks));
        BlockScheduler scheduler = new BlockScheduler(graph);
        Dispatcher dispatcher = new Dispatcher(scheduler, progressBus);

        int poolSize = WorkerPool.poolSize(graph.tasks(), config.maxTotalWorkers());
        WorkerPool pool = new WorkerPool(poolSize, config.shutdownTimeout());
        String runId = "run-" + UUID.randomUUID().toString().substring(0, 8);

        log.info("Starting {}: {} task(s), {} block(s), {} worker(s)",
                runId, graph.tasks().size(), graph.totalBlocks(), poolSize);

        Thread dispatcherThread = new Thread(dispatcher, "blockwise-dispatcher");
        dispatcherThread.setDaemon(true);
        dispatcherThread.start();

        pool.start(dispatcher, graph::task, doneRepository);
        dispatcher.result().whenComplete((result, error) -> pool.close());

        return new RunHandle(runId, dispatcher, pool);
    }

    /** Unset worker and retry settings take this service's run-wide defaults. */
    private List<Task> withDefaults(List<Task> tasks) {
        Objects.requireNonNull(tasks, "tasks");
        List<Task> resolved = new ArrayList<>(tasks.size());
        for (Task task : tasks) {
            TaskConfig taskConfig = task.config()
                    .withDefaults(config.defaultNumWorkers(), config.defaultMaxRetries());
            resolved.add(taskConfig == task.config() ? task : task.toBuilder().config(taskConfig).build());
        }
        return resolved;
    }

    public SchedulerConfig config() {
        return config;
    }

    public ProgressBus progressBus() {
        return progressBus;
    }
}
