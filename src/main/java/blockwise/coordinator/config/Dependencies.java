package blockwise.coordinator.config;

import blockwise.coordinator.core.LoggingProgressListener;
import blockwise.coordinator.core.ProgressBus;
import blockwise.coordinator.repository.BlockDoneRepository;
import blockwise.coordinator.service.BlockwiseService;
import blockwise.coordinator.store.Database;
import blockwise.coordinator.store.JdbcBlockDoneRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires the service and its optional completion store.
 *
 * Usage:
 *
 * <pre>
 * try (Dependencies deps = Dependencies.create(SchedulerConfig.fromEnv())) {
 *     RunResult result = deps.blockwiseService().run(tasks);
 * }
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final SchedulerConfig config;
    private final Database database; // null without db_url
    private final BlockDoneRepository blockDoneRepository;
    private final ProgressBus progressBus;
    private final BlockwiseService blockwiseService;

    private Dependencies(SchedulerConfig config) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Completion store, only when configured
        if (config.hasDatabase()) {
            this.database = new Database(config);
            this.blockDoneRepository = new JdbcBlockDoneRepository(database);
        } else {
            this.database = null;
            this.blockDoneRepository = null;
        }

        this.progressBus = new ProgressBus()
                .subscribe(new LoggingProgressListener(config.progressInterval()));
        this.blockwiseService = new BlockwiseService(config, blockDoneRepository, progressBus);

        log.info("Dependencies initialized (completion store: {})", config.hasDatabase() ? "on" : "off");
    }

    public static Dependencies create(SchedulerConfig config) {
        return new Dependencies(config);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(SchedulerConfig.fromEnv());
    }

    public SchedulerConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public BlockDoneRepository blockDoneRepository() {
        return blockDoneRepository;
    }

    public ProgressBus progressBus() {
        return progressBus;
    }

    public BlockwiseService blockwiseService() {
        return blockwiseService;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");
        if (database != null) {
            try {
                database.close();
            } catch (Exception e) {
                log.warn("Error closing database: {}", e.getMessage());
            }
        }
        log.info("Dependencies closed");
    }
}
