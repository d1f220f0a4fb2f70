package blockwise.coordinator.config;

import java.time.Duration;

/**
 * Configuration holder for run-wide scheduler settings.
 * All settings have sensible defaults.
 */
public final class SchedulerConfig {

    // Worker settings
    private int maxTotalWorkers = Runtime.getRuntime().availableProcessors();
    private int defaultNumWorkers = 1;
    private int defaultMaxRetries = 0;

    // Completion store (null = no store, nothing is remembered between runs)
    private String databaseUrl = null;
    private int databasePoolSize = 4;

    // Progress and shutdown
    private Duration progressInterval = Duration.ofSeconds(5);
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    private SchedulerConfig() {
    }

    public static SchedulerConfig defaults() {
        return new SchedulerConfig();
    }

    public static SchedulerConfig fromEnv() {
        SchedulerConfig config = new SchedulerConfig();

        // Override from environment variables
        String maxWorkers = System.getenv("BLOCKWISE_MAX_WORKERS");
        if (maxWorkers != null && !maxWorkers.isBlank()) {
            config.withMaxTotalWorkers(Integer.parseInt(maxWorkers.trim()));
        }

        String maxRetries = System.getenv("BLOCKWISE_MAX_RETRIES");
        if (maxRetries != null && !maxRetries.isBlank()) {
            config.withDefaultMaxRetries(Integer.parseInt(maxRetries.trim()));
        }

        String dbUrl = System.getenv("BLOCKWISE_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl.trim();
        }

        String progressMs = System.getenv("BLOCKWISE_PROGRESS_INTERVAL_MS");
        if (progressMs != null && !progressMs.isBlank()) {
            config.progressInterval = Duration.ofMillis(Long.parseLong(progressMs.trim()));
        }

        return config;
    }

    // Getters
    public int maxTotalWorkers() {
        return maxTotalWorkers;
    }

    public int defaultNumWorkers() {
        return defaultNumWorkers;
    }

    public int defaultMaxRetries() {
        return defaultMaxRetries;
    }

    public String databaseUrl() {
        return databaseUrl;
    }

    public boolean hasDatabase() {
        return databaseUrl != null && !databaseUrl.isBlank();
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public Duration progressInterval() {
        return progressInterval;
    }

    public Duration shutdownTimeout() {
        return shutdownTimeout;
    }

    // Fluent setters for testing/customization
    public SchedulerConfig withMaxTotalWorkers(int workers) {
        if (workers <= 0) {
            throw new IllegalArgumentException("maxTotalWorkers must be positive");
        }
        this.maxTotalWorkers = workers;
        return this;
    }

    public SchedulerConfig withDefaultNumWorkers(int workers) {
        if (workers <= 0) {
            throw new IllegalArgumentException("defaultNumWorkers must be positive");
        }
        this.defaultNumWorkers = workers;
        return this;
    }

    public SchedulerConfig withDefaultMaxRetries(int retries) {
        if (retries < 0) {
            throw new IllegalArgumentException("defaultMaxRetries must not be negative");
        }
        this.defaultMaxRetries = retries;
        return this;
    }

    public SchedulerConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public SchedulerConfig withDatabasePoolSize(int size) {
        this.databasePoolSize = size;
        return this;
    }

    public SchedulerConfig withProgressInterval(Duration interval) {
        this.progressInterval = interval;
        return this;
    }

    public SchedulerConfig withShutdownTimeout(Duration timeout) {
        this.shutdownTimeout = timeout;
        return this;
    }

    @Override
    public String toString() {
        return "SchedulerConfig{" +
                "maxTotalWorkers=" + maxTotalWorkers +
                ", defaultNumWorkers=" + defaultNumWorkers +
                ", defaultMaxRetries=" + defaultMaxRetries +
                ", databaseUrl='" + databaseUrl + '\'' +
                ", progressInterval=" + progressInterval +
                '}';
    }
}
