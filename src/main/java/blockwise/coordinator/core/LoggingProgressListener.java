package blockwise.coordinator.core;

import blockwise.coordinator.model.ExecutionSummary;
import blockwise.coordinator.model.RunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Logs task progress at INFO, at most once per interval per task. Finished
 * tasks are always logged.
 */
public final class LoggingProgressListener implements ProgressListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingProgressListener.class);

    private final long intervalMs;
    private final LongSupplier clock;
    private final Map<String, Long> lastLogged = new HashMap<>();

    public LoggingProgressListener(Duration interval) {
        this(interval, System::currentTimeMillis);
    }

    LoggingProgressListener(Duration interval, LongSupplier clock) {
        this.intervalMs = interval.toMillis();
        this.clock = clock;
    }

    @Override
    public void onProgress(ExecutionSummary summary) {
        if (shouldLog(summary)) {
            log.info("[{}] {}% {}", summary.taskId(), summary.progressPercent(), summary);
        }
    }

    /** Throttle decision; records the time when it says yes. */
    synchronized boolean shouldLog(ExecutionSummary summary) {
        long now = clock.getAsLong();
        Long last = lastLogged.get(summary.taskId());
        if (summary.isDone() || last == null || now - last >= intervalMs) {
            lastLogged.put(summary.taskId(), now);
            return true;
        }
        return false;
    }

    @Override
    public void onRunFinished(RunResult result) {
        if (result.succeeded()) {
            log.info("Run {}", result.describe());
        } else {
            log.warn("Run {}", result.describe());
        }
        for (ExecutionSummary summary : result.summaries().values()) {
            summary.failures().forEach(f -> log.warn("[{}] failed block {}", summary.taskId(), f));
        }
    }
}
