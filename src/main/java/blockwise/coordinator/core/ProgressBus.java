package blockwise.coordinator.core;

import blockwise.coordinator.model.ExecutionSummary;
import blockwise.coordinator.model.RunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fan-out of progress snapshots to registered listeners. A listener that
 * throws is logged and skipped; it never breaks the dispatcher.
 */
public final class ProgressBus {

    private static final Logger log = LoggerFactory.getLogger(ProgressBus.class);

    private final CopyOnWriteArrayList<ProgressListener> listeners = new CopyOnWriteArrayList<>();

    public ProgressBus subscribe(ProgressListener listener) {
        listeners.add(listener);
        return this;
    }

    public void unsubscribe(ProgressListener listener) {
        listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    public void fireProgress(ExecutionSummary summary) {
        for (var l : listeners) {
            try {
                l.onProgress(summary);
            } catch (RuntimeException e) {
                log.warn("Progress listener {} failed: {}", l, e.getMessage(), e);
            }
        }
    }

    public void fireRunFinished(RunResult result) {
        for (var l : listeners) {
            try {
                l.onRunFinished(result);
            } catch (RuntimeException e) {
                log.warn("Progress listener {} failed on run finish: {}", l, e.getMessage(), e);
            }
        }
    }
}
