package blockwise.coordinator.error;

import java.util.List;

/**
 * The task graph contains a cycle. Raised before any block is scheduled.
 */
public class CyclicDependencyException extends BlockwiseException {

    private final List<String> taskIds;

    public CyclicDependencyException(List<String> taskIds) {
        super("Cyclic dependency between tasks " + taskIds);
        this.taskIds = List.copyOf(taskIds);
    }

    /** Tasks that could not be ordered (the cycle and everything behind it). */
    public List<String> taskIds() {
        return taskIds;
    }
}
