package blockwise.coordinator.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A named unit of blockwise processing: a total region, how to cut it into
 * blocks, what to run on each block, and which tasks must produce their
 * output first.
 */
public final class Task {
    private final String id;
    private final Roi totalRoi;
    private final TaskConfig config;
    private final ProcessFunction processFunction;
    private final CheckFunction checkFunction; // optional
    private final Set<String> upstreamTaskIds;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.totalRoi = Objects.requireNonNull(builder.totalRoi, "totalRoi is required");
        this.config = Objects.requireNonNull(builder.config, "config is required");
        this.processFunction = Objects.requireNonNull(builder.processFunction, "processFunction is required");
        this.checkFunction = builder.checkFunction;
        this.upstreamTaskIds = Collections.unmodifiableSet(new LinkedHashSet<>(builder.upstreamTaskIds));

        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (upstreamTaskIds.contains(id)) {
            throw new IllegalArgumentException("task " + id + " cannot depend on itself");
        }
    }

    public String id() {
        return id;
    }

    public Roi totalRoi() {
        return totalRoi;
    }

    public TaskConfig config() {
        return config;
    }

    public ProcessFunction processFunction() {
        return processFunction;
    }

    public CheckFunction checkFunction() {
        return checkFunction;
    }

    public boolean hasCheckFunction() {
        return checkFunction != null;
    }

    /** Ids of the tasks whose output this task reads, in declaration order. */
    public Set<String> upstreamTaskIds() {
        return upstreamTaskIds;
    }

    public int numWorkers() {
        return config.numWorkers();
    }

    public int maxRetries() {
        return config.maxRetries();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .id(id)
                .totalRoi(totalRoi)
                .config(config)
                .processFunction(processFunction)
                .checkFunction(checkFunction);
        builder.upstreamTaskIds.addAll(upstreamTaskIds);
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private Roi totalRoi;
        private TaskConfig config;
        private ProcessFunction processFunction;
        private CheckFunction checkFunction;
        private final Set<String> upstreamTaskIds = new LinkedHashSet<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder totalRoi(Roi totalRoi) {
            this.totalRoi = totalRoi;
            return this;
        }

        public Builder config(TaskConfig config) {
            this.config = config;
            return this;
        }

        public Builder processFunction(ProcessFunction processFunction) {
            this.processFunction = processFunction;
            return this;
        }

        public Builder checkFunction(CheckFunction checkFunction) {
            this.checkFunction = checkFunction;
            return this;
        }

        public Builder requires(String... taskIds) {
            for (String taskId : taskIds) {
                upstreamTaskIds.add(Objects.requireNonNull(taskId, "upstream task id"));
            }
            return this;
        }

        public Builder requires(Task... tasks) {
            for (Task task : tasks) {
                upstreamTaskIds.add(task.id());
            }
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', total=" + totalRoi + ", upstream=" + upstreamTaskIds + '}';
    }
}
