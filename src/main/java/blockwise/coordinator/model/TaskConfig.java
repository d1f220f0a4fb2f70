package blockwise.coordinator.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Per-task scheduling settings, fixed when the task is created.
 */
public final class TaskConfig {
    private final long[] blockShape;
    private final long[] context;
    private final int numWorkers;
    private final int maxRetries;
    private final boolean readWriteConflict;
    private final boolean numWorkersSet;
    private final boolean maxRetriesSet;

    private TaskConfig(Builder builder) {
        this.blockShape = Objects.requireNonNull(builder.blockShape, "blockShape is required").clone();
        this.context = builder.context != null ? builder.context.clone() : new long[blockShape.length];
        this.numWorkersSet = builder.numWorkers != null;
        this.maxRetriesSet = builder.maxRetries != null;
        this.numWorkers = numWorkersSet ? builder.numWorkers : 1;
        this.maxRetries = maxRetriesSet ? builder.maxRetries : 0;
        this.readWriteConflict = builder.readWriteConflict;

        if (context.length != blockShape.length) {
            throw new IllegalArgumentException("context " + Arrays.toString(context)
                    + " does not match block shape " + Arrays.toString(blockShape));
        }
        for (long c : context) {
            if (c < 0) {
                throw new IllegalArgumentException("context must not be negative: " + Arrays.toString(context));
            }
        }
        if (numWorkers <= 0) {
            throw new IllegalArgumentException("numWorkers must be positive");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
    }

    /** Shape of a block's write region. */
    public long[] blockShape() {
        return blockShape.clone();
    }

    /** Halo added on each side of the write region to form the read region. */
    public long[] context() {
        return context.clone();
    }

    public int numWorkers() {
        return numWorkers;
    }

    /** Extra attempts allowed after a block's first fault. */
    public int maxRetries() {
        return maxRetries;
    }

    /** Sequence neighbouring blocks whose read and write regions overlap. */
    public boolean readWriteConflict() {
        return readWriteConflict;
    }

    public boolean hasContext() {
        for (long c : context) {
            if (c > 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Fills the worker and retry settings the builder left unset with run-wide
     * defaults. Explicit values are kept.
     *
     * @return this config if nothing was unset, otherwise a resolved copy
     */
    public TaskConfig withDefaults(int defaultNumWorkers, int defaultMaxRetries) {
        if (numWorkersSet && maxRetriesSet) {
            return this;
        }
        return toBuilder()
                .numWorkers(numWorkersSet ? numWorkers : defaultNumWorkers)
                .maxRetries(maxRetriesSet ? maxRetries : defaultMaxRetries)
                .build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .blockShape(blockShape)
                .context(context)
                .readWriteConflict(readWriteConflict);
        builder.numWorkers = numWorkersSet ? numWorkers : null;
        builder.maxRetries = maxRetriesSet ? maxRetries : null;
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long[] blockShape;
        private long[] context;
        // null until set; unset values take the run-wide defaults
        private Integer numWorkers;
        private Integer maxRetries;
        private boolean readWriteConflict = false;

        public Builder blockShape(long... blockShape) {
            this.blockShape = blockShape;
            return this;
        }

        public Builder context(long... context) {
            this.context = context;
            return this;
        }

        public Builder numWorkers(int numWorkers) {
            this.numWorkers = numWorkers;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder readWriteConflict(boolean readWriteConflict) {
            this.readWriteConflict = readWriteConflict;
            return this;
        }

        public TaskConfig build() {
            return new TaskConfig(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TaskConfig that))
            return false;
        return numWorkers == that.numWorkers
                && maxRetries == that.maxRetries
                && readWriteConflict == that.readWriteConflict
                && Arrays.equals(blockShape, that.blockShape)
                && Arrays.equals(context, that.context);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(numWorkers, maxRetries, readWriteConflict);
        result = 31 * result + Arrays.hashCode(blockShape);
        return 31 * result + Arrays.hashCode(context);
    }

    @Override
    public String toString() {
        return "TaskConfig{blockShape=" + Arrays.toString(blockShape)
                + ", context=" + Arrays.toString(context)
                + ", numWorkers=" + numWorkers
                + ", maxRetries=" + maxRetries
                + ", readWriteConflict=" + readWriteConflict + '}';
    }
}
