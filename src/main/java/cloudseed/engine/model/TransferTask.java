package cloudseed.engine.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of one download-then-upload unit of work.
 * Every change goes through {@link #toBuilder()} and produces a new instance.
 *
 * The builder enforces the field/state invariants: a download handle exists
 * from SUBMITTED on, a local path from DOWNLOADED on, a remote path only in
 * COMPLETED.
 */
public final class TransferTask {
    private final String id;
    private final String source;
    private final TaskState state;
    private final String downloadHandle;
    private final String name;
    private final double progress;
    private final String localPath;
    private final String remotePath;
    private final String error;
    private final int failureCount;
    private final Instant createdAt;
    private final Instant updatedAt;

    private TransferTask(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.source = Objects.requireNonNull(builder.source, "source is required");
        this.state = Objects.requireNonNull(builder.state, "state is required");
        this.downloadHandle = builder.downloadHandle;
        this.name = builder.name;
        this.progress = Math.max(0.0, Math.min(1.0, builder.progress));
        this.localPath = builder.localPath;
        this.remotePath = builder.remotePath;
        this.error = builder.error;
        this.failureCount = builder.failureCount;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : builder.createdAt;
        checkInvariants();
    }

    private void checkInvariants() {
        // FAILED and REMOVED keep whatever the task had when it left the progression
        if (state.rank() >= 0) {
            if (state.atOrBeyond(TaskState.SUBMITTED) != (downloadHandle != null)) {
                throw new IllegalArgumentException(
                        "task " + id + ": download handle must be set iff state is SUBMITTED or later, state=" + state);
            }
            if (state.atOrBeyond(TaskState.DOWNLOADED) != (localPath != null)) {
                throw new IllegalArgumentException(
                        "task " + id + ": local path must be set iff state is DOWNLOADED or later, state=" + state);
            }
            if ((state == TaskState.COMPLETED) != (remotePath != null)) {
                throw new IllegalArgumentException(
                        "task " + id + ": remote path must be set iff state is COMPLETED, state=" + state);
            }
        }
        if (failureCount < 0) {
            throw new IllegalArgumentException("task " + id + ": failureCount must not be negative");
        }
    }

    public String id() {
        return id;
    }

    public String source() {
        return source;
    }

    public TaskState state() {
        return state;
    }

    public String downloadHandle() {
        return downloadHandle;
    }

    public String name() {
        return name;
    }

    public double progress() {
        return progress;
    }

    public String localPath() {
        return localPath;
    }

    public String remotePath() {
        return remotePath;
    }

    public String error() {
        return error;
    }

    public int failureCount() {
        return failureCount;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public boolean hasError() {
        return error != null && !error.isBlank();
    }

    /** Name if the download engine reported one, otherwise the source. */
    public String displayName() {
        return name != null && !name.isBlank() ? name : source;
    }

    /**
     * Compare every field except {@code updatedAt}.
     * Used to skip saving a record that a poll did not change.
     */
    public boolean sameContentAs(TransferTask other) {
        if (other == null) {
            return false;
        }
        return id.equals(other.id)
                && source.equals(other.source)
                && state == other.state
                && Objects.equals(downloadHandle, other.downloadHandle)
                && Objects.equals(name, other.name)
                && Double.compare(progress, other.progress) == 0
                && Objects.equals(localPath, other.localPath)
                && Objects.equals(remotePath, other.remotePath)
                && Objects.equals(error, other.error)
                && failureCount == other.failureCount
                && Objects.equals(createdAt, other.createdAt);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .source(source)
                .state(state)
                .downloadHandle(downloadHandle)
                .name(name)
                .progress(progress)
                .localPath(localPath)
                .remotePath(remotePath)
                .error(error)
                .failureCount(failureCount)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String source;
        private TaskState state = TaskState.PENDING;
        private String downloadHandle;
        private String name;
        private double progress;
        private String localPath;
        private String remotePath;
        private String error;
        private int failureCount;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder state(TaskState state) {
            this.state = state;
            return this;
        }

        public Builder downloadHandle(String downloadHandle) {
            this.downloadHandle = downloadHandle;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder progress(double progress) {
            this.progress = progress;
            return this;
        }

        public Builder localPath(String localPath) {
            this.localPath = localPath;
            return this;
        }

        public Builder remotePath(String remotePath) {
            this.remotePath = remotePath;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder failureCount(int failureCount) {
            this.failureCount = failureCount;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public TransferTask build() {
            return new TransferTask(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TransferTask task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "TransferTask{id='" + id + "', state=" + state + ", handle='" + downloadHandle + "'}";
    }
}
