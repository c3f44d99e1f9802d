package cloudseed.engine.model;

/**
 * Lifecycle state of a transfer task.
 *
 * The main progression is PENDING → SUBMITTED → DOWNLOADING → DOWNLOADED →
 * UPLOADING → COMPLETED. FAILED is reachable from any non-terminal state,
 * REMOVED from any state except itself.
 */
public enum TaskState {
    /** Created, not yet handed to the download engine */
    PENDING(0),
    /** Accepted by the download engine, handle recorded */
    SUBMITTED(1),
    /** Download engine reports the transfer queued or in progress */
    DOWNLOADING(2),
    /** Content is complete on local disk */
    DOWNLOADED(3),
    /** Upload accepted, transfer to cloud storage in progress */
    UPLOADING(4),
    /** Content uploaded, remote path recorded */
    COMPLETED(5),
    /** Given up; see the task's error */
    FAILED(-1),
    /** Removed by the operator */
    REMOVED(-1);

    private final int rank;

    TaskState(int rank) {
        this.rank = rank;
    }

    /** Position in the main progression, -1 for FAILED and REMOVED. */
    public int rank() {
        return rank;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == REMOVED;
    }

    /**
     * True if this state lies on the main progression at or after {@code other}.
     */
    public boolean atOrBeyond(TaskState other) {
        return rank >= 0 && other.rank >= 0 && rank >= other.rank;
    }

    /**
     * Check whether a task may move from this state to {@code target}.
     * Staying in the same non-terminal state is allowed (progress refresh,
     * retry bookkeeping).
     */
    public boolean canTransitionTo(TaskState target) {
        if (this == REMOVED) {
            return false;
        }
        if (target == REMOVED) {
            return true;
        }
        if (isTerminal()) {
            return false;
        }
        if (target == this || target == FAILED) {
            return true;
        }
        return switch (this) {
            case PENDING -> target == SUBMITTED;
            case SUBMITTED -> target == DOWNLOADING || target == DOWNLOADED;
            case DOWNLOADING -> target == DOWNLOADED;
            case DOWNLOADED -> target == UPLOADING;
            case UPLOADING -> target == COMPLETED;
            default -> false;
        };
    }
}
