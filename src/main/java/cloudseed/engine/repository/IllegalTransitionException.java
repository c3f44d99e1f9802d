package cloudseed.engine.repository;

import cloudseed.engine.model.TaskState;

/**
 * A write would move a task backwards or out of a terminal state.
 * Usually means another process changed the record since it was read.
 */
public class IllegalTransitionException extends RuntimeException {

    private final String taskId;
    private final TaskState from;
    private final TaskState to;

    public IllegalTransitionException(String taskId, TaskState from, TaskState to) {
        super("task " + taskId + ": illegal transition " + from + " -> " + to);
        this.taskId = taskId;
        this.from = from;
        this.to = to;
    }

    public String taskId() {
        return taskId;
    }

    public TaskState from() {
        return from;
    }

    public TaskState to() {
        return to;
    }

    /** Throw if {@code to} cannot follow {@code from}. */
    public static void check(String taskId, TaskState from, TaskState to) {
        if (from != to && !from.canTransitionTo(to)) {
            throw new IllegalTransitionException(taskId, from, to);
        }
    }
}
