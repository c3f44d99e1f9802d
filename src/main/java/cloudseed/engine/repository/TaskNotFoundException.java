package cloudseed.engine.repository;

/**
 * No task with the requested id exists.
 */
public class TaskNotFoundException extends RuntimeException {

    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super("task not found: " + taskId);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
