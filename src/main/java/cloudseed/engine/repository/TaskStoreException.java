package cloudseed.engine.repository;

/**
 * Task state could not be read from or written to stable storage.
 * The polling loop stops on this error rather than silently losing progress.
 */
public class TaskStoreException extends RuntimeException {

    public TaskStoreException(String message) {
        super(message);
    }

    public TaskStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
