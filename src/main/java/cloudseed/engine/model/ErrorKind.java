package cloudseed.engine.model;

/**
 * Classification of a failure while advancing a task.
 * The label is what operators see in the task's error field.
 */
public enum ErrorKind {
    /** Bad source string, never retried */
    INPUT("InputError"),
    /** Network blips and rate limits, retried on the next tick */
    TRANSIENT("TransientError"),
    /** Missing or expired credential, retried once re-authenticated */
    AUTH("AuthError"),
    /** Quota exhausted or content permanently rejected */
    FATAL("FatalGatewayError");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Format an error message as stored on the task record. */
    public String describe(String message) {
        if (message == null || message.isBlank()) {
            return label;
        }
        return label + ": " + message;
    }
}
