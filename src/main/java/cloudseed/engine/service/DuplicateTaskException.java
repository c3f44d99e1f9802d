package cloudseed.engine.service;

import cloudseed.engine.model.TransferTask;

/**
 * Thrown when a source is added while a live (not REMOVED) task for it exists.
 */
public class DuplicateTaskException extends RuntimeException {

    private final TransferTask existing;

    public DuplicateTaskException(TransferTask existing) {
        super("source already tracked by task " + existing.id() + " (" + existing.state() + ")");
        this.existing = existing;
    }

    public TransferTask existing() {
        return existing;
    }
}
