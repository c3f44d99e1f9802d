package cloudseed.engine.repository;

import cloudseed.engine.model.TransferTask;

import java.util.List;
import java.util.Optional;

/**
 * Durable mapping from task id to {@link TransferTask}.
 * Implementations can use plain files or JDBC.
 *
 * All methods throw {@link TaskStoreException} when stable storage cannot be
 * read or written.
 */
public interface TaskStore {

    /**
     * Reconstruct all records from stable storage, replacing anything held in
     * memory. Missing storage yields an empty store.
     *
     * @return number of records loaded
     */
    int load();

    /**
     * Atomically persist the latest state of one record. Durable on return.
     *
     * @throws IllegalTransitionException if the persisted record is in a state
     *                                    the new one cannot follow
     */
    void save(TransferTask task);

    /**
     * Get a record by id.
     *
     * @throws TaskNotFoundException if no such record exists
     */
    default TransferTask get(String taskId) {
        return findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    /**
     * Find a record by id.
     */
    Optional<TransferTask> findById(String taskId);

    /**
     * All records, ordered by creation time ascending.
     */
    List<TransferTask> list();

    /**
     * Check that stable storage is reachable.
     */
    boolean isHealthy();
}
