package cloudseed.engine.service;

import cloudseed.engine.gateway.Credential;
import cloudseed.engine.gateway.GatewayException;
import cloudseed.engine.gateway.UploadGateway;
import cloudseed.engine.model.TaskState;
import cloudseed.engine.model.TransferTask;
import cloudseed.engine.repository.TaskStore;
import cloudseed.engine.scheduler.TaskOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Operator-facing operations on tasks, shared by the CLI and the HTTP API.
 * Adding a task only records it as PENDING; the orchestrator does the rest.
 */
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private final TaskStore store;
    private final TaskOrchestrator orchestrator;
    private final UploadGateway uploadGateway;
    private final Clock clock;

    public TaskService(TaskStore store, TaskOrchestrator orchestrator, UploadGateway uploadGateway) {
        this(store, orchestrator, uploadGateway, Clock.systemUTC());
    }

    public TaskService(TaskStore store, TaskOrchestrator orchestrator, UploadGateway uploadGateway, Clock clock) {
        this.store = store;
        this.orchestrator = orchestrator;
        this.uploadGateway = uploadGateway;
        this.clock = clock;
    }

    /**
     * Record a new PENDING task for a magnet link, torrent URL or torrent file.
     * The source is not contacted here; a bad source fails on the next tick.
     * Concurrent adds of one source yield a single task.
     *
     * @throws IllegalArgumentException if the source is blank
     * @throws DuplicateTaskException   if a live task already has this source
     */
    public synchronized TransferTask addTask(String source) {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source must not be blank");
        }
        String normalized = source.strip();

        for (TransferTask existing : store.list()) {
            if (existing.state() != TaskState.REMOVED && existing.source().equals(normalized)) {
                throw new DuplicateTaskException(existing);
            }
        }

        TransferTask task = TransferTask.builder()
                .id(generateId())
                .source(normalized)
                .state(TaskState.PENDING)
                .createdAt(clock.instant())
                .build();

        store.save(task);
        log.info("Added task {} for {}", task.id(), abbreviate(normalized));
        return task;
    }

    /**
     * All tasks, oldest first.
     */
    public List<TransferTask> listTasks() {
        return store.list();
    }

    public TransferTask getTask(String taskId) {
        return store.get(taskId);
    }

    public TransferTask removeTask(String taskId, boolean purgeFiles) {
        return orchestrator.remove(taskId, purgeFiles);
    }

    /**
     * Run the interactive login of the upload destination and persist the credential.
     */
    public Credential authenticate() throws GatewayException {
        Credential credential = uploadGateway.authenticate();
        log.info("Upload destination authenticated, token valid until {}", credential.expiresAt());
        return credential;
    }

    /**
     * Task counts per state, in state declaration order, zero counts omitted.
     */
    public Map<TaskState, Long> countByState() {
        Map<TaskState, Long> counts = new EnumMap<>(TaskState.class);
        for (TransferTask task : store.list()) {
            counts.merge(task.state(), 1L, Long::sum);
        }
        return counts;
    }

    private String generateId() {
        String id;
        do {
            id = "task-" + UUID.randomUUID().toString().substring(0, 8);
        } while (store.findById(id).isPresent());
        return id;
    }

    private static String abbreviate(String source) {
        return source.length() > 80 ? source.substring(0, 77) + "..." : source;
    }
}
