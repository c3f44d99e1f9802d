package cloudseed.engine.scheduler;

import cloudseed.engine.config.EngineConfig;
import cloudseed.engine.gateway.DownloadGateway;
import cloudseed.engine.gateway.DownloadStatus;
import cloudseed.engine.gateway.GatewayException;
import cloudseed.engine.gateway.UploadGateway;
import cloudseed.engine.model.ErrorKind;
import cloudseed.engine.model.TaskState;
import cloudseed.engine.model.TransferTask;
import cloudseed.engine.repository.IllegalTransitionException;
import cloudseed.engine.repository.TaskStore;
import cloudseed.engine.repository.TaskStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Drives every non-terminal task one step along its state machine.
 *
 * Each {@link #tick()} reloads the store, then for every eligible task, in
 * creation order:
 * 1. performs at most one transition by consulting the gateways
 * 2. saves the record immediately if anything changed
 *
 * Gateway failures are recorded on the task and never escape a tick. Only
 * {@link TaskStoreException} does, since continuing would lose progress.
 *
 * Tasks found in SUBMITTED or DOWNLOADING are polled by their handle and never
 * re-submitted; only PENDING tasks reach {@link DownloadGateway#submit(String)}.
 */
public class TaskOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TaskOrchestrator.class);

    private final TaskStore store;
    private final DownloadGateway downloadGateway;
    private final UploadGateway uploadGateway;
    private final EngineConfig config;
    private final Clock clock;

    public TaskOrchestrator(TaskStore store, DownloadGateway downloadGateway, UploadGateway uploadGateway,
            EngineConfig config) {
        this(store, downloadGateway, uploadGateway, config, Clock.systemUTC());
    }

    public TaskOrchestrator(TaskStore store, DownloadGateway downloadGateway, UploadGateway uploadGateway,
            EngineConfig config, Clock clock) {
        this.store = store;
        this.downloadGateway = downloadGateway;
        this.uploadGateway = uploadGateway;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Advance every non-terminal task by at most one transition.
     *
     * @return counts for logging
     * @throws TaskStoreException if the store cannot be read or written
     */
    public TickReport tick() {
        store.load();

        List<TransferTask> eligible = store.list().stream()
                .filter(task -> !task.isTerminal())
                .toList();

        if (eligible.isEmpty()) {
            log.debug("No active tasks");
            return TickReport.empty();
        }

        int advanced = 0;
        int failed = 0;
        int skipped = 0;

        for (TransferTask task : eligible) {
            try {
                TransferTask next = step(task);
                if (next.sameContentAs(task)) {
                    continue;
                }

                IllegalTransitionException.check(task.id(), task.state(), next.state());
                TransferTask saved = next.toBuilder().updatedAt(clock.instant()).build();
                store.save(saved);
                advanced++;

                if (saved.state() != task.state()) {
                    log.info("Task {} {} -> {}", task.id(), task.state(), saved.state());
                }
                if (saved.state() == TaskState.FAILED) {
                    failed++;
                } else if (saved.state() == TaskState.COMPLETED) {
                    afterCompleted(saved);
                }
            } catch (IllegalTransitionException e) {
                // Another process (e.g. a CLI remove) changed the record first
                skipped++;
                log.warn("Skipped task {}: {}", task.id(), e.getMessage());
            }
        }

        TickReport report = new TickReport(eligible.size(), advanced, failed, skipped);
        log.debug("Tick finished: {}", report);
        return report;
    }

    /**
     * Mark a task REMOVED, stopping its transfer in the download engine.
     * A gateway failure while cancelling is logged; the task is removed anyway.
     *
     * @param purgeFiles also delete the downloaded content
     * @return the removed task
     */
    public TransferTask remove(String taskId, boolean purgeFiles) {
        TransferTask task = store.get(taskId);
        if (task.state() == TaskState.REMOVED) {
            return task;
        }

        if (task.downloadHandle() != null) {
            try {
                downloadGateway.cancel(task.downloadHandle(), purgeFiles);
                log.info("Cancelled transfer {} for task {} (purgeFiles={})",
                        task.downloadHandle(), taskId, purgeFiles);
            } catch (GatewayException e) {
                log.warn("Could not cancel transfer {} for task {}: {}",
                        task.downloadHandle(), taskId, e.getMessage());
            }
        }

        TransferTask removed = task.toBuilder()
                .state(TaskState.REMOVED)
                .error(null)
                .updatedAt(clock.instant())
                .build();
        store.save(removed);
        log.info("Task {} {} -> {}", taskId, task.state(), TaskState.REMOVED);
        return removed;
    }

    /**
     * Compute the next record for one task. Never throws for gateway trouble.
     */
    private TransferTask step(TransferTask task) {
        try {
            return advance(task);
        } catch (GatewayException e) {
            return onFailure(task, e.kind(), e.getMessage());
        } catch (TaskStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected error advancing task {}", task.id(), e);
            return onFailure(task, ErrorKind.TRANSIENT, e.toString());
        }
    }

    private TransferTask advance(TransferTask task) throws GatewayException {
        return switch (task.state()) {
            case PENDING -> submit(task);
            case SUBMITTED, DOWNLOADING -> pollDownload(task);
            case DOWNLOADED -> startUpload(task);
            case UPLOADING -> upload(task);
            default -> task;
        };
    }

    private TransferTask submit(TransferTask task) throws GatewayException {
        String handle = downloadGateway.submit(task.source());
        log.info("Submitted task {} to download engine, handle {}", task.id(), handle);
        return succeeded(task)
                .state(TaskState.SUBMITTED)
                .downloadHandle(handle)
                .build();
    }

    private TransferTask pollDownload(TransferTask task) throws GatewayException {
        DownloadStatus status = downloadGateway.status(task.downloadHandle());
        String name = status.name() != null ? status.name() : task.name();

        return switch (status.state()) {
            case QUEUED, ACTIVE -> succeeded(task)
                    .state(TaskState.DOWNLOADING)
                    .name(name)
                    .progress(status.progress())
                    .build();
            case COMPLETE -> {
                log.info("Download completed for task {}: {}", task.id(), status.localPath());
                yield succeeded(task)
                        .state(TaskState.DOWNLOADED)
                        .name(name)
                        .progress(1.0)
                        .localPath(status.localPath())
                        .build();
            }
            case ERROR -> onFailure(task.toBuilder().name(name).build(),
                    ErrorKind.FATAL, "download engine error: " + status.error());
        };
    }

    private TransferTask startUpload(TransferTask task) throws GatewayException {
        uploadGateway.ensureAuthenticated();
        return succeeded(task)
                .state(TaskState.UPLOADING)
                .build();
    }

    private TransferTask upload(TransferTask task) throws GatewayException {
        uploadGateway.ensureAuthenticated();
        String remotePath = uploadGateway.upload(Path.of(task.localPath()), config.uploadFolder());
        log.info("Uploaded task {} to {}", task.id(), remotePath);
        return succeeded(task)
                .state(TaskState.COMPLETED)
                .remotePath(remotePath)
                .build();
    }

    /** Builder with the retry bookkeeping reset, for any successful step. */
    private static TransferTask.Builder succeeded(TransferTask task) {
        return task.toBuilder()
                .error(null)
                .failureCount(0);
    }

    /**
     * Apply the error policy: input and fatal errors fail the task, auth errors
     * keep it in place, transient errors keep it in place until the
     * consecutive-failure budget is spent.
     */
    private TransferTask onFailure(TransferTask task, ErrorKind kind, String message) {
        switch (kind) {
            case INPUT, FATAL -> {
                log.warn("Task {} failed in {}: {}", task.id(), task.state(), kind.describe(message));
                return task.toBuilder()
                        .state(TaskState.FAILED)
                        .error(kind.describe(message))
                        .build();
            }
            case AUTH -> {
                log.warn("Task {} waiting for authentication: {}", task.id(), message);
                return task.toBuilder()
                        .error(kind.describe(message))
                        .build();
            }
            default -> {
                int failures = task.failureCount() + 1;
                if (failures >= config.maxTransientFailures()) {
                    log.warn("Task {} failed after {} consecutive transient errors: {}",
                            task.id(), failures, message);
                    return task.toBuilder()
                            .state(TaskState.FAILED)
                            .failureCount(failures)
                            .error(kind.describe(message + " (gave up after " + failures + " attempts)"))
                            .build();
                }
                log.warn("Task {} transient error ({}/{}), will retry: {}",
                        task.id(), failures, config.maxTransientFailures(), message);
                return task.toBuilder()
                        .failureCount(failures)
                        .error(kind.describe(message))
                        .build();
            }
        }
    }

    private void afterCompleted(TransferTask task) {
        if (!config.purgeOnComplete()) {
            return;
        }
        try {
            downloadGateway.cancel(task.downloadHandle(), true);
            log.info("Purged local content of task {}", task.id());
        } catch (GatewayException e) {
            log.warn("Could not purge local content of task {}: {}", task.id(), e.getMessage());
        }
    }
}
