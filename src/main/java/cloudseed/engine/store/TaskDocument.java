package cloudseed.engine.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import cloudseed.engine.model.TaskState;
import cloudseed.engine.model.TransferTask;

import java.time.Instant;

/**
 * On-disk form of a {@link TransferTask}: one JSON document per task,
 * tagged with a format version.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskDocument(
        @JsonProperty("version") int version,
        @JsonProperty("id") String id,
        @JsonProperty("source") String source,
        @JsonProperty("state") TaskState state,
        @JsonProperty("downloadHandle") String downloadHandle,
        @JsonProperty("name") String name,
        @JsonProperty("progress") double progress,
        @JsonProperty("localPath") String localPath,
        @JsonProperty("remotePath") String remotePath,
        @JsonProperty("error") String error,
        @JsonProperty("failureCount") int failureCount,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt) {

    public static final int CURRENT_VERSION = 1;

    public static TaskDocument from(TransferTask task) {
        return new TaskDocument(
                CURRENT_VERSION,
                task.id(),
                task.source(),
                task.state(),
                task.downloadHandle(),
                task.name(),
                task.progress(),
                task.localPath(),
                task.remotePath(),
                task.error(),
                task.failureCount(),
                task.createdAt(),
                task.updatedAt());
    }

    public TransferTask toTask() {
        return TransferTask.builder()
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
                .updatedAt(updatedAt)
                .build();
    }
}
