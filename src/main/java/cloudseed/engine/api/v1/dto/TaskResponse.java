package cloudseed.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import cloudseed.engine.model.TransferTask;

import java.time.Instant;

/**
 * Response DTO for one task.
 * GET /api/v1/tasks/{taskId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
        @JsonProperty("id") String id,
        @JsonProperty("source") String source,
        @JsonProperty("state") String state,
        @JsonProperty("name") String name,
        @JsonProperty("progress") double progress,
        @JsonProperty("downloadHandle") String downloadHandle,
        @JsonProperty("localPath") String localPath,
        @JsonProperty("remotePath") String remotePath,
        @JsonProperty("error") String error,
        @JsonProperty("failureCount") int failureCount,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt) {

    public static TaskResponse from(TransferTask task) {
        return new TaskResponse(
                task.id(),
                task.source(),
                task.state().name(),
                task.name(),
                task.progress(),
                task.downloadHandle(),
                task.localPath(),
                task.remotePath(),
                task.error(),
                task.failureCount(),
                task.createdAt(),
                task.updatedAt());
    }
}
