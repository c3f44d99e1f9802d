package cloudseed.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for adding a task.
 * POST /api/v1/tasks
 */
public record AddTaskRequest(
        @JsonProperty("source") String source) {

    /** Validate the request */
    public void validate() {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source is required");
        }
    }
}
