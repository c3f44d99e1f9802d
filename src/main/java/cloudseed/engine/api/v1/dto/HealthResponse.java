package cloudseed.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("store") String store,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("tasks") Map<String, Long> tasks) {

    public static HealthResponse healthy(String uptime, String version, Map<String, Long> tasks) {
        return new HealthResponse("healthy", "ok", uptime, version, tasks);
    }

    public static HealthResponse unhealthy(String store) {
        return new HealthResponse("unhealthy", store, null, null, null);
    }
}
