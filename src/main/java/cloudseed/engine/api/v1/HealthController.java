package cloudseed.engine.api.v1;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import cloudseed.engine.api.Controller;
import cloudseed.engine.api.v1.dto.HealthResponse;
import cloudseed.engine.model.TaskState;
import cloudseed.engine.repository.TaskStore;
import cloudseed.engine.server.RouterHandler;
import cloudseed.engine.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final TaskStore store;
    private final TaskService taskService;

    public HealthController(TaskStore store, TaskService taskService) {
        this.store = store;
        this.taskService = taskService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) {
        try {
            if (!store.isHealthy()) {
                HealthResponse response = HealthResponse.unhealthy("task store unavailable");
                return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(response));
            }

            Map<String, Long> counts = new LinkedHashMap<>();
            for (Map.Entry<TaskState, Long> entry : taskService.countByState().entrySet()) {
                counts.put(entry.getKey().name(), entry.getValue());
            }

            HealthResponse response = HealthResponse.healthy(formatUptime(), VERSION, counts);
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            return ControllerResponse.error("health check failed");
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
