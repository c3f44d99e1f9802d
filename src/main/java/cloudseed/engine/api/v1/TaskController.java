package cloudseed.engine.api.v1;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import cloudseed.engine.api.Controller;
import cloudseed.engine.api.v1.dto.AddTaskRequest;
import cloudseed.engine.api.v1.dto.TaskResponse;
import cloudseed.engine.model.TransferTask;
import cloudseed.engine.repository.IllegalTransitionException;
import cloudseed.engine.repository.TaskNotFoundException;
import cloudseed.engine.server.RouterHandler;
import cloudseed.engine.service.DuplicateTaskException;
import cloudseed.engine.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for task management (public API).
 *
 * GET /api/v1/tasks - List all tasks
 * POST /api/v1/tasks - Add a task
 * GET /api/v1/tasks/{taskId} - Get one task
 * DELETE /api/v1/tasks/{taskId}[?purge=true] - Remove a task
 */
public class TaskController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/tasks$");
    private static final Pattern TASK_BY_ID_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)$");

    private final TaskService taskService;

    public TaskController(TaskService taskService) {
        this.taskService = taskService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (TASKS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.POST);
        }
        if (TASK_BY_ID_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.DELETE);
        }
        return false;
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) {
        try {
            if (TASKS_PATTERN.matcher(path).matches()) {
                return req.method().equals(HttpMethod.POST) ? handleAdd(req) : handleList();
            }

            Matcher byId = TASK_BY_ID_PATTERN.matcher(path);
            if (byId.matches()) {
                String taskId = byId.group(1);
                if (req.method().equals(HttpMethod.DELETE)) {
                    return handleRemove(req, taskId);
                }
                return handleGet(taskId);
            }

            return ControllerResponse.notFound("unknown task endpoint");

        } catch (TaskNotFoundException e) {
            return ControllerResponse.notFound(e.getMessage());
        } catch (DuplicateTaskException | IllegalTransitionException e) {
            return ControllerResponse.conflict(e.getMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Task controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/tasks - Add a task
     */
    private ControllerResponse handleAdd(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("request body is required");
        }
        AddTaskRequest request;
        try {
            request = RouterHandler.mapper().readValue(body, AddTaskRequest.class);
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new IllegalArgumentException("malformed JSON body");
        }
        request.validate();

        TransferTask task = taskService.addTask(request.source());

        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(TaskResponse.from(task)));
    }

    /**
     * GET /api/v1/tasks - List all tasks, oldest first
     */
    private ControllerResponse handleList() throws Exception {
        List<TaskResponse> tasks = taskService.listTasks().stream()
                .map(TaskResponse::from)
                .toList();

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(Map.of("tasks", tasks)));
    }

    /**
     * GET /api/v1/tasks/{taskId} - Get one task
     */
    private ControllerResponse handleGet(String taskId) throws Exception {
        TransferTask task = taskService.getTask(taskId);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(TaskResponse.from(task)));
    }

    /**
     * DELETE /api/v1/tasks/{taskId} - Remove a task, optionally deleting its local content
     */
    private ControllerResponse handleRemove(FullHttpRequest req, String taskId) throws Exception {
        List<String> purgeParam = new QueryStringDecoder(req.uri()).parameters().getOrDefault("purge", List.of());
        boolean purge = !purgeParam.isEmpty() && Boolean.parseBoolean(purgeParam.get(0));

        TransferTask task = taskService.removeTask(taskId, purge);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(TaskResponse.from(task)));
    }
}
