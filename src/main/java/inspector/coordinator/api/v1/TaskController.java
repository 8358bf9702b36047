package inspector.coordinator.api.v1;

import inspector.coordinator.api.Controller;
import inspector.coordinator.api.QueryParams;
import inspector.coordinator.api.v1.dto.AddTaskRequest;
import inspector.coordinator.api.v1.dto.TaskResponse;
import inspector.coordinator.error.OperationResult;
import inspector.coordinator.error.ValidationException;
import inspector.coordinator.model.Task;
import inspector.coordinator.service.DispatchService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for the task queue (public API).
 *
 * POST   /api/v1/tasks                              - Add a task
 * GET    /api/v1/tasks?limit=                       - List pending tasks
 * GET    /api/v1/tasks/{taskId}                     - Get one task
 * DELETE /api/v1/tasks/{taskId}                     - Remove a task
 * POST   /api/v1/tasks/clear?older_than_seconds=    - Clear finished tasks
 */
public class TaskController implements Controller {

    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/tasks$");
    private static final Pattern CLEAR_PATTERN = Pattern.compile("^/api/v1/tasks/clear$");
    private static final Pattern TASK_BY_ID_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)$");

    static final int DEFAULT_LIMIT = 100;

    private final DispatchService dispatch;

    public TaskController(DispatchService dispatch) {
        this.dispatch = dispatch;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (TASKS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST) || method.equals(HttpMethod.GET);
        }
        if (CLEAR_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST);
        }
        if (TASK_BY_ID_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.DELETE);
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        HttpMethod method = req.method();

        if (TASKS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST) ? handleAdd(req) : handleListPending(req);
        }
        if (CLEAR_PATTERN.matcher(path).matches()) {
            return handleClear(req);
        }

        Matcher byId = TASK_BY_ID_PATTERN.matcher(path);
        if (byId.matches()) {
            String taskId = byId.group(1);
            return method.equals(HttpMethod.DELETE) ? handleDelete(taskId) : handleGet(taskId);
        }
        return ControllerResponse.notFound("unknown task endpoint");
    }

    /**
     * POST /api/v1/tasks
     */
    private ControllerResponse handleAdd(FullHttpRequest req) throws Exception {
        AddTaskRequest request = Controller.readBody(req, AddTaskRequest.class);

        OperationResult<String> result = dispatch.enqueue(request.stationId(), request.taskType(), request.params());
        if (result.isFailure()) {
            return ControllerResponse.failure(result);
        }
        return ControllerResponse.ok(HttpResponseStatus.CREATED, Map.of("task_id", result.value()));
    }

    /**
     * GET /api/v1/tasks?limit=
     */
    private ControllerResponse handleListPending(FullHttpRequest req) throws Exception {
        int limit = QueryParams.of(req.uri()).integer("limit", DEFAULT_LIMIT);

        OperationResult<List<Task>> result = dispatch.listPending(limit);
        if (result.isFailure()) {
            return ControllerResponse.failure(result);
        }
        List<TaskResponse> tasks = result.value().stream().map(TaskResponse::from).toList();
        return ControllerResponse.ok(Map.of("tasks", tasks, "count", tasks.size()));
    }

    private ControllerResponse handleGet(String taskId) throws Exception {
        OperationResult<Task> result = dispatch.find(taskId);
        if (result.isFailure()) {
            return ControllerResponse.failure(result);
        }
        return ControllerResponse.ok(TaskResponse.from(result.value()));
    }

    private ControllerResponse handleDelete(String taskId) throws Exception {
        OperationResult<Void> result = dispatch.delete(taskId);
        if (result.isFailure()) {
            return ControllerResponse.failure(result);
        }
        return ControllerResponse.ok(Map.of("success", true, "task_id", taskId));
    }

    /**
     * POST /api/v1/tasks/clear?older_than_seconds=
     */
    private ControllerResponse handleClear(FullHttpRequest req) throws Exception {
        Integer olderThanSeconds = QueryParams.of(req.uri()).integer("older_than_seconds");
        if (olderThanSeconds == null) {
            throw new ValidationException("older_than_seconds is required");
        }

        OperationResult<Integer> result = dispatch.clearCompleted(Duration.ofSeconds(olderThanSeconds));
        if (result.isFailure()) {
            return ControllerResponse.failure(result);
        }
        return ControllerResponse.ok(Map.of("cleared", result.value()));
    }
}
