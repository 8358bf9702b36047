package inspector.coordinator.api.internal.v1;

import inspector.coordinator.api.Controller;
import inspector.coordinator.api.internal.v1.dto.IngestResultRequest;
import inspector.coordinator.api.v1.dto.TaskResponse;
import inspector.coordinator.error.OperationResult;
import inspector.coordinator.model.Task;
import inspector.coordinator.service.DispatchService;
import inspector.coordinator.service.IngestionService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Internal API used by the cart and the vision service.
 *
 * POST /internal/v1/tasks/{taskId}/assign - Claim a pending task
 * POST /internal/v1/results               - Report a result
 */
public class ResultController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(ResultController.class);

    private static final String RESULTS_PATH = "/internal/v1/results";
    private static final Pattern ASSIGN_PATTERN = Pattern.compile("^/internal/v1/tasks/([^/]+)/assign$");

    private final DispatchService dispatch;
    private final IngestionService ingestion;

    public ResultController(DispatchService dispatch, IngestionService ingestion) {
        this.dispatch = dispatch;
        this.ingestion = ingestion;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (!method.equals(HttpMethod.POST)) {
            return false;
        }
        return RESULTS_PATH.equals(path) || ASSIGN_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (RESULTS_PATH.equals(path)) {
            return handleIngest(req);
        }

        Matcher assign = ASSIGN_PATTERN.matcher(path);
        if (assign.matches()) {
            return handleAssign(assign.group(1));
        }
        return ControllerResponse.notFound("unknown internal endpoint");
    }

    private ControllerResponse handleAssign(String taskId) throws Exception {
        OperationResult<Task> result = dispatch.assign(taskId);
        if (result.isFailure()) {
            log.debug("Assign {} refused: {}", taskId, result.message());
            return ControllerResponse.failure(result);
        }
        return ControllerResponse.ok(TaskResponse.from(result.value()));
    }

    private ControllerResponse handleIngest(FullHttpRequest req) throws Exception {
        IngestResultRequest request = Controller.readBody(req, IngestResultRequest.class);

        OperationResult<Long> result = ingestion.ingest(
                request.taskId(),
                request.taskType(),
                request.stationId(),
                request.result(),
                request.imageRef(),
                request.processingTime());
        if (result.isFailure()) {
            log.warn("Result for task {} rejected: {}", request.taskId(), result.message());
            return ControllerResponse.failure(result);
        }
        return ControllerResponse.ok(HttpResponseStatus.CREATED, Map.of("record_id", result.value()));
    }
}
