package inspector.coordinator.api.v1;

import inspector.coordinator.api.Controller;
import inspector.coordinator.api.QueryParams;
import inspector.coordinator.api.v1.dto.StatisticsResponse;
import inspector.coordinator.api.v1.dto.TaskRecordResponse;
import inspector.coordinator.error.OperationResult;
import inspector.coordinator.model.HistoryQuery;
import inspector.coordinator.model.RecordStatistics;
import inspector.coordinator.model.TaskRecord;
import inspector.coordinator.model.TaskType;
import inspector.coordinator.service.HistoryService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for result history (public API).
 *
 * GET /api/v1/history?task_type=&station_id=&from=&to=&limit=&offset=
 * GET /api/v1/statistics?task_type=&days=
 * GET /api/v1/stations/{stationId}/latest?task_type=
 */
public class HistoryController implements Controller {

    private static final String HISTORY_PATH = "/api/v1/history";
    private static final String STATISTICS_PATH = "/api/v1/statistics";
    private static final Pattern LATEST_PATTERN = Pattern.compile("^/api/v1/stations/(\\d+)/latest$");

    static final int DEFAULT_LIMIT = 100;

    private final HistoryService history;

    public HistoryController(HistoryService history) {
        this.history = history;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (!method.equals(HttpMethod.GET)) {
            return false;
        }
        return HISTORY_PATH.equals(path)
                || STATISTICS_PATH.equals(path)
                || LATEST_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        QueryParams params = QueryParams.of(req.uri());

        if (HISTORY_PATH.equals(path)) {
            return handleHistory(params);
        }
        if (STATISTICS_PATH.equals(path)) {
            return handleStatistics(params);
        }
        Matcher latest = LATEST_PATTERN.matcher(path);
        if (latest.matches()) {
            return handleLatest(Integer.parseInt(latest.group(1)), params);
        }
        return ControllerResponse.notFound("unknown history endpoint");
    }

    private ControllerResponse handleHistory(QueryParams params) throws Exception {
        Integer type = params.integer("task_type");
        HistoryQuery query = new HistoryQuery(
                type == null ? null : TaskType.fromCode(type),
                params.integer("station_id"),
                params.instant("from"),
                params.instant("to"),
                params.integer("limit", DEFAULT_LIMIT),
                params.integer("offset", 0));

        OperationResult<List<TaskRecord>> result = history.history(query);
        if (result.isFailure()) {
            return ControllerResponse.failure(result);
        }
        List<TaskRecordResponse> records = result.value().stream().map(TaskRecordResponse::from).toList();
        return ControllerResponse.ok(Map.of("records", records, "count", records.size()));
    }

    private ControllerResponse handleStatistics(QueryParams params) throws Exception {
        Integer type = params.integer("task_type");
        int days = params.integer("days", HistoryService.DEFAULT_STATISTICS_DAYS);

        OperationResult<RecordStatistics> result = history.statistics(
                type == null ? null : TaskType.fromCode(type), days);
        if (result.isFailure()) {
            return ControllerResponse.failure(result);
        }
        return ControllerResponse.ok(StatisticsResponse.from(type, days, result.value()));
    }

    private ControllerResponse handleLatest(int stationId, QueryParams params) throws Exception {
        Integer type = params.integer("task_type");

        OperationResult<TaskRecord> result = history.latestForStation(stationId,
                type == null ? null : TaskType.fromCode(type));
        if (result.isFailure()) {
            return ControllerResponse.failure(result);
        }
        return ControllerResponse.ok(TaskRecordResponse.from(result.value()));
    }
}
