package inspector.coordinator.api.v1;

import inspector.coordinator.api.Controller;
import inspector.coordinator.api.QueryParams;
import inspector.coordinator.api.v1.dto.AlertResponse;
import inspector.coordinator.error.OperationResult;
import inspector.coordinator.model.Alert;
import inspector.coordinator.service.AlertService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for alerts (public API).
 *
 * GET  /api/v1/alerts?limit=           - Unhandled alerts, newest first
 * POST /api/v1/alerts/{alertId}/handle - Mark an alert handled
 */
public class AlertController implements Controller {

    private static final String ALERTS_PATH = "/api/v1/alerts";
    private static final Pattern HANDLE_PATTERN = Pattern.compile("^/api/v1/alerts/(\\d+)/handle$");

    static final int DEFAULT_LIMIT = 50;

    private final AlertService alerts;

    public AlertController(AlertService alerts) {
        this.alerts = alerts;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return ALERTS_PATH.equals(path);
        }
        return method.equals(HttpMethod.POST) && HANDLE_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (ALERTS_PATH.equals(path)) {
            int limit = QueryParams.of(req.uri()).integer("limit", DEFAULT_LIMIT);
            OperationResult<List<Alert>> result = alerts.unhandled(limit);
            if (result.isFailure()) {
                return ControllerResponse.failure(result);
            }
            List<AlertResponse> body = result.value().stream().map(AlertResponse::from).toList();
            return ControllerResponse.ok(Map.of("alerts", body, "count", body.size()));
        }

        Matcher handle = HANDLE_PATTERN.matcher(path);
        if (handle.matches()) {
            OperationResult<Alert> result = alerts.markHandled(Long.parseLong(handle.group(1)));
            if (result.isFailure()) {
                return ControllerResponse.failure(result);
            }
            return ControllerResponse.ok(AlertResponse.from(result.value()));
        }
        return ControllerResponse.notFound("unknown alert endpoint");
    }
}
