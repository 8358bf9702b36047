package inspector.coordinator.api.v1;

import inspector.coordinator.api.Controller;
import inspector.coordinator.api.v1.dto.HealthResponse;
import inspector.coordinator.event.BroadcastHub;
import inspector.coordinator.model.TaskStatus;
import inspector.coordinator.repository.TaskQueueRepository;
import inspector.coordinator.service.CartStatusRegister;
import inspector.coordinator.store.Database;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final TaskQueueRepository queue;
    private final BroadcastHub hub;
    private final CartStatusRegister cart;

    public HealthController(Database database, TaskQueueRepository queue, BroadcastHub hub, CartStatusRegister cart) {
        this.database = database;
        this.queue = queue;
        this.hub = hub;
        this.cart = cart;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (!database.isHealthy()) {
            return ControllerResponse.ok(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    HealthResponse.unhealthy("connection failed"));
        }

        try {
            HealthResponse response = HealthResponse.healthy(
                    formatUptime(),
                    VERSION,
                    queue.countByStatus(TaskStatus.PENDING),
                    queue.countByStatus(TaskStatus.ASSIGNED),
                    hub.subscriberCount(),
                    cart.get().online());
            return ControllerResponse.ok(response);
        } catch (RuntimeException e) {
            log.error("Health check failed", e);
            return ControllerResponse.ok(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    HealthResponse.unhealthy(e.getMessage()));
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
