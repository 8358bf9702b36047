package inspector.coordinator.api.v1;

import inspector.coordinator.api.Controller;
import inspector.coordinator.api.v1.dto.CartStatusRequest;
import inspector.coordinator.error.OperationResult;
import inspector.coordinator.event.CartStatusPayload;
import inspector.coordinator.model.CartStatus;
import inspector.coordinator.service.CartStatusRegister;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

/**
 * Cart status endpoint.
 * GET  /api/v1/cart/status - Current snapshot
 * POST /api/v1/cart/status - Telemetry update
 */
public class CartController implements Controller {

    private static final String STATUS_PATH = "/api/v1/cart/status";

    private final CartStatusRegister register;

    public CartController(CartStatusRegister register) {
        this.register = register;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return STATUS_PATH.equals(path) && (method.equals(HttpMethod.GET) || method.equals(HttpMethod.POST));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (req.method().equals(HttpMethod.GET)) {
            return ControllerResponse.ok(CartStatusPayload.from(register.get()));
        }

        CartStatusRequest request = Controller.readBody(req, CartStatusRequest.class);
        OperationResult<CartStatus> result = register.update(
                request.isOnline(),
                request.currentStation(),
                request.mode(),
                request.batteryLevel(),
                request.lastActivity());
        if (result.isFailure()) {
            return ControllerResponse.failure(result);
        }
        return ControllerResponse.ok(CartStatusPayload.from(result.value()));
    }
}
