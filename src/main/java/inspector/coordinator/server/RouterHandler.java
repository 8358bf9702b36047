package inspector.coordinator.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import inspector.coordinator.api.Controller;
import inspector.coordinator.api.Controller.ControllerResponse;
import inspector.coordinator.error.CoordinatorException;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpResponseStatus.NOT_FOUND;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 *
 * Only handles versioned API endpoints:
 * - /api/v1/* (public API)
 * - /internal/v1/* (cart and vision service)
 *
 * All other endpoints return 404.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);

    private final List<Controller> controllers = new ArrayList<>();

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    public int controllerCount() {
        return controllers.size();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();
        boolean keepAlive = HttpUtil.isKeepAlive(req);

        // Extract path without query string
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        try {
            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    ControllerResponse response = controller.handle(ctx, req, path);
                    writeSafe(ctx, response.status(), response.contentType(), response.body(), keepAlive);
                    return;
                }
            }

            log.debug("No handler for: {} {}", method, path);
            write(ctx, ControllerResponse.error(NOT_FOUND, "not found"), keepAlive);

        } catch (CoordinatorException e) {
            log.warn("{} {} rejected ({}): {}", method, path, e.kind(), e.getMessage());
            write(ctx, ControllerResponse.error(ControllerResponse.statusFor(e.kind()), e.getMessage()), keepAlive);
        } catch (JsonProcessingException e) {
            log.warn("Malformed JSON on {} {}: {}", method, path, e.getOriginalMessage());
            write(ctx, ControllerResponse.badRequest("malformed JSON: " + e.getOriginalMessage()), keepAlive);
        } catch (IllegalArgumentException e) {
            log.warn("Validation error: {}", e.getMessage());
            write(ctx, ControllerResponse.badRequest(e.getMessage()), keepAlive);
        } catch (Exception e) {
            log.error("Handler error: {} {} - Body: [{}]", method, path,
                    req.content().toString(StandardCharsets.UTF_8), e);
            write(ctx, ControllerResponse.error("internal error"), keepAlive);
        }
    }

    private void write(ChannelHandlerContext ctx, ControllerResponse response, boolean keepAlive) {
        writeSafe(ctx, response.status(), response.contentType(), response.body(), keepAlive);
    }

    /**
     * Safe write that catches any exceptions during response writing.
     * Ensures we never silently close the connection.
     */
    private void writeSafe(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body,
            boolean keepAlive) {
        try {
            byte[] bytes = (body == null ? "" : body).getBytes(StandardCharsets.UTF_8);
            FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
            response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            HttpUtil.setKeepAlive(response, keepAlive);
            ChannelFuture written = ctx.writeAndFlush(response);
            if (!keepAlive) {
                written.addListener(ChannelFutureListener.CLOSE);
            }
        } catch (RuntimeException e) {
            log.error("Failed to write response: {}", e.getMessage(), e);
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        try {
            write(ctx, ControllerResponse.error(INTERNAL_SERVER_ERROR, "channel error"), false);
        } finally {
            ctx.close();
        }
    }
}
