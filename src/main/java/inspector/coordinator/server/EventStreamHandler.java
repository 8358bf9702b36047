package inspector.coordinator.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import inspector.coordinator.error.CoordinatorException;
import inspector.coordinator.error.OperationResult;
import inspector.coordinator.event.BroadcastHub;
import inspector.coordinator.event.Event;
import inspector.coordinator.event.EventFrame;
import inspector.coordinator.event.Subscription;
import inspector.coordinator.lock.LockController;
import inspector.coordinator.model.TaskType;
import inspector.coordinator.util.Json;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * One observer connected on {@code /ws/events}.
 *
 * <p>After the WebSocket handshake the channel gets its own hub subscription and its own
 * {@link LockController}. Inbound text frames control the lock:
 * <pre>
 * {"action":"lock","enabled":true|false}
 * {"action":"lock_type","task_type":2,"enabled":true|false}
 * {"action":"ping"}
 * </pre>
 * An observer the hub drops for falling behind is disconnected.
 * Not sharable: holds per-channel state.
 */
public class EventStreamHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {

    private static final Logger log = LoggerFactory.getLogger(EventStreamHandler.class);

    private final BroadcastHub hub;
    private final Supplier<LockController> lockFactory;

    private Subscription subscription;
    private LockController lock;

    public EventStreamHandler(BroadcastHub hub, Supplier<LockController> lockFactory) {
        this.hub = hub;
        this.lockFactory = lockFactory;
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            Channel channel = ctx.channel();
            lock = lockFactory.get();
            subscription = hub.subscribe(event -> push(channel, event), reason -> {
                log.warn("Observer {} fell behind, closing: {}", channel.remoteAddress(), reason.getMessage());
                channel.close();
            });
            log.info("Observer {} connected (subscription {})", channel.remoteAddress(), subscription.id());
        } else {
            super.userEventTriggered(ctx, evt);
        }
    }

    private static void push(Channel channel, Event event) throws JsonProcessingException {
        if (!channel.isActive()) {
            throw new IllegalStateException("channel closed");
        }
        if (!channel.isWritable()) {
            throw new IllegalStateException("observer is not reading");
        }
        channel.writeAndFlush(new TextWebSocketFrame(Json.write(EventFrame.from(event))));
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) throws Exception {
        String text = frame.text();
        JsonNode message;
        try {
            message = Json.mapper().readTree(text);
        } catch (JsonProcessingException e) {
            reply(ctx, "error", Map.of("message", "malformed JSON"));
            return;
        }

        String action = message.path("action").asText("");
        try {
            switch (action) {
                case "ping" -> reply(ctx, "pong", null);
                case "lock" -> handleLock(ctx, message);
                case "lock_type" -> handleLockType(ctx, message);
                default -> reply(ctx, "error", Map.of("message", "unknown action: " + action));
            }
        } catch (CoordinatorException e) {
            reply(ctx, "error", Map.of("message", e.getMessage()));
        }
    }

    private void handleLock(ChannelHandlerContext ctx, JsonNode message) throws JsonProcessingException {
        if (lock == null) {
            reply(ctx, "error", Map.of("message", "handshake not complete"));
            return;
        }
        if (message.path("enabled").asBoolean(false)) {
            OperationResult<Set<TaskType>> armed = lock.arm();
            if (armed.isFailure()) {
                reply(ctx, "error", Map.of("message", armed.message()));
                return;
            }
        } else {
            lock.disarm();
        }
        reply(ctx, "lock_state", lockState());
    }

    private void handleLockType(ChannelHandlerContext ctx, JsonNode message) throws JsonProcessingException {
        if (lock == null) {
            reply(ctx, "error", Map.of("message", "handshake not complete"));
            return;
        }
        JsonNode code = message.get("task_type");
        TaskType type = TaskType.fromCode(code == null || !code.canConvertToInt() ? null : code.asInt());
        if (message.path("enabled").asBoolean(false)) {
            lock.lock(type);
        } else {
            lock.unlock(type);
        }
        reply(ctx, "lock_state", lockState());
    }

    private Map<String, Object> lockState() {
        List<Integer> types = lock.lockedTypes().stream().map(TaskType::code).toList();
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("enabled", lock.isEnabled());
        state.put("locked_task_types", types);
        return state;
    }

    private static void reply(ChannelHandlerContext ctx, String kind, Object payload) throws JsonProcessingException {
        ctx.writeAndFlush(new TextWebSocketFrame(Json.write(EventFrame.control(kind, payload))));
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        release();
        log.info("Observer {} disconnected", ctx.channel().remoteAddress());
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (subscription == null) {
            // plain HTTP channel
            ctx.fireExceptionCaught(cause);
            return;
        }
        log.warn("Event stream error for {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        release();
        ctx.close();
    }

    private void release() {
        if (subscription != null) {
            subscription.close();
            subscription = null;
        }
        if (lock != null) {
            lock.close();
            lock = null;
        }
    }
}
