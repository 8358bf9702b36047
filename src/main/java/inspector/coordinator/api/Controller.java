package inspector.coordinator.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import inspector.coordinator.error.ErrorKind;
import inspector.coordinator.error.OperationResult;
import inspector.coordinator.error.ValidationException;
import inspector.coordinator.util.Json;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Base interface for HTTP controllers.
 * Controllers handle specific URL patterns and HTTP methods.
 */
public interface Controller {

    /**
     * Check if this controller can handle the given request.
     *
     * @param method HTTP method
     * @param path   Request path (without query string)
     * @return true if this controller handles this request
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Handle the request.
     *
     * @param ctx  Netty channel context
     * @param req  Full HTTP request
     * @param path Request path (without query string)
     * @return Response to send back
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception;

    /**
     * Bind the request body to a DTO.
     *
     * @throws ValidationException if the body is empty
     */
    static <T> T readBody(FullHttpRequest req, Class<T> type) throws IOException {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new ValidationException("request body is required");
        }
        return Json.mapper().readValue(body, type);
    }

    /**
     * Response from a controller.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        public static ControllerResponse json(String body) {
            return new ControllerResponse(HttpResponseStatus.OK, "application/json", body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, "application/json", body);
        }

        /** Serialize {@code value} as the JSON body */
        public static ControllerResponse ok(HttpResponseStatus status, Object value) throws JsonProcessingException {
            return json(status, Json.write(value));
        }

        public static ControllerResponse ok(Object value) throws JsonProcessingException {
            return ok(HttpResponseStatus.OK, value);
        }

        public static ControllerResponse notFound(String message) {
            return error(HttpResponseStatus.NOT_FOUND, message);
        }

        public static ControllerResponse badRequest(String message) {
            return error(HttpResponseStatus.BAD_REQUEST, message);
        }

        public static ControllerResponse error(String message) {
            return error(HttpResponseStatus.INTERNAL_SERVER_ERROR, message);
        }

        public static ControllerResponse error(HttpResponseStatus status, String message) {
            try {
                return json(status, Json.write(Map.of("error", message == null ? "" : message)));
            } catch (JsonProcessingException e) {
                return json(status, "{\"error\":\"" + status.reasonPhrase() + "\"}");
            }
        }

        /**
         * Map a failed operation to its HTTP status.
         */
        public static ControllerResponse failure(OperationResult<?> result) {
            ErrorKind kind = result.error().orElseThrow(
                    () -> new IllegalArgumentException("operation did not fail: " + result));
            return error(statusFor(kind), result.message());
        }

        public static HttpResponseStatus statusFor(ErrorKind kind) {
            return switch (kind) {
                case VALIDATION -> HttpResponseStatus.BAD_REQUEST;
                case NOT_FOUND -> HttpResponseStatus.NOT_FOUND;
                case CONFLICT -> HttpResponseStatus.CONFLICT;
                case PERSISTENCE -> HttpResponseStatus.SERVICE_UNAVAILABLE;
            };
        }
    }
}
