package inspector.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("pending_tasks") Integer pendingTasks,
        @JsonProperty("assigned_tasks") Integer assignedTasks,
        @JsonProperty("subscribers") Integer subscribers,
        @JsonProperty("cart_online") Boolean cartOnline) {

    public static HealthResponse healthy(String uptime, String version, int pendingTasks, int assignedTasks,
            int subscribers, boolean cartOnline) {
        return new HealthResponse("healthy", "ok", uptime, version, pendingTasks, assignedTasks, subscribers,
                cartOnline);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null, null, null);
    }
}
