package inspector.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Request DTO for adding a task.
 * POST /api/v1/tasks
 */
public record AddTaskRequest(
        @JsonProperty("station_id") Integer stationId,
        @JsonProperty("task_type") Integer taskType,
        @JsonProperty("params") Map<String, Object> params) {
}
