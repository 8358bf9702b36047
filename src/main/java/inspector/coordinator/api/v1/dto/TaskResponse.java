package inspector.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import inspector.coordinator.model.Task;

import java.time.Instant;
import java.util.Map;

/**
 * Queue entry as returned by the task endpoints.
 */
public record TaskResponse(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("station_id") int stationId,
        @JsonProperty("task_type") int taskType,
        @JsonProperty("status") String status,
        @JsonProperty("params") Map<String, Object> params,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("assigned_at") Instant assignedAt,
        @JsonProperty("completed_at") Instant completedAt) {

    public static TaskResponse from(Task task) {
        return new TaskResponse(
                task.id(),
                task.stationId(),
                task.taskType().code(),
                task.status().wireName(),
                task.params(),
                task.createdAt(),
                task.assignedAt(),
                task.completedAt());
    }
}
