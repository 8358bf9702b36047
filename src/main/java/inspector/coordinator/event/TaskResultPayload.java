package inspector.coordinator.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import inspector.coordinator.model.TaskRecord;
import inspector.coordinator.model.result.ResultPayload;

import java.time.Instant;

/**
 * Payload of {@code task_result}, built from the stored record.
 */
public record TaskResultPayload(
        @JsonProperty("record_id") long recordId,
        @JsonProperty("task_id") String taskId,
        @JsonProperty("task_type") int taskType,
        @JsonProperty("station_id") int stationId,
        @JsonProperty("status") String status,
        @JsonProperty("result") ResultPayload result,
        @JsonProperty("image_ref") String imageRef,
        @JsonProperty("processing_time") Double processingTime,
        @JsonProperty("timestamp") Instant timestamp) {

    public static TaskResultPayload from(TaskRecord record) {
        return new TaskResultPayload(
                record.id(),
                record.taskId(),
                record.taskType().code(),
                record.stationId(),
                record.status().wireName(),
                record.result(),
                record.imageRef(),
                record.processingTime(),
                record.timestamp());
    }
}
