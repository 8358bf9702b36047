package inspector.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import inspector.coordinator.model.TaskRecord;
import inspector.coordinator.model.result.ResultPayload;

import java.time.Instant;

/**
 * History entry as returned by the history and latest-record endpoints.
 */
public record TaskRecordResponse(
        @JsonProperty("id") long id,
        @JsonProperty("task_id") String taskId,
        @JsonProperty("task_type") int taskType,
        @JsonProperty("station_id") int stationId,
        @JsonProperty("image_ref") String imageRef,
        @JsonProperty("result") ResultPayload result,
        @JsonProperty("status") String status,
        @JsonProperty("confidence") Double confidence,
        @JsonProperty("processing_time") Double processingTime,
        @JsonProperty("timestamp") Instant timestamp) {

    public static TaskRecordResponse from(TaskRecord record) {
        return new TaskRecordResponse(
                record.id(),
                record.taskId(),
                record.taskType().code(),
                record.stationId(),
                record.imageRef(),
                record.result(),
                record.status().wireName(),
                record.confidence(),
                record.processingTime(),
                record.timestamp());
    }
}
