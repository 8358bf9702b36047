package inspector.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result reported by the vision service.
 * POST /internal/v1/results
 *
 * {@code result} is kept as a raw tree; its shape depends on {@code task_type}.
 */
public record IngestResultRequest(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("task_type") Integer taskType,
        @JsonProperty("station_id") Integer stationId,
        @JsonProperty("result") JsonNode result,
        @JsonProperty("image_ref") String imageRef,
        @JsonProperty("processing_time") Double processingTime) {
}
