package inspector.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import inspector.coordinator.model.Alert;

import java.time.Instant;

/**
 * Alert log entry.
 */
public record AlertResponse(
        @JsonProperty("id") long id,
        @JsonProperty("record_id") Long recordId,
        @JsonProperty("level") String level,
        @JsonProperty("alert_type") String alertType,
        @JsonProperty("message") String message,
        @JsonProperty("handled") boolean handled,
        @JsonProperty("timestamp") Instant timestamp) {

    public static AlertResponse from(Alert alert) {
        return new AlertResponse(
                alert.id(),
                alert.recordId(),
                alert.level().wireName(),
                alert.alertType(),
                alert.message(),
                alert.handled(),
                alert.timestamp());
    }
}
