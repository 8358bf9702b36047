package inspector.coordinator.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import inspector.coordinator.model.Alert;

import java.time.Instant;

/**
 * Payload of {@code alert}.
 */
public record AlertPayload(
        @JsonProperty("alert_id") long alertId,
        @JsonProperty("level") String level,
        @JsonProperty("alert_type") String alertType,
        @JsonProperty("message") String message,
        @JsonProperty("record_id") Long recordId,
        @JsonProperty("timestamp") Instant timestamp) {

    public static AlertPayload from(Alert alert) {
        return new AlertPayload(
                alert.id(),
                alert.level().wireName(),
                alert.alertType(),
                alert.message(),
                alert.recordId(),
                alert.timestamp());
    }
}
