package inspector.coordinator.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import inspector.coordinator.model.CartStatus;

import java.time.Instant;

/**
 * Wire form of a cart status snapshot, used for {@code cart_status} events and the status endpoint.
 */
public record CartStatusPayload(
        @JsonProperty("online") boolean online,
        @JsonProperty("current_station") Integer currentStation,
        @JsonProperty("mode") String mode,
        @JsonProperty("battery_level") Integer batteryLevel,
        @JsonProperty("last_activity") String lastActivity,
        @JsonProperty("timestamp") Instant timestamp) {

    public static CartStatusPayload from(CartStatus status) {
        return new CartStatusPayload(
                status.online(),
                status.currentStation(),
                status.mode().wireName(),
                status.batteryLevel(),
                status.lastActivity(),
                status.timestamp());
    }
}
