package inspector.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Cart telemetry update.
 * POST /api/v1/cart/status
 */
public record CartStatusRequest(
        @JsonProperty("online") Boolean online,
        @JsonProperty("current_station") Integer currentStation,
        @JsonProperty("mode") String mode,
        @JsonProperty("battery_level") Integer batteryLevel,
        @JsonProperty("last_activity") String lastActivity) {

    /** Telemetry that omits {@code online} comes from a live cart */
    @JsonIgnore
    public boolean isOnline() {
        return online == null || online;
    }
}
