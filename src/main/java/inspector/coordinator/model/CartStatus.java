package inspector.coordinator.model;

import java.time.Instant;

/**
 * Snapshot of the cart's live status. Overwritten in place on every telemetry update.
 */
public record CartStatus(
        boolean online,
        Integer currentStation,
        CartMode mode,
        Integer batteryLevel,
        String lastActivity,
        Instant timestamp) {

    public static final int MAX_ACTIVITY_LENGTH = 256;

    /** Snapshot returned before any telemetry has arrived */
    public static CartStatus offline() {
        return new CartStatus(false, null, CartMode.IDLE, null, null, Instant.EPOCH);
    }
}
