package inspector.coordinator.model;

import java.time.Instant;

/**
 * Alert raised for a non-normal result. {@code recordId} is a lookup link only.
 */
public record Alert(
        long id,
        Long recordId,
        Severity level,
        String alertType,
        String message,
        boolean handled,
        Instant timestamp) {

    public static final int MAX_MESSAGE_LENGTH = 2048;
}
