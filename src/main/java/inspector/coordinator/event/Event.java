package inspector.coordinator.event;

import java.time.Instant;

/**
 * One published state change. {@code payload} is one of the payload records in this package.
 */
public record Event(long sequence, EventKind kind, Object payload, Instant timestamp) {
}
