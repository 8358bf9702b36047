package inspector.coordinator.event;

import java.util.Locale;

/**
 * Why the task queue changed.
 */
public enum QueueUpdateReason {
    ADDED,
    ASSIGNED,
    COMPLETED,
    FAILED,
    REMOVED,
    CLEARED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
