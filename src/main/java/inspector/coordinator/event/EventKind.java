package inspector.coordinator.event;

import java.util.Locale;

/**
 * The four kinds of state change pushed to observers.
 */
public enum EventKind {
    TASK_RESULT,
    TASK_QUEUE_UPDATE,
    CART_STATUS,
    ALERT;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
