package inspector.coordinator.error;

/**
 * Raised inside the broadcast hub when a subscriber cannot accept an event.
 * Logged and never propagated to publishers.
 */
public class PushDeliveryException extends RuntimeException {

    private final long subscriptionId;

    public PushDeliveryException(long subscriptionId, String message) {
        super(message);
        this.subscriptionId = subscriptionId;
    }

    public PushDeliveryException(long subscriptionId, String message, Throwable cause) {
        super(message, cause);
        this.subscriptionId = subscriptionId;
    }

    public long subscriptionId() {
        return subscriptionId;
    }
}
