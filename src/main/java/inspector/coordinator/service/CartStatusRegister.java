package inspector.coordinator.service;

import inspector.coordinator.error.OperationResult;
import inspector.coordinator.error.ValidationException;
import inspector.coordinator.event.BroadcastHub;
import inspector.coordinator.event.CartStatusPayload;
import inspector.coordinator.event.EventKind;
import inspector.coordinator.model.CartMode;
import inspector.coordinator.model.CartStatus;
import inspector.coordinator.repository.CartStatusRepository;
import inspector.coordinator.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the latest cart snapshot. The stored row is read once at construction; afterwards
 * reads are served from memory and every update writes through.
 */
public class CartStatusRegister {

    private static final Logger log = LoggerFactory.getLogger(CartStatusRegister.class);

    private final CartStatusRepository repository;
    private final BroadcastHub hub;
    private final AtomicReference<CartStatus> current;

    public CartStatusRegister(CartStatusRepository repository, BroadcastHub hub) {
        this.repository = repository;
        this.hub = hub;
        this.current = new AtomicReference<>(repository.load().orElse(CartStatus.offline()));
    }

    /**
     * Replace the snapshot with new telemetry.
     */
    public OperationResult<CartStatus> update(boolean online, Integer currentStation, String mode,
            Integer batteryLevel, String lastActivity) {
        return OperationResult.of(() -> {
            CartMode cartMode = CartMode.parse(mode);
            if (batteryLevel != null && (batteryLevel < 0 || batteryLevel > 100)) {
                throw new ValidationException("battery_level must be between 0 and 100");
            }
            if (currentStation != null && currentStation < 1) {
                throw new ValidationException("current_station must be a positive integer");
            }
            if (lastActivity != null && lastActivity.length() > CartStatus.MAX_ACTIVITY_LENGTH) {
                throw new ValidationException(
                        "last_activity must be at most " + CartStatus.MAX_ACTIVITY_LENGTH + " characters");
            }

            CartStatus status;
            // cart_status events follow store order
            synchronized (this) {
                status = new CartStatus(online, currentStation, cartMode, batteryLevel, lastActivity,
                        Timestamps.now());
                repository.save(status);
                current.set(status);
                hub.publish(EventKind.CART_STATUS, CartStatusPayload.from(status));
            }

            log.debug("Cart status: online={}, station={}, mode={}, battery={}",
                    online, currentStation, cartMode.wireName(), batteryLevel);
            return status;
        });
    }

    /**
     * Latest snapshot, or the offline default if no telemetry has arrived.
     */
    public CartStatus get() {
        return current.get();
    }
}
