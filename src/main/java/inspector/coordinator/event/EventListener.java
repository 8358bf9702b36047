package inspector.coordinator.event;

/**
 * Push-style consumer. Invoked on a hub delivery thread, never concurrently for one subscription.
 * Throwing drops the subscription.
 */
@FunctionalInterface
public interface EventListener {

    void onEvent(Event event) throws Exception;
}
