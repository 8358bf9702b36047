package inspector.coordinator.event;

import inspector.coordinator.error.PushDeliveryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Fan-out of state-change events to any number of observers.
 *
 * <p>Publishing never blocks: each subscriber has its own bounded buffer, and a subscriber whose
 * buffer is full is dropped. Every subscriber sees events in publish order. Push subscribers are
 * served from a shared daemon pool, one drain task at a time per subscriber. A subscriber that
 * must know when it has been dropped passes a drop handler; closing a subscription does not
 * invoke it.
 */
public class BroadcastHub implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BroadcastHub.class);

    public static final int DEFAULT_BUFFER_SIZE = 256;

    private final int bufferSize;
    private final Map<Long, Subscription> subscriptions = new ConcurrentHashMap<>();
    private final AtomicLong subscriptionIds = new AtomicLong();
    private final AtomicLong sequence = new AtomicLong();
    private final ExecutorService delivery;

    public BroadcastHub() {
        this(DEFAULT_BUFFER_SIZE);
    }

    public BroadcastHub(int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be positive: " + bufferSize);
        }
        this.bufferSize = bufferSize;
        AtomicInteger threads = new AtomicInteger();
        this.delivery = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "hub-delivery-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Pull-style subscription; the caller polls or drains it.
     */
    public Subscription subscribe() {
        return register(null, null);
    }

    /**
     * Push-style subscription; {@code listener} is called for every event.
     */
    public Subscription subscribe(EventListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener is required");
        }
        return register(listener, null);
    }

    /**
     * Push-style subscription that is told when the hub drops it.
     *
     * @param onDrop called once, on the publishing or delivery thread, after an overflow or a
     *               listener failure removed the subscription
     */
    public Subscription subscribe(EventListener listener, Consumer<PushDeliveryException> onDrop) {
        if (listener == null) {
            throw new IllegalArgumentException("listener is required");
        }
        if (onDrop == null) {
            throw new IllegalArgumentException("onDrop is required");
        }
        return register(listener, onDrop);
    }

    private Subscription register(EventListener listener, Consumer<PushDeliveryException> onDrop) {
        Subscription sub = new Subscription(subscriptionIds.incrementAndGet(), bufferSize, listener, onDrop, this);
        subscriptions.put(sub.id(), sub);
        log.debug("Subscription {} opened ({} active)", sub.id(), subscriptions.size());
        return sub;
    }

    /**
     * Deliver an event to every current subscriber.
     */
    public Event publish(EventKind kind, Object payload) {
        Event event = new Event(sequence.incrementAndGet(), kind, payload, Instant.now());

        for (Subscription sub : subscriptions.values()) {
            if (!sub.offer(event)) {
                if (!sub.isClosed()) {
                    drop(sub, new PushDeliveryException(sub.id(),
                            "buffer full (" + bufferSize + " events), dropping subscriber"));
                }
                continue;
            }
            if (sub.isPush()) {
                scheduleDrain(sub);
            }
        }
        return event;
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    void unsubscribe(Subscription sub) {
        if (sub.markClosed()) {
            subscriptions.remove(sub.id());
            log.debug("Subscription {} closed ({} active)", sub.id(), subscriptions.size());
        }
    }

    private void drop(Subscription sub, PushDeliveryException reason) {
        if (sub.markClosed()) {
            subscriptions.remove(sub.id());
            log.warn("Dropped subscription {}: {}", sub.id(), reason.getMessage(), reason.getCause());
            notifyDropped(sub, reason);
        }
    }

    private static void notifyDropped(Subscription sub, PushDeliveryException reason) {
        Consumer<PushDeliveryException> onDrop = sub.onDrop();
        if (onDrop == null) {
            return;
        }
        try {
            onDrop.accept(reason);
        } catch (RuntimeException e) {
            log.error("Drop handler of subscription {} failed", sub.id(), e);
        }
    }

    private void scheduleDrain(Subscription sub) {
        if (!sub.tryStartDrain()) {
            return;
        }
        try {
            delivery.execute(() -> drainLoop(sub));
        } catch (RejectedExecutionException e) {
            sub.endDrain();
            drop(sub, new PushDeliveryException(sub.id(), "hub is shut down", e));
        }
    }

    private void drainLoop(Subscription sub) {
        while (true) {
            Event event;
            while (!sub.isClosed() && (event = sub.next()) != null) {
                try {
                    sub.listener().onEvent(event);
                } catch (Exception e) {
                    sub.endDrain();
                    drop(sub, new PushDeliveryException(sub.id(), "listener failed: " + e.getMessage(), e));
                    return;
                }
            }
            sub.endDrain();
            // A publish may have landed between the last poll and endDrain
            if (sub.isClosed() || !sub.hasBuffered() || !sub.tryStartDrain()) {
                return;
            }
        }
    }

    @Override
    public void close() {
        List<Subscription> open = new ArrayList<>(subscriptions.values());
        for (Subscription sub : open) {
            unsubscribe(sub);
        }
        delivery.shutdown();
        try {
            if (!delivery.awaitTermination(2, TimeUnit.SECONDS)) {
                delivery.shutdownNow();
            }
        } catch (InterruptedException e) {
            delivery.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Broadcast hub closed ({} subscriptions released)", open.size());
    }
}
