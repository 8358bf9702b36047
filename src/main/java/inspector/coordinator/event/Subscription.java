package inspector.coordinator.event;

import inspector.coordinator.error.PushDeliveryException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * One observer's view of the event stream.
 * Events are buffered in a bounded FIFO queue; when the buffer is full the hub closes the
 * subscription instead of blocking the publisher.
 */
public final class Subscription implements AutoCloseable {

    private final long id;
    private final BlockingQueue<Event> buffer;
    private final EventListener listener;
    private final Consumer<PushDeliveryException> onDrop;
    private final BroadcastHub hub;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean draining = new AtomicBoolean(false);

    Subscription(long id, int capacity, EventListener listener, Consumer<PushDeliveryException> onDrop,
            BroadcastHub hub) {
        this.id = id;
        this.buffer = new ArrayBlockingQueue<>(capacity);
        this.listener = listener;
        this.onDrop = onDrop;
        this.hub = hub;
    }

    public long id() {
        return id;
    }

    /**
     * Wait up to {@code timeout} for the next event.
     *
     * @return the next event, or null on timeout or when the subscription is closed and drained
     */
    public Event poll(Duration timeout) throws InterruptedException {
        if (closed.get() && buffer.isEmpty()) {
            return null;
        }
        return buffer.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Take every event buffered right now.
     */
    public List<Event> drain() {
        List<Event> events = new ArrayList<>();
        buffer.drainTo(events);
        return events;
    }

    public int buffered() {
        return buffer.size();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        hub.unsubscribe(this);
    }

    // Hub side

    boolean offer(Event event) {
        return !closed.get() && buffer.offer(event);
    }

    Event next() {
        return buffer.poll();
    }

    boolean hasBuffered() {
        return !buffer.isEmpty();
    }

    boolean isPush() {
        return listener != null;
    }

    EventListener listener() {
        return listener;
    }

    Consumer<PushDeliveryException> onDrop() {
        return onDrop;
    }

    boolean markClosed() {
        return closed.compareAndSet(false, true);
    }

    boolean tryStartDrain() {
        return draining.compareAndSet(false, true);
    }

    void endDrain() {
        draining.set(false);
    }
}
