package inspector.coordinator.util;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs the latest action submitted for a key once the key has been quiet for {@code delay}.
 * A new submission for the same key replaces the pending one.
 */
public final class KeyedDebouncer<K> implements AutoCloseable {

    private final ScheduledExecutorService ses;
    private final long delayMs;
    private final Map<K, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();

    public KeyedDebouncer(Duration delay, String threadName) {
        this.delayMs = delay.toMillis();
        this.ses = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void submit(K key, Runnable action) {
        ScheduledFuture<?> previous = pending.get(key);
        if (previous != null) {
            previous.cancel(false);
        }
        ScheduledFuture<?>[] self = new ScheduledFuture<?>[1];
        self[0] = ses.schedule(() -> {
            synchronized (this) {
                pending.remove(key, self[0]);
            }
            action.run();
        }, delayMs, TimeUnit.MILLISECONDS);
        pending.put(key, self[0]);
    }

    public synchronized boolean cancel(K key) {
        ScheduledFuture<?> f = pending.remove(key);
        return f != null && f.cancel(false);
    }

    /**
     * Cancel every action that has not started yet.
     *
     * @return how many were cancelled
     */
    public synchronized int cancelAll() {
        int cancelled = 0;
        for (ScheduledFuture<?> f : pending.values()) {
            if (f.cancel(false)) {
                cancelled++;
            }
        }
        pending.clear();
        return cancelled;
    }

    public int pendingCount() {
        return pending.size();
    }

    @Override
    public void close() {
        cancelAll();
        ses.shutdownNow();
    }
}
