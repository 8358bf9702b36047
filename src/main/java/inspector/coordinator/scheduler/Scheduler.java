package inspector.coordinator.scheduler;

import inspector.coordinator.config.CoordinatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the queue janitor on a fixed interval.
 * Uses a single-threaded executor so sweeps never overlap.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final QueueJanitor janitor;
    private final CoordinatorConfig config;

    private volatile boolean running = false;

    public Scheduler(QueueJanitor janitor, CoordinatorConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "inspector-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.janitor = janitor;
        this.config = config;
    }

    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long intervalMs = config.cleanupInterval().toMillis();
        executor.scheduleAtFixedRate(janitor, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Queue janitor scheduled every {}ms", intervalMs);
    }

    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public QueueJanitor janitor() {
        return janitor;
    }
}
