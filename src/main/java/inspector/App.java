package inspector;

import inspector.coordinator.config.CoordinatorConfig;
import inspector.coordinator.config.Dependencies;
import inspector.coordinator.server.CoordinatorServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Process entry point. Wires dependencies, starts housekeeping and the HTTP/WebSocket server,
 * and shuts everything down on JVM exit.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws Exception {
        CoordinatorConfig config = CoordinatorConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        CoordinatorServer server = new CoordinatorServer(deps);
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
            deps.close();
            stopped.countDown();
        }, "inspector-shutdown"));

        try {
            deps.startScheduler();
            int port = server.start();
            log.info("Inspector coordinator started on port {}", port);
        } catch (Exception e) {
            log.error("Failed to start coordinator", e);
            server.stop();
            deps.close();
            System.exit(1);
        }

        stopped.await();
    }
}
