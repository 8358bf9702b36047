package inspector.coordinator.config;

import inspector.coordinator.api.internal.v1.ResultController;
import inspector.coordinator.api.v1.AlertController;
import inspector.coordinator.api.v1.CartController;
import inspector.coordinator.api.v1.HealthController;
import inspector.coordinator.api.v1.HistoryController;
import inspector.coordinator.api.v1.TaskController;
import inspector.coordinator.event.BroadcastHub;
import inspector.coordinator.lock.LockController;
import inspector.coordinator.repository.AlertRepository;
import inspector.coordinator.repository.CartStatusRepository;
import inspector.coordinator.repository.TaskQueueRepository;
import inspector.coordinator.repository.TaskRecordRepository;
import inspector.coordinator.scheduler.QueueJanitor;
import inspector.coordinator.scheduler.Scheduler;
import inspector.coordinator.server.RouterHandler;
import inspector.coordinator.service.AlertEvaluator;
import inspector.coordinator.service.AlertService;
import inspector.coordinator.service.CartStatusRegister;
import inspector.coordinator.service.DispatchService;
import inspector.coordinator.service.HistoryService;
import inspector.coordinator.service.IngestionService;
import inspector.coordinator.store.Database;
import inspector.coordinator.store.JdbcAlertRepository;
import inspector.coordinator.store.JdbcCartStatusRepository;
import inspector.coordinator.store.JdbcTaskQueueRepository;
import inspector.coordinator.store.JdbcTaskRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv());
 * deps.startScheduler(); // start background housekeeping
 * DispatchService dispatch = deps.dispatchService();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final Database database;
    private final BroadcastHub broadcastHub;

    private final TaskQueueRepository taskQueueRepository;
    private final JdbcAlertRepository alertRepository;
    private final TaskRecordRepository taskRecordRepository;
    private final CartStatusRepository cartStatusRepository;

    private final AlertEvaluator alertEvaluator;
    private final DispatchService dispatchService;
    private final IngestionService ingestionService;
    private final HistoryService historyService;
    private final AlertService alertService;
    private final CartStatusRegister cartStatusRegister;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(CoordinatorConfig config) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.broadcastHub = new BroadcastHub(config.subscriberBufferSize());

        // Repositories
        this.taskQueueRepository = new JdbcTaskQueueRepository(database);
        this.alertRepository = new JdbcAlertRepository(database);
        this.taskRecordRepository = new JdbcTaskRecordRepository(database, alertRepository);
        this.cartStatusRepository = new JdbcCartStatusRepository(database);

        // Services
        this.alertEvaluator = new AlertEvaluator();
        this.dispatchService = new DispatchService(taskQueueRepository, broadcastHub);
        this.ingestionService = new IngestionService(taskRecordRepository, taskQueueRepository, alertEvaluator,
                broadcastHub);
        this.historyService = new HistoryService(taskRecordRepository);
        this.alertService = new AlertService(alertRepository);
        this.cartStatusRegister = new CartStatusRegister(cartStatusRepository, broadcastHub);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(CoordinatorConfig config) {
        return new Dependencies(config);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(CoordinatorConfig.fromEnv());
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public BroadcastHub broadcastHub() {
        return broadcastHub;
    }

    public TaskQueueRepository taskQueueRepository() {
        return taskQueueRepository;
    }

    public TaskRecordRepository taskRecordRepository() {
        return taskRecordRepository;
    }

    public AlertRepository alertRepository() {
        return alertRepository;
    }

    public CartStatusRepository cartStatusRepository() {
        return cartStatusRepository;
    }

    public DispatchService dispatchService() {
        return dispatchService;
    }

    public IngestionService ingestionService() {
        return ingestionService;
    }

    public HistoryService historyService() {
        return historyService;
    }

    public AlertService alertService() {
        return alertService;
    }

    public CartStatusRegister cartStatusRegister() {
        return cartStatusRegister;
    }

    /**
     * New lock policy for one observer. The caller owns and closes it.
     */
    public LockController newLockController() {
        return new LockController(broadcastHub, dispatchService, config.lockDebounce());
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * Creates the router on first call.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(new HealthController(database, taskQueueRepository, broadcastHub,
                            cartStatusRegister))
                    .registerController(new TaskController(dispatchService))
                    .registerController(new HistoryController(historyService))
                    .registerController(new AlertController(alertService))
                    .registerController(new CartController(cartStatusRegister))
                    .registerController(new ResultController(dispatchService, ingestionService));
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Start background housekeeping (finished-task and record retention).
     */
    public synchronized void startScheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(new QueueJanitor(dispatchService, historyService, config), config);
        }
        scheduler.start();
    }

    public synchronized Scheduler scheduler() {
        return scheduler;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        if (scheduler != null) {
            scheduler.stop();
        }
        broadcastHub.close();
        database.close();

        log.info("Dependencies closed");
    }
}
