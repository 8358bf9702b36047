package inspector.coordinator.scheduler;

import inspector.coordinator.config.CoordinatorConfig;
import inspector.coordinator.error.OperationResult;
import inspector.coordinator.service.DispatchService;
import inspector.coordinator.service.HistoryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background housekeeping:
 * - removes finished queue entries past the completed-task retention
 * - removes task records past the record retention
 *
 * Pending and assigned entries are never touched.
 */
public class QueueJanitor implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(QueueJanitor.class);

    private final DispatchService dispatch;
    private final HistoryService history;
    private final CoordinatorConfig config;

    public QueueJanitor(DispatchService dispatch, HistoryService history, CoordinatorConfig config) {
        this.dispatch = dispatch;
        this.history = history;
        this.config = config;
    }

    @Override
    public void run() {
        try {
            sweep();
        } catch (Exception e) {
            log.error("Queue janitor error", e);
        }
    }

    /**
     * @return finished queue entries plus records removed
     */
    public int sweep() {
        OperationResult<Integer> cleared = dispatch.clearCompleted(config.completedTaskRetention());
        int tasks = 0;
        if (cleared.isSuccess()) {
            tasks = cleared.value();
        } else {
            log.warn("Clearing finished tasks failed: {}", cleared.message());
        }

        int records = history.cleanupOldRecords(config.recordRetention());

        if (tasks > 0 || records > 0) {
            log.info("Queue janitor: {} finished tasks, {} old records removed", tasks, records);
        } else {
            log.debug("Queue janitor: nothing to remove");
        }
        return tasks + records;
    }
}
