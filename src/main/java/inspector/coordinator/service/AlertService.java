package inspector.coordinator.service;

import inspector.coordinator.error.NotFoundException;
import inspector.coordinator.error.OperationResult;
import inspector.coordinator.error.ValidationException;
import inspector.coordinator.model.Alert;
import inspector.coordinator.repository.AlertRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Operator-facing alert handling.
 */
public class AlertService {

    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    public static final int MAX_LIMIT = 500;

    private final AlertRepository alerts;

    public AlertService(AlertRepository alerts) {
        this.alerts = alerts;
    }

    /**
     * Unhandled alerts, newest first.
     */
    public OperationResult<List<Alert>> unhandled(int limit) {
        return OperationResult.of(() -> {
            if (limit <= 0) {
                throw new ValidationException("limit must be positive");
            }
            return alerts.findUnhandled(Math.min(limit, MAX_LIMIT));
        });
    }

    /**
     * Mark an alert handled. Handling an already handled alert succeeds.
     */
    public OperationResult<Alert> markHandled(long alertId) {
        return OperationResult.of(() -> {
            if (!alerts.markHandled(alertId)) {
                throw new NotFoundException("alert not found: " + alertId);
            }
            log.info("Alert {} handled", alertId);
            return alerts.findById(alertId)
                    .orElseThrow(() -> new NotFoundException("alert not found: " + alertId));
        });
    }
}
