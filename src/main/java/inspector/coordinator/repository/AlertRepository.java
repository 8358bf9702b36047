package inspector.coordinator.repository;

import inspector.coordinator.model.Alert;

import java.util.List;
import java.util.Optional;

/**
 * Alert log. Rows are inserted together with their record by {@link TaskRecordRepository#append}.
 */
public interface AlertRepository {

    Optional<Alert> findById(long id);

    Optional<Alert> findByRecordId(long recordId);

    /**
     * Unhandled alerts, newest first.
     */
    List<Alert> findUnhandled(int limit);

    /**
     * @return true if the alert exists (handled flag set, idempotently)
     */
    boolean markHandled(long id);
}
