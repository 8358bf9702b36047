package inspector.coordinator.repository;

import inspector.coordinator.model.AlertDraft;
import inspector.coordinator.model.HistoryQuery;
import inspector.coordinator.model.RecordStatistics;
import inspector.coordinator.model.StoredResult;
import inspector.coordinator.model.TaskRecord;
import inspector.coordinator.model.TaskType;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only history of ingested results (Record Store).
 */
public interface TaskRecordRepository {

    /**
     * Append a record and, if given, its alert in a single transaction.
     * Either both rows are committed or neither is.
     *
     * @param draft record without id
     * @param alert alert to link to the new record, or null
     */
    StoredResult append(TaskRecord draft, AlertDraft alert);

    Optional<TaskRecord> findById(long id);

    /**
     * Records matching the query, newest first.
     */
    List<TaskRecord> find(HistoryQuery query);

    /**
     * Most recent record for a station, optionally restricted to one task type.
     */
    Optional<TaskRecord> findLatestForStation(int stationId, TaskType taskType);

    /**
     * Severity counts and averages for records at or after {@code since}.
     *
     * @param taskType restrict to one type, or null for all
     */
    RecordStatistics statistics(TaskType taskType, Instant since);

    /**
     * Retention cleanup. Alerts keep their (now dangling) record link.
     *
     * @return number of records removed
     */
    int deleteBefore(Instant cutoff);
}
