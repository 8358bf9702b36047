package inspector.coordinator.service;

import inspector.coordinator.error.NotFoundException;
import inspector.coordinator.error.OperationResult;
import inspector.coordinator.error.ValidationException;
import inspector.coordinator.model.HistoryQuery;
import inspector.coordinator.model.RecordStatistics;
import inspector.coordinator.model.TaskRecord;
import inspector.coordinator.model.TaskType;
import inspector.coordinator.repository.TaskRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Read side of the record history: filtered lookups, per-station latest result and
 * severity statistics. Also owns retention cleanup of old records.
 */
public class HistoryService {

    private static final Logger log = LoggerFactory.getLogger(HistoryService.class);

    public static final int DEFAULT_STATISTICS_DAYS = 7;
    public static final int MAX_STATISTICS_DAYS = 365;

    private final TaskRecordRepository records;

    public HistoryService(TaskRecordRepository records) {
        this.records = records;
    }

    public OperationResult<List<TaskRecord>> history(HistoryQuery query) {
        return OperationResult.of(() -> {
            if (query == null) {
                throw new ValidationException("query is required");
            }
            return records.find(query);
        });
    }

    /**
     * Severity counts over the trailing {@code days}, optionally for one task type.
     */
    public OperationResult<RecordStatistics> statistics(TaskType taskType, int days) {
        return OperationResult.of(() -> {
            if (days <= 0 || days > MAX_STATISTICS_DAYS) {
                throw new ValidationException("days must be between 1 and " + MAX_STATISTICS_DAYS);
            }
            return records.statistics(taskType, Instant.now().minus(Duration.ofDays(days)));
        });
    }

    public OperationResult<TaskRecord> latestForStation(Integer stationId, TaskType taskType) {
        return OperationResult.of(() -> {
            if (stationId == null || stationId < 1) {
                throw new ValidationException("station_id must be a positive integer");
            }
            return records.findLatestForStation(stationId, taskType)
                    .orElseThrow(() -> new NotFoundException("no records for station " + stationId));
        });
    }

    /**
     * Delete records older than {@code retention}.
     *
     * @return number of records deleted
     */
    public int cleanupOldRecords(Duration retention) {
        int deleted = records.deleteBefore(Instant.now().minus(retention));
        if (deleted > 0) {
            log.info("Deleted {} task records older than {}", deleted, retention);
        }
        return deleted;
    }
}
