package inspector.coordinator.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import inspector.coordinator.error.PersistenceException;
import inspector.coordinator.model.Alert;
import inspector.coordinator.model.AlertDraft;
import inspector.coordinator.model.HistoryQuery;
import inspector.coordinator.model.RecordStatistics;
import inspector.coordinator.model.Severity;
import inspector.coordinator.model.StoredResult;
import inspector.coordinator.model.TaskRecord;
import inspector.coordinator.model.TaskType;
import inspector.coordinator.model.result.ResultPayloads;
import inspector.coordinator.repository.TaskRecordRepository;
import inspector.coordinator.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static inspector.coordinator.store.JdbcSupport.getDoubleOrNull;
import static inspector.coordinator.store.JdbcSupport.setDoubleOrNull;
import static inspector.coordinator.store.JdbcSupport.setTimestamp;
import static inspector.coordinator.store.JdbcSupport.toTimestamp;
import static inspector.coordinator.store.JdbcSupport.toInstant;

/**
 * JDBC implementation of TaskRecordRepository.
 * Record and alert rows of one ingestion are committed in the same transaction.
 */
public class JdbcTaskRecordRepository implements TaskRecordRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRecordRepository.class);

    private final Database db;
    private final JdbcAlertRepository alerts;

    public JdbcTaskRecordRepository(Database db, JdbcAlertRepository alerts) {
        this.db = db;
        this.alerts = alerts;
    }

    @Override
    public StoredResult append(TaskRecord unstamped, AlertDraft alertDraft) {
        TaskRecord draft = unstamped.withTimestamp(Timestamps.storable(unstamped.timestamp()));
        String insertSql = """
                    INSERT INTO task_records (task_id, task_type, station_id, image_ref, result_data,
                                              status, confidence, processing_time, recorded_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        String resultJson;
        try {
            resultJson = ResultPayloads.toJson(draft.result());
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize result for task " + draft.taskId(), e);
        }

        try (Connection conn = db.getConnection()) {
            try {
                // 1. Record
                long recordId;
                try (PreparedStatement ps = conn.prepareStatement(insertSql, new String[] { "id" })) {
                    ps.setString(1, draft.taskId());
                    ps.setInt(2, draft.taskType().code());
                    ps.setInt(3, draft.stationId());
                    ps.setString(4, draft.imageRef());
                    ps.setString(5, resultJson);
                    ps.setString(6, draft.status().name());
                    setDoubleOrNull(ps, 7, draft.confidence());
                    setDoubleOrNull(ps, 8, draft.processingTime());
                    setTimestamp(ps, 9, draft.timestamp());
                    ps.executeUpdate();

                    try (ResultSet keys = ps.getGeneratedKeys()) {
                        if (!keys.next()) {
                            throw new SQLException("No id generated for task record");
                        }
                        recordId = keys.getLong(1);
                    }
                }

                // 2. Alert, same transaction
                Alert alert = null;
                if (alertDraft != null) {
                    alert = alerts.insert(conn, alertDraft, recordId, draft.timestamp());
                }

                conn.commit();
                log.info("Task record {} stored: task={}, type={}, station={}, status={}",
                        recordId, draft.taskId(), draft.taskType().code(), draft.stationId(), draft.status());
                return new StoredResult(draft.withId(recordId), alert);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to store result for task " + draft.taskId(), e);
        }
    }

    @Override
    public Optional<TaskRecord> findById(long id) {
        String sql = "SELECT * FROM task_records WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, id);
            List<TaskRecord> found = executeQuery(ps);
            return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
        } catch (SQLException e) {
            throw new PersistenceException("Failed to find task record: " + id, e);
        }
    }

    @Override
    public List<TaskRecord> find(HistoryQuery query) {
        StringBuilder sql = new StringBuilder("SELECT * FROM task_records WHERE 1=1");
        List<Object> params = new ArrayList<>();

        if (query.taskType() != null) {
            sql.append(" AND task_type = ?");
            params.add(query.taskType().code());
        }
        if (query.stationId() != null) {
            sql.append(" AND station_id = ?");
            params.add(query.stationId());
        }
        if (query.from() != null) {
            sql.append(" AND recorded_at >= ?");
            params.add(toTimestamp(query.from()));
        }
        if (query.to() != null) {
            sql.append(" AND recorded_at <= ?");
            params.add(toTimestamp(query.to()));
        }
        sql.append(" ORDER BY recorded_at DESC, id DESC LIMIT ? OFFSET ?");
        params.add(query.limit());
        params.add(query.offset());

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql.toString())) {

            for (int i = 0; i < params.size(); i++) {
                ps.setObject(i + 1, params.get(i));
            }
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to query task records", e);
        }
    }

    @Override
    public Optional<TaskRecord> findLatestForStation(int stationId, TaskType taskType) {
        String sql = taskType == null
                ? "SELECT * FROM task_records WHERE station_id = ? ORDER BY recorded_at DESC, id DESC LIMIT 1"
                : "SELECT * FROM task_records WHERE station_id = ? AND task_type = ? ORDER BY recorded_at DESC, id DESC LIMIT 1";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, stationId);
            if (taskType != null) {
                ps.setInt(2, taskType.code());
            }
            List<TaskRecord> found = executeQuery(ps);
            return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
        } catch (SQLException e) {
            throw new PersistenceException("Failed to find latest record for station " + stationId, e);
        }
    }

    @Override
    public RecordStatistics statistics(TaskType taskType, Instant since) {
        String sql = """
                    SELECT
                        COUNT(*) AS total_count,
                        COUNT(CASE WHEN status = 'NORMAL' THEN 1 END) AS normal_count,
                        COUNT(CASE WHEN status = 'WARNING' THEN 1 END) AS warning_count,
                        COUNT(CASE WHEN status = 'DANGER' THEN 1 END) AS danger_count,
                        AVG(confidence) AS avg_confidence,
                        AVG(processing_time) AS avg_processing_time
                    FROM task_records
                    WHERE recorded_at >= ?
                """ + (taskType != null ? " AND task_type = ?" : "");

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, since);
            if (taskType != null) {
                ps.setInt(2, taskType.code());
            }
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return new RecordStatistics(0, 0, 0, 0, null, null);
                }
                return new RecordStatistics(
                        rs.getLong("total_count"),
                        rs.getLong("normal_count"),
                        rs.getLong("warning_count"),
                        rs.getLong("danger_count"),
                        getDoubleOrNull(rs, "avg_confidence"),
                        getDoubleOrNull(rs, "avg_processing_time"));
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to compute record statistics", e);
        }
    }

    @Override
    public int deleteBefore(Instant cutoff) {
        String sql = "DELETE FROM task_records WHERE recorded_at < ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, cutoff);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to delete old task records", e);
        }
    }

    // Helper methods

    private List<TaskRecord> executeQuery(PreparedStatement ps) throws SQLException {
        List<TaskRecord> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private TaskRecord mapRow(ResultSet rs) throws SQLException {
        long id = rs.getLong("id");
        try {
            return new TaskRecord(
                    id,
                    rs.getString("task_id"),
                    TaskType.fromCode(rs.getInt("task_type")),
                    rs.getInt("station_id"),
                    rs.getString("image_ref"),
                    ResultPayloads.fromJson(rs.getString("result_data")),
                    Severity.valueOf(rs.getString("status")),
                    getDoubleOrNull(rs, "confidence"),
                    getDoubleOrNull(rs, "processing_time"),
                    toInstant(rs.getTimestamp("recorded_at")));
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Corrupt result data in task record " + id, e);
        }
    }
}
