package inspector.coordinator.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import inspector.coordinator.error.PersistenceException;
import inspector.coordinator.error.ValidationException;
import inspector.coordinator.model.AssignResult;
import inspector.coordinator.model.FinishResult;
import inspector.coordinator.model.Task;
import inspector.coordinator.model.TaskStatus;
import inspector.coordinator.model.TaskType;
import inspector.coordinator.repository.TaskQueueRepository;
import inspector.coordinator.util.Json;
import inspector.coordinator.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static inspector.coordinator.store.JdbcSupport.setTimestamp;
import static inspector.coordinator.store.JdbcSupport.toInstant;

/**
 * JDBC implementation of TaskQueueRepository.
 * Status transitions lock the row ({@code FOR UPDATE}) and re-check the expected status
 * in the UPDATE itself, so concurrent transitions on one task serialize.
 */
public class JdbcTaskQueueRepository implements TaskQueueRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskQueueRepository.class);

    private static final String LOCK_SQL = "SELECT status FROM task_queue WHERE task_id = ? FOR UPDATE";

    private final Database db;

    public JdbcTaskQueueRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Task task) {
        String sql = """
                    INSERT INTO task_queue (task_id, station_id, task_type, status, params,
                                            created_at, assigned_at, completed_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;

        String params = writeParams(task);

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, task.id());
            ps.setInt(2, task.stationId());
            ps.setInt(3, task.taskType().code());
            ps.setString(4, task.status().name());
            ps.setString(5, params);
            setTimestamp(ps, 6, task.createdAt() != null ? task.createdAt() : Timestamps.now());
            setTimestamp(ps, 7, task.assignedAt());
            setTimestamp(ps, 8, task.completedAt());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to save task: " + task.id(), e);
        }
    }

    @Override
    public Optional<Task> findById(String taskId) {
        String sql = "SELECT * FROM task_queue WHERE task_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to find task: " + taskId, e);
        }
    }

    @Override
    public List<Task> findPending(int limit) {
        String sql = """
                    SELECT * FROM task_queue
                    WHERE status = 'PENDING'
                    ORDER BY created_at, seq
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to list pending tasks", e);
        }
    }

    @Override
    public int countByStatus(TaskStatus status) {
        String sql = "SELECT COUNT(*) FROM task_queue WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to count tasks by status: " + status, e);
        }
    }

    @Override
    public AssignResult assign(String taskId, Instant assignedAt) {
        String updateSql = """
                    UPDATE task_queue
                    SET status = 'ASSIGNED', assigned_at = ?
                    WHERE task_id = ? AND status = 'PENDING'
                """;

        try (Connection conn = db.getConnection()) {
            try {
                TaskStatus current = lockStatus(conn, taskId);
                if (current == null) {
                    conn.rollback();
                    return AssignResult.NOT_FOUND;
                }
                if (current != TaskStatus.PENDING) {
                    conn.rollback();
                    return AssignResult.NOT_PENDING;
                }

                int updated;
                try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                    setTimestamp(ps, 1, assignedAt);
                    ps.setString(2, taskId);
                    updated = ps.executeUpdate();
                }

                if (updated == 0) {
                    // Another transaction won between lock and update
                    conn.rollback();
                    return AssignResult.NOT_PENDING;
                }

                conn.commit();
                log.debug("Task {} assigned", taskId);
                return AssignResult.ASSIGNED;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to assign task: " + taskId, e);
        }
    }

    @Override
    public FinishResult finish(String taskId, TaskStatus terminal, Instant completedAt) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("finish requires a terminal status, got " + terminal);
        }

        String updateSql = """
                    UPDATE task_queue
                    SET status = ?, completed_at = ?
                    WHERE task_id = ? AND status IN ('PENDING', 'ASSIGNED')
                """;

        try (Connection conn = db.getConnection()) {
            try {
                TaskStatus current = lockStatus(conn, taskId);
                if (current == null) {
                    conn.rollback();
                    return FinishResult.NOT_FOUND;
                }
                if (current.isTerminal()) {
                    conn.rollback();
                    return FinishResult.ALREADY_TERMINAL;
                }

                int updated;
                try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                    ps.setString(1, terminal.name());
                    setTimestamp(ps, 2, completedAt);
                    ps.setString(3, taskId);
                    updated = ps.executeUpdate();
                }

                if (updated == 0) {
                    conn.rollback();
                    return FinishResult.ALREADY_TERMINAL;
                }

                conn.commit();
                log.debug("Task {} -> {}", taskId, terminal);
                return FinishResult.FINISHED;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to finish task: " + taskId, e);
        }
    }

    @Override
    public boolean delete(String taskId) {
        String sql = "DELETE FROM task_queue WHERE task_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to delete task: " + taskId, e);
        }
    }

    @Override
    public int deleteFinishedBefore(Instant cutoff) {
        String sql = """
                    DELETE FROM task_queue
                    WHERE status IN ('COMPLETED', 'FAILED')
                    AND completed_at < ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, cutoff);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to clear finished tasks", e);
        }
    }

    // Helper methods

    private static TaskStatus lockStatus(Connection conn, String taskId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(LOCK_SQL)) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? TaskStatus.valueOf(rs.getString("status")) : null;
            }
        }
    }

    private static String writeParams(Task task) {
        if (task.params().isEmpty()) {
            return null;
        }
        try {
            return Json.write(task.params());
        } catch (JsonProcessingException e) {
            throw new ValidationException("params are not serializable: " + e.getOriginalMessage());
        }
    }

    private List<Task> executeQuery(PreparedStatement ps) throws SQLException {
        List<Task> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Task mapRow(ResultSet rs) throws SQLException {
        String taskId = rs.getString("task_id");
        try {
            return Task.builder()
                    .id(taskId)
                    .stationId(rs.getInt("station_id"))
                    .taskType(TaskType.fromCode(rs.getInt("task_type")))
                    .status(TaskStatus.valueOf(rs.getString("status")))
                    .params(Json.readMap(rs.getString("params")))
                    .createdAt(toInstant(rs.getTimestamp("created_at")))
                    .assignedAt(toInstant(rs.getTimestamp("assigned_at")))
                    .completedAt(toInstant(rs.getTimestamp("completed_at")))
                    .build();
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Corrupt params for task " + taskId, e);
        }
    }
}
