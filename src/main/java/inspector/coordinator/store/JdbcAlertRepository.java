package inspector.coordinator.store;

import inspector.coordinator.error.PersistenceException;
import inspector.coordinator.model.Alert;
import inspector.coordinator.model.AlertDraft;
import inspector.coordinator.model.Severity;
import inspector.coordinator.repository.AlertRepository;
import inspector.coordinator.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static inspector.coordinator.store.JdbcSupport.getLongOrNull;
import static inspector.coordinator.store.JdbcSupport.setLongOrNull;
import static inspector.coordinator.store.JdbcSupport.setTimestamp;
import static inspector.coordinator.store.JdbcSupport.toInstant;

/**
 * JDBC implementation of AlertRepository.
 */
public class JdbcAlertRepository implements AlertRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcAlertRepository.class);

    private final Database db;

    public JdbcAlertRepository(Database db) {
        this.db = db;
    }

    /**
     * Insert an alert on the caller's connection, without committing.
     * Used by the record repository to keep record and alert in one transaction.
     */
    Alert insert(Connection conn, AlertDraft draft, Long recordId, Instant raisedAt) throws SQLException {
        String sql = """
                    INSERT INTO alert_log (record_id, alert_level, alert_type, message, handled, raised_at)
                    VALUES (?, ?, ?, ?, FALSE, ?)
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql, new String[] { "id" })) {
            setLongOrNull(ps, 1, recordId);
            ps.setString(2, draft.level().name());
            ps.setString(3, draft.alertType());
            ps.setString(4, draft.message());
            Instant stamped = Timestamps.storable(raisedAt);
            setTimestamp(ps, 5, stamped);
            ps.executeUpdate();

            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No id generated for alert");
                }
                long id = keys.getLong(1);
                return new Alert(id, recordId, draft.level(), draft.alertType(), draft.message(), false, stamped);
            }
        }
    }

    @Override
    public Optional<Alert> findById(long id) {
        return findOne("SELECT * FROM alert_log WHERE id = ?", id);
    }

    @Override
    public Optional<Alert> findByRecordId(long recordId) {
        return findOne("SELECT * FROM alert_log WHERE record_id = ? ORDER BY id LIMIT 1", recordId);
    }

    @Override
    public List<Alert> findUnhandled(int limit) {
        String sql = """
                    SELECT * FROM alert_log
                    WHERE handled = FALSE
                    ORDER BY raised_at DESC, id DESC
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            List<Alert> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapRow(rs));
                }
            }
            return results;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to list unhandled alerts", e);
        }
    }

    @Override
    public boolean markHandled(long id) {
        String sql = "UPDATE alert_log SET handled = TRUE WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, id);
            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Alert {} marked handled", id);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to mark alert handled: " + id, e);
        }
    }

    private Optional<Alert> findOne(String sql, long key) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to find alert", e);
        }
    }

    private static Alert mapRow(ResultSet rs) throws SQLException {
        return new Alert(
                rs.getLong("id"),
                getLongOrNull(rs, "record_id"),
                Severity.valueOf(rs.getString("alert_level")),
                rs.getString("alert_type"),
                rs.getString("message"),
                rs.getBoolean("handled"),
                toInstant(rs.getTimestamp("raised_at")));
    }
}
