package inspector.coordinator.store;

import inspector.coordinator.error.PersistenceException;
import inspector.coordinator.model.CartMode;
import inspector.coordinator.model.CartStatus;
import inspector.coordinator.repository.CartStatusRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

import static inspector.coordinator.store.JdbcSupport.getIntOrNull;
import static inspector.coordinator.store.JdbcSupport.setIntOrNull;
import static inspector.coordinator.store.JdbcSupport.setTimestamp;
import static inspector.coordinator.store.JdbcSupport.toInstant;

/**
 * JDBC implementation of CartStatusRepository. The snapshot lives in row id = 1.
 */
public class JdbcCartStatusRepository implements CartStatusRepository {

    private static final int SINGLETON_ID = 1;

    private final Database db;

    public JdbcCartStatusRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(CartStatus status) {
        String sql = """
                    MERGE INTO cart_status (id, online, current_station, mode, battery_level, last_activity, updated_at)
                    KEY (id)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, SINGLETON_ID);
            ps.setBoolean(2, status.online());
            setIntOrNull(ps, 3, status.currentStation());
            ps.setString(4, status.mode().name());
            setIntOrNull(ps, 5, status.batteryLevel());
            ps.setString(6, status.lastActivity());
            setTimestamp(ps, 7, status.timestamp());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to save cart status", e);
        }
    }

    @Override
    public Optional<CartStatus> load() {
        String sql = "SELECT * FROM cart_status WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, SINGLETON_ID);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new CartStatus(
                        rs.getBoolean("online"),
                        getIntOrNull(rs, "current_station"),
                        CartMode.valueOf(rs.getString("mode")),
                        getIntOrNull(rs, "battery_level"),
                        rs.getString("last_activity"),
                        toInstant(rs.getTimestamp("updated_at"))));
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load cart status", e);
        }
    }
}
