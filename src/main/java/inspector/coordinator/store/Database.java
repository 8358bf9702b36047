package inspector.coordinator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import inspector.coordinator.config.CoordinatorConfig;
import inspector.coordinator.error.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling; connections are handed out with auto-commit off.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(CoordinatorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("inspector-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- TASK QUEUE ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS task_queue (
                            seq             BIGINT GENERATED BY DEFAULT AS IDENTITY,
                            task_id         VARCHAR(64) PRIMARY KEY,
                            station_id      INT NOT NULL,
                            task_type       INT NOT NULL,
                            status          VARCHAR(20) DEFAULT 'PENDING' NOT NULL,
                            params          CLOB,
                            created_at      TIMESTAMP NOT NULL,
                            assigned_at     TIMESTAMP,
                            completed_at    TIMESTAMP
                        );
                    """);

            // ---------- TASK RECORDS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS task_records (
                            id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            task_id         VARCHAR(64) NOT NULL,
                            task_type       INT NOT NULL,
                            station_id      INT NOT NULL,
                            image_ref       VARCHAR(1024),
                            result_data     CLOB NOT NULL,
                            status          VARCHAR(20) DEFAULT 'NORMAL' NOT NULL,
                            confidence      DOUBLE,
                            processing_time DOUBLE,
                            recorded_at     TIMESTAMP NOT NULL
                        );
                    """);

            // ---------- ALERTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS alert_log (
                            id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            record_id       BIGINT,
                            alert_level     VARCHAR(20) NOT NULL,
                            alert_type      VARCHAR(64) NOT NULL,
                            message         VARCHAR(2048),
                            handled         BOOLEAN DEFAULT FALSE NOT NULL,
                            raised_at       TIMESTAMP NOT NULL
                        );
                    """);

            // ---------- CART STATUS (single row, id = 1) ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS cart_status (
                            id              INT PRIMARY KEY,
                            online          BOOLEAN NOT NULL,
                            current_station INT,
                            mode            VARCHAR(20) NOT NULL,
                            battery_level   INT,
                            last_activity   VARCHAR(256),
                            updated_at      TIMESTAMP NOT NULL
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_queue_status_created ON task_queue(status, created_at, seq);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_queue_station_type ON task_queue(station_id, task_type);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_records_type_ts ON task_records(task_type, recorded_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_records_station_ts ON task_records(station_id, recorded_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_alerts_handled ON alert_log(handled, raised_at);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new PersistenceException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
