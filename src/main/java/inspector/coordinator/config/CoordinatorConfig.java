package inspector.coordinator.config;

import java.time.Duration;

/**
 * Configuration holder for Coordinator settings.
 * All settings have sensible defaults.
 */
public final class CoordinatorConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/database/inspection;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 5000;
    private String serverHost = "0.0.0.0";
    private int maxContentLength = 10 * 1024 * 1024;

    // Push settings
    private int subscriberBufferSize = 256;
    private Duration lockDebounce = Duration.ofMillis(500);

    // Housekeeping settings
    private Duration completedTaskRetention = Duration.ofDays(1);
    private Duration recordRetention = Duration.ofDays(90);
    private Duration cleanupInterval = Duration.ofMinutes(10);

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        CoordinatorConfig config = new CoordinatorConfig();

        // Override from environment variables
        String dbUrl = System.getenv("INSPECTOR_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("INSPECTOR_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String host = System.getenv("INSPECTOR_HOST");
        if (host != null && !host.isBlank()) {
            config.serverHost = host;
        }

        String buffer = System.getenv("INSPECTOR_SUBSCRIBER_BUFFER");
        if (buffer != null && !buffer.isBlank()) {
            config.subscriberBufferSize = Integer.parseInt(buffer);
        }

        String debounceMs = System.getenv("INSPECTOR_LOCK_DEBOUNCE_MS");
        if (debounceMs != null && !debounceMs.isBlank()) {
            config.lockDebounce = Duration.ofMillis(Long.parseLong(debounceMs));
        }

        String retentionHours = System.getenv("INSPECTOR_COMPLETED_RETENTION_HOURS");
        if (retentionHours != null && !retentionHours.isBlank()) {
            config.completedTaskRetention = Duration.ofHours(Long.parseLong(retentionHours));
        }

        String recordDays = System.getenv("INSPECTOR_RECORD_RETENTION_DAYS");
        if (recordDays != null && !recordDays.isBlank()) {
            config.recordRetention = Duration.ofDays(Long.parseLong(recordDays));
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public int maxContentLength() {
        return maxContentLength;
    }

    public int subscriberBufferSize() {
        return subscriberBufferSize;
    }

    public Duration lockDebounce() {
        return lockDebounce;
    }

    public Duration completedTaskRetention() {
        return completedTaskRetention;
    }

    public Duration recordRetention() {
        return recordRetention;
    }

    public Duration cleanupInterval() {
        return cleanupInterval;
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CoordinatorConfig withSubscriberBufferSize(int size) {
        this.subscriberBufferSize = size;
        return this;
    }

    public CoordinatorConfig withLockDebounce(Duration debounce) {
        this.lockDebounce = debounce;
        return this;
    }

    public CoordinatorConfig withCompletedTaskRetention(Duration retention) {
        this.completedTaskRetention = retention;
        return this;
    }

    public CoordinatorConfig withRecordRetention(Duration retention) {
        this.recordRetention = retention;
        return this;
    }

    public CoordinatorConfig withCleanupInterval(Duration interval) {
        this.cleanupInterval = interval;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", subscriberBuffer=" + subscriberBufferSize +
                ", lockDebounce=" + lockDebounce +
                ", completedRetention=" + completedTaskRetention +
                '}';
    }
}
