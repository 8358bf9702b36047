package inspector.coordinator.service;

import inspector.coordinator.config.CoordinatorConfig;
import inspector.coordinator.error.ErrorKind;
import inspector.coordinator.model.Alert;
import inspector.coordinator.model.AlertDraft;
import inspector.coordinator.model.HistoryQuery;
import inspector.coordinator.model.RecordStatistics;
import inspector.coordinator.model.Severity;
import inspector.coordinator.model.TaskRecord;
import inspector.coordinator.model.TaskType;
import inspector.coordinator.model.result.GaugeReading;
import inspector.coordinator.model.result.TemperatureReading;
import inspector.coordinator.store.Database;
import inspector.coordinator.store.JdbcAlertRepository;
import inspector.coordinator.store.JdbcTaskRecordRepository;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * History, statistics and alert handling over a shared record store.
 */
class HistoryServiceTest {

    private static Database db;
    private static JdbcAlertRepository alertRepository;
    private static JdbcTaskRecordRepository records;

    private final HistoryService history = new HistoryService(records);
    private final AlertService alerts = new AlertService(alertRepository);

    @BeforeAll
    static void setup() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-history;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        alertRepository = new JdbcAlertRepository(db);
        records = new JdbcTaskRecordRepository(db, alertRepository);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTables() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM alert_log");
            st.execute("DELETE FROM task_records");
            conn.commit();
        }
    }

    private static TaskRecord temperature(String taskId, int station, double max, Severity severity, Instant at) {
        return TaskRecord.draft(taskId, TaskType.TEMPERATURE, station, null, TemperatureReading.ofMax(max),
                severity, 2.0, at);
    }

    @Test
    void historyFiltersByStation() {
        Instant now = Instant.now();
        records.append(temperature("task-a", 1, 30, Severity.NORMAL, now.minusSeconds(20)), null);
        records.append(temperature("task-b", 2, 30, Severity.NORMAL, now.minusSeconds(10)), null);
        records.append(temperature("task-c", 1, 30, Severity.NORMAL, now), null);

        List<TaskRecord> station1 = history.history(new HistoryQuery(null, 1, null, null, 10, 0)).value();
        assertEquals(List.of("task-c", "task-a"), station1.stream().map(TaskRecord::taskId).toList());

        assertTrue(history.history(null).failedWith(ErrorKind.VALIDATION));
    }

    @Test
    void statisticsCountsSeveritiesInWindow() {
        Instant now = Instant.now();
        records.append(temperature("task-1", 1, 30, Severity.NORMAL, now), null);
        records.append(temperature("task-2", 1, 65, Severity.WARNING, now), null);
        records.append(temperature("task-3", 1, 90, Severity.DANGER, now), null);
        records.append(temperature("task-old", 1, 90, Severity.DANGER, now.minus(10, ChronoUnit.DAYS)), null);
        records.append(TaskRecord.draft("task-g", TaskType.GAUGE_READING, 2, null,
                new GaugeReading(1.0, "MPa", 0.0, 2.0, 0.5, "normal"), Severity.NORMAL, 1.0, now), null);

        RecordStatistics temps = history.statistics(TaskType.TEMPERATURE, HistoryService.DEFAULT_STATISTICS_DAYS)
                .value();
        assertEquals(3, temps.totalCount());
        assertEquals(1, temps.normalCount());
        assertEquals(1, temps.warningCount());
        assertEquals(1, temps.dangerCount());
        assertEquals(2.0, temps.avgProcessingTime(), 1e-9);

        RecordStatistics all = history.statistics(null, 30).value();
        assertEquals(5, all.totalCount());

        assertTrue(history.statistics(null, 0).failedWith(ErrorKind.VALIDATION));
        assertTrue(history.statistics(null, HistoryService.MAX_STATISTICS_DAYS + 1).failedWith(ErrorKind.VALIDATION));
    }

    @Test
    void latestForStation() {
        Instant now = Instant.now();
        records.append(temperature("task-old", 3, 30, Severity.NORMAL, now.minusSeconds(60)), null);
        records.append(temperature("task-new", 3, 31, Severity.NORMAL, now), null);

        assertEquals("task-new", history.latestForStation(3, null).value().taskId());
        assertEquals("task-new", history.latestForStation(3, TaskType.TEMPERATURE).value().taskId());
        assertTrue(history.latestForStation(3, TaskType.SMOKE_A).failedWith(ErrorKind.NOT_FOUND));
        assertTrue(history.latestForStation(9, null).failedWith(ErrorKind.NOT_FOUND));
        assertTrue(history.latestForStation(0, null).failedWith(ErrorKind.VALIDATION));
        assertTrue(history.latestForStation(null, null).failedWith(ErrorKind.VALIDATION));
    }

    @Test
    void cleanupRemovesOnlyExpiredRecords() {
        Instant now = Instant.now();
        records.append(temperature("task-old", 1, 30, Severity.NORMAL, now.minus(100, ChronoUnit.DAYS)), null);
        records.append(temperature("task-new", 1, 30, Severity.NORMAL, now), null);

        assertEquals(1, history.cleanupOldRecords(Duration.ofDays(90)));
        assertEquals(0, history.cleanupOldRecords(Duration.ofDays(90)));
        assertEquals("task-new", history.latestForStation(1, null).value().taskId());
    }

    @Test
    void unhandledAlertsAndMarkHandled() {
        Instant now = Instant.now();
        long first = records.append(temperature("task-1", 1, 70, Severity.WARNING, now.minusSeconds(5)),
                new AlertDraft(Severity.WARNING, AlertEvaluator.HIGH_TEMPERATURE, "Station 1: warm")).alert().id();
        long second = records.append(temperature("task-2", 1, 90, Severity.DANGER, now),
                new AlertDraft(Severity.DANGER, AlertEvaluator.HIGH_TEMPERATURE, "Station 1: hot")).alert().id();

        List<Alert> open = alerts.unhandled(10).value();
        assertEquals(List.of(second, first), open.stream().map(Alert::id).toList());

        Alert handled = alerts.markHandled(second).value();
        assertTrue(handled.handled());
        assertEquals(List.of(first), alerts.unhandled(10).value().stream().map(Alert::id).toList());

        assertTrue(alerts.markHandled(second).isSuccess(), "handling twice is harmless");
        assertTrue(alerts.markHandled(999_999L).failedWith(ErrorKind.NOT_FOUND));
        assertTrue(alerts.unhandled(0).failedWith(ErrorKind.VALIDATION));
    }
}
