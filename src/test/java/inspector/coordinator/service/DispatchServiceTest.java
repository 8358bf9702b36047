package inspector.coordinator.service;

import inspector.coordinator.config.CoordinatorConfig;
import inspector.coordinator.error.ErrorKind;
import inspector.coordinator.error.OperationResult;
import inspector.coordinator.event.BroadcastHub;
import inspector.coordinator.event.Event;
import inspector.coordinator.event.EventKind;
import inspector.coordinator.event.QueueUpdatePayload;
import inspector.coordinator.event.Subscription;
import inspector.coordinator.model.Task;
import inspector.coordinator.model.TaskStatus;
import inspector.coordinator.model.TaskType;
import inspector.coordinator.store.Database;
import inspector.coordinator.store.JdbcTaskQueueRepository;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DispatchServiceTest {

    private static Database db;
    private static JdbcTaskQueueRepository queue;

    private BroadcastHub hub;
    private DispatchService dispatch;
    private Subscription events;

    @BeforeAll
    static void setup() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-dispatch;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000;"
                        + "MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        queue = new JdbcTaskQueueRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void init() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM task_queue");
            conn.commit();
        }
        hub = new BroadcastHub();
        dispatch = new DispatchService(queue, hub);
        events = hub.subscribe();
    }

    @AfterEach
    void closeHub() {
        hub.close();
    }

    private String enqueue(int station, int type) {
        OperationResult<String> result = dispatch.enqueue(station, type, Map.of());
        assertTrue(result.isSuccess(), result.toString());
        return result.value();
    }

    private QueueUpdatePayload nextQueueUpdate() throws InterruptedException {
        Event event = events.poll(Duration.ofSeconds(1));
        assertNotNull(event, "expected an event");
        assertEquals(EventKind.TASK_QUEUE_UPDATE, event.kind());
        return (QueueUpdatePayload) event.payload();
    }

    @Test
    void enqueueCreatesPendingTaskAndPublishes() throws Exception {
        String id = dispatch.enqueue(2, 2, Map.of("priority", 1)).value();

        assertTrue(id.startsWith("task-"));
        Task task = dispatch.find(id).value();
        assertEquals(TaskStatus.PENDING, task.status());
        assertEquals(TaskType.TEMPERATURE, task.taskType());
        assertNotNull(task.createdAt());

        QueueUpdatePayload update = nextQueueUpdate();
        assertEquals("added", update.reason());
        assertEquals(id, update.taskId());
    }

    @Test
    void enqueueValidatesInput() {
        assertTrue(dispatch.enqueue(1, 0, Map.of()).failedWith(ErrorKind.VALIDATION));
        assertTrue(dispatch.enqueue(1, 6, Map.of()).failedWith(ErrorKind.VALIDATION));
        assertTrue(dispatch.enqueue(1, null, Map.of()).failedWith(ErrorKind.VALIDATION));
        assertTrue(dispatch.enqueue(0, 1, Map.of()).failedWith(ErrorKind.VALIDATION));
        assertTrue(dispatch.enqueue(null, 1, Map.of()).failedWith(ErrorKind.VALIDATION));

        assertTrue(events.drain().isEmpty(), "rejected enqueues publish nothing");
    }

    @Test
    void oversizedTaskIdIsRejectedBeforeTheStore() {
        String tooLong = "t".repeat(65);

        assertTrue(dispatch.assign(tooLong).failedWith(ErrorKind.VALIDATION));
        assertTrue(dispatch.delete(tooLong).failedWith(ErrorKind.VALIDATION));
        assertTrue(dispatch.find(tooLong).failedWith(ErrorKind.VALIDATION));
        assertTrue(dispatch.find("t".repeat(64)).failedWith(ErrorKind.NOT_FOUND));
    }

    @Test
    void idsAreUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            ids.add(enqueue(1 + (i % 5), 1 + (i % 5)));
        }
        assertEquals(200, ids.size());
    }

    @Test
    void listPendingOrderAndLimits() {
        String first = enqueue(1, 1);
        String second = enqueue(2, 2);
        String third = enqueue(3, 3);

        List<String> ids = dispatch.listPending(10).value().stream().map(Task::id).toList();
        assertEquals(List.of(first, second, third), ids);

        assertEquals(1, dispatch.listPending(1).value().size());
        assertTrue(dispatch.listPending(0).failedWith(ErrorKind.VALIDATION));
        assertTrue(dispatch.listPending(-5).failedWith(ErrorKind.VALIDATION));
        assertTrue(dispatch.listPending(10_000).isSuccess());
    }

    @Test
    void assignIsPendingOnly() throws Exception {
        String id = enqueue(1, 1);
        events.drain();

        OperationResult<Task> assigned = dispatch.assign(id);
        assertTrue(assigned.isSuccess());
        assertEquals(TaskStatus.ASSIGNED, assigned.value().status());
        assertEquals("assigned", nextQueueUpdate().reason());

        assertTrue(dispatch.assign(id).failedWith(ErrorKind.CONFLICT));
        assertTrue(dispatch.assign("task-unknown").failedWith(ErrorKind.NOT_FOUND));
        assertTrue(dispatch.assign(" ").failedWith(ErrorKind.VALIDATION));
        assertTrue(events.drain().isEmpty());
    }

    @Test
    void concurrentAssignHasExactlyOneWinner() throws Exception {
        String id = enqueue(1, 1);
        int callers = 12;

        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<OperationResult<Task>>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return dispatch.assign(id);
                }));
            }
            start.countDown();

            int successes = 0;
            for (Future<OperationResult<Task>> f : futures) {
                if (f.get(30, TimeUnit.SECONDS).isSuccess()) {
                    successes++;
                }
            }
            assertEquals(1, successes);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(TaskStatus.ASSIGNED, dispatch.find(id).value().status());
    }

    @Test
    void deleteRemovesAnyState() throws Exception {
        String pending = enqueue(1, 1);
        String assigned = enqueue(2, 1);
        dispatch.assign(assigned);
        events.drain();

        assertTrue(dispatch.delete(pending).isSuccess());
        assertTrue(dispatch.delete(assigned).isSuccess());
        assertEquals("removed", nextQueueUpdate().reason());
        assertEquals("removed", nextQueueUpdate().reason());

        assertTrue(dispatch.delete(pending).failedWith(ErrorKind.NOT_FOUND));
        assertTrue(dispatch.find(pending).failedWith(ErrorKind.NOT_FOUND));
    }

    @Test
    void clearCompletedLeavesOpenTasks() throws Exception {
        String pending = enqueue(1, 1);
        String assigned = enqueue(2, 1);
        String done = enqueue(3, 1);
        dispatch.assign(assigned);
        queue.finish(done, TaskStatus.COMPLETED, Instant.now().minusSeconds(3600));
        events.drain();

        OperationResult<Integer> cleared = dispatch.clearCompleted(Duration.ofMinutes(10));
        assertEquals(1, cleared.value());

        QueueUpdatePayload update = nextQueueUpdate();
        assertEquals("cleared", update.reason());
        assertEquals(1, update.count());

        assertTrue(dispatch.find(pending).isSuccess());
        assertTrue(dispatch.find(assigned).isSuccess());
        assertTrue(dispatch.find(done).failedWith(ErrorKind.NOT_FOUND));

        assertEquals(0, dispatch.clearCompleted(Duration.ZERO).value());
        assertTrue(events.drain().isEmpty(), "nothing cleared, nothing published");
        assertTrue(dispatch.clearCompleted(Duration.ofSeconds(-1)).failedWith(ErrorKind.VALIDATION));
    }

    @Test
    void transitionsNeverGoBackwards() {
        String id = enqueue(1, 1);
        dispatch.assign(id);
        queue.finish(id, TaskStatus.COMPLETED, Instant.now());

        assertTrue(dispatch.assign(id).failedWith(ErrorKind.CONFLICT));
        assertEquals(TaskStatus.COMPLETED, dispatch.find(id).value().status());
    }
}
