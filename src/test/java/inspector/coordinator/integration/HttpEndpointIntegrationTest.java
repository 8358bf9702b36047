package inspector.coordinator.integration;

import com.fasterxml.jackson.databind.JsonNode;
import inspector.coordinator.config.CoordinatorConfig;
import inspector.coordinator.config.Dependencies;
import inspector.coordinator.server.CoordinatorServer;
import inspector.coordinator.util.Json;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the coordinator over real HTTP and WebSocket connections.
 */
class HttpEndpointIntegrationTest {

    private static Dependencies deps;
    private static CoordinatorServer server;
    private static HttpClient client;
    private static String base;

    @BeforeAll
    static void start() throws Exception {
        deps = Dependencies.create(CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-http;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withLockDebounce(Duration.ofMillis(100)));
        server = new CoordinatorServer(deps);
        int port = server.start(0);
        base = "http://localhost:" + port;
        client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    }

    @AfterAll
    static void stop() {
        if (server != null)
            server.close();
        if (deps != null)
            deps.close();
    }

    @BeforeEach
    void cleanTables() throws Exception {
        try (var conn = deps.database().getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM alert_log");
            st.execute("DELETE FROM task_records");
            st.execute("DELETE FROM task_queue");
            conn.commit();
        }
    }

    private static HttpResponse<String> get(String path) throws Exception {
        return client.send(HttpRequest.newBuilder(URI.create(base + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private static HttpResponse<String> post(String path, String body) throws Exception {
        return client.send(HttpRequest.newBuilder(URI.create(base + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build(), HttpResponse.BodyHandlers.ofString());
    }

    private static HttpResponse<String> delete(String path) throws Exception {
        return client.send(HttpRequest.newBuilder(URI.create(base + path)).DELETE().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private static JsonNode json(HttpResponse<String> response) throws Exception {
        return Json.mapper().readTree(response.body());
    }

    private static String addTask(int station, int type) throws Exception {
        HttpResponse<String> response = post("/api/v1/tasks",
                "{\"station_id\": " + station + ", \"task_type\": " + type + "}");
        assertEquals(201, response.statusCode(), response.body());
        return json(response).get("task_id").asText();
    }

    @Test
    void taskLifecycleOverHttp() throws Exception {
        String taskId = addTask(2, 2);

        JsonNode list = json(get("/api/v1/tasks"));
        assertEquals(1, list.get("count").asInt());
        assertEquals(taskId, list.get("tasks").get(0).get("task_id").asText());
        assertEquals("pending", list.get("tasks").get(0).get("status").asText());

        HttpResponse<String> assigned = post("/internal/v1/tasks/" + taskId + "/assign", "");
        assertEquals(200, assigned.statusCode(), assigned.body());
        assertEquals("assigned", json(assigned).get("status").asText());

        HttpResponse<String> again = post("/internal/v1/tasks/" + taskId + "/assign", "");
        assertEquals(409, again.statusCode());
        assertTrue(json(again).has("error"));

        HttpResponse<String> ingested = post("/internal/v1/results", """
                {"task_id": "%s", "task_type": 2, "station_id": 2,
                 "result": {"max_temperature": 85.0}, "image_ref": "img/2.jpg", "processing_time": 0.8}
                """.formatted(taskId));
        assertEquals(201, ingested.statusCode(), ingested.body());
        long recordId = json(ingested).get("record_id").asLong();

        JsonNode task = json(get("/api/v1/tasks/" + taskId));
        assertEquals("completed", task.get("status").asText());

        JsonNode history = json(get("/api/v1/history?task_type=2&station_id=2"));
        assertEquals(1, history.get("count").asInt());
        JsonNode record = history.get("records").get(0);
        assertEquals(recordId, record.get("id").asLong());
        assertEquals("danger", record.get("status").asText());
        assertEquals(85.0, record.get("result").get("max_temperature").asDouble(), 1e-9);

        JsonNode latest = json(get("/api/v1/stations/2/latest"));
        assertEquals(recordId, latest.get("id").asLong());
        assertEquals(404, get("/api/v1/stations/7/latest").statusCode());

        JsonNode alerts = json(get("/api/v1/alerts"));
        assertEquals(1, alerts.get("count").asInt());
        long alertId = alerts.get("alerts").get(0).get("id").asLong();
        assertEquals("high_temperature", alerts.get("alerts").get(0).get("alert_type").asText());

        HttpResponse<String> handled = post("/api/v1/alerts/" + alertId + "/handle", "");
        assertEquals(200, handled.statusCode());
        assertTrue(json(handled).get("handled").asBoolean());
        assertEquals(0, json(get("/api/v1/alerts")).get("count").asInt());

        JsonNode stats = json(get("/api/v1/statistics?task_type=2&days=1"));
        assertEquals(1, stats.get("total_count").asLong());
        assertEquals(1, stats.get("danger_count").asLong());
        assertEquals(400, get("/api/v1/statistics?days=0").statusCode());

        JsonNode cleared = json(post("/api/v1/tasks/clear?older_than_seconds=0", ""));
        assertEquals(1, cleared.get("cleared").asInt());
        assertEquals(404, get("/api/v1/tasks/" + taskId).statusCode());
    }

    @Test
    void rejectsBadRequests() throws Exception {
        assertEquals(400, post("/api/v1/tasks", "{\"station_id\": 1, \"task_type\": 9}").statusCode());
        assertEquals(400, post("/api/v1/tasks", "{\"station_id\": 1").statusCode());
        assertEquals(400, post("/api/v1/tasks", "").statusCode());
        assertEquals(400, get("/api/v1/tasks?limit=abc").statusCode());
        assertEquals(400, post("/api/v1/tasks/clear", "").statusCode());
        assertEquals(400, get("/api/v1/history?from=yesterday").statusCode());
        assertEquals(400, post("/internal/v1/results",
                "{\"task_id\": \"t\", \"task_type\": 2, \"station_id\": 1, \"result\": \"hot\"}").statusCode());
        assertEquals(404, get("/api/v1/tasks/task-missing").statusCode());
        assertEquals(404, delete("/api/v1/tasks/task-missing").statusCode());
        assertEquals(404, post("/api/v1/alerts/424242/handle", "").statusCode());
        assertEquals(404, get("/api/v1/unknown").statusCode());
    }

    @Test
    void deleteRemovesTask() throws Exception {
        String taskId = addTask(1, 1);

        HttpResponse<String> deleted = delete("/api/v1/tasks/" + taskId);
        assertEquals(200, deleted.statusCode());
        assertTrue(json(deleted).get("success").asBoolean());
        assertEquals(0, json(get("/api/v1/tasks")).get("count").asInt());
    }

    @Test
    void cartStatusAndHealth() throws Exception {
        HttpResponse<String> updated = post("/api/v1/cart/status",
                "{\"online\": true, \"current_station\": 3, \"mode\": \"loop\", \"battery_level\": 90}");
        assertEquals(200, updated.statusCode(), updated.body());

        JsonNode cart = json(get("/api/v1/cart/status"));
        assertTrue(cart.get("online").asBoolean());
        assertEquals("loop", cart.get("mode").asText());
        assertEquals(90, cart.get("battery_level").asInt());

        assertEquals(400, post("/api/v1/cart/status", "{\"mode\": \"flying\"}").statusCode());

        HttpResponse<String> health = get("/api/v1/health");
        assertEquals(200, health.statusCode());
        JsonNode body = json(health);
        assertEquals("healthy", body.get("status").asText());
        assertTrue(body.get("cart_online").asBoolean());
    }

    @Test
    void observerReceivesEventsAndDrivesLock() throws Exception {
        Observer observer = new Observer();
        WebSocket ws = client.newWebSocketBuilder()
                .buildAsync(URI.create("ws://localhost:" + server.port() + CoordinatorServer.EVENTS_PATH), observer)
                .get(5, TimeUnit.SECONDS);
        try {
            ws.sendText("{\"action\":\"ping\"}", true).get(5, TimeUnit.SECONDS);
            assertEquals("pong", observer.next().get("kind").asText());

            String taskId = addTask(2, 2);
            post("/internal/v1/tasks/" + taskId + "/assign", "");
            post("/internal/v1/results", """
                    {"task_id": "%s", "task_type": 2, "station_id": 2, "result": {"max_temperature": 90.0}}
                    """.formatted(taskId));

            List<String> kinds = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                kinds.add(observer.next().get("kind").asText());
            }
            assertEquals(List.of("task_queue_update", "task_queue_update", "task_result", "alert",
                    "task_queue_update"), kinds);

            ws.sendText("{\"action\":\"lock\",\"enabled\":true}", true).get(5, TimeUnit.SECONDS);
            JsonNode state = observer.next();
            assertEquals("lock_state", state.get("kind").asText());
            assertTrue(state.get("payload").get("enabled").asBoolean());

            ws.sendText("{\"action\":\"lock_type\",\"task_type\":2,\"enabled\":true}", true)
                    .get(5, TimeUnit.SECONDS);
            state = observer.next();
            assertEquals(2, state.get("payload").get("locked_task_types").get(0).asInt());

            String second = addTask(2, 2);
            post("/internal/v1/results", """
                    {"task_id": "%s", "task_type": 2, "station_id": 2, "result": {"max_temperature": 30.0}}
                    """.formatted(second));

            long deadline = System.currentTimeMillis() + 3000;
            int pending = 0;
            while (System.currentTimeMillis() < deadline) {
                pending = json(get("/api/v1/tasks")).get("count").asInt();
                if (pending == 1) {
                    break;
                }
                Thread.sleep(20);
            }
            assertEquals(1, pending, "locked type is requeued for the same station");

            ws.sendText("{\"action\":\"bogus\"}", true).get(5, TimeUnit.SECONDS);
            JsonNode error = observer.nextOfKind("error");
            assertTrue(error.get("payload").get("message").asText().contains("bogus"));
        } finally {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "done").get(5, TimeUnit.SECONDS);
        }
    }

    private static final class Observer implements WebSocket.Listener {

        private final BlockingQueue<String> frames = new LinkedBlockingQueue<>();
        private final StringBuilder partial = new StringBuilder();

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                frames.add(partial.toString());
                partial.setLength(0);
            }
            webSocket.request(1);
            return null;
        }

        JsonNode next() throws Exception {
            String frame = frames.poll(5, TimeUnit.SECONDS);
            assertNotNull(frame, "no frame received");
            return Json.mapper().readTree(frame);
        }

        JsonNode nextOfKind(String kind) throws Exception {
            long deadline = System.currentTimeMillis() + 5000;
            while (System.currentTimeMillis() < deadline) {
                JsonNode frame = next();
                if (kind.equals(frame.get("kind").asText())) {
                    return frame;
                }
            }
            fail("no " + kind + " frame received");
            return null;
        }
    }
}
