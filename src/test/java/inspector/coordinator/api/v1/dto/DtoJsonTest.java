package inspector.coordinator.api.v1.dto;

import com.fasterxml.jackson.databind.JsonNode;
import inspector.coordinator.model.Task;
import inspector.coordinator.model.TaskStatus;
import inspector.coordinator.model.TaskType;
import inspector.coordinator.util.Json;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DtoJsonTest {

    @Test
    void addTaskRequestFromJson() throws Exception {
        AddTaskRequest req = Json.mapper().readValue("""
                {"station_id": 4, "task_type": 3, "params": {"zoom": 2}, "extra": true}
                """, AddTaskRequest.class);

        assertEquals(4, req.stationId());
        assertEquals(3, req.taskType());
        assertEquals(2, req.params().get("zoom"));
    }

    @Test
    void cartStatusRequestDefaultsOnline() throws Exception {
        CartStatusRequest req = Json.mapper().readValue("{\"mode\": \"idle\"}", CartStatusRequest.class);

        assertTrue(req.isOnline());
        assertNull(req.batteryLevel());

        CartStatusRequest offline = Json.mapper().readValue("{\"online\": false, \"mode\": \"idle\"}",
                CartStatusRequest.class);
        assertFalse(offline.isOnline());
    }

    @Test
    void taskResponseUsesWireNames() throws Exception {
        Task task = Task.builder()
                .id("task-1")
                .stationId(5)
                .taskType(TaskType.OBJECT_DESCRIPTION)
                .status(TaskStatus.ASSIGNED)
                .params(Map.of())
                .createdAt(Instant.parse("2024-05-01T08:00:00Z"))
                .assignedAt(Instant.parse("2024-05-01T08:00:05Z"))
                .build();

        JsonNode json = Json.mapper().readTree(Json.write(TaskResponse.from(task)));

        assertEquals("task-1", json.get("task_id").asText());
        assertEquals(5, json.get("task_type").asInt());
        assertEquals("assigned", json.get("status").asText());
        assertEquals("2024-05-01T08:00:00Z", json.get("created_at").asText());
        assertTrue(json.get("completed_at").isNull());
    }
}
