package inspector.coordinator.model.result;

import com.fasterxml.jackson.databind.JsonNode;
import inspector.coordinator.error.ValidationException;
import inspector.coordinator.model.TaskType;
import inspector.coordinator.util.Json;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResultPayloadsTest {

    private static JsonNode json(String text) throws Exception {
        return Json.mapper().readTree(text);
    }

    @Test
    void gaugeReadingFromWire() throws Exception {
        ResultPayload payload = ResultPayloads.fromWire(TaskType.GAUGE_READING, json("""
                {"value": 0.42, "unit": "MPa", "min_range": 0, "max_range": 1.6,
                 "confidence": 0.93, "status": "warning", "extra": "ignored"}
                """));

        GaugeReading gauge = assertInstanceOf(GaugeReading.class, payload);
        assertEquals(0.42, gauge.value());
        assertEquals("MPa", gauge.unit());
        assertEquals(1.6, gauge.maxRange());
        assertEquals(0.93, payload.confidence());
        assertEquals("warning", payload.reportedStatus());
        assertFalse(payload.isFailure());
    }

    @Test
    void bothSmokeTypesShareOneVariant() throws Exception {
        JsonNode wire = json("{\"has_smoke\": true, \"density\": \"high\", \"status\": \"danger\"}");

        SmokeCheck a = assertInstanceOf(SmokeCheck.class, ResultPayloads.fromWire(TaskType.SMOKE_A, wire));
        SmokeCheck b = assertInstanceOf(SmokeCheck.class, ResultPayloads.fromWire(TaskType.SMOKE_B, wire));
        assertTrue(a.hasSmoke());
        assertEquals(a, b);
    }

    @Test
    void objectDescriptionDefaultsItems() throws Exception {
        ObjectDescription description = assertInstanceOf(ObjectDescription.class,
                ResultPayloads.fromWire(TaskType.OBJECT_DESCRIPTION, json("{\"description\": \"a ladder\"}")));

        assertEquals("a ladder", description.description());
        assertEquals(List.of(), description.items());
        assertNull(description.reportedStatus());
    }

    @Test
    void errorFieldSelectsFailureRegardlessOfType() throws Exception {
        ResultPayload payload = ResultPayloads.fromWire(TaskType.TEMPERATURE,
                json("{\"error\": \"camera offline\", \"error_code\": \"E_CAM\"}"));

        ProcessingFailure failure = assertInstanceOf(ProcessingFailure.class, payload);
        assertEquals("camera offline", failure.error());
        assertTrue(payload.isFailure());
    }

    @Test
    void nullErrorFieldIsNotAFailure() throws Exception {
        ResultPayload payload = ResultPayloads.fromWire(TaskType.TEMPERATURE,
                json("{\"max_temperature\": 55.5, \"error\": null}"));

        assertInstanceOf(TemperatureReading.class, payload);
    }

    @Test
    void storedJsonCarriesKindAndReadsBack() throws Exception {
        TemperatureReading reading = new TemperatureReading(85.0, 61.2, 24.0);

        String stored = ResultPayloads.toJson(reading);
        assertEquals("temperature", Json.mapper().readTree(stored).get("kind").asText());
        assertEquals(reading, ResultPayloads.fromJson(stored));
    }

    @Test
    void rejectsMissingOrNonObjectResult() throws Exception {
        assertThrows(ValidationException.class, () -> ResultPayloads.fromWire(TaskType.GAUGE_READING, null));
        assertThrows(ValidationException.class,
                () -> ResultPayloads.fromWire(TaskType.GAUGE_READING, json("null")));
        assertThrows(ValidationException.class,
                () -> ResultPayloads.fromWire(TaskType.GAUGE_READING, json("[1, 2]")));
    }

    @Test
    void wrongFieldTypesAreDroppedNotRejected() throws Exception {
        TemperatureReading temperature = assertInstanceOf(TemperatureReading.class,
                ResultPayloads.fromWire(TaskType.TEMPERATURE,
                        json("{\"max_temperature\": \"hot\", \"avg_temperature\": \"41.5\"}")));
        assertNull(temperature.maxTemperature());
        assertEquals(41.5, temperature.avgTemperature());

        SmokeCheck smoke = assertInstanceOf(SmokeCheck.class, ResultPayloads.fromWire(TaskType.SMOKE_A,
                json("{\"has_smoke\": \"maybe\", \"density\": [1], \"status\": \"danger\"}")));
        assertFalse(smoke.hasSmoke());
        assertNull(smoke.density());
        assertEquals("danger", smoke.reportedStatus());

        GaugeReading gauge = assertInstanceOf(GaugeReading.class, ResultPayloads.fromWire(TaskType.GAUGE_READING,
                json("{\"value\": \"broken\", \"unit\": 7, \"status\": {\"x\": 1}}")));
        assertNull(gauge.value());
        assertEquals("7", gauge.unit());
        assertNull(gauge.reportedStatus());
    }

    @Test
    void scalarsAreCoercedToDeclaredTypes() throws Exception {
        SmokeCheck smoke = assertInstanceOf(SmokeCheck.class,
                ResultPayloads.fromWire(TaskType.SMOKE_B, json("{\"has_smoke\": \"TRUE\", \"confidence\": \"0.8\"}")));
        assertTrue(smoke.hasSmoke());
        assertEquals(0.8, smoke.confidence());

        ObjectDescription object = assertInstanceOf(ObjectDescription.class,
                ResultPayloads.fromWire(TaskType.OBJECT_DESCRIPTION,
                        json("{\"description\": \"pallet\", \"items\": [\"box\", 3, {\"a\": 1}, null]}")));
        assertEquals(List.of("box", "3"), object.items());

        ProcessingFailure failure = assertInstanceOf(ProcessingFailure.class,
                ResultPayloads.fromWire(TaskType.GAUGE_READING, json("{\"error\": {\"code\": 5}}")));
        assertEquals("{\"code\":5}", failure.error());
    }
}
