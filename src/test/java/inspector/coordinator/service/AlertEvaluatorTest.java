package inspector.coordinator.service;

import inspector.coordinator.model.Alert;
import inspector.coordinator.model.Severity;
import inspector.coordinator.model.TaskType;
import inspector.coordinator.model.result.GaugeReading;
import inspector.coordinator.model.result.ObjectDescription;
import inspector.coordinator.model.result.ProcessingFailure;
import inspector.coordinator.model.result.ResultPayloads;
import inspector.coordinator.model.result.SmokeCheck;
import inspector.coordinator.model.result.TemperatureReading;
import inspector.coordinator.util.Json;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AlertEvaluatorTest {

    private final AlertEvaluator evaluator = new AlertEvaluator();

    @Test
    void temperatureAboveDangerThreshold() {
        AlertEvaluator.Evaluation e = evaluator.evaluate(TaskType.TEMPERATURE, 1, TemperatureReading.ofMax(85.0));

        assertEquals(Severity.DANGER, e.severity());
        assertTrue(e.raisesAlert());
        assertEquals(Severity.DANGER, e.alert().level());
        assertEquals("high_temperature", e.alert().alertType());
        assertEquals("Station 1: max temperature 85.0°C reached danger threshold 80.0°C", e.alert().message());
    }

    @Test
    void temperatureWarningBand() {
        AlertEvaluator.Evaluation e = evaluator.evaluate(TaskType.TEMPERATURE, 3, TemperatureReading.ofMax(70.0));

        assertEquals(Severity.WARNING, e.severity());
        assertEquals(Severity.WARNING, e.alert().level());
        assertTrue(e.alert().message().startsWith("Station 3: "));
        assertTrue(e.alert().message().contains("60.0"));
    }

    @Test
    void temperatureNormalRaisesNothing() {
        AlertEvaluator.Evaluation e = evaluator.evaluate(TaskType.TEMPERATURE, 1, TemperatureReading.ofMax(40.0));

        assertEquals(Severity.NORMAL, e.severity());
        assertFalse(e.raisesAlert());
    }

    @Test
    void temperatureBoundariesAreInclusive() {
        assertEquals(Severity.DANGER,
                evaluator.evaluate(TaskType.TEMPERATURE, 1, TemperatureReading.ofMax(80.0)).severity());
        assertEquals(Severity.WARNING,
                evaluator.evaluate(TaskType.TEMPERATURE, 1, TemperatureReading.ofMax(60.0)).severity());
        assertEquals(Severity.NORMAL,
                evaluator.evaluate(TaskType.TEMPERATURE, 1, TemperatureReading.ofMax(59.99)).severity());
    }

    @Test
    void missingTemperatureIsNormal() {
        assertEquals(Severity.NORMAL,
                evaluator.evaluate(TaskType.TEMPERATURE, 1, new TemperatureReading(null, 30.0, 20.0)).severity());
    }

    @Test
    void temperatureIgnoresReportedStatusOfOtherShapes() {
        GaugeReading mislabelled = new GaugeReading(1.0, "MPa", 0.0, 1.0, 0.9, "danger");
        assertEquals(Severity.NORMAL, evaluator.evaluate(TaskType.TEMPERATURE, 1, mislabelled).severity());
    }

    @Test
    void otherTypesPassReportedStatusThrough() {
        AlertEvaluator.Evaluation gauge = evaluator.evaluate(TaskType.GAUGE_READING, 2,
                new GaugeReading(1.8, "MPa", 0.0, 1.6, 0.9, "Danger"));
        assertEquals(Severity.DANGER, gauge.severity());
        assertEquals("abnormal_gauge_reading", gauge.alert().alertType());

        AlertEvaluator.Evaluation smokeB = evaluator.evaluate(TaskType.SMOKE_B, 4,
                new SmokeCheck(true, "light", 0.7, "warning"));
        assertEquals(Severity.WARNING, smokeB.severity());
        assertEquals("smoke_detected", smokeB.alert().alertType());

        AlertEvaluator.Evaluation object = evaluator.evaluate(TaskType.OBJECT_DESCRIPTION, 5,
                new ObjectDescription("open cabinet door", List.of("door"), 0.6, "warning"));
        assertEquals("abnormal_object", object.alert().alertType());
        assertTrue(object.alert().message().contains("open cabinet door"));
    }

    @Test
    void unknownOrMissingReportedStatusIsNormal() {
        assertEquals(Severity.NORMAL, evaluator.evaluate(TaskType.SMOKE_A, 1,
                new SmokeCheck(true, "heavy", 0.9, "critical")).severity());
        assertEquals(Severity.NORMAL, evaluator.evaluate(TaskType.SMOKE_A, 1,
                new SmokeCheck(true, "heavy", 0.9, null)).severity());
    }

    @Test
    void processingFailureIsNormal() {
        AlertEvaluator.Evaluation e = evaluator.evaluate(TaskType.TEMPERATURE, 1,
                new ProcessingFailure("camera offline", null));

        assertEquals(Severity.NORMAL, e.severity());
        assertFalse(e.raisesAlert());
    }

    @Test
    void longMessagesAreClipped() {
        AlertEvaluator.Evaluation e = evaluator.evaluate(TaskType.OBJECT_DESCRIPTION, 2,
                new ObjectDescription("x".repeat(4000), List.of(), 0.5, "danger"));

        assertEquals(Alert.MAX_MESSAGE_LENGTH, e.alert().message().length());
        assertTrue(e.alert().message().startsWith("Station 2: abnormal object"));
        assertTrue(e.alert().message().endsWith("..."));
    }

    private AlertEvaluator.Evaluation evaluateWire(TaskType type, String result) throws Exception {
        return evaluator.evaluate(type, 1, ResultPayloads.fromWire(type, Json.mapper().readTree(result)));
    }

    @Test
    void wrongTypedFieldsFallBackToNormal() throws Exception {
        assertEquals(Severity.NORMAL, evaluateWire(TaskType.TEMPERATURE, "{\"max_temperature\": \"n/a\"}").severity());
        assertEquals(Severity.NORMAL, evaluateWire(TaskType.GAUGE_READING, "{\"status\": {\"x\": 1}}").severity());
        assertFalse(evaluateWire(TaskType.SMOKE_B, "{\"has_smoke\": [true]}").raisesAlert());
    }

    @Test
    void wellTypedStatusSurvivesBadNeighbours() throws Exception {
        AlertEvaluator.Evaluation smoke = evaluateWire(TaskType.SMOKE_A, "{\"has_smoke\": \"maybe\", \"status\": \"danger\"}");
        assertEquals(Severity.DANGER, smoke.severity());
        assertEquals("smoke_detected", smoke.alert().alertType());

        AlertEvaluator.Evaluation gauge = evaluateWire(TaskType.GAUGE_READING, "{\"value\": \"broken\", \"status\": \"warning\"}");
        assertEquals(Severity.WARNING, gauge.severity());
        assertTrue(gauge.alert().message().contains("n/a"));
    }
}
