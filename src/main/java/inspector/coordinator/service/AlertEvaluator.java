package inspector.coordinator.service;

import inspector.coordinator.model.Alert;
import inspector.coordinator.model.AlertDraft;
import inspector.coordinator.model.Severity;
import inspector.coordinator.model.TaskType;
import inspector.coordinator.model.result.GaugeReading;
import inspector.coordinator.model.result.ObjectDescription;
import inspector.coordinator.model.result.ResultPayload;
import inspector.coordinator.model.result.SmokeCheck;
import inspector.coordinator.model.result.TemperatureReading;

import java.util.Locale;

/**
 * Classifies an ingested result into a severity and, for warning or danger, drafts the alert.
 * Stateless and total: every input produces an evaluation.
 */
public class AlertEvaluator {

    public static final double TEMPERATURE_WARNING = 60.0;
    public static final double TEMPERATURE_DANGER = 80.0;

    public static final String ABNORMAL_GAUGE_READING = "abnormal_gauge_reading";
    public static final String HIGH_TEMPERATURE = "high_temperature";
    public static final String SMOKE_DETECTED = "smoke_detected";
    public static final String ABNORMAL_OBJECT = "abnormal_object";

    /**
     * Severity of a result plus the alert to raise, if any.
     */
    public record Evaluation(Severity severity, AlertDraft alert) {

        public boolean raisesAlert() {
            return alert != null;
        }
    }

    public Evaluation evaluate(TaskType taskType, int stationId, ResultPayload payload) {
        if (payload == null || payload.isFailure()) {
            return new Evaluation(Severity.NORMAL, null);
        }

        Severity severity = taskType == TaskType.TEMPERATURE
                ? temperatureSeverity(payload)
                : reportedSeverity(payload);

        if (severity == Severity.NORMAL) {
            return new Evaluation(severity, null);
        }
        return new Evaluation(severity, new AlertDraft(severity, alertType(taskType),
                clip(message(taskType, stationId, severity, payload))));
    }

    private static Severity temperatureSeverity(ResultPayload payload) {
        if (!(payload instanceof TemperatureReading reading) || reading.maxTemperature() == null) {
            return Severity.NORMAL;
        }
        double t = reading.maxTemperature();
        if (t >= TEMPERATURE_DANGER) {
            return Severity.DANGER;
        }
        if (t >= TEMPERATURE_WARNING) {
            return Severity.WARNING;
        }
        return Severity.NORMAL;
    }

    private static Severity reportedSeverity(ResultPayload payload) {
        Severity reported = Severity.parseOrNull(payload.reportedStatus());
        return reported != null ? reported : Severity.NORMAL;
    }

    private static String clip(String message) {
        if (message.length() <= Alert.MAX_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, Alert.MAX_MESSAGE_LENGTH - 3) + "...";
    }

    static String alertType(TaskType taskType) {
        return switch (taskType) {
            case GAUGE_READING -> ABNORMAL_GAUGE_READING;
            case TEMPERATURE -> HIGH_TEMPERATURE;
            case SMOKE_A, SMOKE_B -> SMOKE_DETECTED;
            case OBJECT_DESCRIPTION -> ABNORMAL_OBJECT;
        };
    }

    private static String message(TaskType taskType, int stationId, Severity severity, ResultPayload payload) {
        String prefix = "Station " + stationId + ": ";
        String level = severity.wireName();

        if (payload instanceof TemperatureReading reading) {
            double threshold = severity == Severity.DANGER ? TEMPERATURE_DANGER : TEMPERATURE_WARNING;
            return prefix + String.format(Locale.ROOT, "max temperature %.1f°C reached %s threshold %.1f°C",
                    reading.maxTemperature(), level, threshold);
        }
        if (payload instanceof GaugeReading gauge) {
            String value = gauge.value() == null ? "n/a" : String.format(Locale.ROOT, "%.2f", gauge.value());
            String unit = gauge.unit() == null ? "" : " " + gauge.unit();
            return prefix + "gauge reading " + value + unit + " is " + level;
        }
        if (payload instanceof SmokeCheck smoke) {
            String density = smoke.density() == null ? "" : " (density " + smoke.density() + ")";
            return prefix + (smoke.hasSmoke() ? "smoke detected" : "smoke check") + density + ", level " + level;
        }
        if (payload instanceof ObjectDescription object) {
            String description = object.description() == null ? "no description" : object.description();
            return prefix + "abnormal object, level " + level + ": " + description;
        }
        return prefix + taskType.label() + " result is " + level;
    }
}
