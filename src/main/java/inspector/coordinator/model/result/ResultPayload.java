package inspector.coordinator.model.result;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Structured result reported by the vision service, one variant per task family.
 * Stored as JSON with a {@code kind} discriminator.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = GaugeReading.class, name = "gauge_reading"),
        @JsonSubTypes.Type(value = TemperatureReading.class, name = "temperature"),
        @JsonSubTypes.Type(value = SmokeCheck.class, name = "smoke"),
        @JsonSubTypes.Type(value = ObjectDescription.class, name = "object_description"),
        @JsonSubTypes.Type(value = ProcessingFailure.class, name = "failure")
})
public sealed interface ResultPayload
        permits GaugeReading, TemperatureReading, SmokeCheck, ObjectDescription, ProcessingFailure {

    /** Severity string as reported by the vision service, or null if it did not set one */
    default String reportedStatus() {
        return null;
    }

    /** Model confidence in [0, 1], or null if not reported */
    default Double confidence() {
        return null;
    }

    /** True if the vision service could not produce a classified result */
    @JsonIgnore
    default boolean isFailure() {
        return false;
    }
}
