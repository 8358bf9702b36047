package inspector.coordinator.model.result;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Thermal camera reading (task type 2). Severity is computed locally from the max temperature.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TemperatureReading(
        @JsonProperty("max_temperature") Double maxTemperature,
        @JsonProperty("avg_temperature") Double avgTemperature,
        @JsonProperty("ambient_temperature") Double ambientTemperature) implements ResultPayload {

    public static TemperatureReading ofMax(double maxTemperature) {
        return new TemperatureReading(maxTemperature, null, null);
    }
}
