package inspector.coordinator.model.result;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Pointer gauge reading (task type 1).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record GaugeReading(
        @JsonProperty("value") Double value,
        @JsonProperty("unit") String unit,
        @JsonProperty("min_range") Double minRange,
        @JsonProperty("max_range") Double maxRange,
        @JsonProperty("confidence") Double confidence,
        @JsonProperty("status") String status) implements ResultPayload {

    @Override
    public String reportedStatus() {
        return status;
    }
}
