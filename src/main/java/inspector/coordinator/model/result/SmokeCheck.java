package inspector.coordinator.model.result;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Smoke detection result (task types 3 and 4).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SmokeCheck(
        @JsonProperty("has_smoke") boolean hasSmoke,
        @JsonProperty("density") String density,
        @JsonProperty("confidence") Double confidence,
        @JsonProperty("status") String status) implements ResultPayload {

    @Override
    public String reportedStatus() {
        return status;
    }
}
