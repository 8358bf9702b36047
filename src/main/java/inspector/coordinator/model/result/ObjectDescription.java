package inspector.coordinator.model.result;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Free-text scene description (task type 5).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ObjectDescription(
        @JsonProperty("description") String description,
        @JsonProperty("items") List<String> items,
        @JsonProperty("confidence") Double confidence,
        @JsonProperty("status") String status) implements ResultPayload {

    public ObjectDescription {
        items = items == null ? List.of() : List.copyOf(items);
    }

    @Override
    public String reportedStatus() {
        return status;
    }
}
