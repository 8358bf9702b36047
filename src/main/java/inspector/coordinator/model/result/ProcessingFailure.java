package inspector.coordinator.model.result;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The vision service could not classify the image. Moves the queue entry to FAILED.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProcessingFailure(
        @JsonProperty("error") String error,
        @JsonProperty("error_code") String errorCode) implements ResultPayload {

    @Override
    public boolean isFailure() {
        return true;
    }
}
