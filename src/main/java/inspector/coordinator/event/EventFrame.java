package inspector.coordinator.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Wire envelope for one message on the event stream: {@code {kind, payload, timestamp}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventFrame(
        @JsonProperty("kind") String kind,
        @JsonProperty("payload") Object payload,
        @JsonProperty("timestamp") Instant timestamp) {

    public static EventFrame from(Event event) {
        return new EventFrame(event.kind().wireName(), event.payload(), event.timestamp());
    }

    /** Control message that is not a published event, e.g. {@code pong} */
    public static EventFrame control(String kind, Object payload) {
        return new EventFrame(kind, payload, Instant.now());
    }
}
