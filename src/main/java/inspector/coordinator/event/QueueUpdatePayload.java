package inspector.coordinator.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload of {@code task_queue_update}. {@code count} is only set for bulk clears.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueueUpdatePayload(
        @JsonProperty("reason") String reason,
        @JsonProperty("task_id") String taskId,
        @JsonProperty("count") Integer count) {

    public static QueueUpdatePayload of(QueueUpdateReason reason, String taskId) {
        return new QueueUpdatePayload(reason.wireName(), taskId, null);
    }

    public static QueueUpdatePayload cleared(int count) {
        return new QueueUpdatePayload(QueueUpdateReason.CLEARED.wireName(), null, count);
    }
}
