package inspector.coordinator.model;

import inspector.coordinator.model.result.ResultPayload;

import java.time.Instant;

/**
 * Immutable history entry written once per ingested result.
 * {@code taskId} may outlive its queue entry.
 */
public record TaskRecord(
        long id,
        String taskId,
        TaskType taskType,
        int stationId,
        String imageRef,
        ResultPayload result,
        Severity status,
        Double confidence,
        Double processingTime,
        Instant timestamp) {

    public static final int MAX_IMAGE_REF_LENGTH = 1024;

    /** Record that has not been stored yet (id assigned by the Record Store) */
    public static TaskRecord draft(String taskId, TaskType taskType, int stationId, String imageRef,
            ResultPayload result, Severity status, Double processingTime, Instant timestamp) {
        return new TaskRecord(0L, taskId, taskType, stationId, imageRef, result, status,
                result.confidence(), processingTime, timestamp);
    }

    public TaskRecord withId(long newId) {
        return new TaskRecord(newId, taskId, taskType, stationId, imageRef, result, status, confidence,
                processingTime, timestamp);
    }

    public TaskRecord withTimestamp(Instant newTimestamp) {
        return new TaskRecord(id, taskId, taskType, stationId, imageRef, result, status, confidence,
                processingTime, newTimestamp);
    }
}
