package inspector.coordinator.model;

import inspector.coordinator.error.ValidationException;

import java.time.Instant;

/**
 * Filter for history lookups. Null fields are not applied.
 */
public record HistoryQuery(
        TaskType taskType,
        Integer stationId,
        Instant from,
        Instant to,
        int limit,
        int offset) {

    public static final int MAX_LIMIT = 500;

    public HistoryQuery {
        if (limit <= 0) {
            throw new ValidationException("limit must be positive");
        }
        if (offset < 0) {
            throw new ValidationException("offset must not be negative");
        }
        if (from != null && to != null && from.isAfter(to)) {
            throw new ValidationException("from must not be after to");
        }
        limit = Math.min(limit, MAX_LIMIT);
    }

    public static HistoryQuery byType(TaskType taskType, int limit) {
        return new HistoryQuery(taskType, null, null, null, limit, 0);
    }
}
