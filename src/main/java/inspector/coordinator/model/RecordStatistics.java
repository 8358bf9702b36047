package inspector.coordinator.model;

/**
 * Severity counts and averages over a trailing window of task records.
 */
public record RecordStatistics(
        long totalCount,
        long normalCount,
        long warningCount,
        long dangerCount,
        Double avgConfidence,
        Double avgProcessingTime) {
}
