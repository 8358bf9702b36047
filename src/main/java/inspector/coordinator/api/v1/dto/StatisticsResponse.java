package inspector.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import inspector.coordinator.model.RecordStatistics;

/**
 * Severity statistics over a trailing window.
 * GET /api/v1/statistics
 */
public record StatisticsResponse(
        @JsonProperty("task_type") Integer taskType,
        @JsonProperty("days") int days,
        @JsonProperty("total_count") long totalCount,
        @JsonProperty("normal_count") long normalCount,
        @JsonProperty("warning_count") long warningCount,
        @JsonProperty("danger_count") long dangerCount,
        @JsonProperty("avg_confidence") Double avgConfidence,
        @JsonProperty("avg_processing_time") Double avgProcessingTime) {

    public static StatisticsResponse from(Integer taskType, int days, RecordStatistics stats) {
        return new StatisticsResponse(
                taskType,
                days,
                stats.totalCount(),
                stats.normalCount(),
                stats.warningCount(),
                stats.dangerCount(),
                stats.avgConfidence(),
                stats.avgProcessingTime());
    }
}
