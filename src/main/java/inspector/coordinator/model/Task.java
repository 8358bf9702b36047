package inspector.coordinator.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable queue entry for one inspection task at one station.
 * The Queue Store owns its lifetime; use {@link #toBuilder()} to derive updated copies.
 */
public final class Task {

    /** Longest id the Queue Store accepts */
    public static final int MAX_ID_LENGTH = 64;

    private final String id;
    private final int stationId;
    private final TaskType taskType;
    private final TaskStatus status;
    private final Map<String, Object> params; // opaque caller metadata, e.g. "priority"
    private final Instant createdAt;
    private final Instant assignedAt;
    private final Instant completedAt;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.stationId = builder.stationId;
        this.taskType = Objects.requireNonNull(builder.taskType, "taskType is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.params = builder.params == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.params));
        this.createdAt = builder.createdAt;
        this.assignedAt = builder.assignedAt;
        this.completedAt = builder.completedAt;
    }

    public String id() {
        return id;
    }

    public int stationId() {
        return stationId;
    }

    public TaskType taskType() {
        return taskType;
    }

    public TaskStatus status() {
        return status;
    }

    public Map<String, Object> params() {
        return params;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant assignedAt() {
        return assignedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .stationId(stationId)
                .taskType(taskType)
                .status(status)
                .params(params)
                .createdAt(createdAt)
                .assignedAt(assignedAt)
                .completedAt(completedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private int stationId;
        private TaskType taskType;
        private TaskStatus status = TaskStatus.PENDING;
        private Map<String, Object> params;
        private Instant createdAt;
        private Instant assignedAt;
        private Instant completedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder stationId(int stationId) {
            this.stationId = stationId;
            return this;
        }

        public Builder taskType(TaskType taskType) {
            this.taskType = taskType;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder params(Map<String, Object> params) {
            this.params = params;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder assignedAt(Instant assignedAt) {
            this.assignedAt = assignedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', station=" + stationId + ", type=" + taskType + ", status=" + status + "}";
    }
}
