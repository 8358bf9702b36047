package inspector.coordinator.service;

import inspector.coordinator.error.ConflictException;
import inspector.coordinator.error.NotFoundException;
import inspector.coordinator.error.OperationResult;
import inspector.coordinator.error.ValidationException;
import inspector.coordinator.event.BroadcastHub;
import inspector.coordinator.event.EventKind;
import inspector.coordinator.event.QueueUpdatePayload;
import inspector.coordinator.event.QueueUpdateReason;
import inspector.coordinator.model.AssignResult;
import inspector.coordinator.model.Task;
import inspector.coordinator.model.TaskType;
import inspector.coordinator.repository.TaskQueueRepository;
import inspector.coordinator.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Service layer for the task queue: enqueue, list, assign, delete and clear.
 * Every successful state change is published as a {@code task_queue_update} event.
 */
public class DispatchService {

    private static final Logger log = LoggerFactory.getLogger(DispatchService.class);

    public static final int MAX_LIST_LIMIT = 500;

    private final TaskQueueRepository queue;
    private final BroadcastHub hub;

    public DispatchService(TaskQueueRepository queue, BroadcastHub hub) {
        this.queue = queue;
        this.hub = hub;
    }

    /**
     * Add a pending task for a station.
     *
     * @return the new task id
     */
    public OperationResult<String> enqueue(Integer stationId, Integer taskType, Map<String, Object> params) {
        return OperationResult.of(() -> {
            TaskType type = TaskType.fromCode(taskType);
            if (stationId == null || stationId < 1) {
                throw new ValidationException("station_id must be a positive integer");
            }

            Task task = Task.builder()
                    .id(generateTaskId())
                    .stationId(stationId)
                    .taskType(type)
                    .params(params)
                    .createdAt(Timestamps.now())
                    .build();
            queue.save(task);

            log.info("Task {} queued: station={}, type={}", task.id(), stationId, type.code());
            hub.publish(EventKind.TASK_QUEUE_UPDATE, QueueUpdatePayload.of(QueueUpdateReason.ADDED, task.id()));
            return task.id();
        });
    }

    /**
     * Pending tasks in creation order.
     */
    public OperationResult<List<Task>> listPending(int limit) {
        return OperationResult.of(() -> {
            if (limit <= 0) {
                throw new ValidationException("limit must be positive");
            }
            return queue.findPending(Math.min(limit, MAX_LIST_LIMIT));
        });
    }

    /**
     * Atomically move a pending task to assigned. Of several concurrent callers exactly one wins.
     */
    public OperationResult<Task> assign(String taskId) {
        return OperationResult.of(() -> {
            requireTaskId(taskId);
            AssignResult result = queue.assign(taskId, Timestamps.now());
            switch (result) {
                case NOT_FOUND -> throw new NotFoundException("task not found: " + taskId);
                case NOT_PENDING -> throw new ConflictException("task is not pending: " + taskId);
                case ASSIGNED -> {
                    log.info("Task {} assigned", taskId);
                    hub.publish(EventKind.TASK_QUEUE_UPDATE,
                            QueueUpdatePayload.of(QueueUpdateReason.ASSIGNED, taskId));
                }
            }
            return queue.findById(taskId)
                    .orElseThrow(() -> new NotFoundException("task removed after assignment: " + taskId));
        });
    }

    /**
     * Remove a queue entry in any state. History records are untouched.
     */
    public OperationResult<Void> delete(String taskId) {
        return OperationResult.of(() -> {
            requireTaskId(taskId);
            if (!queue.delete(taskId)) {
                throw new NotFoundException("task not found: " + taskId);
            }
            log.info("Task {} removed", taskId);
            hub.publish(EventKind.TASK_QUEUE_UPDATE, QueueUpdatePayload.of(QueueUpdateReason.REMOVED, taskId));
            return null;
        });
    }

    /**
     * Delete completed and failed entries finished more than {@code olderThan} ago.
     *
     * @return number of entries deleted
     */
    public OperationResult<Integer> clearCompleted(Duration olderThan) {
        return OperationResult.of(() -> {
            if (olderThan == null || olderThan.isNegative()) {
                throw new ValidationException("older_than must not be negative");
            }
            int cleared = queue.deleteFinishedBefore(Timestamps.now().minus(olderThan));
            if (cleared > 0) {
                log.info("Cleared {} finished tasks older than {}", cleared, olderThan);
                hub.publish(EventKind.TASK_QUEUE_UPDATE, QueueUpdatePayload.cleared(cleared));
            }
            return cleared;
        });
    }

    public OperationResult<Task> find(String taskId) {
        return OperationResult.of(() -> {
            requireTaskId(taskId);
            return queue.findById(taskId)
                    .orElseThrow(() -> new NotFoundException("task not found: " + taskId));
        });
    }

    static String generateTaskId() {
        return "task-" + UUID.randomUUID();
    }

    private static void requireTaskId(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            throw new ValidationException("task_id is required");
        }
        if (taskId.length() > Task.MAX_ID_LENGTH) {
            throw new ValidationException("task_id must be at most " + Task.MAX_ID_LENGTH + " characters");
        }
    }
}
