package inspector.coordinator.repository;

import inspector.coordinator.model.AssignResult;
import inspector.coordinator.model.FinishResult;
import inspector.coordinator.model.Task;
import inspector.coordinator.model.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for the task queue (Queue Store).
 * All methods throw {@link inspector.coordinator.error.PersistenceException} on store failure.
 */
public interface TaskQueueRepository {

    /**
     * Insert a new queue entry.
     *
     * @param task the task to save
     */
    void save(Task task);

    /**
     * Find a queue entry by id.
     *
     * @param taskId the task ID
     * @return the task if present
     */
    Optional<Task> findById(String taskId);

    /**
     * Pending entries in creation order (oldest first).
     *
     * @param limit maximum number of results
     */
    List<Task> findPending(int limit);

    /**
     * Count entries with the given status.
     */
    int countByStatus(TaskStatus status);

    /**
     * Atomically move a task from PENDING to ASSIGNED.
     * Of several concurrent callers for the same id at most one gets {@link AssignResult#ASSIGNED}.
     *
     * @param taskId     the task ID
     * @param assignedAt assignment time
     */
    AssignResult assign(String taskId, Instant assignedAt);

    /**
     * Move a PENDING or ASSIGNED task to COMPLETED or FAILED.
     *
     * @param taskId      the task ID
     * @param terminal    COMPLETED or FAILED
     * @param completedAt completion time
     */
    FinishResult finish(String taskId, TaskStatus terminal, Instant completedAt);

    /**
     * Remove an entry regardless of status.
     *
     * @return true if an entry was removed
     */
    boolean delete(String taskId);

    /**
     * Remove COMPLETED and FAILED entries finished before the cutoff.
     * PENDING and ASSIGNED entries are never touched.
     *
     * @return number of entries removed
     */
    int deleteFinishedBefore(Instant cutoff);
}
