package inspector.coordinator.model;

/**
 * Outcome of the pending -> assigned compare-and-set.
 */
public enum AssignResult {
    /** This caller won the transition */
    ASSIGNED,
    /** Task exists but is no longer pending */
    NOT_PENDING,
    /** No such task in the queue */
    NOT_FOUND
}
