package inspector.coordinator.model;

/**
 * Outcome of moving a queue entry to a terminal status.
 */
public enum FinishResult {
    /** Entry moved to COMPLETED or FAILED */
    FINISHED,
    /** Entry was already COMPLETED or FAILED, left untouched */
    ALREADY_TERMINAL,
    /** Entry missing, e.g. already cleared */
    NOT_FOUND
}
