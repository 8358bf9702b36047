package inspector.coordinator.model;

/**
 * Queue entry status. Transitions only move forward:
 * PENDING -> ASSIGNED -> COMPLETED | FAILED.
 */
public enum TaskStatus {
    /** Task created, waiting for the cart */
    PENDING,
    /** Task handed to the cart / vision service */
    ASSIGNED,
    /** Result ingested */
    COMPLETED,
    /** Vision service reported a processing failure */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
