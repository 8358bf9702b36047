package inspector.coordinator.model;

/**
 * A record and the alert written with it in the same transaction.
 *
 * @param alert null when the result was normal
 */
public record StoredResult(TaskRecord record, Alert alert) {

    public boolean hasAlert() {
        return alert != null;
    }
}
