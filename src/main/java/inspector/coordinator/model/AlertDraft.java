package inspector.coordinator.model;

/**
 * Alert content produced by the evaluator, before it is stored and linked to a record.
 */
public record AlertDraft(Severity level, String alertType, String message) {
}
