package inspector.coordinator.error;

/**
 * Failure categories surfaced by public coordinator operations.
 */
public enum ErrorKind {
    /** Malformed input, caller's fault, not retried automatically */
    VALIDATION,
    /** Referenced task or alert does not exist */
    NOT_FOUND,
    /** State transition precondition violated (e.g. double assign) */
    CONFLICT,
    /** Store unavailable; caller may retry with backoff */
    PERSISTENCE
}
