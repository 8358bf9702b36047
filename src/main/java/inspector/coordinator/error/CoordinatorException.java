package inspector.coordinator.error;

/**
 * Base class for typed coordinator failures.
 */
public abstract class CoordinatorException extends RuntimeException {

    protected CoordinatorException(String message) {
        super(message);
    }

    protected CoordinatorException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();
}
